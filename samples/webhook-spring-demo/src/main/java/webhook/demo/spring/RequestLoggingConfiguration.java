package webhook.demo.spring;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.CommonsRequestLoggingFilter;

/**
 * Logs each webhook request at DEBUG under {@code org.springframework.web.filter}.
 */
@Configuration
public class RequestLoggingConfiguration {

    @Bean
    public FilterRegistrationBean<CommonsRequestLoggingFilter> webhookRequestLogging() {
        CommonsRequestLoggingFilter filter = new CommonsRequestLoggingFilter();
        filter.setIncludeClientInfo(true);
        filter.setIncludeQueryString(true);
        filter.setIncludeHeaders(false);

        FilterRegistrationBean<CommonsRequestLoggingFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/webhook");
        return registration;
    }
}
