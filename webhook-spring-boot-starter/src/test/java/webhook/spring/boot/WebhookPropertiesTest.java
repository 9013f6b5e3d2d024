package webhook.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import webhook.DispatchMode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(WebhookProperties.class);
            assertEquals(DispatchMode.INTERNAL_PUSH, props.getDispatch().getMode());
            assertEquals(10, props.getDispatch().getConcurrency());
            assertEquals(100, props.getDispatch().getOverloadThreshold());
            assertEquals(5000, props.getDispatch().getDrainTimeoutMs());
            assertEquals(2000, props.getRetry().getDelayMs());
            assertEquals(100, props.getProcessing().getMinDelayMs());
            assertEquals(300, props.getProcessing().getMaxDelayMs());
            assertEquals(0.1, props.getProcessing().getFailureRate());
            assertEquals(100, props.getConsumer().getPollIntervalMs());
            assertEquals(0, props.getConsumer().getWorkerCount());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("webhook", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "webhook.dispatch.mode=EXTERNAL_PULL",
                "webhook.dispatch.concurrency=4",
                "webhook.dispatch.overload-threshold=50",
                "webhook.dispatch.drain-timeout-ms=10000",
                "webhook.retry.delay-ms=500",
                "webhook.processing.min-delay-ms=5",
                "webhook.processing.max-delay-ms=20",
                "webhook.processing.failure-rate=0.5",
                "webhook.consumer.poll-interval-ms=25",
                "webhook.consumer.worker-count=2",
                "webhook.metrics.enabled=false",
                "webhook.metrics.name-prefix=custom"
        ).run(ctx -> {
            var props = ctx.getBean(WebhookProperties.class);
            assertEquals(DispatchMode.EXTERNAL_PULL, props.getDispatch().getMode());
            assertEquals(4, props.getDispatch().getConcurrency());
            assertEquals(50, props.getDispatch().getOverloadThreshold());
            assertEquals(10000, props.getDispatch().getDrainTimeoutMs());
            assertEquals(500, props.getRetry().getDelayMs());
            assertEquals(5, props.getProcessing().getMinDelayMs());
            assertEquals(20, props.getProcessing().getMaxDelayMs());
            assertEquals(0.5, props.getProcessing().getFailureRate());
            assertEquals(25, props.getConsumer().getPollIntervalMs());
            assertEquals(2, props.getConsumer().getWorkerCount());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("custom", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void modeBindsCaseInsensitively() {
        runner.withPropertyValues("webhook.dispatch.mode=external-pull").run(ctx -> {
            var props = ctx.getBean(WebhookProperties.class);
            assertEquals(DispatchMode.EXTERNAL_PULL, props.getDispatch().getMode());
        });
    }

    @Configuration
    @EnableConfigurationProperties(WebhookProperties.class)
    static class PropsConfig {
    }
}
