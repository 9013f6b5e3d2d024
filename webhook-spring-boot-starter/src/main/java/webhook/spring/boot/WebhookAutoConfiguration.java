package webhook.spring.boot;

import webhook.WebhookQueue;
import webhook.consumer.PollingConsumer;
import webhook.process.FixedDelayRetryPolicy;
import webhook.process.RetryPolicy;
import webhook.process.RetryingProcessor;
import webhook.process.SimulatedWorkUnit;
import webhook.process.WorkUnit;
import webhook.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the webhook queue.
 *
 * <p>Wires a {@link WebhookQueue} from {@link WebhookProperties}, backed by a
 * {@link RetryingProcessor} around the application's {@link WorkUnit}. When no work unit is
 * defined, a {@link SimulatedWorkUnit} with the configured delay range and failure rate is used.
 *
 * <p>Payloads are typed as {@code Object} so that user-supplied beans match without generic
 * gymnastics; the HTTP layer enqueues parsed JSON maps.
 *
 * @see WebhookProperties
 * @see WebhookMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(WebhookQueue.class)
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(WorkUnit.class)
  public WorkUnit<Object> webhookWorkUnit(WebhookProperties props) {
    var processing = props.getProcessing();
    return new SimulatedWorkUnit<>(
        processing.getMinDelayMs(), processing.getMaxDelayMs(), processing.getFailureRate());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy webhookRetryPolicy(WebhookProperties props) {
    return new FixedDelayRetryPolicy(props.getRetry().getDelayMs());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryingProcessor<Object> webhookProcessor(WorkUnit<Object> workUnit, RetryPolicy retryPolicy) {
    return new RetryingProcessor<>(workUnit, retryPolicy);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public WebhookQueue<Object> webhookQueue(WebhookProperties props,
      RetryingProcessor<Object> processor,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var dispatch = props.getDispatch();
    var builder = WebhookQueue.builder()
        .processor(processor)
        .mode(dispatch.getMode())
        .concurrency(dispatch.getConcurrency())
        .overloadThreshold(dispatch.getOverloadThreshold())
        .drainTimeoutMs(dispatch.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "webhook.dispatch", name = "mode", havingValue = "EXTERNAL_PULL")
  public PollingConsumer<Object> webhookConsumer(WebhookQueue<Object> queue, WebhookProperties props) {
    var consumer = props.getConsumer();
    var builder = PollingConsumer.builder(queue)
        .pollIntervalMs(consumer.getPollIntervalMs());
    if (consumer.getWorkerCount() > 0) {
      builder.workerCount(consumer.getWorkerCount());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public WebhookLifecycle webhookLifecycle(WebhookQueue<Object> queue,
      ObjectProvider<PollingConsumer<Object>> consumerProvider) {
    return new WebhookLifecycle(queue, consumerProvider.getIfAvailable());
  }
}
