package webhook.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import webhook.DispatchMode;
import webhook.QueueOverloadedException;
import webhook.WebhookQueue;
import webhook.consumer.PollingConsumer;
import webhook.process.FixedDelayRetryPolicy;
import webhook.process.RetryPolicy;
import webhook.process.RetryingProcessor;
import webhook.process.SimulatedWorkUnit;
import webhook.process.WorkUnit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(WebhookAutoConfiguration.class));

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("webhookWorkUnit"));
      assertTrue(ctx.containsBean("webhookRetryPolicy"));
      assertTrue(ctx.containsBean("webhookProcessor"));
      assertTrue(ctx.containsBean("webhookQueue"));
      assertTrue(ctx.containsBean("webhookLifecycle"));
      assertFalse(ctx.containsBean("webhookConsumer"));

      assertInstanceOf(SimulatedWorkUnit.class, ctx.getBean(WorkUnit.class));
      assertInstanceOf(FixedDelayRetryPolicy.class, ctx.getBean(RetryPolicy.class));
      assertInstanceOf(RetryingProcessor.class, ctx.getBean(RetryingProcessor.class));

      WebhookQueue<?> queue = ctx.getBean(WebhookQueue.class);
      assertEquals(DispatchMode.INTERNAL_PUSH, queue.mode());
      assertEquals(10, queue.concurrency());
      assertEquals(100, queue.overloadThreshold());
      assertTrue(ctx.getBean(WebhookLifecycle.class).isRunning());
    });
  }

  @Test
  void appliesDispatchProperties() {
    runner.withPropertyValues(
        "webhook.dispatch.concurrency=3",
        "webhook.dispatch.overload-threshold=7",
        "webhook.retry.delay-ms=250"
    ).run(ctx -> {
      WebhookQueue<?> queue = ctx.getBean(WebhookQueue.class);
      assertEquals(3, queue.concurrency());
      assertEquals(7, queue.overloadThreshold());
      var policy = (FixedDelayRetryPolicy) ctx.getBean(RetryPolicy.class);
      assertEquals(250, policy.delayMs());
    });
  }

  @Test
  void userWorkUnitReplacesSimulation() {
    runner.withUserConfiguration(RecordingWorkConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("webhookWorkUnit"));

      @SuppressWarnings("unchecked")
      WebhookQueue<Object> queue = ctx.getBean(WebhookQueue.class);
      queue.enqueue("hello");
      assertTrue(queue.drain(5, TimeUnit.SECONDS));

      var config = ctx.getBean(RecordingWorkConfig.class);
      assertEquals(List.of("hello"), config.seen);
    });
  }

  @Test
  void overloadSurfacesThroughWiredQueue() {
    runner.withUserConfiguration(BlockingWorkConfig.class)
        .withPropertyValues(
            "webhook.dispatch.concurrency=1",
            "webhook.dispatch.overload-threshold=2")
        .run(ctx -> {
          @SuppressWarnings("unchecked")
          WebhookQueue<Object> queue = ctx.getBean(WebhookQueue.class);
          queue.enqueue("first");
          assertThrows(QueueOverloadedException.class, () -> queue.enqueue("second"));
          ctx.getBean(BlockingWorkConfig.class).gate.countDown();
          assertTrue(queue.drain(5, TimeUnit.SECONDS));
        });
  }

  @Test
  void externalPullModeCreatesAndStartsConsumer() {
    runner.withUserConfiguration(RecordingWorkConfig.class)
        .withPropertyValues(
            "webhook.dispatch.mode=EXTERNAL_PULL",
            "webhook.dispatch.concurrency=4",
            "webhook.consumer.poll-interval-ms=10",
            "webhook.consumer.worker-count=2")
        .run(ctx -> {
          PollingConsumer<?> consumer = ctx.getBean(PollingConsumer.class);
          assertEquals(2, consumer.workerCount());
          assertTrue(consumer.isRunning());

          @SuppressWarnings("unchecked")
          WebhookQueue<Object> queue = ctx.getBean(WebhookQueue.class);
          assertEquals(DispatchMode.EXTERNAL_PULL, queue.mode());
          queue.enqueue("pulled");

          var config = ctx.getBean(RecordingWorkConfig.class);
          assertTrue(config.done.await(5, TimeUnit.SECONDS));
          assertEquals(List.of("pulled"), config.seen);
        });
  }

  @Test
  void lifecycleStopHaltsConsumerAndClosesQueue() {
    runner.withUserConfiguration(RecordingWorkConfig.class)
        .withPropertyValues(
            "webhook.dispatch.mode=EXTERNAL_PULL",
            "webhook.consumer.poll-interval-ms=10")
        .run(ctx -> {
          var lifecycle = ctx.getBean(WebhookLifecycle.class);
          PollingConsumer<?> consumer = ctx.getBean(PollingConsumer.class);
          @SuppressWarnings("unchecked")
          WebhookQueue<Object> queue = ctx.getBean(WebhookQueue.class);

          lifecycle.stop();

          assertFalse(lifecycle.isRunning());
          assertFalse(consumer.isRunning());
          assertEquals(0, queue.totalItems());
          assertThrows(IllegalStateException.class, () -> queue.enqueue("late"));
        });
  }

  @Test
  void backsOffWhenUserQueuePresent() {
    runner.withUserConfiguration(CustomQueueConfig.class).run(ctx -> {
      WebhookQueue<?> queue = ctx.getBean(WebhookQueue.class);
      assertEquals(2, queue.concurrency());
    });
  }

  @Configuration
  static class RecordingWorkConfig {
    final List<Object> seen = new CopyOnWriteArrayList<>();
    final CountDownLatch done = new CountDownLatch(1);

    @Bean
    WorkUnit<Object> recordingWorkUnit() {
      return item -> {
        seen.add(item);
        done.countDown();
      };
    }
  }

  @Configuration
  static class BlockingWorkConfig {
    final CountDownLatch gate = new CountDownLatch(1);

    @Bean
    WorkUnit<Object> blockingWorkUnit() {
      return item -> gate.await(5, TimeUnit.SECONDS);
    }
  }

  @Configuration
  static class CustomQueueConfig {
    @Bean(destroyMethod = "close")
    WebhookQueue<Object> webhookQueue() {
      return WebhookQueue.builder()
          .processor(item -> { })
          .concurrency(2)
          .build();
    }
  }
}
