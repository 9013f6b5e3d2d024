package webhook.spring.boot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import webhook.WebhookQueue;
import webhook.consumer.PollingConsumer;

import java.util.Objects;

/**
 * Starts the polling consumer with the application context and performs graceful shutdown.
 *
 * <p>Runs in a phase below the embedded web server's, so on stop the server has already quit
 * accepting requests. Stopping halts the consumer (when one exists) and then closes the queue,
 * which waits at most its configured drain timeout. The queue bean's own destroy callback is a
 * no-op afterwards.
 */
public class WebhookLifecycle implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(WebhookLifecycle.class);

  static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

  private final WebhookQueue<?> queue;
  private final PollingConsumer<?> consumer;
  private volatile boolean running;

  /**
   * @param queue    the queue to close on stop
   * @param consumer the polling consumer, or {@code null} in internal-push mode
   */
  public WebhookLifecycle(WebhookQueue<?> queue, PollingConsumer<?> consumer) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.consumer = consumer;
  }

  @Override
  public void start() {
    if (consumer != null) {
      consumer.start();
    }
    running = true;
    log.info("Webhook queue started: mode={}, concurrency={}, overloadThreshold={}",
        queue.mode(), queue.concurrency(), queue.overloadThreshold());
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    running = false;
    log.info("Shutting down webhook processing: {} items resident", queue.totalItems());
    if (consumer != null) {
      consumer.stop();
    }
    queue.close();
    log.info("Webhook queue closed");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }
}
