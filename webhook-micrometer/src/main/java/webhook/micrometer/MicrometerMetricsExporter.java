package webhook.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import webhook.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and two timers with a {@link MeterRegistry} for export to
 * Prometheus and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code webhook.total.received} — webhooks admitted into the queue</li>
 *   <li>{@code webhook.total.processed} — webhooks processed successfully</li>
 *   <li>{@code webhook.too.many.requests} — webhooks rejected due to queue overload</li>
 *   <li>{@code webhook.total.failed} — webhooks that failed after retry</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code webhook.queue.length} — pending plus in-flight webhooks</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code webhook.processing.time} — processing time, SLO buckets 10ms to 5s</li>
 *   <li>{@code webhook.queue.time} — time spent waiting in the queue, SLO buckets 10ms to 1s</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private static final Duration[] PROCESSING_SLOS = millis(10, 50, 100, 200, 500, 1000, 2000, 5000);
  private static final Duration[] QUEUE_SLOS = millis(10, 50, 100, 200, 500, 1000);

  private final MeterRegistry registry;
  private final Counter received;
  private final Counter processed;
  private final Counter rejected;
  private final Counter failed;
  private final Gauge queueLengthGauge;
  private final Timer processingTime;
  private final Timer queueTime;

  private final AtomicInteger queueLength = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "webhook"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "webhook");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.webhook"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.received = Counter.builder(namePrefix + ".total.received")
        .description("Total number of webhook requests received")
        .register(registry);
    this.processed = Counter.builder(namePrefix + ".total.processed")
        .description("Total number of webhook requests successfully processed")
        .register(registry);
    this.rejected = Counter.builder(namePrefix + ".too.many.requests")
        .description("Total number of webhook requests rejected due to queue overload")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".total.failed")
        .description("Total number of webhook requests that failed after retry")
        .register(registry);

    this.queueLengthGauge = Gauge.builder(namePrefix + ".queue.length", queueLength, AtomicInteger::get)
        .description("Current length of the webhook processing queue")
        .register(registry);

    this.processingTime = Timer.builder(namePrefix + ".processing.time")
        .description("Webhook processing time")
        .serviceLevelObjectives(PROCESSING_SLOS)
        .register(registry);
    this.queueTime = Timer.builder(namePrefix + ".queue.time")
        .description("Time webhooks spend in the queue")
        .serviceLevelObjectives(QUEUE_SLOS)
        .register(registry);
  }

  @Override
  public void incrementReceived() {
    if (closed) return;
    received.increment();
  }

  @Override
  public void incrementProcessed() {
    if (closed) return;
    processed.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueLength.set(depth);
  }

  @Override
  public void recordQueueWaitMs(long waitMs) {
    if (closed) return;
    queueTime.record(Math.max(0L, waitMs), TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordProcessingDurationMs(long durationMs) {
    if (closed) return;
    processingTime.record(Math.max(0L, durationMs), TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the queue is closed to prevent a stale queue-length gauge.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(received, processed, rejected, failed,
        queueLengthGauge, processingTime, queueTime)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private static Duration[] millis(long... values) {
    Duration[] durations = new Duration[values.length];
    for (int i = 0; i < values.length; i++) {
      durations[i] = Duration.ofMillis(values[i]);
    }
    return durations;
  }
}
