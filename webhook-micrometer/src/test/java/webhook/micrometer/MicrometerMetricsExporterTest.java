package webhook.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import webhook.WebhookQueue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementReceived() {
    exporter.incrementReceived();
    exporter.incrementReceived();
    assertEquals(2.0, counter("webhook.total.received").count());
  }

  @Test
  void incrementProcessed() {
    exporter.incrementProcessed();
    assertEquals(1.0, counter("webhook.total.processed").count());
  }

  @Test
  void incrementRejected() {
    exporter.incrementRejected();
    exporter.incrementRejected();
    exporter.incrementRejected();
    assertEquals(3.0, counter("webhook.too.many.requests").count());
  }

  @Test
  void incrementFailed() {
    exporter.incrementFailed();
    assertEquals(1.0, counter("webhook.total.failed").count());
  }

  @Test
  void recordQueueDepth() {
    exporter.recordQueueDepth(42);
    assertEquals(42.0, gauge("webhook.queue.length").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("webhook.queue.length").value());
  }

  @Test
  void recordTimings() {
    exporter.recordProcessingDurationMs(150);
    exporter.recordProcessingDurationMs(250);
    exporter.recordQueueWaitMs(30);

    Timer processing = timer("webhook.processing.time");
    assertEquals(2, processing.count());
    assertEquals(400.0, processing.totalTime(TimeUnit.MILLISECONDS), 0.001);
    assertEquals(1, timer("webhook.queue.time").count());
  }

  @Test
  void negativeTimingsClampToZero() {
    exporter.recordQueueWaitMs(-5);
    assertEquals(0.0, timer("webhook.queue.time").totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customPrefix() {
    var custom = new MicrometerMetricsExporter(registry, "billing.webhook");
    custom.incrementReceived();
    assertEquals(1.0, counter("billing.webhook.total.received").count());
  }

  @Test
  void invalidPrefixes() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "webhook."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    assertNull(registry.find("webhook.total.received").counter());
    assertNull(registry.find("webhook.queue.length").gauge());
    assertDoesNotThrow(() -> {
      exporter.incrementReceived();
      exporter.recordQueueDepth(3);
      exporter.recordProcessingDurationMs(10);
    });
  }

  @Test
  void wiredIntoQueueCountsAdmissionsRejectionsAndCompletions() throws Exception {
    var gate = new CountDownLatch(1);
    try (var queue = WebhookQueue.<String>builder()
        .processor(item -> {
          try {
            gate.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        })
        .metrics(exporter)
        .concurrency(1)
        .overloadThreshold(3)
        .build()) {
      queue.enqueue("a");
      queue.enqueue("b");
      assertThrows(webhook.QueueOverloadedException.class, () -> queue.enqueue("c"));
      assertEquals(2.0, gauge("webhook.queue.length").value());

      gate.countDown();
      assertTrue(queue.drain(3, TimeUnit.SECONDS));
    }

    assertEquals(2.0, counter("webhook.total.received").count());
    assertEquals(1.0, counter("webhook.too.many.requests").count());
    assertEquals(2.0, counter("webhook.total.processed").count());
    assertEquals(0.0, gauge("webhook.queue.length").value());
    assertEquals(2, timer("webhook.queue.time").count());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  private Timer timer(String name) {
    Timer t = registry.find(name).timer();
    assertNotNull(t, "Timer not found: " + name);
    return t;
  }
}
