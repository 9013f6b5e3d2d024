package webhook.benchmark;

import org.openjdk.jmh.annotations.*;
import webhook.DispatchMode;
import webhook.QueueOverloadedException;
import webhook.WebhookQueue;
import webhook.consumer.PollingConsumer;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures end-to-end latency of a single webhook: enqueue -> dispatch -> processor callback.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar WebhookQueueBenchmark}
 * <p>Pull mode only: {@code java -jar benchmarks/target/benchmarks.jar -p mode=EXTERNAL_PULL WebhookQueueBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class WebhookQueueBenchmark {

  @Param({"INTERNAL_PUSH", "EXTERNAL_PULL"})
  private DispatchMode mode;

  @Param({"1", "10"})
  private int concurrency;

  private WebhookQueue<Map<String, Object>> queue;
  private PollingConsumer<Map<String, Object>> consumer;
  private final Map<String, Object> payload = Map.of("event", "bench", "id", 1);
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    queue = WebhookQueue.<Map<String, Object>>builder()
        .processor(item -> {
          CountDownLatch latch = latchRef.get();
          if (latch != null) latch.countDown();
        })
        .mode(mode)
        .concurrency(concurrency)
        .overloadThreshold(10_000)
        .build();
    if (mode == DispatchMode.EXTERNAL_PULL) {
      consumer = PollingConsumer.builder(queue).pollIntervalMs(1).build();
      consumer.start();
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    if (consumer != null) consumer.close();
    queue.close();
  }

  @Benchmark
  public void enqueueAndProcess() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    latchRef.set(latch);
    queue.enqueue(payload);
    if (!latch.await(5, TimeUnit.SECONDS)) {
      throw new IllegalStateException("Webhook not processed within 5s");
    }
  }

  /**
   * Measures the rejection path once the queue sits at its overload threshold.
   */
  @State(Scope.Benchmark)
  public static class SaturatedQueue {
    WebhookQueue<String> queue;
    final CountDownLatch gate = new CountDownLatch(1);

    @Setup(Level.Trial)
    public void setup() {
      queue = WebhookQueue.<String>builder()
          .processor(item -> {
            try {
              gate.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          })
          .concurrency(1)
          .overloadThreshold(2)
          .drainTimeoutMs(0)
          .build();
      queue.enqueue("blocker");
    }

    @TearDown(Level.Trial)
    public void tearDown() {
      gate.countDown();
      queue.close();
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.Throughput)
  @OutputTimeUnit(TimeUnit.MILLISECONDS)
  public boolean rejectWhenOverloaded(SaturatedQueue state) {
    try {
      state.queue.enqueue("rejected");
      return false;
    } catch (QueueOverloadedException e) {
      return true;
    }
  }
}
