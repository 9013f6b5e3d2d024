/**
 * Root API for the webhook processor: an in-memory, admission-controlled work queue with
 * bounded concurrent processing and graceful drain.
 *
 * <h2>Core Design</h2>
 * <p>The transport layer hands each accepted payload to {@link webhook.WebhookQueue#enqueue}.
 * The queue refuses the item with {@link webhook.QueueOverloadedException} once
 * {@code pending + inFlight + 1} would reach the overload threshold, which the transport turns
 * into a "too many requests" response. Admitted items are dispatched in FIFO order to a
 * {@linkplain webhook.process.Processor processor}, at most {@code concurrency} at a time. The
 * default {@link webhook.process.RetryingProcessor} gives every item two attempts. Nothing is
 * persisted; delivery is at-least-once per admitted item within the process lifetime.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>webhook-core</b> — queue, processor, polling consumer, metrics SPI (zero external deps)</li>
 *   <li><b>webhook-micrometer</b> — Micrometer-backed {@link webhook.spi.MetricsExporter}</li>
 *   <li><b>webhook-spring-boot-starter</b> — auto-configuration and graceful shutdown</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var processor = new RetryingProcessor<Map<String, Object>>(
 *     payload -> downstream.send(payload),
 *     new FixedDelayRetryPolicy(2000));
 *
 * try (WebhookQueue<Map<String, Object>> queue = WebhookQueue.<Map<String, Object>>builder()
 *     .processor(processor)
 *     .concurrency(10)
 *     .overloadThreshold(100)
 *     .build()) {
 *
 *   try {
 *     queue.enqueue(payload);          // 202 Accepted
 *   } catch (QueueOverloadedException e) {
 *     // 429 Too Many Requests
 *   }
 *
 *   queue.shutdown();                  // waits until nothing is pending or in flight
 * }
 * }</pre>
 *
 * <h2>Pull Mode</h2>
 * <pre>{@code
 * var queue = WebhookQueue.<String>builder()
 *     .processor(processor)
 *     .mode(DispatchMode.EXTERNAL_PULL)
 *     .build();
 * var consumer = PollingConsumer.builder(queue).pollIntervalMs(100).build();
 * consumer.start();
 * // ...
 * consumer.stop();
 * queue.drain();
 * }</pre>
 *
 * @see webhook.WebhookQueue
 * @see webhook.process.RetryingProcessor
 * @see webhook.consumer.PollingConsumer
 */
package webhook;
