package webhook.spi;

/**
 * Observability hook for exporting webhook queue counters, gauges and timings to a metrics
 * backend.
 *
 * <p>The queue calls into the exporter but never reads from it. Implementations are invoked
 * from enqueuing threads and worker threads concurrently and must be thread-safe. The
 * {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of items admitted into the queue.
     */
    void incrementReceived();

    /**
     * Increments the count of items processed successfully.
     */
    void incrementProcessed();

    /**
     * Increments the count of items rejected because the queue was at capacity.
     */
    void incrementRejected();

    /**
     * Increments the count of items whose processing failed permanently (after retry).
     */
    default void incrementFailed() {
    }

    /**
     * Records the current number of resident items (pending plus in flight).
     *
     * @param depth resident item count
     */
    void recordQueueDepth(int depth);

    /**
     * Records how long an item waited in the pending buffer before being dequeued.
     *
     * @param waitMs wait time in milliseconds (always non-negative)
     */
    void recordQueueWaitMs(long waitMs);

    /**
     * Records the time spent processing a single item, retries included.
     *
     * @param durationMs processing time in milliseconds (always non-negative)
     */
    void recordProcessingDurationMs(long durationMs);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementReceived() {
        }

        @Override
        public void incrementProcessed() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }

        @Override
        public void recordQueueWaitMs(long waitMs) {
        }

        @Override
        public void recordProcessingDurationMs(long durationMs) {
        }
    }
}
