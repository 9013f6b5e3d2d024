package webhook.consumer;

import webhook.DispatchMode;
import webhook.ProcessingException;
import webhook.WebhookQueue;
import webhook.util.WebhookThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Alternate dispatch mechanism that pulls items from a {@link WebhookQueue} with a fixed set of
 * polling loops instead of letting the queue push them.
 *
 * <p>Each of the {@code workerCount} loops repeatedly calls {@link WebhookQueue#processNext()},
 * which moves the head item straight into an in-flight slot and processes it on the loop's
 * thread. When nothing is pending the loop sleeps for {@code pollIntervalMs}.
 *
 * <p>The queue must be built with {@link DispatchMode#EXTERNAL_PULL}, so its internal dispatch
 * loop never competes with this consumer.
 *
 * <p>Create instances via {@link #builder(WebhookQueue)}. The {@link #start()} and {@link #stop()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 *
 * @param <T> payload type
 */
public final class PollingConsumer<T> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PollingConsumer.class.getName());

    private final WebhookQueue<T> queue;
    private final int workerCount;
    private final long pollIntervalMs;

    private ExecutorService loops;
    private volatile boolean running;
    private boolean stopped;

    private PollingConsumer(Builder<T> builder) {
        this.queue = builder.queue;
        if (queue.mode() != DispatchMode.EXTERNAL_PULL) {
            throw new IllegalStateException("PollingConsumer requires a queue in EXTERNAL_PULL mode, got " + queue.mode());
        }
        int workerCount = builder.workerCount > 0 ? builder.workerCount : queue.concurrency();
        if (workerCount > queue.concurrency()) {
            throw new IllegalArgumentException("workerCount must be <= queue concurrency (" + queue.concurrency() + ")");
        }
        if (builder.pollIntervalMs <= 0L) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        this.workerCount = workerCount;
        this.pollIntervalMs = builder.pollIntervalMs;
    }

    public static <T> Builder<T> builder(WebhookQueue<T> queue) {
        return new Builder<>(queue);
    }

    /**
     * Starts the polling loops. Subsequent calls while running are no-ops.
     *
     * @throws IllegalStateException if the consumer has already been stopped
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("PollingConsumer has been stopped");
        }
        if (running) {
            logger.warning("Polling consumer is already running");
            return;
        }
        running = true;
        logger.info("Starting polling consumer with " + workerCount + " loops");
        loops = Executors.newFixedThreadPool(workerCount, WebhookThreadFactory.consumers());
        for (int i = 0; i < workerCount; i++) {
            loops.submit(this::consumeLoop);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int workerCount() {
        return workerCount;
    }

    private void consumeLoop() {
        while (running) {
            try {
                if (!queue.processNext()) {
                    Thread.sleep(pollIntervalMs);
                }
            } catch (ProcessingException e) {
                logger.log(Level.WARNING, "Error processing item in consumer loop", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Consumer loop error", t);
            }
        }
    }

    /**
     * Signals every loop to exit after its current item and waits for all of them to finish.
     * Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (!running) {
            return;
        }
        logger.info("Stopping polling consumer");
        running = false;
        loops.shutdown();
        try {
            while (!loops.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.fine("Waiting for consumer loops to finish their current item");
            }
        } catch (InterruptedException e) {
            loops.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Polling consumer stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /** Builder for {@link PollingConsumer}. */
    public static final class Builder<T> {
        private final WebhookQueue<T> queue;
        private int workerCount;
        private long pollIntervalMs = 100;

        private Builder(WebhookQueue<T> queue) {
            this.queue = Objects.requireNonNull(queue, "queue");
        }

        /**
         * Sets the number of polling loops.
         *
         * <p>Optional. Defaults to the queue's concurrency. Must not exceed it.
         *
         * @param workerCount number of loops
         * @return this builder
         */
        public Builder<T> workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets how long an idle loop sleeps before polling again.
         *
         * <p>Optional. Defaults to {@code 100} ms. Must be &gt; 0.
         *
         * @param pollIntervalMs idle poll interval in milliseconds
         * @return this builder
         */
        public Builder<T> pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        /**
         * @throws IllegalStateException    if the queue does not use {@link DispatchMode#EXTERNAL_PULL}
         * @throws IllegalArgumentException if {@code workerCount} exceeds the queue's concurrency
         *                                  or {@code pollIntervalMs <= 0}
         */
        public PollingConsumer<T> build() {
            return new PollingConsumer<>(this);
        }
    }
}
