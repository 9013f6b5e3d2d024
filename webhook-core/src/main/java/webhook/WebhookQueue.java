package webhook;

import webhook.process.Processor;
import webhook.spi.MetricsExporter;
import webhook.util.WebhookThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission-controlled work queue that decouples webhook arrival from processing.
 *
 * <p>{@link #enqueue} admits an item only while {@code pending + inFlight + 1 < overloadThreshold};
 * otherwise it throws {@link QueueOverloadedException} and stores nothing. Admitted items wait
 * in FIFO order until a processing slot frees up. At most {@code concurrency} items are in
 * flight at once.
 *
 * <p>Who moves items from pending to in flight is fixed at construction by {@link DispatchMode}:
 * <ul>
 *   <li>{@link DispatchMode#INTERNAL_PUSH} — the queue's own dispatch loop runs after every
 *       enqueue and every completion, submitting work to named daemon worker threads.</li>
 *   <li>{@link DispatchMode#EXTERNAL_PULL} — the queue only buffers; an external consumer
 *       calls {@link #processNext()}, or {@link #dequeue()} followed by
 *       {@link #processItem(Object)}.</li>
 * </ul>
 *
 * <p>All state transitions happen under a single lock, and every transition signals waiters of
 * {@link #drain()}, which returns exactly when nothing is pending and nothing is in flight.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @param <T> payload type
 * @see WebhookQueue.Builder
 * @see webhook.consumer.PollingConsumer
 */
public final class WebhookQueue<T> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WebhookQueue.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private final Deque<QueueItem<T>> pending = new ArrayDeque<>();
    private final Set<Long> inFlight = new HashSet<>();
    private long nextToken;
    private boolean accepting = true;

    private final Processor<T> processor;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final DispatchMode mode;
    private final int concurrency;
    private final int overloadThreshold;
    private final long drainTimeoutMs;
    private final ExecutorService workers;

    private WebhookQueue(Builder<T> builder) {
        this.processor = Objects.requireNonNull(builder.processor, "processor");
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (builder.overloadThreshold < 1) {
            throw new IllegalArgumentException("overloadThreshold must be >= 1");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.concurrency = builder.concurrency;
        this.overloadThreshold = builder.overloadThreshold;
        this.drainTimeoutMs = builder.drainTimeoutMs;

        this.workers = mode == DispatchMode.INTERNAL_PUSH
                ? Executors.newFixedThreadPool(concurrency, WebhookThreadFactory.workers())
                : null;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Admits an item for asynchronous processing.
     *
     * @param item the payload; must not be {@code null}
     * @throws QueueOverloadedException if admitting the item would reach the overload threshold
     * @throws IllegalStateException    if the queue has been closed
     */
    public void enqueue(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            if (!accepting) {
                throw new IllegalStateException("WebhookQueue has been closed");
            }
            int resident = totalItemsLocked();
            if (resident + 1 >= overloadThreshold) {
                metrics.incrementRejected();
                logger.warning("Queue overload, request rejected. pending=" + pending.size()
                        + ", inFlight=" + inFlight.size() + ", threshold=" + overloadThreshold);
                throw new QueueOverloadedException(resident, overloadThreshold);
            }
            pending.addLast(new QueueItem<>(item, clock.instant()));
            metrics.incrementReceived();
            metrics.recordQueueDepth(totalItemsLocked());
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Enqueued item. pending=" + pending.size() + ", item=" + item);
            }
            if (mode == DispatchMode.INTERNAL_PUSH) {
                pumpLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the oldest pending item. Only the external consumer may call this.
     *
     * @return the head payload, or empty if nothing is pending
     * @throws IllegalStateException if this queue dispatches internally
     */
    public Optional<T> dequeue() {
        requireMode(DispatchMode.EXTERNAL_PULL, "dequeue");
        lock.lock();
        try {
            QueueItem<T> entry = takeHeadLocked();
            if (entry == null) {
                return Optional.empty();
            }
            signalIfIdleLocked();
            return Optional.of(entry.payload());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the oldest pending item into a processing slot and runs the processor on it in the
     * calling thread. The move happens under one lock, so the item is always counted as either
     * pending or in flight.
     *
     * @return {@code true} if an item was processed (successfully or not), {@code false} if
     *         nothing was pending
     * @throws ProcessingException   if the processor gave up on the item
     * @throws IllegalStateException if this queue dispatches internally, or all
     *                               {@code concurrency} slots are taken
     */
    public boolean processNext() throws ProcessingException {
        requireMode(DispatchMode.EXTERNAL_PULL, "processNext");
        QueueItem<T> entry;
        long token;
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return false;
            }
            if (inFlight.size() >= concurrency) {
                throw new IllegalStateException("All " + concurrency + " processing slots are in use");
            }
            entry = takeHeadLocked();
            token = acquireSlotLocked();
        } finally {
            lock.unlock();
        }
        try {
            runProcessor(entry.payload());
        } finally {
            releaseSlot(token, false);
        }
        return true;
    }

    /**
     * Runs the processor on an item previously obtained from {@link #dequeue()}, occupying one
     * in-flight slot for the duration of the call.
     *
     * @param item the payload
     * @throws ProcessingException   if the processor gave up on the item
     * @throws IllegalStateException if this queue dispatches internally, or all
     *                               {@code concurrency} slots are taken
     */
    public void processItem(T item) throws ProcessingException {
        requireMode(DispatchMode.EXTERNAL_PULL, "processItem");
        long token;
        lock.lock();
        try {
            if (inFlight.size() >= concurrency) {
                throw new IllegalStateException("All " + concurrency + " processing slots are in use");
            }
            token = acquireSlotLocked();
        } finally {
            lock.unlock();
        }
        try {
            runProcessor(item);
        } finally {
            releaseSlot(token, false);
        }
    }

    /**
     * Returns the number of resident items, pending plus in flight.
     */
    public int size() {
        return totalItems();
    }

    /**
     * Returns the number of resident items, pending plus in flight. Same value as {@link #size()}.
     */
    public int totalItems() {
        lock.lock();
        try {
            return totalItemsLocked();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public DispatchMode mode() {
        return mode;
    }

    public int concurrency() {
        return concurrency;
    }

    public int overloadThreshold() {
        return overloadThreshold;
    }

    /**
     * Blocks until nothing is pending and nothing is in flight. Returns immediately when the
     * queue is already idle.
     *
     * <p>In {@link DispatchMode#EXTERNAL_PULL} mode, an item between {@code dequeue()} and
     * {@code processItem()} is counted in neither half; consumers that use
     * {@link #processNext()} do not have this gap.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void drain() throws InterruptedException {
        lock.lock();
        try {
            while (!isIdleLocked()) {
                idle.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #drain()}, giving up after the timeout.
     *
     * @return {@code true} if the queue became idle, {@code false} if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean drain(long timeout, TimeUnit unit) throws InterruptedException {
        long remainingNanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!isIdleLocked()) {
                if (remainingNanos <= 0L) {
                    return false;
                }
                remainingNanos = idle.awaitNanos(remainingNanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for every admitted item to settle, logging before and after. Does not stop new
     * enqueues; the transport layer stops accepting requests before calling this.
     *
     * @throws InterruptedException if interrupted while draining
     */
    public void shutdown() throws InterruptedException {
        logger.info("Starting graceful shutdown of queue. pending=" + pendingCount()
                + ", inFlight=" + inFlightCount());
        drain();
        logger.info("All queued items processed, queue shutdown complete");
    }

    /**
     * Stops accepting new items, drains remaining work within the configured drain timeout,
     * then shuts down worker threads. Idempotent.
     *
     * <p>If the timeout elapses, items that never started are dropped and counted as failed,
     * and items running on the worker threads are interrupted, so the queue ends up empty.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (!accepting && (workers == null || workers.isShutdown())) {
                return;
            }
            accepting = false;
        } finally {
            lock.unlock();
        }
        try {
            if (!drain(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Drain timeout exceeded; forcing shutdown. pending=" + pendingCount()
                        + ", inFlight=" + inFlightCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (workers == null) {
            abandonUnstarted(List.of());
        } else {
            abandonUnstarted(workers.shutdownNow());
            try {
                workers.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ── Dispatch loop ─────────────────────────────────────────────────

    private void pumpLocked() {
        while (inFlight.size() < concurrency && !pending.isEmpty()) {
            QueueItem<T> entry = takeHeadLocked();
            long token = acquireSlotLocked();
            try {
                workers.execute(new SlotTask(token, entry.payload()));
            } catch (RejectedExecutionException e) {
                // Workers are gone (forced close); drop the slot so drain() can finish.
                logger.log(Level.SEVERE, "Worker pool rejected item; dropping it", e);
                inFlight.remove(token);
                metrics.incrementFailed();
                metrics.recordQueueDepth(totalItemsLocked());
                signalIfIdleLocked();
            }
        }
    }

    /** Worker task for one dispatched item; its token identifies the slot it occupies. */
    private final class SlotTask implements Runnable {
        private final long token;
        private final T item;

        SlotTask(long token, T item) {
            this.token = token;
            this.item = item;
        }

        @Override
        public void run() {
            try {
                runProcessor(item);
            } catch (ProcessingException e) {
                // already logged and counted; one item's failure never stops the pump
            } finally {
                releaseSlot(token, true);
            }
        }
    }

    /**
     * Drops everything that will never run after a forced shutdown: items still pending and
     * tasks the worker pool accepted but never started.
     */
    private void abandonUnstarted(List<Runnable> unstartedTasks) {
        lock.lock();
        try {
            int dropped = pending.size();
            pending.clear();
            for (Runnable task : unstartedTasks) {
                if (task instanceof WebhookQueue<?>.SlotTask slot && inFlight.remove(slot.token)) {
                    dropped++;
                }
            }
            if (dropped == 0) {
                return;
            }
            for (int i = 0; i < dropped; i++) {
                metrics.incrementFailed();
            }
            logger.warning("Dropped " + dropped + " unprocessed items on forced shutdown");
            metrics.recordQueueDepth(totalItemsLocked());
            signalIfIdleLocked();
        } finally {
            lock.unlock();
        }
    }

    private void runProcessor(T item) throws ProcessingException {
        long start = System.nanoTime();
        try {
            processor.process(item);
        } catch (ProcessingException e) {
            metrics.incrementFailed();
            logger.log(Level.SEVERE, "Error processing item: " + item, e);
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementFailed();
            logger.log(Level.SEVERE, "Processor threw unexpectedly for item: " + item, e);
            throw new ProcessingException("Processor threw unexpectedly", e);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metrics.incrementProcessed();
        metrics.recordProcessingDurationMs(elapsedMs);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Processed item successfully in " + elapsedMs + "ms: " + item);
        }
    }

    private void releaseSlot(long token, boolean pump) {
        lock.lock();
        try {
            inFlight.remove(token);
            metrics.recordQueueDepth(totalItemsLocked());
            if (pump && !workers.isShutdown()) {
                pumpLocked();
            }
            signalIfIdleLocked();
        } finally {
            lock.unlock();
        }
    }

    // ── Locked helpers ────────────────────────────────────────────────

    private QueueItem<T> takeHeadLocked() {
        QueueItem<T> entry = pending.pollFirst();
        if (entry == null) {
            return null;
        }
        long waitMs = Math.max(0L, Duration.between(entry.enqueuedAt(), clock.instant()).toMillis());
        metrics.recordQueueWaitMs(waitMs);
        metrics.recordQueueDepth(totalItemsLocked());
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Dequeued item after " + waitMs + "ms. pending=" + pending.size());
        }
        return entry;
    }

    private long acquireSlotLocked() {
        long token = nextToken++;
        inFlight.add(token);
        metrics.recordQueueDepth(totalItemsLocked());
        return token;
    }

    private int totalItemsLocked() {
        return pending.size() + inFlight.size();
    }

    private boolean isIdleLocked() {
        return pending.isEmpty() && inFlight.isEmpty();
    }

    private void signalIfIdleLocked() {
        if (isIdleLocked()) {
            idle.signalAll();
        }
    }

    private void requireMode(DispatchMode required, String operation) {
        if (mode != required) {
            throw new IllegalStateException(operation + "() requires " + required + " mode, queue is " + mode);
        }
    }

    /** Builder for {@link WebhookQueue}. */
    public static final class Builder<T> {
        private Processor<T> processor;
        private MetricsExporter metrics;
        private Clock clock;
        private DispatchMode mode = DispatchMode.INTERNAL_PUSH;
        private int concurrency = 10;
        private int overloadThreshold = 100;
        private long drainTimeoutMs = 5000;

        private Builder() {}

        /**
         * Sets the processor invoked once per dispatched item.
         *
         * <p><b>Required.</b>
         *
         * @param processor the processor, typically a {@link webhook.process.RetryingProcessor}
         * @return this builder
         */
        public Builder<T> processor(Processor<T> processor) {
            this.processor = processor;
            return this;
        }

        /**
         * Sets the metrics exporter for counters, queue depth and timings.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder<T> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used to timestamp admissions and compute queue wait time.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Selects the dispatch mechanism.
         *
         * <p>Optional. Defaults to {@link DispatchMode#INTERNAL_PUSH}.
         *
         * @param mode the dispatch mode
         * @return this builder
         */
        public Builder<T> mode(DispatchMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Sets the maximum number of items processed at the same time.
         *
         * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
         *
         * @param concurrency in-flight limit
         * @return this builder
         */
        public Builder<T> concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets the overload threshold. An item is admitted only while
         * {@code pending + inFlight + 1 < overloadThreshold}, so at most
         * {@code overloadThreshold - 1} items are ever resident.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &ge; 1.
         *
         * @param overloadThreshold admission threshold
         * @return this builder
         */
        public Builder<T> overloadThreshold(int overloadThreshold) {
            this.overloadThreshold = overloadThreshold;
            return this;
        }

        /**
         * Sets the maximum time in milliseconds {@link #close()} waits for remaining items.
         *
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder<T> drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the queue. In {@link DispatchMode#INTERNAL_PUSH} mode worker threads are created
         * immediately.
         *
         * @return a new {@link WebhookQueue}
         * @throws NullPointerException     if {@code processor} or {@code mode} is null
         * @throws IllegalArgumentException if {@code concurrency < 1}, {@code overloadThreshold < 1}
         *                                  or {@code drainTimeoutMs < 0}
         */
        public WebhookQueue<T> build() {
            return new WebhookQueue<>(this);
        }
    }
}
