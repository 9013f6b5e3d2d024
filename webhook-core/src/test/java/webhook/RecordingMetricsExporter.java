package webhook;

import webhook.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test exporter that counts every call and keeps the observed depth and timing samples.
 */
class RecordingMetricsExporter implements MetricsExporter {
    final AtomicInteger received = new AtomicInteger();
    final AtomicInteger processed = new AtomicInteger();
    final AtomicInteger rejected = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();
    final List<Integer> depths = Collections.synchronizedList(new ArrayList<>());
    final List<Long> waits = Collections.synchronizedList(new ArrayList<>());
    final List<Long> durations = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void incrementReceived() {
        received.incrementAndGet();
    }

    @Override
    public void incrementProcessed() {
        processed.incrementAndGet();
    }

    @Override
    public void incrementRejected() {
        rejected.incrementAndGet();
    }

    @Override
    public void incrementFailed() {
        failed.incrementAndGet();
    }

    @Override
    public void recordQueueDepth(int depth) {
        depths.add(depth);
    }

    @Override
    public void recordQueueWaitMs(long waitMs) {
        waits.add(waitMs);
    }

    @Override
    public void recordProcessingDurationMs(long durationMs) {
        durations.add(durationMs);
    }

    int lastDepth() {
        synchronized (depths) {
            return depths.get(depths.size() - 1);
        }
    }
}
