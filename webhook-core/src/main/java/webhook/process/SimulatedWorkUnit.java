package webhook.process;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;
import java.util.random.RandomGenerator;

/**
 * Stand-in for a call to a downstream system: sleeps a random latency, then fails with a
 * configured probability.
 *
 * <p>Latency is drawn uniformly from {@code [minDelayMs, maxDelayMs]}. Pass a seeded
 * {@link RandomGenerator} to make the outcomes reproducible.
 *
 * @param <T> payload type
 */
public final class SimulatedWorkUnit<T> implements WorkUnit<T> {
    private static final Logger logger = Logger.getLogger(SimulatedWorkUnit.class.getName());

    private final long minDelayMs;
    private final long maxDelayMs;
    private final double failureRate;
    private final RandomGenerator random;

    /**
     * Uses {@link ThreadLocalRandom} for latency and failure draws.
     */
    public SimulatedWorkUnit(long minDelayMs, long maxDelayMs, double failureRate) {
        this(minDelayMs, maxDelayMs, failureRate, null);
    }

    /**
     * @param minDelayMs  lower latency bound (milliseconds, inclusive)
     * @param maxDelayMs  upper latency bound (milliseconds, inclusive)
     * @param failureRate probability in {@code [0, 1]} that an attempt fails
     * @param random      source of randomness; {@code null} selects {@link ThreadLocalRandom}
     */
    public SimulatedWorkUnit(long minDelayMs, long maxDelayMs, double failureRate, RandomGenerator random) {
        if (minDelayMs < 0) {
            throw new IllegalArgumentException("minDelayMs must be >= 0, got: " + minDelayMs);
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= minDelayMs");
        }
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("failureRate must be within [0, 1], got: " + failureRate);
        }
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.failureRate = failureRate;
        this.random = random;
    }

    @Override
    public void perform(T item) throws Exception {
        RandomGenerator rnd = random != null ? random : ThreadLocalRandom.current();
        long delay = minDelayMs == maxDelayMs ? minDelayMs : rnd.nextLong(minDelayMs, maxDelayMs + 1);
        if (delay > 0) {
            Thread.sleep(delay);
        }
        if (rnd.nextDouble() < failureRate) {
            logger.warning("Item processing failed: " + Objects.toString(item));
            throw new SimulatedFailureException("Processing failed");
        }
    }

    /** Failure raised by an unlucky simulated attempt. */
    public static final class SimulatedFailureException extends Exception {
        public SimulatedFailureException(String message) {
            super(message);
        }
    }
}
