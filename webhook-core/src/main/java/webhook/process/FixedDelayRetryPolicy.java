package webhook.process;

/**
 * Retry policy that waits the same delay before every retry.
 */
public final class FixedDelayRetryPolicy implements RetryPolicy {
    private final long delayMs;

    /**
     * @param delayMs delay before each retry (milliseconds); zero retries immediately
     */
    public FixedDelayRetryPolicy(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
        this.delayMs = delayMs;
    }

    @Override
    public long computeDelayMs(int failedAttempts) {
        if (failedAttempts <= 0) {
            return 0L;
        }
        return delayMs;
    }

    public long delayMs() {
        return delayMs;
    }
}
