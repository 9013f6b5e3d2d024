package webhook.process;

/**
 * Strategy for computing the delay before retrying a failed attempt.
 *
 * @see FixedDelayRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param failedAttempts the number of attempts that have failed so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int failedAttempts);
}
