package webhook.process;

import webhook.ProcessingException;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Processor} that runs a {@link WorkUnit} and retries it exactly once on failure.
 *
 * <p>Attempt one runs immediately. If it throws, the processor waits the delay computed by its
 * {@link RetryPolicy} and runs attempt two. If attempt two also throws, a
 * {@link ProcessingException} is raised carrying the second failure as its cause and the first
 * as a suppressed exception. A successful first attempt never waits.
 *
 * <p>This class is stateless and thread-safe as long as the work unit is.
 *
 * @param <T> payload type
 */
public final class RetryingProcessor<T> implements Processor<T> {
    private static final Logger logger = Logger.getLogger(RetryingProcessor.class.getName());

    /** First attempt plus one retry. */
    public static final int MAX_ATTEMPTS = 2;

    private final WorkUnit<T> workUnit;
    private final RetryPolicy retryPolicy;

    /**
     * @param workUnit    the work performed on each attempt
     * @param retryPolicy supplies the delay between attempt one and attempt two
     */
    public RetryingProcessor(WorkUnit<T> workUnit, RetryPolicy retryPolicy) {
        this.workUnit = Objects.requireNonNull(workUnit, "workUnit");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public void process(T item) throws ProcessingException {
        Exception firstFailure;
        try {
            workUnit.perform(item);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException("Interrupted while processing item", e);
        } catch (Exception e) {
            firstFailure = e;
        }

        logger.log(Level.INFO, "Retrying item processing: " + item, firstFailure);
        pause(retryPolicy.computeDelayMs(1), firstFailure);

        try {
            workUnit.perform(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessingException failure = new ProcessingException("Interrupted while retrying item", e);
            failure.addSuppressed(firstFailure);
            throw failure;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Item processing failed after retry: " + item, e);
            ProcessingException failure = new ProcessingException(
                    "Processing failed after " + MAX_ATTEMPTS + " attempts", e);
            failure.addSuppressed(firstFailure);
            throw failure;
        }
    }

    private static void pause(long delayMs, Exception firstFailure) throws ProcessingException {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessingException("Interrupted while waiting to retry", firstFailure);
        }
    }
}
