package webhook.process;

import webhook.ProcessingException;

/**
 * Processes a single dequeued item. Invoked by {@link webhook.WebhookQueue} from a worker
 * thread, at most {@code concurrency} times in parallel.
 *
 * @param <T> payload type
 * @see RetryingProcessor
 */
@FunctionalInterface
public interface Processor<T> {

    /**
     * Processes the item, returning normally on success.
     *
     * @param item the payload
     * @throws ProcessingException if the item could not be processed
     */
    void process(T item) throws ProcessingException;
}
