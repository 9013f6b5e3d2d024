package webhook.process;

/**
 * One attempt at the actual work for an item, such as a call to a downstream system.
 *
 * <p>Implementations hold no state that carries from one attempt to the next; a retry calls
 * {@link #perform} again with the same item.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface WorkUnit<T> {

    /**
     * @param item the payload
     * @throws Exception any failure; the caller decides whether to retry
     */
    void perform(T item) throws Exception;
}
