package webhook;

/**
 * Signals that an item could not be processed, after the retry budget was spent.
 *
 * <p>The queue catches this at the dispatch layer: the in-flight slot is released, the failure
 * is logged and counted, and dispatching continues. It never reaches the original sender of
 * the webhook.
 */
public class ProcessingException extends Exception {

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
