package webhook;

/**
 * Thrown by {@link WebhookQueue#enqueue(Object)} when admitting one more item would reach the
 * overload threshold.
 *
 * <p>This is an expected, frequent outcome under load rather than a fault: the transport
 * layer answers it with a "try again later" response. The rejected item is never stored.
 */
public class QueueOverloadedException extends RuntimeException {

    private final int residentItems;
    private final int threshold;

    /**
     * @param residentItems pending plus in-flight items at the time of rejection
     * @param threshold     the queue's overload threshold
     */
    public QueueOverloadedException(int residentItems, int threshold) {
        super("Queue overloaded");
        this.residentItems = residentItems;
        this.threshold = threshold;
    }

    /** Returns the number of pending plus in-flight items observed when the item was rejected. */
    public int residentItems() {
        return residentItems;
    }

    public int threshold() {
        return threshold;
    }
}
