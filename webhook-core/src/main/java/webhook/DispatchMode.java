package webhook;

/**
 * Selects which mechanism owns dequeuing for a {@link WebhookQueue}. Exactly one is active for
 * the lifetime of a queue.
 */
public enum DispatchMode {
    /** The queue pumps admitted items into its processor itself, after every enqueue and completion. */
    INTERNAL_PUSH,
    /**
     * The queue only buffers; an external consumer such as
     * {@link webhook.consumer.PollingConsumer} claims and runs items with
     * {@link WebhookQueue#processNext()}.
     */
    EXTERNAL_PULL
}
