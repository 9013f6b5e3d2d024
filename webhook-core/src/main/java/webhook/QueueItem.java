package webhook;

import java.time.Instant;
import java.util.Objects;

/**
 * Internal wrapper pairing an admitted payload with its admission time.
 * Used by {@link WebhookQueue} to compute queue wait time when the item is dequeued.
 *
 * @param payload    the opaque webhook payload
 * @param enqueuedAt when the item was admitted
 * @param <T>        payload type
 */
public record QueueItem<T>(T payload, Instant enqueuedAt) {

    public QueueItem {
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }
}
