package webhook.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads that run webhook work.
 *
 * <p>Two pools exist: the queue's dispatch workers ({@code webhook-worker-1}, {@code -2}, ...)
 * and the polling consumer's loops ({@code webhook-consumer-1}, ...). Each factory numbers its
 * own threads. An exception escaping a thread is logged at SEVERE instead of going to stderr.
 */
public final class WebhookThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(WebhookThreadFactory.class.getName());

    public static final String WORKER_PREFIX = "webhook-worker-";
    public static final String CONSUMER_PREFIX = "webhook-consumer-";

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    private WebhookThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    /** Threads for {@link webhook.WebhookQueue}'s internal dispatch. */
    public static WebhookThreadFactory workers() {
        return new WebhookThreadFactory(WORKER_PREFIX);
    }

    /** Threads for {@link webhook.consumer.PollingConsumer} loops. */
    public static WebhookThreadFactory consumers() {
        return new WebhookThreadFactory(CONSUMER_PREFIX);
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(WebhookThreadFactory::logUncaught);
        return thread;
    }

    private static void logUncaught(Thread thread, Throwable error) {
        logger.log(Level.SEVERE, "Uncaught exception on " + thread.getName(), error);
    }
}
