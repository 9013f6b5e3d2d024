/**
 * Pull-based alternative to the queue's internal dispatch loop.
 *
 * @see webhook.consumer.PollingConsumer
 */
package webhook.consumer;
