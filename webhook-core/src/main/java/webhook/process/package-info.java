/**
 * Item processing with a single bounded retry.
 *
 * <p>{@link webhook.process.RetryingProcessor} wraps an injected {@link webhook.process.WorkUnit}
 * and gives each item at most two attempts, separated by the delay of a
 * {@link webhook.process.RetryPolicy}. {@link webhook.process.SimulatedWorkUnit} provides
 * random latency and failures for demos and load runs.
 *
 * @see webhook.process.RetryingProcessor
 * @see webhook.process.Processor
 */
package webhook.process;
