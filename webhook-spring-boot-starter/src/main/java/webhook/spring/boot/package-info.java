/**
 * Spring Boot auto-configuration for the webhook queue.
 *
 * <p>Add {@code webhook-spring-boot-starter} to the classpath and tune it through
 * {@code webhook.*} properties. Supply a {@link webhook.process.WorkUnit} bean to replace the
 * simulated work.
 */
package webhook.spring.boot;
