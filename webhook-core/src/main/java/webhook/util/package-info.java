/**
 * Internal utilities.
 */
package webhook.util;
