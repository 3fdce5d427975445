/**
 * Backoff policies for best-effort operations that are retried on later calls.
 */
package wasteland.retry;
