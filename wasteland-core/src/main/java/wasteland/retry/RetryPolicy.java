package wasteland.retry;

/**
 * Strategy for computing how long to wait before retrying a failed operation, such as an
 * automatic pull-request submission.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param attempts the number of failed attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
