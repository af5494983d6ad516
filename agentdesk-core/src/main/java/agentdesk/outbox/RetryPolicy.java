package agentdesk.outbox;

/**
 * Computes the delay before the next delivery attempt of a failed outbox item.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param attempts number of attempts made so far, including the one that just failed
   * @return delay in milliseconds, never negative
   */
  long computeDelayMs(int attempts);
}
