package agentdesk.outbox;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay},
 * multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 60_000L;
  public static final long DEFAULT_MAX_DELAY_MS = 24L * 60 * 60 * 1000;

  private final long baseDelayMs;
  private final long maxDelayMs;

  /** One minute base delay, capped at one day. */
  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long capped;
    // 2^(attempts-1) overflows or passes the cap long before attempts reaches 63
    if (attempts > 62 || (1L << (attempts - 1)) > maxDelayMs / baseDelayMs) {
      capped = maxDelayMs;
    } else {
      capped = baseDelayMs * (1L << (attempts - 1));
    }
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, (long) (capped * jitter));
  }
}
