package topicflow.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Backoff chains for {@link NonBlockingRetryPolicy}.
 *
 * <p>Delay formula: {@code base * 2^i} for retry {@code i} (zero-based), capped at
 * {@code max}. No jitter is applied: every backoff belongs to a fixed retry topic.
 */
public final class ExponentialBackoff {

  private ExponentialBackoff() {
  }

  /**
   * @param base    delay of the first retry
   * @param max     delay cap
   * @param retries number of retries (and retry topics)
   * @return {@code retries} delays, first retry first
   */
  public static List<Duration> chain(Duration base, Duration max, int retries) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(max, "max");
    if (base.isNegative() || base.isZero()) {
      throw new IllegalArgumentException("base must be > 0, got: " + base);
    }
    if (max.isNegative()) {
      throw new IllegalArgumentException("max must be >= 0, got: " + max);
    }
    if (retries < 0) {
      throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
    }
    long baseMs = base.toMillis();
    long maxMs = max.toMillis();
    List<Duration> delays = new ArrayList<>(retries);
    for (int i = 0; i < retries; i++) {
      delays.add(Duration.ofMillis(delayMs(baseMs, maxMs, i)));
    }
    return Collections.unmodifiableList(delays);
  }

  static long delayMs(long baseMs, long maxMs, int retry) {
    long expDelay;
    if (retry >= 62) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << retry;
      // cap before multiplying so base * shift cannot overflow
      expDelay = (baseMs != 0 && shift > maxMs / baseMs) ? Long.MAX_VALUE : baseMs * shift;
    }
    return Math.min(maxMs, expDelay);
  }
}
