package topicflow.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Retry state recovered from a record consumed from a retry topic.
 *
 * @param attempt       zero-based index of the retry topic the record was read from
 * @param originalTopic topic the record was first consumed from
 * @param submittedAt   when the record was produced to the retry topic
 * @param backoff       delay to observe after {@code submittedAt} before handling
 */
public record RetryAttempt(int attempt, String originalTopic, Instant submittedAt, Duration backoff) {

  public RetryAttempt {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
    }
    Objects.requireNonNull(originalTopic, "originalTopic");
    Objects.requireNonNull(submittedAt, "submittedAt");
    Objects.requireNonNull(backoff, "backoff");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException("backoff must not be negative, got: " + backoff);
    }
  }

  /**
   * Time left until {@code submittedAt + backoff}; zero once it has passed.
   */
  public Duration remainingBackoff(Instant now) {
    Duration remaining = Duration.between(now, submittedAt.plus(backoff));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }
}
