package topicflow.retry;

import topicflow.ConsumerRecord;
import topicflow.Headers;
import topicflow.ProducerRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Retry policy that moves failed records through one retry topic per configured
 * backoff.
 *
 * <p>Retry topics of {@code orders} for group {@code billing} with three backoffs are
 * {@code orders-billing-retry-0}, {@code orders-billing-retry-1} and
 * {@code orders-billing-retry-2}. A record produced to retry topic {@code i} carries
 * three string headers:
 *
 * <ul>
 *   <li>{@value #ATTEMPT_HEADER}: the attempt index {@code i};</li>
 *   <li>{@value #SUBMITTED_AT_HEADER}: production time in epoch milliseconds;</li>
 *   <li>{@value #BACKOFF_HEADER}: the backoff of topic {@code i} in milliseconds.</li>
 * </ul>
 *
 * <p>Headers from earlier attempts are replaced. When a retry topic record lacks a
 * header, or carries an unparseable or out-of-range one, the attempt index falls back
 * to the topic suffix, the backoff to the configured one and the submission time to
 * now.
 *
 * @param <E> handler error type
 */
public final class NonBlockingRetryPolicy<E> implements RetryPolicy<E> {
  public static final String ATTEMPT_HEADER = "retry-attempt";
  public static final String SUBMITTED_AT_HEADER = "retry-submitted-at";
  public static final String BACKOFF_HEADER = "retry-backoff";

  private final String group;
  private final String retryInfix;
  private final List<Duration> backoffs;
  private final Predicate<? super E> nonRetryable;
  private final Clock clock;

  private NonBlockingRetryPolicy(Builder<E> builder) {
    this.group = Objects.requireNonNull(builder.group, "group");
    if (group.isEmpty()) {
      throw new IllegalArgumentException("group must not be empty");
    }
    this.retryInfix = "-" + group + "-retry-";
    this.backoffs = List.copyOf(builder.backoffs);
    for (Duration backoff : backoffs) {
      if (backoff.isNegative()) {
        throw new IllegalArgumentException("backoffs must not be negative, got: " + backoff);
      }
    }
    this.nonRetryable = builder.nonRetryable;
    this.clock = Objects.requireNonNull(builder.clock, "clock");
  }

  public static <E> Builder<E> builder(String group) {
    return new Builder<>(group);
  }

  public String group() {
    return group;
  }

  public List<Duration> backoffs() {
    return backoffs;
  }

  @Override
  public List<String> retryTopics(String topic) {
    Objects.requireNonNull(topic, "topic");
    List<String> topics = new ArrayList<>(backoffs.size());
    for (int i = 0; i < backoffs.size(); i++) {
      topics.add(retryTopic(topic, i));
    }
    return Collections.unmodifiableList(topics);
  }

  @Override
  public Optional<RetryAttempt> retryAttempt(String topic, Headers headers) {
    int infixAt = topic.lastIndexOf(retryInfix);
    if (infixAt <= 0) {
      return Optional.empty();
    }
    int topicIndex = parseIndex(topic.substring(infixAt + retryInfix.length()));
    if (topicIndex < 0) {
      return Optional.empty();
    }
    String originalTopic = topic.substring(0, infixAt);
    int attempt = attemptHeader(headers).orElse(topicIndex);
    Instant submittedAt = longHeader(headers, SUBMITTED_AT_HEADER)
        .map(Instant::ofEpochMilli)
        .orElseGet(clock::instant);
    Duration backoff = longHeader(headers, BACKOFF_HEADER)
        .map(Duration::ofMillis)
        .orElseGet(() -> topicIndex < backoffs.size() ? backoffs.get(topicIndex) : Duration.ZERO);
    if (attempt < 0 || backoff.isNegative()) {
      return Optional.empty();
    }
    return Optional.of(new RetryAttempt(attempt, originalTopic, submittedAt, backoff));
  }

  @Override
  public Optional<ProducerRecord<byte[], byte[]>> retryRecord(RetryAttempt attempt,
                                                              ConsumerRecord<byte[], byte[]> record,
                                                              E error) {
    Objects.requireNonNull(record, "record");
    if (nonRetryable.test(error)) {
      return Optional.empty();
    }
    int next = attempt == null ? 0 : attempt.attempt() + 1;
    if (next >= backoffs.size()) {
      return Optional.empty();
    }
    String originalTopic = attempt == null ? record.topic() : attempt.originalTopic();
    Headers headers = record.headers()
        .without(ATTEMPT_HEADER)
        .without(SUBMITTED_AT_HEADER)
        .without(BACKOFF_HEADER)
        .withString(ATTEMPT_HEADER, Integer.toString(next))
        .withString(SUBMITTED_AT_HEADER, Long.toString(clock.millis()))
        .withString(BACKOFF_HEADER, Long.toString(backoffs.get(next).toMillis()));
    return Optional.of(ProducerRecord.of(
        retryTopic(originalTopic, next), record.key().orElse(null), record.value(), headers));
  }

  private String retryTopic(String topic, int attempt) {
    return topic + retryInfix + attempt;
  }

  private static int parseIndex(String suffix) {
    try {
      return Integer.parseInt(suffix);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static Optional<Integer> attemptHeader(Headers headers) {
    return longHeader(headers, ATTEMPT_HEADER)
        .filter(value -> value >= 0 && value <= Integer.MAX_VALUE)
        .map(Long::intValue);
  }

  private static Optional<Long> longHeader(Headers headers, String key) {
    Optional<String> value = headers.lastString(key);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(value.get().trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /** Builder for {@link NonBlockingRetryPolicy}. */
  public static final class Builder<E> {
    private final String group;
    private List<Duration> backoffs = List.of();
    private Predicate<? super E> nonRetryable = error -> false;
    private Clock clock = Clock.systemUTC();

    private Builder(String group) {
      this.group = group;
    }

    /**
     * Sets one backoff per retry topic. Optional; no retries by default.
     */
    public Builder<E> backoffs(List<Duration> backoffs) {
      Objects.requireNonNull(backoffs, "backoffs");
      for (Duration backoff : backoffs) {
        Objects.requireNonNull(backoff, "backoffs cannot contain null elements");
      }
      this.backoffs = backoffs;
      return this;
    }

    public Builder<E> backoffs(Duration... backoffs) {
      return backoffs(Arrays.asList(backoffs));
    }

    /**
     * Errors matching {@code nonRetryable} are surfaced immediately instead of being
     * sent to a retry topic.
     */
    public Builder<E> nonRetryable(Predicate<? super E> nonRetryable) {
      this.nonRetryable = Objects.requireNonNull(nonRetryable, "nonRetryable");
      return this;
    }

    public Builder<E> clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public NonBlockingRetryPolicy<E> build() {
      return new NonBlockingRetryPolicy<>(this);
    }
  }
}
