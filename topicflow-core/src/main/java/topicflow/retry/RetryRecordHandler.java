package topicflow.retry;

import topicflow.ConsumerRecord;
import topicflow.Either;
import topicflow.HandleResult;
import topicflow.HandlingInterruptedException;
import topicflow.ProducerError;
import topicflow.ProducerRecord;
import topicflow.RecordHandler;
import topicflow.RecordMetadata;
import topicflow.metrics.HandlerMetric;
import topicflow.spi.MetricsExporter;
import topicflow.spi.Producer;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Redirects failures of a byte-level handler to retry topics instead of retrying in
 * process.
 *
 * <p>The handler consumes every wrapped topic together with its retry topics. A record
 * read from a retry topic is held until its backoff has elapsed, counted from the time
 * it was produced, and then handed to the wrapped handler. When the wrapped handler
 * fails, the {@link RetryPolicy} either supplies the record for the next retry topic,
 * which is produced exactly once, or declares the attempts exhausted:
 *
 * <ul>
 *   <li>retry produced: {@link HandleResult#done()};</li>
 *   <li>produce failed: {@code Failed(Left(ProducerError))};</li>
 *   <li>no retry left: {@code Failed(Right(e))} with the handler's error.</li>
 * </ul>
 *
 * <p>Records read from a retry topic are passed to the wrapped handler unchanged,
 * still carrying the retry topic name. Wrap each handler before combining: a combined
 * handler routes by topic and treats retry topics it does not claim as unclaimed.
 *
 * <p>The backoff wait blocks the calling thread. Wrap the result with
 * {@link RecordHandler#parallel(int)} so only the worker owning the retried record's
 * partition waits.
 *
 * @param <E> error type of the wrapped handler
 */
public final class RetryRecordHandler<E> implements RecordHandler<Either<ProducerError, E>, byte[], byte[]> {
  private static final Logger logger = Logger.getLogger(RetryRecordHandler.class.getName());

  private final RecordHandler<E, byte[], byte[]> handler;
  private final RetryPolicy<? super E> policy;
  private final Producer producer;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Set<String> topics;

  private RetryRecordHandler(Builder<E> builder) {
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.policy = Objects.requireNonNull(builder.policy, "policy");
    this.producer = Objects.requireNonNull(builder.producer, "producer");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");

    Set<String> all = new LinkedHashSet<>();
    for (String topic : handler.topics()) {
      all.add(topic);
      all.addAll(policy.retryTopics(topic));
    }
    this.topics = Collections.unmodifiableSet(all);
  }

  /**
   * Wraps {@code handler} with retries using the system clock and no metrics.
   */
  public static <E> RetryRecordHandler<E> withRetries(RecordHandler<E, byte[], byte[]> handler,
                                                      RetryPolicy<? super E> policy,
                                                      Producer producer) {
    return builder(handler, policy, producer).build();
  }

  public static <E> Builder<E> builder(RecordHandler<E, byte[], byte[]> handler,
                                       RetryPolicy<? super E> policy,
                                       Producer producer) {
    return new Builder<>(handler, policy, producer);
  }

  @Override
  public Set<String> topics() {
    return topics;
  }

  @Override
  public HandleResult<Either<ProducerError, E>> handle(ConsumerRecord<byte[], byte[]> record) {
    Optional<RetryAttempt> attempt = policy.retryAttempt(record.topic(), record.headers());
    attempt.ifPresent(a -> awaitBackoff(record, a));

    HandleResult<E> result = handler.handle(record);
    if (!(result instanceof HandleResult.Failed<E> failed)) {
      return HandleResult.done();
    }
    E error = failed.error();
    Optional<ProducerRecord<byte[], byte[]>> retryRecord = policy.retryRecord(attempt.orElse(null), record, error);
    if (retryRecord.isEmpty()) {
      metrics.report(new HandlerMetric.RetriesExhausted(record, attempt.orElse(null)));
      return HandleResult.failed(Either.right(error));
    }
    return produce(record, retryRecord.get());
  }

  private HandleResult<Either<ProducerError, E>> produce(ConsumerRecord<byte[], byte[]> record,
                                                         ProducerRecord<byte[], byte[]> retryRecord) {
    Either<ProducerError, RecordMetadata> produced = producer.produce(retryRecord);
    if (produced instanceof Either.Left<ProducerError, RecordMetadata> left) {
      metrics.report(new HandlerMetric.RetryProduceFailed(record, retryRecord, left.value()));
      logger.log(Level.WARNING, "Failed to produce retry record to " + retryRecord.topic()
          + " for " + record.topic() + "-" + record.partition() + "@" + record.offset(), left.value());
      return HandleResult.failed(Either.left(left.value()));
    }
    metrics.report(new HandlerMetric.RetryProduced(record, retryRecord));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Produced retry record to " + retryRecord.topic() + " for "
          + record.topic() + "-" + record.partition() + "@" + record.offset());
    }
    return HandleResult.done();
  }

  private void awaitBackoff(ConsumerRecord<byte[], byte[]> record, RetryAttempt attempt) {
    Duration remaining = attempt.remainingBackoff(clock.instant());
    if (remaining.isZero()) {
      return;
    }
    metrics.report(new HandlerMetric.WaitingBeforeRetry(record, attempt, remaining));
    try {
      sleeper.sleep(remaining);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HandlingInterruptedException("Interrupted while waiting " + remaining
          + " before retrying " + record.topic() + "-" + record.partition() + "@" + record.offset(), e);
    }
  }

  /** Builder for {@link RetryRecordHandler}. */
  public static final class Builder<E> {
    private final RecordHandler<E, byte[], byte[]> handler;
    private final RetryPolicy<? super E> policy;
    private final Producer producer;
    private MetricsExporter metrics;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder(RecordHandler<E, byte[], byte[]> handler, RetryPolicy<? super E> policy, Producer producer) {
      this.handler = handler;
      this.policy = policy;
      this.producer = producer;
    }

    public Builder<E> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Clock used to compute the remaining backoff. Optional; defaults to the system
     * UTC clock.
     */
    public Builder<E> clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder<E> sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryRecordHandler<E> build() {
      return new RetryRecordHandler<>(this);
    }
  }
}
