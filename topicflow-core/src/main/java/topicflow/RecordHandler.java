package topicflow;

import topicflow.parallel.ParallelRecordHandler;
import topicflow.serialization.Deserializer;
import topicflow.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Processing logic for the records of a fixed set of topics.
 *
 * <p>A handler reports the topics it needs ({@link #topics()}, queried once before
 * consumption starts and stable for the lifetime of the handler) and handles one
 * record at a time, returning a {@link HandleResult} instead of throwing.
 *
 * <p>Handlers are never mutated. Every combinator returns a new handler that wraps
 * the receiver, so layers compose in any order:
 *
 * <pre>{@code
 * RecordHandler<Exception, String, Order> orders =
 *     RecordHandler.fromConsumer("orders", record -> fulfil(record.value()));
 * RecordHandler<Exception, String, Refund> refunds =
 *     RecordHandler.fromConsumer("refunds", record -> refund(record.value()));
 *
 * RecordHandler<Either<ProducerError, Either<SerializationError, Exception>>, byte[], byte[]> all =
 *     RetryRecordHandler.withRetries(orders.deserialize(Deserializers.string(), orderDeserializer),
 *             retryPolicy, producer)
 *         .combine(RetryRecordHandler.withRetries(refunds.deserialize(Deserializers.string(), refundDeserializer),
 *             retryPolicy, producer));
 *
 * try (ParallelRecordHandler<Either<ProducerError, Either<SerializationError, Exception>>, byte[], byte[]> handler =
 *          all.parallel(8)) {
 *   consumer.subscribe(handler.topics());
 *   // poll loop: handler.handle(record) for every record
 * }
 * }</pre>
 *
 * @param <E> error type of failed results
 * @param <K> record key type
 * @param <V> record value type
 * @see HandleResult
 * @see ParallelRecordHandler
 * @see topicflow.retry.RetryRecordHandler
 */
public interface RecordHandler<E, K, V> {

  /**
   * Topics this handler consumes. Calling this repeatedly returns equal sets.
   *
   * @return immutable topic set
   */
  Set<String> topics();

  /**
   * Handles one record.
   *
   * @param record the record
   * @return {@link HandleResult#done()} or a failed result
   */
  HandleResult<E> handle(ConsumerRecord<K, V> record);

  /**
   * Creates a handler for {@code topics} backed by a function.
   */
  static <E, K, V> RecordHandler<E, K, V> of(Set<String> topics,
                                             Function<? super ConsumerRecord<K, V>, HandleResult<E>> handle) {
    return new FunctionRecordHandler<>(topics, handle);
  }

  static <E, K, V> RecordHandler<E, K, V> of(String topic,
                                             Function<? super ConsumerRecord<K, V>, HandleResult<E>> handle) {
    return of(Set.of(topic), handle);
  }

  /**
   * Creates a handler from a consumer that throws on failure. Any {@link Exception}
   * it throws becomes a failed result; errors are not caught.
   */
  static <K, V> RecordHandler<Exception, K, V> fromConsumer(Set<String> topics, RecordConsumer<K, V> consumer) {
    Objects.requireNonNull(consumer, "consumer");
    return of(topics, record -> {
      try {
        consumer.accept(record);
        return HandleResult.done();
      } catch (Exception e) {
        return HandleResult.failed(e);
      }
    });
  }

  static <K, V> RecordHandler<Exception, K, V> fromConsumer(String topic, RecordConsumer<K, V> consumer) {
    return fromConsumer(Set.of(topic), consumer);
  }

  /**
   * Combines handlers left to right with {@link #combine(RecordHandler)}. An empty list
   * yields a handler with no topics.
   */
  static <E, K, V> RecordHandler<E, K, V> combineAll(List<? extends RecordHandler<E, K, V>> handlers) {
    Objects.requireNonNull(handlers, "handlers");
    RecordHandler<E, K, V> combined = null;
    for (RecordHandler<E, K, V> handler : handlers) {
      Objects.requireNonNull(handler, "handlers cannot contain null elements");
      combined = combined == null ? handler : combined.combine(handler);
    }
    return combined != null ? combined : of(Set.of(), record -> HandleResult.done());
  }

  /**
   * Transforms incoming records before delegating to this handler.
   */
  default <K2, V2> RecordHandler<E, K2, V2> contramap(
      Function<? super ConsumerRecord<K2, V2>, ? extends ConsumerRecord<K, V>> f) {
    Objects.requireNonNull(f, "f");
    return this.<K2, V2>contramapOrFail(record -> Either.right(f.apply(record)));
  }

  /**
   * Transforms incoming records with a step that may fail. A {@code Left} fails the
   * record without invoking this handler; a {@code Right} is handed to this handler.
   */
  default <K2, V2> RecordHandler<E, K2, V2> contramapOrFail(
      Function<? super ConsumerRecord<K2, V2>, Either<E, ConsumerRecord<K, V>>> f) {
    return new ContramappedRecordHandler<>(this, f);
  }

  default <E2> RecordHandler<E2, K, V> mapError(Function<? super E, ? extends E2> f) {
    Objects.requireNonNull(f, "f");
    return this.<E2>withErrorHandler(error -> HandleResult.failed(f.apply(error)));
  }

  /**
   * Replaces every failure {@code e} with {@code f(e)}, which may succeed or fail
   * with a different error type.
   */
  default <E2> RecordHandler<E2, K, V> withErrorHandler(Function<? super E, HandleResult<E2>> f) {
    return new ErrorHandlingRecordHandler<>(this, f);
  }

  /**
   * Turns every failure into success.
   */
  default <E2> RecordHandler<E2, K, V> ignore() {
    return this.<E2>withErrorHandler(error -> HandleResult.done());
  }

  /**
   * Runs {@code f} on the same record after this handler, whether this handler
   * succeeded or not. This handler's failure takes precedence; otherwise the result
   * of {@code f} is returned.
   */
  default RecordHandler<E, K, V> andThen(Function<? super ConsumerRecord<K, V>, HandleResult<E>> f) {
    return new AndThenRecordHandler<>(this, f);
  }

  /**
   * Merges this handler with {@code other}, routing by topic. Topics claimed by both
   * run both handlers concurrently on a shared daemon pool.
   */
  default RecordHandler<E, K, V> combine(RecordHandler<E, K, V> other) {
    return combine(other, CombinedRecordHandler.sharedExecutor());
  }

  /**
   * Merges this handler with {@code other}; for topics claimed by both, this handler
   * runs on {@code executor} while {@code other} runs on the calling thread.
   */
  default RecordHandler<E, K, V> combine(RecordHandler<E, K, V> other, Executor executor) {
    return new CombinedRecordHandler<>(this, other, executor);
  }

  /**
   * Adapts this handler to raw bytes. Keys (when present) and values are decoded
   * first; a decoding failure yields {@code Either.left(SerializationError)} and this
   * handler is not invoked. Failures of this handler become {@code Either.right(e)}.
   */
  default RecordHandler<Either<SerializationError, E>, byte[], byte[]> deserialize(
      Deserializer<? extends K> keyDeserializer, Deserializer<? extends V> valueDeserializer) {
    Objects.requireNonNull(keyDeserializer, "keyDeserializer");
    Objects.requireNonNull(valueDeserializer, "valueDeserializer");
    return this.<Either<SerializationError, E>>mapError(Either::right)
        .<byte[], byte[]>contramapOrFail(record ->
            RecordDeserialization.decode(record, keyDeserializer, valueDeserializer));
  }

  /**
   * Runs this handler on {@code workerCount} worker threads with the default queue
   * capacity. See {@link ParallelRecordHandler}.
   */
  default ParallelRecordHandler<E, K, V> parallel(int workerCount) {
    return parallel(workerCount, ParallelRecordHandler.DEFAULT_QUEUE_CAPACITY);
  }

  default ParallelRecordHandler<E, K, V> parallel(int workerCount, int queueCapacity) {
    return parallel(workerCount, queueCapacity, MetricsExporter.NOOP);
  }

  default ParallelRecordHandler<E, K, V> parallel(int workerCount, int queueCapacity, MetricsExporter metrics) {
    return ParallelRecordHandler.builder(this)
        .workerCount(workerCount)
        .queueCapacity(queueCapacity)
        .metrics(metrics)
        .build();
  }

  /**
   * Record callback that reports failure by throwing.
   */
  @FunctionalInterface
  interface RecordConsumer<K, V> {
    void accept(ConsumerRecord<K, V> record) throws Exception;
  }
}
