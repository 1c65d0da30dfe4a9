package topicflow;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Pre-transforms records, possibly failing, before delegating.
 */
final class ContramappedRecordHandler<E, K, V, K2, V2> implements RecordHandler<E, K2, V2> {
  private final RecordHandler<E, K, V> delegate;
  private final Function<? super ConsumerRecord<K2, V2>, Either<E, ConsumerRecord<K, V>>> transform;

  ContramappedRecordHandler(RecordHandler<E, K, V> delegate,
                            Function<? super ConsumerRecord<K2, V2>, Either<E, ConsumerRecord<K, V>>> transform) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.transform = Objects.requireNonNull(transform, "transform");
  }

  @Override
  public Set<String> topics() {
    return delegate.topics();
  }

  @Override
  public HandleResult<E> handle(ConsumerRecord<K2, V2> record) {
    Either<E, ConsumerRecord<K, V>> transformed = transform.apply(record);
    if (transformed instanceof Either.Left<E, ConsumerRecord<K, V>> left) {
      return HandleResult.failed(left.value());
    }
    return delegate.handle(((Either.Right<E, ConsumerRecord<K, V>>) transformed).value());
  }
}
