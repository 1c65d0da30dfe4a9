package topicflow;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs a follow-up on every record after the delegate, regardless of the delegate's
 * outcome. The delegate's failure wins over the follow-up's.
 */
final class AndThenRecordHandler<E, K, V> implements RecordHandler<E, K, V> {
  private final RecordHandler<E, K, V> delegate;
  private final Function<? super ConsumerRecord<K, V>, HandleResult<E>> followUp;

  AndThenRecordHandler(RecordHandler<E, K, V> delegate, Function<? super ConsumerRecord<K, V>, HandleResult<E>> followUp) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.followUp = Objects.requireNonNull(followUp, "followUp");
  }

  @Override
  public Set<String> topics() {
    return delegate.topics();
  }

  @Override
  public HandleResult<E> handle(ConsumerRecord<K, V> record) {
    HandleResult<E> first = delegate.handle(record);
    HandleResult<E> second = Objects.requireNonNull(followUp.apply(record), "follow-up returned null result");
    return first.isDone() ? second : first;
  }
}
