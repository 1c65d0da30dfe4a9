package topicflow;

import java.util.Objects;
import java.util.Set;

final class ContextBoundRecordHandler<C, E, K, V> implements RecordHandler<E, K, V> {
  private final ContextualRecordHandler<C, E, K, V> delegate;
  private final C context;

  ContextBoundRecordHandler(ContextualRecordHandler<C, E, K, V> delegate, C context) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public Set<String> topics() {
    return delegate.topics();
  }

  @Override
  public HandleResult<E> handle(ConsumerRecord<K, V> record) {
    return delegate.handle(context, record);
  }
}
