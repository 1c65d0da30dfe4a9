package topicflow;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Leaf handler: a fixed topic set and a function.
 */
final class FunctionRecordHandler<E, K, V> implements RecordHandler<E, K, V> {
  private final Set<String> topics;
  private final Function<? super ConsumerRecord<K, V>, HandleResult<E>> handle;

  FunctionRecordHandler(Set<String> topics, Function<? super ConsumerRecord<K, V>, HandleResult<E>> handle) {
    this.topics = Set.copyOf(Objects.requireNonNull(topics, "topics"));
    for (String topic : this.topics) {
      if (topic.isEmpty()) {
        throw new IllegalArgumentException("topics cannot contain empty names");
      }
    }
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public Set<String> topics() {
    return topics;
  }

  @Override
  public HandleResult<E> handle(ConsumerRecord<K, V> record) {
    return Objects.requireNonNull(handle.apply(record), "handler returned null result");
  }
}
