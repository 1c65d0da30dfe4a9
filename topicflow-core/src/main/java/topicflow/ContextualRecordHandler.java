package topicflow;

import java.util.Objects;
import java.util.Set;

/**
 * Handler that needs a context value of type {@code C} (a client, a repository, a
 * tenant configuration) for every record.
 *
 * <p>{@link #provide(Object)} binds the context once and yields a plain
 * {@link RecordHandler}, which can then be composed like any other handler:
 *
 * <pre>{@code
 * ContextualRecordHandler<InventoryClient, Exception, String, String> reserve =
 *     ContextualRecordHandler.of(Set.of("orders"), (client, record) -> {
 *       client.reserve(record.value());
 *       return HandleResult.done();
 *     });
 *
 * RecordHandler<Exception, String, String> handler = reserve.provide(inventoryClient);
 * }</pre>
 *
 * @param <C> context type
 * @param <E> error type
 * @param <K> record key type
 * @param <V> record value type
 */
public interface ContextualRecordHandler<C, E, K, V> {

  Set<String> topics();

  HandleResult<E> handle(C context, ConsumerRecord<K, V> record);

  /**
   * Binds {@code context}; the returned handler passes it to every invocation.
   */
  default RecordHandler<E, K, V> provide(C context) {
    return new ContextBoundRecordHandler<>(this, context);
  }

  static <C, E, K, V> ContextualRecordHandler<C, E, K, V> of(Set<String> topics, Handle<C, E, K, V> handle) {
    Set<String> topicSet = Set.copyOf(Objects.requireNonNull(topics, "topics"));
    Objects.requireNonNull(handle, "handle");
    return new ContextualRecordHandler<>() {
      @Override
      public Set<String> topics() {
        return topicSet;
      }

      @Override
      public HandleResult<E> handle(C context, ConsumerRecord<K, V> record) {
        return handle.apply(context, record);
      }
    };
  }

  @FunctionalInterface
  interface Handle<C, E, K, V> {
    HandleResult<E> apply(C context, ConsumerRecord<K, V> record);
  }
}
