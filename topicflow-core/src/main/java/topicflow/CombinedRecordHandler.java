package topicflow;

import topicflow.util.DaemonThreadFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Routes records by topic to one of two handlers, or to both when both claim the
 * topic.
 *
 * <p>The routing table is built once at construction. For shared topics both handlers
 * always run to completion, the first on the executor and the second on the calling
 * thread; the merged result is the failure that completed first, if any. Records for
 * unclaimed topics succeed without side effects.
 */
final class CombinedRecordHandler<E, K, V> implements RecordHandler<E, K, V> {
  private static final ExecutorService SHARED_EXECUTOR =
      Executors.newCachedThreadPool(new DaemonThreadFactory("topicflow-combine-"));

  private final Set<String> topics;
  private final Map<String, Function<ConsumerRecord<K, V>, HandleResult<E>>> handlerByTopic;
  private final Executor executor;

  CombinedRecordHandler(RecordHandler<E, K, V> first, RecordHandler<E, K, V> second, Executor executor) {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    this.executor = Objects.requireNonNull(executor, "executor");

    Map<String, Function<ConsumerRecord<K, V>, HandleResult<E>>> table = new HashMap<>();
    for (RecordHandler<E, K, V> handler : List.of(first, second)) {
      for (String topic : handler.topics()) {
        table.merge(topic, handler::handle, this::concurrently);
      }
    }
    this.handlerByTopic = Collections.unmodifiableMap(table);

    Set<String> union = new LinkedHashSet<>(first.topics());
    union.addAll(second.topics());
    this.topics = Collections.unmodifiableSet(union);
  }

  static Executor sharedExecutor() {
    return SHARED_EXECUTOR;
  }

  @Override
  public Set<String> topics() {
    return topics;
  }

  @Override
  public HandleResult<E> handle(ConsumerRecord<K, V> record) {
    Function<ConsumerRecord<K, V>, HandleResult<E>> handler = handlerByTopic.get(record.topic());
    if (handler == null) {
      return HandleResult.done();
    }
    return handler.apply(record);
  }

  private Function<ConsumerRecord<K, V>, HandleResult<E>> concurrently(
      Function<ConsumerRecord<K, V>, HandleResult<E>> left,
      Function<ConsumerRecord<K, V>, HandleResult<E>> right) {
    return record -> {
      AtomicReference<HandleResult<E>> firstFailure = new AtomicReference<>();
      CompletableFuture<HandleResult<E>> leftRun =
          CompletableFuture.supplyAsync(() -> track(left.apply(record), firstFailure), executor);
      try {
        track(right.apply(record), firstFailure);
      } catch (RuntimeException | Error e) {
        awaitQuietly(leftRun, e);
        throw e;
      }
      join(leftRun);
      HandleResult<E> failure = firstFailure.get();
      return failure != null ? failure : HandleResult.done();
    };
  }

  private static <E> HandleResult<E> track(HandleResult<E> result, AtomicReference<HandleResult<E>> firstFailure) {
    Objects.requireNonNull(result, "handler returned null result");
    if (!result.isDone()) {
      firstFailure.compareAndSet(null, result);
    }
    return result;
  }

  private static void join(CompletableFuture<?> run) {
    try {
      run.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  private static void awaitQuietly(CompletableFuture<?> run, Throwable primary) {
    try {
      run.join();
    } catch (RuntimeException e) {
      Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
      primary.addSuppressed(cause);
    }
  }
}
