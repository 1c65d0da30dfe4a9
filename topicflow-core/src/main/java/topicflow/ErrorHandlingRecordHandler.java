package topicflow;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Replaces failures of the delegate with the result of an error handler.
 */
final class ErrorHandlingRecordHandler<E, E2, K, V> implements RecordHandler<E2, K, V> {
  private final RecordHandler<E, K, V> delegate;
  private final Function<? super E, HandleResult<E2>> errorHandler;

  ErrorHandlingRecordHandler(RecordHandler<E, K, V> delegate, Function<? super E, HandleResult<E2>> errorHandler) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
  }

  @Override
  public Set<String> topics() {
    return delegate.topics();
  }

  @Override
  public HandleResult<E2> handle(ConsumerRecord<K, V> record) {
    HandleResult<E> result = delegate.handle(record);
    if (result instanceof HandleResult.Failed<E> failed) {
      return Objects.requireNonNull(errorHandler.apply(failed.error()), "error handler returned null result");
    }
    return HandleResult.done();
  }
}
