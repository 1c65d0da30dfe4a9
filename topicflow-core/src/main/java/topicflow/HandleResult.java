package topicflow;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of {@link RecordHandler#handle(ConsumerRecord)}.
 *
 * <ul>
 *   <li>{@link Done}: the record was handled.</li>
 *   <li>{@link Failed}: handling failed with an error value of type {@code E}.</li>
 * </ul>
 *
 * <p>Failures are values: handlers return them instead of throwing, so every
 * combinator can inspect, map or recover from them.
 *
 * @param <E> error type
 */
public sealed interface HandleResult<E> permits HandleResult.Done, HandleResult.Failed {

  /**
   * Returns the shared {@link Done} result.
   *
   * @return the done result
   */
  @SuppressWarnings("unchecked")
  static <E> HandleResult<E> done() {
    return (HandleResult<E>) Done.INSTANCE;
  }

  /**
   * Creates a failed result.
   *
   * @param error the error value
   * @return a failed result
   * @throws NullPointerException if {@code error} is null
   */
  static <E> HandleResult<E> failed(E error) {
    return new Failed<>(error);
  }

  default boolean isDone() {
    return this instanceof Done;
  }

  /**
   * Returns the error of a failed result, or empty when done.
   */
  default Optional<E> failure() {
    if (this instanceof Failed<E> failed) {
      return Optional.of(failed.error());
    }
    return Optional.empty();
  }

  default <E2> HandleResult<E2> mapError(Function<? super E, ? extends E2> mapper) {
    if (this instanceof Failed<E> failed) {
      return failed(mapper.apply(failed.error()));
    }
    return done();
  }

  /**
   * Record handled successfully.
   */
  record Done<E>() implements HandleResult<E> {
    private static final Done<Object> INSTANCE = new Done<>();
  }

  /**
   * Record handling failed.
   *
   * @param error the failure (never null)
   */
  record Failed<E>(E error) implements HandleResult<E> {
    public Failed {
      Objects.requireNonNull(error, "error must not be null");
    }
  }
}
