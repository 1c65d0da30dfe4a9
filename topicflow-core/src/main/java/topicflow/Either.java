package topicflow;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Disjoint union of two values. Used as the error type at composition boundaries
 * so callers can tell which stage failed:
 *
 * <ul>
 *   <li>{@code Either<SerializationError, E>}: malformed input ({@link Left}) versus
 *       a failure of the wrapped handler ({@link Right}).</li>
 *   <li>{@code Either<ProducerError, E>}: a retry record could not be produced
 *       ({@link Left}) versus an error surfaced without a retry ({@link Right}).</li>
 * </ul>
 *
 * @param <L> left type
 * @param <R> right type
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {

  static <L, R> Either<L, R> left(L value) {
    return new Left<>(value);
  }

  static <L, R> Either<L, R> right(R value) {
    return new Right<>(value);
  }

  default boolean isLeft() {
    return this instanceof Left;
  }

  default boolean isRight() {
    return this instanceof Right;
  }

  default Optional<L> getLeft() {
    return this instanceof Left<L, R> left ? Optional.of(left.value()) : Optional.empty();
  }

  default Optional<R> getRight() {
    return this instanceof Right<L, R> right ? Optional.of(right.value()) : Optional.empty();
  }

  default <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
    if (this instanceof Left<L, R> left) {
      return onLeft.apply(left.value());
    }
    return onRight.apply(((Right<L, R>) this).value());
  }

  record Left<L, R>(L value) implements Either<L, R> {
    public Left {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  record Right<L, R>(R value) implements Either<L, R> {
    public Right {
      Objects.requireNonNull(value, "value must not be null");
    }
  }
}
