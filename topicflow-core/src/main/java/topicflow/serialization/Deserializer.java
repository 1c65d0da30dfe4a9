package topicflow.serialization;

import topicflow.Headers;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts raw record bytes into a typed key or value.
 *
 * <p>Implementations signal malformed input by throwing. When used through
 * {@link topicflow.RecordHandler#deserialize}, any exception is captured as a
 * {@link topicflow.SerializationError} and the wrapped handler is skipped.
 *
 * @param <T> the decoded type
 * @see Deserializers
 */
@FunctionalInterface
public interface Deserializer<T> {

  /**
   * Decodes {@code data} read from {@code topic}.
   *
   * @param topic   the topic the bytes were consumed from
   * @param headers the record headers
   * @param data    the raw bytes
   * @return the decoded value (never null)
   * @throws Exception if the bytes cannot be decoded
   */
  T deserialize(String topic, Headers headers, byte[] data) throws Exception;

  /**
   * Returns a deserializer that applies {@code mapper} to the decoded value.
   * Exceptions thrown by the mapper count as deserialization failures.
   */
  default <U> Deserializer<U> map(Function<? super T, ? extends U> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return (topic, headers, data) -> mapper.apply(deserialize(topic, headers, data));
  }
}
