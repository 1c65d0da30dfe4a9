package topicflow;

import java.util.Objects;

/**
 * Error value produced when a record key or value cannot be deserialized.
 *
 * <p>Returned as {@code Either.left(...)} by a handler built with
 * {@link RecordHandler#deserialize}; the wrapped handler never sees the record.
 */
public class SerializationError extends RuntimeException {

  public SerializationError(Throwable cause) {
    super("Failed to deserialize record: " + Objects.requireNonNull(cause, "cause"), cause);
  }
}
