package topicflow;

/**
 * Error value returned by a {@link topicflow.spi.Producer} that could not write a record.
 *
 * <p>The retry router surfaces it as {@code Either.left(...)}: a retry could not even
 * be scheduled, which callers handle differently from retries running out.
 */
public class ProducerError extends RuntimeException {

  public ProducerError(String message) {
    super(message);
  }

  public ProducerError(String message, Throwable cause) {
    super(message, cause);
  }

  public ProducerError(Throwable cause) {
    super(cause);
  }
}
