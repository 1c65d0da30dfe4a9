package topicflow;

/**
 * Thrown when a thread is interrupted while blocked inside a handler: waiting for
 * queue capacity in a parallel handler, or waiting out a retry backoff.
 *
 * <p>The thread's interrupt flag is restored before this exception is thrown.
 */
public class HandlingInterruptedException extends RuntimeException {

  public HandlingInterruptedException(String message, InterruptedException cause) {
    super(message, cause);
  }
}
