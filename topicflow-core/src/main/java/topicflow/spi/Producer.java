package topicflow.spi;

import topicflow.Either;
import topicflow.ProducerError;
import topicflow.ProducerRecord;
import topicflow.RecordMetadata;

/**
 * Writes records to the broker. The retry router is the only caller in this library;
 * it produces one record per retryable failure.
 *
 * <p>Implementations block until the broker acknowledges the write (or fails), and
 * report failures as {@code Either.left(ProducerError)} instead of throwing.
 */
@FunctionalInterface
public interface Producer {

  /**
   * Produces {@code record}.
   *
   * @param record the record to write
   * @return the assigned position, or the failure
   */
  Either<ProducerError, RecordMetadata> produce(ProducerRecord<byte[], byte[]> record);
}
