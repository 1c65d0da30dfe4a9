package topicflow.retry;

import topicflow.ConsumerRecord;
import topicflow.Headers;
import topicflow.ProducerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Decides where failed records go next.
 *
 * <p>{@link RetryRecordHandler} is the only caller. Implementations must be
 * thread-safe; they are invoked from every worker that handles retried topics.
 *
 * @param <E> handler error type the policy inspects
 * @see NonBlockingRetryPolicy
 */
public interface RetryPolicy<E> {

  /**
   * Ordered retry topics for {@code topic}; empty when records of that topic are
   * never retried.
   *
   * @param topic an original (non-retry) topic
   * @return retry topic names, first attempt first
   */
  List<String> retryTopics(String topic);

  /**
   * Extracts the retry state of a consumed record.
   *
   * @param topic   topic the record was consumed from
   * @param headers the record's headers
   * @return the attempt, or empty for a record on its original topic
   */
  Optional<RetryAttempt> retryAttempt(String topic, Headers headers);

  /**
   * Builds the record to produce after {@code record} failed with {@code error}.
   *
   * @param attempt the current attempt, or {@code null} for a first-attempt record
   * @param record  the failed record
   * @param error   the handler's error
   * @return the record for the next retry topic, or empty when attempts are
   *     exhausted or {@code error} is not retryable
   */
  Optional<ProducerRecord<byte[], byte[]>> retryRecord(RetryAttempt attempt,
                                                       ConsumerRecord<byte[], byte[]> record,
                                                       E error);
}
