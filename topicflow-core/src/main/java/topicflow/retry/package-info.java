/**
 * Non-blocking retries through dedicated retry topics.
 *
 * <p>{@link topicflow.retry.RetryRecordHandler} consumes the original topics and their
 * retry topics, waits out the backoff of retried records, and produces failed records
 * to the next retry topic chosen by a {@link topicflow.retry.RetryPolicy}.
 * {@link topicflow.retry.NonBlockingRetryPolicy} is the default policy.
 */
package topicflow.retry;
