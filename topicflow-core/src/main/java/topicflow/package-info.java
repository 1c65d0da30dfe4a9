/**
 * Handler algebra for consuming records from a partitioned, topic-based broker.
 *
 * <p>A {@link topicflow.RecordHandler} declares its topics and handles one
 * {@link topicflow.ConsumerRecord} at a time, returning a {@link topicflow.HandleResult}.
 * Combinators on the interface wrap handlers in new handlers: record and error
 * mapping, side-effect chaining, topic-keyed merging, deserialization and parallel
 * dispatch. Retry routing lives in {@link topicflow.retry}.
 *
 * @see topicflow.RecordHandler
 * @see topicflow.parallel.ParallelRecordHandler
 * @see topicflow.retry.RetryRecordHandler
 */
package topicflow;
