/**
 * Partition-ordered parallel dispatch with bounded queues.
 *
 * @see topicflow.parallel.ParallelRecordHandler
 */
package topicflow.parallel;
