package topicflow;

/**
 * Position assigned by the broker to a produced record.
 */
public record RecordMetadata(String topic, int partition, long offset) {
}
