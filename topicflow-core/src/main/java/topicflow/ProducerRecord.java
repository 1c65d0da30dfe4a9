package topicflow;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Record to be produced to a topic. When no partition is set, the producer
 * chooses one (normally by key).
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ProducerRecord<K, V> {
  private final String topic;
  private final K key;
  private final V value;
  private final Integer partition;
  private final Headers headers;

  public ProducerRecord(String topic, K key, V value, Integer partition, Headers headers) {
    this.topic = Objects.requireNonNull(topic, "topic");
    if (topic.isEmpty()) {
      throw new IllegalArgumentException("topic cannot be empty");
    }
    if (partition != null && partition < 0) {
      throw new IllegalArgumentException("partition must be >= 0, got: " + partition);
    }
    this.key = key;
    this.value = Objects.requireNonNull(value, "value");
    this.partition = partition;
    this.headers = headers == null ? Headers.EMPTY : headers;
  }

  public static <K, V> ProducerRecord<K, V> of(String topic, K key, V value, Headers headers) {
    return new ProducerRecord<>(topic, key, value, null, headers);
  }

  public String topic() {
    return topic;
  }

  public Optional<K> key() {
    return Optional.ofNullable(key);
  }

  public V value() {
    return value;
  }

  public OptionalInt partition() {
    return partition == null ? OptionalInt.empty() : OptionalInt.of(partition);
  }

  public Headers headers() {
    return headers;
  }

  @Override
  public String toString() {
    return "ProducerRecord{topic=" + topic + ", partition=" + partition + ", headers=" + headers.size() + "}";
  }
}
