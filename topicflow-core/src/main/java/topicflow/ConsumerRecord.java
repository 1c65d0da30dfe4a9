package topicflow;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable record consumed from a topic partition.
 *
 * <p>The key is optional; the value is required. Byte-array keys and values are
 * held by reference and must not be modified by handlers.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ConsumerRecord<K, V> {
  private final String topic;
  private final int partition;
  private final long offset;
  private final Headers headers;
  private final K key;
  private final V value;

  /**
   * @param topic     topic name
   * @param partition partition number (non-negative)
   * @param offset    offset within the partition (non-negative)
   * @param headers   record headers, {@code null} is treated as {@link Headers#EMPTY}
   * @param key       record key, may be {@code null}
   * @param value     record value
   */
  public ConsumerRecord(String topic, int partition, long offset, Headers headers, K key, V value) {
    this.topic = Objects.requireNonNull(topic, "topic");
    if (topic.isEmpty()) {
      throw new IllegalArgumentException("topic cannot be empty");
    }
    if (partition < 0) {
      throw new IllegalArgumentException("partition must be >= 0, got: " + partition);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
    }
    this.partition = partition;
    this.offset = offset;
    this.headers = headers == null ? Headers.EMPTY : headers;
    this.key = key;
    this.value = Objects.requireNonNull(value, "value");
  }

  /**
   * Creates a record without headers.
   */
  public static <K, V> ConsumerRecord<K, V> of(String topic, int partition, long offset, K key, V value) {
    return new ConsumerRecord<>(topic, partition, offset, Headers.EMPTY, key, value);
  }

  public String topic() {
    return topic;
  }

  public int partition() {
    return partition;
  }

  public long offset() {
    return offset;
  }

  public Headers headers() {
    return headers;
  }

  public Optional<K> key() {
    return Optional.ofNullable(key);
  }

  public V value() {
    return value;
  }

  /**
   * Returns a record at the same position with a new key and value.
   */
  public <K2, V2> ConsumerRecord<K2, V2> withKeyAndValue(K2 key, V2 value) {
    return new ConsumerRecord<>(topic, partition, offset, headers, key, value);
  }

  /**
   * Maps key (when present) and value, keeping topic, partition, offset and headers.
   */
  public <K2, V2> ConsumerRecord<K2, V2> bimap(Function<? super K, ? extends K2> keyMapper,
                                               Function<? super V, ? extends V2> valueMapper) {
    K2 mappedKey = key == null ? null : keyMapper.apply(key);
    return new ConsumerRecord<>(topic, partition, offset, headers, mappedKey, valueMapper.apply(value));
  }

  @Override
  public String toString() {
    return "ConsumerRecord{topic=" + topic + ", partition=" + partition + ", offset=" + offset + "}";
  }
}
