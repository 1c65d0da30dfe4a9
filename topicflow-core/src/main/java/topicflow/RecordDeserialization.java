package topicflow;

import topicflow.serialization.Deserializer;

import java.util.Optional;

/**
 * Decoding step behind {@link RecordHandler#deserialize}.
 */
final class RecordDeserialization {

  private RecordDeserialization() {
  }

  static <E, K, V> Either<Either<SerializationError, E>, ConsumerRecord<K, V>> decode(
      ConsumerRecord<byte[], byte[]> record,
      Deserializer<? extends K> keyDeserializer,
      Deserializer<? extends V> valueDeserializer) {
    try {
      Optional<byte[]> rawKey = record.key();
      K key = null;
      if (rawKey.isPresent()) {
        key = keyDeserializer.deserialize(record.topic(), record.headers(), rawKey.get());
      }
      V value = valueDeserializer.deserialize(record.topic(), record.headers(), record.value());
      if (value == null) {
        throw new IllegalStateException("value deserializer returned null for topic " + record.topic());
      }
      return Either.right(record.withKeyAndValue(key, value));
    } catch (Exception e) {
      return Either.left(Either.left(new SerializationError(e)));
    }
  }
}
