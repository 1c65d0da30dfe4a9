package topicflow.serialization;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Built-in deserializers for common primitive encodings.
 */
public final class Deserializers {

  private Deserializers() {
  }

  /**
   * Strict UTF-8 text. Malformed byte sequences are rejected instead of replaced.
   */
  public static Deserializer<String> string() {
    return (topic, headers, data) -> {
      try {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(data))
            .toString();
      } catch (CharacterCodingException e) {
        throw new IllegalArgumentException("Invalid UTF-8 in record from topic " + topic, e);
      }
    };
  }

  /** Copies the raw bytes unchanged. */
  public static Deserializer<byte[]> bytes() {
    return (topic, headers, data) -> Arrays.copyOf(data, data.length);
  }

  /** Big-endian 4-byte integer. */
  public static Deserializer<Integer> intValue() {
    return (topic, headers, data) -> {
      requireLength(topic, data, Integer.BYTES);
      return ByteBuffer.wrap(data).getInt();
    };
  }

  /** Big-endian 8-byte long. */
  public static Deserializer<Long> longValue() {
    return (topic, headers, data) -> {
      requireLength(topic, data, Long.BYTES);
      return ByteBuffer.wrap(data).getLong();
    };
  }

  private static void requireLength(String topic, byte[] data, int expected) {
    if (data.length != expected) {
      throw new IllegalArgumentException("Expected " + expected + " bytes but got "
          + data.length + " in record from topic " + topic);
    }
  }
}
