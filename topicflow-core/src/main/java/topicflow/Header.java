package topicflow;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single record header: a string key and a raw byte value.
 *
 * <p>The value array is copied on construction and on access, so a header never
 * changes after it has been created.
 */
public final class Header {
  private final String key;
  private final byte[] value;

  public Header(String key, byte[] value) {
    this.key = Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    this.value = Arrays.copyOf(value, value.length);
  }

  /**
   * Creates a header whose value is the UTF-8 encoding of {@code value}.
   */
  public static Header ofString(String key, String value) {
    Objects.requireNonNull(value, "value");
    return new Header(key, value.getBytes(StandardCharsets.UTF_8));
  }

  public String key() {
    return key;
  }

  public byte[] value() {
    return Arrays.copyOf(value, value.length);
  }

  public String valueAsString() {
    return new String(value, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Header other)) return false;
    return key.equals(other.key) && Arrays.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return 31 * key.hashCode() + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "Header{" + key + "=" + value.length + " bytes}";
  }
}
