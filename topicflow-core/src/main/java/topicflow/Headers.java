package topicflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered sequence of record headers. Duplicate keys are allowed and
 * keep their insertion order; lookups return the last value for a key.
 *
 * <p>Every mutator returns a new instance.
 */
public final class Headers implements Iterable<Header> {
  public static final Headers EMPTY = new Headers(List.of());

  private final List<Header> headers;

  private Headers(List<Header> headers) {
    this.headers = headers;
  }

  public static Headers of(List<Header> headers) {
    Objects.requireNonNull(headers, "headers");
    if (headers.isEmpty()) {
      return EMPTY;
    }
    for (Header header : headers) {
      Objects.requireNonNull(header, "headers cannot contain null elements");
    }
    return new Headers(Collections.unmodifiableList(new ArrayList<>(headers)));
  }

  public static Headers of(Header... headers) {
    return of(List.of(headers));
  }

  /**
   * Returns a copy with {@code header} appended.
   */
  public Headers with(Header header) {
    Objects.requireNonNull(header, "header");
    List<Header> copy = new ArrayList<>(headers.size() + 1);
    copy.addAll(headers);
    copy.add(header);
    return new Headers(Collections.unmodifiableList(copy));
  }

  public Headers with(String key, byte[] value) {
    return with(new Header(key, value));
  }

  public Headers withString(String key, String value) {
    return with(Header.ofString(key, value));
  }

  /**
   * Returns a copy without any header named {@code key}.
   */
  public Headers without(String key) {
    Objects.requireNonNull(key, "key");
    List<Header> copy = new ArrayList<>(headers.size());
    for (Header header : headers) {
      if (!header.key().equals(key)) {
        copy.add(header);
      }
    }
    if (copy.size() == headers.size()) {
      return this;
    }
    return copy.isEmpty() ? EMPTY : new Headers(Collections.unmodifiableList(copy));
  }

  public Optional<byte[]> lastValue(String key) {
    return lastHeader(key).map(Header::value);
  }

  public Optional<String> lastString(String key) {
    return lastHeader(key).map(Header::valueAsString);
  }

  private Optional<Header> lastHeader(String key) {
    Objects.requireNonNull(key, "key");
    for (int i = headers.size() - 1; i >= 0; i--) {
      Header header = headers.get(i);
      if (header.key().equals(key)) {
        return Optional.of(header);
      }
    }
    return Optional.empty();
  }

  public List<Header> asList() {
    return headers;
  }

  public int size() {
    return headers.size();
  }

  public boolean isEmpty() {
    return headers.isEmpty();
  }

  @Override
  public Iterator<Header> iterator() {
    return headers.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Headers other)) return false;
    return headers.equals(other.headers);
  }

  @Override
  public int hashCode() {
    return headers.hashCode();
  }

  @Override
  public String toString() {
    return "Headers" + headers;
  }
}
