package ca.gc.cra.sbuild.domain.descriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered YAML mapping that keeps every entry, including repeated keys.
 * <p><strong>Why:</strong> Plain {@link Map} implementations collapse repeated keys, which would hide the
 * duplicates the linter must report.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class RawMapping {
  private static final RawMapping EMPTY = new RawMapping(List.of());

  private final List<Entry> entries;

  /**
   * Creates a mapping from entries in source order.
   *
   * @param entries entries in source order; copied
   */
  public RawMapping(List<Entry> entries) {
    this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
  }

  /**
   * Returns an empty mapping.
   *
   * @return shared empty instance
   */
  public static RawMapping empty() {
    return EMPTY;
  }

  /**
   * Returns all entries in source order, repeated keys included.
   *
   * @return immutable entry list
   */
  public List<Entry> entries() {
    return entries;
  }

  /**
   * Returns the value of the first entry with the given key.
   *
   * @param key entry key
   * @return value or {@code null} when absent (or explicitly null)
   */
  public Object get(String key) {
    for (Entry entry : entries) {
      if (entry.key().equals(key)) {
        return entry.value();
      }
    }
    return null;
  }

  /**
   * Reports whether any entry uses the key.
   *
   * @param key entry key
   * @return {@code true} when present
   */
  public boolean containsKey(String key) {
    for (Entry entry : entries) {
      if (entry.key().equals(key)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the keys in source order, repeated keys included.
   *
   * @return immutable key list
   */
  public List<String> keys() {
    List<String> keys = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      keys.add(entry.key());
    }
    return List.copyOf(keys);
  }

  /**
   * Number of entries, repeated keys included.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Indicates whether the mapping has no entries.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Collapses the mapping into a plain ordered map; the first entry wins for repeated keys and nested
   * mappings are collapsed recursively.
   *
   * @return mutable ordered map
   */
  public Map<String, Object> toPlainMap() {
    Map<String, Object> plain = new LinkedHashMap<>();
    for (Entry entry : entries) {
      plain.putIfAbsent(entry.key(), toPlain(entry.value()));
    }
    return plain;
  }

  static Object toPlain(Object value) {
    if (value instanceof RawMapping nested) {
      return nested.toPlainMap();
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(toPlain(item));
      }
      return copy;
    }
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof RawMapping that && entries.equals(that.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "RawMapping" + entries;
  }

  /**
   * Single mapping entry.
   *
   * @param key entry key rendered as a string
   * @param value scalar, {@link List}, nested {@link RawMapping}, or {@code null}
   */
  public record Entry(String key, Object value) {
    /**
     * Validates the key.
     */
    public Entry {
      Objects.requireNonNull(key, "key");
    }
  }
}
