package com.github.simbo1905.pst;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/// Property tag to typed value, one value per tag. Iteration is in ascending tag order so
/// that serialising the same set twice gives the same bytes.
@EqualsAndHashCode
@ToString
public final class PropertySet {

  private final TreeMap<PropertyTag, PropertyValue> values = new TreeMap<>();

  /// Stores `value` under `tag`, replacing any previous value.
  ///
  /// @throws IllegalArgumentException if the tag has a typed encoding that does not match
  public PropertySet put(PropertyTag tag, PropertyValue value) {
    if (!accepts(tag, value)) {
      throw new IllegalArgumentException(
          String.format(
              "tag %s of type 0x%04X cannot hold %s", tag, tag.type(), value.getClass().getSimpleName()));
    }
    values.put(tag, value);
    return this;
  }

  public PropertySet putString(PropertyTag tag, String value) {
    return put(tag, PropertyValue.of(value));
  }

  public PropertySet putInt(PropertyTag tag, long value) {
    return put(tag, PropertyValue.of(value));
  }

  public PropertySet putTime(PropertyTag tag, Instant value) {
    return put(tag, PropertyValue.of(value));
  }

  public Optional<PropertyValue> get(PropertyTag tag) {
    return Optional.ofNullable(values.get(tag));
  }

  public Optional<String> getString(PropertyTag tag) {
    return get(tag).map(PropertyValue::asText);
  }

  public Optional<Long> getInt(PropertyTag tag) {
    return get(tag)
        .filter(PropertyValue.U32.class::isInstance)
        .map(v -> ((PropertyValue.U32) v).value());
  }

  public Optional<Instant> getTime(PropertyTag tag) {
    return get(tag)
        .filter(PropertyValue.FileTime.class::isInstance)
        .map(v -> ((PropertyValue.FileTime) v).toInstant());
  }

  public boolean contains(PropertyTag tag) {
    return values.containsKey(tag);
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<PropertyTag, PropertyValue> asMap() {
    return Collections.unmodifiableMap(values);
  }

  static boolean accepts(PropertyTag tag, PropertyValue value) {
    switch (tag.type()) {
      case PropertyTag.TYPE_UNICODE:
        return value instanceof PropertyValue.Str;
      case PropertyTag.TYPE_INTEGER32:
        return value instanceof PropertyValue.U32;
      case PropertyTag.TYPE_SYSTIME:
        return value instanceof PropertyValue.FileTime;
      default:
        return true;
    }
  }
}
