package com.github.simbo1905.pst;

import java.time.Instant;

/// A typed property value. Closed: a value is text, an unsigned 32-bit integer or a
/// Windows FILETIME.
public sealed interface PropertyValue permits PropertyValue.Str, PropertyValue.U32, PropertyValue.FileTime {

  /// Milliseconds between 1601-01-01 and 1970-01-01.
  long EPOCH_DELTA_MILLIS = 11_644_473_600_000L;

  long TICKS_PER_MILLI = 10_000L;

  /// Text form, used when a value sits under a tag whose type has no typed encoding.
  String asText();

  static Str of(String value) {
    return new Str(value);
  }

  static U32 of(long value) {
    return new U32(value);
  }

  static FileTime of(Instant value) {
    return FileTime.of(value);
  }

  record Str(String value) implements PropertyValue {
    public Str {
      java.util.Objects.requireNonNull(value, "value");
    }

    @Override
    public String asText() {
      return value;
    }
  }

  record U32(long value) implements PropertyValue {
    public U32 {
      if (value < 0 || value > 0xFFFFFFFFL) {
        throw new IllegalArgumentException("not an unsigned 32-bit value: " + value);
      }
    }

    @Override
    public String asText() {
      return Long.toString(value);
    }
  }

  /// 100-nanosecond ticks since 1601-01-01 UTC.
  record FileTime(long ticks) implements PropertyValue {

    /// Millisecond precision, matching what the encoder keeps.
    public static FileTime of(Instant instant) {
      return new FileTime((instant.toEpochMilli() + EPOCH_DELTA_MILLIS) * TICKS_PER_MILLI);
    }

    public Instant toInstant() {
      return Instant.ofEpochMilli(Math.floorDiv(ticks, TICKS_PER_MILLI) - EPOCH_DELTA_MILLIS)
          .plusNanos(Math.floorMod(ticks, TICKS_PER_MILLI) * 100);
    }

    @Override
    public String asText() {
      return toInstant().toString();
    }
  }
}
