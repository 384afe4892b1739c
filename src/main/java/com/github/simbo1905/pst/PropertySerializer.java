package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.*;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Writes a [PropertySet] into a block payload and reads it back.
///
/// Payload: record count u32, then per record the tag u32 and a value chosen by the low
/// 16 bits of the tag:
/// - `0x001F` text: byte length u32 + UTF-16LE, cut to `maxStringChars` characters
/// - `0x0003` integer: u32
/// - `0x0040` FILETIME: u64 ticks
/// - anything else: byte length u32 + UTF-8 of the value's text form, cut to `maxFallbackChars`
///
/// A record that would not fit in the remaining capacity is dropped whole and the count
/// reflects only what was written. This is lossy on purpose: nothing spills into
/// neighbouring data.
final class PropertySerializer {

  private static final Logger logger = Logger.getLogger(PropertySerializer.class.getName());

  private final int maxStringChars;
  private final int maxFallbackChars;
  private final int capacity;

  PropertySerializer(int maxStringChars, int maxFallbackChars, int capacity) {
    if (capacity < Integer.BYTES) {
      throw new IllegalArgumentException("capacity must hold the record count, got " + capacity);
    }
    this.maxStringChars = maxStringChars;
    this.maxFallbackChars = maxFallbackChars;
    this.capacity = capacity;
  }

  PropertySerializer(PstConfig config) {
    this(config.maxStringChars(), config.maxFallbackChars(), config.propertyBufferBytes());
  }

  byte[] serialize(PropertySet properties) {
    final byte[] buffer = new byte[capacity];
    int pos = Integer.BYTES;
    int written = 0;
    for (Map.Entry<PropertyTag, PropertyValue> entry : properties.asMap().entrySet()) {
      final PropertyTag tag = entry.getKey();
      final byte[] value = encodeValue(tag, entry.getValue());
      final int needed = Integer.BYTES + value.length;
      if (pos + needed > buffer.length) {
        final int remaining = buffer.length - pos;
        logger.log(
            Level.FINE,
            () -> String.format("Dropping property %s: needs %d bytes, %d left", tag, needed, remaining));
        continue;
      }
      putU32(buffer, pos, tag.value());
      System.arraycopy(value, 0, buffer, pos + Integer.BYTES, value.length);
      pos += needed;
      written++;
    }
    putU32(buffer, 0, written);
    return java.util.Arrays.copyOf(buffer, pos);
  }

  private byte[] encodeValue(PropertyTag tag, PropertyValue value) {
    switch (tag.type()) {
      case PropertyTag.TYPE_UNICODE:
        return lengthPrefixed(truncate(value.asText(), maxStringChars).getBytes(StandardCharsets.UTF_16LE));
      case PropertyTag.TYPE_INTEGER32:
        {
          final byte[] bytes = new byte[Integer.BYTES];
          putU32(bytes, 0, ((PropertyValue.U32) value).value());
          return bytes;
        }
      case PropertyTag.TYPE_SYSTIME:
        {
          final byte[] bytes = new byte[Long.BYTES];
          putU64(bytes, 0, ((PropertyValue.FileTime) value).ticks());
          return bytes;
        }
      default:
        return lengthPrefixed(truncate(value.asText(), maxFallbackChars).getBytes(StandardCharsets.UTF_8));
    }
  }

  private static byte[] lengthPrefixed(byte[] data) {
    final byte[] bytes = new byte[Integer.BYTES + data.length];
    putU32(bytes, 0, data.length);
    System.arraycopy(data, 0, bytes, Integer.BYTES, data.length);
    return bytes;
  }

  /// Cuts to at most `max` chars without splitting a surrogate pair.
  static String truncate(String s, int max) {
    if (s.length() <= max) {
      return s;
    }
    int end = max;
    if (end > 0 && Character.isHighSurrogate(s.charAt(end - 1))) {
      end--;
    }
    return s.substring(0, end);
  }

  PropertySet deserialize(byte[] payload) {
    return deserialize(payload, 0, payload.length, 0);
  }

  /// Reads the records stored at `bytes[off, off + len)`.
  ///
  /// @param fileOffset where the payload sits in the image, for error reports
  /// @throws TruncatedBlockException if a record runs past `len`
  PropertySet deserialize(byte[] bytes, int off, int len, long fileOffset) {
    final int end = off + len;
    require(off, Integer.BYTES, end, fileOffset, off);
    final long count = u32(bytes, off);
    int pos = off + Integer.BYTES;
    final PropertySet properties = new PropertySet();
    for (long i = 0; i < count; i++) {
      require(pos, Integer.BYTES, end, fileOffset, off);
      final PropertyTag tag = PropertyTag.of(i32(bytes, pos));
      pos += Integer.BYTES;
      switch (tag.type()) {
        case PropertyTag.TYPE_INTEGER32:
          require(pos, Integer.BYTES, end, fileOffset, off);
          properties.put(tag, PropertyValue.of(u32(bytes, pos)));
          pos += Integer.BYTES;
          break;
        case PropertyTag.TYPE_SYSTIME:
          require(pos, Long.BYTES, end, fileOffset, off);
          properties.put(tag, new PropertyValue.FileTime(u64(bytes, pos)));
          pos += Long.BYTES;
          break;
        default:
          {
            require(pos, Integer.BYTES, end, fileOffset, off);
            final long length = u32(bytes, pos);
            pos += Integer.BYTES;
            require(pos, length, end, fileOffset, off);
            final String text =
                new String(
                    bytes,
                    pos,
                    (int) length,
                    tag.type() == PropertyTag.TYPE_UNICODE
                        ? StandardCharsets.UTF_16LE
                        : StandardCharsets.UTF_8);
            properties.put(tag, PropertyValue.of(text));
            pos += (int) length;
          }
      }
    }
    return properties;
  }

  private static void require(int pos, long needed, int end, long fileOffset, int base) {
    if (pos + needed > end) {
      throw new TruncatedBlockException(fileOffset + (pos - base), needed, Math.max(0, end - pos));
    }
  }
}
