package com.github.simbo1905.pst;

/// A MAPI-style property tag: property id in the high 16 bits, type code in the low 16.
public record PropertyTag(int id, int type) implements Comparable<PropertyTag> {

  public static final int TYPE_INTEGER32 = 0x0003;
  public static final int TYPE_SYSTIME = 0x0040;
  public static final int TYPE_UNICODE = 0x001F;

  public PropertyTag {
    if (id < 0 || id > 0xFFFF || type < 0 || type > 0xFFFF) {
      throw new IllegalArgumentException(
          String.format("property id 0x%X and type 0x%X must each fit 16 bits", id, type));
    }
  }

  public static PropertyTag of(int tag) {
    return new PropertyTag(tag >>> 16, tag & 0xFFFF);
  }

  /// The 32-bit tag as written on disk.
  public int value() {
    return id << 16 | type;
  }

  /// True when values of this tag are written by one of the typed encodings rather than
  /// the text fallback.
  public boolean isKnownType() {
    return type == TYPE_UNICODE || type == TYPE_INTEGER32 || type == TYPE_SYSTIME;
  }

  @Override
  public int compareTo(PropertyTag other) {
    return Integer.compareUnsigned(value(), other.value());
  }

  @Override
  public String toString() {
    return String.format("0x%08X", value());
  }
}
