package com.github.simbo1905.pst;

/// Header offsets and index entry layouts for one on-disk variant. Selected once when a
/// header is decoded (from the version field) or when a builder is configured.
public enum FormatLayout {
  /// Outlook 97-2002 layout: 32-bit sizes and locators.
  ANSI(516, 14, 4, 44, 60, 64, 68, 72, 76, EntryLayout.ANSI_NBT, EntryLayout.ANSI_BBT),

  /// Outlook 2003+ layout: 64-bit sizes and locators.
  UNICODE(564, 36, 8, 44, 240, 248, 256, 264, 272, EntryLayout.UNICODE_NBT, EntryLayout.UNICODE_BBT);

  /// Versions at or above this value select the Unicode layout.
  static final int UNICODE_MIN_VERSION = 23;

  final int headerSize;
  /// Version written by builders that emit this layout.
  final int defaultVersion;
  /// Width in bytes of total size and locator fields.
  final int fieldWidth;
  final int totalSizeOffset;
  final int nbtOffsetOffset;
  final int nbtSizeOffset;
  final int bbtOffsetOffset;
  final int bbtSizeOffset;
  final int densityOffset;
  final EntryLayout<NbtEntry> nbtLayout;
  final EntryLayout<BbtEntry> bbtLayout;

  FormatLayout(
      int headerSize,
      int defaultVersion,
      int fieldWidth,
      int totalSizeOffset,
      int nbtOffsetOffset,
      int nbtSizeOffset,
      int bbtOffsetOffset,
      int bbtSizeOffset,
      int densityOffset,
      EntryLayout<NbtEntry> nbtLayout,
      EntryLayout<BbtEntry> bbtLayout) {
    this.headerSize = headerSize;
    this.defaultVersion = defaultVersion;
    this.fieldWidth = fieldWidth;
    this.totalSizeOffset = totalSizeOffset;
    this.nbtOffsetOffset = nbtOffsetOffset;
    this.nbtSizeOffset = nbtSizeOffset;
    this.bbtOffsetOffset = bbtOffsetOffset;
    this.bbtSizeOffset = bbtSizeOffset;
    this.densityOffset = densityOffset;
    this.nbtLayout = nbtLayout;
    this.bbtLayout = bbtLayout;
  }

  public static FormatLayout forVersion(int version) {
    return version >= UNICODE_MIN_VERSION ? UNICODE : ANSI;
  }

  public int headerSize() {
    return headerSize;
  }

  public boolean isUnicode() {
    return this == UNICODE;
  }

  EntryLayout<NbtEntry> nbtLayout() {
    return nbtLayout;
  }

  EntryLayout<BbtEntry> bbtLayout() {
    return bbtLayout;
  }

  /// Largest value a size or locator field can hold in this layout.
  long maxFieldValue() {
    return fieldWidth == Long.BYTES ? Long.MAX_VALUE : 0xFFFFFFFFL;
  }

  long readField(byte[] header, int off) {
    return fieldWidth == Long.BYTES ? LittleEndian.u64(header, off) : LittleEndian.u32(header, off);
  }

  void writeField(byte[] header, int off, long value) {
    if (value < 0 || value > maxFieldValue()) {
      throw new IllegalArgumentException(
          String.format("%s layout cannot hold value %d at header offset %d", this, value, off));
    }
    if (fieldWidth == Long.BYTES) {
      LittleEndian.putU64(header, off, value);
    } else {
      LittleEndian.putU32(header, off, value);
    }
  }
}
