package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Page format shared by the NBT and the BBT: a 16-byte page header (type u8, level u8,
/// entry count u16, 12 reserved bytes) followed by fixed-size entries, padded to at least
/// one 512-byte block. Only single-level leaf pages are written or read.
final class BTreeCodec {

  private static final Logger logger = Logger.getLogger(BTreeCodec.class.getName());

  static final int PAGE_HEADER_SIZE = 16;
  static final int LEAF_PAGE = 0x81;
  static final int INTERMEDIATE_PAGE = 0x80;
  static final int LEAF_LEVEL = 0;
  static final int MAX_ENTRIES = 0xFFFF;

  private BTreeCodec() {}

  /// Bytes a page with `count` entries occupies before block framing.
  static int pageLength(int count, EntryLayout<?> layout) {
    return Math.max(PAGE_HEADER_SIZE + count * layout.entrySize(), BlockAllocator.BLOCK_SIZE);
  }

  /// Encodes a leaf page. Entries must already be strictly ascending by key; the caller
  /// sorts, this method only checks.
  static <E> byte[] encodePage(List<E> entries, EntryLayout<E> layout) {
    if (entries.size() > MAX_ENTRIES) {
      throw new IllegalArgumentException(
          String.format(
              "%d entries exceed the single-level page limit of %d", entries.size(), MAX_ENTRIES));
    }
    final byte[] page = new byte[pageLength(entries.size(), layout)];
    putU8(page, 0, LEAF_PAGE);
    putU8(page, 1, LEAF_LEVEL);
    putU16(page, 2, entries.size());

    long previous = 0;
    int off = PAGE_HEADER_SIZE;
    for (E entry : entries) {
      final long key = layout.key(entry);
      if (off > PAGE_HEADER_SIZE && Long.compareUnsigned(key, previous) <= 0) {
        throw new IllegalArgumentException(
            String.format("page entries not strictly ascending: 0x%X after 0x%X", key, previous));
      }
      previous = key;
      layout.write(page, off, entry);
      off += layout.entrySize();
    }
    logger.log(
        Level.FINEST,
        () -> String.format("Encoded leaf page entries=%d bytes=%d", entries.size(), page.length));
    return page;
  }

  static <E> BTreePage<E> decodePage(byte[] page, EntryLayout<E> layout) {
    return decodePage(page, 0, page.length, 0, layout);
  }

  /// Decodes the page stored at `bytes[off, off + len)`.
  ///
  /// @param fileOffset where the page sits in the image, for error reports
  /// @throws TruncatedPageException if the declared entries run past `len`
  /// @throws PstFormatException for intermediate or unknown page types
  static <E> BTreePage<E> decodePage(
      byte[] bytes, int off, int len, long fileOffset, EntryLayout<E> layout) {
    if (len < PAGE_HEADER_SIZE) {
      throw new TruncatedPageException(fileOffset, PAGE_HEADER_SIZE, len);
    }
    final int pageType = u8(bytes, off);
    final int level = u8(bytes, off + 1);
    final int count = u16(bytes, off + 2);
    if (pageType == INTERMEDIATE_PAGE) {
      throw new PstFormatException(
          String.format("multi-level b-tree page at offset %d is not supported", fileOffset));
    }
    if (pageType != LEAF_PAGE) {
      throw new PstFormatException(
          String.format("unknown b-tree page type 0x%02X at offset %d", pageType, fileOffset));
    }
    final long required = PAGE_HEADER_SIZE + (long) count * layout.entrySize();
    if (required > len) {
      throw new TruncatedPageException(fileOffset, required, len);
    }
    List<E> entries = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      entries.add(layout.read(bytes, off + PAGE_HEADER_SIZE + i * layout.entrySize()));
    }
    return new BTreePage<>(pageType, level, entries);
  }

  /// True when keys are strictly ascending as unsigned values.
  static <E> boolean isStrictlyAscending(List<E> entries, EntryLayout<E> layout) {
    for (int i = 1; i < entries.size(); i++) {
      if (Long.compareUnsigned(layout.key(entries.get(i)), layout.key(entries.get(i - 1))) <= 0) {
        return false;
      }
    }
    return true;
  }
}
