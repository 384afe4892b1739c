package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.*;

/// Fixed-size serialisation of one B-tree entry type. Pages are generic over this.
///
/// @param <E> the entry record
interface EntryLayout<E> {

  int entrySize();

  /// Sort key, compared as an unsigned value.
  long key(E entry);

  void write(byte[] page, int off, E entry);

  E read(byte[] page, int off);

  /// nid u32, pad u32, bid u64, subnode bid u64, parent nid u32, pad u32.
  EntryLayout<NbtEntry> UNICODE_NBT =
      new EntryLayout<>() {
        @Override
        public int entrySize() {
          return 32;
        }

        @Override
        public long key(NbtEntry entry) {
          return entry.key();
        }

        @Override
        public void write(byte[] page, int off, NbtEntry e) {
          putU32(page, off, e.nodeId());
          putU64(page, off + 8, e.blockId());
          putU64(page, off + 16, e.subnodeBlockId());
          putU32(page, off + 24, e.parentNodeId());
        }

        @Override
        public NbtEntry read(byte[] page, int off) {
          return new NbtEntry(
              i32(page, off), u64(page, off + 8), u64(page, off + 16), i32(page, off + 24));
        }
      };

  /// bid u64, offset u64, ref count u16, pad u16, aligned size u32.
  EntryLayout<BbtEntry> UNICODE_BBT =
      new EntryLayout<>() {
        @Override
        public int entrySize() {
          return 24;
        }

        @Override
        public long key(BbtEntry entry) {
          return entry.blockId();
        }

        @Override
        public void write(byte[] page, int off, BbtEntry e) {
          putU64(page, off, e.blockId());
          putU64(page, off + 8, e.offset());
          putU16(page, off + 16, e.refCount());
          putU32(page, off + 20, e.size());
        }

        @Override
        public BbtEntry read(byte[] page, int off) {
          return new BbtEntry(u64(page, off), u64(page, off + 8), u32(page, off + 20), u16(page, off + 16));
        }
      };

  /// nid, bid, subnode bid, parent nid; all u32.
  EntryLayout<NbtEntry> ANSI_NBT =
      new EntryLayout<>() {
        @Override
        public int entrySize() {
          return 16;
        }

        @Override
        public long key(NbtEntry entry) {
          return entry.key();
        }

        @Override
        public void write(byte[] page, int off, NbtEntry e) {
          putU32(page, off, e.nodeId());
          putU32(page, off + 4, e.blockId());
          putU32(page, off + 8, e.subnodeBlockId());
          putU32(page, off + 12, e.parentNodeId());
        }

        @Override
        public NbtEntry read(byte[] page, int off) {
          return new NbtEntry(
              i32(page, off), u32(page, off + 4), u32(page, off + 8), i32(page, off + 12));
        }
      };

  /// bid u32, offset u32, ref count u16, pad u16. The block size is not stored and reads
  /// back as 0; the parser derives it from the block frame.
  EntryLayout<BbtEntry> ANSI_BBT =
      new EntryLayout<>() {
        @Override
        public int entrySize() {
          return 12;
        }

        @Override
        public long key(BbtEntry entry) {
          return entry.blockId();
        }

        @Override
        public void write(byte[] page, int off, BbtEntry e) {
          putU32(page, off, e.blockId());
          putU32(page, off + 4, e.offset());
          putU16(page, off + 8, e.refCount());
        }

        @Override
        public BbtEntry read(byte[] page, int off) {
          return new BbtEntry(u32(page, off), u32(page, off + 4), 0, u16(page, off + 8));
        }
      };
}
