package com.github.simbo1905.pst;

/// One Block B-Tree entry: where a block lives in the file.
///
/// @param blockId key of the BBT
/// @param offset absolute file offset of the block frame
/// @param size aligned byte size of the framed block on disk
/// @param refCount 1 for blocks reachable from the current indexes, 0 for superseded ones
public record BbtEntry(long blockId, long offset, long size, int refCount) {

  BbtEntry withSize(long newSize) {
    return new BbtEntry(blockId, offset, newSize, refCount);
  }

  long end() {
    return offset + size;
  }
}
