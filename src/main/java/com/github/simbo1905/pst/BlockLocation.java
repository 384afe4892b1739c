package com.github.simbo1905.pst;

/// A byte range in the image: where a framed block (or a B-tree page block) starts and how
/// long it is on disk.
public record BlockLocation(long offset, long size) {

  public static final BlockLocation NONE = new BlockLocation(0, 0);

  public long end() {
    return offset + size;
  }

  public boolean overlaps(BlockLocation other) {
    return offset < other.end() && other.offset < end();
  }
}
