package com.github.simbo1905.pst;

/// Index entry the allocator keeps for every block it appended.
///
/// @param blockId id handed out by [BlockAllocator#allocate]
/// @param offset absolute file offset of the frame
/// @param size aligned on-disk size including the frame header
/// @param payloadSize bytes of payload declared in the frame
/// @param type frame type tag
record AllocatedBlock(long blockId, long offset, long size, int payloadSize, BlockType type) {

  BlockLocation location() {
    return new BlockLocation(offset, size);
  }
}
