package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Hands out block ids and appends framed payloads to an arena that starts right after the
/// file header. Growth is append-only: nothing is compacted or reused.
///
/// Frame layout: block id u32, payload size u32, block type u32, reserved u32, then the
/// payload, zero padded to a multiple of [#BLOCK_SIZE].
class BlockAllocator {

  private static final Logger logger = Logger.getLogger(BlockAllocator.class.getName());

  static final int BLOCK_SIZE = 512;
  static final int FRAME_HEADER_SIZE = 16;

  /// Ids below this are left for fixed system use.
  static final long FIRST_BLOCK_ID = 0x100;

  private final int baseOffset;
  private final BlockArena arena = new BlockArena(64 * BLOCK_SIZE);
  private final Map<Long, AllocatedBlock> index = new LinkedHashMap<>();
  private long nextBlockId = FIRST_BLOCK_ID;

  /// @param baseOffset where the first block lands, the header size of the target layout
  BlockAllocator(int baseOffset) {
    this.baseOffset = baseOffset;
  }

  /// Aligned on-disk size of a block carrying `payloadSize` bytes.
  static long framedSize(int payloadSize) {
    return alignUp((long) FRAME_HEADER_SIZE + payloadSize, BLOCK_SIZE);
  }

  long allocate(byte[] payload) {
    return allocate(payload, BlockType.DATA);
  }

  /// Frames `payload`, appends it and records where it went.
  ///
  /// @return the new block id
  long allocate(byte[] payload, BlockType type) {
    final long blockId = nextBlockId++;
    final long offset = nextOffset();
    final long size = framedSize(payload.length);
    if (offset + size > Integer.MAX_VALUE) {
      throw new IllegalStateException(
          String.format("image would exceed %d bytes at block 0x%X", Integer.MAX_VALUE, blockId));
    }
    final byte[] framed = new byte[(int) size];
    putU32(framed, 0, blockId);
    putU32(framed, 4, payload.length);
    putU32(framed, 8, type.code());
    System.arraycopy(payload, 0, framed, FRAME_HEADER_SIZE, payload.length);
    arena.write(framed, 0, framed.length);

    final AllocatedBlock block = new AllocatedBlock(blockId, offset, size, payload.length, type);
    index.put(blockId, block);
    logger.log(
        Level.FINEST,
        () -> String.format("Allocated %s", block));
    return blockId;
  }

  /// The id the next call to [#allocate] will return.
  long peekNextBlockId() {
    return nextBlockId;
  }

  /// The file offset the next block will be written at.
  long nextOffset() {
    return baseOffset + (long) arena.size();
  }

  Optional<AllocatedBlock> lookup(long blockId) {
    return Optional.ofNullable(index.get(blockId));
  }

  /// Every block in allocation order.
  List<AllocatedBlock> blocks() {
    return Collections.unmodifiableList(new ArrayList<>(index.values()));
  }

  int blockCount() {
    return index.size();
  }

  long totalSize() {
    return nextOffset();
  }

  /// Total payload bytes across all blocks, for the header density byte.
  long payloadBytes() {
    long sum = 0;
    for (AllocatedBlock block : index.values()) {
      sum += block.payloadSize();
    }
    return sum;
  }

  /// A zeroed header placeholder followed by every block in allocation order.
  byte[] render() {
    final byte[] image = new byte[(int) totalSize()];
    arena.copyTo(image, baseOffset);
    return image;
  }
}
