package com.github.simbo1905.pst;

import lombok.Getter;

/// One index refers to something the other index (or the block payload) does not have.
/// The usual case is an NBT entry whose data block id is absent from the BBT.
public class DanglingReferenceException extends PstFormatException {

  /// Node id on the referring side, or 0 when the reference starts from the BBT.
  @Getter private final int nodeId;

  @Getter private final long blockId;

  public DanglingReferenceException(int nodeId, long blockId, String message) {
    super(message);
    this.nodeId = nodeId;
    this.blockId = blockId;
  }

  static DanglingReferenceException missingBlock(int nodeId, long blockId) {
    return new DanglingReferenceException(
        nodeId,
        blockId,
        String.format("node 0x%X references block 0x%X which is not in the BBT", nodeId, blockId));
  }
}
