package com.github.simbo1905.pst;

/// One Node B-Tree entry: where a node's properties live and who its parent is.
///
/// @param nodeId key of the NBT
/// @param blockId data block holding the node's serialised properties; must be a BBT key
/// @param subnodeBlockId subnode block, 0 when the node has none
/// @param parentNodeId 0 for top-level nodes, otherwise an existing node id
public record NbtEntry(int nodeId, long blockId, long subnodeBlockId, int parentNodeId) {

  /// Node ids are unsigned on disk; sort them that way.
  long key() {
    return nodeId & 0xFFFFFFFFL;
  }
}
