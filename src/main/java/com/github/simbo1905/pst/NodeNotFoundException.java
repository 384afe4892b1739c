package com.github.simbo1905.pst;

import java.util.NoSuchElementException;
import lombok.Getter;

/// The node id is not present in the NBT.
public class NodeNotFoundException extends NoSuchElementException {

  @Getter private final int nodeId;

  public NodeNotFoundException(int nodeId) {
    super(String.format("node 0x%X not found in the NBT", nodeId));
    this.nodeId = nodeId;
  }
}
