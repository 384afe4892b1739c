package com.github.simbo1905.pst;

import lombok.Getter;

/// A node id was registered twice.
public class DuplicateNodeException extends IllegalArgumentException {

  @Getter private final int nodeId;

  public DuplicateNodeException(int nodeId) {
    super(String.format("node 0x%X already exists", nodeId));
    this.nodeId = nodeId;
  }
}
