package com.github.simbo1905.pst;

/// What a logical node represents.
public enum NodeKind {
  MESSAGE_STORE,
  NAME_TO_ID_MAP,
  FOLDER,
  MESSAGE,
  /// Any other node type met while reading a foreign image.
  OTHER;

  /// Recovers the kind from a node id alone, as a reader must.
  public static NodeKind fromNodeId(int nodeId) {
    if (nodeId == NodeIds.MESSAGE_STORE) {
      return MESSAGE_STORE;
    }
    if (nodeId == NodeIds.NAME_TO_ID_MAP) {
      return NAME_TO_ID_MAP;
    }
    switch (NodeIds.type(nodeId)) {
      case NodeIds.TYPE_FOLDER:
        return FOLDER;
      case NodeIds.TYPE_MESSAGE:
        return MESSAGE;
      default:
        return OTHER;
    }
  }
}
