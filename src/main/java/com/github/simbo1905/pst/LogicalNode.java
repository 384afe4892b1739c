package com.github.simbo1905.pst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/// A folder, message, message store or name-to-id map, owned by a [NodeStore].
@Getter
@ToString(exclude = "properties")
public final class LogicalNode {

  private final int nodeId;
  private final NodeKind kind;
  private final PropertySet properties;
  private final int parentNodeId;

  @Getter(lombok.AccessLevel.NONE)
  private final List<Integer> children = new ArrayList<>();

  LogicalNode(int nodeId, NodeKind kind, PropertySet properties, int parentNodeId) {
    this.nodeId = nodeId;
    this.kind = kind;
    this.properties = properties;
    this.parentNodeId = parentNodeId;
  }

  /// Child node ids in the order they were added.
  public List<Integer> children() {
    return Collections.unmodifiableList(children);
  }

  public boolean isFolder() {
    return kind == NodeKind.FOLDER;
  }

  public String displayName() {
    return properties
        .getString(PropertyTags.DISPLAY_NAME)
        .orElseGet(() -> properties.getString(PropertyTags.SUBJECT).orElse(""));
  }

  void addChild(int childNodeId) {
    children.add(childNodeId);
  }
}
