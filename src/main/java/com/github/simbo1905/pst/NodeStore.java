package com.github.simbo1905.pst;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// In-memory table of logical nodes: node id to node, with parent links and child lists
/// forming the folder tree. The store is the only place node ids are handed out.
public class NodeStore {

  private static final Logger logger = Logger.getLogger(NodeStore.class.getName());

  static final String MESSAGE_CLASS_NOTE = "IPM.Note";
  static final String CONTAINER_CLASS_NOTE = "IPF.Note";

  private final TreeMap<Integer, LogicalNode> nodes = new TreeMap<>(Integer::compareUnsigned);
  private final Clock clock;
  private int nextIndex = NodeIds.FIRST_DYNAMIC_INDEX;

  public NodeStore() {
    this(Clock.systemUTC());
  }

  NodeStore(Clock clock) {
    this.clock = clock;
  }

  /// Registers a node.
  ///
  /// @param parentNodeId 0 for a top-level node, otherwise a registered node id
  /// @throws DuplicateNodeException if `nodeId` is already registered
  /// @throws UnknownFolderException if the parent is not registered
  public LogicalNode createNode(
      int nodeId, NodeKind kind, PropertySet properties, int parentNodeId) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(properties, "properties");
    if (nodes.containsKey(nodeId)) {
      throw new DuplicateNodeException(nodeId);
    }
    final LogicalNode parent = parentNodeId == 0 ? null : nodes.get(parentNodeId);
    if (parentNodeId != 0 && parent == null) {
      throw new UnknownFolderException(parentNodeId);
    }
    final LogicalNode node = new LogicalNode(nodeId, kind, properties, parentNodeId);
    nodes.put(nodeId, node);
    if (parent != null) {
      parent.addChild(nodeId);
    }
    logger.log(
        Level.FINER,
        () -> String.format("createNode nid=0x%X kind=%s parent=0x%X", nodeId, kind, parentNodeId));
    return node;
  }

  /// Creates a folder under `parentNodeId` with the next free folder id.
  public int addFolder(int parentNodeId, String displayName) {
    requireFolder(parentNodeId);
    final int nodeId = nextNodeId(NodeIds.TYPE_FOLDER);
    createNode(nodeId, NodeKind.FOLDER, folderProperties(displayName), parentNodeId);
    return nodeId;
  }

  /// Creates a message in `folderNodeId` with the next free message id.
  ///
  /// @param htmlBody may be null
  /// @throws UnknownFolderException if `folderNodeId` is not a registered folder
  public int addMessage(
      int folderNodeId, String subject, String sender, String body, String htmlBody) {
    requireFolder(folderNodeId);
    final String safeBody = Objects.requireNonNullElse(body, "");
    final String safeSender = Objects.requireNonNullElse(sender, "");
    final Instant now = clock.instant();

    final PropertySet properties =
        new PropertySet()
            .putString(PropertyTags.MESSAGE_CLASS, MESSAGE_CLASS_NOTE)
            .putString(PropertyTags.SUBJECT, Objects.requireNonNullElse(subject, ""))
            .putString(PropertyTags.SENDER_NAME, safeSender)
            .putTime(PropertyTags.CREATION_TIME, now)
            .putTime(PropertyTags.LAST_MODIFICATION_TIME, now)
            .putString(PropertyTags.BODY, safeBody)
            .putInt(PropertyTags.MESSAGE_SIZE, safeBody.length());
    if (safeSender.contains("@")) {
      properties.putString(PropertyTags.SENDER_EMAIL, safeSender);
    }
    if (htmlBody != null) {
      properties.putString(PropertyTags.BODY_HTML, htmlBody);
    }

    final int nodeId = nextNodeId(NodeIds.TYPE_MESSAGE);
    createNode(nodeId, NodeKind.MESSAGE, properties, folderNodeId);
    logger.log(
        Level.FINE,
        () -> String.format("Added message 0x%X \"%s\" to folder 0x%X", nodeId, subject, folderNodeId));
    return nodeId;
  }

  static PropertySet folderProperties(String displayName) {
    return new PropertySet()
        .putString(PropertyTags.DISPLAY_NAME, displayName)
        .putString(PropertyTags.CONTAINER_CLASS, CONTAINER_CLASS_NOTE)
        .putInt(PropertyTags.CONTENT_COUNT, 0);
  }

  private LogicalNode requireFolder(int folderNodeId) {
    final LogicalNode folder = nodes.get(folderNodeId);
    if (folder == null || !folder.isFolder()) {
      throw new UnknownFolderException(folderNodeId);
    }
    return folder;
  }

  private int nextNodeId(int type) {
    int nodeId;
    do {
      nodeId = NodeIds.make(nextIndex++, type);
    } while (nodes.containsKey(nodeId));
    return nodeId;
  }

  public Optional<LogicalNode> get(int nodeId) {
    return Optional.ofNullable(nodes.get(nodeId));
  }

  /// @throws NodeNotFoundException if absent
  public LogicalNode require(int nodeId) {
    final LogicalNode node = nodes.get(nodeId);
    if (node == null) {
      throw new NodeNotFoundException(nodeId);
    }
    return node;
  }

  public boolean contains(int nodeId) {
    return nodes.containsKey(nodeId);
  }

  /// Every node in ascending node id order.
  public Collection<LogicalNode> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public int size() {
    return nodes.size();
  }

  public List<LogicalNode> childrenOf(int nodeId) {
    final List<LogicalNode> result = new ArrayList<>();
    for (int child : require(nodeId).children()) {
      result.add(nodes.get(child));
    }
    return result;
  }

  public long count(NodeKind kind) {
    return nodes.values().stream().filter(n -> n.getKind() == kind).count();
  }

  /// Inserts a node read back from an image without checking its parent; [#linkChildren]
  /// wires up child lists once every node is present.
  void restore(LogicalNode node) {
    if (nodes.putIfAbsent(node.getNodeId(), node) != null) {
      throw new DuplicateNodeException(node.getNodeId());
    }
  }

  void linkChildren() {
    for (LogicalNode node : nodes.values()) {
      final LogicalNode parent = nodes.get(node.getParentNodeId());
      if (parent != null && parent != node && !parent.children().contains(node.getNodeId())) {
        parent.addChild(node.getNodeId());
      }
    }
    // keep dynamic ids clear of anything restored
    for (int nodeId : nodes.keySet()) {
      nextIndex = Math.max(nextIndex, NodeIds.index(nodeId) + 1);
    }
  }
}
