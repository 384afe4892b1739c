package com.github.simbo1905.pst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// Turns a tree of logical nodes into a complete image.
///
/// Lifecycle:
/// ```
/// EMPTY -> SYSTEM_NODES_CREATED -> MESSAGES_ADDED -> INDEXES_BUILT -> FINALIZED
/// ```
/// Adding content after the indexes are built (or after finalising) goes back to
/// MESSAGES_ADDED. The next [#buildIndexes] then appends blocks for the nodes whose
/// properties changed plus a fresh NBT and BBT; nothing already written is touched.
/// Superseded blocks stay in the BBT with a reference count of 0.
///
/// Example usage:
/// ```
/// PstImageBuilder builder = new PstImageBuilder();
/// builder.createSystemNodes();
/// builder.addMessage(NodeIds.INBOX, "Hello", "a@b.com", "body text");
/// byte[] image = builder.build();
/// ```
public class PstImageBuilder {

  private static final Logger logger = Logger.getLogger(PstImageBuilder.class.getName());

  static final int NAMEID_BUCKETS = 251;

  enum State {
    EMPTY,
    SYSTEM_NODES_CREATED,
    MESSAGES_ADDED,
    INDEXES_BUILT,
    FINALIZED
  }

  @Getter private final PstConfig config;
  @Getter private final NodeStore nodeStore;
  private final PropertySerializer serializer;
  private final BlockAllocator allocator;

  /// Node id to the block currently holding its properties.
  private final Map<Integer, Long> nodeBlocks = new HashMap<>();
  /// Node id to the payload last written for it, to skip unchanged nodes on rebuild.
  private final Map<Integer, byte[]> lastPayloads = new HashMap<>();
  /// Blocks no longer referenced by the current NBT or header.
  private final Set<Long> superseded = new HashSet<>();

  private AllocatedBlock nbtBlock;
  private AllocatedBlock bbtBlock;
  private FileHeader header;
  private byte[] image;

  private volatile State state = State.EMPTY;

  public PstImageBuilder() {
    this(PstConfig.defaults());
  }

  public PstImageBuilder(PstConfig config) {
    this(config, new NodeStore());
  }

  PstImageBuilder(PstConfig config, NodeStore nodeStore) {
    this.config = config;
    this.nodeStore = nodeStore;
    this.serializer = new PropertySerializer(config);
    this.allocator = new BlockAllocator(config.layout().headerSize());
  }

  /// Creates the message store, the name-to-id map, the root folder and the four standard
  /// folders under it.
  ///
  /// @throws IllegalStateException unless the builder is empty
  @Synchronized
  public void createSystemNodes() {
    if (state != State.EMPTY) {
      throw new IllegalStateException("system nodes already created, state is " + state);
    }
    nodeStore.createNode(
        NodeIds.MESSAGE_STORE,
        NodeKind.MESSAGE_STORE,
        new PropertySet()
            .putString(PropertyTags.DISPLAY_NAME, config.storeDisplayName())
            .putString(PropertyTags.CONTAINER_CLASS, NodeStore.CONTAINER_CLASS_NOTE),
        0);
    nodeStore.createNode(
        NodeIds.NAME_TO_ID_MAP,
        NodeKind.NAME_TO_ID_MAP,
        new PropertySet().putInt(PropertyTags.NAMEID_BUCKET_COUNT, NAMEID_BUCKETS),
        0);
    nodeStore.createNode(
        NodeIds.ROOT_FOLDER, NodeKind.FOLDER, NodeStore.folderProperties("Root"), 0);
    createStandardFolder(NodeIds.INBOX, "Inbox");
    createStandardFolder(NodeIds.OUTBOX, "Outbox");
    createStandardFolder(NodeIds.SENT_ITEMS, "Sent Items");
    createStandardFolder(NodeIds.DELETED_ITEMS, "Deleted Items");
    transition(State.SYSTEM_NODES_CREATED);
  }

  private void createStandardFolder(int nodeId, String name) {
    nodeStore.createNode(
        nodeId, NodeKind.FOLDER, NodeStore.folderProperties(name), NodeIds.ROOT_FOLDER);
  }

  public int addMessage(int folderNodeId, String subject, String sender, String body) {
    return addMessage(folderNodeId, subject, sender, body, null);
  }

  /// Adds a message to a registered folder.
  ///
  /// @return the new message node id
  /// @throws UnknownFolderException if `folderNodeId` is not a registered folder
  @Synchronized
  public int addMessage(
      int folderNodeId, String subject, String sender, String body, String htmlBody) {
    final int nodeId = nodeStore.addMessage(folderNodeId, subject, sender, body, htmlBody);
    transition(State.MESSAGES_ADDED);
    return nodeId;
  }

  /// Drains `source` into `folderNodeId`. If the source fails part way, the messages it
  /// produced before failing stay added and the indexes must be rebuilt to include them.
  ///
  /// @return the new message node ids in the order the source produced them
  @Synchronized
  public List<Integer> addMessages(int folderNodeId, MessageSource source) {
    final List<Integer> added = new ArrayList<>();
    try {
      Optional<MessageRecord> next;
      while ((next = source.nextMessage()).isPresent()) {
        final MessageRecord message = next.get();
        added.add(
            nodeStore.addMessage(
                folderNodeId,
                message.subject(),
                message.sender(),
                message.body(),
                message.htmlBody()));
      }
    } finally {
      if (!added.isEmpty()) {
        transition(State.MESSAGES_ADDED);
      }
    }
    logger.log(
        Level.FINE,
        () -> String.format("Added %d messages to folder 0x%X", added.size(), folderNodeId));
    return added;
  }

  /// Adds a folder under a registered folder.
  ///
  /// @return the new folder node id
  @Synchronized
  public int addFolder(int parentNodeId, String displayName) {
    final int nodeId = nodeStore.addFolder(parentNodeId, displayName);
    transition(State.MESSAGES_ADDED);
    return nodeId;
  }

  /// Writes a property block for every new or changed node, then a NBT page and a BBT
  /// page, each as a block of its own. The BBT lists every block allocated so far,
  /// itself included.
  ///
  /// @throws IncompleteImageException if no system nodes exist yet
  @Synchronized
  public void buildIndexes() {
    if (state == State.EMPTY) {
      throw new IncompleteImageException("cannot build indexes before system nodes exist");
    }
    refreshContentCounts();

    int written = 0;
    for (LogicalNode node : nodeStore.nodes()) {
      final byte[] payload = serializer.serialize(node.getProperties());
      final byte[] previous = lastPayloads.get(node.getNodeId());
      if (previous != null && Arrays.equals(previous, payload)) {
        continue;
      }
      final Long old = nodeBlocks.put(node.getNodeId(), allocator.allocate(payload, BlockType.DATA));
      if (old != null) {
        superseded.add(old);
      }
      lastPayloads.put(node.getNodeId(), payload);
      written++;
    }

    if (nbtBlock != null) {
      superseded.add(nbtBlock.blockId());
    }
    if (bbtBlock != null) {
      superseded.add(bbtBlock.blockId());
    }

    final FormatLayout layout = config.layout();
    final List<NbtEntry> nbtEntries = new ArrayList<>(nodeStore.size());
    for (LogicalNode node : nodeStore.nodes()) {
      nbtEntries.add(
          new NbtEntry(
              node.getNodeId(), nodeBlocks.get(node.getNodeId()), 0, node.getParentNodeId()));
    }
    nbtBlock = allocateIndex(BTreeCodec.encodePage(nbtEntries, layout.nbtLayout()));

    // the BBT describes itself, so its id, offset and size are worked out before allocating
    final long bbtBlockId = allocator.peekNextBlockId();
    final long bbtOffset = allocator.nextOffset();
    final int bbtCount = allocator.blockCount() + 1;
    final long bbtSize = BlockAllocator.framedSize(BTreeCodec.pageLength(bbtCount, layout.bbtLayout()));
    final List<BbtEntry> bbtEntries = new ArrayList<>(bbtCount);
    for (AllocatedBlock block : allocator.blocks()) {
      bbtEntries.add(
          new BbtEntry(
              block.blockId(),
              block.offset(),
              block.size(),
              superseded.contains(block.blockId()) ? 0 : 1));
    }
    bbtEntries.add(new BbtEntry(bbtBlockId, bbtOffset, bbtSize, 1));
    bbtBlock = allocateIndex(BTreeCodec.encodePage(bbtEntries, layout.bbtLayout()));
    if (bbtBlock.blockId() != bbtBlockId
        || bbtBlock.offset() != bbtOffset
        || bbtBlock.size() != bbtSize) {
      throw new IllegalStateException(
          String.format("BBT landed at %s, expected id 0x%X at %d size %d",
              bbtBlock, bbtBlockId, bbtOffset, bbtSize));
    }

    final int nodeBlocksWritten = written;
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "Built indexes: %d node blocks written, %d nodes, %d blocks, nbt=%s bbt=%s",
                nodeBlocksWritten, nbtEntries.size(), bbtEntries.size(), nbtBlock, bbtBlock));
    transition(State.INDEXES_BUILT);
  }

  private AllocatedBlock allocateIndex(byte[] page) {
    final long blockId = allocator.allocate(page, BlockType.INTERNAL);
    return allocator.lookup(blockId).orElseThrow();
  }

  private void refreshContentCounts() {
    for (LogicalNode node : nodeStore.nodes()) {
      if (!node.isFolder()) {
        continue;
      }
      final long messages =
          node.children().stream()
              .map(nodeStore::require)
              .filter(child -> child.getKind() == NodeKind.MESSAGE)
              .count();
      node.getProperties().putInt(PropertyTags.CONTENT_COUNT, messages);
    }
  }

  /// Renders the image and writes the header last, once every locator is known. The
  /// result is decoded again with strict checks before it is returned.
  ///
  /// @return a copy of the complete image
  /// @throws IncompleteImageException if the indexes are not built for the current content
  @Synchronized
  public byte[] finalizeImage() {
    if (state == State.FINALIZED) {
      return image.clone();
    }
    if (state != State.INDEXES_BUILT) {
      throw new IncompleteImageException(
          "cannot finalize before indexes are built for the current content, state is " + state);
    }
    final byte[] rendered = allocator.render();
    final FileHeader draft =
        FileHeader.create(config.layout(), config.fileKind())
            .withTotalSize(rendered.length)
            .withLocators(nbtBlock.location(), bbtBlock.location())
            .withRootNodeId(NodeIds.ROOT_FOLDER)
            .withDensity(density());
    final byte[] headerBytes = HeaderCodec.encode(draft);
    System.arraycopy(headerBytes, 0, rendered, 0, headerBytes.length);

    final FileHeader check = HeaderCodec.decode(rendered);
    if (!check.withoutDigests().equals(draft.withoutDigests())) {
      throw new PstFormatException(
          String.format("header self-check failed: wrote %s read %s", draft, check));
    }
    header = check;
    image = rendered;
    transition(State.FINALIZED);
    logger.log(
        Level.FINE,
        () -> String.format("Finalized %d byte %s image", rendered.length, config.layout()));
    return image.clone();
  }

  /// Builds the indexes when the content changed since the last build and finalizes.
  @Synchronized
  public byte[] build() {
    if (state != State.INDEXES_BUILT && state != State.FINALIZED) {
      buildIndexes();
    }
    return finalizeImage();
  }

  /// Percentage of allocated block bytes that carry payload.
  private int density() {
    final long allocated = allocator.totalSize() - config.layout().headerSize();
    if (allocated <= 0) {
      return 0;
    }
    return (int) Math.min(100, allocator.payloadBytes() * 100 / allocated);
  }

  /// The header written by the last [#finalizeImage], if any.
  @Synchronized
  public Optional<FileHeader> header() {
    return Optional.ofNullable(header);
  }

  /// The block holding a node's properties as of the last [#buildIndexes].
  @Synchronized
  public Optional<Long> blockIdOf(int nodeId) {
    return Optional.ofNullable(nodeBlocks.get(nodeId));
  }

  State state() {
    return state;
  }

  private void transition(State next) {
    if (state != next) {
      final State from = state;
      logger.log(Level.FINE, () -> String.format("state %s -> %s", from, next));
      state = next;
    }
  }
}
