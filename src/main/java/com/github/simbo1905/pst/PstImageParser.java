package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.*;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// Read-only view of an image: the decoded header, both index pages, and lookups from a
/// node id to the block holding its properties.
///
/// The parser keeps a reference to the bytes it was opened on and never changes them.
/// Lookups are read-only, so once open the parser may be shared between threads.
public final class PstImageParser {

  private static final Logger logger = Logger.getLogger(PstImageParser.class.getName());

  private final byte[] image;
  @Getter private final PstConfig config;
  private final FileHeader header;
  private final List<NbtEntry> nbtEntries;
  private final List<BbtEntry> bbtEntries;
  private final TreeMap<Integer, NbtEntry> nodes = new TreeMap<>(Integer::compareUnsigned);
  private final TreeMap<Long, BbtEntry> blocks = new TreeMap<>(Long::compareUnsigned);
  private final PropertySerializer serializer;

  private PstImageParser(byte[] image, PstConfig config) {
    this.image = image;
    this.config = config;
    this.serializer = new PropertySerializer(config);
    this.header = HeaderCodec.decode(image, config.strictSignature(), config.verifyChecksums());
    final FormatLayout layout = header.layout();

    this.nbtEntries = readIndex("NBT", header.nbt(), layout.nbtLayout()).entries();
    for (NbtEntry entry : nbtEntries) {
      nodes.put(entry.nodeId(), entry);
    }

    final List<BbtEntry> rawBbt = readIndex("BBT", header.bbt(), layout.bbtLayout()).entries();
    // ANSI entries carry no size; take it from the frame when the frame is readable
    this.bbtEntries =
        layout.isUnicode()
            ? rawBbt
            : rawBbt.stream().map(this::withFrameSize).collect(java.util.stream.Collectors.toList());
    for (BbtEntry entry : bbtEntries) {
      blocks.put(entry.blockId(), entry);
    }
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "Opened %s %s image: %d bytes, %d nodes, %d blocks",
                layout, header.fileKind(), image.length, nbtEntries.size(), bbtEntries.size()));
  }

  public static PstImageParser open(byte[] image) {
    return open(image, PstConfig.defaults());
  }

  /// Decodes the header, then the NBT and BBT pages it points at.
  ///
  /// @throws PstFormatException or one of its subclasses if the header or an index page
  /// cannot be read
  public static PstImageParser open(byte[] image, PstConfig config) {
    return new PstImageParser(image, config);
  }

  public static PstImageParser open(Path path, PstConfig config) throws IOException {
    return open(PstFiles.read(path), config);
  }

  public static PstImageParser open(Path path) throws IOException {
    return open(path, PstConfig.defaults());
  }

  private <E> BTreePage<E> readIndex(String name, BlockLocation location, EntryLayout<E> layout) {
    final int headerSize = header.layout().headerSize();
    if (location.offset() < headerSize) {
      throw new PstFormatException(
          String.format(
              "%s locator offset %d lies inside the %d byte header", name, location.offset(), headerSize));
    }
    final Frame frame = frameAt(location.offset());
    logger.log(
        Level.FINEST,
        () -> String.format("Reading %s page block 0x%X at %d", name, frame.blockId(), location.offset()));
    final BTreePage<E> page =
        BTreeCodec.decodePage(
            image, frame.payloadOffset(), frame.payloadSize(), frame.payloadOffset(), layout);
    final long framed = BlockAllocator.framedSize(frame.payloadSize());
    if (location.size() != framed) {
      throw new PstFormatException(
          String.format(
              "%s locator size %d does not match the %d byte block at offset %d",
              name, location.size(), framed, location.offset()));
    }
    return page;
  }

  private BbtEntry withFrameSize(BbtEntry entry) {
    if (entry.size() != 0 || !within(entry.offset(), BlockAllocator.FRAME_HEADER_SIZE)) {
      return entry;
    }
    final long payloadSize = u32(image, (int) entry.offset() + 4);
    return entry.withSize(alignUp(BlockAllocator.FRAME_HEADER_SIZE + payloadSize, BlockAllocator.BLOCK_SIZE));
  }

  /// Frame header fields of the block at `offset`, with the payload bounds checked.
  ///
  /// @throws TruncatedBlockException if the frame or its declared payload runs off the image
  private Frame frameAt(long offset) {
    if (!within(offset, BlockAllocator.FRAME_HEADER_SIZE)) {
      throw new TruncatedBlockException(offset, BlockAllocator.FRAME_HEADER_SIZE, available(offset));
    }
    final int off = (int) offset;
    final long blockId = u32(image, off);
    final long payloadSize = u32(image, off + 4);
    final int payloadOffset = off + BlockAllocator.FRAME_HEADER_SIZE;
    if (payloadSize > image.length - payloadOffset) {
      throw new TruncatedBlockException(offset, payloadSize, image.length - payloadOffset);
    }
    return new Frame(blockId, payloadOffset, (int) payloadSize);
  }

  /// True when `[offset, offset + length)` lies inside the image. Written without
  /// `offset + length` so that offsets near `Long.MAX_VALUE` cannot wrap.
  private boolean within(long offset, long length) {
    return offset >= 0 && length >= 0 && offset <= image.length && length <= image.length - offset;
  }

  private long available(long offset) {
    return offset < 0 || offset > image.length ? 0 : image.length - offset;
  }

  private record Frame(long blockId, int payloadOffset, int payloadSize) {}

  public FileHeader header() {
    return header;
  }

  public boolean isUnicode() {
    return header.isUnicode();
  }

  public int size() {
    return image.length;
  }

  /// NBT entries in on-disk order.
  public List<NbtEntry> nbtEntries() {
    return Collections.unmodifiableList(nbtEntries);
  }

  /// BBT entries in on-disk order.
  public List<BbtEntry> bbtEntries() {
    return Collections.unmodifiableList(bbtEntries);
  }

  public Optional<NbtEntry> nbtEntry(int nodeId) {
    return Optional.ofNullable(nodes.get(nodeId));
  }

  public Optional<BbtEntry> bbtEntry(long blockId) {
    return Optional.ofNullable(blocks.get(blockId));
  }

  /// Where the properties of `nodeId` live.
  ///
  /// @throws NodeNotFoundException if the NBT has no such node
  /// @throws DanglingReferenceException if the node's block is not in the BBT
  public BlockLocation resolve(int nodeId) {
    final NbtEntry node = nodes.get(nodeId);
    if (node == null) {
      throw new NodeNotFoundException(nodeId);
    }
    final BbtEntry block = blocks.get(node.blockId());
    if (block == null) {
      throw DanglingReferenceException.missingBlock(nodeId, node.blockId());
    }
    return new BlockLocation(block.offset(), block.size());
  }

  /// Payload of a block, after checking that the frame at the BBT offset carries the same
  /// block id.
  ///
  /// @throws DanglingReferenceException if the block is not in the BBT or the frame id differs
  /// @throws TruncatedBlockException if the frame runs past the image
  public byte[] readBlock(long blockId) {
    final Frame frame = checkedFrame(0, blockId);
    return Arrays.copyOfRange(
        image, frame.payloadOffset(), frame.payloadOffset() + frame.payloadSize());
  }

  private Frame checkedFrame(int nodeId, long blockId) {
    final BbtEntry entry = blocks.get(blockId);
    if (entry == null) {
      throw nodeId == 0
          ? new DanglingReferenceException(
              0, blockId, String.format("block 0x%X is not in the BBT", blockId))
          : DanglingReferenceException.missingBlock(nodeId, blockId);
    }
    final Frame frame = frameAt(entry.offset());
    if (frame.blockId() != low(blockId)) {
      throw new DanglingReferenceException(
          nodeId,
          blockId,
          String.format(
              "BBT places block 0x%X at offset %d but the frame there carries id 0x%X",
              blockId, entry.offset(), frame.blockId()));
    }
    if (entry.size() != 0 && BlockAllocator.FRAME_HEADER_SIZE + (long) frame.payloadSize() > entry.size()) {
      throw new TruncatedBlockException(
          entry.offset(), BlockAllocator.FRAME_HEADER_SIZE + (long) frame.payloadSize(), entry.size());
    }
    return frame;
  }

  /// Deserialised properties of a node.
  ///
  /// @throws NodeNotFoundException if the NBT has no such node
  /// @throws DanglingReferenceException if its block cannot be found
  /// @throws TruncatedBlockException if the property records run past the payload
  public PropertySet readProperties(int nodeId) {
    final NbtEntry node = nodes.get(nodeId);
    if (node == null) {
      throw new NodeNotFoundException(nodeId);
    }
    final Frame frame = checkedFrame(nodeId, node.blockId());
    return serializer.deserialize(
        image, frame.payloadOffset(), frame.payloadSize(), frame.payloadOffset());
  }

  /// Rebuilds the node tree: one node per NBT entry, with its properties and child lists.
  public NodeStore reconstruct() {
    final NodeStore store = new NodeStore();
    for (NbtEntry entry : nodes.values()) {
      store.restore(
          new LogicalNode(
              entry.nodeId(),
              NodeKind.fromNodeId(entry.nodeId()),
              readProperties(entry.nodeId()),
              entry.parentNodeId()));
    }
    store.linkChildren();
    logger.log(Level.FINE, () -> String.format("Reconstructed %d nodes", store.size()));
    return store;
  }

  /// A copy of `image[offset, offset + length)`, for callers that locate content
  /// themselves.
  ///
  /// @throws TruncatedDataException if the range runs past the image
  public byte[] readRange(long offset, int length) {
    if (offset < 0 || length < 0) {
      throw new IllegalArgumentException(
          String.format("invalid range offset=%d length=%d", offset, length));
    }
    if (!within(offset, length)) {
      throw new TruncatedDataException("range", offset, length, available(offset));
    }
    return Arrays.copyOfRange(image, (int) offset, (int) offset + length);
  }

  public String text(long offset, int length, Charset charset) {
    return new String(readRange(offset, length), charset);
  }

  /// Multi-line summary of the header and both indexes, for logs and debugging.
  public String describe() {
    final StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "%s %s image version=%d size=%d totalSize=%d root=0x%X density=%d%%%n",
            header.layout(),
            header.fileKind(),
            header.version(),
            image.length,
            header.totalSize(),
            header.rootNodeId(),
            header.density()));
    sb.append(String.format("crc32=%08x checksum=%08x%n", header.crc32(), header.checksum()));
    sb.append(
        String.format(
            "NBT at %d size %d, %d entries%n",
            header.nbt().offset(), header.nbt().size(), nbtEntries.size()));
    for (NbtEntry e : nbtEntries) {
      sb.append(
          String.format(
              "  nid=0x%X bid=0x%X parent=0x%X %s%n",
              e.nodeId(), e.blockId(), e.parentNodeId(), NodeKind.fromNodeId(e.nodeId())));
    }
    sb.append(
        String.format(
            "BBT at %d size %d, %d entries%n",
            header.bbt().offset(), header.bbt().size(), bbtEntries.size()));
    for (BbtEntry e : bbtEntries) {
      sb.append(
          String.format(
              "  bid=0x%X offset=%d size=%d refs=%d%n",
              e.blockId(), e.offset(), e.size(), e.refCount()));
    }
    sb.append("header bytes ").append(hex(image, 0, 64));
    return sb.toString();
  }

  /// Frame type of the block at a BBT entry, or empty if the frame cannot be read.
  Optional<BlockType> blockType(long blockId) {
    return bbtEntry(blockId)
        .filter(e -> within(e.offset(), BlockAllocator.FRAME_HEADER_SIZE))
        .map(e -> BlockType.fromCode(i32(image, (int) e.offset() + 8)));
  }

  /// Block id stored in the frame at `offset`, for cross-checking the BBT.
  long frameBlockId(long offset) {
    return frameAt(offset).blockId();
  }

  byte[] bytes() {
    return image;
  }
}
