package com.github.simbo1905.pst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Best-effort structural check of an image. Unlike the parser, which stops at the first
/// problem, this collects every problem it can find into a [ValidationReport].
public final class PstStructureValidator {

  private static final Logger logger = Logger.getLogger(PstStructureValidator.class.getName());

  static final int MAX_EXPECTED_FOLDERS = 1000;
  static final int MAX_EXPECTED_MESSAGES = 100_000;

  private final PstConfig lenient;

  public PstStructureValidator() {
    this(PstConfig.defaults());
  }

  public PstStructureValidator(PstConfig config) {
    this.lenient =
        new PstConfigBuilder()
            .from(config)
            .strictSignature(false)
            .verifyChecksums(false)
            .build();
  }

  public ValidationReport validate(byte[] image) {
    final List<String> errors = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();

    try {
      HeaderCodec.decode(image, true, true);
    } catch (TruncatedDataException e) {
      errors.add(e.getMessage());
      return report(errors, warnings, 0, 0, image.length);
    } catch (PstFormatException e) {
      // signature and digest problems; keep going with a lenient open
      errors.add(e.getMessage());
    }

    final PstImageParser parser;
    try {
      parser = PstImageParser.open(image, lenient);
    } catch (PstFormatException e) {
      errors.add("cannot open indexes: " + e.getMessage());
      return report(errors, warnings, 0, 0, image.length);
    }

    final FileHeader header = parser.header();
    final int headerSize = header.layout().headerSize();
    if (header.totalSize() != image.length) {
      errors.add(
          String.format(
              "header total size %d does not match file size %d", header.totalSize(), image.length));
    }
    final boolean nbtInside = checkLocator("NBT", header.nbt(), headerSize, image.length, errors);
    final boolean bbtInside = checkLocator("BBT", header.bbt(), headerSize, image.length, errors);
    if (nbtInside && bbtInside && header.nbt().overlaps(header.bbt())) {
      errors.add(String.format("NBT %s overlaps BBT %s", header.nbt(), header.bbt()));
    }
    checkIndexBlock("NBT", header.nbt(), parser, errors);
    checkIndexBlock("BBT", header.bbt(), parser, errors);

    if (!BTreeCodec.isStrictlyAscending(parser.nbtEntries(), header.layout().nbtLayout())) {
      errors.add("NBT entries are not strictly ascending by node id");
    }
    if (!BTreeCodec.isStrictlyAscending(parser.bbtEntries(), header.layout().bbtLayout())) {
      errors.add("BBT entries are not strictly ascending by block id");
    }

    final long limit = Math.min(header.totalSize(), image.length);
    for (BbtEntry block : parser.bbtEntries()) {
      if (!inside(block.offset(), block.size(), headerSize, limit)) {
        errors.add(
            String.format(
                "block 0x%X at %d size %d lies outside [%d, %d)",
                block.blockId(), block.offset(), block.size(), headerSize, limit));
        continue;
      }
      try {
        final long frameId = parser.frameBlockId(block.offset());
        if (frameId != LittleEndian.low(block.blockId())) {
          errors.add(
              String.format(
                  "block 0x%X at offset %d has frame id 0x%X", block.blockId(), block.offset(), frameId));
        }
        parser.blockType(block.blockId());
      } catch (PstFormatException e) {
        errors.add(e.getMessage());
      }
    }

    int folders = 0;
    int messages = 0;
    for (NbtEntry node : parser.nbtEntries()) {
      switch (NodeKind.fromNodeId(node.nodeId())) {
        case FOLDER:
          folders++;
          break;
        case MESSAGE:
          messages++;
          break;
        default:
          break;
      }
      if (node.parentNodeId() != 0 && parser.nbtEntry(node.parentNodeId()).isEmpty()) {
        errors.add(
            String.format(
                "node 0x%X has parent 0x%X which is not in the NBT",
                node.nodeId(), node.parentNodeId()));
      }
      try {
        parser.resolve(node.nodeId());
        parser.readProperties(node.nodeId());
      } catch (PstFormatException e) {
        errors.add(e.getMessage());
      }
    }
    if (header.rootNodeId() != 0 && parser.nbtEntry(header.rootNodeId()).isEmpty()) {
      errors.add(String.format("root folder 0x%X is not in the NBT", header.rootNodeId()));
    }

    if (folders == 0) {
      warnings.add("image contains no folders");
    }
    if (messages == 0) {
      warnings.add("image contains no messages");
    }
    if (folders > MAX_EXPECTED_FOLDERS) {
      warnings.add(String.format("unusually many folders: %d", folders));
    }
    if (messages > MAX_EXPECTED_MESSAGES) {
      warnings.add(String.format("unusually many messages: %d", messages));
    }
    return report(errors, warnings, folders, messages, image.length);
  }

  /// Records an error unless `location` lies inside `[headerSize, fileSize)`.
  ///
  /// @return whether it does
  private static boolean checkLocator(
      String name, BlockLocation location, int headerSize, long fileSize, List<String> errors) {
    if (inside(location.offset(), location.size(), headerSize, fileSize)) {
      return true;
    }
    errors.add(
        String.format(
            "%s locator at %d size %d lies outside [%d, %d)",
            name, location.offset(), location.size(), headerSize, fileSize));
    return false;
  }

  /// `[offset, offset + size)` within `[from, to)`, compared without adding so that
  /// 64-bit offsets near the top of the range cannot wrap.
  private static boolean inside(long offset, long size, long from, long to) {
    return offset >= from && size >= 0 && offset <= to && size <= to - offset;
  }

  /// A locator must name exactly one BBT block: same offset, same size, framed as an
  /// index page.
  private static void checkIndexBlock(
      String name, BlockLocation location, PstImageParser parser, List<String> errors) {
    final Optional<BbtEntry> listed =
        parser.bbtEntries().stream().filter(e -> e.offset() == location.offset()).findFirst();
    if (listed.isEmpty()) {
      errors.add(
          String.format(
              "%s locator offset %d is not the offset of any block in the BBT",
              name, location.offset()));
      return;
    }
    final BbtEntry block = listed.get();
    if (block.size() != location.size()) {
      errors.add(
          String.format(
              "%s locator size %d does not match BBT block 0x%X size %d",
              name, location.size(), block.blockId(), block.size()));
    }
    try {
      parser
          .blockType(block.blockId())
          .filter(type -> type != BlockType.INTERNAL)
          .ifPresent(
              type ->
                  errors.add(
                      String.format(
                          "%s block 0x%X is framed as %s, not INTERNAL",
                          name, block.blockId(), type)));
    } catch (PstFormatException e) {
      errors.add(name + " block: " + e.getMessage());
    }
  }

  private static ValidationReport report(
      List<String> errors, List<String> warnings, int folders, int messages, long size) {
    final ValidationReport report = new ValidationReport(errors, warnings, folders, messages, size);
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "Validated %d bytes: %d errors, %d warnings, %d folders, %d messages",
                size, errors.size(), warnings.size(), folders, messages));
    for (String error : errors) {
      logger.log(Level.FINER, () -> "error: " + error);
    }
    return report;
  }
}
