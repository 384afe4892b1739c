package com.github.simbo1905.pst;

/// Decoded file header. Immutable: every change goes through a `with` method, and the two
/// digests are recomputed by [HeaderCodec#encode] rather than carried over.
///
/// @param signature the four magic bytes read as an unsigned little-endian value
/// @param layout ANSI or Unicode, derived from `version`
/// @param version format version at offset 10
/// @param clientMagic two bytes at offset 8, see [FileKind]
/// @param clientVersion client version at offset 12
/// @param platformCreate platform byte at offset 14
/// @param platformAccess platform byte at offset 15
/// @param totalSize length of the whole image in bytes
/// @param nbt location of the block holding the Node B-Tree page
/// @param bbt location of the block holding the Block B-Tree page
/// @param rootNodeId node id of the root folder
/// @param density percentage of block bytes that carry payload
/// @param crc32 CRC32 over header bytes [8, 516) with the checksum field zeroed
/// @param checksum negated word sum over header bytes [0, 508)
public record FileHeader(
    long signature,
    FormatLayout layout,
    int version,
    int clientMagic,
    int clientVersion,
    int platformCreate,
    int platformAccess,
    long totalSize,
    BlockLocation nbt,
    BlockLocation bbt,
    int rootNodeId,
    int density,
    long crc32,
    long checksum) {

  /// Client version written next to the format version.
  static final int CLIENT_VERSION = 0x13;

  /// A fresh header for an empty image of the given layout. Locators are unset.
  public static FileHeader create(FormatLayout layout, FileKind kind) {
    return new FileHeader(
        HeaderCodec.SIGNATURE & 0xFFFFFFFFL,
        layout,
        layout.defaultVersion,
        kind.clientMagic(),
        CLIENT_VERSION,
        1,
        1,
        layout.headerSize(),
        BlockLocation.NONE,
        BlockLocation.NONE,
        0,
        0,
        0,
        0);
  }

  public boolean isUnicode() {
    return layout.isUnicode();
  }

  public FileKind fileKind() {
    return FileKind.fromMagic(clientMagic);
  }

  public FileHeader withTotalSize(long newTotalSize) {
    return new FileHeader(
        signature, layout, version, clientMagic, clientVersion, platformCreate, platformAccess,
        newTotalSize, nbt, bbt, rootNodeId, density, crc32, checksum);
  }

  public FileHeader withLocators(BlockLocation newNbt, BlockLocation newBbt) {
    return new FileHeader(
        signature, layout, version, clientMagic, clientVersion, platformCreate, platformAccess,
        totalSize, newNbt, newBbt, rootNodeId, density, crc32, checksum);
  }

  public FileHeader withRootNodeId(int newRootNodeId) {
    return new FileHeader(
        signature, layout, version, clientMagic, clientVersion, platformCreate, platformAccess,
        totalSize, nbt, bbt, newRootNodeId, density, crc32, checksum);
  }

  public FileHeader withDensity(int newDensity) {
    return new FileHeader(
        signature, layout, version, clientMagic, clientVersion, platformCreate, platformAccess,
        totalSize, nbt, bbt, rootNodeId, newDensity, crc32, checksum);
  }

  FileHeader withDigests(long newCrc32, long newChecksum) {
    return new FileHeader(
        signature, layout, version, clientMagic, clientVersion, platformCreate, platformAccess,
        totalSize, nbt, bbt, rootNodeId, density, newCrc32, newChecksum);
  }

  /// This header with both digests zeroed, for comparing field values.
  public FileHeader withoutDigests() {
    return withDigests(0, 0);
  }
}
