package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.*;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.CRC32;

/// Parses and encodes the file header for both the ANSI and the Unicode layout.
///
/// Fixed offsets shared by both layouts:
/// - signature @0 (4 bytes, `!BDN`)
/// - CRC32 @4 (4 bytes) over [8, 516) with the checksum field read as zero
/// - client magic @8, version @10, client version @12 (2 bytes each)
/// - platform create/access @14/@15 (1 byte each)
/// - root folder node id @52 (4 bytes)
/// - checksum @508 (4 bytes): the negated sum of every 32-bit word in [0, 508)
///
/// Total size, locators and density sit at layout-specific offsets, see [FormatLayout].
/// Encoding writes the CRC first and then the checksum, which covers the CRC.
public final class HeaderCodec {

  private static final Logger logger = Logger.getLogger(HeaderCodec.class.getName());

  /// `0x21 0x42 0x44 0x4E` read little-endian.
  static final int SIGNATURE = 0x4E444221;

  static final int SIGNATURE_OFFSET = 0;
  static final int CRC_OFFSET = 4;
  static final int CLIENT_MAGIC_OFFSET = 8;
  static final int VERSION_OFFSET = 10;
  static final int CLIENT_VERSION_OFFSET = 12;
  static final int PLATFORM_CREATE_OFFSET = 14;
  static final int PLATFORM_ACCESS_OFFSET = 15;
  static final int ROOT_NODE_OFFSET = 52;
  static final int CHECKSUM_OFFSET = 508;

  /// The CRC covers [CRC_START, CRC_END).
  static final int CRC_START = 8;

  static final int CRC_END = 516;

  private HeaderCodec() {}

  /// Strict decode: a bad signature or a digest mismatch is an error.
  public static FileHeader decode(byte[] bytes) {
    return decode(bytes, true, true);
  }

  /// Decodes a header.
  ///
  /// @param bytes the image, or at least its first header-size bytes
  /// @param strictSignature when false a bad signature is logged and decoding continues
  /// @param verifyDigests when false CRC/checksum mismatches are logged and decoding continues
  /// @throws BadSignatureException if the magic mismatches and `strictSignature` is set
  /// @throws TruncatedDataException if fewer bytes than the header size are available
  /// @throws PstFormatException if a digest mismatches and `verifyDigests` is set
  public static FileHeader decode(byte[] bytes, boolean strictSignature, boolean verifyDigests) {
    if (bytes.length < VERSION_OFFSET + Short.BYTES) {
      throw new TruncatedDataException("header", 0, FormatLayout.ANSI.headerSize(), bytes.length);
    }
    final long signature = u32(bytes, SIGNATURE_OFFSET);
    final int version = u16(bytes, VERSION_OFFSET);
    final FormatLayout layout = FormatLayout.forVersion(version);
    if (bytes.length < layout.headerSize()) {
      throw new TruncatedDataException("header", 0, layout.headerSize(), bytes.length);
    }

    if (signature != (SIGNATURE & 0xFFFFFFFFL)) {
      if (strictSignature) {
        throw new BadSignatureException(signature);
      }
      logger.log(
          Level.WARNING,
          () -> String.format("Non-standard signature 0x%08X, continuing with %s layout", signature, layout));
    }

    final long storedCrc = u32(bytes, CRC_OFFSET);
    final long storedChecksum = u32(bytes, CHECKSUM_OFFSET);
    final long actualCrc = crc32(bytes);
    final long actualChecksum = checksum(bytes);
    if (storedCrc != actualCrc || storedChecksum != actualChecksum) {
      final String message =
          String.format(
              "header digest mismatch: crc32 stored=%08x computed=%08x, checksum stored=%08x computed=%08x",
              storedCrc, actualCrc, storedChecksum, actualChecksum);
      if (verifyDigests) {
        throw new PstFormatException(message);
      }
      logger.log(Level.WARNING, message);
    }

    FileHeader header =
        new FileHeader(
            signature,
            layout,
            version,
            u16(bytes, CLIENT_MAGIC_OFFSET),
            u16(bytes, CLIENT_VERSION_OFFSET),
            u8(bytes, PLATFORM_CREATE_OFFSET),
            u8(bytes, PLATFORM_ACCESS_OFFSET),
            layout.readField(bytes, layout.totalSizeOffset),
            new BlockLocation(
                layout.readField(bytes, layout.nbtOffsetOffset),
                layout.readField(bytes, layout.nbtSizeOffset)),
            new BlockLocation(
                layout.readField(bytes, layout.bbtOffsetOffset),
                layout.readField(bytes, layout.bbtSizeOffset)),
            i32(bytes, ROOT_NODE_OFFSET),
            u8(bytes, layout.densityOffset),
            storedCrc,
            storedChecksum);
    logger.log(Level.FINE, () -> "Decoded " + header);
    return header;
  }

  /// Encodes a header in its own layout and fills in both digests. Call this only once
  /// the locators and total size are final: both digests cover them.
  public static byte[] encode(FileHeader header) {
    final FormatLayout layout = header.layout();
    final byte[] bytes = new byte[layout.headerSize()];

    putU32(bytes, SIGNATURE_OFFSET, header.signature());
    putU16(bytes, CLIENT_MAGIC_OFFSET, header.clientMagic());
    putU16(bytes, VERSION_OFFSET, header.version());
    putU16(bytes, CLIENT_VERSION_OFFSET, header.clientVersion());
    putU8(bytes, PLATFORM_CREATE_OFFSET, header.platformCreate());
    putU8(bytes, PLATFORM_ACCESS_OFFSET, header.platformAccess());
    layout.writeField(bytes, layout.totalSizeOffset, header.totalSize());
    putU32(bytes, ROOT_NODE_OFFSET, header.rootNodeId());
    layout.writeField(bytes, layout.nbtOffsetOffset, header.nbt().offset());
    layout.writeField(bytes, layout.nbtSizeOffset, header.nbt().size());
    layout.writeField(bytes, layout.bbtOffsetOffset, header.bbt().offset());
    layout.writeField(bytes, layout.bbtSizeOffset, header.bbt().size());
    putU8(bytes, layout.densityOffset, header.density());

    // checksum field is still zero here
    final long crc = crc32(bytes);
    putU32(bytes, CRC_OFFSET, crc);
    putU32(bytes, CHECKSUM_OFFSET, checksum(bytes));

    logger.log(
        Level.FINEST,
        () -> String.format("Encoded %s header crc32=%08x bytes=%s", layout, crc, hex(bytes, 0, 64)));
    return bytes;
  }

  /// CRC32 over [8, 516), reading the checksum field as zero.
  static long crc32(byte[] header) {
    final byte[] covered = java.util.Arrays.copyOfRange(header, CRC_START, CRC_END);
    final int checksumAt = CHECKSUM_OFFSET - CRC_START;
    java.util.Arrays.fill(covered, checksumAt, checksumAt + Integer.BYTES, (byte) 0);
    CRC32 crc = new CRC32();
    crc.update(covered, 0, covered.length);
    return crc.getValue();
  }

  /// Sum of every little-endian 32-bit word in [0, 508), negated, modulo 2^32.
  static long checksum(byte[] header) {
    long sum = 0;
    for (int off = 0; off < CHECKSUM_OFFSET; off += Integer.BYTES) {
      sum += u32(header, off);
    }
    return -sum & 0xFFFFFFFFL;
  }
}
