package com.github.simbo1905.pst.scan;

import com.github.simbo1905.pst.LittleEndian;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/// Scans every byte position for a little-endian 32-bit marker that repeats one byte four
/// times, as page and block starts often do in damaged files.
public final class SignatureScanLocator implements ContentLocator {

  private static final Logger logger = Logger.getLogger(SignatureScanLocator.class.getName());

  public static final int DATA_MARKER = 0x01010101;
  public static final int BLOCK_MARKER = 0x02020202;
  public static final int INTERMEDIATE_PAGE_MARKER = 0x80808080;
  public static final int LEAF_PAGE_MARKER = 0x81818181;

  static final Set<Integer> MARKERS =
      Set.of(DATA_MARKER, BLOCK_MARKER, INTERMEDIATE_PAGE_MARKER, LEAF_PAGE_MARKER);

  public static final int DEFAULT_MAX_HITS = 50;

  private final int maxHits;

  public SignatureScanLocator() {
    this(DEFAULT_MAX_HITS);
  }

  public SignatureScanLocator(int maxHits) {
    if (maxHits < 1) {
      throw new IllegalArgumentException("maxHits must be positive, got " + maxHits);
    }
    this.maxHits = maxHits;
  }

  @Override
  public LongStream locate(byte[] image) {
    logger.log(
        Level.FINE,
        () -> String.format("Signature scan over %d bytes, max %d hits", image.length, maxHits));
    return IntStream.rangeClosed(0, image.length - Integer.BYTES)
        .filter(i -> MARKERS.contains(LittleEndian.i32(image, i)))
        .limit(maxHits)
        .asLongStream();
  }
}
