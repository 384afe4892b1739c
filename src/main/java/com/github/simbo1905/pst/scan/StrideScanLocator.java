package com.github.simbo1905.pst.scan;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.LongStream;

/// Fallback when no markers are found: evenly spaced samples across the image, skipping a
/// margin at both ends where headers and trailers live.
public final class StrideScanLocator implements ContentLocator {

  private static final Logger logger = Logger.getLogger(StrideScanLocator.class.getName());

  public static final int DEFAULT_MARGIN = 4096;
  public static final int DEFAULT_SAMPLES = 1000;

  private final int margin;
  private final int samples;

  public StrideScanLocator() {
    this(DEFAULT_MARGIN, DEFAULT_SAMPLES);
  }

  public StrideScanLocator(int margin, int samples) {
    if (margin < 0 || samples < 1) {
      throw new IllegalArgumentException(
          String.format("margin must be >= 0 and samples > 0, got %d and %d", margin, samples));
    }
    this.margin = margin;
    this.samples = samples;
  }

  /// Offsets from `margin` in steps of `length / samples` (at least 1), stopping before
  /// `length - margin`. Empty when the image is no larger than twice the margin.
  @Override
  public LongStream locate(byte[] image) {
    final long length = image.length;
    final long stride = Math.max(1, length / samples);
    final long end = length - margin;
    logger.log(
        Level.FINE,
        () -> String.format("Stride scan over %d bytes, stride %d", length, stride));
    if (end <= margin) {
      return LongStream.empty();
    }
    return LongStream.iterate(margin, offset -> offset + stride).limit((end - margin + stride - 1) / stride);
  }
}
