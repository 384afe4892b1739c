package com.github.simbo1905.pst.scan;

import java.util.stream.LongStream;

/// Finds byte offsets in a raw image that are worth interpreting as content when the
/// indexes cannot be trusted. Offsets are candidates only; callers read and judge the bytes
/// themselves, for example through `PstImageParser.readRange`.
@FunctionalInterface
public interface ContentLocator {

  /// Candidate offsets in ascending order. Each call returns a fresh lazy stream, so a scan
  /// can be restarted by calling again.
  LongStream locate(byte[] image);
}
