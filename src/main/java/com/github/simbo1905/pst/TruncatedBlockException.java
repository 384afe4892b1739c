package com.github.simbo1905.pst;

/// A block frame, block payload or raw byte range runs past the end of the image.
public class TruncatedBlockException extends TruncatedDataException {

  public TruncatedBlockException(long offset, long required, long available) {
    super("block", offset, required, available);
  }
}
