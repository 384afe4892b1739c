package com.github.simbo1905.pst;

import lombok.Getter;

/// Fewer bytes are available at a claimed offset than the structure there declares.
public class TruncatedDataException extends PstFormatException {

  /// File offset of the structure that could not be read in full.
  @Getter private final long offset;

  @Getter private final long required;

  @Getter private final long available;

  public TruncatedDataException(String what, long offset, long required, long available) {
    super(
        String.format(
            "truncated %s at offset %d: requires %d bytes but only %d available",
            what, offset, required, available));
    this.offset = offset;
    this.required = required;
    this.available = available;
  }
}
