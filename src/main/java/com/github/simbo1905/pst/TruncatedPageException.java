package com.github.simbo1905.pst;

/// A B-tree page declares more entries than its bytes can hold.
public class TruncatedPageException extends TruncatedDataException {

  public TruncatedPageException(long offset, long required, long available) {
    super("b-tree page", offset, required, available);
  }
}
