package com.github.simbo1905.pst;

/// Signals bytes that do not form a valid image: bad signature, bad checksum, a
/// structure that cannot be decoded. Codecs always surface these; only callers doing
/// best-effort analysis may catch and continue.
public class PstFormatException extends IllegalStateException {

  public PstFormatException(String message) {
    super(message);
  }

  public PstFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
