package com.github.simbo1905.pst;

import lombok.Getter;

/// The first four bytes of the header are not the `!BDN` magic.
public class BadSignatureException extends PstFormatException {

  @Getter private final long actualSignature;

  public BadSignatureException(long actualSignature) {
    super(
        String.format(
            "bad signature 0x%08X expected 0x%08X",
            actualSignature, HeaderCodec.SIGNATURE & 0xFFFFFFFFL));
    this.actualSignature = actualSignature;
  }
}
