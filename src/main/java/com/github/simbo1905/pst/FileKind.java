package com.github.simbo1905.pst;

/// Which client wrote the file, from the two-byte magic at header offset 8.
public enum FileKind {
  /// Personal storage table, magic `SM`.
  PST(0x4D53),
  /// Offline storage table, magic `SO`.
  OST(0x4F53),
  UNKNOWN(0);

  final int clientMagic;

  FileKind(int clientMagic) {
    this.clientMagic = clientMagic;
  }

  public int clientMagic() {
    return clientMagic;
  }

  static FileKind fromMagic(int magic) {
    if (magic == PST.clientMagic) {
      return PST;
    }
    if (magic == OST.clientMagic) {
      return OST;
    }
    return UNKNOWN;
  }
}
