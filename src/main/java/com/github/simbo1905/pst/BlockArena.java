package com.github.simbo1905.pst;

import java.io.ByteArrayOutputStream;

/// Growable append-only buffer holding framed blocks back to back. Extends
/// ByteArrayOutputStream to copy its contents out without an intermediate array.
class BlockArena extends ByteArrayOutputStream {

  BlockArena(int initialSize) {
    super(initialSize);
  }

  /// Copies the whole arena into `dest` starting at `destOff`.
  synchronized void copyTo(byte[] dest, int destOff) {
    System.arraycopy(super.buf, 0, dest, destOff, super.count);
  }
}
