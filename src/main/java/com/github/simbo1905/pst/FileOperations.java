package com.github.simbo1905.pst;

import java.io.IOException;

/// The file calls [PstFiles] makes. A seam so tests can wrap the real file and inject
/// failures at a chosen call.
interface FileOperations {

  /// Forces buffered writes to the storage device.
  void sync() throws IOException;

  void readFully(byte[] b) throws IOException;

  void write(byte[] b, int off, int len) throws IOException;

  void seek(long pos) throws IOException;

  long length() throws IOException;

  void setLength(long newLength) throws IOException;

  void close() throws IOException;
}
