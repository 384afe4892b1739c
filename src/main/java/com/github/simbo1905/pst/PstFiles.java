package com.github.simbo1905.pst;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Reads a whole image from disk and writes one back. Every call opens its own handle and
/// closes it on every exit path. When a call fails and the close fails too, the close
/// failure is logged and attached as suppressed; the original error is what propagates.
public final class PstFiles {

  private static final Logger logger = Logger.getLogger(PstFiles.class.getName());

  private PstFiles() {}

  public static byte[] read(Path path) throws IOException {
    logger.log(Level.FINE, () -> String.format("Reading image from %s", path));
    return read(new RandomAccessFile(new java.io.RandomAccessFile(path.toFile(), "r")));
  }

  /// Writes `image` to `path`, truncating whatever was there, and syncs before closing.
  public static void write(Path path, byte[] image) throws IOException {
    logger.log(
        Level.FINE, () -> String.format("Writing %d byte image to %s", image.length, path));
    write(new RandomAccessFile(new java.io.RandomAccessFile(path.toFile(), "rw")), image);
  }

  static byte[] read(FileOperations file) throws IOException {
    final byte[] image;
    try {
      final long length = file.length();
      if (length > Integer.MAX_VALUE) {
        throw new IOException(
            String.format("file of %d bytes is too large to load into memory", length));
      }
      image = new byte[(int) length];
      file.seek(0);
      file.readFully(image);
    } catch (IOException | RuntimeException e) {
      closeAfterFailure(file, e);
      throw e;
    }
    file.close();
    return image;
  }

  static void write(FileOperations file, byte[] image) throws IOException {
    try {
      file.setLength(image.length);
      file.seek(0);
      file.write(image, 0, image.length);
      file.sync();
    } catch (IOException | RuntimeException e) {
      closeAfterFailure(file, e);
      throw e;
    }
    file.close();
  }

  private static void closeAfterFailure(FileOperations file, Exception primary) {
    try {
      file.close();
    } catch (IOException closeException) {
      logger.log(Level.WARNING, "Failed to close file after an I/O failure", closeException);
      primary.addSuppressed(closeException);
    }
  }
}
