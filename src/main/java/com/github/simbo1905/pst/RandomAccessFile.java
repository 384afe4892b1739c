package com.github.simbo1905.pst;

import java.io.IOException;

record RandomAccessFile(java.io.RandomAccessFile randomAccessFile) implements FileOperations {

  @Override
  public void sync() throws IOException {
    randomAccessFile.getChannel().force(false);
  }

  public void readFully(byte[] b) throws IOException {
    randomAccessFile.readFully(b);
  }

  public void write(byte[] b, int off, int len) throws IOException {
    randomAccessFile.write(b, off, len);
  }

  public void seek(long pos) throws IOException {
    randomAccessFile.seek(pos);
  }

  public long length() throws IOException {
    return randomAccessFile.length();
  }

  public void setLength(long newLength) throws IOException {
    randomAccessFile.setLength(newLength);
  }

  public void close() throws IOException {
    randomAccessFile.close();
  }
}
