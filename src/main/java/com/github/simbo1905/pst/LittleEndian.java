package com.github.simbo1905.pst;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/// Fixed-width little-endian reads and writes over byte arrays.
///
/// Every value wider than 32 bits is carried in a `long` end to end. Splitting into
/// (low, high) halves and joining them back uses shifts and masks only, so offsets above
/// 2^53 survive unchanged.
public final class LittleEndian {

  private LittleEndian() {}

  static ByteBuffer wrap(byte[] bytes) {
    return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
  }

  static ByteBuffer allocate(int size) {
    return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
  }

  static int u8(byte[] b, int off) {
    return b[off] & 0xFF;
  }

  static int u16(byte[] b, int off) {
    return (b[off] & 0xFF) | (b[off + 1] & 0xFF) << 8;
  }

  /// Unsigned 32-bit value widened to a long.
  static long u32(byte[] b, int off) {
    return i32(b, off) & 0xFFFFFFFFL;
  }

  /// Signed 32-bit value at `off`.
  public static int i32(byte[] b, int off) {
    return (b[off] & 0xFF)
        | (b[off + 1] & 0xFF) << 8
        | (b[off + 2] & 0xFF) << 16
        | (b[off + 3] & 0xFF) << 24;
  }

  static long u64(byte[] b, int off) {
    return join(u32(b, off), u32(b, off + 4));
  }

  static void putU8(byte[] b, int off, int v) {
    b[off] = (byte) v;
  }

  static void putU16(byte[] b, int off, int v) {
    b[off] = (byte) v;
    b[off + 1] = (byte) (v >>> 8);
  }

  static void putU32(byte[] b, int off, long v) {
    b[off] = (byte) v;
    b[off + 1] = (byte) (v >>> 8);
    b[off + 2] = (byte) (v >>> 16);
    b[off + 3] = (byte) (v >>> 24);
  }

  static void putU64(byte[] b, int off, long v) {
    putU32(b, off, low(v));
    putU32(b, off + 4, high(v));
  }

  /// Reassembles a 64-bit value from its unsigned 32-bit halves.
  static long join(long low, long high) {
    return (high & 0xFFFFFFFFL) << 32 | (low & 0xFFFFFFFFL);
  }

  static long low(long v) {
    return v & 0xFFFFFFFFL;
  }

  static long high(long v) {
    return v >>> 32;
  }

  /// Rounds `size` up to the next multiple of `alignment`, which must be a power of two.
  static long alignUp(long size, int alignment) {
    return (size + alignment - 1) & -(long) alignment;
  }

  static String hex(byte[] bytes, int off, int len) {
    StringBuilder sb = new StringBuilder();
    sb.append("[ ");
    for (int i = off; i < off + len && i < bytes.length; i++) {
      sb.append(String.format("%02X ", bytes[i]));
    }
    sb.append("]");
    return sb.toString();
  }
}
