package com.github.simbo1905.pst;

/// Block type tag stored in the third word of every block frame.
public enum BlockType {
  /// B-tree page blocks.
  INTERNAL(1),
  /// Serialised node properties.
  DATA(2),
  SUBNODE(3);

  final int code;

  BlockType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  static BlockType fromCode(int code) {
    for (BlockType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new PstFormatException("unknown block type " + code);
  }
}
