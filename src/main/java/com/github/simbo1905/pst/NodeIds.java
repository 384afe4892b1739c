package com.github.simbo1905.pst;

/// Node id numbering. A node id is `index << 5 | type`, where the low five bits give the
/// node type. The fixed system ids follow that rule too:
///
/// | node | id | index | type |
/// |---|---|---|---|
/// | message store | 0x21 | 1 | internal |
/// | name-to-id map | 0x61 | 3 | internal |
/// | root folder | 0x122 | 9 | folder |
/// | inbox | 0x142 | 10 | folder |
/// | outbox | 0x162 | 11 | folder |
/// | sent items | 0x182 | 12 | folder |
/// | deleted items | 0x1A2 | 13 | folder |
///
/// Folders and messages created at run time take indexes from [#FIRST_DYNAMIC_INDEX] up,
/// so the first message is 0x2004.
public final class NodeIds {

  private NodeIds() {}

  public static final int TYPE_INTERNAL = 0x01;
  public static final int TYPE_FOLDER = 0x02;
  public static final int TYPE_MESSAGE = 0x04;

  public static final int MESSAGE_STORE = 0x21;
  public static final int NAME_TO_ID_MAP = 0x61;
  public static final int ROOT_FOLDER = 0x122;
  public static final int INBOX = 0x142;
  public static final int OUTBOX = 0x162;
  public static final int SENT_ITEMS = 0x182;
  public static final int DELETED_ITEMS = 0x1A2;

  static final int FIRST_DYNAMIC_INDEX = 0x100;

  private static final int TYPE_BITS = 5;
  private static final int TYPE_MASK = (1 << TYPE_BITS) - 1;

  public static int make(int index, int type) {
    return index << TYPE_BITS | type;
  }

  public static int type(int nodeId) {
    return nodeId & TYPE_MASK;
  }

  public static int index(int nodeId) {
    return nodeId >>> TYPE_BITS;
  }
}
