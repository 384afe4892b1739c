package com.github.simbo1905.pst;

/// The property tags this library reads and writes.
public final class PropertyTags {

  private PropertyTags() {}

  public static final PropertyTag MESSAGE_CLASS = PropertyTag.of(0x001A001F);
  public static final PropertyTag SUBJECT = PropertyTag.of(0x0037001F);
  public static final PropertyTag SENDER_NAME = PropertyTag.of(0x0C1A001F);
  public static final PropertyTag SENDER_EMAIL = PropertyTag.of(0x0C1F001F);
  public static final PropertyTag MESSAGE_SIZE = PropertyTag.of(0x0E080003);
  public static final PropertyTag BODY = PropertyTag.of(0x1000001F);
  public static final PropertyTag BODY_HTML = PropertyTag.of(0x1013001F);
  public static final PropertyTag DISPLAY_NAME = PropertyTag.of(0x3001001F);
  public static final PropertyTag CREATION_TIME = PropertyTag.of(0x30070040);
  public static final PropertyTag LAST_MODIFICATION_TIME = PropertyTag.of(0x30080040);
  public static final PropertyTag CONTENT_COUNT = PropertyTag.of(0x36020003);
  public static final PropertyTag CONTAINER_CLASS = PropertyTag.of(0x3613001F);
  public static final PropertyTag NAMEID_BUCKET_COUNT = PropertyTag.of(0x00010003);
}
