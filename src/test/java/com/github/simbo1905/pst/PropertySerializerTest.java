package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.u32;
import static com.github.simbo1905.pst.LittleEndian.u64;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

import java.time.Instant;
import java.util.Arrays;
import org.junit.Test;

public class PropertySerializerTest extends JulLoggingConfig {

  private final PropertySerializer serializer = new PropertySerializer(PstConfig.defaults());

  @Test
  public void testMessagePropertiesRoundTrip() {
    final PropertySet properties =
        new PropertySet()
            .putString(PropertyTags.SUBJECT, "Hello")
            .putString(PropertyTags.SENDER_NAME, "a@b.com")
            .putString(PropertyTags.BODY, "body text with ünïcödé and 😀")
            .putInt(PropertyTags.MESSAGE_SIZE, 0xFFFFFFFFL)
            .putTime(PropertyTags.CREATION_TIME, Instant.parse("2024-05-06T07:08:09.123Z"));

    final PropertySet decoded = serializer.deserialize(serializer.serialize(properties));
    assertEquals(properties, decoded);
    assertThat(
        decoded.getTime(PropertyTags.CREATION_TIME).orElseThrow(),
        is(Instant.parse("2024-05-06T07:08:09.123Z")));
  }

  @Test
  public void testUnicodeRecordLayout() {
    final byte[] payload =
        serializer.serialize(new PropertySet().putString(PropertyTags.SUBJECT, "Hi"));
    final byte[] expected = {
      1, 0, 0, 0, // count
      0x1F, 0x00, 0x37, 0x00, // tag 0x0037001F
      4, 0, 0, 0, // byte length
      'H', 0, 'i', 0
    };
    assertArrayEquals(expected, payload);
  }

  @Test
  public void testFileTimeUsesWindowsEpoch() {
    final byte[] payload =
        serializer.serialize(new PropertySet().putTime(PropertyTags.CREATION_TIME, Instant.EPOCH));
    assertEquals(116_444_736_000_000_000L, u64(payload, 8));
    assertEquals(Instant.EPOCH, new PropertyValue.FileTime(u64(payload, 8)).toInstant());
  }

  @Test
  public void testLongTextIsTruncated() {
    final PropertySerializer small = new PropertySerializer(5, 3, 1024);
    final PropertyTag binary = PropertyTag.of(0x00010102);
    final PropertySet decoded =
        small.deserialize(
            small.serialize(
                new PropertySet()
                    .putString(PropertyTags.SUBJECT, "Hello world")
                    .putString(binary, "abcdef")));
    assertEquals("Hello", decoded.getString(PropertyTags.SUBJECT).orElseThrow());
    assertEquals("abc", decoded.getString(binary).orElseThrow());
  }

  @Test
  public void testTruncateKeepsSurrogatePairsWhole() {
    assertEquals("ab", PropertySerializer.truncate("ab😀", 3));
    assertEquals("ab😀", PropertySerializer.truncate("ab😀", 4));
    assertEquals("short", PropertySerializer.truncate("short", 10));
  }

  @Test
  public void testUnknownTypeFallsBackToUtf8() {
    final PropertyTag binary = PropertyTag.of(0x00010102);
    final byte[] payload = serializer.serialize(new PropertySet().putString(binary, "é"));
    assertEquals(2, u32(payload, 8));
    assertEquals(
        "é", serializer.deserialize(payload).getString(binary).orElseThrow());
  }

  @Test
  public void testPropertyThatDoesNotFitIsDroppedAndCountAdjusted() {
    final PropertySerializer small = new PropertySerializer(1000, 500, 64);
    final PropertySet properties =
        new PropertySet()
            .putString(PropertyTags.SUBJECT, "x".repeat(100))
            .putInt(PropertyTags.MESSAGE_SIZE, 42);

    final byte[] payload = small.serialize(properties);
    assertTrue(payload.length <= 64);
    assertEquals(1, u32(payload, 0));

    final PropertySet decoded = small.deserialize(payload);
    assertFalse(decoded.contains(PropertyTags.SUBJECT));
    assertEquals(Long.valueOf(42), decoded.getInt(PropertyTags.MESSAGE_SIZE).orElseThrow());
  }

  @Test
  public void testTruncatedPayloadReportsOffset() {
    final byte[] payload =
        serializer.serialize(new PropertySet().putString(PropertyTags.SUBJECT, "Hello"));
    final byte[] cut = Arrays.copyOf(payload, payload.length - 2);
    final TruncatedBlockException e =
        assertThrows(
            TruncatedBlockException.class, () -> serializer.deserialize(cut, 0, cut.length, 1000));
    assertEquals(1000 + 12, e.getOffset());
  }

  @Test
  public void testTypeMismatchRejected() {
    final PropertySet properties = new PropertySet();
    assertThrows(
        IllegalArgumentException.class,
        () -> properties.put(PropertyTags.SUBJECT, PropertyValue.of(7L)));
    assertThrows(
        IllegalArgumentException.class,
        () -> properties.put(PropertyTags.MESSAGE_SIZE, PropertyValue.of("7")));
    assertThrows(IllegalArgumentException.class, () -> PropertyValue.of(-1L));
  }
}
