package com.github.simbo1905.pst;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class PstStructureValidatorTest extends JulLoggingConfig {

  private final PstStructureValidator validator = new PstStructureValidator();

  private static byte[] twoMessageImage() {
    final PstImageBuilder builder = new PstImageBuilder();
    builder.createSystemNodes();
    builder.addMessage(NodeIds.INBOX, "one", "a@b.com", "first");
    builder.addMessage(NodeIds.SENT_ITEMS, "two", "c@d.com", "second");
    return builder.build();
  }

  @Test
  public void testValidImage() {
    final byte[] image = twoMessageImage();
    final ValidationReport report = validator.validate(image);
    assertTrue(report.errors().toString(), report.isValid());
    assertThat(report.warnings(), empty());
    assertEquals(5, report.folderCount());
    assertEquals(2, report.messageCount());
    assertEquals(image.length, report.fileSize());
  }

  @Test
  public void testEmptyImageWarns() {
    final PstImageBuilder builder = new PstImageBuilder();
    builder.createSystemNodes();
    final ValidationReport report = validator.validate(builder.build());
    assertTrue(report.isValid());
    assertThat(report.warnings(), hasItem(containsString("no messages")));
  }

  @Test
  public void testTrailingBytesAreReported() {
    final byte[] image = twoMessageImage();
    final ValidationReport report = validator.validate(Arrays.copyOf(image, image.length + 512));
    assertFalse(report.isValid());
    assertThat(report.errors(), hasItem(containsString("does not match file size")));
  }

  @Test
  public void testBadSignatureStillCounts() {
    final byte[] image = twoMessageImage();
    image[0] = 'X';
    final ValidationReport report = validator.validate(image);
    assertFalse(report.isValid());
    assertThat(report.errors(), hasItem(containsString("bad signature")));
    assertEquals(2, report.messageCount());
  }

  @Test
  public void testMissingBbtEntry() {
    final PstImageBuilder builder = TestImages.withHelloMessage(PstConfig.defaults());
    final byte[] image = builder.finalizeImage();
    final int messageId = NodeIds.make(NodeIds.FIRST_DYNAMIC_INDEX, NodeIds.TYPE_MESSAGE);
    final byte[] corrupt =
        TestImages.withoutBbtEntry(image, builder.blockIdOf(messageId).orElseThrow());

    final ValidationReport report = validator.validate(corrupt);
    assertFalse(report.isValid());
    assertThat(report.errors(), hasItem(containsString("not in the BBT")));
  }

  @Test
  public void testUnreadableInput() {
    final ValidationReport report = validator.validate(new byte[100]);
    assertFalse(report.isValid());
    assertEquals(0, report.messageCount());
    assertThat(report.errors(), not(empty()));
  }

  @Test
  public void testReportIsImmutable() {
    final ValidationReport report = validator.validate(twoMessageImage());
    final List<String> errors = report.errors();
    assertThrows(UnsupportedOperationException.class, () -> errors.add("x"));
  }

  @Test
  public void testBlockOffsetNearLongMaxIsReported() {
    final byte[] image = twoMessageImage();
    final PstImageParser parser = PstImageParser.open(image);
    final NbtEntry message =
        parser.nbtEntries().stream()
            .filter(n -> NodeKind.fromNodeId(n.nodeId()) == NodeKind.MESSAGE)
            .findFirst()
            .orElseThrow();
    final byte[] corrupt =
        TestImages.withBbtEntry(
            image,
            message.blockId(),
            e -> new BbtEntry(e.blockId(), Long.MAX_VALUE - 7, e.size(), e.refCount()));

    final ValidationReport report = validator.validate(corrupt);
    assertFalse(report.isValid());
    assertThat(report.errors(), hasItem(containsString("lies outside")));
    assertThat(report.errors(), hasItem(containsString(String.valueOf(Long.MAX_VALUE - 7))));
    assertEquals(2, report.messageCount());
  }

  @Test
  public void testHeaderLocatorNearLongMaxIsReported() {
    final byte[] corrupt =
        TestImages.withHeader(
            twoMessageImage(),
            h -> h.withLocators(new BlockLocation(Long.MAX_VALUE - 7, h.nbt().size()), h.bbt()));
    final ValidationReport report = validator.validate(corrupt);
    assertFalse(report.isValid());
    assertThat(report.errors(), hasItem(containsString("cannot open indexes")));
  }

  @Test
  public void testLocatorSizeMismatchIsReported() {
    final byte[] corrupt =
        TestImages.withHeader(
            twoMessageImage(),
            h -> h.withLocators(new BlockLocation(h.nbt().offset(), 16), h.bbt()));
    final ValidationReport report = validator.validate(corrupt);
    assertFalse(report.isValid());
    assertThat(report.errors(), hasItem(containsString("NBT locator size 16")));
  }

  @Test
  public void testIndexBlockMissingFromBbtIsReported() {
    final byte[] image = twoMessageImage();
    final PstImageParser parser = PstImageParser.open(image);
    final long nbtBlock =
        parser.bbtEntries().stream()
            .filter(e -> e.offset() == parser.header().nbt().offset())
            .findFirst()
            .orElseThrow()
            .blockId();

    final ValidationReport report = validator.validate(TestImages.withoutBbtEntry(image, nbtBlock));
    assertFalse(report.isValid());
    assertThat(
        report.errors(), hasItem(containsString("NBT locator offset")));
    assertThat(report.errors(), hasItem(containsString("not the offset of any block in the BBT")));
  }

  @Test
  public void testNoFoldersWarns() {
    final byte[] corrupt =
        TestImages.withNbtEntries(
            twoMessageImage(), n -> NodeKind.fromNodeId(n.nodeId()) != NodeKind.FOLDER);
    final ValidationReport report = validator.validate(corrupt);
    assertEquals(0, report.folderCount());
    assertThat(report.warnings(), hasItem("image contains no folders"));
  }
}
