package com.github.simbo1905.pst;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PstConfigBuilderTest extends JulLoggingConfig {

  private static final String MAX_STRING_CHARS_KEY =
      "com.github.simbo1905.pst.PstConfig.MAX_STRING_CHARS";

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testDefaults() {
    final PstConfig config = new PstConfigBuilder().build();
    assertEquals(FormatLayout.UNICODE, config.layout());
    assertEquals(FileKind.PST, config.fileKind());
    assertEquals(PstConfig.DEFAULT_MAX_FALLBACK_CHARS, config.maxFallbackChars());
    assertEquals(PstConfig.DEFAULT_PROPERTY_BUFFER_BYTES, config.propertyBufferBytes());
    assertTrue(config.strictSignature());
    assertTrue(config.verifyChecksums());
    assertEquals("Personal Folders", config.storeDisplayName());
  }

  @Test
  public void testSystemPropertyOverridesMaxStringChars() {
    final String previous = System.getProperty(MAX_STRING_CHARS_KEY);
    System.setProperty(MAX_STRING_CHARS_KEY, "42");
    try {
      assertEquals(42, new PstConfigBuilder().build().maxStringChars());
      assertEquals(7, new PstConfigBuilder().maxStringChars(7).build().maxStringChars());
    } finally {
      if (previous == null) {
        System.clearProperty(MAX_STRING_CHARS_KEY);
      } else {
        System.setProperty(MAX_STRING_CHARS_KEY, previous);
      }
    }
  }

  @Test
  public void testValidation() {
    final PstConfigBuilder builder = new PstConfigBuilder();
    assertThrows(IllegalArgumentException.class, () -> builder.maxStringChars(0));
    assertThrows(
        IllegalArgumentException.class, () -> builder.maxFallbackChars(PstConfigBuilder.MAX_CHARS + 1));
    assertThrows(IllegalArgumentException.class, () -> builder.propertyBufferBytes(3));
    assertThrows(IllegalArgumentException.class, () -> builder.fileKind(FileKind.UNKNOWN));
    assertThrows(NullPointerException.class, () -> builder.layout(null));
  }

  @Test
  public void testFromCopiesEverySetting() {
    final PstConfig config =
        new PstConfigBuilder()
            .layout(FormatLayout.ANSI)
            .fileKind(FileKind.OST)
            .maxStringChars(10)
            .maxFallbackChars(20)
            .propertyBufferBytes(4096)
            .strictSignature(false)
            .verifyChecksums(false)
            .storeDisplayName("Offline")
            .build();
    assertEquals(config, new PstConfigBuilder().from(config).build());
  }

  @Test
  public void testMaxStringCharsAppliesToImages() {
    final PstImageBuilder builder = new PstConfigBuilder().maxStringChars(5).newImage();
    final int nid = builder.addMessage(NodeIds.INBOX, "Hello world", "a@b.com", "body");
    final PstImageParser parser = PstImageParser.open(builder.build());
    assertEquals("Hello", parser.readProperties(nid).getString(PropertyTags.SUBJECT).orElseThrow());
  }

  @Test
  public void testSaveAndOpen() throws IOException {
    final Path path = tempFolder.getRoot().toPath().resolve("saved.pst");
    final PstConfigBuilder files = new PstConfigBuilder().path(path);
    final PstImageBuilder image = files.newImage();
    final int nid = image.addMessage(NodeIds.INBOX, "Saved", "a@b.com", "on disk");

    assertEquals(path, files.save(image));
    assertTrue(Files.exists(path));

    final PstImageParser parser = files.open();
    assertEquals(Files.size(path), parser.header().totalSize());
    assertEquals("Saved", parser.readProperties(nid).getString(PropertyTags.SUBJECT).orElseThrow());
  }

  @Test
  public void testSaveToTempFile() throws IOException {
    final PstConfigBuilder files = new PstConfigBuilder().tempFile("pst-", ".pst");
    final Path saved = files.save(files.newImage());
    assertTrue(Files.size(saved) > 0);
    assertTrue(new PstStructureValidator().validate(Files.readAllBytes(saved)).isValid());
  }

  @Test
  public void testSaveAndOpenNeedALocation() {
    final PstConfigBuilder files = new PstConfigBuilder();
    assertThrows(IllegalStateException.class, () -> files.save(files.newImage()));
    assertThrows(IllegalStateException.class, files::open);
  }

  @Test
  public void testInvalidMaxStringCharsOverrideIsRejected() {
    final String previous = System.getProperty(MAX_STRING_CHARS_KEY);
    try {
      System.setProperty(MAX_STRING_CHARS_KEY, "lots");
      final IllegalArgumentException notNumber =
          assertThrows(IllegalArgumentException.class, PstConfigBuilder::new);
      assertTrue(notNumber.getMessage(), notNumber.getMessage().contains("must be a number"));

      System.setProperty(MAX_STRING_CHARS_KEY, String.valueOf(PstConfigBuilder.MAX_CHARS + 1));
      assertThrows(IllegalArgumentException.class, PstConfigBuilder::new);

      System.setProperty(MAX_STRING_CHARS_KEY, "0");
      assertThrows(IllegalArgumentException.class, PstConfigBuilder::new);
    } finally {
      if (previous == null) {
        System.clearProperty(MAX_STRING_CHARS_KEY);
      } else {
        System.setProperty(MAX_STRING_CHARS_KEY, previous);
      }
    }
  }
}
