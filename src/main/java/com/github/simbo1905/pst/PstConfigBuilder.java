package com.github.simbo1905.pst;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fluent builder for [PstConfig], plus shortcuts that use the resolved config to start a
/// new image, open an existing file or save a built image.
///
/// Example usage:
/// <pre>
/// PstConfigBuilder files = new PstConfigBuilder()
///     .path("/path/to/mail.pst")
///     .layout(FormatLayout.UNICODE)
///     .maxStringChars(2000);
/// PstImageBuilder image = files.newImage();
/// image.addMessage(NodeIds.INBOX, "Hello", "a@b.com", "body text");
/// files.save(image);
/// PstImageParser parser = files.open();
/// </pre>
public class PstConfigBuilder {

  private static final Logger logger = Logger.getLogger(PstConfigBuilder.class.getName());

  /// Upper bound for string limits; a longer value could never fit a property block.
  public static final int MAX_CHARS = PstConfig.DEFAULT_PROPERTY_BUFFER_BYTES / 2;

  private FormatLayout layout = FormatLayout.UNICODE;
  private FileKind fileKind = FileKind.PST;
  private int maxStringChars = PstConfig.getMaxStringCharsOrDefault();
  private int maxFallbackChars = PstConfig.DEFAULT_MAX_FALLBACK_CHARS;
  private int propertyBufferBytes = PstConfig.DEFAULT_PROPERTY_BUFFER_BYTES;
  private boolean strictSignature = true;
  private boolean verifyChecksums = true;
  private String storeDisplayName = PstConfig.DEFAULT_STORE_DISPLAY_NAME;

  private Path path;
  private String tempFilePrefix;
  private String tempFileSuffix;

  /// Copies every setting of `config`.
  ///
  /// @return this builder for chaining
  public PstConfigBuilder from(PstConfig config) {
    this.layout = config.layout();
    this.fileKind = config.fileKind();
    this.maxStringChars = config.maxStringChars();
    this.maxFallbackChars = config.maxFallbackChars();
    this.propertyBufferBytes = config.propertyBufferBytes();
    this.strictSignature = config.strictSignature();
    this.verifyChecksums = config.verifyChecksums();
    this.storeDisplayName = config.storeDisplayName();
    return this;
  }

  /// Sets the path of the image file.
  ///
  /// @return this builder for chaining
  public PstConfigBuilder path(Path path) {
    this.path = path;
    return this;
  }

  /// Sets the path of the image file from a string, normalised.
  ///
  /// @return this builder for chaining
  public PstConfigBuilder path(String path) {
    this.path = Paths.get(path).normalize();
    return this;
  }

  /// Saves to a new temporary file, deleted on JVM exit.
  ///
  /// @return this builder for chaining
  public PstConfigBuilder tempFile(String prefix, String suffix) {
    this.tempFilePrefix = prefix;
    this.tempFileSuffix = suffix;
    return this;
  }

  public PstConfigBuilder layout(FormatLayout layout) {
    this.layout = Objects.requireNonNull(layout, "layout");
    return this;
  }

  /// PST or OST client magic.
  ///
  /// @throws IllegalArgumentException for [FileKind#UNKNOWN]
  public PstConfigBuilder fileKind(FileKind fileKind) {
    if (Objects.requireNonNull(fileKind, "fileKind") == FileKind.UNKNOWN) {
      throw new IllegalArgumentException("fileKind must be PST or OST");
    }
    this.fileKind = fileKind;
    return this;
  }

  /// Longest text property value kept, in UTF-16 chars.
  ///
  /// @param maxStringChars 1 to [#MAX_CHARS]
  /// @return this builder for chaining
  public PstConfigBuilder maxStringChars(int maxStringChars) {
    this.maxStringChars = checkChars("maxStringChars", maxStringChars);
    return this;
  }

  /// Longest text kept for values under tags with no typed encoding.
  ///
  /// @param maxFallbackChars 1 to [#MAX_CHARS]
  /// @return this builder for chaining
  public PstConfigBuilder maxFallbackChars(int maxFallbackChars) {
    this.maxFallbackChars = checkChars("maxFallbackChars", maxFallbackChars);
    return this;
  }

  static int checkChars(String name, int value) {
    if (value < 1 || value > MAX_CHARS) {
      throw new IllegalArgumentException(
          String.format("%s must be between 1 and %d, got %d", name, MAX_CHARS, value));
    }
    return value;
  }

  /// Capacity of one property block payload. Properties that do not fit are dropped.
  ///
  /// @param bytes at least 4, at most the default of 64 KiB
  /// @return this builder for chaining
  public PstConfigBuilder propertyBufferBytes(int bytes) {
    if (bytes < Integer.BYTES || bytes > PstConfig.DEFAULT_PROPERTY_BUFFER_BYTES) {
      throw new IllegalArgumentException(
          String.format(
              "propertyBufferBytes must be between %d and %d, got %d",
              Integer.BYTES, PstConfig.DEFAULT_PROPERTY_BUFFER_BYTES, bytes));
    }
    this.propertyBufferBytes = bytes;
    return this;
  }

  /// When false a bad signature is logged at WARNING and reading carries on.
  public PstConfigBuilder strictSignature(boolean strictSignature) {
    this.strictSignature = strictSignature;
    return this;
  }

  /// When false CRC and checksum mismatches are logged at WARNING and reading carries on.
  public PstConfigBuilder verifyChecksums(boolean verifyChecksums) {
    this.verifyChecksums = verifyChecksums;
    return this;
  }

  public PstConfigBuilder storeDisplayName(String storeDisplayName) {
    this.storeDisplayName = Objects.requireNonNull(storeDisplayName, "storeDisplayName");
    return this;
  }

  public PstConfig build() {
    final PstConfig config =
        new PstConfig(
            layout,
            fileKind,
            maxStringChars,
            maxFallbackChars,
            propertyBufferBytes,
            strictSignature,
            verifyChecksums,
            storeDisplayName);
    logger.log(Level.FINER, () -> "Resolved " + config);
    return config;
  }

  /// A new image builder with the system nodes already created.
  public PstImageBuilder newImage() {
    final PstImageBuilder builder = new PstImageBuilder(build());
    builder.createSystemNodes();
    return builder;
  }

  /// Reads and opens the image at the configured path.
  ///
  /// @throws IllegalStateException if no path was set
  public PstImageParser open() throws IOException {
    if (path == null) {
      throw new IllegalStateException("path must be specified to open an image");
    }
    return PstImageParser.open(path, build());
  }

  /// Builds indexes if needed, finalizes `image` and writes it to the configured path or
  /// a new temporary file.
  ///
  /// @return where the image was written
  /// @throws IllegalStateException if neither path nor tempFile was set
  public Path save(PstImageBuilder image) throws IOException {
    final Path target;
    if (tempFilePrefix != null && tempFileSuffix != null) {
      target = Files.createTempFile(tempFilePrefix, tempFileSuffix);
      target.toFile().deleteOnExit();
    } else if (path != null) {
      target = path;
    } else {
      throw new IllegalStateException("Either path or tempFile must be specified");
    }
    PstFiles.write(target, image.build());
    logger.log(Level.FINE, () -> String.format("Saved image to %s", target));
    return target;
  }
}
