package com.github.simbo1905.pst;

import java.util.Objects;

/// Resolved settings shared by the image builder, the parser and the property serializer.
/// Use [PstConfigBuilder] to create one; [#defaults()] gives the Unicode PST settings.
///
/// @param layout header and index layout written by builders
/// @param fileKind client magic written by builders
/// @param maxStringChars longest text value kept, in UTF-16 chars
/// @param maxFallbackChars longest text kept for values under tags with no typed encoding
/// @param propertyBufferBytes payload capacity of one property block
/// @param strictSignature when false the parser logs a bad signature and carries on
/// @param verifyChecksums when false the parser logs digest mismatches and carries on
/// @param storeDisplayName display name of the message store node
public record PstConfig(
    FormatLayout layout,
    FileKind fileKind,
    int maxStringChars,
    int maxFallbackChars,
    int propertyBufferBytes,
    boolean strictSignature,
    boolean verifyChecksums,
    String storeDisplayName) {

  public static final int DEFAULT_MAX_STRING_CHARS = 1000;
  public static final int DEFAULT_MAX_FALLBACK_CHARS = 500;
  public static final int DEFAULT_PROPERTY_BUFFER_BYTES = 64 * 1024;
  public static final String DEFAULT_STORE_DISPLAY_NAME = "Personal Folders";

  public PstConfig {
    Objects.requireNonNull(layout, "layout");
    Objects.requireNonNull(fileKind, "fileKind");
    Objects.requireNonNull(storeDisplayName, "storeDisplayName");
    if (fileKind == FileKind.UNKNOWN) {
      throw new IllegalArgumentException("fileKind must be PST or OST");
    }
    if (maxStringChars < 1 || maxFallbackChars < 1) {
      throw new IllegalArgumentException(
          String.format(
              "string limits must be positive, got maxStringChars=%d maxFallbackChars=%d",
              maxStringChars, maxFallbackChars));
    }
    if (propertyBufferBytes < Integer.BYTES) {
      throw new IllegalArgumentException(
          "propertyBufferBytes must hold at least the record count, got " + propertyBufferBytes);
    }
  }

  public static PstConfig defaults() {
    return new PstConfigBuilder().build();
  }

  /// The max string length from environment variable or system property
  /// `com.github.simbo1905.pst.PstConfig.MAX_STRING_CHARS`, the property winning.
  ///
  /// @throws IllegalArgumentException if the value is not a number between 1 and
  /// [PstConfigBuilder#MAX_CHARS]
  static int getMaxStringCharsOrDefault() {
    final String key = String.format("%s.%s", PstConfig.class.getName(), "MAX_STRING_CHARS");
    String maxChars =
        System.getenv(key) == null
            ? Integer.valueOf(DEFAULT_MAX_STRING_CHARS).toString()
            : System.getenv(key);
    maxChars = System.getProperty(key, maxChars);
    final int parsed;
    try {
      parsed = Integer.parseInt(maxChars.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be a number, got '%s'", key, maxChars), e);
    }
    return PstConfigBuilder.checkChars(key, parsed);
  }
}
