package com.github.simbo1905.pst;

import java.util.Optional;

/// One message handed to the builder by a [MessageSource].
///
/// @param htmlBody null when the message has no HTML part
public record MessageRecord(String subject, String sender, String body, String htmlBody) {

  public MessageRecord(String subject, String sender, String body) {
    this(subject, sender, body, null);
  }

  public Optional<String> html() {
    return Optional.ofNullable(htmlBody);
  }
}
