package com.github.simbo1905.pst;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/// A finite sequence of messages to store, drained by [PstImageBuilder#addMessages].
@FunctionalInterface
public interface MessageSource {

  /// The next message, or empty once the source is exhausted.
  Optional<MessageRecord> nextMessage();

  static MessageSource of(List<MessageRecord> messages) {
    final Iterator<MessageRecord> it = List.copyOf(messages).iterator();
    return () -> it.hasNext() ? Optional.of(it.next()) : Optional.empty();
  }
}
