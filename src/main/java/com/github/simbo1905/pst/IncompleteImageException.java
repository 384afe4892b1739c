package com.github.simbo1905.pst;

/// The image was finalised before its indexes were built for the current content.
public class IncompleteImageException extends IllegalStateException {

  public IncompleteImageException(String message) {
    super(message);
  }
}
