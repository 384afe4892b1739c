package com.github.simbo1905.pst;

import lombok.Getter;

/// A message or folder was added under a node id that is not a registered folder.
public class UnknownFolderException extends IllegalArgumentException {

  @Getter private final int folderId;

  public UnknownFolderException(int folderId) {
    super(String.format("no folder with node id 0x%X", folderId));
    this.folderId = folderId;
  }
}
