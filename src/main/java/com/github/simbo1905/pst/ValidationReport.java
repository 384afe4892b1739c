package com.github.simbo1905.pst;

import java.util.List;

/// Outcome of [PstStructureValidator#validate]. Errors mean the image is structurally
/// broken; warnings flag images that are well formed but unusual.
public record ValidationReport(
    List<String> errors, List<String> warnings, int folderCount, int messageCount, long fileSize) {

  public ValidationReport {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
