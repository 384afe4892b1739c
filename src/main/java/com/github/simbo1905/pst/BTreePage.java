package com.github.simbo1905.pst;

import java.util.List;

/// A decoded B-tree page: header fields plus its entries in on-disk order.
///
/// @param pageType [BTreeCodec#LEAF_PAGE] for every page this library writes
/// @param level 0 for leaf pages
/// @param entries entries in the order they were stored
/// @param <E> [NbtEntry] or [BbtEntry]
public record BTreePage<E>(int pageType, int level, List<E> entries) {

  public BTreePage {
    entries = List.copyOf(entries);
  }

  public int entryCount() {
    return entries.size();
  }
}
