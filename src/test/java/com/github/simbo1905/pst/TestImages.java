package com.github.simbo1905.pst;

import static com.github.simbo1905.pst.LittleEndian.putU32;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/// Fixtures shared by the image tests.
final class TestImages {

  private TestImages() {}

  /// A builder with system nodes and one "Hello" message in the inbox, indexes built.
  static PstImageBuilder withHelloMessage(PstConfig config) {
    final PstImageBuilder builder = new PstImageBuilder(config);
    builder.createSystemNodes();
    builder.addMessage(NodeIds.INBOX, "Hello", "a@b.com", "body text");
    builder.buildIndexes();
    return builder;
  }

  /// A copy of `image` whose BBT page no longer lists `blockId`. The header is left alone:
  /// its digests do not cover the BBT.
  static byte[] withoutBbtEntry(byte[] image, long blockId) {
    final PstImageParser parser = PstImageParser.open(image);
    final List<BbtEntry> entries = new ArrayList<>(parser.bbtEntries());
    if (!entries.removeIf(e -> e.blockId() == blockId)) {
      throw new IllegalArgumentException("no BBT entry for block " + blockId);
    }
    final FormatLayout layout = parser.header().layout();
    return withPage(image, parser.header().bbt(), BTreeCodec.encodePage(entries, layout.bbtLayout()));
  }

  /// A copy of `image` with `change` applied to the BBT entry of `blockId`.
  static byte[] withBbtEntry(byte[] image, long blockId, UnaryOperator<BbtEntry> change) {
    final PstImageParser parser = PstImageParser.open(image);
    final List<BbtEntry> entries =
        parser.bbtEntries().stream()
            .map(e -> e.blockId() == blockId ? change.apply(e) : e)
            .collect(Collectors.toList());
    final FormatLayout layout = parser.header().layout();
    return withPage(image, parser.header().bbt(), BTreeCodec.encodePage(entries, layout.bbtLayout()));
  }

  /// A copy of `image` whose NBT page keeps only the entries `keep` accepts.
  static byte[] withNbtEntries(byte[] image, Predicate<NbtEntry> keep) {
    final PstImageParser parser = PstImageParser.open(image);
    final List<NbtEntry> entries =
        parser.nbtEntries().stream().filter(keep).collect(Collectors.toList());
    final FormatLayout layout = parser.header().layout();
    return withPage(image, parser.header().nbt(), BTreeCodec.encodePage(entries, layout.nbtLayout()));
  }

  private static byte[] withPage(byte[] image, BlockLocation location, byte[] page) {
    final byte[] copy = image.clone();
    final int frame = (int) location.offset();
    putU32(copy, frame + 4, page.length);
    System.arraycopy(page, 0, copy, frame + BlockAllocator.FRAME_HEADER_SIZE, page.length);
    return copy;
  }

  /// A copy of `image` with a re-encoded header, digests valid for the changed fields.
  static byte[] withHeader(byte[] image, UnaryOperator<FileHeader> change) {
    final byte[] header = HeaderCodec.encode(change.apply(HeaderCodec.decode(image)));
    final byte[] copy = image.clone();
    System.arraycopy(header, 0, copy, 0, header.length);
    return copy;
  }

  static int indexOf(byte[] haystack, String text, Charset charset) {
    final byte[] needle = text.getBytes(charset);
    outer:
    for (int i = 0; i <= haystack.length - needle.length; i++) {
      for (int j = 0; j < needle.length; j++) {
        if (haystack[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }
}
