package com.github.simbo1905.pst;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class BTreeCodecTest extends JulLoggingConfig {

  private static final EntryLayout<NbtEntry> NBT = FormatLayout.UNICODE.nbtLayout();
  private static final EntryLayout<BbtEntry> BBT = FormatLayout.UNICODE.bbtLayout();

  private static List<NbtEntry> nbtEntries(int count) {
    final List<NbtEntry> entries = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      entries.add(new NbtEntry(NodeIds.make(0x100 + i, NodeIds.TYPE_MESSAGE), 0x100 + i, 0, NodeIds.INBOX));
    }
    return entries;
  }

  @Test
  public void testNbtPageRoundTrip() {
    final List<NbtEntry> entries = nbtEntries(3);
    final byte[] page = BTreeCodec.encodePage(entries, NBT);
    assertEquals(512, page.length);
    assertEquals(BTreeCodec.LEAF_PAGE, page[0] & 0xFF);
    assertEquals(BTreeCodec.LEAF_LEVEL, page[1]);
    assertEquals(3, LittleEndian.u16(page, 2));

    final BTreePage<NbtEntry> decoded = BTreeCodec.decodePage(page, NBT);
    assertEquals(BTreeCodec.LEAF_PAGE, decoded.pageType());
    assertEquals(entries, decoded.entries());
  }

  @Test
  public void testUnicodeEntryLayoutOffsets() {
    final NbtEntry entry = new NbtEntry(0x2004, (1L << 40) + 5, 0, 0x142);
    final byte[] page = BTreeCodec.encodePage(List.of(entry), NBT);
    final int off = BTreeCodec.PAGE_HEADER_SIZE;
    assertEquals(0x2004, LittleEndian.u32(page, off));
    assertEquals((1L << 40) + 5, LittleEndian.u64(page, off + 8));
    assertEquals(0, LittleEndian.u64(page, off + 16));
    assertEquals(0x142, LittleEndian.u32(page, off + 24));
  }

  @Test
  public void testBbtKeepsSizeInUnicodeAndDropsItInAnsi() {
    final List<BbtEntry> entries =
        List.of(new BbtEntry(0x100, 564, 512, 1), new BbtEntry(0x101, 1076, 1024, 0));
    assertEquals(entries, BTreeCodec.decodePage(BTreeCodec.encodePage(entries, BBT), BBT).entries());

    final EntryLayout<BbtEntry> ansi = FormatLayout.ANSI.bbtLayout();
    final List<BbtEntry> decoded =
        BTreeCodec.decodePage(BTreeCodec.encodePage(entries, ansi), ansi).entries();
    assertEquals(0, decoded.get(1).size());
    assertEquals(entries.get(1).withSize(0), decoded.get(1));
  }

  @Test
  public void testPageLength() {
    assertEquals(512, BTreeCodec.pageLength(0, NBT));
    assertEquals(512, BTreeCodec.pageLength(15, NBT));
    assertEquals(16 + 16 * 32, BTreeCodec.pageLength(16, NBT));
    assertEquals(16 + 100 * 24, BTreeCodec.pageLength(100, BBT));
  }

  @Test
  public void testUnsortedEntriesRejected() {
    final List<NbtEntry> entries = nbtEntries(3);
    Collections.reverse(entries);
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> BTreeCodec.encodePage(entries, NBT));
    assertThat(e.getMessage(), containsString("ascending"));
    assertFalse(BTreeCodec.isStrictlyAscending(entries, NBT));
  }

  @Test
  public void testDuplicateKeysRejected() {
    final NbtEntry entry = nbtEntries(1).get(0);
    assertThrows(
        IllegalArgumentException.class, () -> BTreeCodec.encodePage(List.of(entry, entry), NBT));
  }

  @Test
  public void testKeysCompareUnsigned() {
    final NbtEntry small = new NbtEntry(0x10, 1, 0, 0);
    final NbtEntry large = new NbtEntry(0x80000000, 2, 0, 0);
    assertThat(BTreeCodec.isStrictlyAscending(List.of(small, large), NBT), is(true));
    BTreeCodec.encodePage(List.of(small, large), NBT);
    assertThrows(
        IllegalArgumentException.class, () -> BTreeCodec.encodePage(List.of(large, small), NBT));
  }

  @Test
  public void testTruncatedPage() {
    final byte[] page = BTreeCodec.encodePage(nbtEntries(20), NBT);
    assertEquals(16 + 20 * 32, page.length);
    final TruncatedPageException e =
        assertThrows(
            TruncatedPageException.class, () -> BTreeCodec.decodePage(page, 0, 100, 1234, NBT));
    assertEquals(1234, e.getOffset());
    assertEquals(page.length, e.getRequired());
    assertEquals(100, e.getAvailable());

    assertThrows(TruncatedPageException.class, () -> BTreeCodec.decodePage(page, 0, 8, 0, NBT));
  }

  @Test
  public void testIntermediateAndUnknownPagesRejected() {
    final byte[] page = BTreeCodec.encodePage(nbtEntries(2), NBT);
    page[0] = (byte) BTreeCodec.INTERMEDIATE_PAGE;
    assertThrows(PstFormatException.class, () -> BTreeCodec.decodePage(page, NBT));
    page[0] = 0x42;
    assertThrows(PstFormatException.class, () -> BTreeCodec.decodePage(page, NBT));
  }

  @Test
  public void testTooManyEntriesForOnePage() {
    final List<NbtEntry> entries =
        Collections.nCopies(BTreeCodec.MAX_ENTRIES + 1, new NbtEntry(1, 1, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> BTreeCodec.encodePage(entries, NBT));
  }
}
