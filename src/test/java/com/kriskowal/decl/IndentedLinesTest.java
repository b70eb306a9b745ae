package com.kriskowal.decl;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class IndentedLinesTest {

  @Test
  void testIndentation() {
    List<IndentedLines.Line> lines = new ArrayList<>();
    IndentedLines.of("top\n  two\n\n    \n\tfour\r\n").forEachRemaining(lines::add);

    assertEquals(5, lines.size());
    assertEquals(0, lines.get(0).indent());
    assertEquals("top", lines.get(0).text());
    assertEquals(2, lines.get(1).indent());
    assertTrue(lines.get(2).isBlank());
    assertTrue(lines.get(3).isBlank());
    assertEquals(IndentedLines.Line.BLANK, lines.get(3).indent());
    assertEquals(4, lines.get(4).indent());
    assertEquals("four", lines.get(4).text());
  }

  @Test
  void testTabsRoundUpToTabStops() {
    assertEquals(4, IndentedLines.measure("\tx", 4).indent());
    assertEquals(4, IndentedLines.measure("  \tx", 4).indent());
    assertEquals(6, IndentedLines.measure("\t  x", 4).indent());
    assertEquals(8, IndentedLines.measure("\tx", 8).indent());
  }

  @Test
  void testTrailingWhitespaceKept() {
    assertEquals("x  ", IndentedLines.measure("  x  \r", 4).text());
  }

  @Test
  void testFromList() {
    List<IndentedLines.Line> lines = new ArrayList<>();
    IndentedLines.of(Arrays.asList("a", " b")).forEachRemaining(lines::add);

    assertEquals(2, lines.size());
    assertEquals(1, lines.get(1).indent());
  }

  @Test
  void testReadFailure() {
    Reader broken =
        new Reader() {
          @Override
          public int read(char[] buf, int off, int len) throws IOException {
            throw new IOException("disk on fire");
          }

          @Override
          public void close() {}
        };

    Decl.DeclException e =
        assertThrows(
            Decl.DeclException.class, () -> IndentedLines.of(broken, "broken.decl").hasNext());
    assertTrue(e.getMessage().contains("disk on fire"), e.getMessage());
    assertTrue(e.getMessage().contains("broken.decl"), e.getMessage());
  }

  @Test
  void testClosesReaderAtTheEnd() {
    boolean[] closed = {false};
    Reader reader =
        new StringReader("one\ntwo\n") {
          @Override
          public void close() {
            closed[0] = true;
            super.close();
          }
        };
    IndentedLines lines = IndentedLines.of(reader, "two.decl");

    assertEquals("one", lines.next().text());
    assertFalse(closed[0]);
    assertEquals("two", lines.next().text());
    assertFalse(lines.hasNext());
    assertTrue(closed[0]);
  }

  @Test
  void testBadTabWidth() {
    assertThrows(
        IllegalArgumentException.class,
        () -> IndentedLines.of(new StringReader("x"), null, 0));
  }
}
