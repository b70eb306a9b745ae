package com.kriskowal.decl.docset;

import static org.junit.jupiter.api.Assertions.*;

import com.kriskowal.decl.BodyMode;
import com.kriskowal.decl.Decl;
import com.kriskowal.decl.IndentedLines;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileDocsetTest {

  @Test
  void testScan(@TempDir Path dir) throws IOException {
    Files.writeString(dir.resolve("b.decl"), "menu file\n");
    Files.writeString(dir.resolve("a.dtext"), "Some text\n");
    Files.writeString(dir.resolve("readme"), "not a document\n");

    FileDocset docset = new FileDocset(dir);

    assertEquals(Arrays.asList("0", "1"), docset.list());
    assertEquals("a.dtext", docset.info("0", "name"));
    assertEquals("textplus", docset.info("0", "type"));
    assertEquals(BodyMode.TEXTPLUS, docset.info("0").type());
    assertEquals("b.decl", docset.info("1", "name"));
    assertEquals("tag", docset.info("1", "type"));
    assertEquals(dir.resolve("b.decl").toString(), docset.info("1", "path"));
    assertEquals("1", docset.info("1", "id"));
    assertNull(docset.info("1", "colour"));
    assertNull(docset.info("2"));
    assertNull(docset.info("x"));
    assertNull(docset.text("2"));
  }

  @Test
  void testText(@TempDir Path dir) throws IOException {
    Files.writeString(dir.resolve("a.decl"), "dialog main\n  field name\n");

    Iterator<IndentedLines.Line> lines = new FileDocset(dir).text("0");
    assertTrue(lines instanceof IndentedLines, "read line by line");
    assertEquals("dialog main", lines.next().text());
    assertEquals(2, lines.next().indent());
    assertFalse(lines.hasNext());
  }

  @Test
  void testTextOfMissingFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("a.decl");
    Files.writeString(file, "menu\n");
    FileDocset docset = new FileDocset(dir);
    Files.delete(file);

    Decl.DeclException e = assertThrows(Decl.DeclException.class, () -> docset.text("0"));
    assertTrue(e.getMessage().startsWith("Can't open"), e.getMessage());
  }

  @Test
  void testRescan(@TempDir Path dir) throws IOException {
    FileDocset docset = new FileDocset(dir);
    assertTrue(docset.list().isEmpty());

    Files.writeString(dir.resolve("a.decl"), "menu\n");
    assertEquals(1, docset.scan());
    assertEquals(Collections.singletonList("0"), docset.list());
  }

  @Test
  void testCustomTypes(@TempDir Path dir) throws IOException {
    Files.writeString(dir.resolve("notes.txt"), "# just a comment\n");

    FileDocset docset =
        new FileDocset(dir, Collections.singletonMap("txt", BodyMode.COMMENT));
    assertEquals("comment", docset.info("0", "type"));
  }

  @Test
  void testMissingRoot(@TempDir Path dir) {
    assertThrows(Decl.DeclException.class, () -> new FileDocset(dir.resolve("nowhere")));
  }
}
