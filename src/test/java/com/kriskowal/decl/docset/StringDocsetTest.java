package com.kriskowal.decl.docset;

import static org.junit.jupiter.api.Assertions.*;

import com.kriskowal.decl.BodyMode;
import com.kriskowal.decl.IndentedLines;
import java.util.Collections;
import java.util.Iterator;
import org.junit.jupiter.api.Test;

public class StringDocsetTest {

  @Test
  void testSingleDocument() {
    StringDocset docset = new StringDocset("dialog main\n  field name");

    assertEquals(Collections.singletonList("*"), docset.list());
    assertEquals("tag", docset.info("*", "type"));
    assertEquals("", docset.info("*", "tag"));
    assertEquals("*", docset.info("*").id());
    assertNull(docset.info("0"));
    assertNull(docset.info("0", "type"));
    assertNull(docset.text("0"));

    Iterator<IndentedLines.Line> lines = docset.text("*");
    assertEquals("dialog main", lines.next().text());
    assertEquals(2, lines.next().indent());
  }

  @Test
  void testType() {
    assertEquals("textplus", new StringDocset("x", BodyMode.TEXTPLUS).info("*", "type"));
    assertEquals(BodyMode.TEXTPLUS, DocumentInfo.typeOf("textplus"));
    assertThrows(IllegalArgumentException.class, () -> DocumentInfo.typeOf("poem"));
  }
}
