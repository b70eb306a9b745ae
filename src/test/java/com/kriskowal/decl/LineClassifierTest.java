package com.kriskowal.decl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class LineClassifierTest {

  private static final Dialect STANDARD = Dialect.standard();

  @Test
  void testFindInitial() {
    LineClassifier.Initial initial = LineClassifier.findInitial("dialog (x=1)");
    assertEquals("dialog", initial.tag());
    assertEquals(7, initial.postIndent());
    assertEquals("(x=1)", initial.rest());

    initial = LineClassifier.findInitial("para: text");
    assertEquals("para", initial.tag());
    assertEquals(4, initial.postIndent());
    assertEquals(": text", initial.rest());
  }

  @Test
  void testTagAlone() {
    LineClassifier.Initial initial = LineClassifier.findInitial("field   ");
    assertEquals("field", initial.tag());
    assertEquals(0, initial.postIndent());
    assertEquals("", initial.rest());
  }

  @Test
  void testAnonymousSigil() {
    LineClassifier.Initial initial = LineClassifier.findInitial(": just text");
    assertEquals("", initial.tag());
    assertEquals(0, initial.postIndent());
    assertEquals(": just text", initial.rest());
  }

  @Test
  void testBracketedTags() {
    LineClassifier.Initial initial = LineClassifier.findInitial("[x: y] stuff");
    assertEquals("[x: y]", initial.tag());
    assertEquals(7, initial.postIndent());
    assertEquals("stuff", initial.rest());

    initial = LineClassifier.findInitial("<a b>:text");
    assertEquals("<a b>", initial.tag());
    assertEquals(":text", initial.rest());

    // Nothing after the brackets: no tag at all.
    initial = LineClassifier.findInitial("[x]");
    assertEquals("", initial.tag());
    assertEquals("[x]", initial.rest());
  }

  @Test
  void testIdentifyInTagMode() {
    assertEquals(BodyMode.COMMENT, LineClassifier.identify(STANDARD, BodyMode.TAG, "#").mode());
    assertEquals(BodyMode.TAG, LineClassifier.identify(STANDARD, BodyMode.TAG, "dialog").mode());
    assertEquals(BodyMode.TAG, LineClassifier.identify(STANDARD, BodyMode.TAG, "").mode());
  }

  @Test
  void testIdentifyInTextplusMode() {
    LineClassifier.Classification c =
        LineClassifier.identify(STANDARD, BodyMode.TEXTPLUS, "Hello");
    assertTrue(c.isText());

    c = LineClassifier.identify(STANDARD, BodyMode.TEXTPLUS, "-");
    assertEquals(BodyMode.TEXTPLUS, c.mode());
    assertEquals("-", c.tag());

    // The plus flag eats itself and reads the rest as a tag.
    c = LineClassifier.identify(STANDARD, BodyMode.TEXTPLUS, "+dialog");
    assertEquals(BodyMode.TAG, c.mode());
    assertEquals("dialog", c.tag());
  }

  @Test
  void testModesWithoutTablesUseTagTables() {
    assertEquals(BodyMode.COMMENT, LineClassifier.identify(STANDARD, BodyMode.CODE, "#").mode());
  }

  @Test
  void testFlagCycle() {
    Dialect dialect =
        Dialect.builder()
            .lineType(BodyMode.TAG, "", BodyMode.TAG)
            .flag(BodyMode.TAG, '!', BodyMode.TEXTPLUS, false)
            .flag(BodyMode.TEXTPLUS, '!', BodyMode.TAG, false)
            .build();

    Decl.ConfigurationException e =
        assertThrows(
            Decl.ConfigurationException.class,
            () -> LineClassifier.identify(dialect, BodyMode.TAG, "!x"));
    assertTrue(e.getMessage().contains("leads back"), e.getMessage());
  }

  @Test
  void testFlagDepthBound() {
    Dialect dialect =
        Dialect.builder()
            .lineType(BodyMode.TAG, "", BodyMode.TAG)
            .flag(BodyMode.TAG, '+', BodyMode.TAG, true)
            .maxIndirection(2)
            .build();

    assertEquals("x", LineClassifier.identify(dialect, BodyMode.TAG, "++x").tag());
    Decl.ConfigurationException e =
        assertThrows(
            Decl.ConfigurationException.class,
            () -> LineClassifier.identify(dialect, BodyMode.TAG, "+++x"));
    assertTrue(e.getMessage().contains("deeper than 2"), e.getMessage());
  }

  @Test
  void testFlagToMissingMode() {
    Dialect dialect =
        Dialect.builder()
            .lineType(BodyMode.TAG, "", BodyMode.TAG)
            .flag(BodyMode.TAG, '!', BodyMode.CODE, true)
            .build();

    assertThrows(
        Decl.ConfigurationException.class,
        () -> LineClassifier.identify(dialect, BodyMode.TAG, "!x"));
  }

  @Test
  void testIndirectionBoundMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> Dialect.builder().maxIndirection(0));
  }
}
