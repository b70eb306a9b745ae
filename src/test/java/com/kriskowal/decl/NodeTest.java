package com.kriskowal.decl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class NodeTest {

  private static Node load(String... lines) {
    return Decl.load(String.join("\n", lines));
  }

  @Test
  void testParameterClassification() {
    Node root = load("dialog (xsize=250, ysize=110) \"Wx sample text\"");
    Node dialog = root.children().get(0);

    assertEquals("dialog", dialog.tag());
    assertEquals("", dialog.name());
    assertEquals("250", dialog.inparm("xsize"));
    assertEquals("110", dialog.inparm("ysize"));
    assertEquals(Arrays.asList("xsize", "ysize"), dialog.inparmNames());
    assertEquals("Wx sample text", dialog.string());
    assertTrue(dialog.warnings().isEmpty());
  }

  @Test
  void testNameAndExparms() {
    Node field = load("field email [required, width=40] (hidden)").children().get(0);

    assertEquals("email", field.name());
    assertEquals("1", field.exparm("required"));
    assertEquals("40", field.exparm("width"));
    assertEquals(Arrays.asList("required", "width"), field.exparmNames());
    assertEquals("1", field.inparm("hidden"));
    assertNull(field.inparm("width"));
    assertNull(field.string());
  }

  @Test
  void testWarnings() {
    Node field = load("field a b \"s1\" \"s2\" (x) [y]").children().get(0);

    assertEquals("a", field.name());
    assertEquals("s1", field.string());
    assertEquals(
        Arrays.asList(
            "name not in first position: 'b'",
            "more than one string: s2",
            "inparm after string: 'x'",
            "exparm after string: 'y'"),
        field.warnings());
  }

  @Test
  void testPathsAndLevels() {
    Node root = load("dialog main", "  field name", "  field other", "menu");
    Node dialog = root.children().get(0);
    Node field = dialog.children().get(0);

    assertEquals(0, root.level());
    assertEquals("", root.path());
    assertEquals("<*>", root.location());
    assertEquals(1, dialog.level());
    assertEquals(".dialog", dialog.path());
    assertEquals(2, field.level());
    assertEquals(".dialog.field", field.path());
    assertEquals("<*>.dialog.field", field.location());
    assertSame(dialog, field.parent());
    assertNull(root.parent());

    // Siblings with the same tag share a path.
    assertEquals(field.path(), dialog.children().get(1).path());
  }

  @Test
  void testDocidInLocation() {
    Node root = Node.of("dialog main", new Node.Context(BodyMode.TAG, null, "forms"));

    assertEquals("forms", root.children().get(0).docid());
    assertEquals("<forms>.dialog", root.children().get(0).location());
  }

  @Test
  void testIndexerSeesEveryNodeParentsFirst() {
    List<String> seen = new ArrayList<>();
    Node.Indexer indexer =
        (docid, tag, name, level, path, node) ->
            seen.add(docid + " " + level + " " + path + " " + name);

    Node.of(
        String.join("\n", "dialog main", "  field name", "menu file"),
        new Node.Context(BodyMode.TAG, indexer, "d1"));

    assertEquals(
        Arrays.asList("d1 0  ", "d1 1 .dialog main", "d1 2 .dialog.field name", "d1 1 .menu file"),
        seen);
  }

  @Test
  void testOnlyTagChildren() {
    Node root =
        load(
            "# a comment",
            "doc:+ Intro",
            "  - item",
            "  +field name",
            "  text again",
            "code {",
            "  x();",
            "}");

    assertEquals(2, root.children().size());
    Node doc = root.children().get(0);
    assertEquals("doc", doc.tag());
    assertEquals(1, doc.children().size());
    assertEquals("field", doc.children().get(0).tag());
    assertEquals("x();", root.children().get(1).code());
  }

  @Test
  void testText() {
    Node para = load("para: some text", "  more").children().get(0);

    assertEquals("    some text\nmore", para.text());
    assertNull(para.code());
    assertSame(para.syntax().parent(), para.parent().syntax());
  }
}
