package com.kriskowal.decl;

import static org.junit.jupiter.api.Assertions.*;

import com.kriskowal.decl.docset.FileDocset;
import com.kriskowal.decl.docset.StringDocset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class WorkspaceTest {

  @Test
  void testIndexesTopLevelNodes() {
    Workspace ws =
        new Workspace(
                new StringDocset(
                    String.join(
                        "\n", "dialog main", "  field a", "dialog other", "menu file")))
            .load();

    assertEquals(2, ws.nodes("dialog").size());
    assertEquals(1, ws.nodes("menu").size());
    assertTrue(ws.nodes("field").isEmpty());
    assertEquals("other", ws.node("dialog", "other").name());
    assertNull(ws.node("dialog", "missing"));
    assertNull(ws.node("button", "ok"));
    assertEquals(Arrays.asList("main", "other"), ws.extract("dialog", Node::name));
    assertEquals(Collections.singleton("*"), ws.documents().keySet());
    assertEquals("*", ws.node("menu", "file").docid());
  }

  @Test
  void testLoadsFiles(@TempDir Path dir) throws IOException {
    Files.writeString(dir.resolve("a.decl"), "dialog one\n  field x\n");
    Files.createDirectories(dir.resolve("sub"));
    Files.writeString(dir.resolve("sub").resolve("b.dtext"), "Some text\n+menu file\nMore text\n");
    Files.writeString(dir.resolve("notes.txt"), "dialog ignored\n");

    Workspace ws = new Workspace(new FileDocset(dir)).load();

    assertEquals(2, ws.documents().size());
    assertEquals("0", ws.node("dialog", "one").docid());
    assertEquals("1", ws.node("menu", "file").docid());
    assertNull(ws.node("dialog", "ignored"));
    assertEquals("<1>.menu", ws.node("menu", "file").location());
  }

  @Test
  void testReloadReplacesIndex() {
    Workspace ws = new Workspace(new StringDocset("dialog main"));
    ws.load();
    ws.load();

    assertEquals(1, ws.nodes("dialog").size());
  }
}
