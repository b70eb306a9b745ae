package com.kriskowal.decl;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy source of indented lines. Each raw line becomes an indentation and the text after it; a
 * line holding nothing but whitespace comes out blank with an indentation of -1.
 *
 * <p>The source is read once, front to back, and cannot be restarted. The reader is closed when
 * the last line has been read.
 */
public final class IndentedLines implements Iterator<IndentedLines.Line>, Closeable {

  public static final int DEFAULT_TAB_WIDTH = 4;

  /** One indented line. */
  public static final class Line {
    public static final int BLANK = -1;

    private final int indent;
    private final String text;

    public Line(int indent, String text) {
      this.indent = indent;
      this.text = text == null ? "" : text;
    }

    public static Line blank() {
      return new Line(BLANK, "");
    }

    public int indent() {
      return indent;
    }

    public String text() {
      return text;
    }

    public boolean isBlank() {
      return indent < 0;
    }

    @Override
    public String toString() {
      return isBlank() ? "(blank)" : indent + ":" + text;
    }
  }

  private final BufferedReader reader;
  private final String resource;
  private final int tabWidth;
  private Line next;
  private boolean done;

  private IndentedLines(Reader reader, String resource, int tabWidth) {
    this.reader =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    this.resource = resource;
    this.tabWidth = tabWidth;
  }

  public static IndentedLines of(String source) {
    return new IndentedLines(
        new StringReader(source == null ? "" : source), null, DEFAULT_TAB_WIDTH);
  }

  public static IndentedLines of(Reader reader, String resource) {
    return new IndentedLines(reader, resource, DEFAULT_TAB_WIDTH);
  }

  public static IndentedLines of(Reader reader, String resource, int tabWidth) {
    if (tabWidth < 1) {
      throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
    }
    return new IndentedLines(reader, resource, tabWidth);
  }

  public static IndentedLines of(List<String> rawLines) {
    return of(String.join("\n", rawLines));
  }

  /** Split one raw line into its indentation and text. */
  public static Line measure(String raw, int tabWidth) {
    if (raw.endsWith("\r")) {
      raw = raw.substring(0, raw.length() - 1);
    }
    int col = 0;
    int i = 0;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c == ' ') {
        col++;
      } else if (c == '\t') {
        col = (col / tabWidth + 1) * tabWidth;
      } else {
        break;
      }
      i++;
    }
    String text = raw.substring(i);
    if (text.isBlank()) {
      return Line.blank();
    }
    return new Line(col, text);
  }

  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (done) {
      return false;
    }
    String raw;
    try {
      raw = reader.readLine();
    } catch (IOException e) {
      throw new Decl.DeclException("Can't read: " + e.getMessage(), resource, e);
    }
    if (raw == null) {
      close();
      return false;
    }
    next = measure(raw, tabWidth);
    return true;
  }

  @Override
  public Line next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Line line = next;
    next = null;
    return line;
  }

  /** Stop reading and release the reader. */
  @Override
  public void close() {
    done = true;
    try {
      reader.close();
    } catch (IOException e) {
      throw new Decl.DeclException("Can't close: " + e.getMessage(), resource, e);
    }
  }
}
