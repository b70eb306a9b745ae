package com.kriskowal.decl;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Decl Parser - A parser for the Decl declarative markup.
 *
 * <p>Parsing happens in two phases. The syntax phase turns indented lines into a tree of {@link
 * SyntaxNode}s: every tag line is tokenized into parameters, and the sigil on the line decides how
 * the indented lines under it are read (child tags, text, code, comments or mixed text). The
 * semantic phase lifts the tag nodes of that tree into {@link Node}s with a name, parameter maps
 * and a search API.
 */
public final class Decl {

  private Decl() {}

  /** Parse a Decl document into a syntax tree. */
  public static SyntaxNode parse(String source) {
    return parse(source, null);
  }

  /** Parse a Decl document with filename for error messages. */
  public static SyntaxNode parse(String source, String filename) {
    return parse(IndentedLines.of(source), BodyMode.TAG, filename);
  }

  /** Parse a document read from a file. */
  public static SyntaxNode parse(Path file) {
    Reader reader;
    try {
      reader = Files.newBufferedReader(file);
    } catch (IOException e) {
      throw new DeclException("Can't open '" + file + "': " + e.getMessage(), file.toString(), e);
    }
    try (Reader r = reader) {
      return parse(IndentedLines.of(r, file.toString()), BodyMode.TAG, file.toString());
    } catch (IOException e) {
      throw new DeclException("Can't close '" + file + "': " + e.getMessage(), file.toString(), e);
    }
  }

  /** Parse a line source whose root body reads in the given mode. */
  public static SyntaxNode parse(
      Iterator<IndentedLines.Line> lines, BodyMode type, String filename) {
    return parse(lines, type, filename, Dialect.standard());
  }

  /** Parse a line source with a custom dialect. */
  public static SyntaxNode parse(
      Iterator<IndentedLines.Line> lines, BodyMode type, String filename, Dialect dialect) {
    TreeBuilder builder = new TreeBuilder(dialect, type, filename);
    while (lines.hasNext()) {
      builder.addLine(lines.next());
    }
    return builder.finish();
  }

  /** Parse a document and extract its semantic tree. */
  public static Node load(String source) {
    return Node.of(parse(source), Node.Context.defaults());
  }

  // ========================================================================
  // Exceptions
  // ========================================================================

  public static class DeclException extends RuntimeException {
    public DeclException(String message, String filename, int line, int col) {
      super(
          message + " at " + line + ":" + col + (filename != null ? " of <" + filename + ">" : ""));
    }

    public DeclException(String message, String filename) {
      super(message + (filename != null ? " <" + filename + ">" : ""));
    }

    public DeclException(String message, String filename, Throwable cause) {
      super(message + (filename != null ? " <" + filename + ">" : ""), cause);
    }

    protected DeclException(String message) {
      super(message);
    }
  }

  /** A dialect table points somewhere it cannot go. */
  public static class ConfigurationException extends DeclException {
    public ConfigurationException(String message) {
      super(message);
    }
  }
}
