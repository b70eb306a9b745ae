package com.kriskowal.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the syntax tree. The root is the source itself; below it, each node is a tag line
 * (or comment, or mixed-text node) with its parsed parameters, the text or code lines of its body,
 * and its children in document order. In mixed-text bodies a child can be a plain run of text
 * lines instead of a tag.
 */
public final class SyntaxNode {

  /** What the node was created as. */
  public enum What {
    SOURCE("source"),
    TAG("tag"),
    TEXT("text"),
    COMMENT("comment"),
    CODE("code"),
    TEXTPLUS("textplus");

    private final String label;

    What(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }

    static What of(BodyMode mode) {
      switch (mode) {
        case COMMENT:
          return COMMENT;
        case TEXT:
        case TERMINATED_TAG:
          return TEXT;
        case CODE:
          return CODE;
        case TEXTPLUS:
          return TEXTPLUS;
        default:
          return TAG;
      }
    }
  }

  private final What what;
  private final BodyMode startMode;
  private final String tag;
  private final int indent;
  private final int postIndent;
  private final String line;
  private final int lineNumber;
  private final SyntaxNode parent;
  private final SyntaxNode root;
  private final String filename;
  private final boolean textRun;
  private final List<SyntaxNode> children = new ArrayList<>();
  private final List<String> lines = new ArrayList<>();

  private List<Token> tokens = Collections.emptyList();
  private BodyMode bodyMode;
  private Character terminator;
  private boolean closed;
  private String codeTerminator;
  private boolean hasText;
  private String codeSigil = "";
  private int postSigil;
  private int bodyIndent = -1;

  private SyntaxNode(
      What what,
      BodyMode startMode,
      String tag,
      int indent,
      int postIndent,
      String line,
      int lineNumber,
      SyntaxNode parent,
      String filename,
      boolean textRun) {
    this.what = what;
    this.startMode = startMode;
    this.tag = tag;
    this.indent = indent;
    this.postIndent = postIndent;
    this.line = line;
    this.lineNumber = lineNumber;
    this.parent = parent;
    this.root = parent == null ? this : parent.root;
    this.filename = filename;
    this.textRun = textRun;
    this.bodyMode = startMode;
  }

  /** Root of a tree; lines must be indented deeper than {@code indent} to belong to it. */
  static SyntaxNode source(BodyMode type, String filename, int indent) {
    return new SyntaxNode(What.SOURCE, type, "", indent, 0, null, 0, null, filename, false);
  }

  static SyntaxNode child(
      SyntaxNode parent,
      BodyMode mode,
      String tag,
      int indent,
      int postIndent,
      String line,
      int lineNumber) {
    SyntaxNode node =
        new SyntaxNode(
            What.of(mode), mode, tag, indent, postIndent, line, lineNumber, parent, null, false);
    parent.children.add(node);
    return node;
  }

  /** An anonymous run of text under a textplus node, indented at the column of its first line. */
  static SyntaxNode textRun(SyntaxNode parent, int indent, int lineNumber) {
    SyntaxNode node =
        new SyntaxNode(
            What.TEXT, BodyMode.TEXT, "", indent, 0, "", lineNumber, parent, null, true);
    parent.children.add(node);
    node.hasText = true;
    return node;
  }

  // ========================================================================
  // Structure
  // ========================================================================

  public What what() {
    return what;
  }

  /** The body mode the node was created in. */
  public BodyMode startMode() {
    return startMode;
  }

  /** The body mode in force now. */
  public BodyMode bodyMode() {
    return bodyMode;
  }

  public String tag() {
    return tag;
  }

  public int indent() {
    return indent;
  }

  public int postIndent() {
    return postIndent;
  }

  /** The line after its tag, as handed to the node. */
  public String line() {
    return line;
  }

  public int lineNumber() {
    return lineNumber;
  }

  public SyntaxNode parent() {
    return parent;
  }

  public SyntaxNode root() {
    return root;
  }

  public boolean isRoot() {
    return parent == null;
  }

  /** File the tree was read from; null for strings and line iterators. */
  public String filename() {
    return root.filename;
  }

  /** Whether this is an anonymous run of text in a mixed-text body. */
  public boolean isTextRun() {
    return textRun;
  }

  public List<SyntaxNode> children() {
    return Collections.unmodifiableList(children);
  }

  public List<Token> tokens() {
    return tokens;
  }

  public List<String> lines() {
    return Collections.unmodifiableList(lines);
  }

  /** Character that closes this node's code body, or null. */
  public Character terminator() {
    return terminator;
  }

  /** Line that closed this node's code body, or null while open. */
  public String codeTerminator() {
    return codeTerminator;
  }

  // ========================================================================
  // Parameters
  // ========================================================================

  /** All parameters of the tag line. */
  public List<Parameter> parameters() {
    return parameters(tokens, null);
  }

  /** Parameters of one flavor only. */
  public List<Parameter> parameters(String flavor) {
    return parameters(tokens, flavor);
  }

  static List<Parameter> parameters(List<Token> tokens, String flavor) {
    List<Parameter> out = new ArrayList<>();
    for (Token t : tokens) {
      String kind = t.kind().symbol();
      if (flavor != null && !flavor.equals(kind)) {
        continue;
      }
      if (t.kind().isQuoted() || t.kind().isClosedCode()) {
        out.add(new Parameter(kind, kind, t.text()));
      } else if (t.kind().isGroup()) {
        for (Token part : t.parts()) {
          if (part.kind() == TokenKind.PAIR) {
            List<Token> kv = part.parts();
            out.add(new Parameter(kv.get(0).text(), kind, kv.get(1).text()));
          } else {
            out.add(new Parameter(part.text(), kind, null));
          }
        }
      } else if (t.kind() == TokenKind.POST_SIGIL) {
        out.add(new Parameter(t.text(), kind, String.valueOf(t.offset())));
      } else {
        out.add(new Parameter(t.text(), kind, null));
      }
    }
    return out;
  }

  public List<String> parameterNames(String flavor) {
    List<String> names = new ArrayList<>();
    for (Parameter p : parameters(flavor)) {
      names.add(p.name());
    }
    return names;
  }

  /** Value of the first parameter with the given name, or null. */
  public String getParameter(String name) {
    for (Parameter p : parameters()) {
      if (p.name().equals(name)) {
        return p.value();
      }
    }
    return null;
  }

  /**
   * The sigil of the tag line: the first {@code :} token with the punctuation after it, or the
   * first open code sigil. Empty if there is none.
   */
  public String sigil() {
    for (Token t : tokens) {
      if (t.kind() == TokenKind.SIGIL) {
        return ":" + t.text();
      }
      if (t.kind().isOpenCode()) {
        return t.kind().symbol();
      }
    }
    return "";
  }

  /** Content of the one-line code block, or null. */
  public String lineCode() {
    for (Parameter p : parameters()) {
      if (p.name().equals("}") || p.name().equals(">")) {
        return p.value();
      }
    }
    return null;
  }

  /** Flavor of the one-line code block ({@code }} or {@code >}), or null. */
  public String lineCodeType() {
    for (Parameter p : parameters()) {
      if (p.name().equals("}") || p.name().equals(">")) {
        return p.name();
      }
    }
    return null;
  }

  // ========================================================================
  // Content
  // ========================================================================

  public boolean hasText() {
    return hasText;
  }

  public boolean hasCode() {
    return !codeSigil.isEmpty();
  }

  /** Sigil of the code the node holds, or empty. */
  public String codeType() {
    return codeSigil;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public String getText() {
    return hasText ? String.join("\n", lines) : null;
  }

  public String getCode() {
    return hasCode() ? String.join("\n", lines) : null;
  }

  // ========================================================================
  // State for the body modes
  // ========================================================================

  void setTokens(List<Token> tokens) {
    this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
  }

  void setBodyMode(BodyMode bodyMode) {
    this.bodyMode = bodyMode;
  }

  void setTerminator(Character terminator) {
    this.terminator = terminator;
  }

  boolean isClosed() {
    return closed;
  }

  void close(String terminatorLine) {
    this.closed = true;
    this.codeTerminator = terminatorLine;
  }

  void markText() {
    this.hasText = true;
  }

  void markCode(String sigil) {
    if (codeSigil.isEmpty()) {
      this.codeSigil = sigil;
    }
  }

  List<String> mutableLines() {
    return lines;
  }

  List<SyntaxNode> mutableChildren() {
    return children;
  }

  int postSigil() {
    return postSigil;
  }

  void setPostSigil(int postSigil) {
    this.postSigil = postSigil;
  }

  int bodyIndent() {
    return bodyIndent;
  }

  void setBodyIndent(int bodyIndent) {
    this.bodyIndent = bodyIndent;
  }

  // ========================================================================
  // Dumps
  // ========================================================================

  /** One line per node: line number, indentation, what, and tag for tags. */
  public String dumpTree() {
    StringBuilder out = new StringBuilder();
    dumpTree(out);
    return out.toString();
  }

  private void dumpTree(StringBuilder out) {
    if (what == What.SOURCE) {
      out.append("Source: ").append(filename != null ? filename : "<string>").append('\n');
    } else if (textRun) {
      out.append(String.format("%03d %s(text)\n", lineNumber, " ".repeat(Math.max(indent, 0))));
    } else {
      out.append(
          String.format(
              "%03d %s%s %s\n",
              lineNumber,
              " ".repeat(indent),
              what.label(),
              what == What.TAG ? tag : ""));
    }
    for (SyntaxNode child : children) {
      child.dumpTree(out);
    }
  }

  /** Longer description of every node, with body text. */
  public String debugTree() {
    StringBuilder out = new StringBuilder();
    debugTree(out);
    return out.toString();
  }

  private void debugTree(StringBuilder out) {
    if (what == What.SOURCE) {
      out.append("Source: ").append(filename != null ? filename : "<string>").append('\n');
      appendLines(out);
    } else if (textRun) {
      out.append("(text)\n");
      appendLines(out);
      return;
    } else {
      out.append(
          String.format(
              "Line %d: %s %s indented %d,%d\n",
              lineNumber, what.label(), tag, indent, postIndent));
      if (what == What.COMMENT) {
        appendLines(out);
        out.append('\n');
      } else {
        out.append("  Text: ").append(line).append('\n');
        if (hasText || hasCode()) {
          appendLines(out);
        }
      }
    }
    for (SyntaxNode child : children) {
      child.debugTree(out);
    }
  }

  private void appendLines(StringBuilder out) {
    for (String l : lines) {
      out.append(l).append('\n');
    }
  }

  @Override
  public String toString() {
    return what.label() + (tag.isEmpty() ? "" : " " + tag) + " @" + lineNumber;
  }
}
