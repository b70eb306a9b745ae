package com.kriskowal.decl;

import java.util.List;

/**
 * How a node reads the indented lines under it. Every mode shares the same indentation test; the
 * start hook runs once when a node is created in that mode, and the line handler runs for each
 * line the node accepts while the mode is in force.
 */
public enum BodyMode {

  /** Child lines are tags; the sigil of the tag line picks the body mode of the node. */
  TAG {
    @Override
    void start(TreeBuilder builder, SyntaxNode node) {
      if (node.line() == null) {
        return;
      }
      node.setTokens(LineTokenizer.parse(node.line()));

      String lineCode = node.lineCode();
      if (lineCode != null) {
        node.markCode(node.lineCodeType().equals("}") ? "{" : "<");
        node.mutableLines().add(lineCode);
        return;
      }

      Dialect.Table table = builder.dialect().table(node.startMode());
      String sigil = node.sigil();
      if (sigil.isEmpty()) {
        return;
      }
      // A longer sigil falls back to the longest prefix the table knows.
      BodyMode body = null;
      int len = sigil.length();
      while (len > 0 && (body = table.bodies.get(sigil.substring(0, len))) == null) {
        len--;
      }
      if (body == null) {
        return;
      }
      sigil = sigil.substring(0, len);
      Character terminator = table.terminators.get(sigil);
      if (terminator != null) {
        node.setTerminator(terminator);
      }
      node.setBodyMode(body);
      startBody(node, body, sigil);
    }

    @Override
    void acceptLine(TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo,
        int blanks) {
      spawn(builder, node, indent, text, lineNo, BodyMode.TAG);
    }
  },

  /** Lines are kept as text, indented relative to the first of them. */
  TEXT {
    @Override
    void start(TreeBuilder builder, SyntaxNode node) {
      firstBodyLine(node, node.line(), node.indent() + node.postIndent());
      if (!node.lines().isEmpty()) {
        node.markText();
      }
    }

    @Override
    void acceptLine(TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo,
        int blanks) {
      addBodyLine(node, indent, text, blanks);
      node.markText();
    }
  },

  /** Lines are kept as code until a line at the node's indentation starts with the terminator. */
  CODE {
    @Override
    void start(TreeBuilder builder, SyntaxNode node) {
      firstBodyLine(node, node.line(), node.indent() + node.postIndent());
      if (!node.lines().isEmpty()) {
        node.markCode("{");
      }
    }

    @Override
    void acceptLine(TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo,
        int blanks) {
      Character terminator = node.terminator();
      if (terminator != null && indent <= node.indent() && text.charAt(0) == terminator) {
        node.close(text);
        node.setBodyMode(TAG);
        return;
      }
      addBodyLine(node, indent, text, blanks);
      String sigil = node.sigil();
      node.markCode(sigil.isEmpty() ? "{" : sigil);
    }
  },

  /** Lines are kept verbatim, blank lines included, relative to the comment's own text. */
  COMMENT {
    @Override
    void start(TreeBuilder builder, SyntaxNode node) {
      if (node.line() != null && !node.isRoot()) {
        node.mutableLines().add(node.line());
      }
    }

    @Override
    void acceptLine(TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo,
        int blanks) {
      List<String> lines = node.mutableLines();
      for (int i = 0; i < blanks; i++) {
        lines.add("");
      }
      int base = node.isRoot() ? 0 : node.indent() + node.postIndent();
      lines.add(" ".repeat(Math.max(indent - base, 0)) + text);
    }
  },

  /**
   * Free text with embedded nodes. Lines that classify as a line type start child nodes; the rest
   * go into anonymous text runs, with a new run after every blank line or child node.
   */
  TEXTPLUS {
    @Override
    void start(TreeBuilder builder, SyntaxNode node) {
      if (node.line() != null && !node.line().isEmpty()) {
        SyntaxNode run =
            SyntaxNode.textRun(node, node.indent() + node.postIndent(), node.lineNumber());
        run.mutableLines().add(node.line());
      }
    }

    @Override
    void acceptLine(TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo,
        int blanks) {
      LineClassifier.Initial initial = LineClassifier.findInitial(text);
      LineClassifier.Classification c =
          LineClassifier.identify(
              builder.dialect(), builder.classificationMode(node), initial.tag());
      if (!c.isText()) {
        builder.addChild(node, c.mode(), c.tag(), indent, initial, lineNo);
        return;
      }

      List<SyntaxNode> children = node.mutableChildren();
      SyntaxNode last = children.isEmpty() ? null : children.get(children.size() - 1);
      if (last == null || !last.isTextRun() || blanks > 0) {
        last = SyntaxNode.textRun(node, indent, lineNo);
      }
      if (node.bodyIndent() < 0) {
        node.setBodyIndent(indent);
      }
      last.mutableLines().add(" ".repeat(Math.max(indent - node.bodyIndent(), 0)) + text);
    }
  },

  /**
   * Text that ends at the first blank line after it has started. The line after the gap, and
   * everything after it, is read as child tags.
   */
  TERMINATED_TAG {
    @Override
    void start(TreeBuilder builder, SyntaxNode node) {
      TEXT.start(builder, node);
    }

    @Override
    void acceptLine(TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo,
        int blanks) {
      if (!node.lines().isEmpty() && blanks > 0) {
        node.setBodyMode(TAG);
        TAG.acceptLine(builder, node, indent, text, lineNo, blanks);
        return;
      }
      TEXT.acceptLine(builder, node, indent, text, lineNo, blanks);
    }
  };

  /** Start hook, run once when a node is created in this mode. */
  abstract void start(TreeBuilder builder, SyntaxNode node);

  /** Handle a line the node has accepted. */
  abstract void acceptLine(
      TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo, int blanks);

  /**
   * Whether a node takes a line: it must be indented deeper than the node, unless it is the
   * matching terminator of the node's still-open code body at the node's own indentation.
   */
  static boolean testIndent(SyntaxNode node, int indent, String text) {
    Character terminator = node.terminator();
    if (terminator != null
        && !node.isClosed()
        && indent == node.indent()
        && !text.isEmpty()
        && text.charAt(0) == terminator) {
      return true;
    }
    return indent > node.indent();
  }

  // ========================================================================
  // Shared line handling
  // ========================================================================

  private static void spawn(
      TreeBuilder builder, SyntaxNode node, int indent, String text, int lineNo, BodyMode mode) {
    LineClassifier.Initial initial = LineClassifier.findInitial(text);
    LineClassifier.Classification c =
        LineClassifier.identify(builder.dialect(), builder.classificationMode(node), initial.tag());
    builder.addChild(node, c.isText() ? mode : c.mode(), c.tag(), indent, initial, lineNo);
  }

  /** Set up a text or code body once the tag line's sigil has chosen it. */
  private static void startBody(SyntaxNode node, BodyMode body, String sigil) {
    int rest = node.indent() + node.postIndent();
    if (body == TEXTPLUS) {
      Token post = postSigil(node);
      if (post != null) {
        SyntaxNode run = SyntaxNode.textRun(node, rest + post.offset(), node.lineNumber());
        run.mutableLines().add(post.text());
      }
    } else if (body == CODE) {
      for (Token t : node.tokens()) {
        if (t.kind().isOpenCode()) {
          firstBodyLine(node, t.text(), rest + t.contentOffset());
        }
      }
      if (!node.lines().isEmpty()) {
        node.markCode(sigil);
      }
    } else if (body == TEXT || body == TERMINATED_TAG) {
      Token post = postSigil(node);
      if (post != null) {
        firstBodyLine(node, post.text(), rest + post.offset());
        node.markText();
      }
    }
  }

  private static Token postSigil(SyntaxNode node) {
    for (Token t : node.tokens()) {
      if (t.kind() == TokenKind.POST_SIGIL && !t.text().isBlank()) {
        return t;
      }
    }
    return null;
  }

  /**
   * Text on the tag line after the sigil is the first line of the body, and its column is where
   * the body's indentation is measured from if the next lines reach it.
   */
  private static void firstBodyLine(SyntaxNode node, String text, int column) {
    if (text == null || text.isBlank()) {
      return;
    }
    int lead = 0;
    while (lead < text.length() && text.charAt(lead) == ' ') {
      lead++;
    }
    node.mutableLines().add(text.substring(lead).stripTrailing());
    node.setPostSigil(column + lead);
  }

  private static void addBodyLine(SyntaxNode node, int indent, String text, int blanks) {
    List<String> lines = node.mutableLines();
    if (node.bodyIndent() < 0) {
      int postSigil = node.postSigil();
      if (postSigil > 0 && indent >= postSigil) {
        node.setBodyIndent(postSigil);
      } else {
        node.setBodyIndent(indent);
        if (postSigil > 0 && !lines.isEmpty()) {
          // The tag line's text keeps its column relative to the new baseline.
          lines.set(0, " ".repeat(postSigil - indent) + lines.get(0));
        }
      }
    }
    for (int i = 0; i < blanks; i++) {
      lines.add("");
    }
    lines.add(" ".repeat(Math.max(indent - node.bodyIndent(), 0)) + text);
  }
}
