package com.kriskowal.decl;

import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a syntax tree one line at a time.
 *
 * <p>The builder keeps the chain of open nodes as a stack, root at the bottom. A line goes to the
 * node on top; a node that won't take it is closed and popped, and its parent gets the line. A new
 * child goes on top of the stack. Blank lines are counted and handed to whichever node takes the
 * next line.
 */
final class TreeBuilder {

  private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

  private final Dialect dialect;
  private final SyntaxNode root;
  private final Deque<SyntaxNode> open = new ArrayDeque<>();
  private int blanks;
  private int lineNo;

  TreeBuilder(Dialect dialect, BodyMode type, String filename) {
    this(dialect, SyntaxNode.source(type, filename, -1));
  }

  TreeBuilder(Dialect dialect, SyntaxNode root) {
    this.dialect = dialect;
    this.root = root;
    root.startMode().start(this, root);
    open.push(root);
  }

  Dialect dialect() {
    return dialect;
  }

  void addLine(IndentedLines.Line line) {
    lineNo++;
    if (line.isBlank()) {
      blanks++;
      return;
    }
    int indent = line.indent();
    String text = line.text();
    while (true) {
      SyntaxNode current = open.peek();
      if (current == null) {
        throw new Decl.DeclException("Couldn't accept line", root.filename(), lineNo, indent + 1);
      }
      if (BodyMode.testIndent(current, indent, text)) {
        current.bodyMode().acceptLine(this, current, indent, text, lineNo, blanks);
        blanks = 0;
        return;
      }
      open.pop();
    }
  }

  /** Create a child node, run its start hook, and make it the insertion point. */
  SyntaxNode addChild(
      SyntaxNode parent,
      BodyMode mode,
      String tag,
      int indent,
      LineClassifier.Initial initial,
      int lineNo) {
    SyntaxNode child =
        SyntaxNode.child(parent, mode, tag, indent, initial.postIndent(), initial.rest(), lineNo);
    mode.start(this, child);
    if (logger.isDebugEnabled()) {
      logger.debug(
          "Line {}: {} '{}' at indent {} under {}, body {}",
          lineNo,
          child.what().label(),
          tag,
          indent,
          parent,
          child.bodyMode());
    }
    open.push(child);
    return child;
  }

  /**
   * Mode whose tables classify lines under a node: the body mode in force if the dialect has
   * tables for it, else the mode the node started in, else tag mode.
   */
  BodyMode classificationMode(SyntaxNode node) {
    if (dialect.hasTable(node.bodyMode())) {
      return node.bodyMode();
    }
    if (dialect.hasTable(node.startMode())) {
      return node.startMode();
    }
    return BodyMode.TAG;
  }

  SyntaxNode finish() {
    if (blanks > 0) {
      logger.trace("{} trailing blank lines dropped", blanks);
    }
    return root;
  }
}
