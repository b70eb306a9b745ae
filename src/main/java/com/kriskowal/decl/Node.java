package com.kriskowal.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A semantic node: one tag of a syntax tree with its parameters sorted out.
 *
 * <p>The first bareword after the tag is the node's name; parenthesized parameters are internal
 * ("inparms"), bracketed ones external ("exparms"), and a quoted string describes the node. Things
 * out of the usual order (a second bareword, a second string, parameters after the string) are
 * kept as warnings rather than errors. Nodes are built top-down in one pass and do not change
 * afterwards.
 */
public final class Node {

  private static final Logger logger = LoggerFactory.getLogger(Node.class);

  /** Called once per node as the tree is built, parents before children. */
  @FunctionalInterface
  public interface Indexer {
    void index(String docid, String tag, String name, int level, String path, Node node);
  }

  /** Settings for building a semantic tree. */
  public static final class Context {
    private static final Context DEFAULTS = new Context(BodyMode.TAG, null, "*");

    private final BodyMode type;
    private final Indexer indexer;
    private final String docid;

    public Context(BodyMode type, Indexer indexer, String docid) {
      this.type = type;
      this.indexer = indexer;
      this.docid = docid;
    }

    public static Context defaults() {
      return DEFAULTS;
    }

    /** Body mode of the document root. */
    public BodyMode type() {
      return type;
    }

    public Indexer indexer() {
      return indexer;
    }

    public String docid() {
      return docid;
    }
  }

  private final SyntaxNode syntax;
  private final Node parent;
  private final String docid;
  private final int level;
  private final String path;
  private String name = "";
  private String string;
  private final Map<String, String> inparms = new LinkedHashMap<>();
  private final Map<String, String> exparms = new LinkedHashMap<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<Node> children = new ArrayList<>();

  private Node(SyntaxNode syntax, Node parent, Context context) {
    this.syntax = syntax;
    this.parent = parent;
    this.docid = context.docid();
    this.level = parent == null ? 0 : parent.level + 1;
    this.path = parent == null ? "" : parent.path + "." + syntax.tag();
    extract();

    if (context.indexer() != null) {
      context.indexer().index(docid, tag(), name, level, path, this);
    }
    for (SyntaxNode child : syntax.children()) {
      if (child.what() == SyntaxNode.What.TAG) {
        children.add(new Node(child, this, context));
      }
    }
  }

  /** Build the semantic tree over a syntax tree. */
  public static Node of(SyntaxNode syntax, Context context) {
    return new Node(syntax, null, context);
  }

  /** Parse a source string in the context's document type and build its semantic tree. */
  public static Node of(String source, Context context) {
    return of(Decl.parse(IndentedLines.of(source), context.type(), null), context);
  }

  private void extract() {
    boolean named = false;
    for (Parameter p : syntax.parameters()) {
      switch (p.flavor()) {
        case "":
          if (!named) {
            name = p.name();
            named = true;
          } else {
            warn("name not in first position: '" + p.name() + "'");
          }
          break;
        case ")":
          if (string != null) {
            warn("inparm after string: '" + p.name() + "'");
          }
          inparms.put(p.name(), p.value() != null ? p.value() : "1");
          break;
        case "]":
          if (string != null) {
            warn("exparm after string: '" + p.name() + "'");
          }
          exparms.put(p.name(), p.value() != null ? p.value() : "1");
          break;
        case "\"":
        case "'":
          if (string != null) {
            warn("more than one string: " + p.value());
          } else {
            string = p.value();
          }
          break;
        default:
          break;
      }
    }
  }

  private void warn(String warning) {
    warnings.add(warning);
    logger.debug("{}: {}", location(), warning);
  }

  // ========================================================================
  // Accessors
  // ========================================================================

  public String tag() {
    return syntax.tag();
  }

  /** First bareword of the tag line, or empty. */
  public String name() {
    return name;
  }

  /** The quoted description, or null. */
  public String string() {
    return string;
  }

  /** Depth below the document root, which is level 0. */
  public int level() {
    return level;
  }

  public String docid() {
    return docid;
  }

  public Node parent() {
    return parent;
  }

  public List<String> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  /** Value of an internal parameter; "1" if it was given without one, null if absent. */
  public String inparm(String name) {
    return inparms.get(name);
  }

  public String exparm(String name) {
    return exparms.get(name);
  }

  /** Internal parameter names in the order given. */
  public List<String> inparmNames() {
    return Collections.unmodifiableList(new ArrayList<>(inparms.keySet()));
  }

  public List<String> exparmNames() {
    return Collections.unmodifiableList(new ArrayList<>(exparms.keySet()));
  }

  public Map<String, String> inparms() {
    return Collections.unmodifiableMap(inparms);
  }

  public Map<String, String> exparms() {
    return Collections.unmodifiableMap(exparms);
  }

  public List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  /** Dot-joined tags from the root, which has the empty path. */
  public String path() {
    return path;
  }

  /** The path prefixed with the document id in angle brackets. */
  public String location() {
    return "<" + docid + ">" + path;
  }

  public String text() {
    return syntax.getText();
  }

  public String code() {
    return syntax.getCode();
  }

  public SyntaxNode syntax() {
    return syntax;
  }

  // ========================================================================
  // Search
  // ========================================================================

  public boolean match(Match match) {
    return match.test(this);
  }

  /** At least one of the match's field conditions holds. */
  public boolean matchOr(Match match) {
    return match.any(this);
  }

  /** Not all of the match's field conditions hold. */
  public boolean matchNot(Match match) {
    return !match.all(this);
  }

  /** None of the match's field conditions hold. */
  public boolean matchNor(Match match) {
    return !match.any(this);
  }

  /** First matching descendant in document order, or null. */
  public Node first(Match match) {
    return first(match, 0);
  }

  /**
   * First matching descendant no more than {@code depth} levels down; a depth of 0 or less
   * searches the whole subtree.
   */
  public Node first(Match match, int depth) {
    for (Node child : children) {
      if (child.match(match)) {
        return child;
      }
      if (depth != 1) {
        Node found = child.first(match, depth - 1);
        if (found != null) {
          return found;
        }
      }
    }
    return null;
  }

  public List<Node> all(Match match) {
    return all(match, 0);
  }

  /** Every matching descendant in document order, searched as deep as {@link #first}. */
  public List<Node> all(Match match, int depth) {
    List<Node> found = new ArrayList<>();
    collect(match, depth, found);
    return found;
  }

  private void collect(Match match, int depth, List<Node> found) {
    for (Node child : children) {
      if (child.match(match)) {
        found.add(child);
      }
      if (depth != 1) {
        child.collect(match, depth - 1, found);
      }
    }
  }

  @Override
  public String toString() {
    return location() + (name.isEmpty() ? "" : " " + name);
  }
}
