package com.kriskowal.decl;

import com.kriskowal.decl.docset.Docset;
import com.kriskowal.decl.docset.DocumentInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All the documents of a docset, parsed. Top-level nodes are indexed by tag, and by tag and name,
 * while the trees are built.
 */
public final class Workspace {

  private static final Logger logger = LoggerFactory.getLogger(Workspace.class);

  private final Docset docset;
  private final Dialect dialect;
  private final Map<String, Node> documents = new LinkedHashMap<>();
  private final Map<String, List<Node>> byTag = new LinkedHashMap<>();
  private final Map<String, Map<String, Node>> byName = new LinkedHashMap<>();

  public Workspace(Docset docset) {
    this(docset, Dialect.standard());
  }

  public Workspace(Docset docset, Dialect dialect) {
    this.docset = docset;
    this.dialect = dialect;
  }

  /** Parse every document of the docset, replacing whatever was loaded before. */
  public Workspace load() {
    documents.clear();
    byTag.clear();
    byName.clear();
    for (String id : docset.list()) {
      DocumentInfo info = docset.info(id);
      Iterator<IndentedLines.Line> lines = docset.text(id);
      if (info == null || lines == null) {
        throw new Decl.DeclException("Docset lists document '" + id + "' but can't supply it", id);
      }
      SyntaxNode syntax = Decl.parse(lines, info.type(), info.field("path"), dialect);
      Node.Context context = new Node.Context(info.type(), this::index, id);
      documents.put(id, Node.of(syntax, context));
    }
    logger.info(
        "Loaded {} documents, {} top-level tags", documents.size(), byTag.keySet().size());
    return this;
  }

  private void index(String docid, String tag, String name, int level, String path, Node node) {
    if (level != 1) {
      return;
    }
    byTag.computeIfAbsent(tag, t -> new ArrayList<>()).add(node);
    byName.computeIfAbsent(tag, t -> new LinkedHashMap<>()).put(name, node);
  }

  /** Top-level nodes with the given tag, in load order. */
  public List<Node> nodes(String tag) {
    return Collections.unmodifiableList(byTag.getOrDefault(tag, Collections.emptyList()));
  }

  /** The last top-level node loaded with the given tag and name, or null. */
  public Node node(String tag, String name) {
    Map<String, Node> names = byName.get(tag);
    return names == null ? null : names.get(name);
  }

  /** Apply a function to every top-level node with the tag and collect what it returns. */
  public <T> List<T> extract(String tag, Function<Node, T> fn) {
    List<T> out = new ArrayList<>();
    for (Node node : nodes(tag)) {
      out.add(fn.apply(node));
    }
    return out;
  }

  /** Document roots by docset id. */
  public Map<String, Node> documents() {
    return Collections.unmodifiableMap(documents);
  }

  public Docset docset() {
    return docset;
  }
}
