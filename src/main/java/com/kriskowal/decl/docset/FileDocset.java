package com.kriskowal.decl.docset;

import com.kriskowal.decl.BodyMode;
import com.kriskowal.decl.Decl;
import com.kriskowal.decl.IndentedLines;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A docset over the files of a directory tree. Files are typed by extension; files without a
 * known extension are left out. Ids are assigned {@code 0..n-1} in path order when the tree is
 * scanned and stay valid until the next {@link #scan()}.
 */
public final class FileDocset implements Docset {

  private static final Logger logger = LoggerFactory.getLogger(FileDocset.class);

  private final Path root;
  private final Map<String, BodyMode> types;
  private List<DocumentInfo> documents = Collections.emptyList();

  public FileDocset(Path root) {
    this(root, defaultTypes());
  }

  /** Docset with its own extension to document type map, extensions without the dot. */
  public FileDocset(Path root, Map<String, BodyMode> types) {
    this.root = root;
    this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    scan();
  }

  public static Map<String, BodyMode> defaultTypes() {
    Map<String, BodyMode> types = new LinkedHashMap<>();
    types.put("decl", BodyMode.TAG);
    types.put("dtext", BodyMode.TEXTPLUS);
    return types;
  }

  /** Walk the tree again and reassign ids. Returns the number of documents found. */
  public int scan() {
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new Decl.DeclException("Can't scan: " + e.getMessage(), root.toString(), e);
    }

    List<DocumentInfo> found = new ArrayList<>();
    for (Path file : files) {
      String name = file.getFileName().toString();
      int dot = name.lastIndexOf('.');
      BodyMode type = dot < 0 ? null : types.get(name.substring(dot + 1));
      if (type == null) {
        logger.warn("Skipping {}: no document type for its extension", file);
        continue;
      }
      String id = String.valueOf(found.size());
      Map<String, String> extra = new LinkedHashMap<>();
      extra.put("name", name);
      extra.put("path", file.toString());
      found.add(new DocumentInfo(id, "", type, extra));
    }
    documents = Collections.unmodifiableList(found);
    logger.debug("Scanned {}: {} documents", root, documents.size());
    return documents.size();
  }

  @Override
  public List<String> list() {
    List<String> ids = new ArrayList<>();
    for (DocumentInfo info : documents) {
      ids.add(info.id());
    }
    return ids;
  }

  @Override
  public DocumentInfo info(String id) {
    int index;
    try {
      index = Integer.parseInt(id);
    } catch (NumberFormatException e) {
      return null;
    }
    return index >= 0 && index < documents.size() ? documents.get(index) : null;
  }

  @Override
  public Iterator<IndentedLines.Line> text(String id) {
    DocumentInfo info = info(id);
    if (info == null) {
      return null;
    }
    String path = info.field("path");
    try {
      return IndentedLines.of(Files.newBufferedReader(Path.of(path)), path);
    } catch (IOException e) {
      throw new Decl.DeclException("Can't open '" + path + "': " + e.getMessage(), path, e);
    }
  }
}
