package com.kriskowal.decl.docset;

import com.kriskowal.decl.IndentedLines;
import java.util.Iterator;
import java.util.List;

/**
 * The documents that make up a Decl workspace, each known by an id. Lookups of an id the docset
 * doesn't have return null.
 */
public interface Docset {

  /** Document ids in a stable order. */
  List<String> list();

  DocumentInfo info(String id);

  /** One field of a document's info: {@code id}, {@code tag}, {@code type} or more. */
  default String info(String id, String field) {
    DocumentInfo info = info(id);
    return info == null ? null : info.field(field);
  }

  /** The document's lines, ready for parsing. */
  Iterator<IndentedLines.Line> text(String id);
}
