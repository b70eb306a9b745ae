package com.kriskowal.decl.docset;

import com.kriskowal.decl.BodyMode;
import com.kriskowal.decl.IndentedLines;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/** A docset of one document, held in a string, with the id {@code *}. */
public final class StringDocset implements Docset {

  public static final String ID = "*";

  private final String source;
  private final BodyMode type;

  public StringDocset(String source) {
    this(source, BodyMode.TAG);
  }

  public StringDocset(String source, BodyMode type) {
    this.source = source;
    this.type = type;
  }

  @Override
  public List<String> list() {
    return Collections.singletonList(ID);
  }

  @Override
  public DocumentInfo info(String id) {
    return ID.equals(id) ? new DocumentInfo(ID, "", type) : null;
  }

  @Override
  public Iterator<IndentedLines.Line> text(String id) {
    return ID.equals(id) ? IndentedLines.of(source) : null;
  }
}
