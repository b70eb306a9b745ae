package com.kriskowal.decl.docset;

import com.kriskowal.decl.BodyMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** What a docset knows about one document. */
public final class DocumentInfo {

  private final String id;
  private final String tag;
  private final BodyMode type;
  private final Map<String, String> extra;

  public DocumentInfo(String id, String tag, BodyMode type) {
    this(id, tag, type, Collections.emptyMap());
  }

  public DocumentInfo(String id, String tag, BodyMode type, Map<String, String> extra) {
    this.id = id;
    this.tag = tag;
    this.type = type;
    this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public String id() {
    return id;
  }

  public String tag() {
    return tag;
  }

  /** Body mode the document's root is read in. */
  public BodyMode type() {
    return type;
  }

  /** Look up a field by name; null if the document has no such field. */
  public String field(String name) {
    switch (name) {
      case "id":
        return id;
      case "tag":
        return tag;
      case "type":
        return typeName(type);
      default:
        return extra.get(name);
    }
  }

  public static String typeName(BodyMode type) {
    return type.name().toLowerCase(Locale.ROOT);
  }

  /** Body mode for a type name such as {@code tag} or {@code textplus}. */
  public static BodyMode typeOf(String name) {
    try {
      return BodyMode.valueOf(name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown document type '" + name + "'", e);
    }
  }

  @Override
  public String toString() {
    return "DocumentInfo{id=" + id + ", tag=" + tag + ", type=" + typeName(type) + extra + "}";
  }
}
