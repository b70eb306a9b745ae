package com.kriskowal.decl;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * The tables that steer parsing, one set per body mode:
 *
 * <ul>
 *   <li>line types: first character of a line's tag to the mode of the node it starts, with ""
 *       as the catch-all
 *   <li>bodies: sigil to the body mode of the tagged node's content
 *   <li>terminators: code sigil to the character that closes its body
 *   <li>flags: first character of a tag that hands classification over to another mode's tables,
 *       optionally eating the character
 * </ul>
 *
 * <p>Dialects are immutable once built. {@link #standard()} is the one the parser uses by default.
 */
public final class Dialect {

  public static final int DEFAULT_MAX_INDIRECTION = 8;

  private static final Dialect STANDARD = buildStandard();

  /** Redirects classification to another mode's tables. */
  public static final class Flag {
    private final BodyMode target;
    private final boolean consume;

    public Flag(BodyMode target, boolean consume) {
      this.target = target;
      this.consume = consume;
    }

    public BodyMode target() {
      return target;
    }

    public boolean consume() {
      return consume;
    }
  }

  static final class Table {
    final Map<String, BodyMode> lineTypes;
    final Map<String, BodyMode> bodies;
    final Map<String, Character> terminators;
    final Map<Character, Flag> flags;

    Table(
        Map<String, BodyMode> lineTypes,
        Map<String, BodyMode> bodies,
        Map<String, Character> terminators,
        Map<Character, Flag> flags) {
      this.lineTypes = Collections.unmodifiableMap(new HashMap<>(lineTypes));
      this.bodies = Collections.unmodifiableMap(new HashMap<>(bodies));
      this.terminators = Collections.unmodifiableMap(new HashMap<>(terminators));
      this.flags = Collections.unmodifiableMap(new HashMap<>(flags));
    }
  }

  private final Map<BodyMode, Table> tables;
  private final int maxIndirection;

  private Dialect(Map<BodyMode, Table> tables, int maxIndirection) {
    this.tables = Collections.unmodifiableMap(new EnumMap<>(tables));
    this.maxIndirection = maxIndirection;
  }

  public static Dialect standard() {
    return STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxIndirection() {
    return maxIndirection;
  }

  public boolean hasTable(BodyMode mode) {
    return tables.containsKey(mode);
  }

  /** Tables for a mode, falling back to those of {@link BodyMode#TAG}. */
  Table table(BodyMode mode) {
    Table table = tables.get(mode);
    if (table == null) {
      table = tables.get(BodyMode.TAG);
    }
    if (table == null) {
      throw new Decl.ConfigurationException("No tables for mode " + mode + " and no tag tables");
    }
    return table;
  }

  /** Tables a flag points at; a missing one is a configuration error. */
  Table flagTarget(char flag, BodyMode target) {
    Table table = tables.get(target);
    if (table == null) {
      throw new Decl.ConfigurationException(
          "Flag '" + flag + "' points to mode " + target + ", which has no tables");
    }
    return table;
  }

  private static Dialect buildStandard() {
    Builder b = builder();
    b.lineType(BodyMode.TAG, "#", BodyMode.COMMENT);
    b.lineType(BodyMode.TAG, "", BodyMode.TAG);
    b.body(BodyMode.TAG, ":", BodyMode.TEXT);
    b.body(BodyMode.TAG, ":~", BodyMode.TERMINATED_TAG);
    b.body(BodyMode.TAG, ":#", BodyMode.TERMINATED_TAG);
    b.body(BodyMode.TAG, ":+", BodyMode.TEXTPLUS);
    for (String code : new String[] {"{", "<", "(", "["}) {
      b.body(BodyMode.TAG, code, BodyMode.CODE);
    }
    b.terminator(BodyMode.TAG, "{", '}');
    b.terminator(BodyMode.TAG, "(", ')');
    b.terminator(BodyMode.TAG, "[", ']');
    b.terminator(BodyMode.TAG, "<", '>');

    for (String first : new String[] {"#", "-", "~", "+", ":", "\""}) {
      b.lineType(BodyMode.TEXTPLUS, first, BodyMode.TEXTPLUS);
    }
    b.flag(BodyMode.TEXTPLUS, '+', BodyMode.TAG, true);

    b.table(BodyMode.COMMENT);
    return b.build();
  }

  // ========================================================================
  // Builder
  // ========================================================================

  public static final class Builder {
    private final Map<BodyMode, Map<String, BodyMode>> lineTypes = new EnumMap<>(BodyMode.class);
    private final Map<BodyMode, Map<String, BodyMode>> bodies = new EnumMap<>(BodyMode.class);
    private final Map<BodyMode, Map<String, Character>> terminators =
        new EnumMap<>(BodyMode.class);
    private final Map<BodyMode, Map<Character, Flag>> flags = new EnumMap<>(BodyMode.class);
    private int maxIndirection = DEFAULT_MAX_INDIRECTION;

    private Builder() {}

    /** Declare a mode's tables even if they stay empty. */
    public Builder table(BodyMode mode) {
      lineTypes.computeIfAbsent(mode, m -> new HashMap<>());
      return this;
    }

    public Builder lineType(BodyMode mode, String firstChar, BodyMode lineType) {
      table(mode);
      lineTypes.get(mode).put(firstChar, lineType);
      return this;
    }

    public Builder body(BodyMode mode, String sigil, BodyMode body) {
      table(mode);
      bodies.computeIfAbsent(mode, m -> new HashMap<>()).put(sigil, body);
      return this;
    }

    public Builder terminator(BodyMode mode, String sigil, char terminator) {
      table(mode);
      terminators.computeIfAbsent(mode, m -> new HashMap<>()).put(sigil, terminator);
      return this;
    }

    public Builder flag(BodyMode mode, char flag, BodyMode target, boolean consume) {
      table(mode);
      flags.computeIfAbsent(mode, m -> new HashMap<>()).put(flag, new Flag(target, consume));
      return this;
    }

    public Builder maxIndirection(int maxIndirection) {
      if (maxIndirection < 1) {
        throw new IllegalArgumentException("Indirection bound must be positive: " + maxIndirection);
      }
      this.maxIndirection = maxIndirection;
      return this;
    }

    public Dialect build() {
      Map<BodyMode, Table> tables = new EnumMap<>(BodyMode.class);
      for (BodyMode mode : lineTypes.keySet()) {
        tables.put(
            mode,
            new Table(
                lineTypes.get(mode),
                bodies.getOrDefault(mode, Collections.emptyMap()),
                terminators.getOrDefault(mode, Collections.emptyMap()),
                flags.getOrDefault(mode, Collections.emptyMap())));
      }
      return new Dialect(tables, maxIndirection);
    }
  }
}
