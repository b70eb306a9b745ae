package com.kriskowal.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A predicate over semantic nodes. Field conditions combine with AND; one level of {@code or},
 * {@code and}, {@code not} and {@code nor} groups can be attached, each holding plain field
 * conditions. A condition value is either a literal string, compared for equality, or a {@link
 * Pattern}, which matches if it is found anywhere in the field.
 *
 * <pre>
 *   Match.where().tag("dialog").or(Match.where().name("main").string(Pattern.compile("sample")))
 * </pre>
 */
public final class Match {

  private enum Field {
    TAG,
    NAME,
    STRING,
    INPARM,
    EXPARM
  }

  private final List<Condition> conditions = new ArrayList<>();
  private Match or;
  private Match and;
  private Match not;
  private Match nor;

  private Match() {}

  public static Match where() {
    return new Match();
  }

  // ========================================================================
  // Field conditions
  // ========================================================================

  public Match tag(String tag) {
    return add(Field.TAG, null, Value.of(tag));
  }

  public Match tag(Pattern tag) {
    return add(Field.TAG, null, Value.of(tag));
  }

  public Match name(String name) {
    return add(Field.NAME, null, Value.of(name));
  }

  public Match name(Pattern name) {
    return add(Field.NAME, null, Value.of(name));
  }

  public Match string(String string) {
    return add(Field.STRING, null, Value.of(string));
  }

  public Match string(Pattern string) {
    return add(Field.STRING, null, Value.of(string));
  }

  /** Some internal parameter is named {@code name}. */
  public Match inparm(String name) {
    return add(Field.INPARM, null, Value.of(name));
  }

  /** Some internal parameter has a name matching the pattern. */
  public Match inparm(Pattern name) {
    return add(Field.INPARM, null, Value.of(name));
  }

  /** The internal parameter {@code name} has the given value. */
  public Match inparm(String name, String value) {
    return add(Field.INPARM, name, Value.of(value));
  }

  public Match inparm(String name, Pattern value) {
    return add(Field.INPARM, name, Value.of(value));
  }

  public Match exparm(String name) {
    return add(Field.EXPARM, null, Value.of(name));
  }

  public Match exparm(Pattern name) {
    return add(Field.EXPARM, null, Value.of(name));
  }

  public Match exparm(String name, String value) {
    return add(Field.EXPARM, name, Value.of(value));
  }

  public Match exparm(String name, Pattern value) {
    return add(Field.EXPARM, name, Value.of(value));
  }

  // ========================================================================
  // Groups
  // ========================================================================

  /** Also require that at least one of the group's conditions holds. */
  public Match or(Match group) {
    this.or = checkGroup(group);
    return this;
  }

  /** Also require that all of the group's conditions hold. */
  public Match and(Match group) {
    this.and = checkGroup(group);
    return this;
  }

  /** Also require that not all of the group's conditions hold. */
  public Match not(Match group) {
    this.not = checkGroup(group);
    return this;
  }

  /** Also require that none of the group's conditions hold. */
  public Match nor(Match group) {
    this.nor = checkGroup(group);
    return this;
  }

  private static Match checkGroup(Match group) {
    if (group.or != null || group.and != null || group.not != null || group.nor != null) {
      throw new IllegalArgumentException("Match groups can't be nested");
    }
    return group;
  }

  // ========================================================================
  // Testing
  // ========================================================================

  /** All field conditions and all attached groups hold. */
  public boolean test(Node node) {
    if (!all(node)) {
      return false;
    }
    if (or != null && !or.any(node)) {
      return false;
    }
    if (and != null && !and.all(node)) {
      return false;
    }
    if (not != null && not.all(node)) {
      return false;
    }
    return nor == null || !nor.any(node);
  }

  /** Every field condition holds; groups are not consulted. */
  boolean all(Node node) {
    for (Condition c : conditions) {
      if (!c.test(node)) {
        return false;
      }
    }
    return true;
  }

  /** At least one field condition holds; groups are not consulted. */
  boolean any(Node node) {
    for (Condition c : conditions) {
      if (c.test(node)) {
        return true;
      }
    }
    return false;
  }

  // ========================================================================
  // From maps
  // ========================================================================

  /**
   * Build a match from a map of field names to values. A value is a {@link String} or a {@link
   * Pattern}; for {@code inparm} and {@code exparm} it can also be a two-element {@link List} or
   * a {@link Map.Entry} naming the parameter and its value. The keys {@code or}, {@code and},
   * {@code not} and {@code nor} take a map of plain field conditions.
   */
  public static Match from(Map<String, ?> fields) {
    return from(fields, true);
  }

  private static Match from(Map<String, ?> fields, boolean groups) {
    Match m = new Match();
    for (Map.Entry<String, ?> e : fields.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      switch (key) {
        case "tag":
          m.add(Field.TAG, null, Value.from(key, value));
          break;
        case "name":
          m.add(Field.NAME, null, Value.from(key, value));
          break;
        case "string":
          m.add(Field.STRING, null, Value.from(key, value));
          break;
        case "inparm":
          m.addParm(Field.INPARM, key, value);
          break;
        case "exparm":
          m.addParm(Field.EXPARM, key, value);
          break;
        case "or":
        case "and":
        case "not":
        case "nor":
          if (!groups) {
            throw new IllegalArgumentException("Match groups can't be nested: '" + key + "'");
          }
          if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Group '" + key + "' needs a map, got " + value);
          }
          @SuppressWarnings("unchecked")
          Match group = from((Map<String, ?>) value, false);
          if (key.equals("or")) {
            m.or = group;
          } else if (key.equals("and")) {
            m.and = group;
          } else if (key.equals("not")) {
            m.not = group;
          } else {
            m.nor = group;
          }
          break;
        default:
          throw new IllegalArgumentException("Unknown match field '" + key + "'");
      }
    }
    return m;
  }

  private void addParm(Field field, String key, Object value) {
    if (value instanceof List) {
      List<?> pair = (List<?>) value;
      if (pair.size() != 2 || !(pair.get(0) instanceof String)) {
        throw new IllegalArgumentException(
            "'" + key + "' pair must be [name, value], got " + value);
      }
      add(field, (String) pair.get(0), Value.from(key, pair.get(1)));
    } else if (value instanceof Map.Entry) {
      Map.Entry<?, ?> pair = (Map.Entry<?, ?>) value;
      if (!(pair.getKey() instanceof String)) {
        throw new IllegalArgumentException("'" + key + "' pair needs a string name: " + value);
      }
      add(field, (String) pair.getKey(), Value.from(key, pair.getValue()));
    } else {
      add(field, null, Value.from(key, value));
    }
  }

  private Match add(Field field, String parm, Value value) {
    conditions.add(new Condition(field, parm, value));
    return this;
  }

  List<String> describe() {
    List<String> out = new ArrayList<>();
    for (Condition c : conditions) {
      out.add(c.toString());
    }
    return Collections.unmodifiableList(out);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Match").append(describe());
    if (or != null) {
      sb.append(" or").append(or.describe());
    }
    if (and != null) {
      sb.append(" and").append(and.describe());
    }
    if (not != null) {
      sb.append(" not").append(not.describe());
    }
    if (nor != null) {
      sb.append(" nor").append(nor.describe());
    }
    return sb.toString();
  }

  // ========================================================================
  // Conditions
  // ========================================================================

  private static final class Condition {
    final Field field;
    final String parm;
    final Value value;

    Condition(Field field, String parm, Value value) {
      this.field = field;
      this.parm = parm;
      this.value = value;
    }

    boolean test(Node node) {
      switch (field) {
        case TAG:
          return value.test(node.tag());
        case NAME:
          return value.test(node.name());
        case STRING:
          return value.test(node.string());
        case INPARM:
          return parm != null
              ? value.test(node.inparm(parm))
              : value.testAny(node.inparmNames());
        case EXPARM:
          return parm != null
              ? value.test(node.exparm(parm))
              : value.testAny(node.exparmNames());
        default:
          throw new IllegalStateException("Unhandled field " + field);
      }
    }

    @Override
    public String toString() {
      return field.name().toLowerCase() + (parm != null ? "(" + parm + ")" : "") + "=" + value;
    }
  }

  private static final class Value {
    final String literal;
    final Pattern pattern;

    private Value(String literal, Pattern pattern) {
      this.literal = literal;
      this.pattern = pattern;
    }

    static Value of(String literal) {
      if (literal == null) {
        throw new IllegalArgumentException("Match value can't be null");
      }
      return new Value(literal, null);
    }

    static Value of(Pattern pattern) {
      if (pattern == null) {
        throw new IllegalArgumentException("Match pattern can't be null");
      }
      return new Value(null, pattern);
    }

    static Value from(String key, Object value) {
      if (value instanceof String) {
        return of((String) value);
      }
      if (value instanceof Pattern) {
        return of((Pattern) value);
      }
      throw new IllegalArgumentException(
          "'" + key + "' needs a string or a pattern, got " + value);
    }

    boolean test(String s) {
      if (s == null) {
        return false;
      }
      return pattern != null ? pattern.matcher(s).find() : literal.equals(s);
    }

    boolean testAny(List<String> candidates) {
      for (String s : candidates) {
        if (test(s)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return pattern != null ? "/" + pattern.pattern() + "/" : "\"" + literal + "\"";
    }
  }
}
