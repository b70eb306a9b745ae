package com.kriskowal.decl;

import java.util.Objects;

/**
 * A parameter of a tag line: name, flavor and value. Barewords have flavor "" and are named by the
 * word; quoted strings and one-line code blocks are named by their flavor and carry the content
 * as value; option group entries are named by their key and carry the value after "=", or null.
 */
public final class Parameter {
  private final String name;
  private final String flavor;
  private final String value;

  public Parameter(String name, String flavor, String value) {
    this.name = name;
    this.flavor = flavor;
    this.value = value;
  }

  public String name() {
    return name;
  }

  public String flavor() {
    return flavor;
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Parameter)) return false;
    Parameter p = (Parameter) o;
    return name.equals(p.name) && flavor.equals(p.flavor) && Objects.equals(value, p.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, flavor, value);
  }

  @Override
  public String toString() {
    return "[" + name + ", " + flavor + ", " + value + "]";
  }
}
