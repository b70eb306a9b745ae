package com.kriskowal.decl;

import java.util.EnumSet;
import java.util.Set;

/** Finds the tag at the start of a line and decides what kind of node the line starts. */
public final class LineClassifier {

  private LineClassifier() {}

  /** Leading tag of a line, the column where the rest starts, and the rest. */
  public static final class Initial {
    private final String tag;
    private final int postIndent;
    private final String rest;

    Initial(String tag, int postIndent, String rest) {
      this.tag = tag;
      this.postIndent = postIndent;
      this.rest = rest;
    }

    public String tag() {
      return tag;
    }

    public int postIndent() {
      return postIndent;
    }

    public String rest() {
      return rest;
    }
  }

  /** Outcome of classification; a null mode means the line is plain text. */
  public static final class Classification {
    private final BodyMode mode;
    private final String tag;

    Classification(BodyMode mode, String tag) {
      this.mode = mode;
      this.tag = tag;
    }

    public BodyMode mode() {
      return mode;
    }

    public String tag() {
      return tag;
    }

    public boolean isText() {
      return mode == null;
    }
  }

  /**
   * Split off the tag: a run of characters up to whitespace or one of {@code :{[<(}, or a whole
   * {@code [...]} or {@code <...>} run that is followed by whitespace or a sigil. A line that
   * starts with a sigil has an empty tag and is all rest.
   */
  public static Initial findInitial(String text) {
    int n = text.length();
    int end;
    boolean bracketed = false;
    char first = n > 0 ? text.charAt(0) : ' ';
    if (first == '[' || first == '<') {
      int close = text.indexOf(first == '[' ? ']' : '>');
      end = close < 0 ? 0 : close + 1;
      bracketed = true;
    } else {
      end = 0;
      while (end < n && !isBreak(text.charAt(end))) {
        end++;
      }
    }
    if (end == 0) {
      return new Initial("", 0, text);
    }
    int j = end;
    while (j < n && Character.isWhitespace(text.charAt(j))) {
      j++;
    }
    if (bracketed && (end == n || !isBreak(text.charAt(end)) || j == n)) {
      // A bracketed run needs something after it to count as a tag.
      return new Initial("", 0, text);
    }
    if (j == n) {
      return new Initial(text.substring(0, end), 0, "");
    }
    return new Initial(text.substring(0, end), j, text.substring(j));
  }

  /**
   * Classify a tag with the tables of the given mode. Flags on the first character hand the
   * lookup over to the target mode's tables and may eat the character; the hand-over can chain,
   * up to the dialect's bound, and may not come back to a mode without eating a character.
   */
  public static Classification identify(Dialect dialect, BodyMode mode, String tag) {
    Dialect.Table table = dialect.table(mode);
    Set<BodyMode> visited = EnumSet.of(mode);
    int hops = 0;
    while (!tag.isEmpty()) {
      Dialect.Flag flag = table.flags.get(tag.charAt(0));
      if (flag == null) {
        break;
      }
      char c = tag.charAt(0);
      if (++hops > dialect.maxIndirection()) {
        throw new Decl.ConfigurationException(
            "Flag indirection deeper than " + dialect.maxIndirection() + " at '" + c + "'");
      }
      table = dialect.flagTarget(c, flag.target());
      if (flag.consume()) {
        // The tag got shorter, so coming back to a mode is progress.
        tag = tag.substring(1);
        visited.clear();
        visited.add(flag.target());
      } else if (!visited.add(flag.target())) {
        throw new Decl.ConfigurationException(
            "Flag '" + c + "' leads back to mode " + flag.target());
      }
    }
    BodyMode lineType = null;
    if (!tag.isEmpty()) {
      lineType = table.lineTypes.get(tag.substring(0, 1));
    }
    if (lineType == null) {
      lineType = table.lineTypes.get("");
    }
    return new Classification(lineType, tag);
  }

  private static boolean isBreak(char c) {
    return Character.isWhitespace(c) || c == ':' || c == '{' || c == '[' || c == '<' || c == '(';
  }
}
