package com.kriskowal.decl;

/** What a token on a tag line is, named by the one-character symbol the parameters report. */
public enum TokenKind {
  BAREWORD(""),
  DOUBLE_QUOTED("\""),
  SINGLE_QUOTED("'"),
  SIGIL(":"),
  POST_SIGIL("."),
  COMMENT("#"),
  PAREN_GROUP(")"),
  BRACKET_GROUP("]"),
  OPEN_BRACE("{"),
  OPEN_ANGLE("<"),
  OPEN_PAREN("("),
  OPEN_BRACKET("["),
  CLOSED_BRACE("}"),
  CLOSED_ANGLE(">"),
  PAIR("=");

  private final String symbol;

  TokenKind(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isQuoted() {
    return this == DOUBLE_QUOTED || this == SINGLE_QUOTED;
  }

  public boolean isGroup() {
    return this == PAREN_GROUP || this == BRACKET_GROUP;
  }

  /** Code sigil still open at the end of the line. */
  public boolean isOpenCode() {
    return this == OPEN_BRACE || this == OPEN_ANGLE || this == OPEN_PAREN || this == OPEN_BRACKET;
  }

  /** Code block opened and closed on the same line. */
  public boolean isClosedCode() {
    return this == CLOSED_BRACE || this == CLOSED_ANGLE;
  }

  /** Kinds whose content runs to the end of the line and may enclose other tokens. */
  boolean isRestOfLine() {
    return isOpenCode() || this == COMMENT || this == POST_SIGIL;
  }

  /** Number of delimiter characters in front of the content. */
  int leadWidth() {
    switch (this) {
      case BAREWORD:
      case POST_SIGIL:
      case PAIR:
        return 0;
      default:
        return 1;
    }
  }

  /** Number of delimiter characters after the content. */
  int tailWidth() {
    switch (this) {
      case DOUBLE_QUOTED:
      case SINGLE_QUOTED:
      case PAREN_GROUP:
      case BRACKET_GROUP:
      case CLOSED_BRACE:
      case CLOSED_ANGLE:
        return 1;
      default:
        return 0;
    }
  }

  public static TokenKind forOpening(char c) {
    switch (c) {
      case '{':
        return OPEN_BRACE;
      case '<':
        return OPEN_ANGLE;
      case '(':
        return OPEN_PAREN;
      case '[':
        return OPEN_BRACKET;
      default:
        throw new IllegalArgumentException("Not a code sigil: " + c);
    }
  }
}
