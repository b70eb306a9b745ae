package com.kriskowal.decl;

import java.util.Collections;
import java.util.List;

/**
 * A token of a tag line. The offset points at the token's first character, delimiter included;
 * the length counts the content only. Option groups and key/value pairs carry sub-tokens in place
 * of text.
 */
public final class Token {
  private final int offset;
  private final int length;
  private final TokenKind kind;
  private final String text;
  private final List<Token> parts;

  public Token(int offset, int length, TokenKind kind, String text) {
    this.offset = offset;
    this.length = length;
    this.kind = kind;
    this.text = text;
    this.parts = null;
  }

  public Token(int offset, int length, TokenKind kind, List<Token> parts) {
    this.offset = offset;
    this.length = length;
    this.kind = kind;
    this.text = null;
    this.parts = Collections.unmodifiableList(parts);
  }

  public int offset() {
    return offset;
  }

  public int length() {
    return length;
  }

  public TokenKind kind() {
    return kind;
  }

  /** Text content, or null for tokens made of parts. */
  public String text() {
    return text;
  }

  /** Sub-tokens of an option group or pair; empty for plain tokens. */
  public List<Token> parts() {
    return parts == null ? Collections.emptyList() : parts;
  }

  public boolean hasParts() {
    return parts != null;
  }

  /** Offset of the first content character. */
  public int contentOffset() {
    return offset + kind.leadWidth();
  }

  /** Exclusive end of the whole token, closing delimiter included. */
  public int end() {
    return contentOffset() + length + kind.tailWidth();
  }

  Token withKind(TokenKind newKind, String newText, int newLength) {
    return new Token(offset, newLength, newKind, newText);
  }

  @Override
  public String toString() {
    if (parts != null) {
      return String.format("%2d %2d %1s %s", offset, length, kind.symbol(), parts);
    }
    return String.format("%2d %2d %1s %s", offset, length, kind.symbol(), text);
  }
}
