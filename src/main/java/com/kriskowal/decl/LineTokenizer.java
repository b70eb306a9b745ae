package com.kriskowal.decl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lexer for the remainder of a tag line.
 *
 * <p>Tokens are claimed in strict priority order: quoted strings, then the sigil and the text
 * after it, then a trailing comment, then closed option groups, then a single open code sigil,
 * and finally barewords. Each phase blanks out what it claims so that later phases never see it.
 * Content of tokens that run to the end of the line, and of option groups, is reported with the
 * claimed spans still blanked; {@link TokenPostProcessor} puts them back.
 */
public final class LineTokenizer {

  // A quote right after a sigil starts where the post-sigil text does.
  private static final Comparator<Token> SPAN_ORDER =
      Comparator.comparingInt(Token::offset)
          .thenComparing(Token::end, Comparator.reverseOrder())
          .thenComparingInt(t -> t.kind().isRestOfLine() || t.kind().isGroup() ? 0 : 1);

  private LineTokenizer() {}

  /** Tokenize and post-process one line. */
  public static List<Token> parse(String line) {
    String text = line == null ? "" : line;
    return TokenPostProcessor.process(text, tokenize(text));
  }

  /** Raw tokens of one line, sorted by offset with enclosing tokens ahead of what they enclose. */
  public static List<Token> tokenize(String line) {
    String text = line == null ? "" : line;
    char[] masked = text.toCharArray();
    List<Token> tokens = new ArrayList<>();
    int limit = masked.length;

    // Phase 1: quoted strings
    for (int i = 0; i < limit; i++) {
      char c = masked[i];
      if (c != '"' && c != '\'') {
        continue;
      }
      int close = findClosingQuote(masked, i, limit);
      if (close < 0) {
        continue;
      }
      TokenKind kind = c == '"' ? TokenKind.DOUBLE_QUOTED : TokenKind.SINGLE_QUOTED;
      tokens.add(new Token(i, close - i - 1, kind, text.substring(i + 1, close)));
      blank(masked, i, close + 1);
      i = close;
    }

    // Phase 2: sigil and the text after it
    int colon = findSigil(masked, limit);
    if (colon >= 0) {
      int j = colon + 1;
      while (j < limit && isPunct(masked[j])) {
        j++;
      }
      String sigil = new String(masked, colon + 1, j - colon - 1);
      tokens.add(new Token(colon, sigil.length(), TokenKind.SIGIL, sigil));
      int k = j;
      while (k < limit && text.charAt(k) == ' ') {
        k++;
      }
      if (k < limit) {
        tokens.add(new Token(k, limit - k, TokenKind.POST_SIGIL, new String(masked, k, limit - k)));
      }
      blank(masked, colon, limit);
      limit = trimEnd(text, colon);
    }

    // Phase 3: comment
    for (int i = 0; i < limit; i++) {
      if (masked[i] == '#') {
        String comment = new String(masked, i + 1, limit - i - 1);
        tokens.add(new Token(i, comment.length(), TokenKind.COMMENT, comment));
        blank(masked, i, limit);
        limit = trimEnd(text, i);
        break;
      }
    }

    // Phase 4: closed option groups
    for (int i = 0; i < limit; i++) {
      char c = masked[i];
      if (c != '(' && c != '[') {
        continue;
      }
      char close = c == '(' ? ')' : ']';
      int j = i + 1;
      while (j < limit && masked[j] != close) {
        j++;
      }
      if (j >= limit) {
        continue;
      }
      TokenKind kind = c == '(' ? TokenKind.PAREN_GROUP : TokenKind.BRACKET_GROUP;
      tokens.add(new Token(i, j - i - 1, kind, new String(masked, i + 1, j - i - 1)));
      blank(masked, i, j + 1);
      i = j;
    }

    // Phase 5: open code sigil; there can be only one, and it takes the rest of the line
    for (int i = 0; i < limit; i++) {
      char c = masked[i];
      if (c == '{' || c == '<' || c == '[' || c == '(') {
        String code = new String(masked, i + 1, limit - i - 1);
        tokens.add(new Token(i, code.length(), TokenKind.forOpening(c), code));
        blank(masked, i, limit);
        limit = trimEnd(text, i);
        break;
      }
    }

    // Phase 6: everything else is a bareword
    int i = 0;
    while (i < limit) {
      while (i < limit && Character.isWhitespace(masked[i])) {
        i++;
      }
      int start = i;
      while (i < limit && !Character.isWhitespace(masked[i])) {
        i++;
      }
      if (i > start) {
        tokens.add(new Token(start, i - start, TokenKind.BAREWORD, text.substring(start, i)));
      }
    }

    tokens.sort(SPAN_ORDER);
    return tokens;
  }

  // ========================================================================
  // Utility Methods
  // ========================================================================

  private static int findClosingQuote(char[] s, int start, int limit) {
    char quote = s[start];
    for (int i = start + 1; i < limit; i++) {
      char c = s[i];
      if (c == '\\') {
        i++;
        continue;
      }
      if (c == quote) {
        return i;
      }
    }
    return -1;
  }

  private static int findSigil(char[] s, int limit) {
    for (int i = 0; i < limit; i++) {
      if (s[i] == ':' && (i == 0 || s[i - 1] != '\\')) {
        return i;
      }
    }
    return -1;
  }

  static boolean isPunct(char c) {
    return (c >= '!' && c <= '/')
        || (c >= ':' && c <= '@')
        || (c >= '[' && c <= '`')
        || (c >= '{' && c <= '~');
  }

  private static void blank(char[] s, int from, int to) {
    for (int i = from; i < to; i++) {
      s[i] = ' ';
    }
  }

  private static int trimEnd(String s, int end) {
    while (end > 0 && s.charAt(end - 1) == ' ') {
      end--;
    }
    return end;
  }
}
