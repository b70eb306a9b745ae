package com.kriskowal.decl;

import java.util.ArrayList;
import java.util.List;

/**
 * Second pass over the tokens of a line. In order:
 *
 * <ol>
 *   <li>tokens running to the end of the line get the tokens they enclose spliced back in
 *   <li>quoted strings are de-escaped
 *   <li>code sigils closed on the same line become one-line code blocks
 *   <li>option groups are split on commas, then on the first equals sign, into bare and key/value
 *       sub-tokens, with enclosed quoted strings put back in the sub-token holding them
 * </ol>
 */
public final class TokenPostProcessor {

  private TokenPostProcessor() {}

  public static List<Token> process(String line, List<Token> raw) {
    List<Token> out = new ArrayList<>();
    int i = 0;
    while (i < raw.size()) {
      Token t = raw.get(i++);
      TokenKind kind = t.kind();

      List<Token> nested = new ArrayList<>();
      if (kind.isRestOfLine() || kind.isGroup()) {
        while (i < raw.size() && raw.get(i).end() <= t.end()) {
          nested.add(raw.get(i++));
        }
      }

      if (kind.isRestOfLine()) {
        t = new Token(t.offset(), t.length(), kind, splice(line, t, nested));
        t = closeCode(t);
      } else if (kind.isQuoted()) {
        t = t.withKind(kind, deEscape(t.text()), t.length());
      } else if (kind.isGroup()) {
        t = subdivide(line, t, nested);
      }
      out.add(t);
    }
    return out;
  }

  /**
   * Rebuild the content of a token from its blanked text plus the original text of every token
   * it encloses. Each enclosed span has the same length as the blank it fills, so offsets hold.
   */
  static String splice(String line, Token outer, List<Token> nested) {
    StringBuilder buffer = new StringBuilder(outer.text());
    int base = outer.contentOffset();
    for (Token inner : nested) {
      int from = inner.offset() - base;
      int to = inner.end() - base;
      if (from < 0 || to > buffer.length()) {
        continue;
      }
      buffer.replace(from, to, line.substring(inner.offset(), inner.end()));
    }
    return buffer.toString();
  }

  private static Token closeCode(Token t) {
    char match;
    TokenKind closed;
    if (t.kind() == TokenKind.OPEN_BRACE) {
      match = '}';
      closed = TokenKind.CLOSED_BRACE;
    } else if (t.kind() == TokenKind.OPEN_ANGLE) {
      match = '>';
      closed = TokenKind.CLOSED_ANGLE;
    } else {
      return t;
    }
    String content = t.text().stripTrailing();
    if (content.isEmpty() || content.charAt(content.length() - 1) != match) {
      return t;
    }
    content = content.substring(0, content.length() - 1);
    return t.withKind(closed, content, content.length());
  }

  static String deEscape(String s) {
    StringBuilder out = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        char next = s.charAt(i + 1);
        switch (next) {
          case '"':
          case '\'':
          case '\\':
            out.append(next);
            i++;
            continue;
          case 'n':
            out.append('\n');
            i++;
            continue;
          case 't':
            out.append('\t');
            i++;
            continue;
          default:
            break;
        }
      }
      out.append(c);
    }
    return out.toString();
  }

  // ========================================================================
  // Option groups
  // ========================================================================

  private static Token subdivide(String line, Token group, List<Token> quotes) {
    String masked = group.text();
    String restored = splice(line, group, quotes);
    int base = group.contentOffset();
    boolean[] quoted = new boolean[masked.length()];
    for (Token q : quotes) {
      for (int k = q.offset() - base; k < q.end() - base && k < quoted.length; k++) {
        if (k >= 0) {
          quoted[k] = true;
        }
      }
    }
    GroupContent content = new GroupContent(masked, restored, base, quoted, quotes);

    List<Token> parts = new ArrayList<>();
    int start = 0;
    while (start <= masked.length()) {
      int comma = masked.indexOf(',', start);
      int end = comma < 0 ? masked.length() : comma;
      int eq = masked.indexOf('=', start);
      if (eq >= 0 && eq < end) {
        Token key = content.piece(start, eq);
        Token value = content.piece(eq + 1, end);
        List<Token> pair = new ArrayList<>();
        pair.add(key != null ? key : content.empty(start));
        pair.add(value != null ? value : content.empty(eq + 1));
        parts.add(new Token(base + start, end - start, TokenKind.PAIR, pair));
      } else {
        Token bare = content.piece(start, end);
        if (bare != null) {
          parts.add(bare);
        }
      }
      if (comma < 0) {
        break;
      }
      start = comma + 1;
    }
    return new Token(group.offset(), group.length(), group.kind(), parts);
  }

  /** Group text in its blanked and restored forms, with the quoted strings it holds. */
  private static final class GroupContent {
    final String masked;
    final String restored;
    final int base;
    final boolean[] quoted;
    final List<Token> quotes;

    GroupContent(String masked, String restored, int base, boolean[] quoted, List<Token> quotes) {
      this.masked = masked;
      this.restored = restored;
      this.base = base;
      this.quoted = quoted;
      this.quotes = quotes;
    }

    /** Sub-token for the trimmed span, or null if nothing is left after trimming. */
    Token piece(int from, int to) {
      while (from < to && masked.charAt(from) == ' ' && !quoted[from]) {
        from++;
      }
      while (to > from && masked.charAt(to - 1) == ' ' && !quoted[to - 1]) {
        to--;
      }
      if (from >= to) {
        return null;
      }
      for (Token q : quotes) {
        if (q.offset() - base == from && q.end() - base == to) {
          // Nothing but the quoted string: it takes the place of the sub-token.
          return q.withKind(q.kind(), deEscape(q.text()), q.length());
        }
      }
      return new Token(base + from, to - from, TokenKind.BAREWORD, restored.substring(from, to));
    }

    Token empty(int at) {
      return new Token(base + at, 0, TokenKind.BAREWORD, "");
    }
  }
}
