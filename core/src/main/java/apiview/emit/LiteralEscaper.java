//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import com.google.common.escape.CharEscaper;

/**
 * Escapes the contents of a quoted string or character literal: backslashes, the quote character,
 * the usual control character escapes, and a four digit unicode escape for anything else that
 * does not print. Surrogate pairs pass through untouched; unpaired surrogates are escaped.
 */
final class LiteralEscaper extends CharEscaper {

  /** Escapes the contents of double quoted literals. */
  public static final LiteralEscaper STRING = new LiteralEscaper('"');

  /** Escapes the contents of single quoted literals. */
  public static final LiteralEscaper CHAR = new LiteralEscaper('\'');

  /** Returns {@code text} escaped and wrapped in this escaper's quote character. */
  public String quote (String text) {
    StringBuilder out = new StringBuilder().append(_quote);
    int start = 0;
    for (int ii = 0, ll = text.length(); ii < ll; ii++) {
      char c = text.charAt(ii);
      boolean paired = Character.isHighSurrogate(c) && ii+1 < ll &&
        Character.isLowSurrogate(text.charAt(ii+1));
      if (paired) {
        ii++;
      } else if (Character.isSurrogate(c)) {
        out.append(escape(text.substring(start, ii))).append(unicode(c));
        start = ii+1;
      }
    }
    return out.append(escape(text.substring(start))).append(_quote).toString();
  }

  @Override protected char[] escape (char c) {
    switch (c) {
    case '\\':     return BACKSLASH;
    case '\0':     return "\\0".toCharArray();
    case '\u0007': return "\\a".toCharArray();
    case '\b':     return "\\b".toCharArray();
    case '\f':     return "\\f".toCharArray();
    case '\n':     return "\\n".toCharArray();
    case '\r':     return "\\r".toCharArray();
    case '\t':     return "\\t".toCharArray();
    case '\u000B': return "\\v".toCharArray();
    default:
      if (c == _quote) return new char[] { '\\', c };
      if (isPrintable(c)) return null;
      return unicode(c).toCharArray();
    }
  }

  private static String unicode (char c) {
    return String.format("\\u%04X", (int)c);
  }

  private static boolean isPrintable (char c) {
    switch (Character.getType(c)) {
    case Character.CONTROL:
    case Character.UNASSIGNED:
    case Character.LINE_SEPARATOR:
    case Character.PARAGRAPH_SEPARATOR:
      return false;
    default:
      return true;
    }
  }

  private LiteralEscaper (char quote) {
    _quote = quote;
  }

  private final char _quote;
  private static final char[] BACKSLASH = { '\\', '\\' };
}
