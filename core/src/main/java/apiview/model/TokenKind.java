//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * Enumerates the kinds of {@link Token}. The range marker kinds carry no text; they signal the
 * renderer and downstream diff tooling.
 */
public enum TokenKind {

  KEYWORD,
  PUNCTUATION,
  WHITESPACE,
  NEWLINE,
  TYPE_NAME,
  MEMBER_NAME,
  STRING_LITERAL,
  LITERAL,
  /** Free text, including the degraded rendering of shapes we do not understand. */
  TEXT,
  /** Marks the declaration point of a symbol; carries its definition id. */
  LINE_ID_MARKER,

  DOCUMENTATION_RANGE_START,
  DOCUMENTATION_RANGE_END,
  DEPRECATED_RANGE_START,
  DEPRECATED_RANGE_END,
  /** Brackets text that a diff tool should ignore when comparing two renderings. */
  SKIP_DIFF_RANGE_START,
  SKIP_DIFF_RANGE_END;

  /** Returns true if tokens of this kind never carry text. */
  public boolean isMarker () {
    return this == LINE_ID_MARKER || compareTo(DOCUMENTATION_RANGE_START) >= 0;
  }
}
