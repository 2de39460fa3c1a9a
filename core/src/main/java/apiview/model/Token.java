//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * The atomic unit of output. Tokens are produced once, in order, by the token emitter and are
 * never modified thereafter.
 */
public final class Token {

  public final TokenKind kind;

  /** The text of this token, null for marker kinds. */
  public final String value;

  /** The definition id of the symbol whose declaration point this token marks, or null. */
  public final String definitionId;

  /** The definition id of the type to which this token's text refers, or null. */
  public final String navigateToId;

  /** Returns a text-bearing token. */
  public static Token of (TokenKind kind, String value) {
    return new Token(kind, value, null, null);
  }

  /** Returns a text-bearing token that links to the definition {@code navigateToId}. */
  public static Token link (TokenKind kind, String value, String navigateToId) {
    return new Token(kind, value, null, navigateToId);
  }

  /** Returns a marker token (a range start or end). */
  public static Token marker (TokenKind kind) {
    Preconditions.checkArgument(kind.isMarker(), "Not a marker kind: %s", kind);
    return new Token(kind, null, null, null);
  }

  /** Returns a line id marker for {@code definitionId}. */
  public static Token lineId (String definitionId) {
    return new Token(TokenKind.LINE_ID_MARKER, null,
                     Preconditions.checkNotNull(definitionId), null);
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Token)) return false;
    Token otok = (Token)other;
    return (kind == otok.kind && Objects.equals(value, otok.value) &&
            Objects.equals(definitionId, otok.definitionId) &&
            Objects.equals(navigateToId, otok.navigateToId));
  }

  @Override public int hashCode () {
    return kind.hashCode() ^ Objects.hashCode(value) ^ Objects.hashCode(definitionId);
  }

  @Override public String toString () {
    StringBuilder sb = new StringBuilder(kind.toString());
    if (value != null) sb.append(" '").append(value).append("'");
    if (definitionId != null) sb.append(" def=").append(definitionId);
    if (navigateToId != null) sb.append(" nav=").append(navigateToId);
    return sb.toString();
  }

  private Token (TokenKind kind, String value, String definitionId, String navigateToId) {
    this.kind = Preconditions.checkNotNull(kind);
    this.value = value;
    this.definitionId = definitionId;
    this.navigateToId = navigateToId;
  }
}
