//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import java.util.Objects;

/**
 * A rendered row of output along with the definition id of the last symbol declared on it.
 */
public final class DisplayLine {

  /** The rendered text of this line, without a line terminator. */
  public final String text;

  /** The id of the last definition on this line, or null. */
  public final String definitionId;

  public DisplayLine (String text, String definitionId) {
    this.text = text;
    this.definitionId = definitionId;
  }

  @Override public boolean equals (Object other) {
    return (other instanceof DisplayLine) && text.equals(((DisplayLine)other).text) &&
      Objects.equals(definitionId, ((DisplayLine)other).definitionId);
  }

  @Override public int hashCode () {
    return text.hashCode() ^ Objects.hashCode(definitionId);
  }

  @Override public String toString () {
    return (definitionId == null) ? text : text + " #" + definitionId;
  }
}
