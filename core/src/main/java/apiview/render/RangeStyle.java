//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.render;

import apiview.model.Token;

/**
 * Decides how a {@link LineRenderer} spells the text of tokens and the boundaries of marked
 * ranges. The reduction of tokens into lines is the same for all styles.
 */
public interface RangeStyle {

  /** Emits token text as is and ignores range boundaries. */
  RangeStyle PLAIN = new RangeStyle() {
    @Override public String text (Token token, boolean deprecated) {
      return token.value;
    }
  };

  /** Returns the text to append for {@code token}, which carries text.
    * @param deprecated whether the token lies inside a deprecated range. */
  String text (Token token, boolean deprecated);

  /** Returns the text to append where a documentation range starts. */
  default String startDocumentation () { return ""; }

  /** Returns the text to append where a documentation range ends. */
  default String endDocumentation () { return ""; }

  /** Returns the text to append where a deprecated range starts. */
  default String startDeprecated () { return ""; }

  /** Returns the text to append where a deprecated range ends. */
  default String endDeprecated () { return ""; }
}
