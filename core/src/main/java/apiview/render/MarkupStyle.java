//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.render;

import apiview.model.Token;
import apiview.model.TokenKind;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;

/**
 * Renders lines as HTML fragments. Documentation is wrapped in a {@code doc} span, deprecated
 * text is struck through, and type names that link to a definition become anchors whose target
 * is the definition id.
 */
public class MarkupStyle implements RangeStyle {

  @Override public String text (Token token, boolean deprecated) {
    String text = ESC.escape(token.value);
    if (token.kind == TokenKind.TYPE_NAME && token.navigateToId != null) {
      text = "<a href=\"#" + ESC.escape(token.navigateToId) + "\">" + text + "</a>";
    }
    if (deprecated && token.kind != TokenKind.WHITESPACE) text = "<s>" + text + "</s>";
    return text;
  }

  @Override public String startDocumentation () { return "<span class=\"doc\">"; }
  @Override public String endDocumentation () { return "</span>"; }

  @Override public String startDeprecated () { return "<span class=\"deprecated\">"; }
  @Override public String endDeprecated () { return "</span>"; }

  private static final Escaper ESC = HtmlEscapers.htmlEscaper();
}
