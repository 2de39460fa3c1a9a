//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.render;

import apiview.model.DisplayLine;
import apiview.model.Token;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Reduces a token sequence to display lines. Rendering is a pure function of the tokens and the
 * {@link RangeStyle}, so one token sequence may be rendered any number of times, in any number of
 * styles.
 */
public class LineRenderer {

  public LineRenderer (RangeStyle style) {
    _style = style;
  }

  public LineRenderer () {
    this(RangeStyle.PLAIN);
  }

  /** Returns one display line per newline token in {@code tokens}. Text that follows the last
    * newline does not form a line. */
  public List<DisplayLine> render (List<Token> tokens) {
    ImmutableList.Builder<DisplayLine> lines = ImmutableList.builder();
    StringBuilder text = new StringBuilder();
    String lineId = null;
    int deprecated = 0;

    for (Token token : tokens) {
      // the last id on a line wins
      if (token.definitionId != null) lineId = token.definitionId;

      switch (token.kind) {
      case NEWLINE:
        lines.add(new DisplayLine(text.toString(), lineId));
        text.setLength(0);
        lineId = null;
        break;
      case LINE_ID_MARKER:
      case SKIP_DIFF_RANGE_START:
      case SKIP_DIFF_RANGE_END:
        break;
      case DOCUMENTATION_RANGE_START:
        text.append(_style.startDocumentation());
        break;
      case DOCUMENTATION_RANGE_END:
        text.append(_style.endDocumentation());
        break;
      case DEPRECATED_RANGE_START:
        deprecated += 1;
        text.append(_style.startDeprecated());
        break;
      case DEPRECATED_RANGE_END:
        deprecated = Math.max(0, deprecated - 1);
        text.append(_style.endDeprecated());
        break;
      default:
        if (token.value != null) text.append(_style.text(token, deprecated > 0));
        break;
      }
    }
    return lines.build();
  }

  private final RangeStyle _style;
}
