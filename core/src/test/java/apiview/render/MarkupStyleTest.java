//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.render;

import apiview.model.*;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.*;
import static org.junit.Assert.*;

public class MarkupStyleTest {

  @Test public void testEscapingAndLinks () {
    List<Token> tokens = ImmutableList.of(
      Token.link(TokenKind.TYPE_NAME, "List", "a.List`1"), Token.of(TokenKind.PUNCTUATION, "<"),
      Token.of(TokenKind.TYPE_NAME, "T"), Token.of(TokenKind.PUNCTUATION, ">"),
      Token.of(TokenKind.WHITESPACE, " "), Token.of(TokenKind.STRING_LITERAL, "\"a&b\""),
      Token.of(TokenKind.NEWLINE, "\n"));
    List<DisplayLine> lines = new LineRenderer(new MarkupStyle()).render(tokens);
    assertEquals("<a href=\"#a.List`1\">List</a>&lt;T&gt; &quot;a&amp;b&quot;",
                 lines.get(0).text);
  }

  @Test public void testRanges () {
    List<Token> tokens = ImmutableList.of(
      Token.marker(TokenKind.DOCUMENTATION_RANGE_START), Token.of(TokenKind.TEXT, "/// doc"),
      Token.marker(TokenKind.DOCUMENTATION_RANGE_END), Token.of(TokenKind.NEWLINE, "\n"),
      Token.marker(TokenKind.DEPRECATED_RANGE_START), Token.of(TokenKind.KEYWORD, "void"),
      Token.of(TokenKind.WHITESPACE, " "), Token.of(TokenKind.MEMBER_NAME, "M"),
      Token.marker(TokenKind.DEPRECATED_RANGE_END), Token.of(TokenKind.NEWLINE, "\n"));
    List<DisplayLine> lines = new LineRenderer(new MarkupStyle()).render(tokens);
    assertEquals("<span class=\"doc\">/// doc</span>", lines.get(0).text);
    assertEquals("<span class=\"deprecated\"><s>void</s> <s>M</s></span>", lines.get(1).text);
  }
}
