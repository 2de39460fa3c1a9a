//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import org.junit.*;
import static org.junit.Assert.*;

public class LiteralEscaperTest {

  @Test public void testControlCharacters () {
    assertEquals("\"\\0\\a\\b\\f\\n\\r\\t\\v\"",
                 LiteralEscaper.STRING.quote("\0\u0007\b\f\n\r\t\u000B"));
    assertEquals("\"\\u001B[0m\"", LiteralEscaper.STRING.quote("\u001B[0m"));
    assertEquals("\"\\u2028\"", LiteralEscaper.STRING.quote("\u2028"));
  }

  @Test public void testQuotes () {
    assertEquals("\"it's \\\"quoted\\\"\"", LiteralEscaper.STRING.quote("it's \"quoted\""));
    assertEquals("'\"'", LiteralEscaper.CHAR.quote("\""));
    assertEquals("'\\\\'", LiteralEscaper.CHAR.quote("\\"));
  }

  @Test public void testPrintablePassesThrough () {
    assertEquals("\"h\u00e9llo w\u00f6rld \u4e16\u754c\"",
                 LiteralEscaper.STRING.quote("h\u00e9llo w\u00f6rld \u4e16\u754c"));
    // surrogate pairs are left alone
    assertEquals("\"\ud83d\ude00\"", LiteralEscaper.STRING.quote("\ud83d\ude00"));
  }

  @Test public void testUnpairedSurrogates () {
    assertEquals("\"a\\uD800b\"", LiteralEscaper.STRING.quote("a\ud800b"));
    assertEquals("\"\\uDE00\\n\"", LiteralEscaper.STRING.quote("\ude00\n"));
    assertEquals("'\\uD83D'", LiteralEscaper.CHAR.quote("\ud83d"));
    // a pair followed by a stray high surrogate keeps the pair intact
    assertEquals("\"\ud83d\ude00\\uD83D\"", LiteralEscaper.STRING.quote("\ud83d\ude00\ud83d"));
  }
}
