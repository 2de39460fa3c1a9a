//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.Token;
import apiview.model.TokenKind;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the tokens of one emission pass, in order. Blocks must be opened and closed in
 * pairs; {@link #finish} checks that they were.
 */
final class TokenSink {

  public TokenSink (String indentUnit) {
    _indentUnit = indentUnit;
  }

  public void keyword (String text) {
    add(Token.of(TokenKind.KEYWORD, text));
  }

  public void punct (String text) {
    add(Token.of(TokenKind.PUNCTUATION, text));
  }

  public void space () {
    add(Token.of(TokenKind.WHITESPACE, " "));
  }

  public void text (String text) {
    add(Token.of(TokenKind.TEXT, text));
  }

  public void memberName (String name) {
    add(Token.of(TokenKind.MEMBER_NAME, name));
  }

  /** Emits a type name which links to {@code navigateToId}, if that is non-null. */
  public void typeName (String name, String navigateToId) {
    add(Token.link(TokenKind.TYPE_NAME, name, navigateToId));
  }

  public void literal (String text) {
    add(Token.of(TokenKind.LITERAL, text));
  }

  public void stringLiteral (String text) {
    add(Token.of(TokenKind.STRING_LITERAL, text));
  }

  /** Marks the declaration point of the symbol with id {@code definitionId}. */
  public void lineId (String definitionId) {
    add(Token.lineId(definitionId));
  }

  public void marker (TokenKind kind) {
    add(Token.marker(kind));
  }

  public void newline () {
    add(Token.of(TokenKind.NEWLINE, "\n"));
  }

  /** Emits the leading whitespace of a line at nesting level {@code ctx.indent}. */
  public void indent (Context ctx) {
    if (ctx.indent > 0) {
      add(Token.of(TokenKind.WHITESPACE, Strings.repeat(_indentUnit, ctx.indent)));
    }
  }

  /** Ends the current line with an open brace and returns a context for the block's contents. */
  public Context openBlock (Context ctx) {
    punct("{");
    newline();
    _opened++;
    return ctx.nested();
  }

  /** Emits the closing brace of a block opened from {@code ctx}. */
  public void closeBlock (Context ctx) {
    _closed++;
    Preconditions.checkState(_closed <= _opened, "Closed more blocks than were opened");
    indent(ctx);
    punct("}");
    newline();
  }

  /** Checks that every block was closed and returns the emitted tokens. */
  public List<Token> finish () {
    Preconditions.checkState(_opened == _closed, "Unbalanced blocks [opened=%s, closed=%s]",
                             _opened, _closed);
    return ImmutableList.copyOf(_tokens);
  }

  private void add (Token token) {
    _tokens.add(token);
  }

  private final String _indentUnit;
  private final List<Token> _tokens = new ArrayList<>();
  private int _opened, _closed;
}
