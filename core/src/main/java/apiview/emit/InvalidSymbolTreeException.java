//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.Symbol;

/**
 * Thrown when a symbol tree is not well formed: a required name or member type is missing, or one
 * symbol instance appears at more than one place in the tree. Unsupported but well formed shapes do not
 * raise this. They are rendered in a degraded form.
 */
public class InvalidSymbolTreeException extends RuntimeException {

  /** A description of the offending symbol. */
  public final String symbol;

  public InvalidSymbolTreeException (Symbol symbol, String message) {
    super(message + " [symbol=" + symbol + "]");
    this.symbol = String.valueOf(symbol);
  }

  private static final long serialVersionUID = 1L;
}
