//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.Symbol;

/**
 * Decides which symbols belong in the public surface.
 */
public interface VisibilityFilter {

  /** Returns true if {@code symbol} belongs in the output. */
  boolean isVisible (Symbol symbol);

  /** Returns true if {@code attribute} is rendered above the declaration it is applied to. */
  boolean isVisible (Symbol.Attribute attribute);
}
