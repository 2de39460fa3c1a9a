//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.Symbol;

/**
 * The explicitly scoped state of one emission pass. A context is never modified: descending into
 * a block, a definition or a deprecated region derives a new context, and the caller's context is
 * unaffected. The token sink and definition index are shared by all contexts of one pass.
 */
final class Context {

  /** Where tokens are written. */
  public final TokenSink out;

  /** The definition ids of this pass. */
  public final DefinitionIndex index;

  /** The current nesting level. */
  public final int indent;

  /** The definition id of the symbol being declared, or null. References to this symbol do not
    * link to its definition. */
  public final String defining;

  /** Whether we are inside a deprecated range. */
  public final boolean deprecated;

  /** The type whose members are being emitted, or null at namespace level. */
  public final Symbol.Type owner;

  public static Context root (TokenSink out, DefinitionIndex index) {
    return new Context(out, index, 0, null, false, null);
  }

  /** Returns a context one nesting level deeper. */
  public Context nested () {
    return new Context(out, index, indent+1, defining, deprecated, owner);
  }

  /** Returns a context for the declaration of the symbol with id {@code id}. */
  public Context defining (String id) {
    return new Context(out, index, indent, id, deprecated, owner);
  }

  /** Returns a context inside a deprecated range. */
  public Context inDeprecated () {
    return new Context(out, index, indent, defining, true, owner);
  }

  /** Returns a context for the members of {@code owner}. */
  public Context within (Symbol.Type owner) {
    return new Context(out, index, indent, defining, deprecated, owner);
  }

  private Context (TokenSink out, DefinitionIndex index, int indent, String defining,
                   boolean deprecated, Symbol.Type owner) {
    this.out = out;
    this.index = index;
    this.indent = indent;
    this.defining = defining;
    this.deprecated = deprecated;
    this.owner = owner;
  }
}
