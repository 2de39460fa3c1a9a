//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.extract;

import apiview.model.Symbol;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the symbol tree of a compiled artifact. Providers for different languages can provide
 * other entry points, but this allows the renderer to abstract over them.
 *
 * <p>Providers that key the {@link apiview.model.TypeRef}s they create must follow the key scheme
 * described there, so that references link to the types emitted in the same document.</p>
 */
public interface SymbolProvider {

  /** Reads the artifact at {@code artifact} and returns its symbol tree.
    * @throws IOException if the artifact cannot be read. */
  Symbol.Assembly load (Path artifact) throws IOException;
}
