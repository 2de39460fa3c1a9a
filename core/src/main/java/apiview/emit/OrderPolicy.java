//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.Symbol;
import java.util.List;

/**
 * Imposes a deterministic total order over sibling symbols. The order must depend only on the
 * symbols themselves, never on the order in which they are supplied: that is what makes two
 * renderings of the same symbol tree identical. Implementations must be pure.
 */
public interface OrderPolicy {

  /** Orders namespaces. Each namespace supplied here is named by its full dotted name. */
  List<Symbol.Namespace> orderNamespaces (Iterable<Symbol.Namespace> namespaces);

  /** Orders sibling types (the types of one namespace, or the nested types of one type). */
  List<Symbol.Type> orderTypes (Iterable<Symbol.Type> types);

  /** Orders the members of {@code owner}. */
  List<Symbol.Member> orderMembers (Symbol.Type owner, Iterable<Symbol.Member> members);

  /** Orders the attributes applied to one symbol. */
  List<Symbol.Attribute> orderAttributes (Iterable<Symbol.Attribute> attributes);
}
