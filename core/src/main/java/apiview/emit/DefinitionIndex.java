//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Allocates the definition ids of one emission pass. The ids of all visible types are allocated
 * up front, in emission order, so that references to types declared later in the document can
 * link to them. Namespace and member ids are allocated as they are emitted. Every id handed out is
 * unique within the pass; a colliding id is suffixed with {@code ~2}, {@code ~3} and so on.
 */
final class DefinitionIndex {

  /** Indexes the visible types of {@code namespaces}, which must be supplied in emission order and
    * named by their full names. */
  public static DefinitionIndex build (List<Symbol.Namespace> namespaces, OrderPolicy order,
                                       VisibilityFilter filter) {
    DefinitionIndex index = new DefinitionIndex();
    for (Symbol.Namespace ns : namespaces) {
      index.addTypes(ns.name, ns.types, order, filter);
    }
    return index;
  }

  /** Returns the id allocated for {@code type}. */
  public String typeId (Symbol.Type type) {
    String id = _typeIds.get(type);
    if (id == null) throw new IllegalStateException("Type was not indexed: " + type);
    return id;
  }

  /** Returns the id of the definition to which {@code ref} should link, or null if it refers to
    * no type defined in this pass or to the definition {@code defining}. */
  public String navigateTo (TypeRef ref, String defining) {
    if (ref.key == null) return null;
    String id = _keyIds.get(ref.key);
    return (id == null || id.equals(defining)) ? null : id;
  }

  /** Allocates a unique id based on {@code base}. */
  public String allocate (String base) {
    if (_used.add(base)) return base;
    for (int ii = 2; ; ii++) {
      String id = base + "~" + ii;
      if (_used.add(id)) return id;
    }
  }

  private void addTypes (String container, List<Symbol.Type> types, OrderPolicy order,
                         VisibilityFilter filter) {
    for (Symbol.Type type : order.orderTypes(types)) {
      if (!filter.isVisible(type)) continue;
      if (type.name.isEmpty()) throw new InvalidSymbolTreeException(type, "Type has no name");
      if (_typeIds.containsKey(type)) throw new InvalidSymbolTreeException(
        type, "Symbol appears at more than one place in the tree");

      String key = TypeRef.key(container, type.name, type.arity());
      String id = allocate(key);
      _typeIds.put(type, id);
      _keyIds.putIfAbsent(key, id);

      // delegates and unclassified types have no body, so their nested types are never emitted
      if (type.kind != TypeKind.DELEGATE && type.kind != TypeKind.UNKNOWN) {
        addTypes(key, type.nestedTypes, order, filter);
      }
    }
  }

  private final Map<Symbol.Type,String> _typeIds = new IdentityHashMap<>();
  private final Map<String,String> _keyIds = new HashMap<>();
  private final Set<String> _used = new HashSet<>();
}
