//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * Enumerates the declared access levels of a symbol. This is the union of the access levels of
 * the languages whose compiled artifacts we read; Java uses only a subset.
 */
public enum Accessibility {

  // note: the order of these elements is from widest to narrowest reach

  PUBLIC("public"),
  PROTECTED_OR_INTERNAL("protected internal"),
  PROTECTED("protected"),
  INTERNAL("internal"),
  PROTECTED_AND_INTERNAL("private protected"),
  PRIVATE("private"),
  /** For symbols which have no access level of their own (namespaces, the assembly). */
  NOT_APPLICABLE("");

  /** The keyword text used when emitting this access level. */
  public final String keyword;

  /** Returns true if symbols with this access level are reachable from outside their assembly. */
  public boolean isExternallyVisible () {
    return this == PUBLIC || this == PROTECTED || this == PROTECTED_OR_INTERNAL;
  }

  Accessibility (String keyword) {
    this.keyword = keyword;
  }
}
