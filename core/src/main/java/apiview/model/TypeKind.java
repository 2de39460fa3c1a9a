//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * Denotes the different kinds of types that appear in a symbol tree.
 */
public enum TypeKind {

  CLASS("class"),
  STRUCT("struct"),
  INTERFACE("interface"),
  ENUM("enum"),
  DELEGATE("delegate"),

  /** A type the provider could not classify. These are rendered in a degraded form. */
  UNKNOWN("unknown");

  /** The keyword that introduces a declaration of this kind, also used as the navigation tag. */
  public final String keyword;

  TypeKind (String keyword) {
    this.keyword = keyword;
  }
}
