//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * The passing mode of a parameter.
 */
public enum RefKind {
  NONE(""), REF("ref"), OUT("out"), IN("in"), PARAMS("params"),
  /** The receiver parameter of an extension method. */
  THIS("this");

  public final String keyword;

  RefKind (String keyword) {
    this.keyword = keyword;
  }
}
