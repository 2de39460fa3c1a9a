//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * The declared variance of a generic type parameter.
 */
public enum Variance {
  NONE(""), IN("in"), OUT("out");

  public final String keyword;

  Variance (String keyword) {
    this.keyword = keyword;
  }
}
