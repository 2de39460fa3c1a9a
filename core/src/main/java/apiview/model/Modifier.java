//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * Declaration modifiers carried by types and members.
 */
public enum Modifier {

  // note: members emit their modifiers in this order

  STATIC("static"),
  ABSTRACT("abstract"),
  VIRTUAL("virtual"),
  SEALED("sealed"),
  OVERRIDE("override"),
  READONLY("readonly"),
  CONST("const");

  public final String keyword;

  Modifier (String keyword) {
    this.keyword = keyword;
  }
}
