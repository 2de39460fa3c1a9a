//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.extract.fixture;

abstract class Hidden {
  public abstract void invisible ();
}
