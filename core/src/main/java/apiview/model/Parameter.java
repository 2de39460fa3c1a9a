//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.base.Preconditions;

/**
 * A parameter of a method, constructor, indexer or delegate.
 */
public final class Parameter {

  public final String name;
  public final TypeRef type;
  public final RefKind refKind;

  /** The default value of an optional parameter, or null if the parameter is required. */
  public final TypedConstant defaultValue;

  public static Parameter of (String name, TypeRef type) {
    return new Parameter(name, type, RefKind.NONE, null);
  }

  public Parameter refKind (RefKind refKind) {
    return new Parameter(name, type, refKind, defaultValue);
  }

  public Parameter defaultValue (TypedConstant defaultValue) {
    return new Parameter(name, type, refKind, defaultValue);
  }

  @Override public String toString () {
    return (refKind == RefKind.NONE ? "" : refKind.keyword + " ") + type + " " + name;
  }

  private Parameter (String name, TypeRef type, RefKind refKind, TypedConstant defaultValue) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Parameter requires a name");
    this.name = name;
    this.type = Preconditions.checkNotNull(type, "Parameter %s requires a type", name);
    this.refKind = Preconditions.checkNotNull(refKind);
    this.defaultValue = defaultValue;
  }
}
