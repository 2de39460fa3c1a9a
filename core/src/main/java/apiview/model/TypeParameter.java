//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A generic type parameter declared by a type or method, with its variance and constraints.
 */
public final class TypeParameter {

  public final String name;
  public final Variance variance;

  /** Type constraints, in declaration order. */
  public final List<TypeRef> constraints;

  /** The {@code class}, {@code struct} and {@code new()} constraints. */
  public final boolean referenceType, valueType, constructor;

  public static TypeParameter of (String name) {
    return new TypeParameter(name, Variance.NONE, ImmutableList.of(), false, false, false);
  }

  public TypeParameter variance (Variance variance) {
    return new TypeParameter(name, variance, constraints, referenceType, valueType, constructor);
  }

  public TypeParameter constraints (TypeRef... constraints) {
    return new TypeParameter(name, variance, ImmutableList.copyOf(constraints),
                             referenceType, valueType, constructor);
  }

  public TypeParameter kindConstraints (boolean referenceType, boolean valueType,
                                        boolean constructor) {
    return new TypeParameter(name, variance, constraints, referenceType, valueType, constructor);
  }

  /** Returns true if this parameter carries any constraint that needs a {@code where} clause. */
  public boolean isConstrained () {
    return referenceType || valueType || constructor || !constraints.isEmpty();
  }

  @Override public String toString () {
    return variance == Variance.NONE ? name : variance.keyword + " " + name;
  }

  private TypeParameter (String name, Variance variance, List<TypeRef> constraints,
                         boolean referenceType, boolean valueType, boolean constructor) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Type parameter requires a name");
    this.name = name;
    this.variance = Preconditions.checkNotNull(variance);
    this.constraints = ImmutableList.copyOf(constraints);
    this.referenceType = referenceType;
    this.valueType = valueType;
    this.constructor = constructor;
  }
}
