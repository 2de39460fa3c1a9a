//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * A reference to a type from within a signature, base list, attribute or constant.
 *
 * <p>References to types that may be defined in the same document carry a {@link #key}. A type's
 * key is its container's key (namespace full name or enclosing type key), a dot, and its simple
 * name, followed by {@code `N} when it declares {@code N} type parameters. For example {@code
 * a.b.Outer`1.Inner}. Providers must build keys with this scheme so that references can be matched
 * against the types emitted in the same pass.</p>
 */
public final class TypeRef {

  /** The text displayed for this type, excluding type arguments, array and nullable suffixes. */
  public final String name;

  /** The definition key of the referenced type, or null if it has none (special types, type
    * parameters, types from other assemblies that the provider chose not to key). */
  public final String key;

  /** The declared access level of the referenced type. */
  public final Accessibility access;

  /** Whether {@link #name} is a language keyword ({@code int}, {@code void}, {@code object}). */
  public final boolean isKeyword;

  /** Whether this refers to a generic type parameter. */
  public final boolean isTypeParam;

  /** The type arguments applied to the referenced type. */
  public final List<TypeRef> args;

  /** The number of array dimensions applied to the referenced type. */
  public final int arrayRank;

  /** Whether the reference is annotated as nullable. */
  public final boolean nullable;

  /** Computes the key of a type named {@code name} with {@code arity} type parameters, declared in
    * the container with key {@code container} ("" for the global namespace). */
  public static String key (String container, String name, int arity) {
    String key = container.isEmpty() ? name : container + "." + name;
    return (arity == 0) ? key : key + "`" + arity;
  }

  /** Returns a reference to a language keyword type. */
  public static TypeRef keyword (String name) {
    return new TypeRef(name, null, Accessibility.PUBLIC, true, false,
                       ImmutableList.of(), 0, false);
  }

  /** Returns a reference to a generic type parameter named {@code name}. */
  public static TypeRef param (String name) {
    return new TypeRef(name, null, Accessibility.NOT_APPLICABLE, false, true,
                       ImmutableList.of(), 0, false);
  }

  /** Returns a reference to the type with definition key {@code key}, displayed as its key minus
    * any arity suffixes. */
  public static TypeRef named (String key) {
    return new TypeRef(key.replaceAll("`\\d+", ""), key, Accessibility.PUBLIC, false, false,
                       ImmutableList.of(), 0, false);
  }

  /** Returns a reference to the type with definition key {@code key}, displayed as {@code name}. */
  public static TypeRef named (String name, String key) {
    return new TypeRef(name, key, Accessibility.PUBLIC, false, false, ImmutableList.of(), 0, false);
  }

  /** Returns a reference to a type that cannot be defined in the same document. */
  public static TypeRef external (String name) {
    return new TypeRef(name, null, Accessibility.PUBLIC, false, false, ImmutableList.of(), 0,
                       false);
  }

  public TypeRef withArgs (TypeRef... args) {
    return withArgs(ImmutableList.copyOf(args));
  }
  public TypeRef withArgs (List<TypeRef> args) {
    return new TypeRef(name, key, access, isKeyword, isTypeParam, ImmutableList.copyOf(args),
                       arrayRank, nullable);
  }
  public TypeRef withAccess (Accessibility access) {
    return new TypeRef(name, key, access, isKeyword, isTypeParam, args, arrayRank, nullable);
  }
  public TypeRef array (int rank) {
    return new TypeRef(name, key, access, isKeyword, isTypeParam, args, rank, nullable);
  }
  public TypeRef nullable () {
    return new TypeRef(name, key, access, isKeyword, isTypeParam, args, arrayRank, true);
  }

  /** Returns the name of the referenced type with any namespace or container qualifier removed. */
  public String simpleName () {
    int didx = name.lastIndexOf('.');
    return (didx == -1) ? name : name.substring(didx+1);
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof TypeRef)) return false;
    TypeRef oref = (TypeRef)other;
    return (name.equals(oref.name) && Objects.equals(key, oref.key) && access == oref.access &&
            isKeyword == oref.isKeyword && isTypeParam == oref.isTypeParam &&
            args.equals(oref.args) && arrayRank == oref.arrayRank && nullable == oref.nullable);
  }

  @Override public int hashCode () {
    return name.hashCode() ^ args.hashCode() ^ arrayRank;
  }

  /** Returns the display text of this reference, for example {@code java.util.List<T>[]}. */
  @Override public String toString () {
    StringBuilder sb = new StringBuilder(name);
    if (!args.isEmpty()) sb.append('<').append(Joiner.on(", ").join(args)).append('>');
    if (nullable) sb.append('?');
    for (int ii = 0; ii < arrayRank; ii++) sb.append("[]");
    return sb.toString();
  }

  private TypeRef (String name, String key, Accessibility access, boolean isKeyword,
                   boolean isTypeParam, List<TypeRef> args, int arrayRank, boolean nullable) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Type reference requires a name");
    Preconditions.checkArgument(arrayRank >= 0, "Negative array rank %s", arrayRank);
    this.name = name;
    this.key = key;
    this.access = access;
    this.isKeyword = isKeyword;
    this.isTypeParam = isTypeParam;
    this.args = ImmutableList.copyOf(args);
    this.arrayRank = arrayRank;
    this.nullable = nullable;
  }
}
