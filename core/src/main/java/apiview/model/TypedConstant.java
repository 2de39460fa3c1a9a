//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A typed compile-time constant: an attribute argument, a constant field's value, an enum member's
 * value or a parameter default. This comes in a fixed set of flavors, one nested class each.
 */
public abstract class TypedConstant {

  /** The {@code null} constant. */
  public static final class Null extends TypedConstant {
    @Override public String toString () { return "null"; }
    private Null () {}
  }

  /** A boolean, character or numeric constant. */
  public static final class Primitive extends TypedConstant {
    /** A {@link Boolean}, {@link Character} or {@link Number}. */
    public final Object value;

    @Override public boolean equals (Object other) {
      return (other instanceof Primitive) && value.equals(((Primitive)other).value);
    }
    @Override public int hashCode () { return value.hashCode(); }
    @Override public String toString () { return String.valueOf(value); }

    private Primitive (Object value) {
      Preconditions.checkArgument(
        value instanceof Boolean || value instanceof Character || value instanceof Number,
        "Not a primitive constant: %s", value);
      this.value = value;
    }
  }

  /** A string constant. */
  public static final class Str extends TypedConstant {
    public final String value;

    @Override public boolean equals (Object other) {
      return (other instanceof Str) && value.equals(((Str)other).value);
    }
    @Override public int hashCode () { return value.hashCode(); }
    @Override public String toString () { return "\"" + value + "\""; }

    private Str (String value) {
      this.value = Preconditions.checkNotNull(value);
    }
  }

  /** A named member of an enum type, along with its underlying value. */
  public static final class EnumMember {
    public final String name;
    public final long value;

    public EnumMember (String name, long value) {
      this.name = Preconditions.checkNotNull(name);
      this.value = value;
    }

    @Override public boolean equals (Object other) {
      return (other instanceof EnumMember) && name.equals(((EnumMember)other).name) &&
        value == ((EnumMember)other).value;
    }
    @Override public int hashCode () { return name.hashCode() ^ Long.hashCode(value); }
    @Override public String toString () { return name + "=" + value; }
  }

  /** A value of an enum type. The enum's named members travel with the value so that it can be
    * decomposed into them without access to the enum's declaration. */
  public static final class EnumValue extends TypedConstant {
    public final TypeRef type;
    /** The members of {@link #type}, in declaration order. */
    public final List<EnumMember> members;
    public final long value;

    @Override public boolean equals (Object other) {
      if (!(other instanceof EnumValue)) return false;
      EnumValue oval = (EnumValue)other;
      return type.equals(oval.type) && members.equals(oval.members) && value == oval.value;
    }
    @Override public int hashCode () { return type.hashCode() ^ Long.hashCode(value); }
    @Override public String toString () { return type + "(" + value + ")"; }

    private EnumValue (TypeRef type, List<EnumMember> members, long value) {
      this.type = Preconditions.checkNotNull(type);
      this.members = ImmutableList.copyOf(members);
      this.value = value;
    }
  }

  /** A type-valued constant, rendered as {@code typeof(T)}. */
  public static final class TypeValue extends TypedConstant {
    public final TypeRef type;

    @Override public boolean equals (Object other) {
      return (other instanceof TypeValue) && type.equals(((TypeValue)other).type);
    }
    @Override public int hashCode () { return type.hashCode(); }
    @Override public String toString () { return "typeof(" + type + ")"; }

    private TypeValue (TypeRef type) {
      this.type = Preconditions.checkNotNull(type);
    }
  }

  /** An array of constants. */
  public static final class ArrayValue extends TypedConstant {
    public final List<TypedConstant> elements;

    @Override public boolean equals (Object other) {
      return (other instanceof ArrayValue) && elements.equals(((ArrayValue)other).elements);
    }
    @Override public int hashCode () { return elements.hashCode(); }
    @Override public String toString () { return "{" + Joiner.on(", ").join(elements) + "}"; }

    private ArrayValue (List<TypedConstant> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }
  }

  /** The null constant. */
  public static final TypedConstant NULL = new Null();

  /** Returns a constant for {@code value}, which must be a string, boolean, character or number.
    * A null value yields {@link #NULL}. */
  public static TypedConstant of (Object value) {
    if (value == null) return NULL;
    if (value instanceof String) return new Str((String)value);
    return new Primitive(value);
  }

  public static TypedConstant enumValue (TypeRef type, long value, List<EnumMember> members) {
    return new EnumValue(type, members, value);
  }

  public static TypedConstant type (TypeRef type) {
    return new TypeValue(type);
  }

  public static TypedConstant array (TypedConstant... elements) {
    return new ArrayValue(ImmutableList.copyOf(elements));
  }

  public static TypedConstant array (List<TypedConstant> elements) {
    return new ArrayValue(elements);
  }

  private TypedConstant () {} // seal it!
}
