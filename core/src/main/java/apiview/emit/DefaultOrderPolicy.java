//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import com.google.common.base.Joiner;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import java.util.List;

/**
 * Orders namespaces and types by name (ordinal, case-sensitive) and members by kind group, then
 * name, then parameter count, so that overload sets stay adjacent. Enum fields follow the same
 * rule unless the policy is created with {@link #byEnumValue}, which orders them by value, then
 * name.
 */
public class DefaultOrderPolicy implements OrderPolicy {

  /** Returns a policy that orders the fields of an enum by their value before their name. */
  public static DefaultOrderPolicy byEnumValue () {
    return new DefaultOrderPolicy(true);
  }

  public DefaultOrderPolicy () {
    this(false);
  }

  protected DefaultOrderPolicy (boolean enumsByValue) {
    _enumsByValue = enumsByValue;
  }

  @Override public List<Symbol.Namespace> orderNamespaces (Iterable<Symbol.Namespace> namespaces) {
    return NAMESPACES.immutableSortedCopy(namespaces);
  }

  @Override public List<Symbol.Type> orderTypes (Iterable<Symbol.Type> types) {
    return TYPES.immutableSortedCopy(types);
  }

  @Override public List<Symbol.Member> orderMembers (Symbol.Type owner,
                                                     Iterable<Symbol.Member> members) {
    boolean isEnum = _enumsByValue && owner.kind == TypeKind.ENUM;
    return Ordering.from((Symbol.Member a, Symbol.Member b) -> ComparisonChain.start().
      compare(a.kind, b.kind).
      compare(isEnum ? enumValue(a) : 0L, isEnum ? enumValue(b) : 0L).
      compare(a.name, b.name).
      compare(a.parameters.size(), b.parameters.size()).
      compare(paramKey(a), paramKey(b)).
      compare(a.typeParams.size(), b.typeParams.size()).
      compare(String.valueOf(a.explicitInterface), String.valueOf(b.explicitInterface)).
      compare(String.valueOf(a.type), String.valueOf(b.type)).
      compare(a.access, b.access).
      compare(a.modifiers.toString(), b.modifiers.toString()).
      result()).immutableSortedCopy(members);
  }

  @Override public List<Symbol.Attribute> orderAttributes (Iterable<Symbol.Attribute> attributes) {
    return ATTRIBUTES.immutableSortedCopy(attributes);
  }

  /** Returns the underlying value of an enum member, for ordering. Members without a usable
    * value sort last. */
  protected static long enumValue (Symbol.Member member) {
    TypedConstant value = member.constant;
    if (value instanceof TypedConstant.Primitive &&
        ((TypedConstant.Primitive)value).value instanceof Number) {
      return ((Number)((TypedConstant.Primitive)value).value).longValue();
    }
    if (value instanceof TypedConstant.EnumValue) return ((TypedConstant.EnumValue)value).value;
    return Long.MAX_VALUE;
  }

  protected static String paramKey (Symbol.Member member) {
    return Joiner.on(',').join(member.parameters);
  }

  private static final Ordering<Symbol.Namespace> NAMESPACES = Ordering.from(
    (Symbol.Namespace a, Symbol.Namespace b) -> a.name.compareTo(b.name));

  private static final Ordering<Symbol.Type> TYPES = Ordering.from(
    (Symbol.Type a, Symbol.Type b) -> ComparisonChain.start().
      compare(a.name, b.name).
      compare(a.arity(), b.arity()).
      compare(a.kind, b.kind).
      result());

  private static final Ordering<Symbol.Attribute> ATTRIBUTES = Ordering.from(
    (Symbol.Attribute a, Symbol.Attribute b) -> ComparisonChain.start().
      compare(a.type.toString(), b.type.toString()).
      compare(a.args.toString(), b.args.toString()).
      compare(a.namedArgs.toString(), b.namedArgs.toString()).
      result());

  protected final boolean _enumsByValue;
}
