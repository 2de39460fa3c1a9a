//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Longs;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits typed constants: attribute arguments, constant field values and parameter defaults.
 */
final class ConstantFormatter {

  /** Emits {@code value} via {@code ctx}. */
  public static void format (TypedConstant value, Context ctx) {
    if (value instanceof TypedConstant.Null) {
      ctx.out.keyword("null");

    } else if (value instanceof TypedConstant.EnumValue) {
      formatEnum((TypedConstant.EnumValue)value, ctx);

    } else if (value instanceof TypedConstant.TypeValue) {
      ctx.out.keyword("typeof");
      ctx.out.punct("(");
      SignatureWriter.type(((TypedConstant.TypeValue)value).type, ctx);
      ctx.out.punct(")");

    } else if (value instanceof TypedConstant.ArrayValue) {
      ctx.out.keyword("new");
      ctx.out.punct("[] {");
      List<TypedConstant> elems = ((TypedConstant.ArrayValue)value).elements;
      for (int ii = 0; ii < elems.size(); ii++) {
        if (ii > 0) SignatureWriter.comma(ctx);
        format(elems.get(ii), ctx);
      }
      ctx.out.punct("}");

    } else if (value instanceof TypedConstant.Str) {
      ctx.out.stringLiteral(LiteralEscaper.STRING.quote(((TypedConstant.Str)value).value));

    } else if (value instanceof TypedConstant.Primitive) {
      Object prim = ((TypedConstant.Primitive)value).value;
      if (prim instanceof Character) ctx.out.literal(LiteralEscaper.CHAR.quote(prim.toString()));
      else ctx.out.literal(formatPrimitive(prim));

    } else {
      LOG.warn("Unsupported constant, rendering as text [value={}]", value);
      ctx.out.text(String.valueOf(value));
    }
  }

  /** Returns the canonical text of a boolean or number. */
  public static String formatPrimitive (Object value) {
    if (value instanceof BigDecimal) return ((BigDecimal)value).toPlainString();
    return value.toString();
  }

  /**
   * Decomposes {@code value} into the named members of its enum type. A member with exactly the
   * value wins. Otherwise members are taken largest value first while their bits are all still
   * unaccounted for. If that leaves bits uncovered, every member whose bits lie within the value is
   * used instead. The members used are joined with {@code |} in declaration order. If no
   * combination of members reproduces the value, the raw number is emitted.
   */
  static void formatEnum (TypedConstant.EnumValue value, Context ctx) {
    for (TypedConstant.EnumMember member : value.members) {
      if (member.value == value.value) {
        enumMember(value.type, member, ctx);
        return;
      }
    }

    List<TypedConstant.EnumMember> used = new ArrayList<>();
    long remain = value.value;
    if (remain != 0) {
      for (TypedConstant.EnumMember member : BY_VALUE_DESC.sortedCopy(value.members)) {
        if (member.value != 0 && (remain & member.value) == member.value) {
          used.add(member);
          remain &= ~member.value;
          if (remain == 0) break;
        }
      }
    }

    // overlapping members can defeat the greedy pass; every member contained in the value may
    // still cover it
    if (remain != 0) {
      used.clear();
      long covered = 0;
      for (TypedConstant.EnumMember member : value.members) {
        if (member.value != 0 && (value.value & member.value) == member.value) {
          used.add(member);
          covered |= member.value;
        }
      }
      if (covered == value.value) remain = 0;
    }

    if (remain != 0 || used.isEmpty()) {
      ctx.out.literal(Long.toString(value.value));
      return;
    }

    boolean first = true;
    for (TypedConstant.EnumMember member : value.members) {
      if (!used.contains(member)) continue;
      if (!first) {
        ctx.out.space();
        ctx.out.punct("|");
        ctx.out.space();
      }
      first = false;
      enumMember(value.type, member, ctx);
    }
  }

  private static void enumMember (TypeRef type, TypedConstant.EnumMember member, Context ctx) {
    ctx.out.typeName(type.simpleName(), ctx.index.navigateTo(type, ctx.defining));
    ctx.out.punct(".");
    ctx.out.memberName(member.name);
  }

  // a stable sort, so members with equal values keep their declaration order
  private static final Ordering<TypedConstant.EnumMember> BY_VALUE_DESC = Ordering.from(
    (TypedConstant.EnumMember a, TypedConstant.EnumMember b) -> Longs.compare(b.value, a.value));

  private static final Logger LOG = LoggerFactory.getLogger(ConstantFormatter.class);

  private ConstantFormatter () {} // static methods only
}
