//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Emits the pieces of declarations that reference other types: type references, generic
 * parameter lists, constraint clauses and parameter lists.
 */
final class SignatureWriter {

  /** Emits {@code ref}, linking it (and its type arguments) to their definitions if they are
    * defined in this pass. */
  public static void type (TypeRef ref, Context ctx) {
    if (ref.isKeyword) ctx.out.keyword(ref.name);
    else ctx.out.typeName(ref.name, ctx.index.navigateTo(ref, ctx.defining));

    if (!ref.args.isEmpty()) {
      ctx.out.punct("<");
      for (int ii = 0; ii < ref.args.size(); ii++) {
        if (ii > 0) comma(ctx);
        type(ref.args.get(ii), ctx);
      }
      ctx.out.punct(">");
    }
    if (ref.nullable) ctx.out.punct("?");
    for (int ii = 0; ii < ref.arrayRank; ii++) ctx.out.punct("[]");
  }

  /** Emits {@code <in T, U>}, or nothing if {@code params} is empty. */
  public static void typeParams (List<TypeParameter> params, Context ctx) {
    if (params.isEmpty()) return;
    ctx.out.punct("<");
    for (int ii = 0; ii < params.size(); ii++) {
      if (ii > 0) comma(ctx);
      TypeParameter param = params.get(ii);
      if (param.variance != Variance.NONE) {
        ctx.out.keyword(param.variance.keyword);
        ctx.out.space();
      }
      ctx.out.typeName(param.name, null);
    }
    ctx.out.punct(">");
  }

  /** Emits a {@code where} clause for each constrained parameter in {@code params}. Each clause is
    * preceded by a space. */
  public static void constraints (List<TypeParameter> params, Context ctx) {
    for (TypeParameter param : params) {
      if (!param.isConstrained()) continue;
      ctx.out.space();
      ctx.out.keyword("where");
      ctx.out.space();
      ctx.out.typeName(param.name, null);
      ctx.out.space();
      ctx.out.punct(":");
      ctx.out.space();

      List<Runnable> parts = new ArrayList<>();
      if (param.referenceType) parts.add(() -> ctx.out.keyword("class"));
      if (param.valueType) parts.add(() -> ctx.out.keyword("struct"));
      for (TypeRef constraint : param.constraints) parts.add(() -> type(constraint, ctx));
      if (param.constructor) parts.add(() -> {
        ctx.out.keyword("new");
        ctx.out.punct("()");
      });
      for (int ii = 0; ii < parts.size(); ii++) {
        if (ii > 0) comma(ctx);
        parts.get(ii).run();
      }
    }
  }

  /** Emits a parenthesized parameter list. */
  public static void params (List<Parameter> params, Context ctx) {
    paramList("(", params, ")", ctx);
  }

  /** Emits a parameter list between {@code open} and {@code close}. */
  public static void paramList (String open, List<Parameter> params, String close, Context ctx) {
    ctx.out.punct(open);
    for (int ii = 0; ii < params.size(); ii++) {
      if (ii > 0) comma(ctx);
      Parameter param = params.get(ii);
      if (param.refKind != RefKind.NONE) {
        ctx.out.keyword(param.refKind.keyword);
        ctx.out.space();
      }
      type(param.type, ctx);
      ctx.out.space();
      ctx.out.text(param.name);
      if (param.defaultValue != null) {
        ctx.out.space();
        ctx.out.punct("=");
        ctx.out.space();
        ConstantFormatter.format(param.defaultValue, ctx);
      }
    }
    ctx.out.punct(close);
  }

  /** Emits a comma followed by a space. */
  public static void comma (Context ctx) {
    ctx.out.punct(",");
    ctx.out.space();
  }

  private SignatureWriter () {} // static methods only
}
