//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a symbol tree depth first (assembly, namespaces, types, nested types and members),
 * applying an {@link OrderPolicy} and a {@link VisibilityFilter} at each level, and emits the
 * token sequence and navigation tree of its public surface.
 *
 * <p>An emitter holds only its configuration. All state of a pass lives in the {@link Context}
 * threaded through the walk, so one emitter may run any number of passes, concurrently if need
 * be.</p>
 */
public class TokenEmitter {

  /** The language tag of the code files we produce. */
  public static final String LANGUAGE = "C#";

  public TokenEmitter (RenderConfig config, OrderPolicy order, VisibilityFilter filter) {
    _config = config;
    _order = order;
    _filter = filter;
  }

  /**
   * Emits the public surface of {@code assembly}.
   * @throws InvalidSymbolTreeException if the tree is not well formed.
   */
  public CodeFile emit (Symbol.Assembly assembly) {
    List<Symbol.Namespace> namespaces = new ArrayList<>();
    flatten(assembly.global, "", namespaces);
    namespaces = _order.orderNamespaces(namespaces);

    TokenSink out = new TokenSink(_config.indentUnit);
    Context ctx = Context.root(out, DefinitionIndex.build(namespaces, _order, _filter));
    List<NavigationItem> items = new ArrayList<>();
    for (Symbol.Namespace ns : namespaces) {
      if (ns.name.isEmpty()) emitTypes(ns.types, ctx, items);
      else emitNamespace(ns, ctx, items);
    }

    NavigationItem root = new NavigationItem(null, assembly.name, "assembly", items);
    String name = assembly.version.isEmpty() ? assembly.name :
      assembly.name + " (" + assembly.version + ")";
    return new CodeFile(name, assembly.name, LANGUAGE, out.finish(), ImmutableList.of(root));
  }

  /** Collects the visible namespaces nested in {@code ns} (and {@code ns} itself), each renamed to
    * its full dotted name. Only the name and types are kept; a namespace line carries no
    * documentation or attributes. */
  protected void flatten (Symbol.Namespace ns, String fullName, List<Symbol.Namespace> into) {
    if (_filter.isVisible(ns)) {
      Symbol.NamespaceBuilder copy = Symbol.namespace(fullName);
      for (Symbol.Type type : ns.types) copy.type(type);
      into.add(copy.build());
    }
    for (Symbol.Namespace child : ns.namespaces) {
      if (child.name.isEmpty()) throw new InvalidSymbolTreeException(
        child, "Nested namespace has no name [parent=" + fullName + "]");
      flatten(child, fullName.isEmpty() ? child.name : fullName + "." + child.name, into);
    }
  }

  protected void emitNamespace (Symbol.Namespace ns, Context ctx, List<NavigationItem> items) {
    String id = ctx.index.allocate(ns.name);
    ctx.out.keyword("namespace");
    ctx.out.space();
    ctx.out.text(ns.name);
    ctx.out.space();
    Context inner = ctx.out.openBlock(ctx);
    List<NavigationItem> children = new ArrayList<>();
    emitTypes(ns.types, inner, children);
    ctx.out.closeBlock(ctx);
    items.add(new NavigationItem(id, ns.name, "namespace", children));
  }

  protected void emitTypes (List<Symbol.Type> types, Context ctx, List<NavigationItem> items) {
    for (Symbol.Type type : _order.orderTypes(types)) {
      if (_filter.isVisible(type)) emitType(type, ctx, items);
    }
  }

  protected void emitType (Symbol.Type type, Context ctx, List<NavigationItem> items) {
    String id = ctx.index.typeId(type);
    Context tctx = startDeclaration(type, ctx.defining(id));
    List<NavigationItem> children = new ArrayList<>();

    ctx.out.indent(tctx);
    if (type.access.keyword.length() > 0) {
      ctx.out.keyword(type.access.keyword);
      ctx.out.space();
    }

    switch (type.kind) {
    case CLASS:
      typeModifiers(type, tctx, Modifier.ABSTRACT, Modifier.STATIC, Modifier.SEALED);
      partial(tctx);
      ctx.out.keyword("class");
      break;
    case STRUCT:
      typeModifiers(type, tctx, Modifier.READONLY);
      partial(tctx);
      ctx.out.keyword("struct");
      break;
    case INTERFACE:
    case ENUM:
      ctx.out.keyword(type.kind.keyword);
      break;
    case DELEGATE:
      ctx.out.keyword("delegate");
      ctx.out.space();
      SignatureWriter.type(returnType(type.returnType), tctx);
      break;
    default:
      LOG.warn("Unsupported type kind, rendering as text [type={}, kind={}]", type, type.kind);
      ctx.out.text(type.kind.keyword);
      break;
    }
    ctx.out.space();
    ctx.out.lineId(id);
    ctx.out.typeName(type.name, null);
    SignatureWriter.typeParams(type.typeParams, tctx);

    if (type.kind == TypeKind.DELEGATE) {
      SignatureWriter.params(type.parameters, tctx);
      SignatureWriter.constraints(type.typeParams, tctx);
      ctx.out.punct(";");
      ctx.out.newline();

    } else if (type.kind == TypeKind.UNKNOWN) {
      ctx.out.punct(";");
      ctx.out.newline();

    } else {
      baseList(type, tctx);
      SignatureWriter.constraints(type.typeParams, tctx);
      ctx.out.space();
      Context inner = ctx.out.openBlock(tctx).within(type);
      emitTypes(type.nestedTypes, inner, children);
      for (Symbol.Member member : _order.orderMembers(type, type.members)) {
        if (_filter.isVisible(member)) emitMember(member, inner);
      }
      ctx.out.closeBlock(tctx);
    }

    endDeclaration(type, ctx);
    items.add(new NavigationItem(id, navText(type), type.kind.keyword, children));
  }

  protected void emitMember (Symbol.Member member, Context ctx) {
    Symbol.Type owner = ctx.owner;
    if (member.name.isEmpty()) throw new InvalidSymbolTreeException(member, "Member has no name");
    boolean isEnumField = member.kind == MemberKind.FIELD && owner.kind == TypeKind.ENUM;
    if (member.type == null && !isEnumField && (member.kind == MemberKind.FIELD ||
        member.kind == MemberKind.PROPERTY || member.kind == MemberKind.EVENT)) {
      throw new InvalidSymbolTreeException(
        member, "Member has no type [kind=" + member.kind + ", owner=" + owner.name + "]");
    }

    String id = ctx.index.allocate(memberKey(ctx.index.typeId(owner), member));
    Context mctx = startDeclaration(member, ctx.defining(id));
    ctx.out.indent(mctx);
    if (needsAccessibility(member, owner)) {
      ctx.out.keyword(effectiveAccess(member).keyword);
      ctx.out.space();
    }

    if (!isEnumField) memberModifiers(member, owner, mctx);

    switch (member.kind) {
    case FIELD:
      if (!isEnumField) {
        SignatureWriter.type(member.type, mctx);
        ctx.out.space();
      }
      ctx.out.lineId(id);
      ctx.out.memberName(member.name);
      if (member.constant != null) {
        ctx.out.space();
        ctx.out.punct("=");
        ctx.out.space();
        if (isEnumField) enumFieldValue(member.constant, mctx);
        else ConstantFormatter.format(member.constant, mctx);
      }
      ctx.out.punct(isEnumField ? "," : ";");
      break;

    case CONSTRUCTOR:
      ctx.out.lineId(id);
      ctx.out.memberName(owner.name);
      SignatureWriter.params(member.parameters, mctx);
      stubBody(mctx);
      break;

    case METHOD:
      SignatureWriter.type(returnType(member.type), mctx);
      ctx.out.space();
      explicitQualifier(member, mctx);
      ctx.out.lineId(id);
      ctx.out.memberName(member.name);
      SignatureWriter.typeParams(member.typeParams, mctx);
      SignatureWriter.params(member.parameters, mctx);
      SignatureWriter.constraints(member.typeParams, mctx);
      if (isAbstract(member, owner)) ctx.out.punct(";");
      else stubBody(mctx);
      break;

    case PROPERTY:
      SignatureWriter.type(member.type, mctx);
      ctx.out.space();
      explicitQualifier(member, mctx);
      ctx.out.lineId(id);
      if (member.parameters.isEmpty()) ctx.out.memberName(member.name);
      else {
        ctx.out.keyword("this");
        SignatureWriter.paramList("[", member.parameters, "]", mctx);
      }
      accessorList(member, isAbstract(member, owner), mctx);
      break;

    case EVENT:
      ctx.out.keyword("event");
      ctx.out.space();
      SignatureWriter.type(member.type, mctx);
      ctx.out.space();
      explicitQualifier(member, mctx);
      ctx.out.lineId(id);
      ctx.out.memberName(member.name);
      if (isAbstract(member, owner)) ctx.out.punct(";");
      else {
        ctx.out.space();
        ctx.out.punct("{ " + _config.eventBody + " }");
      }
      break;

    default:
      LOG.warn("Unsupported member kind, rendering as text [member={}, kind={}]",
               member, member.kind);
      ctx.out.lineId(id);
      ctx.out.text(member.name);
      ctx.out.punct(";");
      break;
    }
    ctx.out.newline();
    endDeclaration(member, ctx);
  }

  /** Emits the range markers, documentation and attributes that precede a declaration. Returns
    * the context for the declaration itself. */
  protected Context startDeclaration (Symbol symbol, Context ctx) {
    Context dctx = ctx;
    if (symbol.deprecated && !ctx.deprecated) {
      ctx.out.marker(TokenKind.DEPRECATED_RANGE_START);
      dctx = ctx.inDeprecated();
    }
    if (symbol.doc != null) {
      ctx.out.marker(TokenKind.DOCUMENTATION_RANGE_START);
      for (String line : Splitter.onPattern("\r?\n").split(symbol.doc)) {
        ctx.out.indent(dctx);
        ctx.out.text(line.isEmpty() ? "///" : "/// " + line);
        ctx.out.newline();
      }
      ctx.out.marker(TokenKind.DOCUMENTATION_RANGE_END);
    }
    emitAttributes(symbol, dctx);
    return dctx;
  }

  /** Closes the deprecated range opened for {@code symbol}, if one was. {@code ctx} is the
    * context from before the declaration. */
  protected void endDeclaration (Symbol symbol, Context ctx) {
    if (symbol.deprecated && !ctx.deprecated) ctx.out.marker(TokenKind.DEPRECATED_RANGE_END);
  }

  /** Emits one line per visible attribute of {@code symbol}. */
  protected void emitAttributes (Symbol symbol, Context ctx) {
    List<Symbol.Attribute> visible = new ArrayList<>();
    for (Symbol.Attribute attr : symbol.attributes) if (_filter.isVisible(attr)) visible.add(attr);

    for (Symbol.Attribute attr : _order.orderAttributes(visible)) {
      boolean skipDiff = _config.skipDiffAttributes.contains(attr.type.simpleName());
      if (skipDiff) ctx.out.marker(TokenKind.SKIP_DIFF_RANGE_START);
      ctx.out.indent(ctx);
      ctx.out.punct("[");
      ctx.out.typeName(attributeName(attr.type), ctx.index.navigateTo(attr.type, ctx.defining));
      if (!attr.args.isEmpty() || !attr.namedArgs.isEmpty()) {
        ctx.out.punct("(");
        boolean first = true;
        for (TypedConstant arg : attr.args) {
          if (!first) SignatureWriter.comma(ctx);
          first = false;
          ConstantFormatter.format(arg, ctx);
        }
        for (String name : attr.namedArgs.keySet()) {
          if (!first) SignatureWriter.comma(ctx);
          first = false;
          ctx.out.memberName(name);
          ctx.out.space();
          ctx.out.punct("=");
          ctx.out.space();
          ConstantFormatter.format(attr.namedArgs.get(name), ctx);
        }
        ctx.out.punct(")");
      }
      ctx.out.punct("]");
      ctx.out.newline();
      if (skipDiff) ctx.out.marker(TokenKind.SKIP_DIFF_RANGE_END);
    }
  }

  /** Emits {@code : Base, IContract} for types that have a non-implicit base type or visible
    * contracts, and {@code : byte} for enums with a non-default underlying type. */
  protected void baseList (Symbol.Type type, Context ctx) {
    List<TypeRef> bases = new ArrayList<>();
    if (type.kind == TypeKind.ENUM) {
      TypeRef under = type.underlyingType;
      if (under != null && !under.name.equals("int")) bases.add(under);
    } else if (type.baseType != null && !type.baseType.isKeyword) {
      bases.add(type.baseType);
    }
    for (TypeRef iface : type.interfaces) {
      if (iface.access.isExternallyVisible()) bases.add(iface);
    }
    if (bases.isEmpty()) return;

    ctx.out.space();
    ctx.out.punct(":");
    ctx.out.space();
    for (int ii = 0; ii < bases.size(); ii++) {
      if (ii > 0) SignatureWriter.comma(ctx);
      SignatureWriter.type(bases.get(ii), ctx);
    }
  }

  /** Returns whether an access keyword precedes {@code member}. Interface members and enum fields
    * have their access fixed by their container, and explicit implementations are qualified by
    * their contract instead. */
  protected boolean needsAccessibility (Symbol.Member member, Symbol.Type owner) {
    if (owner.kind == TypeKind.INTERFACE || owner.kind == TypeKind.ENUM) return false;
    return member.explicitInterface == null && member.access.keyword.length() > 0;
  }

  /** Returns the access level shown for {@code member}. An override of a protected internal member
    * is only reachable as protected from outside the assembly. */
  protected Accessibility effectiveAccess (Symbol.Member member) {
    if (member.access == Accessibility.PROTECTED_OR_INTERNAL && member.is(Modifier.OVERRIDE)) {
      return Accessibility.PROTECTED;
    }
    return member.access;
  }

  /** Returns true if {@code member} has no body: it is abstract, or it is an interface member
    * which is neither static nor a default implementation. */
  protected boolean isAbstract (Symbol.Member member, Symbol.Type owner) {
    if (member.is(Modifier.ABSTRACT)) return true;
    return (owner.kind == TypeKind.INTERFACE && !member.is(Modifier.STATIC) &&
            !member.is(Modifier.VIRTUAL));
  }

  /** Computes the unqualified definition key of {@code member}: its name, a generic arity suffix,
    * and the parameter types of methods, constructors and indexers. */
  protected static String memberKey (String typeId, Symbol.Member member) {
    StringBuilder sb = new StringBuilder(typeId).append('.');
    if (member.explicitInterface != null) sb.append(member.explicitInterface).append('.');
    sb.append(member.kind == MemberKind.CONSTRUCTOR ? "#ctor" : member.name);
    if (!member.typeParams.isEmpty()) sb.append("``").append(member.typeParams.size());
    boolean hasParams = member.kind == MemberKind.METHOD || member.kind == MemberKind.CONSTRUCTOR ||
      !member.parameters.isEmpty();
    if (hasParams) {
      List<String> types = new ArrayList<>();
      for (Parameter param : member.parameters) types.add(param.type.toString());
      sb.append('(').append(Joiner.on(',').join(types)).append(')');
    }
    return sb.toString();
  }

  private void typeModifiers (Symbol.Type type, Context ctx, Modifier... mods) {
    for (Modifier mod : mods) {
      if (type.is(mod)) {
        ctx.out.keyword(mod.keyword);
        ctx.out.space();
      }
    }
  }

  private void memberModifiers (Symbol.Member member, Symbol.Type owner, Context ctx) {
    boolean inInterface = owner.kind == TypeKind.INTERFACE;
    for (Modifier mod : member.modifiers) {
      // constants are implicitly static, interface members implicitly abstract or virtual
      if (mod == Modifier.STATIC && member.is(Modifier.CONST)) continue;
      if (inInterface && (mod == Modifier.ABSTRACT || mod == Modifier.VIRTUAL)) continue;
      ctx.out.keyword(mod.keyword);
      ctx.out.space();
    }
  }

  private void partial (Context ctx) {
    if (_config.partialTypes) {
      ctx.out.keyword("partial");
      ctx.out.space();
    }
  }

  private void explicitQualifier (Symbol.Member member, Context ctx) {
    if (member.explicitInterface == null) return;
    SignatureWriter.type(member.explicitInterface, ctx);
    ctx.out.punct(".");
  }

  private void stubBody (Context ctx) {
    ctx.out.space();
    ctx.out.punct("{");
    ctx.out.space();
    ctx.out.text(_config.stubBody);
    ctx.out.space();
    ctx.out.punct("}");
  }

  private void accessorList (Symbol.Member member, boolean isAbstract, Context ctx) {
    ctx.out.space();
    ctx.out.punct("{");
    if (member.hasGetter) accessor("get", _config.stubBody, isAbstract, ctx);
    if (member.hasSetter) accessor("set", _config.setterBody, isAbstract, ctx);
    ctx.out.space();
    ctx.out.punct("}");
  }

  private void accessor (String keyword, String body, boolean isAbstract, Context ctx) {
    ctx.out.space();
    ctx.out.keyword(keyword);
    if (isAbstract) ctx.out.punct(";");
    else if (body.isEmpty()) {
      ctx.out.space();
      ctx.out.punct("{ }");
    } else {
      ctx.out.space();
      ctx.out.punct("{");
      ctx.out.space();
      ctx.out.text(body);
      ctx.out.space();
      ctx.out.punct("}");
    }
  }

  private void enumFieldValue (TypedConstant value, Context ctx) {
    // enum members show their underlying value rather than decomposing themselves
    if (value instanceof TypedConstant.EnumValue) {
      ctx.out.literal(Long.toString(((TypedConstant.EnumValue)value).value));
    } else {
      ConstantFormatter.format(value, ctx);
    }
  }

  private static TypeRef returnType (TypeRef type) {
    return (type == null) ? VOID : type;
  }

  private static String attributeName (TypeRef type) {
    String name = type.name;
    return name.endsWith(ATTRIBUTE) && name.length() > ATTRIBUTE.length() ?
      name.substring(0, name.length() - ATTRIBUTE.length()) : name;
  }

  private static String navText (Symbol.Type type) {
    StringBuilder sb = new StringBuilder(type.name);
    if (!type.typeParams.isEmpty()) {
      List<String> names = new ArrayList<>();
      for (TypeParameter param : type.typeParams) names.add(param.name);
      sb.append('<').append(Joiner.on(", ").join(names)).append('>');
    }
    return sb.toString();
  }

  private final RenderConfig _config;
  private final OrderPolicy _order;
  private final VisibilityFilter _filter;

  private static final TypeRef VOID = TypeRef.keyword("void");
  private static final String ATTRIBUTE = "Attribute";
  private static final Logger LOG = LoggerFactory.getLogger(TokenEmitter.class);
}
