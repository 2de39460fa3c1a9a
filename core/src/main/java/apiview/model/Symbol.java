//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node in the symbol tree supplied by a {@link apiview.extract.SymbolProvider}. Symbols come in
 * a fixed set of variants: {@link Assembly}, {@link Namespace}, {@link Type}, {@link Member} and
 * {@link Attribute}. Symbols are immutable and are created via the builders returned by the static
 * factory methods of this class.
 */
public abstract class Symbol {

  /** The root of a symbol tree: a compiled artifact. */
  public static final class Assembly extends Symbol {
    /** The version of the artifact, or "" if unknown. */
    public final String version;
    /** The unnamed global namespace which contains all other namespaces. */
    public final Namespace global;

    private Assembly (AssemblyBuilder b) {
      super(b);
      this.version = b._version;
      this.global = b._global.build();
    }
  }

  /** A namespace. Its {@link #name} is its simple name, "" for the global namespace. */
  public static final class Namespace extends Symbol {
    public final List<Namespace> namespaces;
    public final List<Type> types;

    private Namespace (NamespaceBuilder b) {
      super(b);
      this.namespaces = ImmutableList.copyOf(b._namespaces);
      this.types = ImmutableList.copyOf(b._types);
    }
  }

  /** A class, struct, interface, enum or delegate. */
  public static final class Type extends Symbol {
    public final TypeKind kind;
    public final List<TypeParameter> typeParams;
    /** The base type, or null if the type extends its kind's implicit root. */
    public final TypeRef baseType;
    /** The directly implemented contracts (interfaces), in declaration order. */
    public final List<TypeRef> interfaces;
    /** The underlying type of an enum, or null for the default. */
    public final TypeRef underlyingType;
    /** The return type of a delegate. */
    public final TypeRef returnType;
    /** The parameters of a delegate. */
    public final List<Parameter> parameters;
    public final List<Type> nestedTypes;
    public final List<Member> members;

    /** Returns the number of generic type parameters declared by this type. */
    public int arity () {
      return typeParams.size();
    }

    private Type (TypeBuilder b) {
      super(b);
      this.kind = b._kind;
      this.typeParams = ImmutableList.copyOf(b._typeParams);
      this.baseType = b._baseType;
      this.interfaces = ImmutableList.copyOf(b._interfaces);
      this.underlyingType = b._underlyingType;
      this.returnType = b._returnType;
      this.parameters = ImmutableList.copyOf(b._parameters);
      this.nestedTypes = ImmutableList.copyOf(b._nestedTypes);
      this.members = ImmutableList.copyOf(b._members);
    }
  }

  /** A field, constructor, property, event, method or accessor of a type. */
  public static final class Member extends Symbol {
    public final MemberKind kind;
    /** The field, property or event type, or the return type of a method. Null for
      * constructors. */
    public final TypeRef type;
    public final List<Parameter> parameters;
    public final List<TypeParameter> typeParams;
    /** The value of a constant field or enum member, or null. */
    public final TypedConstant constant;
    /** The contract whose member this member explicitly implements, or null. */
    public final TypeRef explicitInterface;
    /** Whether a property has a getter and a setter. */
    public final boolean hasGetter, hasSetter;

    private Member (MemberBuilder b) {
      super(b);
      this.kind = b._kind;
      this.type = b._type;
      this.parameters = ImmutableList.copyOf(b._parameters);
      this.typeParams = ImmutableList.copyOf(b._typeParams);
      this.constant = b._constant;
      this.explicitInterface = b._explicitInterface;
      this.hasGetter = b._hasGetter;
      this.hasSetter = b._hasSetter;
    }
  }

  /** An attribute (annotation) applied to another symbol. Its accessibility is that of its
    * attribute type. */
  public static final class Attribute extends Symbol {
    public final TypeRef type;
    /** Positional arguments, in order. */
    public final List<TypedConstant> args;
    /** Named arguments, sorted by name. */
    public final Map<String,TypedConstant> namedArgs;

    private Attribute (AttributeBuilder b) {
      super(b);
      this.type = b._type;
      this.args = ImmutableList.copyOf(b._args);
      this.namedArgs = ImmutableSortedMap.copyOf(b._namedArgs);
    }
  }

  /** The name of this symbol. */
  public final String name;

  /** The declared access level of this symbol. */
  public final Accessibility access;

  /** The declaration modifiers of this symbol. */
  public final Set<Modifier> modifiers;

  /** The attributes applied to this symbol, in the order the provider supplied them. */
  public final List<Attribute> attributes;

  /** The documentation comment text attached to this symbol, or null. */
  public final String doc;

  /** Whether this symbol is marked deprecated (obsolete). */
  public final boolean deprecated;

  /** Whether this symbol was declared implicitly by a compiler rather than in source. */
  public final boolean implicit;

  /** Returns true if this symbol carries {@code modifier}. */
  public boolean is (Modifier modifier) {
    return modifiers.contains(modifier);
  }

  @Override public String toString () {
    return getClass().getSimpleName() + "(" + name + ", " + access + ")";
  }

  public static AssemblyBuilder assembly (String name, String version) {
    return new AssemblyBuilder(name, version);
  }

  public static NamespaceBuilder namespace (String name) {
    return new NamespaceBuilder(name);
  }

  public static TypeBuilder type (TypeKind kind, String name) {
    return new TypeBuilder(kind, name);
  }

  public static MemberBuilder member (MemberKind kind, String name) {
    return new MemberBuilder(kind, name);
  }

  public static MemberBuilder method (String name, TypeRef returnType) {
    return new MemberBuilder(MemberKind.METHOD, name).type(returnType);
  }

  public static MemberBuilder constructor () {
    return new MemberBuilder(MemberKind.CONSTRUCTOR, ".ctor");
  }

  public static MemberBuilder field (String name, TypeRef type) {
    return new MemberBuilder(MemberKind.FIELD, name).type(type);
  }

  public static MemberBuilder property (String name, TypeRef type) {
    return new MemberBuilder(MemberKind.PROPERTY, name).type(type).accessors(true, false);
  }

  public static AttributeBuilder attribute (TypeRef type) {
    return new AttributeBuilder(type);
  }

  /** The data shared by all symbol builders. */
  public static abstract class Builder<B extends Builder<B>> {

    public B access (Accessibility access) {
      _access = Preconditions.checkNotNull(access);
      return self();
    }

    public B modifiers (Modifier... modifiers) {
      _modifiers.addAll(Arrays.asList(modifiers));
      return self();
    }

    public B attribute (Attribute attribute) {
      _attributes.add(Preconditions.checkNotNull(attribute));
      return self();
    }

    public B doc (String doc) {
      _doc = doc;
      return self();
    }

    public B deprecated () {
      _deprecated = true;
      return self();
    }

    public B implicit () {
      _implicit = true;
      return self();
    }

    protected Builder (String name, Accessibility access) {
      _name = Preconditions.checkNotNull(name, "Symbols require a (possibly empty) name");
      _access = access;
    }

    @SuppressWarnings("unchecked") private B self () {
      return (B)this;
    }

    protected final String _name;
    protected Accessibility _access;
    protected final EnumSet<Modifier> _modifiers = EnumSet.noneOf(Modifier.class);
    protected final List<Attribute> _attributes = new ArrayList<>();
    protected String _doc;
    protected boolean _deprecated, _implicit;
  }

  public static final class AssemblyBuilder extends Builder<AssemblyBuilder> {
    /** Adds {@code namespace} as a child of the global namespace. */
    public AssemblyBuilder namespace (Namespace namespace) {
      _global.namespace(namespace);
      return this;
    }
    /** Adds {@code type} to the global namespace. */
    public AssemblyBuilder type (Type type) {
      _global.type(type);
      return this;
    }
    public Assembly build () {
      return new Assembly(this);
    }

    private AssemblyBuilder (String name, String version) {
      super(name, Accessibility.NOT_APPLICABLE);
      _version = Preconditions.checkNotNull(version);
    }

    private final String _version;
    private final NamespaceBuilder _global = new NamespaceBuilder("");
  }

  public static final class NamespaceBuilder extends Builder<NamespaceBuilder> {
    public NamespaceBuilder namespace (Namespace namespace) {
      _namespaces.add(Preconditions.checkNotNull(namespace));
      return this;
    }
    public NamespaceBuilder type (Type type) {
      _types.add(Preconditions.checkNotNull(type));
      return this;
    }
    public Namespace build () {
      return new Namespace(this);
    }

    private NamespaceBuilder (String name) {
      super(name, Accessibility.NOT_APPLICABLE);
    }

    private final List<Namespace> _namespaces = new ArrayList<>();
    private final List<Type> _types = new ArrayList<>();
  }

  public static final class TypeBuilder extends Builder<TypeBuilder> {
    public TypeBuilder typeParams (TypeParameter... params) {
      _typeParams.addAll(Arrays.asList(params));
      return this;
    }
    public TypeBuilder base (TypeRef baseType) {
      _baseType = baseType;
      return this;
    }
    public TypeBuilder implement (TypeRef... interfaces) {
      _interfaces.addAll(Arrays.asList(interfaces));
      return this;
    }
    public TypeBuilder underlying (TypeRef underlyingType) {
      _underlyingType = underlyingType;
      return this;
    }
    public TypeBuilder returns (TypeRef returnType) {
      _returnType = returnType;
      return this;
    }
    public TypeBuilder params (Parameter... params) {
      _parameters.addAll(Arrays.asList(params));
      return this;
    }
    public TypeBuilder nested (Type type) {
      _nestedTypes.add(Preconditions.checkNotNull(type));
      return this;
    }
    public TypeBuilder member (Member member) {
      _members.add(Preconditions.checkNotNull(member));
      return this;
    }
    public Type build () {
      return new Type(this);
    }

    private TypeBuilder (TypeKind kind, String name) {
      super(name, Accessibility.PUBLIC);
      _kind = Preconditions.checkNotNull(kind);
    }

    private final TypeKind _kind;
    private final List<TypeParameter> _typeParams = new ArrayList<>();
    private TypeRef _baseType, _underlyingType, _returnType;
    private final List<TypeRef> _interfaces = new ArrayList<>();
    private final List<Parameter> _parameters = new ArrayList<>();
    private final List<Type> _nestedTypes = new ArrayList<>();
    private final List<Member> _members = new ArrayList<>();
  }

  public static final class MemberBuilder extends Builder<MemberBuilder> {
    public MemberBuilder type (TypeRef type) {
      _type = type;
      return this;
    }
    public MemberBuilder params (Parameter... params) {
      _parameters.addAll(Arrays.asList(params));
      return this;
    }
    public MemberBuilder typeParams (TypeParameter... params) {
      _typeParams.addAll(Arrays.asList(params));
      return this;
    }
    public MemberBuilder constant (TypedConstant constant) {
      _constant = constant;
      return this;
    }
    public MemberBuilder explicitImpl (TypeRef contract) {
      _explicitInterface = contract;
      return this;
    }
    public MemberBuilder accessors (boolean getter, boolean setter) {
      _hasGetter = getter;
      _hasSetter = setter;
      return this;
    }
    public Member build () {
      return new Member(this);
    }

    private MemberBuilder (MemberKind kind, String name) {
      super(name, Accessibility.PUBLIC);
      _kind = Preconditions.checkNotNull(kind);
    }

    private final MemberKind _kind;
    private TypeRef _type, _explicitInterface;
    private final List<Parameter> _parameters = new ArrayList<>();
    private final List<TypeParameter> _typeParams = new ArrayList<>();
    private TypedConstant _constant;
    private boolean _hasGetter, _hasSetter;
  }

  public static final class AttributeBuilder extends Builder<AttributeBuilder> {
    public AttributeBuilder arg (TypedConstant arg) {
      _args.add(Preconditions.checkNotNull(arg));
      return this;
    }
    public AttributeBuilder named (String name, TypedConstant arg) {
      _namedArgs.put(Preconditions.checkNotNull(name), Preconditions.checkNotNull(arg));
      return this;
    }
    public Attribute build () {
      return new Attribute(this);
    }

    private AttributeBuilder (TypeRef type) {
      super(type.name, type.access);
      _type = type;
    }

    private final TypeRef _type;
    private final List<TypedConstant> _args = new ArrayList<>();
    private final Map<String,TypedConstant> _namedArgs = new LinkedHashMap<>();
  }

  private Symbol (Builder<?> b) {
    this.name = b._name;
    this.access = b._access;
    this.modifiers = Sets.immutableEnumSet(b._modifiers);
    this.attributes = ImmutableList.copyOf(b._attributes);
    this.doc = b._doc;
    this.deprecated = b._deprecated;
    this.implicit = b._implicit;
  }
}
