//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.extract;

import apiview.model.Accessibility;
import apiview.model.Parameter;
import apiview.model.RefKind;
import apiview.model.Symbol;
import apiview.model.TypeKind;
import apiview.model.TypeParameter;
import apiview.model.TypeRef;
import apiview.model.TypedConstant;
import com.google.common.base.Strings;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.MalformedParameterizedTypeException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies the symbol tree of a jar file of compiled Java classes, read via reflection. Classes
 * are loaded without being initialized, so no code from the jar runs. Packages become namespaces,
 * classes, interfaces and enums become types, and runtime visible annotations become attributes.
 *
 * <p>Reflection cannot see documentation or the values of constant fields (reading a static field
 * initializes its class), so neither is supplied. Enum constants are given their ordinal as their
 * value.</p>
 */
public class ReflectionProvider implements SymbolProvider {

  /** Creates a provider that resolves the classes referenced by a jar via {@code parent}. */
  public ReflectionProvider (ClassLoader parent) {
    _parent = parent;
  }

  public ReflectionProvider () {
    this(ReflectionProvider.class.getClassLoader());
  }

  @Override public Symbol.Assembly load (Path artifact) throws IOException {
    String name = artifact.getFileName().toString();
    if (name.endsWith(".jar")) name = name.substring(0, name.length()-4);

    try (JarFile jar = new JarFile(artifact.toFile());
         URLClassLoader loader = new URLClassLoader(
           new URL[] { artifact.toUri().toURL() }, _parent)) {
      PackageNode root = new PackageNode("");
      List<String> classNames = new ArrayList<>();
      for (Enumeration<JarEntry> iter = jar.entries(); iter.hasMoreElements(); ) {
        String entry = iter.nextElement().getName();
        if (!entry.endsWith(".class") || entry.endsWith("module-info.class") ||
            entry.endsWith("package-info.class")) continue;
        classNames.add(entry.substring(0, entry.length()-6).replace('/', '.'));
      }
      classNames.sort(Comparator.naturalOrder());

      for (String className : classNames) {
        Class<?> clazz = loadClass(className, loader);
        // nested classes are reached via their enclosing class
        if (clazz == null || clazz.getDeclaringClass() != null || clazz.isAnonymousClass() ||
            clazz.isLocalClass() || clazz.isSynthetic()) continue;
        Symbol.Type type = type(clazz);
        if (type != null) root.resolve(clazz.getPackageName()).types.add(type);
      }

      Symbol.AssemblyBuilder assembly = Symbol.assembly(name, version(jar));
      for (PackageNode pkg : root.children.values()) assembly.namespace(pkg.build());
      for (Symbol.Type type : root.types) assembly.type(type);
      return assembly.build();
    }
  }

  /** Returns the key of {@code clazz}, per the scheme described by {@link TypeRef}. */
  public static String key (Class<?> clazz) {
    Class<?> outer = clazz.getDeclaringClass();
    String container = (outer == null) ? clazz.getPackageName() : key(outer);
    return TypeRef.key(container, clazz.getSimpleName(), clazz.getTypeParameters().length);
  }

  /** Returns a reference to {@code type}. */
  public static TypeRef ref (java.lang.reflect.Type type) {
    if (type instanceof Class<?>) {
      Class<?> clazz = (Class<?>)type;
      if (clazz.isArray()) {
        TypeRef elem = ref(clazz.getComponentType());
        return elem.array(elem.arrayRank+1);
      }
      if (clazz.isPrimitive()) return TypeRef.keyword(clazz.getName());
      return TypeRef.named(displayName(clazz), key(clazz)).withAccess(
        access(clazz.getModifiers()));
    }
    if (type instanceof ParameterizedType) {
      ParameterizedType ptype = (ParameterizedType)type;
      List<TypeRef> args = new ArrayList<>();
      for (java.lang.reflect.Type arg : ptype.getActualTypeArguments()) args.add(ref(arg));
      return ref(ptype.getRawType()).withArgs(args);
    }
    if (type instanceof GenericArrayType) {
      TypeRef elem = ref(((GenericArrayType)type).getGenericComponentType());
      return elem.array(elem.arrayRank+1);
    }
    if (type instanceof TypeVariable<?>) {
      return TypeRef.param(((TypeVariable<?>)type).getName());
    }
    if (type instanceof WildcardType) {
      // wildcards render as their bound
      WildcardType wtype = (WildcardType)type;
      if (wtype.getLowerBounds().length > 0) return ref(wtype.getLowerBounds()[0]);
      java.lang.reflect.Type[] upper = wtype.getUpperBounds();
      if (upper.length > 0 && upper[0] != Object.class) return ref(upper[0]);
      return TypeRef.param("?");
    }
    LOG.warn("Unknown reflected type, referencing by name [type={}]", type);
    return TypeRef.external(type.getTypeName());
  }

  /** Maps Java access modifiers to an accessibility. Package private maps to internal. */
  public static Accessibility access (int modifiers) {
    if (Modifier.isPublic(modifiers)) return Accessibility.PUBLIC;
    if (Modifier.isProtected(modifiers)) return Accessibility.PROTECTED;
    if (Modifier.isPrivate(modifiers)) return Accessibility.PRIVATE;
    return Accessibility.INTERNAL;
  }

  protected Class<?> loadClass (String name, ClassLoader loader) {
    try {
      return Class.forName(name, false, loader);
    } catch (ClassNotFoundException | LinkageError e) {
      LOG.warn("Skipping class that failed to load [class={}, error={}]", name, e.toString());
      return null;
    }
  }

  /** Creates the type for {@code clazz}, or returns null if its signatures reference classes
    * that are not available. */
  protected Symbol.Type type (Class<?> clazz) {
    try {
      return type0(clazz);
    } catch (LinkageError | TypeNotPresentException | MalformedParameterizedTypeException e) {
      LOG.warn("Skipping class with unresolvable signature [class={}, error={}]",
               clazz.getName(), e.toString());
      return null;
    }
  }

  private Symbol.Type type0 (Class<?> clazz) {
    int mods = clazz.getModifiers();
    TypeKind kind = clazz.isInterface() ? TypeKind.INTERFACE :
      (clazz.isEnum() ? TypeKind.ENUM : TypeKind.CLASS);
    Symbol.TypeBuilder type = Symbol.type(kind, clazz.getSimpleName()).access(access(mods));
    if (kind == TypeKind.CLASS) {
      if (Modifier.isAbstract(mods)) type.modifiers(apiview.model.Modifier.ABSTRACT);
      if (Modifier.isFinal(mods)) type.modifiers(apiview.model.Modifier.SEALED);
    }
    if (clazz.isSynthetic()) type.implicit();
    annotate(clazz, type);

    type.typeParams(typeParams(clazz.getTypeParameters()));
    java.lang.reflect.Type parent = clazz.getGenericSuperclass();
    if (parent != null && parent != Object.class && clazz.getSuperclass() != Enum.class &&
        clazz.getSuperclass() != Record.class) type.base(ref(parent));
    for (java.lang.reflect.Type iface : clazz.getGenericInterfaces()) {
      if (iface != Annotation.class) type.implement(ref(iface));
    }

    for (Class<?> nested : clazz.getDeclaredClasses()) {
      if (nested.isSynthetic()) continue;
      Symbol.Type ntype = type(nested);
      if (ntype != null) type.nested(ntype);
    }

    int ordinal = 0;
    for (Field field : clazz.getDeclaredFields()) {
      if (field.isEnumConstant()) type.member(enumConstant(field, ordinal++));
      else type.member(field(field));
    }
    for (Constructor<?> ctor : clazz.getDeclaredConstructors()) {
      // enum constructors can never be called
      if (kind != TypeKind.ENUM) type.member(constructor(ctor));
    }
    for (Method method : clazz.getDeclaredMethods()) type.member(method(method, clazz));
    return type.build();
  }

  private Symbol.Member enumConstant (Field field, int ordinal) {
    Symbol.MemberBuilder member = Symbol.field(field.getName(), ref(field.getDeclaringClass())).
      constant(TypedConstant.of(ordinal));
    annotate(field, member);
    return member.build();
  }

  private Symbol.Member field (Field field) {
    int mods = field.getModifiers();
    Symbol.MemberBuilder member = Symbol.field(field.getName(), ref(field.getGenericType())).
      access(access(mods));
    if (Modifier.isStatic(mods)) member.modifiers(apiview.model.Modifier.STATIC);
    if (Modifier.isFinal(mods)) member.modifiers(apiview.model.Modifier.READONLY);
    if (field.isSynthetic()) member.implicit();
    annotate(field, member);
    return member.build();
  }

  private Symbol.Member constructor (Constructor<?> ctor) {
    Symbol.MemberBuilder member = Symbol.constructor().access(access(ctor.getModifiers())).
      params(params(ctor));
    if (ctor.isSynthetic()) member.implicit();
    annotate(ctor, member);
    return member.build();
  }

  private Symbol.Member method (Method method, Class<?> owner) {
    int mods = method.getModifiers();
    Symbol.MemberBuilder member = Symbol.method(method.getName(),
                                                ref(method.getGenericReturnType())).
      access(owner.isInterface() && !Modifier.isPrivate(mods) ? Accessibility.PUBLIC :
             access(mods)).
      typeParams(typeParams(method.getTypeParameters())).
      params(params(method));
    if (Modifier.isStatic(mods)) member.modifiers(apiview.model.Modifier.STATIC);
    if (owner.isInterface()) {
      if (method.isDefault()) member.modifiers(apiview.model.Modifier.VIRTUAL);
    } else {
      if (Modifier.isAbstract(mods)) member.modifiers(apiview.model.Modifier.ABSTRACT);
      if (Modifier.isFinal(mods)) member.modifiers(apiview.model.Modifier.SEALED);
    }
    if (method.isSynthetic() || method.isBridge() || isEnumSupport(method, owner)) {
      member.implicit();
    }
    annotate(method, member);
    return member.build();
  }

  private static boolean isEnumSupport (Method method, Class<?> owner) {
    if (!owner.isEnum() || !Modifier.isStatic(method.getModifiers())) return false;
    Class<?>[] ptypes = method.getParameterTypes();
    return (method.getName().equals("values") && ptypes.length == 0) ||
      (method.getName().equals("valueOf") && ptypes.length == 1 && ptypes[0] == String.class);
  }

  private static Parameter[] params (Executable exec) {
    List<Parameter> params = new ArrayList<>();
    java.lang.reflect.Parameter[] rparams = exec.getParameters();
    java.lang.reflect.Type[] gtypes = exec.getGenericParameterTypes();
    // generic parameter types omit synthetic and implicit parameters, raw parameters do not
    boolean useGeneric = gtypes.length == rparams.length;
    for (int ii = 0; ii < rparams.length; ii++) {
      java.lang.reflect.Parameter rparam = rparams[ii];
      if (rparam.isImplicit() || rparam.isSynthetic()) continue;
      TypeRef type = ref(useGeneric ? gtypes[ii] : rparam.getParameterizedType());
      Parameter param = Parameter.of(rparam.getName(), type);
      if (rparam.isVarArgs()) param = param.refKind(RefKind.PARAMS);
      params.add(param);
    }
    return params.toArray(new Parameter[params.size()]);
  }

  private static TypeParameter[] typeParams (TypeVariable<?>[] vars) {
    TypeParameter[] params = new TypeParameter[vars.length];
    for (int ii = 0; ii < vars.length; ii++) {
      List<TypeRef> bounds = new ArrayList<>();
      for (java.lang.reflect.Type bound : vars[ii].getBounds()) {
        if (bound != Object.class) bounds.add(ref(bound));
      }
      params[ii] = TypeParameter.of(vars[ii].getName()).constraints(
        bounds.toArray(new TypeRef[bounds.size()]));
    }
    return params;
  }

  private void annotate (AnnotatedElement elem, Symbol.Builder<?> symbol) {
    for (Annotation ann : elem.getDeclaredAnnotations()) {
      if (ann instanceof Deprecated) symbol.deprecated();
      symbol.attribute(attribute(ann));
    }
  }

  /** Converts {@code ann} to an attribute. A lone {@code value} element becomes a positional
    * argument, other elements become named arguments. Elements left at their default are
    * omitted. */
  protected Symbol.Attribute attribute (Annotation ann) {
    Class<? extends Annotation> atype = ann.annotationType();
    Symbol.AttributeBuilder attr = Symbol.attribute(ref(atype));
    if (!Modifier.isPublic(atype.getModifiers())) return attr.build();

    Method[] elems = atype.getDeclaredMethods();
    Arrays.sort(elems, Comparator.comparing(Method::getName));
    Map<String,TypedConstant> values = new TreeMap<>();
    for (Method elem : elems) {
      if (elem.getParameterCount() > 0 || Modifier.isStatic(elem.getModifiers())) continue;
      try {
        Object value = elem.invoke(ann);
        if (isDefault(elem.getDefaultValue(), value)) continue;
        TypedConstant constant = constant(value);
        if (constant != null) values.put(elem.getName(), constant);
      } catch (ReflectiveOperationException | RuntimeException e) {
        LOG.warn("Failed to read annotation element [annotation={}, element={}, error={}]",
                 atype.getName(), elem.getName(), e.toString());
      }
    }

    if (values.size() == 1 && values.containsKey("value")) attr.arg(values.get("value"));
    else for (Map.Entry<String,TypedConstant> entry : values.entrySet()) {
      attr.named(entry.getKey(), entry.getValue());
    }
    return attr.build();
  }

  /** Converts an annotation element value to a constant. Returns null for nested annotations,
    * which have no constant form. */
  protected static TypedConstant constant (Object value) {
    if (value == null) return TypedConstant.NULL;
    if (value instanceof Class<?>) return TypedConstant.type(ref((Class<?>)value));
    if (value instanceof Enum<?>) {
      Enum<?> evalue = (Enum<?>)value;
      Class<?> etype = evalue.getDeclaringClass();
      List<TypedConstant.EnumMember> members = new ArrayList<>();
      for (Object econst : etype.getEnumConstants()) {
        Enum<?> member = (Enum<?>)econst;
        members.add(new TypedConstant.EnumMember(member.name(), member.ordinal()));
      }
      return TypedConstant.enumValue(ref(etype), evalue.ordinal(), members);
    }
    if (value.getClass().isArray()) {
      List<TypedConstant> elems = new ArrayList<>();
      for (int ii = 0, ll = Array.getLength(value); ii < ll; ii++) {
        TypedConstant elem = constant(Array.get(value, ii));
        if (elem != null) elems.add(elem);
      }
      return TypedConstant.array(elems);
    }
    if (value instanceof Annotation) {
      LOG.warn("Nested annotations have no constant form, omitting [value={}]", value);
      return null;
    }
    return TypedConstant.of(value);
  }

  private static boolean isDefault (Object defval, Object value) {
    if (defval == null) return false;
    if (defval.getClass().isArray()) {
      return value.getClass().isArray() &&
        Arrays.deepEquals(new Object[] { defval }, new Object[] { value });
    }
    return defval.equals(value);
  }

  private static String displayName (Class<?> clazz) {
    Class<?> outer = clazz.getDeclaringClass();
    return (outer == null) ? clazz.getSimpleName() :
      displayName(outer) + "." + clazz.getSimpleName();
  }

  private static String version (JarFile jar) throws IOException {
    Manifest manifest = jar.getManifest();
    if (manifest == null) return "";
    return Strings.nullToEmpty(
      manifest.getMainAttributes().getValue(java.util.jar.Attributes.Name.IMPLEMENTATION_VERSION));
  }

  /** Accumulates the types of one package while a jar is read. */
  private static class PackageNode {
    public final String name;
    public final Map<String,PackageNode> children = new TreeMap<>();
    public final List<Symbol.Type> types = new ArrayList<>();

    public PackageNode (String name) {
      this.name = name;
    }

    /** Returns the descendant package with dotted name {@code path}, creating it if needed. */
    public PackageNode resolve (String path) {
      if (path.isEmpty()) return this;
      int didx = path.indexOf('.');
      String head = (didx == -1) ? path : path.substring(0, didx);
      PackageNode child = children.computeIfAbsent(head, PackageNode::new);
      return (didx == -1) ? child : child.resolve(path.substring(didx+1));
    }

    public Symbol.Namespace build () {
      Symbol.NamespaceBuilder ns = Symbol.namespace(name);
      for (PackageNode child : children.values()) ns.namespace(child.build());
      for (Symbol.Type type : types) ns.type(type);
      return ns.build();
    }
  }

  private final ClassLoader _parent;

  private static final Logger LOG = LoggerFactory.getLogger(ReflectionProvider.class);
}
