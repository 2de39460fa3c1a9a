//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.extract;

import apiview.ApiView;
import apiview.model.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.*;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class ReflectionProviderTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  @Test public void testAssembly () throws IOException {
    Symbol.Assembly asm = load();
    assertEquals("fixtures", asm.name);
    assertEquals(Fixtures.VERSION, asm.version);
    assertEquals("apiview", asm.global.namespaces.get(0).name);
    assertTrue(asm.global.types.isEmpty());

    List<String> names = new ArrayList<>();
    for (Symbol.Type type : fixtures(asm).types) names.add(type.name);
    assertEquals(4, names.size());
    assertTrue(names.contains("Hidden"));
    assertTrue(names.contains("Widget"));
  }

  @Test public void testTypes () throws IOException {
    Symbol.Namespace ns = fixtures(load());
    Symbol.Type widget = type(ns, "Widget");
    assertEquals(TypeKind.CLASS, widget.kind);
    assertEquals(Accessibility.PUBLIC, widget.access);
    assertNull(widget.baseType);
    assertEquals("Runnable", widget.interfaces.get(0).name);
    assertEquals("java.lang.Runnable", widget.interfaces.get(0).key);
    assertEquals(1, widget.typeParams.size());
    assertEquals("Comparable<T>", widget.typeParams.get(0).constraints.get(0).toString());

    Symbol.Type mode = nested(widget, "Mode");
    assertEquals(TypeKind.ENUM, mode.kind);
    Symbol.Type part = nested(widget, "Part");
    assertTrue(part.is(apiview.model.Modifier.SEALED));

    assertEquals(TypeKind.INTERFACE, type(ns, "Shape").kind);
    assertEquals(TypeKind.INTERFACE, type(ns, "Tag").kind);
    assertEquals(Accessibility.INTERNAL, type(ns, "Hidden").access);
    assertTrue(type(ns, "Hidden").is(apiview.model.Modifier.ABSTRACT));
  }

  @Test public void testMembers () throws IOException {
    Symbol.Type widget = type(fixtures(load()), "Widget");

    Symbol.Member max = member(widget, "MAX");
    assertTrue(max.is(apiview.model.Modifier.STATIC));
    assertTrue(max.is(apiview.model.Modifier.READONLY));
    assertEquals(Accessibility.PROTECTED, member(widget, "name").access);
    assertEquals(Accessibility.INTERNAL, member(widget, "hidden").access);
    assertEquals(Accessibility.INTERNAL, member(widget, "internalOnly").access);

    Symbol.Member pick = member(widget, "pick");
    assertEquals(TypeRef.param("T"), pick.type);
    assertEquals("List<T>", pick.parameters.get(0).type.toString());

    Symbol.Member varargs = null;
    for (Symbol.Member member : widget.members) {
      if (member.kind == MemberKind.CONSTRUCTOR && member.parameters.size() == 2) varargs = member;
    }
    assertNotNull(varargs);
    Parameter sizes = varargs.parameters.get(1);
    assertEquals(RefKind.PARAMS, sizes.refKind);
    assertEquals("int[]", sizes.type.toString());

    Symbol.Member old = member(widget, "old");
    assertTrue(old.deprecated);
    assertEquals("Deprecated", old.attributes.get(0).type.name);
    assertTrue(old.attributes.get(0).namedArgs.isEmpty());
  }

  @Test public void testEnums () throws IOException {
    Symbol.Type mode = nested(type(fixtures(load()), "Widget"), "Mode");
    assertEquals(TypedConstant.of(0), member(mode, "FAST").constant);
    assertEquals(TypedConstant.of(1), member(mode, "SAFE").constant);
    assertTrue(member(mode, "values").implicit);
    assertTrue(member(mode, "valueOf").implicit);
    for (Symbol.Member member : mode.members) {
      assertNotEquals(MemberKind.CONSTRUCTOR, member.kind);
    }
  }

  @Test public void testInterfaceMembers () throws IOException {
    Symbol.Type shape = type(fixtures(load()), "Shape");
    assertTrue(member(shape, "area").modifiers.isEmpty());
    assertTrue(member(shape, "label").is(apiview.model.Modifier.VIRTUAL));
    assertTrue(member(shape, "unit").is(apiview.model.Modifier.STATIC));
    for (Symbol.Member member : shape.members) {
      if (member.name.startsWith("lambda$")) assertTrue(member.implicit);
    }
  }

  @Test public void testAnnotations () throws IOException {
    Symbol.Type widget = type(fixtures(load()), "Widget");
    Symbol.Attribute tag = widget.attributes.get(0);
    assertEquals("Tag", tag.type.name);
    assertTrue(tag.args.isEmpty());
    assertEquals(TypedConstant.of("w"), tag.namedArgs.get("value"));
    TypedConstant.EnumValue mode = (TypedConstant.EnumValue)tag.namedArgs.get("mode");
    assertEquals(1, mode.value);
    assertEquals(2, mode.members.size());
    // elements left at their default are omitted
    assertFalse(tag.namedArgs.containsKey("type"));

    Symbol.Type tagType = type(fixtures(load()), "Tag");
    for (Symbol.Attribute attr : tagType.attributes) {
      if (attr.type.name.equals("Target")) {
        TypedConstant.ArrayValue targets = (TypedConstant.ArrayValue)attr.args.get(0);
        assertEquals(2, targets.elements.size());
      }
    }
  }

  @Test public void testRendering () throws IOException {
    ApiView view = ApiView.builder().build();
    List<String> lines = new ArrayList<>();
    for (DisplayLine line : view.render(view.build(load()))) lines.add(line.text);

    assertTrue(lines.contains("namespace apiview.extract.fixture {"));
    assertTrue(lines.contains("    public interface Shape {"));
    assertTrue(lines.contains("        double area();"));
    assertTrue(lines.contains("        String label() { throw null; }"));
    assertTrue(lines.contains("        static Shape unit() { throw null; }"));
    assertTrue(lines.contains("    [Tag(mode = Mode.SAFE, value = \"w\")]"));
    assertTrue(lines.contains("        public enum Mode {"));
    assertTrue(lines.contains("            FAST = 0,"));
    assertTrue(lines.contains("        public void run() { throw null; }"));
    assertTrue(lines.contains("        [Deprecated]"));
    for (String line : lines) {
      assertFalse(line, line.contains("Hidden"));
      assertFalse(line, line.contains("internalOnly"));
      assertFalse(line, line.contains("valueOf"));
      assertFalse(line, line.contains("lambda$"));
    }
  }

  @Test(expected=IOException.class) public void testNotAJar () throws IOException {
    Path bogus = tmp.getRoot().toPath().resolve("bogus.jar");
    Files.write(bogus, "not a jar".getBytes("UTF-8"));
    new ReflectionProvider().load(bogus);
  }

  protected Symbol.Assembly load () throws IOException {
    return new ReflectionProvider().load(Fixtures.jar(tmp.getRoot().toPath()));
  }

  protected static Symbol.Namespace fixtures (Symbol.Assembly asm) {
    Symbol.Namespace ns = asm.global;
    for (String name : new String[] { "apiview", "extract", "fixture" }) {
      Symbol.Namespace next = null;
      for (Symbol.Namespace child : ns.namespaces) if (child.name.equals(name)) next = child;
      assertNotNull("Missing namespace " + name, next);
      ns = next;
    }
    return ns;
  }

  protected static Symbol.Type type (Symbol.Namespace ns, String name) {
    for (Symbol.Type type : ns.types) if (type.name.equals(name)) return type;
    throw new AssertionError("Missing type " + name);
  }

  protected static Symbol.Type nested (Symbol.Type owner, String name) {
    for (Symbol.Type type : owner.nestedTypes) if (type.name.equals(name)) return type;
    throw new AssertionError("Missing nested type " + name);
  }

  protected static Symbol.Member member (Symbol.Type owner, String name) {
    for (Symbol.Member member : owner.members) if (member.name.equals(name)) return member;
    throw new AssertionError("Missing member " + name);
  }
}
