//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import com.google.common.collect.ImmutableSet;
import org.junit.*;
import static org.junit.Assert.*;

public class PublicSurfaceFilterTest {

  final VisibilityFilter filter = new PublicSurfaceFilter(ImmutableSet.of("HiddenAttribute"));

  @Test public void testAccessLevels () {
    for (Accessibility access : Accessibility.values()) {
      Symbol.Member member = Symbol.method("M", null).access(access).build();
      boolean visible = (access == Accessibility.PUBLIC || access == Accessibility.PROTECTED ||
                         access == Accessibility.PROTECTED_OR_INTERNAL);
      assertEquals(access.toString(), visible, filter.isVisible(member));
    }
    assertFalse(filter.isVisible(Symbol.type(TypeKind.CLASS, "T").
                                 access(Accessibility.PROTECTED_AND_INTERNAL).build()));
    assertTrue(filter.isVisible(Symbol.type(TypeKind.CLASS, "T").
                                access(Accessibility.PROTECTED).build()));
  }

  @Test public void testExplicitImplementations () {
    TypeRef visible = TypeRef.external("IVisible");
    TypeRef hidden = TypeRef.external("IHidden").withAccess(Accessibility.INTERNAL);
    assertTrue(filter.isVisible(Symbol.method("M", null).access(Accessibility.PRIVATE).
                                explicitImpl(visible).build()));
    assertFalse(filter.isVisible(Symbol.method("M", null).access(Accessibility.PRIVATE).
                                 explicitImpl(hidden).build()));
  }

  @Test public void testImplicitAndAccessors () {
    assertFalse(filter.isVisible(Symbol.method("get_X", null).implicit().build()));
    assertFalse(filter.isVisible(Symbol.member(MemberKind.ACCESSOR, "get_X").build()));
    assertFalse(filter.isVisible(Symbol.type(TypeKind.CLASS, "<>c").implicit().build()));
  }

  @Test public void testNamespaces () {
    Symbol.Type pub = Symbol.type(TypeKind.CLASS, "A").build();
    Symbol.Type internal = Symbol.type(TypeKind.CLASS, "B").access(Accessibility.INTERNAL).build();
    assertTrue(filter.isVisible(Symbol.namespace("N").type(internal).type(pub).build()));
    assertFalse(filter.isVisible(Symbol.namespace("N").type(internal).build()));
    // a namespace that only holds other namespaces has nothing of its own to show
    assertFalse(filter.isVisible(Symbol.namespace("N").namespace(
                                   Symbol.namespace("M").type(pub).build()).build()));
  }

  @Test public void testAttributes () {
    assertTrue(filter.isVisible(Symbol.attribute(TypeRef.external("ShownAttribute")).build()));
    assertFalse(filter.isVisible(Symbol.attribute(TypeRef.external("HiddenAttribute")).build()));
    assertFalse(filter.isVisible(Symbol.attribute(
      TypeRef.named("HiddenAttribute", "a.b.HiddenAttribute")).build()));
    assertFalse(filter.isVisible(Symbol.attribute(
      TypeRef.external("InternalAttribute").withAccess(Accessibility.INTERNAL)).build()));
  }
}
