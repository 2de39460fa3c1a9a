//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.List;
import org.junit.*;
import static org.junit.Assert.*;

public class ConstantFormatterTest {

  static final TypeRef COLOR = TypeRef.named("Color", "N.Color");
  static final List<TypedConstant.EnumMember> COLORS = ImmutableList.of(
    new TypedConstant.EnumMember("None", 0),
    new TypedConstant.EnumMember("Red", 1),
    new TypedConstant.EnumMember("Green", 2),
    new TypedConstant.EnumMember("Blue", 4),
    new TypedConstant.EnumMember("Yellow", 3));

  @Test public void testFlags () {
    assertEquals("Color.Red | Color.Blue", format(TypedConstant.enumValue(COLOR, 5, COLORS)));
    // an exact match beats a decomposition
    assertEquals("Color.Yellow", format(TypedConstant.enumValue(COLOR, 3, COLORS)));
    assertEquals("Color.None", format(TypedConstant.enumValue(COLOR, 0, COLORS)));
    // the larger member is taken first, but members are listed in declaration order
    assertEquals("Color.Blue | Color.Yellow", format(TypedConstant.enumValue(COLOR, 7, COLORS)));
  }

  @Test public void testOverlappingFlags () {
    TypeRef mode = TypeRef.named("Mode", "N.Mode");
    List<TypedConstant.EnumMember> modes = ImmutableList.of(
      new TypedConstant.EnumMember("A", 3),
      new TypedConstant.EnumMember("B", 5),
      new TypedConstant.EnumMember("C", 6));
    // taking C first leaves a bit no unused member can supply alone
    assertEquals("Mode.A | Mode.B | Mode.C", format(TypedConstant.enumValue(mode, 7, modes)));
    assertEquals("Mode.B", format(TypedConstant.enumValue(mode, 5, modes)));
    assertEquals("15", format(TypedConstant.enumValue(mode, 15, modes)));
  }

  @Test public void testFlagsFallBackToNumber () {
    assertEquals("8", format(TypedConstant.enumValue(COLOR, 8, COLORS)));
    assertEquals("9", format(TypedConstant.enumValue(COLOR, 9, COLORS)));
    assertEquals("0", format(TypedConstant.enumValue(COLOR, 0, ImmutableList.of())));
  }

  @Test public void testPrimitives () {
    assertEquals("null", format(TypedConstant.NULL));
    assertEquals("true", format(TypedConstant.of(true)));
    assertEquals("42", format(TypedConstant.of(42)));
    assertEquals("-7", format(TypedConstant.of(-7L)));
    assertEquals("2.5", format(TypedConstant.of(2.5)));
    assertEquals("0.0000001", format(TypedConstant.of(new BigDecimal("1E-7"))));
    assertEquals("'x'", format(TypedConstant.of('x')));
    assertEquals("'\\''", format(TypedConstant.of('\'')));
  }

  @Test public void testStrings () {
    assertEquals("\"hello\"", format(TypedConstant.of("hello")));
    assertEquals("\"a\\\"b\\n\\tc\\\\\"", format(TypedConstant.of("a\"b\n\tc\\")));
    assertEquals("\"\\u0001\"", format(TypedConstant.of("\u0001")));
  }

  @Test public void testTypeAndArray () {
    assertEquals("typeof(List<int>)", format(TypedConstant.type(
      TypeRef.external("List").withArgs(TypeRef.keyword("int")))));
    assertEquals("new[] {1, \"two\", null}", format(TypedConstant.array(
      TypedConstant.of(1), TypedConstant.of("two"), TypedConstant.NULL)));
    assertEquals("new[] {}", format(TypedConstant.array()));
  }

  @Test public void testTokenKinds () {
    List<Token> tokens = tokens(TypedConstant.array(TypedConstant.of("s"), TypedConstant.of(1)));
    assertEquals(TokenKind.KEYWORD, tokens.get(0).kind);
    assertEquals(TokenKind.STRING_LITERAL, tokens.get(2).kind);
    assertEquals(TokenKind.LITERAL, tokens.get(5).kind);
  }

  static List<Token> tokens (TypedConstant value) {
    TokenSink out = new TokenSink("    ");
    DefinitionIndex index = DefinitionIndex.build(
      ImmutableList.of(), new DefaultOrderPolicy(), new PublicSurfaceFilter(ImmutableSet.of()));
    ConstantFormatter.format(value, Context.root(out, index));
    return out.finish();
  }

  static String format (TypedConstant value) {
    StringBuilder sb = new StringBuilder();
    for (Token token : tokens(value)) if (token.value != null) sb.append(token.value);
    return sb.toString();
  }
}
