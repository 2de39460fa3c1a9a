//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import java.util.Properties;
import org.junit.*;
import static org.junit.Assert.*;

public class RenderConfigTest {

  @Test public void testDefaults () {
    RenderConfig config = RenderConfig.defaults();
    assertEquals("throw null;", config.stubBody);
    assertEquals("", config.setterBody);
    assertEquals("add { } remove { }", config.eventBody);
    assertEquals("    ", config.indentUnit);
    assertFalse(config.partialTypes);
    assertEquals(6, config.skippedAttributes.size());
    assertTrue(config.skippedAttributes.contains("AsyncStateMachineAttribute"));
    assertTrue(config.skippedAttributes.contains("TupleElementNamesAttribute"));
    assertTrue(config.skipDiffAttributes.contains("GeneratedCodeAttribute"));
    assertTrue(config.skipDiffAttributes.contains("Generated"));
  }

  @Test public void testOverrides () {
    Properties props = new Properties();
    props.setProperty("indent", "2");
    props.setProperty("skipped.attributes", " Foo ,Bar,, ");
    props.setProperty("partial.types", "true");
    RenderConfig config = RenderConfig.load(props);
    assertEquals("  ", config.indentUnit);
    assertEquals(2, config.skippedAttributes.size());
    assertTrue(config.skippedAttributes.contains("Foo"));
    assertTrue(config.skippedAttributes.contains("Bar"));
    assertTrue(config.partialTypes);
    // unset keys keep their defaults
    assertEquals("throw null;", config.stubBody);
  }

  @Test public void testWithers () {
    RenderConfig config = RenderConfig.defaults();
    RenderConfig stub = config.withStubBody("return;");
    assertEquals("return;", stub.stubBody);
    assertEquals("throw null;", config.stubBody);
    assertTrue(config.withPartialTypes(true).partialTypes);
    assertEquals(config.skippedAttributes, stub.skippedAttributes);
  }
}
