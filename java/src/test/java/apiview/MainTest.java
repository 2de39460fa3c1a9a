//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview;

import apiview.extract.Fixtures;
import apiview.extract.ReflectionProvider;
import apiview.extract.SymbolProvider;
import apiview.model.Symbol;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import org.junit.*;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class MainTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  @Test public void testRender () throws IOException {
    String jar = Fixtures.jar(tmp.getRoot().toPath()).toString();
    assertEquals(0, run(jar));
    assertTrue(_out.toString().contains("namespace apiview.extract.fixture {\n"));
    assertEquals("", _err.toString());
  }

  @Test public void testMarkup () throws IOException {
    String jar = Fixtures.jar(tmp.getRoot().toPath()).toString();
    assertEquals(0, run(jar, "--markup"));
    assertTrue(_out.toString().contains("<a href=\"#apiview.extract.fixture.Shape\">"));
  }

  @Test public void testNav () throws IOException {
    String jar = Fixtures.jar(tmp.getRoot().toPath()).toString();
    assertEquals(0, run("--nav", jar));
    String out = _out.toString();
    assertTrue(out.startsWith("assembly fixtures\n"));
    assertTrue(out.contains("  namespace apiview.extract.fixture #apiview.extract.fixture\n"));
    assertTrue(out.contains("    interface Shape #apiview.extract.fixture.Shape\n"));
  }

  @Test public void testBadArguments () {
    assertEquals(1, run());
    assertTrue(_err.toString().contains(Main.USAGE));
    assertEquals(1, run("--bogus", "x.jar"));
    assertEquals(1, run(tmp.getRoot().toPath().resolve("missing.jar").toString()));
    assertEquals("", _out.toString());
  }

  @Test public void testProviderFailure () throws IOException {
    Path jar = Fixtures.jar(tmp.getRoot().toPath());
    SymbolProvider failing = new SymbolProvider() {
      @Override public Symbol.Assembly load (Path artifact) throws IOException {
        throw new IOException("corrupt");
      }
    };
    assertEquals(1, Main.run(new String[] { jar.toString() }, failing, out(), err()));
    assertTrue(_err.toString().contains("corrupt"));
  }

  private int run (String... args) {
    return Main.run(args, new ReflectionProvider(), out(), err());
  }

  private PrintStream out () { return new PrintStream(_out, true); }
  private PrintStream err () { return new PrintStream(_err, true); }

  private final ByteArrayOutputStream _out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream _err = new ByteArrayOutputStream();
}
