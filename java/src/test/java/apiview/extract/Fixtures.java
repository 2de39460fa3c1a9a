//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.extract;

import apiview.extract.fixture.*;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

/** Packages the compiled fixture classes into a jar for the provider to read. */
public class Fixtures {

  public static final String VERSION = "3.1";

  public static Path jar (Path dir) throws IOException {
    Manifest manifest = new Manifest();
    manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
    manifest.getMainAttributes().put(Attributes.Name.IMPLEMENTATION_VERSION, VERSION);

    Path jar = dir.resolve("fixtures.jar");
    try (OutputStream out = Files.newOutputStream(jar);
         JarOutputStream jout = new JarOutputStream(out, manifest)) {
      Class<?>[] classes = { Widget.class, Widget.Mode.class, Widget.Part.class, Shape.class,
                             Tag.class, Class.forName("apiview.extract.fixture.Hidden") };
      for (Class<?> clazz : classes) {
        String path = clazz.getName().replace('.', '/') + ".class";
        jout.putNextEntry(new JarEntry(path));
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(path)) {
          ByteStreams.copy(in, jout);
        }
        jout.closeEntry();
      }
    } catch (ClassNotFoundException cnfe) {
      throw new IOException(cnfe);
    }
    return jar;
  }
}
