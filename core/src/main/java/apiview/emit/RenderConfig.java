//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Properties;
import java.util.Set;

/**
 * The configuration tables that steer emission: attribute name tables and placeholder body
 * text. Defaults are read from the {@code apiview/render.properties} classpath resource.
 */
public final class RenderConfig {

  /** The classpath location of the default configuration. */
  public static final String RESOURCE = "apiview/render.properties";

  /** Names of attribute types that are dropped from the output. */
  public final Set<String> skippedAttributes;

  /** Names of attribute types whose lines are bracketed by skip-diff markers. */
  public final Set<String> skipDiffAttributes;

  /** The statement placed in method, constructor and getter bodies. */
  public final String stubBody;

  /** The statement placed in setter bodies, usually empty. */
  public final String setterBody;

  /** The accessor list placed in non-abstract event bodies. */
  public final String eventBody;

  /** The whitespace emitted per nesting level. */
  public final String indentUnit;

  /** Whether classes and structs carry the partial marker. */
  public final boolean partialTypes;

  /** Returns the default configuration. */
  public static RenderConfig defaults () {
    return load(new Properties());
  }

  /** Returns the default configuration with {@code overrides} laid over it. */
  public static RenderConfig load (Properties overrides) {
    Properties props = new Properties();
    URL url = Resources.getResource(RESOURCE);
    try (InputStream in = Resources.asByteSource(url).openStream()) {
      props.load(in);
    } catch (IOException ioe) {
      throw new UncheckedIOException("Failed to read " + url, ioe);
    }
    props.putAll(overrides);
    return new RenderConfig(props);
  }

  /** Returns a copy of this config with the partial marker turned on or off. */
  public RenderConfig withPartialTypes (boolean partialTypes) {
    return new RenderConfig(skippedAttributes, skipDiffAttributes, stubBody, setterBody,
                            eventBody, indentUnit, partialTypes);
  }

  /** Returns a copy of this config with a different placeholder statement. */
  public RenderConfig withStubBody (String stubBody) {
    return new RenderConfig(skippedAttributes, skipDiffAttributes, stubBody, setterBody,
                            eventBody, indentUnit, partialTypes);
  }

  private RenderConfig (Properties props) {
    this(names(props.getProperty("skipped.attributes", "")),
         names(props.getProperty("skipdiff.attributes", "")),
         props.getProperty("body.stub", "throw null;").trim(),
         props.getProperty("body.setter", "").trim(),
         props.getProperty("body.event", "add { } remove { }").trim(),
         Strings.repeat(" ", Integer.parseInt(props.getProperty("indent", "4").trim())),
         Boolean.parseBoolean(props.getProperty("partial.types", "false").trim()));
  }

  private RenderConfig (Set<String> skippedAttributes, Set<String> skipDiffAttributes,
                        String stubBody, String setterBody, String eventBody, String indentUnit,
                        boolean partialTypes) {
    this.skippedAttributes = ImmutableSet.copyOf(skippedAttributes);
    this.skipDiffAttributes = ImmutableSet.copyOf(skipDiffAttributes);
    this.stubBody = stubBody;
    this.setterBody = setterBody;
    this.eventBody = eventBody;
    this.indentUnit = indentUnit;
    this.partialTypes = partialTypes;
  }

  private static Set<String> names (String list) {
    return ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(list));
  }
}
