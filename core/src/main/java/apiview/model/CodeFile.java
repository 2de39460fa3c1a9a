//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The result of one build pass over an assembly: the token sequence and the navigation tree.
 * Both are immutable, so any number of renderers may consume one code file.
 */
public final class CodeFile {

  /** The version of the token format produced by this code. Changes whenever the emitted text for
    * an unchanged symbol tree changes. */
  public static final String FORMAT_VERSION = "1";

  /** The display name of the code file, {@code <assembly> (<version>)}. */
  public final String name;

  /** The name of the assembly this code file renders. */
  public final String packageName;

  /** The language tag of the rendered text. */
  public final String language;

  public final String formatVersion;

  public final List<Token> tokens;

  /** The navigation roots. This always contains exactly one item: the assembly. */
  public final List<NavigationItem> navigation;

  public CodeFile (String name, String packageName, String language, List<Token> tokens,
                   List<NavigationItem> navigation) {
    this.name = name;
    this.packageName = packageName;
    this.language = language;
    this.formatVersion = FORMAT_VERSION;
    this.tokens = ImmutableList.copyOf(tokens);
    this.navigation = ImmutableList.copyOf(navigation);
  }

  @Override public String toString () {
    return "CodeFile(" + name + ", " + tokens.size() + " tokens)";
  }
}
