//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview;

import apiview.extract.ReflectionProvider;
import apiview.extract.SymbolProvider;
import apiview.model.CodeFile;
import apiview.model.DisplayLine;
import apiview.model.NavigationItem;
import apiview.render.MarkupStyle;
import apiview.render.RangeStyle;
import com.google.common.base.Strings;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prints the public API surface of a jar file.
 *
 * <pre>apiview &lt;jar&gt; [--markup] [--nav]</pre>
 */
public class Main {

  public static final String USAGE = "Usage: apiview <jar> [--markup] [--nav]";

  public static void main (String[] args) {
    System.exit(run(args, new ReflectionProvider(), System.out, System.err));
  }

  /** Renders the artifact named in {@code args}. Returns the process exit status: 0 on success,
    * 1 if the arguments are bad or the artifact cannot be rendered. */
  public static int run (String[] args, SymbolProvider provider, PrintStream out,
                         PrintStream err) {
    Path artifact = null;
    boolean markup = false, nav = false;
    for (String arg : args) {
      if (arg.equals("--markup")) markup = true;
      else if (arg.equals("--nav")) nav = true;
      else if (arg.startsWith("-") || artifact != null) {
        err.println("Unknown argument: " + arg);
        err.println(USAGE);
        return 1;
      }
      else artifact = Paths.get(arg);
    }
    if (artifact == null) {
      err.println(USAGE);
      return 1;
    }
    if (!Files.exists(artifact)) {
      err.println("No such file: " + artifact);
      return 1;
    }

    try {
      ApiView view = ApiView.builder().build();
      CodeFile file = view.build(provider.load(artifact));
      if (nav) {
        for (NavigationItem item : file.navigation) printNav(item, 0, out);
      } else {
        RangeStyle style = markup ? new MarkupStyle() : RangeStyle.PLAIN;
        for (DisplayLine line : view.render(file, style)) out.println(line.text);
      }
      out.flush();
      return 0;
    } catch (Exception e) {
      err.println("Failed to render " + artifact + ": " + e);
      e.printStackTrace(err);
      return 1;
    }
  }

  private static void printNav (NavigationItem item, int depth, PrintStream out) {
    out.println(Strings.repeat("  ", depth) + item);
    for (NavigationItem child : item.children) printNav(child, depth+1, out);
  }
}
