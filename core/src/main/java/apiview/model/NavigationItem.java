//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A node in the outline tree that mirrors the namespace and type nesting of a rendered document.
 */
public final class NavigationItem {

  /** The definition id this item navigates to, or null for the assembly root. */
  public final String id;

  /** The text displayed for this item. */
  public final String text;

  /** The kind tag: assembly, namespace, or a {@link TypeKind#keyword}. */
  public final String kind;

  public final List<NavigationItem> children;

  public NavigationItem (String id, String text, String kind, List<NavigationItem> children) {
    this.id = id;
    this.text = text;
    this.kind = kind;
    this.children = ImmutableList.copyOf(children);
  }

  @Override public String toString () {
    return kind + " " + text + (id == null ? "" : " #" + id);
  }
}
