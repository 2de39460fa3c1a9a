//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.emit;

import apiview.model.*;
import java.util.Set;

/**
 * The default visibility filter. A symbol is visible if its declared access level is reachable
 * from outside its assembly, or if it explicitly implements a member of a visible contract.
 * Accessors and implicitly declared members are never visible; their property, event or
 * declaring type stands for them. A namespace is visible when it directly contains a visible type.
 */
public class PublicSurfaceFilter implements VisibilityFilter {

  public PublicSurfaceFilter (Set<String> skippedAttributes) {
    _skippedAttributes = skippedAttributes;
  }

  @Override public boolean isVisible (Symbol symbol) {
    if (symbol instanceof Symbol.Attribute) return isVisible((Symbol.Attribute)symbol);
    if (symbol instanceof Symbol.Namespace) {
      for (Symbol.Type type : ((Symbol.Namespace)symbol).types) if (isVisible(type)) return true;
      return false;
    }
    if (symbol.implicit) return false;
    if (symbol instanceof Symbol.Member) {
      Symbol.Member member = (Symbol.Member)symbol;
      if (member.kind == MemberKind.ACCESSOR) return false;
      if (member.access.isExternallyVisible()) return true;
      return (member.explicitInterface != null &&
              member.explicitInterface.access.isExternallyVisible());
    }
    return symbol.access.isExternallyVisible() || symbol.access == Accessibility.NOT_APPLICABLE;
  }

  @Override public boolean isVisible (Symbol.Attribute attribute) {
    return attribute.type.access.isExternallyVisible() &&
      !_skippedAttributes.contains(attribute.type.simpleName());
  }

  private final Set<String> _skippedAttributes;
}
