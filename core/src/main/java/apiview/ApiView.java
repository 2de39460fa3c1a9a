//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview;

import apiview.emit.*;
import apiview.model.CodeFile;
import apiview.model.DisplayLine;
import apiview.model.Symbol;
import apiview.render.LineRenderer;
import apiview.render.RangeStyle;
import com.google.common.base.Preconditions;
import java.util.List;

/**
 * Wires together the rendering pipeline: ordering, visibility filtering, token emission and line
 * rendering. An {@code ApiView} holds no per-build state and may be shared.
 *
 * <pre>{@code
 * ApiView view = ApiView.builder().build();
 * CodeFile file = view.build(assembly);
 * for (DisplayLine line : view.render(file)) System.out.println(line.text);
 * }</pre>
 */
public class ApiView {

  /** Configures and creates an {@link ApiView}. */
  public static class Builder {

    public Builder config (RenderConfig config) {
      _config = Preconditions.checkNotNull(config);
      return this;
    }

    public Builder orderPolicy (OrderPolicy order) {
      _order = Preconditions.checkNotNull(order);
      return this;
    }

    /** Replaces the visibility filter. By default a {@link PublicSurfaceFilter} that skips the
      * configured attribute names is used. */
    public Builder filter (VisibilityFilter filter) {
      _filter = Preconditions.checkNotNull(filter);
      return this;
    }

    public ApiView build () {
      RenderConfig config = (_config == null) ? RenderConfig.defaults() : _config;
      VisibilityFilter filter = (_filter == null) ?
        new PublicSurfaceFilter(config.skippedAttributes) : _filter;
      return new ApiView(new TokenEmitter(config, _order, filter));
    }

    private RenderConfig _config;
    private OrderPolicy _order = new DefaultOrderPolicy();
    private VisibilityFilter _filter;
  }

  public static Builder builder () {
    return new Builder();
  }

  /** Emits the public surface of {@code assembly}.
    * @throws InvalidSymbolTreeException if the tree is not well formed. */
  public CodeFile build (Symbol.Assembly assembly) {
    return _emitter.emit(assembly);
  }

  /** Renders {@code file} as plain text lines. */
  public List<DisplayLine> render (CodeFile file) {
    return render(file, RangeStyle.PLAIN);
  }

  /** Renders {@code file} as lines, spelled in {@code style}. */
  public List<DisplayLine> render (CodeFile file, RangeStyle style) {
    return new LineRenderer(style).render(file.tokens);
  }

  protected ApiView (TokenEmitter emitter) {
    _emitter = emitter;
  }

  private final TokenEmitter _emitter;
}
