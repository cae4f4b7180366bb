package bio.terra.pipeline.middleware;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Wraps a unit of work in a chain of {@link Middleware}, independent of the hook phases. The first
 * middleware added is the outermost layer: a call enters layer 1, then layer 2 and so on down to
 * the core, and the results unwind back out in reverse order.
 *
 * <pre>
 *   Callable&lt;PipelineResult&gt; wrapped = new MiddlewareComposer&lt;PipelineResult&gt;()
 *     .use(new StopWatchMiddleware&lt;&gt;("pipeline"))
 *     .use(new ErrorTranslationMiddleware&lt;&gt;(ex -&gt; new ServiceException(ex)))
 *     .compose(runner::run);
 * </pre>
 *
 * @param <T> result type of the unit of work
 */
public class MiddlewareComposer<T> {
  private final List<Middleware<T>> middlewares = new ArrayList<>();

  public MiddlewareComposer<T> use(Middleware<T> middleware) {
    middlewares.add(middleware);
    return this;
  }

  public int size() {
    return middlewares.size();
  }

  /**
   * Build the layered callable. The composer's current middleware list is captured; middleware
   * added afterwards does not affect the returned callable.
   *
   * @param core the unit of work
   * @return callable running the core inside every middleware layer
   */
  public Callable<T> compose(Callable<T> core) {
    Callable<T> chain = core;
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      Middleware<T> middleware = middlewares.get(i);
      Callable<T> next = chain;
      chain = () -> middleware.apply(next);
    }
    return chain;
  }
}
