package bio.terra.pipeline.middleware;

import java.util.concurrent.Callable;

/**
 * One layer of cross-cutting behavior around a unit of work. A middleware receives the next layer
 * as a callable and decides what to do before, after, or instead of calling it.
 *
 * @param <T> result type of the wrapped unit of work
 */
@FunctionalInterface
public interface Middleware<T> {
  /**
   * @param next the next layer; the core unit of work for the innermost middleware
   * @return result to hand to the enclosing layer
   * @throws Exception failure of this layer or of a layer below it
   */
  T apply(Callable<T> next) throws Exception;
}
