package bio.terra.pipeline.middleware;

import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Translates exceptions raised below it into the exception type the embedding system expects. An
 * {@link InterruptedException} is passed through untouched.
 */
public class ErrorTranslationMiddleware<T> implements Middleware<T> {
  private final Function<Exception, ? extends Exception> translator;

  public ErrorTranslationMiddleware(Function<Exception, ? extends Exception> translator) {
    this.translator = translator;
  }

  @Override
  public T apply(Callable<T> next) throws Exception {
    try {
      return next.call();
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      Exception translated = translator.apply(ex);
      throw (translated == null) ? ex : translated;
    }
  }
}
