package bio.terra.pipeline.middleware;

import java.util.concurrent.Callable;
import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs how long the layers below it took, whether they completed or failed. */
public class StopWatchMiddleware<T> implements Middleware<T> {
  private static final Logger logger = LoggerFactory.getLogger(StopWatchMiddleware.class);

  private final String name;

  public StopWatchMiddleware(String name) {
    this.name = name;
  }

  @Override
  public T apply(Callable<T> next) throws Exception {
    StopWatch stopWatch = StopWatch.createStarted();
    boolean completed = false;
    try {
      T result = next.call();
      completed = true;
      return result;
    } finally {
      stopWatch.stop();
      logger.info(
          "{} {} in {} ms", name, completed ? "completed" : "failed", stopWatch.getTime());
    }
  }
}
