package bio.terra.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executor for direct hooks that have a timeout. Such a hook runs on a pool thread while the run's
 * thread waits for it, so that an overrun can be detected and the hook interrupted.
 *
 * <p>Threads are created on demand, never queued behind each other, and are daemons, so an
 * abandoned hook cannot keep the JVM alive.
 */
public class HookThreadPool extends ThreadPoolExecutor {
  private static final Logger logger = LoggerFactory.getLogger(HookThreadPool.class);
  private static final long KEEP_ALIVE_SECONDS = 60;

  private final AtomicInteger activeHooks;

  public HookThreadPool(String threadNamePrefix) {
    super(
        0,
        Integer.MAX_VALUE,
        KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        new ThreadFactoryBuilder().setDaemon(true).setNameFormat(threadNamePrefix + "-%d").build());
    activeHooks = new AtomicInteger();
  }

  private static class DefaultHolder {
    private static final HookThreadPool DEFAULT = new HookThreadPool("pipeline-hook");
  }

  /** @return the pool shared by runners that are not given an executor of their own */
  public static HookThreadPool getDefault() {
    return DefaultHolder.DEFAULT;
  }

  public int getActiveHooks() {
    return activeHooks.get();
  }

  @Override
  protected void beforeExecute(Thread t, Runnable r) {
    super.beforeExecute(t, r);
    int active = activeHooks.incrementAndGet();
    logger.trace("Hook thread started: {} active", active);
  }

  @Override
  protected void afterExecute(Runnable r, Throwable t) {
    super.afterExecute(r, t);
    int active = activeHooks.decrementAndGet();
    logger.trace("Hook thread finished: {} active", active);
  }
}
