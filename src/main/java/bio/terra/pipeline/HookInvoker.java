package bio.terra.pipeline;

import bio.terra.pipeline.exception.HookTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Adapter between the runner and the two kinds of hook body. Whatever the kind, {@link #invoke}
 * returns only once the hook has finished, failed or timed out, so the runner can treat every hook
 * as a blocking call.
 *
 * <ul>
 *   <li>direct hook, no timeout: runs on the calling thread
 *   <li>direct hook with timeout: runs on the hook executor against a copy of the context; the
 *       copy's entries are taken over when the hook finishes, and dropped if it is interrupted on
 *       overrun
 *   <li>suspending hook: its completion stage is awaited; cancelled on overrun
 * </ul>
 */
class HookInvoker {
  private static final Logger logger = LoggerFactory.getLogger(HookInvoker.class);

  private final ExecutorService hookExecutor;

  HookInvoker(ExecutorService hookExecutor) {
    this.hookExecutor = hookExecutor;
  }

  /**
   * Run a hook body to completion.
   *
   * @param hook descriptor of the hook, for its id and timeout
   * @param body resolved body of the hook
   * @param context context of the run
   * @throws HookTimeoutException if the hook has a timeout and exceeds it
   * @throws InterruptedException if the calling thread is interrupted while waiting
   * @throws Exception whatever the hook body failed with, unwrapped
   */
  void invoke(HookDescriptor hook, HookBody body, PipelineContext context) throws Exception {
    Duration timeout = hook.getTimeout().orElse(null);
    if (body instanceof DirectHook) {
      DirectHook directHook = (DirectHook) body;
      if (timeout == null) {
        directHook.run(context);
        return;
      }
      PipelineContext hookContext = context.copy();
      Future<Void> future =
          hookExecutor.submit(
              PipelineMdc.wrapWithContext(
                  MDC.getCopyOfContextMap(),
                  () -> {
                    directHook.run(hookContext);
                    return null;
                  }));
      try {
        await(hook, future, timeout);
      } finally {
        // A cancelled hook may still be running; its copy stays detached from the run
        if (future.isDone() && !future.isCancelled()) {
          context.replaceWith(hookContext);
        }
      }
    } else if (body instanceof SuspendingHook) {
      CompletionStage<?> stage = ((SuspendingHook) body).run(context);
      if (stage == null) {
        throw new IllegalStateException(
            "Suspending hook '" + hook.getHookId() + "' returned no completion stage");
      }
      await(hook, stage.toCompletableFuture(), timeout);
    } else {
      throw new IllegalArgumentException(
          "Unsupported hook body type for hook '"
              + hook.getHookId()
              + "': "
              + body.getClass().getName());
    }
  }

  private void await(HookDescriptor hook, Future<?> future, @Nullable Duration timeout)
      throws Exception {
    try {
      if (timeout == null) {
        future.get();
      } else {
        future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      }
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.debug("Hook {} timed out after {}", hook.getHookId(), timeout);
      throw new HookTimeoutException(hook.getHookId(), timeout);
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      throw unwrap(ex.getCause());
    }
  }

  /**
   * Strip the wrappers added by futures and completion stages so the runner sees the hook's own
   * exception. Errors are rethrown directly.
   */
  static Exception unwrap(Throwable throwable) {
    Throwable cause = throwable;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    if (cause instanceof Exception) {
      return (Exception) cause;
    }
    return new ExecutionException(cause);
  }
}
