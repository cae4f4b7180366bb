package bio.terra.pipeline;

import java.util.Map;
import java.util.concurrent.Callable;
import javax.annotation.Nullable;
import org.slf4j.MDC;

/**
 * Utility methods to make pipeline runs context-aware, using mapped diagnostic context (MDC). Log
 * lines written by the engine or by hook bodies during a run carry the run id, and during a hook
 * also the phase and hook id.
 */
public class PipelineMdc {
  /** ID of the run */
  public static final String RUN_ID_KEY = "pipelineRunId";

  /** Phase currently running */
  public static final String PHASE_KEY = "pipelinePhase";

  /** ID of the hook currently running */
  public static final String HOOK_ID_KEY = "pipelineHookId";

  private PipelineMdc() {}

  /**
   * Wrap a callable so that it runs with the given MDC context map, restoring the thread's own
   * context map afterwards. Used to carry the run's context onto hook executor threads.
   *
   * @param context to override MDC's context map; if null, the MDC is cleared during the call
   * @param callable to wrap
   * @return wrapped callable
   */
  static <T> Callable<T> wrapWithContext(
      @Nullable Map<String, String> context, Callable<T> callable) {
    return () -> {
      Map<String, String> initialContext = MDC.getCopyOfContextMap();
      try {
        overwriteContext(context);
        return callable.call();
      } finally {
        overwriteContext(initialContext);
      }
    };
  }

  /**
   * Null-safe utility method for overwriting the current thread's MDC.
   *
   * @param context to set as MDC, if null then MDC will be cleared.
   */
  static void overwriteContext(@Nullable Map<String, String> context) {
    MDC.clear();
    if (context != null) {
      MDC.setContextMap(context);
    }
  }

  static void addRunContextToMdc(String runId) {
    MDC.put(RUN_ID_KEY, runId);
  }

  static void removeRunContextFromMdc() {
    MDC.remove(RUN_ID_KEY);
  }

  static void addPhaseContextToMdc(HookPhase phase) {
    MDC.put(PHASE_KEY, phase.name());
  }

  static void removePhaseContextFromMdc() {
    MDC.remove(PHASE_KEY);
  }

  static void addHookContextToMdc(HookDescriptor hook) {
    MDC.put(HOOK_ID_KEY, hook.getHookId());
  }

  static void removeHookContextFromMdc() {
    MDC.remove(HOOK_ID_KEY);
  }
}
