package bio.terra.pipeline;

import javax.annotation.Nullable;

/**
 * When a {@link PipelineRunner} is built, you can specify one or more objects that implement this
 * PipelineListener interface to observe the run: logging, metrics, tracing and the like.
 *
 * <p><b>Caution</b>
 *
 * <p>Listeners are called on the run's thread with the live context. They must not modify the
 * context. An exception thrown by a listener is logged and otherwise ignored; it never changes the
 * outcome of the run.
 */
public interface PipelineListener {
  /**
   * Called once, before the first phase runs.
   *
   * @param runId id of the run
   * @param context the context of the run
   */
  default void startRun(String runId, PipelineContext context) {}

  /**
   * Called before the hooks of a phase run. Phases without hooks are reported too.
   *
   * @param phase the phase about to run
   * @param context the context of the run
   */
  default void startPhase(HookPhase phase, PipelineContext context) {}

  default void startHook(HookDescriptor hook, PipelineContext context) {}

  /**
   * Called after every hook invocation, whether it succeeded or failed.
   *
   * @param hook the hook that ran
   * @param context the context of the run
   */
  default void endHook(HookDescriptor hook, PipelineContext context) {}

  /**
   * Called when a hook fails. Captured failures in continue-on-error phases, including every
   * {@link HookPhase#FINALIZE} failure, arrive here as well as in the result's error list.
   *
   * @param error the failure
   * @param captured true if the run continues; false if this failure aborts the run
   */
  default void hookFailed(HookError error, boolean captured) {}

  default void endPhase(HookPhase phase, PipelineContext context) {}

  /**
   * Called once, after the finalize phase.
   *
   * @param runId id of the run
   * @param context the final context of the run
   * @param abortCause the fail-fast error about to be raised from {@code run()}; null if the run
   *     was not aborted
   */
  default void endRun(String runId, PipelineContext context, @Nullable Throwable abortCause) {}
}
