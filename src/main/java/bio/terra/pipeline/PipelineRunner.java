package bio.terra.pipeline;

import bio.terra.pipeline.exception.CallableNotFoundException;
import bio.terra.pipeline.exception.HookExecutionException;
import bio.terra.pipeline.exception.RunnerAlreadyUsedException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PipelineRunner executes one run of an {@link ExecutionPlan}. It walks the phases in canonical
 * order and the hooks of each phase in plan order, strictly one hook at a time, against a single
 * {@link PipelineContext}.
 *
 * <p>Error policy:
 *
 * <ul>
 *   <li>In a fail-fast phase the first hook error aborts the run. The finalize phase still runs,
 *       then the original error is raised from {@link #run()}. Unchecked exceptions are raised as
 *       they are; checked exceptions arrive wrapped in a {@link HookExecutionException}.
 *   <li>In a continue-on-error phase every hook error is captured into the result and the phase
 *       goes on with its next hook.
 *   <li>The finalize phase runs exactly once per run. Its errors are always captured, so a cleanup
 *       failure never hides the error that aborted the run.
 * </ul>
 *
 * An interrupt of the running thread, or a {@link VirtualMachineError} from a hook, aborts the run
 * from any phase other than finalize. Any other {@link Error}, such as an {@link AssertionError}
 * from a hook's own checks, follows the phase policy like an exception.
 *
 * <p>A runner is single use and is not thread safe. Build a new one, from the same shared plan, for
 * every run.
 */
public class PipelineRunner {
  private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

  private final ExecutionPlan plan;
  private final CallableResolver resolver;
  private final HookInvoker hookInvoker;
  private final ListenerWrapper listenerWrapper;
  private final String runId;
  private final AtomicBoolean used = new AtomicBoolean();

  // Set when the finalize phase captured an interrupt; restored once finalize is done
  private boolean interruptCaptured;

  PipelineRunner(PipelineRunnerBuilder builder) {
    this.plan = builder.getPlan();
    this.resolver = builder.getResolver();
    this.hookInvoker = new HookInvoker(builder.getHookExecutor());
    this.listenerWrapper = new ListenerWrapper(builder.getListeners());
    this.runId = builder.getRunId();
  }

  public String getRunId() {
    return runId;
  }

  /**
   * Run the plan against a fresh, empty context.
   *
   * @return the result of the run
   * @throws InterruptedException if the thread is interrupted outside the finalize phase
   * @throws RunnerAlreadyUsedException if this runner has already run
   */
  public PipelineResult run() throws InterruptedException {
    return run(new PipelineContext());
  }

  /**
   * Run the plan against a context seeded by the caller. The context must be new to this run and
   * must not be shared with any other run.
   *
   * @param context initial context of the run
   * @return the result of the run
   * @throws InterruptedException if the thread is interrupted outside the finalize phase
   * @throws RunnerAlreadyUsedException if this runner has already run
   */
  public PipelineResult run(PipelineContext context) throws InterruptedException {
    if (!used.compareAndSet(false, true)) {
      throw new RunnerAlreadyUsedException("Pipeline runner " + runId + " has already been run");
    }

    PipelineMdc.addRunContextToMdc(runId);
    try {
      logger.info("Starting pipeline run {} with {} hooks", runId, plan.getTotalHooks());
      listenerWrapper.startRun(runId, context);
      List<HookError> errors = new ArrayList<>();

      Abort abort = null;
      for (HookPhase phase : HookPhase.values()) {
        if (phase == HookPhase.FINALIZE) {
          continue;
        }
        abort = runPhase(plan.getPhasePlan(phase), context, errors);
        if (abort != null) {
          break;
        }
      }

      // Clear a pending interrupt so finalize hooks can wait; the interrupt is re-raised below
      if (abort != null && abort.cause instanceof InterruptedException) {
        Thread.interrupted();
      }
      runPhase(plan.getPhasePlan(HookPhase.FINALIZE), context, errors);
      if (interruptCaptured) {
        Thread.currentThread().interrupt();
      }

      listenerWrapper.endRun(runId, context, (abort == null) ? null : abort.cause);
      if (abort != null) {
        logger.error(
            "Pipeline run {} aborted by hook {} in phase {}", runId, abort.hookId, abort.phase);
        raise(abort);
      }

      PipelineResult result = new PipelineResult(runId, errors, context);
      logger.info(
          "Finished pipeline run {}: success={} errors={}",
          runId,
          result.isSuccess(),
          errors.size());
      return result;
    } finally {
      PipelineMdc.removeRunContextFromMdc();
    }
  }

  /**
   * Run the hooks of one phase in order.
   *
   * @return the abort to raise, or null if the run goes on
   */
  private Abort runPhase(PhasePlan phasePlan, PipelineContext context, List<HookError> errors) {
    HookPhase phase = phasePlan.getPhase();
    PipelineMdc.addPhaseContextToMdc(phase);
    listenerWrapper.startPhase(phase, context);
    try {
      for (HookDescriptor hook : phasePlan.getHooks()) {
        Throwable failure = runHook(hook, context);
        if (failure == null) {
          continue;
        }

        HookError error = new HookError(phase, hook.getHookId(), failure);
        if (phase != HookPhase.FINALIZE && (phasePlan.isFailFast() || isAbortive(failure))) {
          logger.error("Hook {} failed in phase {}", hook.getHookId(), phase, failure);
          listenerWrapper.hookFailed(error, false);
          return new Abort(phase, hook.getHookId(), failure);
        }

        logger.warn(
            "Hook {} failed in phase {}; continuing: {}",
            hook.getHookId(),
            phase,
            error.getErrorMessage(),
            failure);
        if (failure instanceof InterruptedException) {
          interruptCaptured = true;
        }
        errors.add(error);
        listenerWrapper.hookFailed(error, true);
      }
      return null;
    } finally {
      listenerWrapper.endPhase(phase, context);
      PipelineMdc.removePhaseContextFromMdc();
    }
  }

  /**
   * Resolve and invoke one hook.
   *
   * @return the failure of the hook, or null on success
   */
  private Throwable runHook(HookDescriptor hook, PipelineContext context) {
    PipelineMdc.addHookContextToMdc(hook);
    listenerWrapper.startHook(hook, context);
    try {
      HookBody body =
          resolver
              .resolve(hook.getCallableRef())
              .orElseThrow(
                  () -> new CallableNotFoundException(hook.getHookId(), hook.getCallableRef()));
      logger.debug("Running hook {}", hook.getHookId());
      hookInvoker.invoke(hook, body, context);
      return null;
    } catch (Throwable ex) {
      return ex;
    } finally {
      listenerWrapper.endHook(hook, context);
      PipelineMdc.removeHookContextFromMdc();
    }
  }

  /**
   * Raise the failure that aborted the run. Unchecked exceptions and errors are raised as they are,
   * other checked exceptions are wrapped.
   */
  private static void raise(Abort abort) throws InterruptedException {
    Throwable cause = abort.cause;
    if (cause instanceof InterruptedException) {
      throw (InterruptedException) cause;
    }
    if (cause instanceof RuntimeException) {
      throw (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    throw new HookExecutionException(abort.phase, abort.hookId, cause);
  }

  private static boolean isAbortive(Throwable failure) {
    return failure instanceof InterruptedException || failure instanceof VirtualMachineError;
  }

  /** The failure that stopped the run and where it happened. */
  private static final class Abort {
    private final HookPhase phase;
    private final String hookId;
    private final Throwable cause;

    private Abort(HookPhase phase, String hookId, Throwable cause) {
      this.phase = phase;
      this.hookId = hookId;
      this.cause = cause;
    }
  }
}
