package bio.terra.pipeline;

/**
 * The fixed lifecycle phases, declared in canonical execution order. Each phase carries a static
 * error policy: in a fail-fast phase the first hook error aborts the run, in a continue-on-error
 * phase hook errors are captured and the remaining hooks still run.
 *
 * <p>{@link #FINALIZE} always runs exactly once per run, whatever happened in earlier phases.
 */
public enum HookPhase {
  PREFLIGHT(true), // admission checks before any work
  BEFORE(true), // setup of the unit of work
  EXECUTE(true), // the unit of work itself
  AFTER(false), // post-processing of the outcome
  EMIT(false), // publishing results and events
  FINALIZE(false); // cleanup; always runs

  private final boolean failFast;

  HookPhase(boolean failFast) {
    this.failFast = failFast;
  }

  public boolean isFailFast() {
    return failFast;
  }
}
