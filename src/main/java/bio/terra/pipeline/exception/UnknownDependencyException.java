package bio.terra.pipeline.exception;

import bio.terra.pipeline.HookPhase;

/**
 * Thrown when a hook depends on a hook id that is not registered in the same phase. Dependencies
 * never cross phases, so a dependency on a hook registered in another phase is also unknown.
 */
public class UnknownDependencyException extends PlanValidationException {
  private final String hookId;
  private final String dependencyId;
  private final HookPhase phase;

  public UnknownDependencyException(String hookId, String dependencyId, HookPhase phase) {
    super(
        String.format(
            "Hook '%s' depends on unknown hook '%s' in phase %s", hookId, dependencyId, phase));
    this.hookId = hookId;
    this.dependencyId = dependencyId;
    this.phase = phase;
  }

  public String getHookId() {
    return hookId;
  }

  public String getDependencyId() {
    return dependencyId;
  }

  public HookPhase getPhase() {
    return phase;
  }
}
