package bio.terra.pipeline.exception;

import bio.terra.pipeline.HookPhase;

/**
 * Carries a checked exception thrown by a hook body out of a fail-fast phase. Unchecked exceptions
 * are re-raised unchanged; only checked ones are wrapped, with the original as the cause.
 */
public class HookExecutionException extends PipelineExecutionException {
  private final HookPhase phase;
  private final String hookId;

  public HookExecutionException(HookPhase phase, String hookId, Throwable cause) {
    super("Hook '" + hookId + "' failed in phase " + phase + ": " + cause.getMessage(), cause);
    this.phase = phase;
    this.hookId = hookId;
  }

  public HookPhase getPhase() {
    return phase;
  }

  public String getHookId() {
    return hookId;
  }
}
