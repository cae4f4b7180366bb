package bio.terra.pipeline.exception;

import java.time.Duration;

/**
 * Thrown when a single hook invocation runs longer than its timeout. The owning phase's policy
 * decides whether it aborts the run or is captured.
 */
public class HookTimeoutException extends PipelineExecutionException {
  private final String hookId;
  private final Duration timeout;

  public HookTimeoutException(String hookId, Duration timeout) {
    super("Hook '" + hookId + "' exceeded its timeout of " + timeout.toMillis() + " ms");
    this.hookId = hookId;
    this.timeout = timeout;
  }

  public String getHookId() {
    return hookId;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
