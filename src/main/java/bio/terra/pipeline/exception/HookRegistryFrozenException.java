package bio.terra.pipeline.exception;

/** Thrown when a hook is registered after the registry has been sealed. */
public class HookRegistryFrozenException extends PipelineBadRequestException {
  private final String hookId;

  public HookRegistryFrozenException(String hookId) {
    super("Cannot register hook '" + hookId + "': the registry is sealed");
    this.hookId = hookId;
  }

  public String getHookId() {
    return hookId;
  }
}
