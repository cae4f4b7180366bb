package bio.terra.pipeline.exception;

/**
 * Exception thrown when a hook id that is already in the registry is registered again.
 *
 * <p>Hook ids are chosen by the caller, so this is distinguished from other registration errors.
 */
public class DuplicateHookException extends PipelineBadRequestException {
  private final String hookId;

  public DuplicateHookException(String hookId) {
    super("Hook with id '" + hookId + "' is already registered");
    this.hookId = hookId;
  }

  public String getHookId() {
    return hookId;
  }
}
