package bio.terra.pipeline.exception;

/** Thrown when a hook descriptor is built from missing or malformed fields. */
public class InvalidHookDescriptorException extends PipelineBadRequestException {
  public InvalidHookDescriptorException(String message) {
    super(message);
  }

  public InvalidHookDescriptorException(String message, Throwable cause) {
    super(message, cause);
  }

  public InvalidHookDescriptorException(Throwable cause) {
    super(cause);
  }
}
