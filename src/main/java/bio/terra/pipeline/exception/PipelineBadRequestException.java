package bio.terra.pipeline.exception;

/**
 * Base class for errors caused by the caller: bad hook registrations, bad builder configuration
 * or misuse of a runner.
 */
public class PipelineBadRequestException extends PipelineException {
  public PipelineBadRequestException(String message) {
    super(message);
  }

  public PipelineBadRequestException(String message, Throwable cause) {
    super(message, cause);
  }

  public PipelineBadRequestException(Throwable cause) {
    super(cause);
  }
}
