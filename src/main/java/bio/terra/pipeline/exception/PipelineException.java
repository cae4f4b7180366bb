package bio.terra.pipeline.exception;

/** Base class for all pipeline exceptions */
public abstract class PipelineException extends RuntimeException {
  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }

  public PipelineException(Throwable cause) {
    super(cause);
  }
}
