package bio.terra.pipeline.exception;

/** Base class for errors raised by the engine itself while running a plan. */
public class PipelineExecutionException extends PipelineException {
  public PipelineExecutionException(String message) {
    super(message);
  }

  public PipelineExecutionException(String message, Throwable cause) {
    super(message, cause);
  }

  public PipelineExecutionException(Throwable cause) {
    super(cause);
  }
}
