package bio.terra.pipeline.exception;

/**
 * Base class for errors found while compiling a sealed registry into an execution plan. When one of
 * these is thrown no plan is produced.
 */
public class PlanValidationException extends PipelineException {
  public PlanValidationException(String message) {
    super(message);
  }

  public PlanValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  public PlanValidationException(Throwable cause) {
    super(cause);
  }
}
