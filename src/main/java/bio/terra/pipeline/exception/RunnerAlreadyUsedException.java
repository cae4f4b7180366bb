package bio.terra.pipeline.exception;

/**
 * Thrown when {@code run()} is called a second time on a runner. A runner executes exactly once;
 * build a new runner from the same plan for every run.
 */
public class RunnerAlreadyUsedException extends PipelineBadRequestException {
  public RunnerAlreadyUsedException(String message) {
    super(message);
  }

  public RunnerAlreadyUsedException(String message, Throwable cause) {
    super(message, cause);
  }

  public RunnerAlreadyUsedException(Throwable cause) {
    super(cause);
  }
}
