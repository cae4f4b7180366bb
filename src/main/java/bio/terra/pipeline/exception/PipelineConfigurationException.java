package bio.terra.pipeline.exception;

/** Thrown when a plan builder or runner builder is missing required configuration. */
public class PipelineConfigurationException extends PipelineBadRequestException {
  public PipelineConfigurationException(String message) {
    super(message);
  }

  public PipelineConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public PipelineConfigurationException(Throwable cause) {
    super(cause);
  }
}
