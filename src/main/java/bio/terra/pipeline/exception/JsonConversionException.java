package bio.terra.pipeline.exception;

/** Thrown when a pipeline context or plan cannot be converted to or from JSON. */
public class JsonConversionException extends PipelineException {
  public JsonConversionException(String message) {
    super(message);
  }

  public JsonConversionException(String message, Throwable cause) {
    super(message, cause);
  }

  public JsonConversionException(Throwable cause) {
    super(cause);
  }
}
