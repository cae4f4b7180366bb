package bio.terra.pipeline.exception;

public class DuplicateCallableException extends PipelineBadRequestException {
  private final String callableRef;

  public DuplicateCallableException(String callableRef) {
    super("Callable reference '" + callableRef + "' is already mapped");
    this.callableRef = callableRef;
  }

  public String getCallableRef() {
    return callableRef;
  }
}
