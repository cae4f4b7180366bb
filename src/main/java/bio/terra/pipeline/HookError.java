package bio.terra.pipeline;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Record of one hook failure that was captured rather than propagated: every error in a
 * continue-on-error phase, including {@link HookPhase#FINALIZE}.
 */
public class HookError {
  private final HookPhase phase;
  private final String hookId;
  private final String errorType;
  private final String errorMessage;
  private final Throwable exception;

  public HookError(HookPhase phase, String hookId, Throwable exception) {
    this.phase = phase;
    this.hookId = hookId;
    this.errorType = exception.getClass().getSimpleName();
    this.errorMessage = StringUtils.defaultIfEmpty(exception.getMessage(), errorType);
    this.exception = exception;
  }

  public HookPhase getPhase() {
    return phase;
  }

  public String getHookId() {
    return hookId;
  }

  /** @return simple class name of the exception */
  public String getErrorType() {
    return errorType;
  }

  /** @return message of the exception, or its type when it has no message */
  public String getErrorMessage() {
    return errorMessage;
  }

  public Throwable getException() {
    return exception;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.JSON_STYLE)
        .append("phase", phase)
        .append("hookId", hookId)
        .append("errorType", errorType)
        .append("errorMessage", errorMessage)
        .toString();
  }
}
