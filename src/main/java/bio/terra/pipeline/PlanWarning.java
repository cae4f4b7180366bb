package bio.terra.pipeline;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Advisory finding produced by the plan builder when a check is not enforced. The plan is still
 * built.
 */
public class PlanWarning {
  public static final String HOOK_TYPE_MISMATCH = "HOOK_TYPE_MISMATCH";

  private final String code;
  private final String hookId;
  private final String message;

  public PlanWarning(String code, String hookId, String message) {
    this.code = code;
    this.hookId = hookId;
    this.message = message;
  }

  public String getCode() {
    return code;
  }

  public String getHookId() {
    return hookId;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.JSON_STYLE)
        .append("code", code)
        .append("hookId", hookId)
        .append("message", message)
        .toString();
  }
}
