package bio.terra.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Outcome of a run that was not aborted by a fail-fast error. A run is successful when no hook
 * error was captured; a degraded run still carries the final context.
 */
public class PipelineResult {
  private final String runId;
  private final ImmutableList<HookError> errors;
  private final PipelineContext context;

  public PipelineResult(String runId, List<HookError> errors, PipelineContext context) {
    this.runId = runId;
    this.errors = ImmutableList.copyOf(errors);
    this.context = context;
  }

  public String getRunId() {
    return runId;
  }

  public boolean isSuccess() {
    return errors.isEmpty();
  }

  /** @return captured errors in the order they occurred */
  public ImmutableList<HookError> getErrors() {
    return errors;
  }

  public PipelineContext getContext() {
    return context;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.JSON_STYLE)
        .append("runId", runId)
        .append("success", isSuccess())
        .append("errors", errors)
        .toString();
  }
}
