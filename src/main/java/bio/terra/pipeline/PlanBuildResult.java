package bio.terra.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The plan produced by {@link ExecutionPlanBuilder#build()} and any advisory warnings. */
public class PlanBuildResult {
  private final ExecutionPlan plan;
  private final ImmutableList<PlanWarning> warnings;

  PlanBuildResult(ExecutionPlan plan, List<PlanWarning> warnings) {
    this.plan = plan;
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public ExecutionPlan getPlan() {
    return plan;
  }

  public ImmutableList<PlanWarning> getWarnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
