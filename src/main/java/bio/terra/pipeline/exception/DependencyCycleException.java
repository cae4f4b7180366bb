package bio.terra.pipeline.exception;

import bio.terra.pipeline.HookPhase;
import java.util.List;

/** Thrown when the dependencies inside one phase form a cycle. */
public class DependencyCycleException extends PlanValidationException {
  private final HookPhase phase;
  private final List<String> cycle;

  /**
   * @param phase phase whose dependency graph contains the cycle
   * @param cycle hook ids forming the cycle; each depends on the next and the last depends on the
   *     first
   */
  public DependencyCycleException(HookPhase phase, List<String> cycle) {
    super(
        String.format(
            "Dependency cycle detected in phase %s: %s", phase, String.join(" -> ", cycle)));
    this.phase = phase;
    this.cycle = List.copyOf(cycle);
  }

  public HookPhase getPhase() {
    return phase;
  }

  public List<String> getCycle() {
    return cycle;
  }
}
