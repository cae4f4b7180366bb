package bio.terra.pipeline;

import static bio.terra.pipeline.PipelineMapper.getObjectMapper;

import bio.terra.pipeline.exception.JsonConversionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * The frozen output of the {@link ExecutionPlanBuilder}: for every phase, the hooks in the order
 * they will run and the phase's fail-fast flag. Every phase is present, possibly with no hooks.
 *
 * <p>A plan is immutable and holds no per-run state, so one plan can back any number of concurrent
 * {@link PipelineRunner}s.
 */
public class ExecutionPlan {
  private static final ExecutionPlan EMPTY_PLAN = new ExecutionPlan(Collections.emptyMap(), null);

  private final ImmutableMap<HookPhase, PhasePlan> phases;
  @Nullable private final HandlerCategory contractCategory;

  ExecutionPlan(
      Map<HookPhase, List<HookDescriptor>> orderedHooks,
      @Nullable HandlerCategory contractCategory) {
    Map<HookPhase, PhasePlan> phaseMap = new EnumMap<>(HookPhase.class);
    for (HookPhase phase : HookPhase.values()) {
      phaseMap.put(
          phase, new PhasePlan(phase, orderedHooks.getOrDefault(phase, Collections.emptyList())));
    }
    this.phases = ImmutableMap.copyOf(phaseMap);
    this.contractCategory = contractCategory;
  }

  /** @return a plan with no hooks in any phase */
  public static ExecutionPlan empty() {
    return EMPTY_PLAN;
  }

  public PhasePlan getPhasePlan(HookPhase phase) {
    return phases.get(phase);
  }

  public ImmutableList<HookDescriptor> getHooks(HookPhase phase) {
    return phases.get(phase).getHooks();
  }

  public boolean isFailFast(HookPhase phase) {
    return phases.get(phase).isFailFast();
  }

  /** @return phase plans in canonical phase order */
  public ImmutableList<PhasePlan> getPhasePlans() {
    return ImmutableList.copyOf(phases.values());
  }

  public int getTotalHooks() {
    return phases.values().stream().mapToInt(phasePlan -> phasePlan.getHooks().size()).sum();
  }

  public boolean isEmpty() {
    return getTotalHooks() == 0;
  }

  public Optional<HandlerCategory> getContractCategory() {
    return Optional.ofNullable(contractCategory);
  }

  /**
   * Render a summary of the plan as JSON: the contract category and, per phase, the fail-fast flag
   * and the ordered hook ids. Meant for diagnostics; a plan cannot be rebuilt from it.
   *
   * @return JSON string
   */
  public String toJson() {
    Map<String, Object> phaseSummary = new LinkedHashMap<>();
    for (PhasePlan phasePlan : phases.values()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("failFast", phasePlan.isFailFast());
      List<String> hookIds =
          phasePlan.getHooks().stream().map(HookDescriptor::getHookId).collect(Collectors.toList());
      entry.put("hooks", hookIds);
      phaseSummary.put(phasePlan.getPhase().name(), entry);
    }
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("contractCategory", contractCategory);
    summary.put("totalHooks", getTotalHooks());
    summary.put("phases", phaseSummary);
    try {
      return getObjectMapper().writeValueAsString(summary);
    } catch (JsonProcessingException ex) {
      throw new JsonConversionException("Failed to convert execution plan to json string", ex);
    }
  }

  @Override
  public String toString() {
    return "ExecutionPlan{totalHooks=" + getTotalHooks() + ", phases=" + phases.values() + "}";
  }
}
