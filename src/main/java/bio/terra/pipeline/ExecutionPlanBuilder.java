package bio.terra.pipeline;

import bio.terra.pipeline.exception.DependencyCycleException;
import bio.terra.pipeline.exception.HookTypeMismatchException;
import bio.terra.pipeline.exception.PipelineConfigurationException;
import bio.terra.pipeline.exception.UnknownDependencyException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This builder compiles a sealed {@link HookRegistry} into an {@link ExecutionPlan}. For example,
 *
 * <pre>
 *   PlanBuildResult result = new ExecutionPlanBuilder()
 *     .registry(registry)
 *     .contractCategory(HandlerCategory.EFFECT)
 *     .enforceTyping(false)
 *     .build();
 * </pre>
 *
 * <p>Building runs these checks in order, and stops at the first failing one without producing a
 * plan:
 *
 * <ol>
 *   <li>type compatibility of each tagged hook with the contract category
 *   <li>every dependency names a hook in the same phase
 *   <li>no phase has a dependency cycle
 * </ol>
 *
 * Within each phase hooks are then topologically sorted. Among hooks whose dependencies are all
 * satisfied, lower priority runs first and the hook id breaks ties, so the same registry always
 * yields the same order.
 */
public class ExecutionPlanBuilder {
  private static final Logger logger = LoggerFactory.getLogger(ExecutionPlanBuilder.class);

  static final Comparator<HookDescriptor> READY_ORDER =
      Comparator.comparingInt(HookDescriptor::getPriority)
          .thenComparing(HookDescriptor::getHookId);

  private HookRegistry registry;
  private HandlerCategory contractCategory;
  private boolean enforceTyping = true;

  /**
   * @param registry sealed registry to compile. Required.
   * @return this
   */
  public ExecutionPlanBuilder registry(HookRegistry registry) {
    this.registry = registry;
    return this;
  }

  public HookRegistry getRegistry() {
    return registry;
  }

  /**
   * @param contractCategory category every tagged hook must match. Default is null, which skips
   *     the type check.
   * @return this
   */
  public ExecutionPlanBuilder contractCategory(HandlerCategory contractCategory) {
    this.contractCategory = contractCategory;
    return this;
  }

  public HandlerCategory getContractCategory() {
    return contractCategory;
  }

  /**
   * @param enforceTyping when true a type mismatch fails the build; when false it is reported as a
   *     {@link PlanWarning}. Default is true.
   * @return this
   */
  public ExecutionPlanBuilder enforceTyping(boolean enforceTyping) {
    this.enforceTyping = enforceTyping;
    return this;
  }

  public boolean isEnforceTyping() {
    return enforceTyping;
  }

  /**
   * Validate the registry and produce the plan.
   *
   * @return the plan and any advisory warnings
   * @throws PipelineConfigurationException if no registry was given or it is not sealed
   * @throws HookTypeMismatchException on a type mismatch in enforced mode
   * @throws UnknownDependencyException if a dependency is not a hook of the same phase
   * @throws DependencyCycleException if a phase's dependencies form a cycle
   */
  public PlanBuildResult build() {
    if (registry == null) {
      throw new PipelineConfigurationException("A hook registry is required to build a plan");
    }
    if (!registry.isSealed()) {
      throw new PipelineConfigurationException("The hook registry must be sealed before building");
    }

    Map<HookPhase, List<HookDescriptor>> hooksByPhase = new EnumMap<>(HookPhase.class);
    for (HookPhase phase : HookPhase.values()) {
      hooksByPhase.put(phase, registry.getHooksForPhase(phase));
    }

    List<PlanWarning> warnings = validateTypes(hooksByPhase);
    for (HookPhase phase : HookPhase.values()) {
      validateDependencies(phase, hooksByPhase.get(phase));
    }

    Map<HookPhase, List<HookDescriptor>> orderedHooks = new EnumMap<>(HookPhase.class);
    for (HookPhase phase : HookPhase.values()) {
      orderedHooks.put(phase, sortPhase(phase, hooksByPhase.get(phase)));
    }

    ExecutionPlan plan = new ExecutionPlan(orderedHooks, contractCategory);
    logger.debug(
        "Built execution plan: {} hooks, {} warnings", plan.getTotalHooks(), warnings.size());
    return new PlanBuildResult(plan, warnings);
  }

  private List<PlanWarning> validateTypes(Map<HookPhase, List<HookDescriptor>> hooksByPhase) {
    List<PlanWarning> warnings = new ArrayList<>();
    if (contractCategory == null) {
      return warnings;
    }
    for (HookPhase phase : HookPhase.values()) {
      List<HookDescriptor> phaseHooks = new ArrayList<>(hooksByPhase.get(phase));
      phaseHooks.sort(Comparator.comparing(HookDescriptor::getHookId));
      for (HookDescriptor hook : phaseHooks) {
        HandlerCategory typeTag = hook.getTypeTag().orElse(null);
        if (HandlerCategory.isCompatible(typeTag, contractCategory)) {
          continue;
        }
        if (enforceTyping) {
          throw new HookTypeMismatchException(hook.getHookId(), typeTag, contractCategory);
        }
        String message =
            String.format(
                "Hook '%s' has type tag %s but the contract category is %s",
                hook.getHookId(), typeTag, contractCategory);
        logger.warn(message);
        warnings.add(new PlanWarning(PlanWarning.HOOK_TYPE_MISMATCH, hook.getHookId(), message));
      }
    }
    return warnings;
  }

  private void validateDependencies(HookPhase phase, List<HookDescriptor> phaseHooks) {
    Map<String, HookDescriptor> byId = indexById(phaseHooks);
    for (HookDescriptor hook : phaseHooks) {
      for (String dependency : hook.getDependencies()) {
        if (!byId.containsKey(dependency)) {
          throw new UnknownDependencyException(hook.getHookId(), dependency, phase);
        }
      }
    }
  }

  /**
   * Kahn's algorithm over one phase. Hooks whose dependencies have all been emitted wait in a
   * priority queue ordered by {@link #READY_ORDER}. Any hook left over at the end sits on a cycle
   * or behind one.
   */
  private List<HookDescriptor> sortPhase(HookPhase phase, List<HookDescriptor> phaseHooks) {
    Map<String, Integer> pendingDependencies = new HashMap<>();
    Map<String, List<HookDescriptor>> dependents = new HashMap<>();
    PriorityQueue<HookDescriptor> ready = new PriorityQueue<>(READY_ORDER);

    for (HookDescriptor hook : phaseHooks) {
      pendingDependencies.put(hook.getHookId(), hook.getDependencies().size());
      for (String dependency : hook.getDependencies()) {
        dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(hook);
      }
      if (hook.getDependencies().isEmpty()) {
        ready.add(hook);
      }
    }

    List<HookDescriptor> ordered = new ArrayList<>(phaseHooks.size());
    while (!ready.isEmpty()) {
      HookDescriptor next = ready.poll();
      ordered.add(next);
      for (HookDescriptor dependent : dependents.getOrDefault(next.getHookId(), List.of())) {
        int remaining = pendingDependencies.merge(dependent.getHookId(), -1, Integer::sum);
        if (remaining == 0) {
          ready.add(dependent);
        }
      }
    }

    if (ordered.size() < phaseHooks.size()) {
      Map<String, HookDescriptor> unsorted = new TreeMap<>(indexById(phaseHooks));
      ordered.forEach(hook -> unsorted.remove(hook.getHookId()));
      throw new DependencyCycleException(phase, findCycle(unsorted));
    }
    return ordered;
  }

  /**
   * Every hook left unsorted still has an unsorted dependency, so walking dependencies from any of
   * them must come back to a hook already on the path.
   */
  private static List<String> findCycle(Map<String, HookDescriptor> unsorted) {
    Map<String, Integer> pathIndex = new LinkedHashMap<>();
    String current = unsorted.keySet().iterator().next();
    while (!pathIndex.containsKey(current)) {
      pathIndex.put(current, pathIndex.size());
      current =
          unsorted.get(current).getDependencies().stream()
              .filter(unsorted::containsKey)
              .sorted()
              .findFirst()
              .orElseThrow(
                  () -> new IllegalStateException("Unsorted hook has no unsorted dependency"));
    }
    List<String> path = new ArrayList<>(pathIndex.keySet());
    return path.subList(pathIndex.get(current), path.size());
  }

  private static Map<String, HookDescriptor> indexById(List<HookDescriptor> hooks) {
    Map<String, HookDescriptor> byId = new HashMap<>();
    hooks.forEach(hook -> byId.put(hook.getHookId(), hook));
    return byId;
  }
}
