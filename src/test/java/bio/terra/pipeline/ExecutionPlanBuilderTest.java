package bio.terra.pipeline;

import static bio.terra.pipeline.fixtures.TestUtil.hook;
import static bio.terra.pipeline.fixtures.TestUtil.hookBuilder;
import static bio.terra.pipeline.fixtures.TestUtil.hookIds;
import static bio.terra.pipeline.fixtures.TestUtil.sealedRegistry;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import bio.terra.pipeline.exception.DependencyCycleException;
import bio.terra.pipeline.exception.HookTypeMismatchException;
import bio.terra.pipeline.exception.PipelineConfigurationException;
import bio.terra.pipeline.exception.UnknownDependencyException;
import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
public class ExecutionPlanBuilderTest {

  @Test
  public void registryMustBeSealed() {
    HookRegistry registry = new HookRegistry();
    registry.register(hook("h1", HookPhase.EXECUTE));
    assertThrows(
        PipelineConfigurationException.class,
        () -> new ExecutionPlanBuilder().registry(registry).build());
    assertThrows(PipelineConfigurationException.class, () -> new ExecutionPlanBuilder().build());
  }

  @Test
  public void emptyRegistry() {
    PlanBuildResult result = new ExecutionPlanBuilder().registry(sealedRegistry()).build();
    assertTrue(result.getPlan().isEmpty());
    assertThat(result.getPlan().getTotalHooks(), equalTo(0));
    assertFalse(result.hasWarnings());
    assertThat(result.getPlan().getPhasePlans(), hasSize(HookPhase.values().length));
  }

  @Test
  public void unknownDependency() {
    HookRegistry registry =
        sealedRegistry(
            hook("a", HookPhase.EXECUTE),
            hookBuilder("b", HookPhase.EXECUTE).dependsOn("nonexistent").build());
    UnknownDependencyException ex =
        assertThrows(
            UnknownDependencyException.class,
            () -> new ExecutionPlanBuilder().registry(registry).build());
    assertThat(ex.getHookId(), equalTo("b"));
    assertThat(ex.getDependencyId(), equalTo("nonexistent"));
    assertThat(ex.getMessage(), containsString("'b'"));
    assertThat(ex.getMessage(), containsString("'nonexistent'"));
  }

  @Test
  public void dependencyInOtherPhaseIsUnknown() {
    HookRegistry registry =
        sealedRegistry(
            hook("setup", HookPhase.BEFORE),
            hookBuilder("work", HookPhase.EXECUTE).dependsOn("setup").build());
    UnknownDependencyException ex =
        assertThrows(
            UnknownDependencyException.class,
            () -> new ExecutionPlanBuilder().registry(registry).build());
    assertThat(ex.getHookId(), equalTo("work"));
    assertThat(ex.getDependencyId(), equalTo("setup"));
    assertThat(ex.getPhase(), equalTo(HookPhase.EXECUTE));
  }

  @Test
  public void twoHookCycle() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("a", HookPhase.EXECUTE).dependsOn("b").build(),
            hookBuilder("b", HookPhase.EXECUTE).dependsOn("a").build());
    DependencyCycleException ex =
        assertThrows(
            DependencyCycleException.class,
            () -> new ExecutionPlanBuilder().registry(registry).build());
    assertThat(ex.getPhase(), equalTo(HookPhase.EXECUTE));
    assertThat(ex.getCycle(), containsInAnyOrder("a", "b"));
  }

  @Test
  public void threeHookCycleBehindAcyclicHooks() {
    HookRegistry registry =
        sealedRegistry(
            hook("root", HookPhase.AFTER),
            hookBuilder("x", HookPhase.AFTER).dependsOn("root", "z").build(),
            hookBuilder("y", HookPhase.AFTER).dependsOn("x").build(),
            hookBuilder("z", HookPhase.AFTER).dependsOn("y").build(),
            hookBuilder("tail", HookPhase.AFTER).dependsOn("z").build());
    DependencyCycleException ex =
        assertThrows(
            DependencyCycleException.class,
            () -> new ExecutionPlanBuilder().registry(registry).build());
    assertThat(ex.getPhase(), equalTo(HookPhase.AFTER));
    assertThat("Only cycle members are reported", ex.getCycle(), containsInAnyOrder("x", "y", "z"));
  }

  @Test
  public void selfDependency() {
    HookRegistry registry =
        sealedRegistry(hookBuilder("loop", HookPhase.EMIT).dependsOn("loop").build());
    DependencyCycleException ex =
        assertThrows(
            DependencyCycleException.class,
            () -> new ExecutionPlanBuilder().registry(registry).build());
    assertThat(ex.getCycle(), contains("loop"));
  }

  @Test
  public void priorityThenIdOrder() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("c", HookPhase.EXECUTE).priority(10).build(),
            hookBuilder("b", HookPhase.EXECUTE).priority(10).build(),
            hookBuilder("late", HookPhase.EXECUTE).priority(200).build(),
            hookBuilder("a", HookPhase.EXECUTE).priority(50).build(),
            hookBuilder("first", HookPhase.EXECUTE).priority(1).build());

    ExecutionPlan plan = new ExecutionPlanBuilder().registry(registry).build().getPlan();
    assertThat(
        hookIds(plan.getHooks(HookPhase.EXECUTE)), contains("first", "b", "c", "a", "late"));

    for (int i = 0; i < 10; i++) {
      ExecutionPlan again = new ExecutionPlanBuilder().registry(registry).build().getPlan();
      assertThat(again.getHooks(HookPhase.EXECUTE), equalTo(plan.getHooks(HookPhase.EXECUTE)));
    }
  }

  @Test
  public void dependencyBeatsPriority() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("needsSlow", HookPhase.BEFORE).priority(1).dependsOn("slow").build(),
            hookBuilder("slow", HookPhase.BEFORE).priority(500).build(),
            hookBuilder("other", HookPhase.BEFORE).priority(100).build());
    ExecutionPlan plan = new ExecutionPlanBuilder().registry(registry).build().getPlan();
    assertThat(hookIds(plan.getHooks(HookPhase.BEFORE)), contains("other", "slow", "needsSlow"));
  }

  @Test
  public void diamond() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("D", HookPhase.EXECUTE).priority(1).dependsOn("B", "C").build(),
            hookBuilder("C", HookPhase.EXECUTE).priority(2).dependsOn("A").build(),
            hookBuilder("B", HookPhase.EXECUTE).priority(1).dependsOn("A").build(),
            hookBuilder("A", HookPhase.EXECUTE).priority(1).build());
    ExecutionPlan plan = new ExecutionPlanBuilder().registry(registry).build().getPlan();
    List<String> order = hookIds(plan.getHooks(HookPhase.EXECUTE));
    assertThat(order, contains("A", "B", "C", "D"));
  }

  @Test
  public void phasesAreOrderedIndependently() {
    HookRegistry registry =
        sealedRegistry(
            hook("f1", HookPhase.FINALIZE),
            hook("p1", HookPhase.PREFLIGHT),
            hook("e1", HookPhase.EXECUTE));
    ExecutionPlan plan = new ExecutionPlanBuilder().registry(registry).build().getPlan();
    assertThat(plan.getTotalHooks(), equalTo(3));
    assertThat(hookIds(plan.getHooks(HookPhase.PREFLIGHT)), contains("p1"));
    assertThat(hookIds(plan.getHooks(HookPhase.FINALIZE)), contains("f1"));
    assertTrue(plan.getHooks(HookPhase.AFTER).isEmpty());
    assertTrue(plan.isFailFast(HookPhase.EXECUTE));
    assertFalse(plan.isFailFast(HookPhase.FINALIZE));
  }

  @Test
  public void typeMismatchEnforced() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("pure", HookPhase.EXECUTE).typeTag(HandlerCategory.COMPUTE).build(),
            hookBuilder("writer", HookPhase.EXECUTE).typeTag(HandlerCategory.EFFECT).build());
    HookTypeMismatchException ex =
        assertThrows(
            HookTypeMismatchException.class,
            () ->
                new ExecutionPlanBuilder()
                    .registry(registry)
                    .contractCategory(HandlerCategory.COMPUTE)
                    .build());
    assertThat(ex.getHookId(), equalTo("writer"));
    assertThat(ex.getTypeTag(), equalTo(HandlerCategory.EFFECT));
    assertThat(ex.getContractCategory(), equalTo(HandlerCategory.COMPUTE));
  }

  @Test
  public void typeMismatchAdvisory() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("writer", HookPhase.EXECUTE).typeTag(HandlerCategory.EFFECT).build(),
            hookBuilder("random", HookPhase.AFTER)
                .typeTag(HandlerCategory.NONDETERMINISTIC_COMPUTE)
                .build(),
            hook("untagged", HookPhase.EXECUTE),
            hookBuilder("pure", HookPhase.EXECUTE).typeTag(HandlerCategory.COMPUTE).build());
    PlanBuildResult result =
        new ExecutionPlanBuilder()
            .registry(registry)
            .contractCategory(HandlerCategory.COMPUTE)
            .enforceTyping(false)
            .build();

    assertTrue(result.hasWarnings());
    assertThat(result.getWarnings(), hasSize(2));
    PlanWarning first = result.getWarnings().get(0);
    assertThat(first.getCode(), equalTo(PlanWarning.HOOK_TYPE_MISMATCH));
    assertThat(first.getHookId(), equalTo("writer"));
    assertThat(first.getMessage(), containsString("writer"));
    assertThat(result.getWarnings().get(1).getHookId(), equalTo("random"));
    assertThat("Plan is still built", result.getPlan().getTotalHooks(), equalTo(4));
    assertThat(result.getPlan().getContractCategory().get(), equalTo(HandlerCategory.COMPUTE));
  }

  @Test
  public void noContractCategorySkipsTypeCheck() {
    HookRegistry registry =
        sealedRegistry(
            hookBuilder("writer", HookPhase.EXECUTE).typeTag(HandlerCategory.EFFECT).build());
    PlanBuildResult result = new ExecutionPlanBuilder().registry(registry).build();
    assertFalse(result.hasWarnings());
    assertFalse(result.getPlan().getContractCategory().isPresent());
  }
}
