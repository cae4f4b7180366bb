package bio.terra.pipeline.fixtures;

import bio.terra.pipeline.CallableRegistry;
import bio.terra.pipeline.ExecutionPlan;
import bio.terra.pipeline.ExecutionPlanBuilder;
import bio.terra.pipeline.HookDescriptor;
import bio.terra.pipeline.HookPhase;
import bio.terra.pipeline.HookRegistry;
import java.util.List;
import java.util.stream.Collectors;

public final class TestUtil {
  private TestUtil() {}

  /** Hook with the default priority and a callable reference of "test." + hookId */
  public static HookDescriptor hook(String hookId, HookPhase phase) {
    return HookDescriptor.builder(hookId, phase, callableRef(hookId)).build();
  }

  public static HookDescriptor.Builder hookBuilder(String hookId, HookPhase phase) {
    return HookDescriptor.builder(hookId, phase, callableRef(hookId));
  }

  public static String callableRef(String hookId) {
    return "test." + hookId;
  }

  public static HookRegistry sealedRegistry(HookDescriptor... hooks) {
    HookRegistry registry = new HookRegistry();
    for (HookDescriptor hook : hooks) {
      registry.register(hook);
    }
    registry.seal();
    return registry;
  }

  public static ExecutionPlan buildPlan(HookDescriptor... hooks) {
    return new ExecutionPlanBuilder().registry(sealedRegistry(hooks)).build().getPlan();
  }

  public static List<String> hookIds(List<HookDescriptor> hooks) {
    return hooks.stream().map(HookDescriptor::getHookId).collect(Collectors.toList());
  }

  /**
   * Direct hooks for the given ids that append their id to the execution log when run.
   *
   * @param executionLog list receiving hook ids in execution order
   * @param hookIds ids of hooks built with {@link #hook}
   * @return callable registry with one body per hook id
   */
  public static CallableRegistry recordingCallables(List<String> executionLog, String... hookIds) {
    CallableRegistry callables = new CallableRegistry();
    for (String hookId : hookIds) {
      callables.direct(callableRef(hookId), context -> executionLog.add(hookId));
    }
    return callables;
  }
}
