package bio.terra.pipeline;

import bio.terra.pipeline.exception.CallableNotFoundException;
import bio.terra.pipeline.exception.PipelineConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * This builder class is the way to construct a PipelineRunner. A runner is good for one run, so
 * build one per unit of work. For example,
 *
 * <pre>
 *   PipelineResult result = new PipelineRunnerBuilder()
 *     .plan(plan)
 *     .resolver(callables)
 *     .listener(new MetricsListener())
 *     .build()
 *     .run();
 * </pre>
 */
public class PipelineRunnerBuilder {
  private final List<PipelineListener> listeners = new ArrayList<>();
  private ExecutionPlan plan;
  private CallableResolver resolver;
  private ExecutorService hookExecutor;
  private String runId;

  /**
   * @param plan the plan to run. Required. The same plan may be given to any number of runners.
   * @return this
   */
  public PipelineRunnerBuilder plan(ExecutionPlan plan) {
    this.plan = plan;
    return this;
  }

  public ExecutionPlan getPlan() {
    return plan;
  }

  /**
   * @param resolver maps callable references of the plan's hooks to hook bodies. Required.
   * @return this
   */
  public PipelineRunnerBuilder resolver(CallableResolver resolver) {
    this.resolver = resolver;
    return this;
  }

  public CallableResolver getResolver() {
    return resolver;
  }

  /**
   * Each call to listener adds a listener to a list of listeners. The listeners are called in the
   * order in which they are added to the builder.
   *
   * @param listener object observing the run
   * @return this
   */
  public PipelineRunnerBuilder listener(PipelineListener listener) {
    this.listeners.add(listener);
    return this;
  }

  public List<PipelineListener> getListeners() {
    return listeners;
  }

  /**
   * @param hookExecutor executor that runs direct hooks which have a timeout. Default is the shared
   *     {@link HookThreadPool#getDefault()}. The runner never shuts it down.
   * @return this
   */
  public PipelineRunnerBuilder hookExecutor(ExecutorService hookExecutor) {
    this.hookExecutor = hookExecutor;
    return this;
  }

  public ExecutorService getHookExecutor() {
    return hookExecutor;
  }

  /**
   * @param runId id used in logs, MDC and the result. Default is a fresh random id.
   * @return this
   */
  public PipelineRunnerBuilder runId(String runId) {
    this.runId = runId;
    return this;
  }

  public String getRunId() {
    return runId;
  }

  /**
   * Check the configuration and build the runner. Every callable reference of the plan must resolve
   * when the runner is built.
   *
   * @return a runner good for one run
   * @throws PipelineConfigurationException if the plan or the resolver is missing
   * @throws CallableNotFoundException naming every reference of the plan that does not resolve
   */
  public PipelineRunner build() {
    if (plan == null) {
      throw new PipelineConfigurationException("An execution plan is required to build a runner");
    }
    if (resolver == null) {
      throw new PipelineConfigurationException("A callable resolver is required to build a runner");
    }
    List<String> missingRefs = findMissingCallables();
    if (!missingRefs.isEmpty()) {
      throw new CallableNotFoundException(missingRefs);
    }
    if (hookExecutor == null) {
      hookExecutor = HookThreadPool.getDefault();
    }
    if (runId == null) {
      runId = RunIds.newRunId();
    }
    return new PipelineRunner(this);
  }

  private List<String> findMissingCallables() {
    Set<String> missingRefs = new LinkedHashSet<>();
    for (PhasePlan phasePlan : plan.getPhasePlans()) {
      for (HookDescriptor hook : phasePlan.getHooks()) {
        if (resolver.resolve(hook.getCallableRef()).isEmpty()) {
          missingRefs.add(hook.getCallableRef());
        }
      }
    }
    return new ArrayList<>(missingRefs);
  }
}
