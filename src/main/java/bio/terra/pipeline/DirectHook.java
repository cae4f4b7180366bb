package bio.terra.pipeline;

/**
 * A hook body that does its work on the calling thread and returns when it is done.
 *
 * <p>A direct hook with a timeout runs on the hook executor and receives a copy of the run's
 * context. If it overruns, the runner interrupts it and moves on; anything the hook writes from
 * then on lands in the abandoned copy and never reaches the run. A hook that ignores the interrupt
 * keeps its executor thread busy until it returns.
 */
@FunctionalInterface
public interface DirectHook extends HookBody {
  /**
   * @param context the context of the current run
   * @throws InterruptedException when the hook is interrupted, for example on timeout
   * @throws Exception any failure; handled according to the phase's error policy
   */
  void run(PipelineContext context) throws Exception;
}
