package bio.terra.pipeline;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fans runner events out to the configured listeners, isolating the run from listener failures. */
class ListenerWrapper {
  private static final Logger logger = LoggerFactory.getLogger(ListenerWrapper.class);
  private final List<PipelineListener> listeners;

  @FunctionalInterface
  private interface ListenerCall {
    void call(PipelineListener listener);
  }

  ListenerWrapper(List<PipelineListener> listeners) {
    this.listeners = List.copyOf(listeners);
  }

  void startRun(String runId, PipelineContext context) {
    handleListenerList("startRun", listener -> listener.startRun(runId, context));
  }

  void startPhase(HookPhase phase, PipelineContext context) {
    handleListenerList("startPhase", listener -> listener.startPhase(phase, context));
  }

  void startHook(HookDescriptor hook, PipelineContext context) {
    handleListenerList("startHook", listener -> listener.startHook(hook, context));
  }

  void endHook(HookDescriptor hook, PipelineContext context) {
    handleListenerList("endHook", listener -> listener.endHook(hook, context));
  }

  void hookFailed(HookError error, boolean captured) {
    handleListenerList("hookFailed", listener -> listener.hookFailed(error, captured));
  }

  void endPhase(HookPhase phase, PipelineContext context) {
    handleListenerList("endPhase", listener -> listener.endPhase(phase, context));
  }

  void endRun(String runId, PipelineContext context, Throwable abortCause) {
    handleListenerList("endRun", listener -> listener.endRun(runId, context, abortCause));
  }

  private void handleListenerList(String operation, ListenerCall call) {
    for (PipelineListener listener : listeners) {
      try {
        call.call(listener);
      } catch (Exception ex) {
        logger.warn("Pipeline listener {} failed with exception", operation, ex);
      }
    }
  }
}
