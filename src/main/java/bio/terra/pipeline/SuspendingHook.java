package bio.terra.pipeline;

import java.util.concurrent.CompletionStage;

/**
 * A hook body that starts asynchronous work and returns without waiting for it. The hook is
 * complete when the returned stage completes; an exceptional completion is the hook's error.
 *
 * <p>On timeout the runner cancels the stage if it is a {@link java.util.concurrent.Future}.
 * Stopping the underlying work is up to whatever produced the stage.
 */
@FunctionalInterface
public interface SuspendingHook extends HookBody {
  CompletionStage<?> run(PipelineContext context);
}
