package bio.terra.pipeline;

/**
 * The invokable unit behind a hook's callable reference. A body is either a {@link DirectHook},
 * which blocks until its work is done, or a {@link SuspendingHook}, which returns a completion
 * stage. The runner waits for either kind before moving on, so both can be mixed in one plan.
 */
public interface HookBody {}
