package bio.terra.pipeline;

import java.util.Optional;

/**
 * Maps a hook's callable reference to the body that runs it. Supplied by the embedding system; the
 * engine never looks inside a body.
 */
@FunctionalInterface
public interface CallableResolver {
  Optional<HookBody> resolve(String callableRef);
}
