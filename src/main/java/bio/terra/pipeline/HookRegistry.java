package bio.terra.pipeline;

import bio.terra.pipeline.exception.DuplicateHookException;
import bio.terra.pipeline.exception.HookRegistryFrozenException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of hook descriptors keyed by hook id. The registry starts out mutable and accepts
 * registrations until {@link #seal()} is called. Sealing is one-way: after it, registration fails
 * and the registry can be read from any number of threads without synchronization.
 *
 * <p>Reads never hand out internal state. Before sealing they return copies made under the
 * registry lock; after sealing they are served from an immutable snapshot.
 */
public class HookRegistry {
  private static final Logger logger = LoggerFactory.getLogger(HookRegistry.class);

  // Guarded by this; only touched while unsealed
  private final Map<String, HookDescriptor> hooks = new LinkedHashMap<>();

  // Written once, in seal()
  private volatile ImmutableMap<String, HookDescriptor> sealedHooks;

  /**
   * Add a hook to the registry.
   *
   * @param hook descriptor to add
   * @throws HookRegistryFrozenException if the registry is sealed
   * @throws DuplicateHookException if a hook with the same id is already registered
   */
  public synchronized void register(HookDescriptor hook) {
    if (sealedHooks != null) {
      throw new HookRegistryFrozenException(hook.getHookId());
    }
    if (hooks.containsKey(hook.getHookId())) {
      throw new DuplicateHookException(hook.getHookId());
    }
    hooks.put(hook.getHookId(), hook);
    logger.debug("Registered hook {} in phase {}", hook.getHookId(), hook.getPhase());
  }

  /** Seal the registry. Calling seal on a sealed registry does nothing. */
  public synchronized void seal() {
    if (sealedHooks != null) {
      return;
    }
    sealedHooks = ImmutableMap.copyOf(hooks);
    logger.debug("Sealed hook registry with {} hooks", sealedHooks.size());
  }

  public boolean isSealed() {
    return sealedHooks != null;
  }

  /** @return every hook, in registration order */
  public List<HookDescriptor> getAllHooks() {
    return ImmutableList.copyOf(snapshot().values());
  }

  /** @return hooks of one phase, in registration order */
  public List<HookDescriptor> getHooksForPhase(HookPhase phase) {
    return snapshot().values().stream()
        .filter(hook -> hook.getPhase() == phase)
        .collect(ImmutableList.toImmutableList());
  }

  public Optional<HookDescriptor> getHookById(String hookId) {
    return Optional.ofNullable(snapshot().get(hookId));
  }

  /**
   * Look up a hook by its display name. Names are not required to be unique; the first registered
   * match is returned.
   */
  public Optional<HookDescriptor> getHookByName(String hookName) {
    return snapshot().values().stream()
        .filter(hook -> hook.getHookName().equals(hookName))
        .findFirst();
  }

  public int size() {
    return snapshot().size();
  }

  private Map<String, HookDescriptor> snapshot() {
    ImmutableMap<String, HookDescriptor> sealed = sealedHooks;
    if (sealed != null) {
      return sealed;
    }
    synchronized (this) {
      return (sealedHooks != null) ? sealedHooks : ImmutableMap.copyOf(hooks);
    }
  }

  @Override
  public String toString() {
    return "HookRegistry{sealed="
        + isSealed()
        + ", hooks="
        + snapshot().keySet().stream().collect(Collectors.joining(", ", "[", "]"))
        + "}";
  }
}
