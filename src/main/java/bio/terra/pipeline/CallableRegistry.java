package bio.terra.pipeline;

import bio.terra.pipeline.exception.DuplicateCallableException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link CallableResolver}. The typed registration methods spare callers from casting
 * lambdas to one body kind or the other:
 *
 * <pre>
 *   CallableRegistry callables = new CallableRegistry()
 *     .direct("hooks.validate", context -&gt; context.put("valid", true))
 *     .suspending("hooks.publish", context -&gt; publisher.publishAsync(context));
 * </pre>
 */
public class CallableRegistry implements CallableResolver {
  private final Map<String, HookBody> callables = new ConcurrentHashMap<>();

  public CallableRegistry direct(String callableRef, DirectHook body) {
    return add(callableRef, body);
  }

  public CallableRegistry suspending(String callableRef, SuspendingHook body) {
    return add(callableRef, body);
  }

  private CallableRegistry add(String callableRef, HookBody body) {
    if (callables.putIfAbsent(callableRef, body) != null) {
      throw new DuplicateCallableException(callableRef);
    }
    return this;
  }

  @Override
  public Optional<HookBody> resolve(String callableRef) {
    return Optional.ofNullable(callables.get(callableRef));
  }

  public int size() {
    return callables.size();
  }
}
