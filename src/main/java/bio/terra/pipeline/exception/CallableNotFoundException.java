package bio.terra.pipeline.exception;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Thrown when callable references of a plan do not resolve to hook bodies. Building a runner
 * checks every reference of the plan up front and reports all missing ones together; the runner
 * raises it for a single hook if its reference stops resolving afterwards.
 */
public class CallableNotFoundException extends PipelineExecutionException {
  @Nullable private final String hookId;
  private final List<String> callableRefs;

  public CallableNotFoundException(String hookId, String callableRef) {
    super("No callable found for reference '" + callableRef + "' of hook '" + hookId + "'");
    this.hookId = hookId;
    this.callableRefs = List.of(callableRef);
  }

  public CallableNotFoundException(List<String> callableRefs) {
    super("No callables found for references: " + String.join(", ", callableRefs));
    this.hookId = null;
    this.callableRefs = List.copyOf(callableRefs);
  }

  /** @return the hook whose reference failed at run time, or null for the up-front check */
  @Nullable
  public String getHookId() {
    return hookId;
  }

  /** @return the first missing reference */
  public String getCallableRef() {
    return callableRefs.get(0);
  }

  /** @return every missing reference, in plan order */
  public List<String> getCallableRefs() {
    return callableRefs;
  }
}
