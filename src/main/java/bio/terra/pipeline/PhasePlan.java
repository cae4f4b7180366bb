package bio.terra.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/** The ordered hooks of one phase together with the phase's error policy. */
public class PhasePlan {
  private final HookPhase phase;
  private final ImmutableList<HookDescriptor> hooks;
  private final boolean failFast;

  PhasePlan(HookPhase phase, List<HookDescriptor> hooks) {
    this.phase = phase;
    this.hooks = ImmutableList.copyOf(hooks);
    this.failFast = phase.isFailFast();
  }

  public HookPhase getPhase() {
    return phase;
  }

  /** @return hooks in execution order */
  public ImmutableList<HookDescriptor> getHooks() {
    return hooks;
  }

  public boolean isFailFast() {
    return failFast;
  }

  public boolean isEmpty() {
    return hooks.isEmpty();
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.JSON_STYLE)
        .append("phase", phase)
        .append("failFast", failFast)
        .append("hooks", hooks.size())
        .toString();
  }
}
