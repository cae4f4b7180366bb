package bio.terra.pipeline;

import bio.terra.pipeline.exception.InvalidHookDescriptorException;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Immutable description of one hook: which phase it runs in, which callable runs it, and how it is
 * ordered relative to its siblings. Descriptors are made with the builder, for example
 *
 * <pre>
 *   HookDescriptor hook = HookDescriptor
 *     .builder("validate-input", HookPhase.PREFLIGHT, "hooks.validate")
 *     .priority(10)
 *     .dependsOn("load-schema")
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 *
 * <p>Dependencies name other hooks in the same phase. They are not checked here, since hooks may be
 * registered in any order; the {@link ExecutionPlanBuilder} validates them.
 */
public class HookDescriptor {
  public static final int DEFAULT_PRIORITY = 100;

  private final String hookId;
  private final HookPhase phase;
  private final String callableRef;
  private final int priority;
  private final ImmutableList<String> dependencies;
  @Nullable private final HandlerCategory typeTag;
  @Nullable private final Duration timeout;
  @Nullable private final String hookName;

  private HookDescriptor(Builder builder) {
    this.hookId = builder.hookId;
    this.phase = builder.phase;
    this.callableRef = builder.callableRef;
    this.priority = builder.priority;
    this.dependencies = ImmutableList.copyOf(builder.dependencies);
    this.typeTag = builder.typeTag;
    this.timeout = builder.timeout;
    this.hookName = builder.hookName;
  }

  public static Builder builder(String hookId, HookPhase phase, String callableRef) {
    return new Builder(hookId, phase, callableRef);
  }

  public String getHookId() {
    return hookId;
  }

  public HookPhase getPhase() {
    return phase;
  }

  public String getCallableRef() {
    return callableRef;
  }

  public int getPriority() {
    return priority;
  }

  public ImmutableList<String> getDependencies() {
    return dependencies;
  }

  public Optional<HandlerCategory> getTypeTag() {
    return Optional.ofNullable(typeTag);
  }

  public Optional<Duration> getTimeout() {
    return Optional.ofNullable(timeout);
  }

  /** @return display name of the hook; the hook id when no name was given */
  public String getHookName() {
    return (hookName == null) ? hookId : hookName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HookDescriptor)) {
      return false;
    }
    HookDescriptor that = (HookDescriptor) o;
    return new EqualsBuilder()
        .append(priority, that.priority)
        .append(hookId, that.hookId)
        .append(phase, that.phase)
        .append(callableRef, that.callableRef)
        .append(dependencies, that.dependencies)
        .append(typeTag, that.typeTag)
        .append(timeout, that.timeout)
        .append(hookName, that.hookName)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder(17, 37)
        .append(hookId)
        .append(phase)
        .append(callableRef)
        .append(priority)
        .append(dependencies)
        .append(typeTag)
        .append(timeout)
        .append(hookName)
        .toHashCode();
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.JSON_STYLE)
        .append("hookId", hookId)
        .append("phase", phase)
        .append("callableRef", callableRef)
        .append("priority", priority)
        .append("dependencies", dependencies)
        .append("typeTag", typeTag)
        .append("timeout", timeout)
        .toString();
  }

  public static class Builder {
    private final String hookId;
    private final HookPhase phase;
    private final String callableRef;
    private final Set<String> dependencies = new LinkedHashSet<>();
    private int priority = DEFAULT_PRIORITY;
    private HandlerCategory typeTag;
    private Duration timeout;
    private String hookName;

    private Builder(String hookId, HookPhase phase, String callableRef) {
      this.hookId = hookId;
      this.phase = phase;
      this.callableRef = callableRef;
    }

    /**
     * @param priority lower values run earlier among hooks that do not depend on each other.
     *     Default is DEFAULT_PRIORITY (100).
     * @return this
     */
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Add hooks that must run before this one. May be called more than once; repeated ids are
     * kept once.
     *
     * @param hookIds ids of hooks in the same phase
     * @return this
     */
    public Builder dependsOn(String... hookIds) {
      return dependsOn(Arrays.asList(hookIds));
    }

    public Builder dependsOn(Collection<String> hookIds) {
      for (String hookId : hookIds) {
        if (StringUtils.isBlank(hookId)) {
          throw new InvalidHookDescriptorException(
              "Hook '" + this.hookId + "' has a blank dependency id");
        }
        dependencies.add(hookId);
      }
      return this;
    }

    /**
     * @param typeTag category of work this hook performs. Default is none, which is compatible with
     *     every contract category.
     * @return this
     */
    public Builder typeTag(HandlerCategory typeTag) {
      this.typeTag = typeTag;
      return this;
    }

    /**
     * @param timeout upper bound on one invocation of the hook. Default is no timeout.
     * @return this
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder hookName(String hookName) {
      this.hookName = hookName;
      return this;
    }

    public HookDescriptor build() {
      if (StringUtils.isBlank(hookId)) {
        throw new InvalidHookDescriptorException("Hook id must not be blank");
      }
      if (phase == null) {
        throw new InvalidHookDescriptorException("Hook '" + hookId + "' has no phase");
      }
      if (StringUtils.isBlank(callableRef)) {
        throw new InvalidHookDescriptorException(
            "Hook '" + hookId + "' has a blank callable reference");
      }
      if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
        throw new InvalidHookDescriptorException(
            "Hook '" + hookId + "' timeout must be positive, was " + timeout);
      }
      return new HookDescriptor(this);
    }
  }
}
