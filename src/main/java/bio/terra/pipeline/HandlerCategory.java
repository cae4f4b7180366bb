package bio.terra.pipeline;

import javax.annotation.Nullable;

/**
 * Classification of the work a hook performs. Used both as the optional type tag of a hook and as
 * the contract category a plan is built against.
 */
public enum HandlerCategory {
  COMPUTE, // pure, deterministic transformation
  EFFECT, // performs I/O or other side effects
  NONDETERMINISTIC_COMPUTE; // no side effects, but not reproducible

  /**
   * A missing tag or a missing category acts as a wildcard; otherwise the two must be equal.
   *
   * @param typeTag type tag of a hook, may be null
   * @param contractCategory category the plan is validated against, may be null
   * @return true if the hook may run under the contract category
   */
  public static boolean isCompatible(
      @Nullable HandlerCategory typeTag, @Nullable HandlerCategory contractCategory) {
    if (typeTag == null || contractCategory == null) {
      return true;
    }
    return typeTag == contractCategory;
  }
}
