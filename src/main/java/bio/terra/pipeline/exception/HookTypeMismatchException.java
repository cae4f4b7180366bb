package bio.terra.pipeline.exception;

import bio.terra.pipeline.HandlerCategory;

/**
 * Thrown by the plan builder in enforced typing mode when a hook's type tag differs from the
 * contract category the plan is built for.
 */
public class HookTypeMismatchException extends PlanValidationException {
  private final String hookId;
  private final HandlerCategory typeTag;
  private final HandlerCategory contractCategory;

  public HookTypeMismatchException(
      String hookId, HandlerCategory typeTag, HandlerCategory contractCategory) {
    super(
        String.format(
            "Hook '%s' has type tag %s which is incompatible with contract category %s",
            hookId, typeTag, contractCategory));
    this.hookId = hookId;
    this.typeTag = typeTag;
    this.contractCategory = contractCategory;
  }

  public String getHookId() {
    return hookId;
  }

  public HandlerCategory getTypeTag() {
    return typeTag;
  }

  public HandlerCategory getContractCategory() {
    return contractCategory;
  }
}
