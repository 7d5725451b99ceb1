package com.github.flowengine;

/**
 * Tagged value held by a step's {@code nextStep}, {@code previousStep} and {@code skipToStep}
 * fields. An absent field (null on the step) behaves like {@link Kind#SEQUENCE}.
 */
public final class NavigationTarget {
  private static final NavigationTarget TERMINAL = new NavigationTarget(Kind.TERMINAL, null, null);
  private static final NavigationTarget SEQUENCE = new NavigationTarget(Kind.SEQUENCE, null, null);

  public static enum Kind {
    // go to the step with this id
    LITERAL,
    // no further step, the flow ends here
    TERMINAL,
    // the adjacent eligible step in step order
    SEQUENCE,
    // computed from the context by a StepRouter
    PREDICATE;
  }

  private final Kind kind;
  private final String stepId;
  private final StepRouter router;

  private NavigationTarget(final Kind kind, final String stepId, final StepRouter router) {
    this.kind = kind;
    this.stepId = stepId;
    this.router = router;
  }

  public static NavigationTarget step(final String stepId) {
    if (stepId == null) {
      return TERMINAL;
    }
    return new NavigationTarget(Kind.LITERAL, stepId, null);
  }

  public static NavigationTarget step(final int stepId) {
    return step(String.valueOf(stepId));
  }

  public static NavigationTarget end() {
    return TERMINAL;
  }

  public static NavigationTarget sequence() {
    return SEQUENCE;
  }

  public static NavigationTarget dynamic(final StepRouter router) {
    if (router == null) {
      throw new IllegalArgumentException("router cannot be null");
    }
    return new NavigationTarget(Kind.PREDICATE, null, router);
  }

  public Kind getKind() {
    return kind;
  }

  public String getStepId() {
    return stepId;
  }

  public StepRouter getRouter() {
    return router;
  }

  @Override
  public int hashCode() {
    int result = kind.hashCode();
    result = 31 * result + (stepId == null ? 0 : stepId.hashCode());
    result = 31 * result + (router == null ? 0 : router.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final NavigationTarget other = (NavigationTarget) obj;
    return kind == other.kind && (stepId == null ? other.stepId == null : stepId.equals(other.stepId))
        && router == other.router;
  }

  @Override
  public String toString() {
    switch (kind) {
      case LITERAL:
        return "NavigationTarget [" + stepId + "]";
      default:
        return "NavigationTarget [" + kind + "]";
    }
  }
}
