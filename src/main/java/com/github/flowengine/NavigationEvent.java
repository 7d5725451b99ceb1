package com.github.flowengine;

/**
 * Payload of {@code navigationForward}, {@code navigationBack} and {@code navigationJump}, fired
 * after a transition between two steps committed.
 */
public final class NavigationEvent {
  private final Step fromStep;
  private final Step toStep;
  private final NavigationDirection direction;
  private final FlowContext context;

  NavigationEvent(final Step fromStep, final Step toStep, final NavigationDirection direction,
      final FlowContext context) {
    this.fromStep = fromStep;
    this.toStep = toStep;
    this.direction = direction;
    this.context = context;
  }

  public Step getFromStep() {
    return fromStep;
  }

  public Step getToStep() {
    return toStep;
  }

  public NavigationDirection getDirection() {
    return direction;
  }

  public FlowContext getContext() {
    return context;
  }

  @Override
  public String toString() {
    return "NavigationEvent [" + fromStep.getId() + "->" + toStep.getId() + ", direction="
        + direction + "]";
  }
}
