package com.github.flowengine;

/**
 * Interceptable payload of {@code beforeStepChange}. Listeners may either {@link #cancel()} the
 * attempted transition or {@link #redirect(String)} it elsewhere. Only the first decision counts,
 * across all listeners of one dispatch, and decisions made after dispatch returned are ignored.
 * Both methods report whether the call took effect.
 */
public final class BeforeStepChangeEvent {

  static enum Decision {
    PROCEED, CANCEL, REDIRECT;
  }

  private final Step fromStep;
  private final String targetStepId;
  private final NavigationDirection direction;
  private final FlowContext context;

  private Decision decision = Decision.PROCEED;
  private String redirectStepId;
  private boolean sealed;

  BeforeStepChangeEvent(final Step fromStep, final String targetStepId,
      final NavigationDirection direction, final FlowContext context) {
    this.fromStep = fromStep;
    this.targetStepId = targetStepId;
    this.direction = direction;
    this.context = context;
  }

  /**
   * Null when the transition starts the flow.
   */
  public Step getFromStep() {
    return fromStep;
  }

  /**
   * Null when the transition would complete the flow.
   */
  public String getTargetStepId() {
    return targetStepId;
  }

  public NavigationDirection getDirection() {
    return direction;
  }

  public FlowContext getContext() {
    return context;
  }

  public synchronized boolean cancel() {
    if (sealed || decision != Decision.PROCEED) {
      return false;
    }
    decision = Decision.CANCEL;
    return true;
  }

  /**
   * Substitute the target. A null id redirects to flow completion.
   */
  public synchronized boolean redirect(final String stepId) {
    if (sealed || decision != Decision.PROCEED) {
      return false;
    }
    decision = Decision.REDIRECT;
    redirectStepId = stepId;
    return true;
  }

  public synchronized boolean isCancelled() {
    return decision == Decision.CANCEL;
  }

  public synchronized boolean isRedirected() {
    return decision == Decision.REDIRECT;
  }

  synchronized String getRedirectStepId() {
    return redirectStepId;
  }

  synchronized void seal() {
    sealed = true;
  }

  @Override
  public String toString() {
    return "BeforeStepChangeEvent [from=" + (fromStep == null ? null : fromStep.getId())
        + ", target=" + targetStepId + ", direction=" + direction + ", decision=" + decision + "]";
  }
}
