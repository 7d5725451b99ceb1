package com.github.flowengine;

/**
 * Payload of {@code flowStarted}, {@code flowCompleted} and {@code flowAbandoned}. The step id is
 * the step that was current when the event fired, null once the flow completed.
 */
public final class FlowLifecycleEvent {
  private final FlowContext context;
  private final String stepId;
  private final long durationMillis;

  FlowLifecycleEvent(final FlowContext context, final String stepId, final long durationMillis) {
    this.context = context;
    this.stepId = stepId;
    this.durationMillis = durationMillis;
  }

  public FlowContext getContext() {
    return context;
  }

  public String getStepId() {
    return stepId;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  @Override
  public String toString() {
    return "FlowLifecycleEvent [stepId=" + stepId + ", durationMillis=" + durationMillis + "]";
  }
}
