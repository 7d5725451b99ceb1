package com.github.flowengine;

import java.util.Collections;
import java.util.Map;

/**
 * Payload of {@code stepActive}, {@code stepCompleted} and {@code stepSkipped}.
 */
public final class StepEvent {
  private final Step step;
  private final FlowContext context;
  private final Map<String, Object> stepData;
  private final long timestampMillis = System.currentTimeMillis();

  StepEvent(final Step step, final FlowContext context, final Map<String, Object> stepData) {
    this.step = step;
    this.context = context;
    this.stepData = stepData == null ? Collections.<String, Object>emptyMap() : stepData;
  }

  public Step getStep() {
    return step;
  }

  public FlowContext getContext() {
    return context;
  }

  public Map<String, Object> getStepData() {
    return stepData;
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  @Override
  public String toString() {
    return "StepEvent [step=" + step.getId() + ", stepData=" + stepData + "]";
  }
}
