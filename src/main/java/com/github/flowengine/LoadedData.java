package com.github.flowengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a load handler returns to resume a flow: previously collected flowData, the step to resume
 * at, caller attributes and, optionally, the recorded step timestamps.
 */
public final class LoadedData {
  private final Map<String, Object> flowData;
  private final String currentStepId;
  private final Map<String, Object> attributes;
  private final Long startedAt;
  private final Map<String, Long> completedSteps;
  private final Map<String, Long> stepStartTimes;

  private LoadedData(final Builder builder) {
    this.flowData = Collections.unmodifiableMap(new LinkedHashMap<>(builder.flowData));
    this.currentStepId = builder.currentStepId;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    this.startedAt = builder.startedAt;
    this.completedSteps = Collections.unmodifiableMap(new LinkedHashMap<>(builder.completedSteps));
    this.stepStartTimes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stepStartTimes));
  }

  public Map<String, Object> getFlowData() {
    return flowData;
  }

  public String getCurrentStepId() {
    return currentStepId;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public Long getStartedAt() {
    return startedAt;
  }

  public Map<String, Long> getCompletedSteps() {
    return completedSteps;
  }

  public Map<String, Long> getStepStartTimes() {
    return stepStartTimes;
  }

  /**
   * Capture everything needed to resume the given context at the given step.
   */
  public static LoadedData snapshotOf(final FlowContext context, final String currentStepId) {
    return newBuilder().flowData(context.getFlowData()).attributes(context.getAttributes())
        .currentStepId(currentStepId).startedAt(context.getInternals().getStartedAt())
        .completedSteps(context.getInternals().getCompletedSteps())
        .stepStartTimes(context.getInternals().getStepStartTimes()).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "LoadedData [currentStepId=" + currentStepId + ", flowData=" + flowData + "]";
  }

  public final static class Builder {
    private final Map<String, Object> flowData = new LinkedHashMap<>();
    private String currentStepId;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Long startedAt;
    private final Map<String, Long> completedSteps = new LinkedHashMap<>();
    private final Map<String, Long> stepStartTimes = new LinkedHashMap<>();

    public Builder flowData(final Map<String, ?> flowData) {
      if (flowData != null) {
        this.flowData.putAll(flowData);
      }
      return this;
    }

    public Builder flowData(final String key, final Object value) {
      this.flowData.put(key, value);
      return this;
    }

    public Builder currentStepId(final String currentStepId) {
      this.currentStepId = currentStepId;
      return this;
    }

    public Builder attributes(final Map<String, ?> attributes) {
      if (attributes != null) {
        this.attributes.putAll(attributes);
      }
      return this;
    }

    public Builder startedAt(final Long startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public Builder completedSteps(final Map<String, Long> completedSteps) {
      if (completedSteps != null) {
        this.completedSteps.putAll(completedSteps);
      }
      return this;
    }

    public Builder stepStartTimes(final Map<String, Long> stepStartTimes) {
      if (stepStartTimes != null) {
        this.stepStartTimes.putAll(stepStartTimes);
      }
      return this;
    }

    public LoadedData build() {
      return new LoadedData(this);
    }

    private Builder() {}
  }
}
