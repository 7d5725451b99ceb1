package com.github.flowengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One analytics fact handed to every {@link AnalyticsProvider} of an {@link AnalyticsPlugin}.
 */
public final class AnalyticsEvent {
  public static final String FLOW_STARTED = "flow_started";
  public static final String FLOW_COMPLETED = "flow_completed";
  public static final String FLOW_ABANDONED = "flow_abandoned";
  public static final String STEP_VIEWED = "step_viewed";
  public static final String STEP_COMPLETED = "step_completed";
  public static final String STEP_SKIPPED = "step_skipped";
  public static final String STEP_SLOW = "step_slow";
  public static final String NAVIGATION_BACK = "navigation_back";
  public static final String PROGRESS_MILESTONE = "progress_milestone";
  public static final String ERROR = "error";

  private final String type;
  private final String engineId;
  private final String flowId;
  private final String stepId;
  private final long timestampMillis;
  private final Map<String, Object> properties;

  AnalyticsEvent(final String type, final String engineId, final String flowId,
      final String stepId, final long timestampMillis, final Map<String, Object> properties) {
    this.type = type;
    this.engineId = engineId;
    this.flowId = flowId;
    this.stepId = stepId;
    this.timestampMillis = timestampMillis;
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public String getType() {
    return type;
  }

  public String getEngineId() {
    return engineId;
  }

  public String getFlowId() {
    return flowId;
  }

  /**
   * Null for flow-level events.
   */
  public String getStepId() {
    return stepId;
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public Object getProperty(final String key) {
    return properties.get(key);
  }

  @Override
  public String toString() {
    return "AnalyticsEvent [type=" + type + ", flowId=" + flowId + ", stepId=" + stepId
        + ", properties=" + properties + "]";
  }
}
