package com.github.flowengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The reserved {@code _internal} region of a {@link FlowContext}. Completion and activation
 * timestamps are keyed by step id and written once: later writes for the same step are ignored.
 */
public final class FlowInternals {
  private final long startedAt;
  private final Map<String, Long> completedSteps;
  private final Map<String, Long> stepStartTimes;

  FlowInternals(final long startedAt) {
    this(startedAt, Collections.<String, Long>emptyMap(), Collections.<String, Long>emptyMap());
  }

  private FlowInternals(final long startedAt, final Map<String, Long> completedSteps,
      final Map<String, Long> stepStartTimes) {
    this.startedAt = startedAt;
    this.completedSteps = completedSteps;
    this.stepStartTimes = stepStartTimes;
  }

  public long getStartedAt() {
    return startedAt;
  }

  public Map<String, Long> getCompletedSteps() {
    return completedSteps;
  }

  public Map<String, Long> getStepStartTimes() {
    return stepStartTimes;
  }

  public boolean isStepCompleted(final String stepId) {
    return completedSteps.containsKey(stepId);
  }

  FlowInternals withStepCompleted(final String stepId, final long timestamp) {
    if (completedSteps.containsKey(stepId)) {
      return this;
    }
    return new FlowInternals(startedAt, append(completedSteps, stepId, timestamp), stepStartTimes);
  }

  FlowInternals withStepStarted(final String stepId, final long timestamp) {
    if (stepStartTimes.containsKey(stepId)) {
      return this;
    }
    return new FlowInternals(startedAt, completedSteps, append(stepStartTimes, stepId, timestamp));
  }

  /**
   * Carries forward timestamps recorded by a previous session, keeping entries already present.
   */
  FlowInternals absorb(final FlowInternals restored) {
    FlowInternals merged = new FlowInternals(Math.min(startedAt, restored.startedAt),
        completedSteps, stepStartTimes);
    for (final Map.Entry<String, Long> entry : restored.completedSteps.entrySet()) {
      merged = merged.withStepCompleted(entry.getKey(), entry.getValue());
    }
    for (final Map.Entry<String, Long> entry : restored.stepStartTimes.entrySet()) {
      merged = merged.withStepStarted(entry.getKey(), entry.getValue());
    }
    return merged;
  }

  static FlowInternals restore(final long startedAt, final Map<String, Long> completedSteps,
      final Map<String, Long> stepStartTimes) {
    return new FlowInternals(startedAt,
        Collections.unmodifiableMap(new LinkedHashMap<>(completedSteps)),
        Collections.unmodifiableMap(new LinkedHashMap<>(stepStartTimes)));
  }

  private static Map<String, Long> append(final Map<String, Long> source, final String key,
      final long value) {
    final Map<String, Long> copy = new LinkedHashMap<>(source);
    copy.put(key, value);
    return Collections.unmodifiableMap(copy);
  }

  @Override
  public int hashCode() {
    int result = 1;
    result = 31 * result + Long.hashCode(startedAt);
    result = 31 * result + completedSteps.hashCode();
    result = 31 * result + stepStartTimes.hashCode();
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
    final FlowInternals other = (FlowInternals) obj;
    return startedAt == other.startedAt && completedSteps.equals(other.completedSteps)
        && stepStartTimes.equals(other.stepStartTimes);
  }

  @Override
  public String toString() {
    return "FlowInternals [startedAt=" + startedAt + ", completedSteps=" + completedSteps
        + ", stepStartTimes=" + stepStartTimes + "]";
  }
}
