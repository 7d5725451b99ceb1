package com.github.flowengine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Simple statistics holder for an engine's flow.
 */
public final class FlowStatistics {
  static final int maxRouteLength = 100;

  private final String engineId;
  private final long startMillis = System.currentTimeMillis();
  private int transitionSuccesses;
  private int transitionFailures;
  private int transitionCancellations;
  // used to track activity level of a flow
  private long lastTouchTimeMillis;
  // bounded at maxRouteLength, oldest entries dropped first
  private final Deque<StepTimePair> boundedStepRoute = new ArrayDeque<>();

  FlowStatistics(final String engineId) {
    this.engineId = engineId;
  }

  public String getEngineId() {
    return engineId;
  }

  public synchronized int getTransitionSuccesses() {
    return transitionSuccesses;
  }

  public synchronized int getTransitionFailures() {
    return transitionFailures;
  }

  public synchronized int getTransitionCancellations() {
    return transitionCancellations;
  }

  public synchronized long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  /**
   * The last {@value #maxRouteLength} step activations, oldest first.
   */
  public synchronized StepTimePair[] getStepRoute() {
    final StepTimePair[] route = new StepTimePair[boundedStepRoute.size()];
    int index = 0;
    final long now = System.currentTimeMillis();
    for (final StepTimePair pair : boundedStepRoute) {
      route[index++] = pair.copy(now);
    }
    return route;
  }

  synchronized void recordActivation(final String stepId) {
    final long now = System.currentTimeMillis();
    closeCurrent(now);
    if (stepId != null) {
      boundedStepRoute.addLast(new StepTimePair(stepId, now));
      while (boundedStepRoute.size() > maxRouteLength) {
        boundedStepRoute.removeFirst();
      }
    }
    transitionSuccesses++;
    lastTouchTimeMillis = now;
  }

  synchronized void recordFailure() {
    transitionFailures++;
    lastTouchTimeMillis = System.currentTimeMillis();
  }

  synchronized void recordCancellation() {
    transitionCancellations++;
    lastTouchTimeMillis = System.currentTimeMillis();
  }

  private void closeCurrent(final long now) {
    final StepTimePair current = boundedStepRoute.peekLast();
    if (current != null && current.elapsedMillis < 0L) {
      current.elapsedMillis = now - current.startMillis;
    }
  }

  @Override
  public synchronized String toString() {
    return "FlowStatistics [engineId=" + engineId + ", transitionSuccesses="
        + transitionSuccesses + ", transitionFailures=" + transitionFailures
        + ", transitionCancellations=" + transitionCancellations + ", lastTouchTimeMillis="
        + lastTouchTimeMillis + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

  public final static class StepTimePair {
    public final String stepId;
    public final long startMillis;
    // -1 while the step is still current
    public long elapsedMillis = -1L;

    private StepTimePair(final String stepId, final long startMillis) {
      this.stepId = stepId;
      this.startMillis = startMillis;
    }

    private StepTimePair copy(final long now) {
      final StepTimePair copy = new StepTimePair(stepId, startMillis);
      copy.elapsedMillis = elapsedMillis < 0L ? now - startMillis : elapsedMillis;
      return copy;
    }

    @Override
    public String toString() {
      return "StepTimePair [stepId=" + stepId + ", elapsedMillis=" + elapsedMillis + "]";
    }
  }

}
