package com.github.flowengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns engine events into {@link AnalyticsEvent}s for a set of {@link AnalyticsProvider}s.
 *
 * Notes:<br>
 * 1. progress milestones (25/50/75/100 percent by default) are reported once per installation<br>
 * 2. a step that stays active longer than the slow-step threshold is reported as
 * {@code step_slow} when it completes<br>
 * 3. a failing provider is logged and skipped, it never affects other providers or the engine<br>
 * 4. milestone and timing state starts over on every install, which includes reinstalls after an
 * engine reset<br>
 *
 * @author gaurav
 */
public final class AnalyticsPlugin extends BasePlugin {
  private static final Logger logger = LogManager.getLogger(AnalyticsPlugin.class.getSimpleName());

  public static final String NAME = "analytics";
  public static final long DEFAULT_SLOW_STEP_MILLIS = 3000L;
  private static final int[] defaultMilestones = {25, 50, 75, 100};

  private final List<AnalyticsProvider> providers;
  private final long slowStepMillis;
  private final int[] milestones;

  // all guarded by this
  private final TreeSet<Integer> reachedMilestones = new TreeSet<>();
  private final Map<String, Long> activations = new HashMap<>();
  private String engineId;
  private String flowId;

  public AnalyticsPlugin(final AnalyticsProvider... providers) {
    this(Arrays.asList(providers), DEFAULT_SLOW_STEP_MILLIS, defaultMilestones);
  }

  public AnalyticsPlugin(final List<AnalyticsProvider> providers, final long slowStepMillis,
      final int... milestones) {
    super(NAME, "1.0.0");
    if (providers == null || providers.isEmpty() || providers.contains(null)) {
      throw new IllegalArgumentException("At least one non-null analytics provider is required");
    }
    if (slowStepMillis < 0) {
      throw new IllegalArgumentException("slowStepMillis cannot be negative");
    }
    final int[] sorted = milestones.clone();
    Arrays.sort(sorted);
    for (final int milestone : sorted) {
      if (milestone < 1 || milestone > 100) {
        throw new IllegalArgumentException("Milestone " + milestone + " is not within 1..100");
      }
    }
    this.providers = Collections.unmodifiableList(new ArrayList<>(providers));
    this.slowStepMillis = slowStepMillis;
    this.milestones = sorted;
  }

  @Override
  protected void onInstall() {
    synchronized (this) {
      reachedMilestones.clear();
      activations.clear();
      engineId = getEngine().getId();
      flowId = getEngine().getConfiguration().getFlowId();
    }
    on(EventType.FLOW_STARTED, new FlowEventListener<FlowLifecycleEvent>() {
      @Override
      public void onEvent(final FlowLifecycleEvent event) {
        track(AnalyticsEvent.FLOW_STARTED, event.getStepId(), noProperties());
      }
    });
    on(EventType.STEP_ACTIVE, new FlowEventListener<StepEvent>() {
      @Override
      public void onEvent(final StepEvent event) {
        synchronized (AnalyticsPlugin.this) {
          activations.put(event.getStep().getId(), event.getTimestampMillis());
        }
        track(AnalyticsEvent.STEP_VIEWED, event.getStep().getId(), noProperties());
      }
    });
    on(EventType.STEP_COMPLETED, new FlowEventListener<StepEvent>() {
      @Override
      public void onEvent(final StepEvent event) {
        stepCompleted(event);
      }
    });
    on(EventType.STEP_SKIPPED, new FlowEventListener<StepEvent>() {
      @Override
      public void onEvent(final StepEvent event) {
        synchronized (AnalyticsPlugin.this) {
          activations.remove(event.getStep().getId());
        }
        track(AnalyticsEvent.STEP_SKIPPED, event.getStep().getId(), noProperties());
      }
    });
    on(EventType.NAVIGATION_BACK, new FlowEventListener<NavigationEvent>() {
      @Override
      public void onEvent(final NavigationEvent event) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("to_step", event.getToStep().getId());
        track(AnalyticsEvent.NAVIGATION_BACK, event.getFromStep().getId(), properties);
      }
    });
    on(EventType.STATE_CHANGE, new FlowEventListener<EngineState>() {
      @Override
      public void onEvent(final EngineState state) {
        progressChanged(state.getProgressPercentage());
      }
    });
    on(EventType.FLOW_COMPLETED, new FlowEventListener<FlowLifecycleEvent>() {
      @Override
      public void onEvent(final FlowLifecycleEvent event) {
        track(AnalyticsEvent.FLOW_COMPLETED, null, duration(event.getDurationMillis()));
      }
    });
    on(EventType.FLOW_ABANDONED, new FlowEventListener<FlowLifecycleEvent>() {
      @Override
      public void onEvent(final FlowLifecycleEvent event) {
        track(AnalyticsEvent.FLOW_ABANDONED, event.getStepId(),
            duration(event.getDurationMillis()));
      }
    });
    on(EventType.ERROR, new FlowEventListener<ErrorRecord>() {
      @Override
      public void onEvent(final ErrorRecord record) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("kind", record.getKind().name());
        properties.put("code", record.getError().getCode().name());
        properties.put("operation", record.getOperation());
        track(AnalyticsEvent.ERROR, record.getStepId(), properties);
      }
    });
  }

  @Override
  protected void onUninstall() {
    for (final AnalyticsProvider provider : providers) {
      try {
        provider.flush();
      } catch (Exception flushFailure) {
        logger.warn("Analytics provider " + provider.getName() + " failed to flush",
            flushFailure);
      }
    }
  }

  /**
   * Milestones reached since the last install, ascending.
   */
  public synchronized List<Integer> getReachedMilestones() {
    return Collections.unmodifiableList(new ArrayList<>(reachedMilestones));
  }

  private void stepCompleted(final StepEvent event) {
    final String stepId = event.getStep().getId();
    final Long activatedAt;
    synchronized (this) {
      activatedAt = activations.remove(stepId);
    }
    if (activatedAt == null) {
      track(AnalyticsEvent.STEP_COMPLETED, stepId, noProperties());
      return;
    }
    final long durationMillis = Math.max(0L, event.getTimestampMillis() - activatedAt);
    track(AnalyticsEvent.STEP_COMPLETED, stepId, duration(durationMillis));
    if (durationMillis > slowStepMillis) {
      final Map<String, Object> properties = duration(durationMillis);
      properties.put("threshold_ms", slowStepMillis);
      track(AnalyticsEvent.STEP_SLOW, stepId, properties);
    }
  }

  private void progressChanged(final int progressPercentage) {
    final List<Integer> reachedNow = new ArrayList<>();
    synchronized (this) {
      for (final int milestone : milestones) {
        if (progressPercentage >= milestone && reachedMilestones.add(milestone)) {
          reachedNow.add(milestone);
        }
      }
    }
    for (final Integer milestone : reachedNow) {
      final Map<String, Object> properties = new LinkedHashMap<>();
      properties.put("milestone", milestone);
      properties.put("progress", progressPercentage);
      track(AnalyticsEvent.PROGRESS_MILESTONE, null, properties);
    }
  }

  private void track(final String type, final String stepId,
      final Map<String, Object> properties) {
    final AnalyticsEvent event;
    synchronized (this) {
      event = new AnalyticsEvent(type, engineId, flowId, stepId, System.currentTimeMillis(),
          properties);
    }
    for (final AnalyticsProvider provider : providers) {
      try {
        provider.trackEvent(event);
      } catch (Exception trackFailure) {
        logger.warn("Analytics provider " + provider.getName() + " failed on " + type,
            trackFailure);
      }
    }
  }

  private static Map<String, Object> duration(final long durationMillis) {
    final Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("duration_ms", durationMillis);
    return properties;
  }

  private static Map<String, Object> noProperties() {
    return Collections.emptyMap();
  }
}
