package com.github.flowengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

import com.github.flowengine.FlowEngineException.Code;

/**
 * This object represents immutable metadata about one node of a flow: its identity, navigation
 * rules, visibility condition and lifecycle hooks. Use {@link #newBuilder(String)} to build one.
 * 
 * Notes:<br>
 * 1. navigation fields left unset fall back to step order<br>
 * 2. a step that is not skippable never exposes a skipToStep, one supplied to the builder is
 * dropped<br>
 * 3. steps are compared by id only<br>
 */
public final class Step {
  private final String id;
  private final StepType type;
  private final Object payload;
  private final NavigationTarget nextStep;
  private final NavigationTarget previousStep;
  private final NavigationTarget skipToStep;
  private final boolean skippable;
  private final boolean skipToStepDropped;
  private final Predicate<FlowContext> condition;
  private final StepActiveHook onStepActive;
  private final StepCompleteHook onStepComplete;
  private final Map<String, Object> meta;

  private Step(final Builder builder) {
    this.id = builder.id;
    this.type = builder.type;
    this.payload = builder.payload;
    this.nextStep = builder.nextStep;
    this.previousStep = builder.previousStep;
    this.skippable = builder.skippable;
    this.skipToStep = builder.skippable ? builder.skipToStep : null;
    this.skipToStepDropped = !builder.skippable && builder.skipToStep != null;
    this.condition = builder.condition;
    this.onStepActive = builder.onStepActive;
    this.onStepComplete = builder.onStepComplete;
    this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
  }

  public String getId() {
    return id;
  }

  public StepType getType() {
    return type;
  }

  public Object getPayload() {
    return payload;
  }

  public NavigationTarget getNextStep() {
    return nextStep;
  }

  public NavigationTarget getPreviousStep() {
    return previousStep;
  }

  public NavigationTarget getSkipToStep() {
    return skipToStep;
  }

  public boolean isSkippable() {
    return skippable;
  }

  boolean isSkipToStepDropped() {
    return skipToStepDropped;
  }

  public Predicate<FlowContext> getCondition() {
    return condition;
  }

  public StepActiveHook getOnStepActive() {
    return onStepActive;
  }

  public StepCompleteHook getOnStepComplete() {
    return onStepComplete;
  }

  public Map<String, Object> getMeta() {
    return meta;
  }

  /**
   * Report if this step is visible for the given context. Exceptions thrown by the condition
   * propagate to the caller.
   */
  public boolean isEligible(final FlowContext context) {
    return condition == null || condition.test(context);
  }

  public static Builder newBuilder(final String id) {
    return new Builder(id);
  }

  public static Builder newBuilder(final int id) {
    return new Builder(String.valueOf(id));
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return id.equals(((Step) obj).id);
  }

  @Override
  public String toString() {
    return "Step [id=" + id + ", type=" + type + "]";
  }

  public final static class Builder {
    private final String id;
    private StepType type = StepType.INFORMATION;
    private Object payload;
    private NavigationTarget nextStep;
    private NavigationTarget previousStep;
    private NavigationTarget skipToStep;
    private boolean skippable;
    private Predicate<FlowContext> condition;
    private StepActiveHook onStepActive;
    private StepCompleteHook onStepComplete;
    private final Map<String, Object> meta = new LinkedHashMap<>();

    public Builder type(final StepType type) {
      this.type = type;
      return this;
    }

    public Builder payload(final Object payload) {
      this.payload = payload;
      return this;
    }

    public Builder nextStep(final String stepId) {
      this.nextStep = NavigationTarget.step(stepId);
      return this;
    }

    public Builder nextStep(final StepRouter router) {
      this.nextStep = NavigationTarget.dynamic(router);
      return this;
    }

    public Builder nextStep(final NavigationTarget target) {
      this.nextStep = target;
      return this;
    }

    public Builder previousStep(final String stepId) {
      this.previousStep = NavigationTarget.step(stepId);
      return this;
    }

    public Builder previousStep(final StepRouter router) {
      this.previousStep = NavigationTarget.dynamic(router);
      return this;
    }

    public Builder previousStep(final NavigationTarget target) {
      this.previousStep = target;
      return this;
    }

    public Builder skipToStep(final String stepId) {
      this.skipToStep = NavigationTarget.step(stepId);
      return this;
    }

    public Builder skipToStep(final StepRouter router) {
      this.skipToStep = NavigationTarget.dynamic(router);
      return this;
    }

    public Builder skipToStep(final NavigationTarget target) {
      this.skipToStep = target;
      return this;
    }

    public Builder skippable(final boolean skippable) {
      this.skippable = skippable;
      return this;
    }

    public Builder condition(final Predicate<FlowContext> condition) {
      this.condition = condition;
      return this;
    }

    public Builder onStepActive(final StepActiveHook onStepActive) {
      this.onStepActive = onStepActive;
      return this;
    }

    public Builder onStepComplete(final StepCompleteHook onStepComplete) {
      this.onStepComplete = onStepComplete;
      return this;
    }

    public Builder meta(final String key, final Object value) {
      this.meta.put(key, value);
      return this;
    }

    public Step build() throws FlowEngineException {
      if (id == null || id.trim().isEmpty()) {
        throw new FlowEngineException(Code.INVALID_STEP, "Step id cannot be null or blank");
      }
      if (type == null) {
        throw new FlowEngineException(Code.INVALID_STEP, "Step " + id + " has a null type");
      }
      return new Step(this);
    }

    private Builder(final String id) {
      this.id = id;
    }
  }
}
