package com.github.flowengine;

/**
 * Read-only snapshot of an engine, recomputed in full from the engine's fields whenever it is
 * requested or published. Derived flags are never patched incrementally.
 */
public final class EngineState {
  private final String flowId;
  private final String flowName;
  private final String flowVersion;
  private final EngineStatus status;
  private final Step currentStep;
  private final FlowContext context;
  private final boolean loading;
  private final boolean hydrating;
  private final boolean completed;
  private final FlowEngineException error;
  private final boolean firstStep;
  private final boolean lastStep;
  private final boolean canGoNext;
  private final boolean canGoPrevious;
  private final boolean skippable;
  private final Step nextStepCandidate;
  private final Step previousStepCandidate;
  private final int totalSteps;
  private final int completedSteps;
  private final int progressPercentage;
  private final int currentStepNumber;
  private final int pendingOperations;

  private EngineState(final Builder builder) {
    this.flowId = builder.flowId;
    this.flowName = builder.flowName;
    this.flowVersion = builder.flowVersion;
    this.status = builder.status;
    this.currentStep = builder.currentStep;
    this.context = builder.context;
    this.loading = builder.loading;
    this.hydrating = builder.hydrating;
    this.completed = builder.completed;
    this.error = builder.error;
    this.firstStep = builder.firstStep;
    this.lastStep = builder.lastStep;
    this.canGoNext = builder.canGoNext;
    this.canGoPrevious = builder.canGoPrevious;
    this.skippable = builder.skippable;
    this.nextStepCandidate = builder.nextStepCandidate;
    this.previousStepCandidate = builder.previousStepCandidate;
    this.totalSteps = builder.totalSteps;
    this.completedSteps = builder.completedSteps;
    this.progressPercentage = builder.progressPercentage;
    this.currentStepNumber = builder.currentStepNumber;
    this.pendingOperations = builder.pendingOperations;
  }

  public String getFlowId() {
    return flowId;
  }

  public String getFlowName() {
    return flowName;
  }

  public String getFlowVersion() {
    return flowVersion;
  }

  public EngineStatus getStatus() {
    return status;
  }

  public Step getCurrentStep() {
    return currentStep;
  }

  public FlowContext getContext() {
    return context;
  }

  public boolean isLoading() {
    return loading;
  }

  public boolean isHydrating() {
    return hydrating;
  }

  public boolean isCompleted() {
    return completed;
  }

  public FlowEngineException getError() {
    return error;
  }

  public boolean isFirstStep() {
    return firstStep;
  }

  public boolean isLastStep() {
    return lastStep;
  }

  public boolean canGoNext() {
    return canGoNext;
  }

  public boolean canGoPrevious() {
    return canGoPrevious;
  }

  public boolean isSkippable() {
    return skippable;
  }

  public Step getNextStepCandidate() {
    return nextStepCandidate;
  }

  public Step getPreviousStepCandidate() {
    return previousStepCandidate;
  }

  public int getTotalSteps() {
    return totalSteps;
  }

  public int getCompletedSteps() {
    return completedSteps;
  }

  public int getProgressPercentage() {
    return progressPercentage;
  }

  public int getCurrentStepNumber() {
    return currentStepNumber;
  }

  public int getPendingOperations() {
    return pendingOperations;
  }

  @Override
  public String toString() {
    return "EngineState [flowId=" + flowId + ", status=" + status + ", currentStep="
        + (currentStep == null ? null : currentStep.getId()) + ", completed=" + completed
        + ", progressPercentage=" + progressPercentage + ", currentStepNumber=" + currentStepNumber
        + "/" + totalSteps + ", error=" + error + "]";
  }

  static Builder newBuilder() {
    return new Builder();
  }

  final static class Builder {
    private String flowId;
    private String flowName;
    private String flowVersion;
    private EngineStatus status;
    private Step currentStep;
    private FlowContext context;
    private boolean loading;
    private boolean hydrating;
    private boolean completed;
    private FlowEngineException error;
    private boolean firstStep;
    private boolean lastStep;
    private boolean canGoNext;
    private boolean canGoPrevious;
    private boolean skippable;
    private Step nextStepCandidate;
    private Step previousStepCandidate;
    private int totalSteps;
    private int completedSteps;
    private int progressPercentage;
    private int currentStepNumber;
    private int pendingOperations;

    Builder identity(final String flowId, final String flowName, final String flowVersion) {
      this.flowId = flowId;
      this.flowName = flowName;
      this.flowVersion = flowVersion;
      return this;
    }

    Builder status(final EngineStatus status) {
      this.status = status;
      return this;
    }

    Builder currentStep(final Step currentStep) {
      this.currentStep = currentStep;
      return this;
    }

    Builder context(final FlowContext context) {
      this.context = context;
      return this;
    }

    Builder loading(final boolean loading) {
      this.loading = loading;
      return this;
    }

    Builder hydrating(final boolean hydrating) {
      this.hydrating = hydrating;
      return this;
    }

    Builder completed(final boolean completed) {
      this.completed = completed;
      return this;
    }

    Builder error(final FlowEngineException error) {
      this.error = error;
      return this;
    }

    Builder firstStep(final boolean firstStep) {
      this.firstStep = firstStep;
      return this;
    }

    Builder lastStep(final boolean lastStep) {
      this.lastStep = lastStep;
      return this;
    }

    Builder canGoNext(final boolean canGoNext) {
      this.canGoNext = canGoNext;
      return this;
    }

    Builder canGoPrevious(final boolean canGoPrevious) {
      this.canGoPrevious = canGoPrevious;
      return this;
    }

    Builder skippable(final boolean skippable) {
      this.skippable = skippable;
      return this;
    }

    Builder candidates(final Step nextStepCandidate, final Step previousStepCandidate) {
      this.nextStepCandidate = nextStepCandidate;
      this.previousStepCandidate = previousStepCandidate;
      return this;
    }

    Builder progress(final int totalSteps, final int completedSteps, final int currentStepNumber) {
      this.totalSteps = totalSteps;
      this.completedSteps = completedSteps;
      this.currentStepNumber = currentStepNumber;
      this.progressPercentage =
          totalSteps == 0 ? 0 : Math.round(completedSteps * 100f / totalSteps);
      return this;
    }

    Builder pendingOperations(final int pendingOperations) {
      this.pendingOperations = pendingOperations;
      return this;
    }

    EngineState build() {
      return new EngineState(this);
    }

    private Builder() {}
  }
}
