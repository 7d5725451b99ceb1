package com.github.flowengine;

/**
 * Payload of {@code persistenceSuccess} and {@code persistenceFailure}. Fired once per handler
 * invocation after the final attempt.
 */
public final class PersistenceEvent {

  public static enum Operation {
    LOAD, PERSIST, CLEAR;
  }

  private final Operation operation;
  private final String stepId;
  private final int attempts;
  private final FlowEngineException error;
  private final FlowContext context;

  PersistenceEvent(final Operation operation, final String stepId, final int attempts,
      final FlowEngineException error, final FlowContext context) {
    this.operation = operation;
    this.stepId = stepId;
    this.attempts = attempts;
    this.error = error;
    this.context = context;
  }

  public Operation getOperation() {
    return operation;
  }

  public String getStepId() {
    return stepId;
  }

  public int getAttempts() {
    return attempts;
  }

  public FlowEngineException getError() {
    return error;
  }

  public FlowContext getContext() {
    return context;
  }

  @Override
  public String toString() {
    return "PersistenceEvent [operation=" + operation + ", stepId=" + stepId + ", attempts="
        + attempts + ", error=" + error + "]";
  }
}
