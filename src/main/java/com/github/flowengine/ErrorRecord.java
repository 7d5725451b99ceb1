package com.github.flowengine;

import java.util.Map;

/**
 * Diagnostic entry kept by the {@link ErrorHandler} and published as the {@code error} event
 * payload. The context snapshot has sensitive values redacted.
 */
public final class ErrorRecord {
  private final FlowEngineException error;
  private final ErrorKind kind;
  private final String operation;
  private final String stepId;
  private final long timestampMillis = System.currentTimeMillis();
  private final Map<String, Object> contextSnapshot;

  ErrorRecord(final FlowEngineException error, final ErrorKind kind, final String operation,
      final String stepId, final Map<String, Object> contextSnapshot) {
    this.error = error;
    this.kind = kind;
    this.operation = operation;
    this.stepId = stepId;
    this.contextSnapshot = contextSnapshot;
  }

  public FlowEngineException getError() {
    return error;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getOperation() {
    return operation;
  }

  public String getStepId() {
    return stepId;
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  public Map<String, Object> getContextSnapshot() {
    return contextSnapshot;
  }

  @Override
  public String toString() {
    return "ErrorRecord [kind=" + kind + ", code=" + error.getCode() + ", operation=" + operation
        + ", stepId=" + stepId + ", message=" + error.getMessage() + "]";
  }
}
