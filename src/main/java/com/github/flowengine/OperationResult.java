package com.github.flowengine;

/**
 * This object encapsulates the result of a fallible engine operation.
 * 
 * Typically, successes are encoded with {@link #successful} being set to true and may carry a
 * {@link #value}. Failures are expected to report {@link #isSuccessful()} as false and carry an
 * associated {@link #error}. {@link #description} is optional.
 * 
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class OperationResult<T> {
  private final boolean successful;
  private final T value;
  private final String description;
  private final FlowEngineException error;

  private OperationResult(final boolean successful, final T value, final String description,
      final FlowEngineException error) {
    this.successful = successful;
    this.value = value;
    this.description = description;
    this.error = error;
  }

  public static <T> OperationResult<T> success(final T value) {
    return new OperationResult<>(true, value, null, null);
  }

  public static <T> OperationResult<T> success(final T value, final String description) {
    return new OperationResult<>(true, value, description, null);
  }

  public static <T> OperationResult<T> failure(final FlowEngineException error) {
    return new OperationResult<>(false, null, error.getMessage(), error);
  }

  public static <T> OperationResult<T> failure(final FlowEngineException.Code code,
      final String description) {
    return failure(new FlowEngineException(code, description));
  }

  /**
   * Re-types a failed result so it can be passed up through a caller with a different value type.
   */
  public <U> OperationResult<U> propagate() {
    if (successful) {
      throw new IllegalStateException("Only failed results can be propagated");
    }
    return new OperationResult<>(false, null, description, error);
  }

  public boolean isSuccessful() {
    return successful;
  }

  public T getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  public FlowEngineException getError() {
    return error;
  }

  @Override
  public String toString() {
    return "OperationResult [successful=" + successful + ", value=" + value + ", description="
        + description + ", error=" + error + "]";
  }
}
