package com.github.flowengine;

/**
 * Unified single exception that's thrown and handled by this engine. The idea is to use the code
 * enum to encapsulate various error/exception conditions and their {@link ErrorKind}. That said,
 * stack traces, where available and desired, are not meant to be kept from users.
 */
public final class FlowEngineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FlowEngineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FlowEngineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FlowEngineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public FlowEngineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public ErrorKind getKind() {
    return code.getKind();
  }

  public static enum Code {
    // 1.
    INVALID_ENGINE_CONFIG(ErrorKind.PRECONDITION, "Flow engine configuration is invalid"),
    // 2.
    INVALID_STEP(ErrorKind.PRECONDITION, "Step definition is invalid"),
    // 3.
    STEP_NOT_FOUND(ErrorKind.PRECONDITION, "No step exists with the requested id"),
    // 4.
    STEP_NOT_SKIPPABLE(ErrorKind.PRECONDITION, "Current step is not skippable"),
    // 5.
    CHECKLIST_STEP_INVALID(ErrorKind.PRECONDITION, "Target step does not support checklist items"),
    // 6.
    CHECKLIST_ITEM_NOT_FOUND(ErrorKind.PRECONDITION, "Checklist item does not exist on the step"),
    // 7.
    CHECKLIST_INCOMPLETE(ErrorKind.PRECONDITION,
        "Checklist completion criteria are not met, cannot advance"),
    // 8.
    ENGINE_ERRORED(ErrorKind.PRECONDITION,
        "Flow engine is in errored state and refuses navigation until reset"),
    // 9.
    ENGINE_SHUT_DOWN(ErrorKind.PRECONDITION, "Flow engine is shut down and cannot service requests"),
    // 10.
    NAVIGATION_RESOLUTION_FAILURE(ErrorKind.RESOLUTION, "Failed to resolve navigation target"),
    // 11.
    NAVIGATION_LISTENER_FAILURE(ErrorKind.RESOLUTION,
        "A beforeStepChange listener failed, transition aborted"),
    // 12.
    HOOK_FAILURE(ErrorKind.SIDE_EFFECT, "Step lifecycle hook failed"),
    // 13.
    PERSISTENCE_FAILURE(ErrorKind.SIDE_EFFECT, "Failed to persist or clear flow data"),
    // 14.
    DATA_LOAD_FAILURE(ErrorKind.FATAL, "Failed to load persisted flow data"),
    // 15.
    PLUGIN_FAILURE(ErrorKind.SIDE_EFFECT, "Plugin failed to install or uninstall"),
    // 16.
    PLUGIN_ALREADY_INSTALLED(ErrorKind.PRECONDITION, "Plugin with the same name is installed"),
    // 17.
    PLUGIN_DEPENDENCY_MISSING(ErrorKind.PRECONDITION, "Plugin dependency is not installed"),
    // 18.
    PLUGIN_IN_USE(ErrorKind.PRECONDITION, "Plugin is a dependency of other installed plugins"),
    // 19.
    PLUGIN_NOT_FOUND(ErrorKind.PRECONDITION, "No plugin is installed under the given name"),
    // 20.
    INVARIANT_VIOLATION(ErrorKind.FATAL, "Internal engine invariant was violated"),
    // 21.
    OPERATION_CANCELLED(ErrorKind.SIDE_EFFECT, "Queued operation was cancelled"),
    // 22.
    INTERRUPTED(ErrorKind.SIDE_EFFECT, "Flow engine was interrupted"),
    // 23.
    UNKNOWN_FAILURE(ErrorKind.SIDE_EFFECT,
        "Flow engine failed. Check exception stacktrace for more details of the failure");

    private final ErrorKind kind;
    private final String description;

    private Code(final ErrorKind kind, final String description) {
      this.kind = kind;
      this.description = description;
    }

    public ErrorKind getKind() {
      return kind;
    }

    public String getDescription() {
      return description;
    }
  }

}
