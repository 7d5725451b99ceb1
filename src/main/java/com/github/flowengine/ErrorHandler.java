package com.github.flowengine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Classifies failures, turns them into {@link OperationResult}s and keeps a bounded history of
 * recent {@link ErrorRecord}s with a redacted context snapshot.
 * 
 * Every reported error is first offered to the engine's {@link ErrorSink}. An accepted error is
 * appended to the history, logged and published as the {@code error} event, in that order. A
 * refused one is only logged at debug level.
 */
final class ErrorHandler {
  static final int DEFAULT_HISTORY_SIZE = 50;
  static final String REDACTED = "[REDACTED]";
  private static final String[] sensitiveKeyFragments =
      {"password", "secret", "token", "apikey", "api_key", "ssn", "credential"};

  /**
   * Receives every reported error before it is recorded. The engine uses this to move to ERRORED
   * on fatal errors and to refuse errors raised by operations a reset abandoned.
   */
  interface ErrorSink {
    boolean accept(final ErrorRecord record);
  }

  private final FlowLogger logger;
  private final EventBus eventBus;
  private final int maxHistory;
  private final ErrorSink sink;

  // guarded by itself
  private final Deque<ErrorRecord> history = new ArrayDeque<>();

  ErrorHandler(final FlowLogger logger, final EventBus eventBus, final int maxHistory,
      final ErrorSink sink) {
    this.logger = logger;
    this.eventBus = eventBus;
    this.maxHistory = maxHistory > 0 ? maxHistory : DEFAULT_HISTORY_SIZE;
    this.sink = sink;
  }

  /**
   * Normalize any throwable into a {@link FlowEngineException}. Wrapper exceptions from futures are
   * unwrapped first. JVM errors are treated as invariant violations.
   */
  static FlowEngineException wrap(final Throwable error, final Code fallbackCode) {
    final Throwable cause = unwrap(error);
    if (cause instanceof FlowEngineException) {
      return (FlowEngineException) cause;
    }
    if (cause instanceof Error) {
      return new FlowEngineException(Code.INVARIANT_VIOLATION, cause);
    }
    if (cause instanceof InterruptedException) {
      return new FlowEngineException(Code.INTERRUPTED, cause);
    }
    if (cause instanceof CancellationException) {
      return new FlowEngineException(Code.OPERATION_CANCELLED, cause);
    }
    return new FlowEngineException(fallbackCode, String.valueOf(cause.getMessage()), cause);
  }

  static ErrorKind classify(final Throwable error, final Code fallbackCode) {
    return wrap(error, fallbackCode).getKind();
  }

  static Throwable unwrap(final Throwable error) {
    Throwable current = error;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  ErrorRecord report(final Throwable error, final Code fallbackCode, final String operation,
      final FlowContext context, final String stepId) {
    final FlowEngineException wrapped = wrap(error, fallbackCode);
    final ErrorRecord record =
        new ErrorRecord(wrapped, wrapped.getKind(), operation, stepId, redact(context));
    if (sink != null && !sink.accept(record)) {
      logger.debug("Discarded " + record.getKind() + " error during " + operation + " at step "
          + stepId + ": " + wrapped.getMessage());
      return record;
    }
    synchronized (history) {
      history.addLast(record);
      while (history.size() > maxHistory) {
        history.removeFirst();
      }
    }
    if (record.getKind() == ErrorKind.FATAL) {
      logger.error("Fatal error during " + operation + " at step " + stepId, wrapped);
    } else {
      logger.warn(record.getKind() + " error during " + operation + " at step " + stepId + ": "
          + wrapped.getMessage());
    }
    eventBus.publish(EventType.ERROR, record);
    return record;
  }

  <T> OperationResult<T> fail(final FlowEngineException error, final String operation,
      final FlowContext context, final String stepId) {
    report(error, error.getCode(), operation, context, stepId);
    return OperationResult.failure(error);
  }

  /**
   * Run a fallible call, reporting and converting any failure into a failed result.
   */
  <T> OperationResult<T> safeExecute(final Callable<T> operation, final Code fallbackCode,
      final String operationName, final FlowContext context, final String stepId) {
    try {
      return OperationResult.success(operation.call());
    } catch (Throwable failure) {
      if (unwrap(failure) instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      final ErrorRecord record = report(failure, fallbackCode, operationName, context, stepId);
      return OperationResult.failure(record.getError());
    }
  }

  List<ErrorRecord> getErrorHistory() {
    synchronized (history) {
      return Collections.unmodifiableList(new ArrayList<>(history));
    }
  }

  void clearErrorHistory() {
    synchronized (history) {
      history.clear();
    }
  }

  static Map<String, Object> redact(final FlowContext context) {
    if (context == null) {
      return Collections.emptyMap();
    }
    final Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("flowData", redactMap(context.getFlowData()));
    snapshot.put("attributes", redactMap(context.getAttributes()));
    snapshot.put("currentUser", context.getCurrentUser() == null ? null : REDACTED);
    snapshot.put("completedSteps", context.getInternals().getCompletedSteps());
    return Collections.unmodifiableMap(snapshot);
  }

  private static Map<String, Object> redactMap(final Map<?, ?> source) {
    final Map<String, Object> redacted = new LinkedHashMap<>();
    for (final Map.Entry<?, ?> entry : source.entrySet()) {
      final String key = String.valueOf(entry.getKey());
      if (isSensitive(key)) {
        redacted.put(key, REDACTED);
      } else if (entry.getValue() instanceof Map) {
        redacted.put(key, redactMap((Map<?, ?>) entry.getValue()));
      } else {
        redacted.put(key, entry.getValue());
      }
    }
    return redacted;
  }

  private static boolean isSensitive(final String key) {
    final String lowered = key.toLowerCase(Locale.ROOT);
    for (final String fragment : sensitiveKeyFragments) {
      if (lowered.contains(fragment)) {
        return true;
      }
    }
    return false;
  }
}
