package com.github.flowengine;

import com.github.flowengine.FlowEngineException.Code;
import com.github.flowengine.PersistenceEvent.Operation;
import com.github.flowengine.PersistenceHandlers.DataClearHandler;
import com.github.flowengine.PersistenceHandlers.DataLoadHandler;
import com.github.flowengine.PersistenceHandlers.DataPersistHandler;

/**
 * Invokes the caller's load/persist/clear handlers at the engine's lifecycle points.
 * 
 * Notes:<br>
 * 1. all calls are made from inside queued operations, never concurrently<br>
 * 2. persist and clear are retried per the {@link RetryPolicy}, load is attempted once since it
 * gates readiness<br>
 * 3. exactly one persistenceSuccess or persistenceFailure event fires per call, after the final
 * attempt<br>
 * 4. a failure never touches in-memory navigation state<br>
 */
final class PersistenceCoordinator {
  private final FlowLogger logger;
  private final EventBus eventBus;
  private final ErrorHandler errorHandler;

  private volatile RetryPolicy retryPolicy;
  private volatile DataLoadHandler loadHandler;
  private volatile DataPersistHandler persistHandler;
  private volatile DataClearHandler clearHandler;

  PersistenceCoordinator(final FlowLogger logger, final EventBus eventBus,
      final ErrorHandler errorHandler, final RetryPolicy retryPolicy) {
    this.logger = logger;
    this.eventBus = eventBus;
    this.errorHandler = errorHandler;
    this.retryPolicy = retryPolicy == null ? RetryPolicy.defaultPolicy() : retryPolicy;
  }

  /**
   * Fetch stored data. A missing handler or a null answer both mean "start fresh". Failures are
   * reported as fatal {@link Code#DATA_LOAD_FAILURE}.
   */
  OperationResult<LoadedData> load(final FlowContext context) {
    final DataLoadHandler handler = loadHandler;
    if (handler == null) {
      return OperationResult.success(null);
    }
    try {
      final LoadedData loaded = AsyncSupport.await(handler.load());
      logger.info(loaded == null ? "Load handler found no stored flow"
          : "Loaded stored flow resuming at " + loaded.getCurrentStepId());
      eventBus.publish(EventType.PERSISTENCE_SUCCESS,
          new PersistenceEvent(Operation.LOAD, null, 1, null, context));
      return OperationResult.success(loaded);
    } catch (Exception failure) {
      restoreInterrupt(failure);
      final FlowEngineException error = new FlowEngineException(Code.DATA_LOAD_FAILURE,
          "Load handler failed: " + ErrorHandler.unwrap(failure).getMessage(), failure);
      errorHandler.report(error, Code.DATA_LOAD_FAILURE, "loadData", context, null);
      eventBus.publish(EventType.PERSISTENCE_FAILURE,
          new PersistenceEvent(Operation.LOAD, null, 1, error, context));
      return OperationResult.failure(error);
    }
  }

  OperationResult<Void> persist(final FlowContext context, final String currentStepId) {
    final DataPersistHandler handler = persistHandler;
    if (handler == null) {
      return OperationResult.success(null);
    }
    return withRetries(Operation.PERSIST, context, currentStepId, new QueuedOperation<Object>() {
      @Override
      public Object execute() throws Exception {
        return AsyncSupport.await(handler.persist(context, currentStepId));
      }
    });
  }

  OperationResult<Void> clear(final FlowContext context) {
    final DataClearHandler handler = clearHandler;
    if (handler == null) {
      return OperationResult.success(null);
    }
    return withRetries(Operation.CLEAR, context, null, new QueuedOperation<Object>() {
      @Override
      public Object execute() throws Exception {
        return AsyncSupport.await(handler.clear());
      }
    });
  }

  private OperationResult<Void> withRetries(final Operation operation, final FlowContext context,
      final String stepId, final QueuedOperation<?> call) {
    final RetryPolicy policy = retryPolicy;
    Exception lastFailure = null;
    int attempts = 0;
    while (attempts < policy.getMaxAttempts()) {
      if (attempts > 0) {
        try {
          Thread.sleep(policy.backoffMillis(attempts));
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          lastFailure = interrupted;
          break;
        }
      }
      attempts++;
      try {
        call.execute();
        logger.debug(operation + " succeeded after " + attempts + " attempt(s)");
        eventBus.publish(EventType.PERSISTENCE_SUCCESS,
            new PersistenceEvent(operation, stepId, attempts, null, context));
        return OperationResult.success(null);
      } catch (Exception failure) {
        lastFailure = failure;
        if (ErrorHandler.unwrap(failure) instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          break;
        }
        logger.warn(operation + " attempt " + attempts + "/" + policy.getMaxAttempts()
            + " failed: " + ErrorHandler.unwrap(failure).getMessage());
      }
    }
    final FlowEngineException error = new FlowEngineException(Code.PERSISTENCE_FAILURE,
        operation + " failed after " + attempts + " attempt(s)", lastFailure);
    errorHandler.report(error, Code.PERSISTENCE_FAILURE,
        operation == Operation.PERSIST ? "persistData" : "clearPersistedData", context, stepId);
    eventBus.publish(EventType.PERSISTENCE_FAILURE,
        new PersistenceEvent(operation, stepId, attempts, error, context));
    return OperationResult.failure(error);
  }

  private static void restoreInterrupt(final Exception failure) {
    if (ErrorHandler.unwrap(failure) instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
  }

  void setRetryPolicy(final RetryPolicy retryPolicy) {
    this.retryPolicy = retryPolicy == null ? RetryPolicy.defaultPolicy() : retryPolicy;
  }

  DataLoadHandler getLoadHandler() {
    return loadHandler;
  }

  void setLoadHandler(final DataLoadHandler loadHandler) {
    this.loadHandler = loadHandler;
  }

  DataPersistHandler getPersistHandler() {
    return persistHandler;
  }

  void setPersistHandler(final DataPersistHandler persistHandler) {
    this.persistHandler = persistHandler;
  }

  DataClearHandler getClearHandler() {
    return clearHandler;
  }

  void setClearHandler(final DataClearHandler clearHandler) {
    this.clearHandler = clearHandler;
  }

  void clearHandlers() {
    loadHandler = null;
    persistHandler = null;
    clearHandler = null;
  }
}
