package com.github.flowengine;

import java.util.concurrent.CompletionStage;

/**
 * Caller-supplied persistence adapter contracts. Each may complete synchronously by returning null
 * (a null stage for the load handler means "nothing stored") or asynchronously through the stage.
 * The engine never serializes anything itself.
 */
public final class PersistenceHandlers {

  @FunctionalInterface
  public interface DataLoadHandler {
    CompletionStage<LoadedData> load() throws Exception;
  }

  @FunctionalInterface
  public interface DataPersistHandler {
    CompletionStage<?> persist(final FlowContext context, final String currentStepId)
        throws Exception;
  }

  @FunctionalInterface
  public interface DataClearHandler {
    CompletionStage<?> clear() throws Exception;
  }

  private PersistenceHandlers() {}
}
