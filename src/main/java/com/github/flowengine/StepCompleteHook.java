package com.github.flowengine;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Invoked before a step is left through {@code next()}. A failure aborts the transition. May
 * complete asynchronously by returning a stage; a null return means the hook finished
 * synchronously.
 */
@FunctionalInterface
public interface StepCompleteHook {
  CompletionStage<?> onStepComplete(final Map<String, Object> stepData, final FlowContext context)
      throws Exception;
}
