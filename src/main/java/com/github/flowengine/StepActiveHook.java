package com.github.flowengine;

import java.util.concurrent.CompletionStage;

/**
 * Invoked after a step becomes current. May complete asynchronously by returning a stage; a null
 * return means the hook finished synchronously.
 */
@FunctionalInterface
public interface StepActiveHook {
  CompletionStage<?> onStepActive(final FlowContext context) throws Exception;
}
