package com.github.flowengine;

import java.util.concurrent.CompletionStage;

/**
 * Invoked once when the flow completes. A null return means the hook finished synchronously.
 */
@FunctionalInterface
public interface FlowCompleteHook {
  CompletionStage<?> onFlowComplete(final FlowContext context) throws Exception;
}
