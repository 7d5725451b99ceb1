package com.github.flowengine;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Bridges caller-supplied asynchronous hooks onto the blocking operation thread.
 */
final class AsyncSupport {

  /**
   * Wait for a hook's stage. A null stage counts as already complete. The stage's failure cause is
   * rethrown unwrapped.
   */
  static <T> T await(final CompletionStage<T> stage) throws Exception {
    if (stage == null) {
      return null;
    }
    try {
      return stage.toCompletableFuture().get();
    } catch (ExecutionException wrapped) {
      final Throwable cause = ErrorHandler.unwrap(wrapped);
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw wrapped;
    }
  }

  private AsyncSupport() {}
}
