package com.github.flowengine;

/**
 * Unit of work run by the {@link OperationQueue}. Runs on the queue's worker thread and may block
 * while it waits for asynchronous hooks; nothing else on the same queue runs meanwhile.
 */
@FunctionalInterface
interface QueuedOperation<T> {
  T execute() throws Exception;
}
