package com.github.flowengine;

/**
 * Handle returned by {@link FlowEngine#addEventListener(EventType, FlowEventListener)}.
 * Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface ListenerRegistration {
  void unsubscribe();
}
