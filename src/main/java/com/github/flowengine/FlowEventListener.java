package com.github.flowengine;

/**
 * Subscriber for one {@link EventType}. Listeners run synchronously on the thread publishing the
 * event, usually the engine's operation thread.
 */
@FunctionalInterface
public interface FlowEventListener<E> {
  void onEvent(final E event);
}
