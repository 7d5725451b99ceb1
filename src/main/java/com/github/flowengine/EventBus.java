package com.github.flowengine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Typed publish/subscribe hub of an engine.
 * 
 * Notes:<br>
 * 1. delivery is synchronous and in subscription order<br>
 * 2. every dispatch iterates a copy of the listener list taken when the dispatch starts, so
 * subscribing or unsubscribing from inside a listener only affects later dispatches<br>
 * 3. a failing listener is logged and does not prevent delivery to the remaining listeners, except
 * for interceptable dispatches where the failure aborts the dispatch and is returned to the
 * caller<br>
 */
final class EventBus {
  private final FlowLogger logger;

  // guarded by this
  private final Map<EventType<?>, List<Subscription<?>>> subscriptions = new HashMap<>();

  EventBus(final FlowLogger logger) {
    this.logger = logger;
  }

  <E> ListenerRegistration subscribe(final EventType<E> type, final FlowEventListener<E> listener) {
    if (type == null || listener == null) {
      throw new IllegalArgumentException("Event type and listener are required");
    }
    final Subscription<E> subscription = new Subscription<>(type, listener);
    synchronized (this) {
      List<Subscription<?>> forType = subscriptions.get(type);
      if (forType == null) {
        forType = new ArrayList<>();
        subscriptions.put(type, forType);
      }
      forType.add(subscription);
    }
    return new ListenerRegistration() {
      @Override
      public void unsubscribe() {
        synchronized (EventBus.this) {
          final List<Subscription<?>> forType = subscriptions.get(type);
          if (forType != null) {
            forType.remove(subscription);
          }
        }
      }
    };
  }

  /**
   * Deliver an event to every listener captured at dispatch start. Returns the number of listeners
   * that handled it without failing.
   */
  <E> int publish(final EventType<E> type, final E event) {
    int delivered = 0;
    for (final Subscription<?> subscription : snapshot(type)) {
      try {
        subscription.deliver(event);
        delivered++;
      } catch (RuntimeException listenerFailure) {
        logger.error("Listener for " + type + " failed, continuing dispatch", listenerFailure);
      }
    }
    return delivered;
  }

  /**
   * Dispatch a beforeStepChange event. The event is sealed once dispatch ends so late decisions
   * are ignored. A listener failure stops the dispatch and is returned as a failed result.
   */
  OperationResult<BeforeStepChangeEvent> publishInterceptable(final BeforeStepChangeEvent event) {
    try {
      for (final Subscription<?> subscription : snapshot(EventType.BEFORE_STEP_CHANGE)) {
        try {
          subscription.deliver(event);
        } catch (RuntimeException listenerFailure) {
          return OperationResult.failure(new FlowEngineException(
              Code.NAVIGATION_LISTENER_FAILURE, "beforeStepChange listener failed for " + event,
              listenerFailure));
        }
      }
      return OperationResult.success(event);
    } finally {
      event.seal();
    }
  }

  synchronized void clear() {
    subscriptions.clear();
  }

  private synchronized List<Subscription<?>> snapshot(final EventType<?> type) {
    final List<Subscription<?>> forType = subscriptions.get(type);
    return forType == null ? new ArrayList<Subscription<?>>() : new ArrayList<>(forType);
  }

  // identity wrapper so the same listener added twice is removed one registration at a time
  private static final class Subscription<E> {
    private final EventType<E> type;
    private final FlowEventListener<E> listener;

    private Subscription(final EventType<E> type, final FlowEventListener<E> listener) {
      this.type = type;
      this.listener = listener;
    }

    private void deliver(final Object event) {
      listener.onEvent(type.cast(event));
    }
  }
}
