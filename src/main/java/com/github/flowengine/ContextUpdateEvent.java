package com.github.flowengine;

/**
 * Payload of {@code contextUpdate}, only fired when the merge produced a different context.
 */
public final class ContextUpdateEvent {
  private final FlowContext oldContext;
  private final FlowContext newContext;

  ContextUpdateEvent(final FlowContext oldContext, final FlowContext newContext) {
    this.oldContext = oldContext;
    this.newContext = newContext;
  }

  public FlowContext getOldContext() {
    return oldContext;
  }

  public FlowContext getNewContext() {
    return newContext;
  }
}
