package com.github.flowengine;

/**
 * Lifecycle state of a {@link FlowEngine} instance.
 */
public enum EngineStatus {
  // constructed, still installing plugins or hydrating
  NOT_READY,
  // idle with a current step
  READY,
  // a navigation call is being processed
  NAVIGATING,
  // resolution yielded no further step
  COMPLETED,
  // a fatal error occurred, only reset() recovers
  ERRORED;
}
