package com.github.flowengine;

/**
 * Narrow view of the engine's context given to components that need to read or change flowData.
 * All changes go through the engine's single update path.
 */
interface ContextAccess {
  FlowContext currentContext();

  /**
   * Merge a patch into the context. Returns false when the merge changed nothing.
   */
  boolean applyContextPatch(final ContextPatch patch);
}
