package com.github.flowengine;

/**
 * A navigation predicate: computes where to go from the current context. Returning null means "no
 * opinion", and resolution falls back to step order. Routers are invoked synchronously on the
 * engine's operation thread and must not block.
 */
@FunctionalInterface
public interface StepRouter {
  NavigationTarget route(final FlowContext context);
}
