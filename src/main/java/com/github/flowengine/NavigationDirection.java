package com.github.flowengine;

/**
 * Kind of transition being attempted, carried by navigation events.
 */
public enum NavigationDirection {
  INITIAL,
  NEXT,
  PREVIOUS,
  SKIP,
  GOTO;
}
