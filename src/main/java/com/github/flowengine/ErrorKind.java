package com.github.flowengine;

/**
 * Failure taxonomy used by the {@link ErrorHandler} to decide how far an error reaches.
 */
public enum ErrorKind {
  // invalid call given the current state, recovered locally and reported
  PRECONDITION,
  // a navigation rule could not be evaluated, only the in-flight transition is aborted
  RESOLUTION,
  // hook or persistence failure, reported but never rolls back navigation
  SIDE_EFFECT,
  // invariant violation, engine moves to ERRORED until reset
  FATAL;
}
