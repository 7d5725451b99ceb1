package com.github.flowengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, read-only set of steps with id lookup. Replaced wholesale on reconfiguration, never
 * modified in place.
 */
final class StepCatalog {
  private final List<Step> steps;
  private final Map<String, Integer> positions;

  StepCatalog(final List<Step> steps) {
    this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    this.positions = new HashMap<>();
    for (int index = 0; index < this.steps.size(); index++) {
      positions.put(this.steps.get(index).getId(), index);
    }
  }

  List<Step> getSteps() {
    return steps;
  }

  Step find(final String stepId) {
    final Integer position = stepId == null ? null : positions.get(stepId);
    return position == null ? null : steps.get(position);
  }

  boolean contains(final String stepId) {
    return stepId != null && positions.containsKey(stepId);
  }

  int indexOf(final String stepId) {
    final Integer position = stepId == null ? null : positions.get(stepId);
    return position == null ? -1 : position;
  }

  Step get(final int index) {
    return steps.get(index);
  }

  int size() {
    return steps.size();
  }

  Step first() {
    return steps.isEmpty() ? null : steps.get(0);
  }
}
