package com.github.flowengine;

import java.util.function.Predicate;

/**
 * Definition of one checklist entry. Items are mandatory unless stated otherwise; an item whose
 * condition fails for the current context is not counted at all.
 */
public final class ChecklistItem {
  private final String id;
  private final String label;
  private final boolean mandatory;
  private final Predicate<FlowContext> condition;

  public ChecklistItem(final String id, final String label) {
    this(id, label, true, null);
  }

  public ChecklistItem(final String id, final String label, final boolean mandatory) {
    this(id, label, mandatory, null);
  }

  public ChecklistItem(final String id, final String label, final boolean mandatory,
      final Predicate<FlowContext> condition) {
    this.id = id;
    this.label = label;
    this.mandatory = mandatory;
    this.condition = condition;
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public boolean isMandatory() {
    return mandatory;
  }

  public Predicate<FlowContext> getCondition() {
    return condition;
  }

  boolean isRelevant(final FlowContext context) {
    return condition == null || condition.test(context);
  }

  @Override
  public String toString() {
    return "ChecklistItem [id=" + id + ", label=" + label + ", mandatory=" + mandatory + "]";
  }
}
