package com.github.flowengine;

/**
 * Presentation tag of a step. Only {@link #CHECKLIST} changes engine behavior: such a step carries
 * a {@link ChecklistPayload} and blocks {@code next()} until its completion criteria are met.
 */
public enum StepType {
  INFORMATION,
  MULTIPLE_CHOICE,
  SINGLE_CHOICE,
  CONFIRMATION,
  CUSTOM_COMPONENT,
  CHECKLIST;
}
