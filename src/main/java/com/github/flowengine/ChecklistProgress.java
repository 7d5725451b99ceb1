package com.github.flowengine;

/**
 * Point-in-time progress of a checklist step.
 */
public final class ChecklistProgress {
  private final int completed;
  private final int total;
  private final int percentage;
  private final boolean complete;

  ChecklistProgress(final int completed, final int total, final boolean complete) {
    this.completed = completed;
    this.total = total;
    this.percentage = total == 0 ? 0 : Math.round(completed * 100f / total);
    this.complete = complete;
  }

  public int getCompleted() {
    return completed;
  }

  public int getTotal() {
    return total;
  }

  public int getPercentage() {
    return percentage;
  }

  public boolean isComplete() {
    return complete;
  }

  @Override
  public String toString() {
    return "ChecklistProgress [completed=" + completed + ", total=" + total + ", percentage="
        + percentage + ", complete=" + complete + "]";
  }
}
