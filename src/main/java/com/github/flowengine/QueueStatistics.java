package com.github.flowengine;

/**
 * Point-in-time statistics of an engine's operation queue.
 */
public final class QueueStatistics {
  private final int queueLength;
  private final int activeOperations;
  private final long completedOperations;
  private final long failedOperations;
  private final boolean paused;
  private final long oldestOperationAgeMillis;

  QueueStatistics(final int queueLength, final int activeOperations, final long completedOperations,
      final long failedOperations, final boolean paused, final long oldestOperationAgeMillis) {
    this.queueLength = queueLength;
    this.activeOperations = activeOperations;
    this.completedOperations = completedOperations;
    this.failedOperations = failedOperations;
    this.paused = paused;
    this.oldestOperationAgeMillis = oldestOperationAgeMillis;
  }

  public int getQueueLength() {
    return queueLength;
  }

  public int getActiveOperations() {
    return activeOperations;
  }

  public long getCompletedOperations() {
    return completedOperations;
  }

  public long getFailedOperations() {
    return failedOperations;
  }

  public boolean isPaused() {
    return paused;
  }

  public boolean isProcessing() {
    return activeOperations > 0;
  }

  public long getOldestOperationAgeMillis() {
    return oldestOperationAgeMillis;
  }

  @Override
  public String toString() {
    return "QueueStatistics [queueLength=" + queueLength + ", activeOperations="
        + activeOperations + ", completedOperations=" + completedOperations
        + ", failedOperations=" + failedOperations + ", paused=" + paused
        + ", oldestOperationAgeMillis=" + oldestOperationAgeMillis + "]";
  }
}
