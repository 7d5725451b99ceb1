package com.github.flowengine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Engine-scoped logging facade. Every line is prefixed with the owning engine and flow ids so
 * interleaved output from many engines in one process stays attributable. One instance is built per
 * engine and handed to each component at construction.
 */
final class FlowLogger {
  private final Logger logger;
  private final String engineId;
  private volatile String flowId;

  FlowLogger(final Class<?> owner, final String engineId, final String flowId) {
    this.logger = LogManager.getLogger(owner.getSimpleName());
    this.engineId = engineId;
    this.flowId = flowId;
  }

  /**
   * Derive a logger for another component that shares this engine's prefix.
   */
  FlowLogger forComponent(final Class<?> component) {
    return new FlowLogger(component, engineId, flowId);
  }

  void setFlowId(final String flowId) {
    this.flowId = flowId;
  }

  void error(final String message) {
    logger.error(prefix(message));
  }

  void error(final String message, final Throwable error) {
    logger.error(prefix(message), error);
  }

  void warn(final String message) {
    logger.warn(prefix(message));
  }

  void warn(final String message, final Throwable error) {
    logger.warn(prefix(message), error);
  }

  void info(final String message) {
    logger.info(prefix(message));
  }

  boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  void debug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(prefix(message));
    }
  }

  private String prefix(final String message) {
    return new StringBuilder().append("[e:").append(engineId).append("][f:").append(flowId)
        .append("] ").append(message).toString();
  }
}
