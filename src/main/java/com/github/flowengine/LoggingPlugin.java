package com.github.flowengine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes a line per navigation, completion, abandonment and error event of the engine it is
 * installed on.
 */
public final class LoggingPlugin extends BasePlugin {
  private static final Logger logger = LogManager.getLogger(LoggingPlugin.class.getSimpleName());

  public static final String NAME = "logging";

  public LoggingPlugin() {
    super(NAME, "1.0.0");
  }

  @Override
  protected void onInstall() {
    final String engineId = getEngine().getId();
    final FlowEventListener<NavigationEvent> navigationLogger =
        new FlowEventListener<NavigationEvent>() {
          @Override
          public void onEvent(final NavigationEvent event) {
            logger.info("[e:" + engineId + "] " + event.getDirection() + " "
                + event.getFromStep().getId() + " -> " + event.getToStep().getId());
          }
        };
    on(EventType.NAVIGATION_FORWARD, navigationLogger);
    on(EventType.NAVIGATION_BACK, navigationLogger);
    on(EventType.NAVIGATION_JUMP, navigationLogger);
    on(EventType.FLOW_COMPLETED, new FlowEventListener<FlowLifecycleEvent>() {
      @Override
      public void onEvent(final FlowLifecycleEvent event) {
        logger.info("[e:" + engineId + "] flow completed in " + event.getDurationMillis() + "ms");
      }
    });
    on(EventType.FLOW_ABANDONED, new FlowEventListener<FlowLifecycleEvent>() {
      @Override
      public void onEvent(final FlowLifecycleEvent event) {
        logger.info("[e:" + engineId + "] flow abandoned at step " + event.getStepId());
      }
    });
    on(EventType.ERROR, new FlowEventListener<ErrorRecord>() {
      @Override
      public void onEvent(final ErrorRecord record) {
        logger.warn("[e:" + engineId + "] " + record);
      }
    });
  }
}
