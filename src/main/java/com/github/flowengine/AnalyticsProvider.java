package com.github.flowengine;

/**
 * Destination for analytics events, e.g. an HTTP collector or a metrics backend. Calls arrive on the
 * engine's operation thread, so implementations should hand off slow work.
 */
public interface AnalyticsProvider {

  String getName();

  void trackEvent(final AnalyticsEvent event) throws Exception;

  /**
   * Called once when the owning plugin is uninstalled.
   */
  default void flush() throws Exception {}
}
