package com.github.flowengine;

/**
 * Returned by {@link FlowPlugin#install(FlowEngine)}, run when the plugin is uninstalled or the
 * engine resets or shuts down.
 */
@FunctionalInterface
public interface PluginCleanup {
  void cleanup() throws Exception;
}
