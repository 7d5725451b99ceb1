package com.github.flowengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Install/uninstall lifecycle of {@link FlowPlugin}s for one engine. Plugins are kept in install
 * order and cleaned up in reverse order.
 */
final class PluginHost {
  private final FlowLogger logger;
  private final EventBus eventBus;

  // guarded by this
  private final Map<String, Installed> installed = new LinkedHashMap<>();

  PluginHost(final FlowLogger logger, final EventBus eventBus) {
    this.logger = logger;
    this.eventBus = eventBus;
  }

  void install(final FlowPlugin plugin, final FlowEngine engine) throws FlowEngineException {
    final String name = plugin.getName();
    synchronized (this) {
      if (installed.containsKey(name)) {
        throw new FlowEngineException(Code.PLUGIN_ALREADY_INSTALLED,
            "Plugin " + name + " is already installed");
      }
      for (final String dependency : plugin.getDependencies()) {
        if (!installed.containsKey(dependency)) {
          throw new FlowEngineException(Code.PLUGIN_DEPENDENCY_MISSING,
              "Plugin " + name + " depends on " + dependency + " which is not installed");
        }
      }
    }
    final PluginCleanup cleanup;
    try {
      cleanup = plugin.install(engine);
    } catch (Exception installFailure) {
      final FlowEngineException error = new FlowEngineException(Code.PLUGIN_FAILURE,
          "Plugin " + name + " failed to install", installFailure);
      logger.error(error.getMessage(), installFailure);
      eventBus.publish(EventType.PLUGIN_ERROR, new PluginEvent(name, plugin.getVersion(), error));
      throw error;
    }
    synchronized (this) {
      installed.put(name, new Installed(plugin, cleanup));
    }
    logger.info("Installed plugin " + name + "@" + plugin.getVersion());
    eventBus.publish(EventType.PLUGIN_INSTALLED, new PluginEvent(name, plugin.getVersion(), null));
  }

  void uninstall(final String name) throws FlowEngineException {
    final Installed entry;
    synchronized (this) {
      entry = installed.get(name);
      if (entry == null) {
        throw new FlowEngineException(Code.PLUGIN_NOT_FOUND, "Plugin " + name + " not installed");
      }
      final List<String> dependents = new ArrayList<>();
      for (final Installed other : installed.values()) {
        if (other.plugin.getDependencies().contains(name)) {
          dependents.add(other.plugin.getName());
        }
      }
      if (!dependents.isEmpty()) {
        throw new FlowEngineException(Code.PLUGIN_IN_USE,
            "Plugin " + name + " is required by " + dependents);
      }
      installed.remove(name);
    }
    runCleanup(entry);
    logger.info("Uninstalled plugin " + name);
  }

  /**
   * Uninstall everything, newest first. Cleanup failures are logged and do not stop the sweep.
   * Returns the number of cleanups that failed.
   */
  int cleanupAll() {
    final List<Installed> toClean;
    synchronized (this) {
      toClean = new ArrayList<>(installed.values());
      installed.clear();
    }
    Collections.reverse(toClean);
    int failures = 0;
    for (final Installed entry : toClean) {
      try {
        runCleanup(entry);
      } catch (FlowEngineException cleanupFailure) {
        failures++;
        logger.warn(cleanupFailure.getMessage(), cleanupFailure.getCause());
      }
    }
    return failures;
  }

  synchronized boolean isInstalled(final String name) {
    return installed.containsKey(name);
  }

  synchronized List<FlowPlugin> getInstalledPlugins() {
    final List<FlowPlugin> plugins = new ArrayList<>();
    for (final Installed entry : installed.values()) {
      plugins.add(entry.plugin);
    }
    return Collections.unmodifiableList(plugins);
  }

  private void runCleanup(final Installed entry) throws FlowEngineException {
    if (entry.cleanup == null) {
      return;
    }
    try {
      entry.cleanup.cleanup();
    } catch (Exception cleanupFailure) {
      final FlowEngineException error = new FlowEngineException(Code.PLUGIN_FAILURE,
          "Plugin " + entry.plugin.getName() + " failed to clean up", cleanupFailure);
      eventBus.publish(EventType.PLUGIN_ERROR,
          new PluginEvent(entry.plugin.getName(), entry.plugin.getVersion(), error));
      throw error;
    }
  }

  private static final class Installed {
    private final FlowPlugin plugin;
    private final PluginCleanup cleanup;

    private Installed(final FlowPlugin plugin, final PluginCleanup cleanup) {
      this.plugin = plugin;
      this.cleanup = cleanup;
    }
  }
}
