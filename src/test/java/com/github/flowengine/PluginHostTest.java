package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Tests to maintain the sanity and correctness of the plugin lifecycle.
 */
public class PluginHostTest {
  private static final FlowLogger logger =
      new FlowLogger(PluginHostTest.class, "test-engine", "test-flow");

  private final EventBus bus = new EventBus(logger);
  private final PluginHost host = new PluginHost(logger, bus);
  private final List<String> cleanups = Collections.synchronizedList(new ArrayList<String>());

  @Test
  public void testInstallAndUninstall() throws FlowEngineException {
    final List<PluginEvent> installed = new ArrayList<>();
    bus.subscribe(EventType.PLUGIN_INSTALLED, new FlowEventListener<PluginEvent>() {
      @Override
      public void onEvent(final PluginEvent event) {
        installed.add(event);
      }
    });

    host.install(new TrackedPlugin("audit", cleanups, false), null);
    assertTrue(host.isInstalled("audit"));
    assertEquals(1, installed.size());
    assertEquals("audit", installed.get(0).getPluginName());

    host.uninstall("audit");
    assertFalse(host.isInstalled("audit"));
    assertEquals(Arrays.asList("audit"), cleanups);
  }

  @Test
  public void testPreconditions() throws FlowEngineException {
    host.install(new TrackedPlugin("base", cleanups, false), null);
    expect(Code.PLUGIN_ALREADY_INSTALLED, new TrackedPlugin("base", cleanups, false));
    expect(Code.PLUGIN_DEPENDENCY_MISSING,
        new TrackedPlugin("needy", cleanups, false, "missing"));

    host.install(new TrackedPlugin("child", cleanups, false, "base"), null);
    try {
      host.uninstall("base");
      fail("a plugin with dependents cannot be uninstalled");
    } catch (FlowEngineException expected) {
      assertEquals(Code.PLUGIN_IN_USE, expected.getCode());
    }
    try {
      host.uninstall("nobody");
      fail("unknown plugin");
    } catch (FlowEngineException expected) {
      assertEquals(Code.PLUGIN_NOT_FOUND, expected.getCode());
    }
  }

  @Test
  public void testInstallFailure() {
    final List<PluginEvent> errors = new ArrayList<>();
    bus.subscribe(EventType.PLUGIN_ERROR, new FlowEventListener<PluginEvent>() {
      @Override
      public void onEvent(final PluginEvent event) {
        errors.add(event);
      }
    });
    expect(Code.PLUGIN_FAILURE, new FlowEngineTest.BrokenPlugin());
    assertFalse(host.isInstalled("broken"));
    assertEquals(1, errors.size());
    assertEquals(Code.PLUGIN_FAILURE, errors.get(0).getError().getCode());
  }

  @Test
  public void testCleanupAllInReverseOrder() throws FlowEngineException {
    host.install(new TrackedPlugin("first", cleanups, false), null);
    host.install(new TrackedPlugin("second", cleanups, true), null);
    host.install(new TrackedPlugin("third", cleanups, false), null);
    assertEquals(3, host.getInstalledPlugins().size());

    // a failing cleanup does not stop the sweep
    assertEquals(1, host.cleanupAll());
    assertEquals(Arrays.asList("third", "second", "first"), cleanups);
    assertTrue(host.getInstalledPlugins().isEmpty());
  }

  private void expect(final Code code, final FlowPlugin plugin) {
    try {
      host.install(plugin, null);
      fail("install of " + plugin.getName() + " must fail with " + code);
    } catch (FlowEngineException expected) {
      assertEquals(code, expected.getCode());
    }
  }

  static final class TrackedPlugin implements FlowPlugin {
    private final String name;
    private final List<String> cleanups;
    private final boolean failCleanup;
    private final List<String> dependencies;

    TrackedPlugin(final String name, final List<String> cleanups, final boolean failCleanup,
        final String... dependencies) {
      this.name = name;
      this.cleanups = cleanups;
      this.failCleanup = failCleanup;
      this.dependencies = Arrays.asList(dependencies);
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public String getVersion() {
      return "1.0";
    }

    @Override
    public List<String> getDependencies() {
      return dependencies;
    }

    @Override
    public PluginCleanup install(final FlowEngine engine) {
      return new PluginCleanup() {
        @Override
        public void cleanup() throws Exception {
          cleanups.add(name);
          if (failCleanup) {
            throw new IllegalStateException(name + " cannot clean up");
          }
        }
      };
    }
  }
}
