/*
 * Copyright 2025 The Plugin Engine Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.pluginengine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pluginengine.core.ApplicationScope;
import io.pluginengine.core.DependencyResolver;
import io.pluginengine.core.FailureReason;
import io.pluginengine.core.PackageInfo;
import io.pluginengine.core.Plugin;
import io.pluginengine.core.PluginContextMismatchException;
import io.pluginengine.core.PluginContextWrappers;
import io.pluginengine.core.PluginDescriptor;
import io.pluginengine.core.PluginEngineException;
import io.pluginengine.core.PluginFactory;
import io.pluginengine.core.PluginFailure;
import io.pluginengine.core.PluginHandle;
import io.pluginengine.core.PluginInfo;
import io.pluginengine.core.PluginInfoJson;
import io.pluginengine.core.PluginLoader;
import io.pluginengine.core.PluginRegistry;
import io.pluginengine.core.PluginSignal;
import io.pluginengine.core.PluginsAlreadyLoadedException;
import io.pluginengine.loader.EntryPointPluginLoader;

/**
 * PluginEngine loads a configured set of plugins and keeps track of which ones
 * are active and which failed.
 *
 * <p>
 * Loading happens once, in {@link #loadPlugins(boolean)}: every configured name
 * is looked up with the {@link PluginLoader}, the valid candidates are ordered
 * by their dependencies and instantiated in that order, and the
 * {@link #getPluginsLoadedSignal() plugins loaded} signal is sent.
 *
 * <pre>{@code
 * PluginEngine engine = PluginEngine.builder()
 *     .namespace("coffee.plugins")
 *     .plugins("espresso", "milk")
 *     .loader(new EntryPointPluginLoader())
 *     .build();
 * boolean allLoaded = engine.loadPlugins();
 * }</pre>
 */
public class PluginEngine implements PluginRegistry {

  private static final Logger logger = LoggerFactory.getLogger(PluginEngine.class);

  private final PluginEngineState state = new PluginEngineState();
  private final PluginLoader loader;
  private final ApplicationScope applicationScope;
  private final PluginSignal pluginsLoaded = new PluginSignal("plugins-loaded");
  private final PluginContextWrappers contextWrappers = new PluginContextWrappers();
  private volatile String namespace;
  private volatile List<String> pluginsToLoad;
  private final boolean skipFailed;

  /**
   * Creates a new PluginEngine.
   *
   * @param options
   *            the engine options
   * @param loader
   *            the loader used to find plugin implementations
   * @param applicationScope
   *            the host scope held while plugins initialize
   */
  public PluginEngine(PluginEngineOptions options, PluginLoader loader, ApplicationScope applicationScope) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.applicationScope = Objects.requireNonNull(applicationScope, "applicationScope");
    this.namespace = options.getNamespace();
    this.pluginsToLoad = options.getPlugins();
    this.skipFailed = options.isSkipFailed();
  }

  /**
   * Creates a new PluginEngine without an application scope.
   *
   * @param options
   *            the engine options
   * @param loader
   *            the loader used to find plugin implementations
   */
  public PluginEngine(PluginEngineOptions options, PluginLoader loader) {
    this(options, loader, ApplicationScope.NONE);
  }

  /**
   * Creates a new PluginEngine builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sets the namespace and the plugins to load. May be called any number of
   * times before the plugins are loaded.
   *
   * @param namespace
   *            the namespace plugins are looked up in
   * @param plugins
   *            the names of the plugins to load
   * @throws IllegalStateException
   *             if the plugins were already loaded
   */
  public void configure(String namespace, Collection<String> plugins) {
    if (state.isLoaded()) {
      throw new IllegalStateException("Cannot configure a plugin engine after its plugins were loaded");
    }
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("Namespace must not be empty");
    }
    List<String> names = PluginEngineOptions.normalizePlugins(plugins);
    this.namespace = namespace;
    this.pluginsToLoad = List.copyOf(names);
  }

  /**
   * Loads the configured plugins using the configured skip-failed behavior.
   *
   * @return true if all plugins could be loaded
   * @see #loadPlugins(boolean)
   */
  public boolean loadPlugins() {
    return loadPlugins(skipFailed);
  }

  /**
   * Loads all configured plugins. Can only be called once per engine.
   *
   * @param skipFailed
   *            if true, initialize the other plugins even if some plugins could
   *            not be loaded; if false, initialize nothing in that case
   * @return true if all plugins could be loaded
   * @throws io.pluginengine.core.PluginsAlreadyLoadedException
   *             if plugins were already loaded
   * @throws io.pluginengine.core.DependencyResolutionException
   *             if the dependencies between plugins cannot be resolved
   * @throws PluginEngineException
   *             if a plugin fails to initialize
   */
  public boolean loadPlugins(boolean skipFailed) {
    state.markLoaded();
    Map<String, PluginDescriptor> candidates = importPlugins();
    if (state.hasFailures() && !skipFailed) {
      logger.warn("Not loading any plugins because {} could not be loaded", state.getFailed());
      return false;
    }
    for (PluginDescriptor descriptor : DependencyResolver.resolveDescriptors(candidates.values())) {
      Plugin plugin;
      try {
        plugin = descriptor.instantiate(this, applicationScope);
      } catch (PluginContextMismatchException | PluginsAlreadyLoadedException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new PluginEngineException("Failed to initialize plugin: " + descriptor.getName(), e,
            PluginEngineException.PLUGIN_INIT_FAILED, descriptor.getName());
      }
      state.addPlugin(descriptor.getName(), plugin);
      logger.info("Loaded plugin: {} (version {})", descriptor.getName(), descriptor.getVersion());
    }
    pluginsLoaded.send();
    return !state.hasFailures();
  }

  /**
   * Looks up every configured plugin and validates it.
   *
   * @return the valid candidates by plugin name
   */
  private Map<String, PluginDescriptor> importPlugins() {
    Map<String, PluginDescriptor> plugins = new LinkedHashMap<>();
    for (String name : pluginsToLoad) {
      List<PluginHandle> handles = loader.find(namespace, name);
      if (handles.isEmpty()) {
        fail(name, FailureReason.NOT_FOUND, "Plugin " + name + " does not exist", null);
        continue;
      } else if (handles.size() > 1) {
        String origins = handles.stream().map(h -> String.valueOf(h.getOrigin())).collect(Collectors.joining(", "));
        fail(name, FailureReason.AMBIGUOUS, "Plugin name " + name + " is not unique (defined in " + origins + ")",
            null);
        continue;
      }
      PluginHandle handle = handles.get(0);
      Object implementation;
      try {
        implementation = loader.materialize(handle);
      } catch (RuntimeException | LinkageError e) {
        fail(name, FailureReason.MATERIALIZE_FAILED, "Could not load plugin " + name, e);
        continue;
      }
      if (!(implementation instanceof PluginFactory)) {
        String type = implementation == null ? "null" : implementation.getClass().getName();
        fail(name, FailureReason.CONTRACT_VIOLATION,
            "Plugin " + name + " (" + type + ") does not implement " + PluginFactory.class.getSimpleName(), null);
        continue;
      }
      try {
        PackageInfo packageInfo = loader.packageInfo(handle);
        plugins.put(name, new PluginDescriptor(name, (PluginFactory) implementation, packageInfo));
      } catch (RuntimeException | LinkageError e) {
        fail(name, FailureReason.MATERIALIZE_FAILED, "Could not read package of plugin " + name, e);
      }
    }
    return plugins;
  }

  private void fail(String name, FailureReason reason, String message, Throwable cause) {
    if (cause != null) {
      logger.error(message, cause);
    } else {
      logger.error(message);
    }
    state.addFailure(new PluginFailure(name, reason, message, cause));
  }

  @Override
  public String getNamespace() {
    return namespace;
  }

  /**
   * Returns the names of the plugins that will be loaded.
   *
   * @return the configured plugin names
   */
  public List<String> getPluginsToLoad() {
    return pluginsToLoad;
  }

  /**
   * Returns whether {@link #loadPlugins(boolean)} was called.
   *
   * @return true if plugins were loaded
   */
  public boolean isLoaded() {
    return state.isLoaded();
  }

  @Override
  public Set<String> getFailedPlugins() {
    return state.getFailed();
  }

  /**
   * Returns why each failed plugin could not be loaded.
   *
   * @return map of plugin name to failure
   */
  public Map<String, PluginFailure> getFailureDetails() {
    return state.getFailureDetails();
  }

  @Override
  public Map<String, Plugin> getActivePlugins() {
    return state.getPlugins();
  }

  @Override
  public boolean hasPlugin(String name) {
    return state.hasPlugin(name);
  }

  @Override
  public Plugin getPlugin(String name) {
    return state.getPlugin(name);
  }

  /**
   * Returns a summary of every active plugin, in load order.
   *
   * @return the plugin summaries
   */
  public List<PluginInfo> describePlugins() {
    List<PluginInfo> infos = new ArrayList<>();
    for (Plugin plugin : state.getPlugins().values()) {
      infos.add(plugin.getInfo());
    }
    return infos;
  }

  /**
   * Returns {@link #describePlugins()} as a JSON array.
   *
   * @return the plugin listing
   */
  public String describePluginsAsJson() {
    return PluginInfoJson.write(describePlugins());
  }

  /**
   * Returns the signal sent once all plugins have been loaded.
   *
   * @return the signal
   */
  public PluginSignal getPluginsLoadedSignal() {
    return pluginsLoaded;
  }

  @Override
  public Runnable wrapInPluginContext(Plugin plugin, Runnable runnable) {
    return contextWrappers.wrap(plugin, runnable);
  }

  @Override
  public <T> Callable<T> wrapInPluginContext(Plugin plugin, Callable<T> callable) {
    return contextWrappers.wrap(plugin, callable);
  }

  @Override
  public String toString() {
    return "PluginEngine(namespace=" + namespace + ", plugins=" + state.getPlugins().keySet() + ")";
  }

  /**
   * Builder for PluginEngine.
   */
  public static class Builder {
    private final PluginEngineOptions.Builder options = PluginEngineOptions.builder();
    private PluginLoader loader;
    private ApplicationScope applicationScope = ApplicationScope.NONE;

    /**
     * Copies the given options.
     *
     * @param options
     *            the options
     * @return this builder
     */
    public Builder options(PluginEngineOptions options) {
      this.options.namespace(options.getNamespace()).plugins(options.getPlugins())
          .skipFailed(options.isSkipFailed());
      return this;
    }

    public Builder namespace(String namespace) {
      this.options.namespace(namespace);
      return this;
    }

    public Builder plugins(String... plugins) {
      this.options.plugins(plugins);
      return this;
    }

    public Builder plugins(Collection<String> plugins) {
      this.options.plugins(plugins);
      return this;
    }

    public Builder skipFailed(boolean skipFailed) {
      this.options.skipFailed(skipFailed);
      return this;
    }

    /**
     * Sets the plugin loader. Defaults to an {@link EntryPointPluginLoader} on
     * the context class loader.
     *
     * @param loader
     *            the loader
     * @return this builder
     */
    public Builder loader(PluginLoader loader) {
      this.loader = loader;
      return this;
    }

    public Builder applicationScope(ApplicationScope applicationScope) {
      this.applicationScope = applicationScope;
      return this;
    }

    /**
     * Builds the engine. Plugins are not loaded until
     * {@link PluginEngine#loadPlugins()} is called.
     *
     * @return the engine
     */
    public PluginEngine build() {
      PluginLoader pluginLoader = loader != null ? loader : new EntryPointPluginLoader();
      return new PluginEngine(options.build(), pluginLoader, applicationScope);
    }
  }
}
