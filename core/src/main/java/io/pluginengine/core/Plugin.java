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

package io.pluginengine.core;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Plugin is the base class for extension components loaded by a plugin engine.
 * Instances are created by their {@link PluginFactory}, bound to the engine and
 * initialized exactly once, in dependency order.
 *
 * <p>
 * Subclasses override {@link #init()} to set themselves up. Code that runs
 * later on behalf of the plugin, such as signal receivers, should be wrapped
 * with {@link #wrap(Runnable)} or connected with
 * {@link #connect(PluginSignal, Runnable)} so that
 * {@link PluginContext#current()} reports this plugin while it runs.
 */
public abstract class Plugin {

  static final String NO_DESCRIPTION = "no description available";

  private PluginRegistry engine;
  private PluginDescriptor descriptor;

  /**
   * Initializes the plugin at startup. Runs inside the host's application
   * scope and with this plugin on the context stack. Does nothing by default.
   */
  protected void init() {
  }

  final void bind(PluginRegistry engine, PluginDescriptor descriptor) {
    if (this.engine != null) {
      throw new IllegalStateException("Plugin " + descriptor.getName() + " is already bound to an engine");
    }
    this.engine = engine;
    this.descriptor = descriptor;
  }

  /**
   * Returns the engine that loaded this plugin.
   *
   * @return the engine, or null before the plugin is bound
   */
  public PluginRegistry getEngine() {
    return engine;
  }

  public String getName() {
    return descriptor != null ? descriptor.getName() : null;
  }

  public String getPackageName() {
    return descriptor != null ? descriptor.getPackageInfo().getPackageName() : null;
  }

  public String getPackageVersion() {
    return descriptor != null ? descriptor.getPackageInfo().getPackageVersion() : null;
  }

  /**
   * Returns the plugin version, which defaults to the package version.
   *
   * @return the version
   */
  public String getVersion() {
    return descriptor != null ? descriptor.getVersion() : null;
  }

  public Path getRootPath() {
    return descriptor != null ? descriptor.getPackageInfo().getRootPath() : null;
  }

  /**
   * Returns the first line of the plugin documentation.
   *
   * @return the title, empty if the plugin is undocumented
   */
  public String getTitle() {
    return DocStrings.title(getDocumentation());
  }

  /**
   * Returns the plugin documentation after the title.
   *
   * @return the description, or "no description available"
   */
  public String getDescription() {
    return DocStrings.description(getDocumentation(), NO_DESCRIPTION);
  }

  private String getDocumentation() {
    return descriptor != null ? descriptor.getDocumentation() : null;
  }

  /**
   * Pushes this plugin on the context stack until the returned scope is
   * closed.
   *
   * <pre>{@code
   * try (PluginContext.Scope ignored = plugin.pluginContext()) {
   *   // PluginContext.current() == plugin
   * }
   * }</pre>
   *
   * @return the scope
   */
  public PluginContext.Scope pluginContext() {
    return PluginContext.enter(this);
  }

  /**
   * Returns a runnable that runs the given one in this plugin's context.
   * Wrapping the same runnable twice returns the same wrapper.
   *
   * @param runnable
   *            the runnable to wrap
   * @return the wrapped runnable
   */
  public Runnable wrap(Runnable runnable) {
    return requireEngine().wrapInPluginContext(this, runnable);
  }

  /**
   * Returns a callable that runs the given one in this plugin's context.
   * Wrapping the same callable twice returns the same wrapper.
   *
   * @param <T>
   *            the result type
   * @param callable
   *            the callable to wrap
   * @return the wrapped callable
   */
  public <T> Callable<T> wrap(Callable<T> callable) {
    return requireEngine().wrapInPluginContext(this, callable);
  }

  /**
   * Connects a receiver to a signal so that it runs in this plugin's context.
   *
   * @param signal
   *            the signal
   * @param receiver
   *            the receiver
   */
  public void connect(PluginSignal signal, Runnable receiver) {
    signal.connect(wrap(receiver));
  }

  /**
   * Returns a serializable summary of this plugin.
   *
   * @return the plugin info
   */
  public PluginInfo getInfo() {
    PluginInfo info = new PluginInfo();
    info.setName(getName());
    info.setPackageName(getPackageName());
    info.setPackageVersion(getPackageVersion());
    info.setVersion(getVersion());
    info.setTitle(getTitle());
    info.setDescription(getDescription());
    if (descriptor != null) {
      info.setRequiredPlugins(descriptor.getRequiredPlugins());
      info.setUsedPlugins(descriptor.getUsedPlugins());
    }
    return info;
  }

  private PluginRegistry requireEngine() {
    if (engine == null) {
      throw new IllegalStateException("Plugin " + getClass().getSimpleName() + " is not bound to an engine");
    }
    return engine;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + getName() + ")";
  }
}
