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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * PluginRegistry is the read side of a plugin engine: what plugins are active,
 * which failed, and the context wrappers for plugins it owns. Plugins hold a
 * reference to the registry that loaded them.
 */
public interface PluginRegistry {

  /**
   * Returns the namespace plugins are looked up in.
   *
   * @return the namespace
   */
  String getNamespace();

  /**
   * Returns the names of the plugins that could not be loaded.
   *
   * @return an immutable snapshot of the failed plugin names
   */
  Set<String> getFailedPlugins();

  /**
   * Returns the active plugins in the order they were loaded.
   *
   * @return an unmodifiable snapshot mapping plugin names to instances
   */
  Map<String, Plugin> getActivePlugins();

  /**
   * Returns whether a plugin is active.
   *
   * @param name
   *            the plugin name
   * @return true if the plugin was loaded
   */
  boolean hasPlugin(String name);

  /**
   * Returns an active plugin.
   *
   * @param name
   *            the plugin name
   * @return the plugin, or null if it is not active
   */
  Plugin getPlugin(String name);

  /**
   * Returns an active plugin of the given type.
   *
   * @param <P>
   *            the plugin type
   * @param name
   *            the plugin name
   * @param type
   *            the expected plugin class
   * @return the plugin, or null if it is not active
   * @throws ClassCastException
   *             if the plugin is not of the given type
   */
  default <P extends Plugin> P getPlugin(String name, Class<P> type) {
    return type.cast(getPlugin(name));
  }

  /**
   * Wraps a runnable so it runs in the plugin's context. Repeated calls with
   * the same plugin and runnable return the same wrapper.
   *
   * @param plugin
   *            the plugin
   * @param runnable
   *            the runnable
   * @return the wrapper
   */
  Runnable wrapInPluginContext(Plugin plugin, Runnable runnable);

  /**
   * Wraps a callable so it runs in the plugin's context. Repeated calls with
   * the same plugin and callable return the same wrapper.
   *
   * @param <T>
   *            the result type
   * @param plugin
   *            the plugin
   * @param callable
   *            the callable
   * @return the wrapper
   */
  <T> Callable<T> wrapInPluginContext(Plugin plugin, Callable<T> callable);
}
