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
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PluginContextWrappers memoizes {@link PluginContext#wrap} so that wrapping the
 * same plugin and callback twice yields the same wrapper. Receivers that are
 * de-duplicated by identity, such as those of a {@link PluginSignal}, are then
 * only registered once.
 *
 * <p>
 * Keys compare plugin and callback by identity. Entries are never evicted; the
 * cache lives as long as the engine that owns it. It is safe to use from
 * several threads.
 */
public class PluginContextWrappers {

  private static final Logger logger = LoggerFactory.getLogger(PluginContextWrappers.class);

  private final Map<Key, Runnable> runnables = new ConcurrentHashMap<>();
  private final Map<Key, Callable<?>> callables = new ConcurrentHashMap<>();

  /**
   * Returns the wrapper for a plugin and runnable, creating it on first use.
   *
   * @param plugin
   *            the plugin
   * @param runnable
   *            the runnable
   * @return the wrapper
   */
  public Runnable wrap(Plugin plugin, Runnable runnable) {
    return runnables.computeIfAbsent(new Key(plugin, runnable), key -> {
      logger.debug("Wrapping runnable in context of plugin {}", plugin.getName());
      return PluginContext.wrap(plugin, runnable);
    });
  }

  /**
   * Returns the wrapper for a plugin and callable, creating it on first use.
   *
   * @param <T>
   *            the result type
   * @param plugin
   *            the plugin
   * @param callable
   *            the callable
   * @return the wrapper
   */
  @SuppressWarnings("unchecked")
  public <T> Callable<T> wrap(Plugin plugin, Callable<T> callable) {
    return (Callable<T>) callables.computeIfAbsent(new Key(plugin, callable), key -> {
      logger.debug("Wrapping callable in context of plugin {}", plugin.getName());
      return PluginContext.wrap(plugin, callable);
    });
  }

  /**
   * Returns the number of cached wrappers.
   *
   * @return the cache size
   */
  public int size() {
    return runnables.size() + callables.size();
  }

  private static final class Key {

    private final Object plugin;
    private final Object target;

    Key(Object plugin, Object target) {
      if (plugin == null || target == null) {
        throw new NullPointerException("plugin and target must not be null");
      }
      this.plugin = plugin;
      this.target = target;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key)) {
        return false;
      }
      Key other = (Key) o;
      return plugin == other.plugin && target == other.target;
    }

    @Override
    public int hashCode() {
      return 31 * System.identityHashCode(plugin) + System.identityHashCode(target);
    }
  }
}
