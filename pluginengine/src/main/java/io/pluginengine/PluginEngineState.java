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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import io.pluginengine.core.Plugin;
import io.pluginengine.core.PluginFailure;
import io.pluginengine.core.PluginsAlreadyLoadedException;

/**
 * The mutable state of one {@link PluginEngine}: whether plugins were loaded,
 * the loaded plugins and the failed ones. Written only during the single load
 * pass; reads return snapshots.
 */
final class PluginEngineState {

  private final AtomicBoolean pluginsLoaded = new AtomicBoolean();
  private final Map<String, Plugin> plugins = new LinkedHashMap<>();
  private final Map<String, PluginFailure> failed = new LinkedHashMap<>();

  /**
   * Marks the plugins as loaded.
   *
   * @throws PluginsAlreadyLoadedException
   *             if they were already marked
   */
  void markLoaded() {
    if (!pluginsLoaded.compareAndSet(false, true)) {
      throw new PluginsAlreadyLoadedException();
    }
  }

  boolean isLoaded() {
    return pluginsLoaded.get();
  }

  synchronized void addPlugin(String name, Plugin plugin) {
    plugins.put(name, plugin);
  }

  synchronized void addFailure(PluginFailure failure) {
    failed.put(failure.getName(), failure);
  }

  synchronized boolean hasFailures() {
    return !failed.isEmpty();
  }

  synchronized Map<String, Plugin> getPlugins() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(plugins));
  }

  synchronized Plugin getPlugin(String name) {
    return plugins.get(name);
  }

  synchronized boolean hasPlugin(String name) {
    return plugins.containsKey(name);
  }

  synchronized Set<String> getFailed() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(failed.keySet()));
  }

  synchronized Map<String, PluginFailure> getFailureDetails() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(failed));
  }

  @Override
  public synchronized String toString() {
    return "PluginEngineState(plugins=" + plugins.keySet() + ", failed=" + failed.keySet() + ")";
  }
}
