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

import java.util.Collections;
import java.util.Set;

/**
 * PluginFactory is the contract a loaded plugin implementation must satisfy.
 * It declares the plugin's dependencies and metadata before anything is
 * instantiated, and creates the {@link Plugin} once the engine decides it is
 * its turn.
 *
 * <p>
 * Required plugins must be loaded first; if one of them is missing the load
 * pass fails. Used plugins are loaded first when they are available, but their
 * absence never prevents this plugin from loading.
 *
 * @see PluginDefinition
 */
public interface PluginFactory {

  /**
   * Creates a new, unbound plugin instance. Called once per load pass.
   *
   * @return the plugin
   */
  Plugin create();

  /**
   * Returns the names of the plugins this plugin depends on.
   *
   * @return the required plugin names
   */
  default Set<String> getRequiredPlugins() {
    return Collections.emptySet();
  }

  /**
   * Returns the names of the plugins this plugin uses if they are available.
   *
   * @return the used plugin names
   */
  default Set<String> getUsedPlugins() {
    return Collections.emptySet();
  }

  /**
   * Returns the plugin version.
   *
   * @return the version, or null to use the package version
   */
  default String getVersion() {
    return null;
  }

  /**
   * Returns the documentation of the plugin. The first line is the title, the
   * remaining lines the description.
   *
   * @return the documentation, or null if there is none
   */
  default String getDocumentation() {
    return null;
  }
}
