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

import java.util.List;

/**
 * PluginLoader locates and loads the implementations registered for plugin
 * names. The engine asks it for each configured name and treats zero or
 * multiple results, and a failing {@link #materialize(PluginHandle)}, as
 * per-plugin failures.
 */
public interface PluginLoader {

  /**
   * Finds every implementation registered for a name within a namespace.
   *
   * @param namespace
   *            the plugin namespace
   * @param name
   *            the plugin name
   * @return the handles found, empty if none
   */
  List<PluginHandle> find(String namespace, String name);

  /**
   * Loads the implementation behind a handle. The engine expects a
   * {@link PluginFactory}; anything else is reported as a contract violation.
   *
   * @param handle
   *            a handle returned by {@link #find(String, String)}
   * @return the implementation
   * @throws PluginLoadException
   *             if the implementation cannot be loaded
   */
  Object materialize(PluginHandle handle) throws PluginLoadException;

  /**
   * Returns the package identity of a materialized handle.
   *
   * @param handle
   *            a handle that was successfully materialized
   * @return the package info
   */
  PackageInfo packageInfo(PluginHandle handle);
}
