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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Thrown when the dependency graph of the candidate plugins cannot be ordered:
 * either required dependencies form a cycle, or a plugin requires another
 * plugin that is not among the candidates (usually because it failed to load).
 */
public class DependencyResolutionException extends PluginEngineException {

  public static final String ERROR_CODE = "UNRESOLVABLE_DEPENDENCIES";

  private final Map<String, Set<String>> unresolved;

  /**
   * Creates a new DependencyResolutionException.
   *
   * @param unresolved
   *            the names that could not be ordered, each mapped to its required
   *            dependencies that were never satisfied
   */
  public DependencyResolutionException(Map<String, Set<String>> unresolved) {
    super("Could not resolve dependencies between plugins: " + unresolved, null, ERROR_CODE, unresolved);
    this.unresolved = Collections.unmodifiableMap(new LinkedHashMap<>(unresolved));
  }

  /**
   * Returns the plugins that could not be ordered.
   *
   * @return map of plugin name to its unmet required dependencies
   */
  public Map<String, Set<String>> getUnresolved() {
    return unresolved;
  }
}
