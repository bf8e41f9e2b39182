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

import java.util.Objects;

/**
 * PluginHandle identifies one implementation a {@link PluginLoader} found for a
 * plugin name. The engine never looks inside a handle; it only passes it back
 * to the loader that created it.
 */
public final class PluginHandle {

  private final String name;
  private final String target;
  private final String origin;

  /**
   * Creates a new PluginHandle.
   *
   * @param name
   *            the plugin name the handle was found for
   * @param target
   *            what the loader will materialize, e.g. a class name
   * @param origin
   *            where the registration was found, used in diagnostics
   */
  public PluginHandle(String name, String target, String origin) {
    this.name = Objects.requireNonNull(name, "name");
    this.target = Objects.requireNonNull(target, "target");
    this.origin = origin;
  }

  public String getName() {
    return name;
  }

  public String getTarget() {
    return target;
  }

  public String getOrigin() {
    return origin;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PluginHandle)) {
      return false;
    }
    PluginHandle other = (PluginHandle) o;
    return name.equals(other.name) && target.equals(other.target) && Objects.equals(origin, other.origin);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, target, origin);
  }

  @Override
  public String toString() {
    return name + "=" + target + (origin != null ? " (" + origin + ")" : "");
  }
}
