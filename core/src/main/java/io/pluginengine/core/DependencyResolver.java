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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Orders plugins so that each one comes after the plugins it depends on.
 *
 * <p>
 * Plugins are emitted in layers. A layer holds every pending plugin whose
 * required and used plugins have all been emitted. If there is no such plugin,
 * the layer holds every pending plugin whose required plugins have been
 * emitted, ignoring unmet used plugins. If there is no such plugin either, the
 * remaining plugins have a required dependency cycle or require a plugin that
 * is not a candidate, and resolution fails.
 *
 * <p>
 * Used plugins that are not candidates at all never delay a plugin. The order
 * of plugins within a layer is undefined and must not be relied upon; declare
 * a (used) dependency to force one.
 */
public final class DependencyResolver {

  private DependencyResolver() {
    // Utility class
  }

  /**
   * Orders plugin names by their dependencies.
   *
   * @param candidates
   *            map of plugin name to its dependencies
   * @return the names in load order
   * @throws DependencyResolutionException
   *             if the remaining plugins cannot be ordered
   */
  public static List<String> resolve(Map<String, Dependencies> candidates) {
    Map<String, Dependencies> pending = new LinkedHashMap<>(candidates);
    Set<String> resolved = new HashSet<>();
    List<String> order = new ArrayList<>(candidates.size());

    while (!pending.isEmpty()) {
      // Plugins with both required and used plugins met
      List<String> ready = new ArrayList<>();
      for (Map.Entry<String, Dependencies> entry : pending.entrySet()) {
        Dependencies deps = entry.getValue();
        if (resolved.containsAll(deps.getRequired()) && usedMet(deps, pending)) {
          ready.add(entry.getKey());
        }
      }
      if (ready.isEmpty()) {
        // Otherwise plugins with all required plugins met
        for (Map.Entry<String, Dependencies> entry : pending.entrySet()) {
          if (resolved.containsAll(entry.getValue().getRequired())) {
            ready.add(entry.getKey());
          }
        }
      }
      if (ready.isEmpty()) {
        throw new DependencyResolutionException(unresolved(pending, resolved));
      }
      for (String name : ready) {
        pending.remove(name);
        resolved.add(name);
        order.add(name);
      }
    }
    return order;
  }

  /**
   * Orders plugin descriptors by their dependencies.
   *
   * @param descriptors
   *            the candidates, with unique names
   * @return the descriptors in load order
   * @throws DependencyResolutionException
   *             if the remaining plugins cannot be ordered
   */
  public static List<PluginDescriptor> resolveDescriptors(Collection<PluginDescriptor> descriptors) {
    Map<String, PluginDescriptor> byName = new LinkedHashMap<>();
    Map<String, Dependencies> candidates = new LinkedHashMap<>();
    for (PluginDescriptor descriptor : descriptors) {
      if (byName.put(descriptor.getName(), descriptor) != null) {
        throw new IllegalArgumentException("Duplicate plugin name: " + descriptor.getName());
      }
      candidates.put(descriptor.getName(),
          new Dependencies(descriptor.getRequiredPlugins(), descriptor.getUsedPlugins()));
    }
    List<PluginDescriptor> ordered = new ArrayList<>(byName.size());
    for (String name : resolve(candidates)) {
      ordered.add(byName.get(name));
    }
    return ordered;
  }

  // A used plugin that is not a candidate counts as met
  private static boolean usedMet(Dependencies deps, Map<String, Dependencies> pending) {
    for (String used : deps.getUsed()) {
      if (pending.containsKey(used)) {
        return false;
      }
    }
    return true;
  }

  private static Map<String, Set<String>> unresolved(Map<String, Dependencies> pending, Set<String> resolved) {
    Map<String, Set<String>> unresolved = new LinkedHashMap<>();
    for (Map.Entry<String, Dependencies> entry : pending.entrySet()) {
      Set<String> missing = new LinkedHashSet<>(entry.getValue().getRequired());
      missing.removeAll(resolved);
      unresolved.put(entry.getKey(), Collections.unmodifiableSet(missing));
    }
    return unresolved;
  }

  /**
   * The required and used plugins of one candidate.
   */
  public static final class Dependencies {

    private final Set<String> required;
    private final Set<String> used;

    public Dependencies(Set<String> required, Set<String> used) {
      this.required = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(required, "required")));
      this.used = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(used, "used")));
    }

    public static Dependencies of(Set<String> required, Set<String> used) {
      return new Dependencies(required, used);
    }

    public Set<String> getRequired() {
      return required;
    }

    public Set<String> getUsed() {
      return used;
    }

    @Override
    public String toString() {
      return "requires=" + required + ", uses=" + used;
    }
  }
}
