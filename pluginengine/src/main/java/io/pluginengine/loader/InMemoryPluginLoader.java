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

package io.pluginengine.loader;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pluginengine.core.PackageInfo;
import io.pluginengine.core.PluginHandle;
import io.pluginengine.core.PluginLoadException;
import io.pluginengine.core.PluginLoader;

/**
 * A {@link PluginLoader} for plugins registered in code. Registering the same
 * name twice in a namespace is allowed and makes the name ambiguous to the
 * engine, just like two jars declaring the same entry point.
 */
public class InMemoryPluginLoader implements PluginLoader {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryPluginLoader.class);

  // namespace -> plugin name -> registrations
  private final Map<String, Map<String, List<Registration>>> registrations = new ConcurrentHashMap<>();

  /**
   * Registers an implementation, using its class's package as package info.
   *
   * @param namespace
   *            the namespace
   * @param name
   *            the plugin name
   * @param implementation
   *            the implementation, normally a
   *            {@link io.pluginengine.core.PluginFactory}
   * @return this loader
   */
  public InMemoryPluginLoader register(String namespace, String name, Object implementation) {
    Objects.requireNonNull(implementation, "implementation");
    Class<?> type = implementation.getClass();
    Package pkg = type.getPackage();
    String version = pkg != null ? pkg.getImplementationVersion() : null;
    return register(namespace, name, implementation,
        new PackageInfo(type.getPackageName(), version, EntryPointPluginLoader.rootPath(type)));
  }

  /**
   * Registers an implementation with explicit package info.
   *
   * @param namespace
   *            the namespace
   * @param name
   *            the plugin name
   * @param implementation
   *            the implementation
   * @param packageInfo
   *            the package the implementation belongs to
   * @return this loader
   */
  public synchronized InMemoryPluginLoader register(String namespace, String name, Object implementation,
      PackageInfo packageInfo) {
    Objects.requireNonNull(packageInfo, "packageInfo");
    List<Registration> list = registrations.computeIfAbsent(namespace, k -> new ConcurrentHashMap<>())
        .computeIfAbsent(name, k -> new CopyOnWriteArrayList<>());
    String target = implementation != null ? implementation.getClass().getName() : "null";
    PluginHandle handle = new PluginHandle(name, target,
        namespace + ":" + packageInfo.getPackageName() + "#" + list.size());
    list.add(new Registration(handle, implementation, packageInfo));
    logger.debug("Registered plugin {} in namespace {}", name, namespace);
    return this;
  }

  /**
   * Registers a plugin whose implementation fails to load with the given
   * error.
   *
   * @param namespace
   *            the namespace
   * @param name
   *            the plugin name
   * @param error
   *            the error {@link #materialize(PluginHandle)} will throw
   * @return this loader
   */
  public InMemoryPluginLoader registerBroken(String namespace, String name, Throwable error) {
    return register(namespace, name, new BrokenImplementation(error),
        new PackageInfo(name, null, Paths.get("").toAbsolutePath()));
  }

  @Override
  public List<PluginHandle> find(String namespace, String name) {
    List<PluginHandle> handles = new ArrayList<>();
    Map<String, List<Registration>> byName = registrations.getOrDefault(namespace, Map.of());
    for (Registration registration : byName.getOrDefault(name, List.of())) {
      handles.add(registration.handle);
    }
    return handles;
  }

  @Override
  public Object materialize(PluginHandle handle) throws PluginLoadException {
    Registration registration = lookup(handle);
    if (registration.implementation instanceof BrokenImplementation) {
      Throwable error = ((BrokenImplementation) registration.implementation).error;
      throw new PluginLoadException("Could not load plugin " + handle.getName() + ": " + error.getMessage(), error);
    }
    return registration.implementation;
  }

  @Override
  public PackageInfo packageInfo(PluginHandle handle) {
    return lookup(handle).packageInfo;
  }

  private Registration lookup(PluginHandle handle) {
    for (Map<String, List<Registration>> byName : registrations.values()) {
      for (Registration registration : byName.getOrDefault(handle.getName(), List.of())) {
        if (registration.handle.equals(handle)) {
          return registration;
        }
      }
    }
    throw new PluginLoadException("Unknown plugin handle: " + handle);
  }

  private static final class Registration {
    final PluginHandle handle;
    final Object implementation;
    final PackageInfo packageInfo;

    Registration(PluginHandle handle, Object implementation, PackageInfo packageInfo) {
      this.handle = handle;
      this.implementation = implementation;
      this.packageInfo = packageInfo;
    }
  }

  private static final class BrokenImplementation {
    final Throwable error;

    BrokenImplementation(Throwable error) {
      this.error = Objects.requireNonNull(error, "error");
    }
  }
}
