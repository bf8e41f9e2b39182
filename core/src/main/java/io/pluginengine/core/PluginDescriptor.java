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
import java.util.Set;

/**
 * PluginDescriptor is a validated load candidate: the configured name, the
 * {@link PluginFactory} the loader produced for it, and the package it came
 * from. It is what the {@link DependencyResolver} orders and what the engine
 * instantiates.
 */
public final class PluginDescriptor {

  private final String name;
  private final PluginFactory factory;
  private final PackageInfo packageInfo;

  /**
   * Creates a new PluginDescriptor.
   *
   * @param name
   *            the plugin name, unique within a load pass
   * @param factory
   *            the factory that creates the plugin
   * @param packageInfo
   *            the package the factory was loaded from
   */
  public PluginDescriptor(String name, PluginFactory factory, PackageInfo packageInfo) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Plugin name must not be empty");
    }
    this.name = name;
    this.factory = Objects.requireNonNull(factory, "factory");
    this.packageInfo = Objects.requireNonNull(packageInfo, "packageInfo");
  }

  public String getName() {
    return name;
  }

  public PluginFactory getFactory() {
    return factory;
  }

  public PackageInfo getPackageInfo() {
    return packageInfo;
  }

  public Set<String> getRequiredPlugins() {
    return factory.getRequiredPlugins();
  }

  public Set<String> getUsedPlugins() {
    return factory.getUsedPlugins();
  }

  /**
   * Returns the plugin version: the version the factory declares, or the
   * package version if it declares none.
   *
   * @return the version
   */
  public String getVersion() {
    String version = factory.getVersion();
    return version != null ? version : packageInfo.getPackageVersion();
  }

  public String getDocumentation() {
    return factory.getDocumentation();
  }

  /**
   * Creates the plugin, binds it to the engine and runs its
   * {@link Plugin#init()} hook inside the application scope and the plugin's
   * own context.
   *
   * @param engine
   *            the engine the plugin belongs to
   * @param applicationScope
   *            the host scope to hold during initialization
   * @return the initialized plugin
   */
  public Plugin instantiate(PluginRegistry engine, ApplicationScope applicationScope) {
    Plugin plugin = factory.create();
    if (plugin == null) {
      throw new PluginEngineException("Plugin factory for " + name + " returned null");
    }
    plugin.bind(engine, this);
    try (ApplicationScope.Scope app = applicationScope.open(); PluginContext.Scope ctx = plugin.pluginContext()) {
      plugin.init();
    }
    return plugin;
  }

  @Override
  public String toString() {
    return "PluginDescriptor{" + name + ", requires=" + getRequiredPlugins() + ", uses=" + getUsedPlugins() + "}";
  }
}
