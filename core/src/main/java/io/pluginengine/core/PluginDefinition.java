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
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * PluginDefinition is the standard {@link PluginFactory}: a constructor
 * reference plus the declared dependencies and metadata.
 *
 * <pre>{@code
 * PluginFactory espresso = PluginDefinition.builder(EspressoPlugin::new)
 *     .requires("grinder")
 *     .uses("milk", "sugar")
 *     .documentation("Espresso\n\nCreamy espresso out of your app")
 *     .build();
 * }</pre>
 */
public class PluginDefinition implements PluginFactory {

  private final Supplier<? extends Plugin> constructor;
  private final Set<String> requiredPlugins;
  private final Set<String> usedPlugins;
  private final String version;
  private final String documentation;

  protected PluginDefinition(Builder builder) {
    this.constructor = builder.constructor;
    this.requiredPlugins = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredPlugins));
    this.usedPlugins = Collections.unmodifiableSet(new LinkedHashSet<>(builder.usedPlugins));
    this.version = builder.version;
    this.documentation = builder.documentation;
  }

  /**
   * Creates a builder for a PluginDefinition.
   *
   * @param constructor
   *            creates the plugin instance
   * @return a new builder
   */
  public static Builder builder(Supplier<? extends Plugin> constructor) {
    return new Builder(constructor);
  }

  /**
   * Creates a PluginDefinition without dependencies or metadata.
   *
   * @param constructor
   *            creates the plugin instance
   * @return the definition
   */
  public static PluginDefinition of(Supplier<? extends Plugin> constructor) {
    return builder(constructor).build();
  }

  @Override
  public Plugin create() {
    return constructor.get();
  }

  @Override
  public Set<String> getRequiredPlugins() {
    return requiredPlugins;
  }

  @Override
  public Set<String> getUsedPlugins() {
    return usedPlugins;
  }

  @Override
  public String getVersion() {
    return version;
  }

  @Override
  public String getDocumentation() {
    return documentation;
  }

  /**
   * Builder for PluginDefinition. Calling {@link #requires(String...)} or
   * {@link #uses(String...)} several times accumulates the names.
   */
  public static class Builder {
    private final Supplier<? extends Plugin> constructor;
    private final Set<String> requiredPlugins = new LinkedHashSet<>();
    private final Set<String> usedPlugins = new LinkedHashSet<>();
    private String version;
    private String documentation;

    protected Builder(Supplier<? extends Plugin> constructor) {
      this.constructor = Objects.requireNonNull(constructor, "constructor");
    }

    public Builder requires(String... plugins) {
      Collections.addAll(requiredPlugins, plugins);
      return this;
    }

    public Builder uses(String... plugins) {
      Collections.addAll(usedPlugins, plugins);
      return this;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder documentation(String documentation) {
      this.documentation = documentation;
      return this;
    }

    public PluginDefinition build() {
      return new PluginDefinition(this);
    }
  }
}
