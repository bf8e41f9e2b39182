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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.pluginengine.core.PluginEngineException;

/**
 * PluginEngineOptions contains configuration options for a {@link PluginEngine}.
 */
public class PluginEngineOptions {

  static final String NAMESPACE_ENV = "PLUGINENGINE_NAMESPACE";
  static final String PLUGINS_ENV = "PLUGINENGINE_PLUGINS";
  static final String SKIP_FAILED_ENV = "PLUGINENGINE_SKIP_FAILED";

  private static final ObjectMapper mapper = new ObjectMapper();

  private final String namespace;
  private final List<String> plugins;
  private final boolean skipFailed;

  private PluginEngineOptions(Builder builder) {
    this.namespace = builder.namespace;
    this.plugins = Collections.unmodifiableList(new ArrayList<>(builder.plugins));
    this.skipFailed = builder.skipFailed;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses options from JSON of the form
   * {@code {"namespace": "...", "plugins": ["..."], "skipFailed": true}}.
   * Missing fields keep their builder defaults.
   *
   * @param json
   *            the JSON document
   * @return the options
   * @throws PluginEngineException
   *             if the JSON is malformed
   */
  public static PluginEngineOptions fromJson(String json) {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new PluginEngineException("Failed to parse plugin engine options: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new PluginEngineException("Plugin engine options must be a JSON object");
    }
    Builder builder = builder();
    if (root.hasNonNull("namespace")) {
      builder.namespace(root.get("namespace").asText());
    }
    if (root.has("plugins")) {
      JsonNode plugins = root.get("plugins");
      if (!plugins.isArray()) {
        throw new PluginEngineException("'plugins' must be a JSON array");
      }
      List<String> names = new ArrayList<>();
      for (JsonNode plugin : plugins) {
        names.add(plugin.asText());
      }
      builder.plugins(names);
    }
    if (root.hasNonNull("skipFailed")) {
      builder.skipFailed(root.get("skipFailed").asBoolean());
    }
    return builder.build();
  }

  /**
   * Parses options from a JSON classpath resource.
   *
   * @param resourcePath
   *            the resource path, e.g. "/pluginengine.json"
   * @return the options
   * @throws PluginEngineException
   *             if the resource is missing or malformed
   */
  public static PluginEngineOptions fromResource(String resourcePath) {
    try (InputStream in = PluginEngineOptions.class.getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new PluginEngineException("Plugin engine options not found: " + resourcePath);
      }
      return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new PluginEngineException("Failed to read plugin engine options: " + resourcePath, e);
    }
  }

  /**
   * Returns the namespace plugins are looked up in.
   *
   * @return the namespace
   */
  public String getNamespace() {
    return namespace;
  }

  /**
   * Returns the names of the plugins to load, in configuration order.
   *
   * @return the plugin names
   */
  public List<String> getPlugins() {
    return plugins;
  }

  /**
   * Returns whether {@link PluginEngine#loadPlugins()} instantiates the
   * remaining plugins when some could not be loaded.
   *
   * @return true if failed plugins are skipped
   */
  public boolean isSkipFailed() {
    return skipFailed;
  }

  static List<String> normalizePlugins(Collection<String> names) {
    Set<String> unique = new LinkedHashSet<>();
    for (String name : names) {
      if (name == null || name.trim().isEmpty()) {
        throw new IllegalArgumentException("Plugin names must not be empty");
      }
      unique.add(name.trim());
    }
    return new ArrayList<>(unique);
  }

  /**
   * Builder for PluginEngineOptions.
   */
  public static class Builder {
    private String namespace = getNamespaceFromEnv();
    private List<String> plugins = getPluginsFromEnv();
    private boolean skipFailed = getSkipFailedFromEnv();

    private static String getNamespaceFromEnv() {
      String env = System.getenv(NAMESPACE_ENV);
      return env != null && !env.isBlank() ? env.trim() : "pluginengine.plugins";
    }

    private static List<String> getPluginsFromEnv() {
      String env = System.getenv(PLUGINS_ENV);
      return parsePluginList(env);
    }

    private static boolean getSkipFailedFromEnv() {
      String env = System.getenv(SKIP_FAILED_ENV);
      return env == null || !"false".equalsIgnoreCase(env.trim());
    }

    static List<String> parsePluginList(String value) {
      List<String> names = new ArrayList<>();
      if (value == null) {
        return names;
      }
      for (String part : value.split(",")) {
        if (!part.isBlank()) {
          names.add(part.trim());
        }
      }
      return normalizePlugins(names);
    }

    public Builder namespace(String namespace) {
      if (namespace == null || namespace.isBlank()) {
        throw new IllegalArgumentException("Namespace must not be empty");
      }
      this.namespace = namespace;
      return this;
    }

    public Builder plugins(Collection<String> plugins) {
      this.plugins = normalizePlugins(plugins);
      return this;
    }

    public Builder plugins(String... plugins) {
      List<String> names = new ArrayList<>();
      Collections.addAll(names, plugins);
      return plugins(names);
    }

    public Builder skipFailed(boolean skipFailed) {
      this.skipFailed = skipFailed;
      return this;
    }

    public PluginEngineOptions build() {
      return new PluginEngineOptions(this);
    }
  }
}
