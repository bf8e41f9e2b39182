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

import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PluginInfo is a serializable summary of an active plugin, used by hosts to
 * list plugins.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PluginInfo {

  @JsonProperty("name")
  private String name;

  @JsonProperty("packageName")
  private String packageName;

  @JsonProperty("packageVersion")
  private String packageVersion;

  @JsonProperty("version")
  private String version;

  @JsonProperty("title")
  private String title;

  @JsonProperty("description")
  private String description;

  @JsonProperty("requiredPlugins")
  private Set<String> requiredPlugins;

  @JsonProperty("usedPlugins")
  private Set<String> usedPlugins;

  /**
   * Default constructor for Jackson deserialization.
   */
  public PluginInfo() {
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getPackageName() {
    return packageName;
  }

  public void setPackageName(String packageName) {
    this.packageName = packageName;
  }

  public String getPackageVersion() {
    return packageVersion;
  }

  public void setPackageVersion(String packageVersion) {
    this.packageVersion = packageVersion;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Set<String> getRequiredPlugins() {
    return requiredPlugins;
  }

  public void setRequiredPlugins(Set<String> requiredPlugins) {
    this.requiredPlugins = requiredPlugins;
  }

  public Set<String> getUsedPlugins() {
    return usedPlugins;
  }

  public void setUsedPlugins(Set<String> usedPlugins) {
    this.usedPlugins = usedPlugins;
  }
}
