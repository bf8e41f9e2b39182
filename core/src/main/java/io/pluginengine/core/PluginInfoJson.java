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
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes plugin listings, the JSON form of
 * {@link PluginInfo} lists that hosts show on status pages or exchange with
 * other tools.
 */
public final class PluginInfoJson {

  private static final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final TypeReference<List<PluginInfo>> LISTING = new TypeReference<>() {
  };

  private PluginInfoJson() {
    // Utility class
  }

  /**
   * Writes a plugin listing as a JSON array.
   *
   * @param infos
   *            the plugin summaries, in listing order
   * @return the JSON array
   * @throws PluginEngineException
   *             if a summary cannot be serialized
   */
  public static String write(Collection<PluginInfo> infos) {
    try {
      return mapper.writeValueAsString(new ArrayList<>(infos));
    } catch (JsonProcessingException e) {
      throw new PluginEngineException("Failed to write plugin listing: " + e.getMessage(), e);
    }
  }

  /**
   * Reads a plugin listing written by {@link #write(Collection)}. Unknown
   * fields are ignored.
   *
   * @param json
   *            the JSON array
   * @return the plugin summaries
   * @throws PluginEngineException
   *             if the JSON is not a plugin listing
   */
  public static List<PluginInfo> read(String json) {
    try {
      List<PluginInfo> infos = mapper.readValue(json, LISTING);
      if (infos == null) {
        throw new PluginEngineException("Plugin listing must be a JSON array");
      }
      return infos;
    } catch (JsonProcessingException e) {
      throw new PluginEngineException("Failed to read plugin listing: " + e.getMessage(), e);
    }
  }
}
