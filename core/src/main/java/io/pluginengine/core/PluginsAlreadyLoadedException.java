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

/**
 * Thrown when plugins are loaded a second time on the same engine.
 */
public class PluginsAlreadyLoadedException extends PluginEngineException {

  public static final String ERROR_CODE = "DOUBLE_LOAD";

  public PluginsAlreadyLoadedException() {
    super("Plugins already loaded", null, ERROR_CODE, null);
  }
}
