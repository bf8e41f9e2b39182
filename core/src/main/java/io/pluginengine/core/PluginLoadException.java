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
 * Thrown by a {@link PluginLoader} when a discovered candidate cannot be turned
 * into a working implementation.
 */
public class PluginLoadException extends PluginEngineException {

  public static final String ERROR_CODE = "MATERIALIZE_FAILED";

  public PluginLoadException(String message) {
    super(message, null, ERROR_CODE, null);
  }

  public PluginLoadException(String message, Throwable cause) {
    super(message, cause, ERROR_CODE, null);
  }
}
