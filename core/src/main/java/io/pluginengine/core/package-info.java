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

/**
 * Core types for loading plugins into a host application.
 *
 * <h2>Key Components</h2>
 * <ul>
 * <li>{@link io.pluginengine.core.Plugin} - Base class of every plugin</li>
 * <li>{@link io.pluginengine.core.PluginFactory} - What a loader must produce
 * for a plugin name; {@link io.pluginengine.core.PluginDefinition} is the
 * builder-based implementation</li>
 * <li>{@link io.pluginengine.core.DependencyResolver} - Orders plugins by their
 * required and used dependencies</li>
 * <li>{@link io.pluginengine.core.PluginContext} - Per-thread stack of the
 * plugins code is running for</li>
 * <li>{@link io.pluginengine.core.PluginLoader} - Discovery of plugin
 * implementations</li>
 * </ul>
 *
 * <h2>Example Usage</h2>
 *
 * <pre>{@code
 * public class EspressoFactory extends PluginDefinition {
 *   public EspressoFactory() {
 *     super(PluginDefinition.builder(EspressoPlugin::new).requires("grinder").uses("milk"));
 *   }
 * }
 * }</pre>
 */
package io.pluginengine.core;
