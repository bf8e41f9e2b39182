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
 * ApplicationScope is the host resource the engine holds while a plugin
 * initializes, e.g. an application or request context. The engine does not
 * know what it represents; it only opens it and closes it around
 * {@link Plugin#init()}.
 */
@FunctionalInterface
public interface ApplicationScope {

  /** A scope that does nothing. */
  ApplicationScope NONE = () -> () -> {
  };

  /**
   * Acquires the scope.
   *
   * @return a handle that releases the scope when closed
   */
  Scope open();

  /**
   * An acquired application scope.
   */
  @FunctionalInterface
  interface Scope extends AutoCloseable {

    @Override
    void close();
  }
}
