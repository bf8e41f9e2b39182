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
 * Thrown when the plugin popped from the context stack is not the plugin the
 * exiting scope pushed. This means scopes were exited out of order and the
 * stack can no longer be trusted.
 */
public class PluginContextMismatchException extends PluginEngineException {

  public static final String ERROR_CODE = "CONTEXT_MISMATCH";

  private final transient Plugin expected;
  private final transient Plugin actual;

  /**
   * Creates a new PluginContextMismatchException.
   *
   * @param expected
   *            the plugin the scope pushed
   * @param actual
   *            the plugin found on top of the stack, or null if it was empty
   */
  public PluginContextMismatchException(Plugin expected, Plugin actual) {
    super("Popped wrong plugin: expected " + expected + " but found " + actual, null, ERROR_CODE, null);
    this.expected = expected;
    this.actual = actual;
  }

  public Plugin getExpected() {
    return expected;
  }

  public Plugin getActual() {
    return actual;
  }
}
