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

/**
 * Records a plugin that could not be loaded and why.
 */
public final class PluginFailure {

  private final String name;
  private final FailureReason reason;
  private final String message;
  private final Throwable cause;

  public PluginFailure(String name, FailureReason reason, String message, Throwable cause) {
    this.name = Objects.requireNonNull(name, "name");
    this.reason = Objects.requireNonNull(reason, "reason");
    this.message = message;
    this.cause = cause;
  }

  public PluginFailure(String name, FailureReason reason, String message) {
    this(name, reason, message, null);
  }

  public String getName() {
    return name;
  }

  public FailureReason getReason() {
    return reason;
  }

  public String getMessage() {
    return message;
  }

  /**
   * Returns the exception that caused the failure.
   *
   * @return the cause, or null if the failure was not caused by an exception
   */
  public Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return "PluginFailure{" + name + ", " + reason + ", " + message + "}";
  }
}
