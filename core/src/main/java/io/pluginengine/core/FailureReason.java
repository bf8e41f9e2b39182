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
 * Why a requested plugin could not become a load candidate.
 */
public enum FailureReason {

  /** The loader found no implementation for the name. */
  NOT_FOUND,

  /** The loader found more than one implementation for the name. */
  AMBIGUOUS,

  /** The loader could not load the implementation. */
  MATERIALIZE_FAILED,

  /** The implementation is not a {@link PluginFactory}. */
  CONTRACT_VIOLATION
}
