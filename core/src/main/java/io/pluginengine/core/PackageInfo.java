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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of the package a plugin implementation ships in, as reported by the
 * {@link PluginLoader}.
 */
public final class PackageInfo {

  private final String packageName;
  private final String packageVersion;
  private final Path rootPath;

  /**
   * Creates a new PackageInfo.
   *
   * @param packageName
   *            the package name
   * @param packageVersion
   *            the package version, may be null if unknown
   * @param rootPath
   *            the location the implementation was loaded from, may be null
   */
  public PackageInfo(String packageName, String packageVersion, Path rootPath) {
    this.packageName = Objects.requireNonNull(packageName, "packageName");
    this.packageVersion = packageVersion;
    this.rootPath = rootPath;
  }

  public String getPackageName() {
    return packageName;
  }

  public String getPackageVersion() {
    return packageVersion;
  }

  public Path getRootPath() {
    return rootPath;
  }

  @Override
  public String toString() {
    return packageName + " " + packageVersion;
  }
}
