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

package io.pluginengine.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Constructor;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pluginengine.core.PackageInfo;
import io.pluginengine.core.PluginHandle;
import io.pluginengine.core.PluginLoadException;
import io.pluginengine.core.PluginLoader;

/**
 * Finds plugins through entry point files on the class path.
 *
 * <p>
 * Every {@code META-INF/pluginengine/<namespace>.properties} resource visible
 * to the class loader is read. Each entry maps a plugin name to the class of its
 * {@link io.pluginengine.core.PluginFactory}:
 *
 * <pre>
 * espresso=com.example.coffee.EspressoPluginFactory
 * </pre>
 *
 * <p>
 * If several jars register the same name, the name is ambiguous. The factory
 * class must have a public no-arg constructor.
 */
public class EntryPointPluginLoader implements PluginLoader {

  private static final Logger logger = LoggerFactory.getLogger(EntryPointPluginLoader.class);

  /** Directory holding the entry point files, one per namespace. */
  public static final String ENTRY_POINT_DIR = "META-INF/pluginengine/";

  private final ClassLoader classLoader;

  /**
   * Creates a loader that uses the current thread's context class loader.
   */
  public EntryPointPluginLoader() {
    this(defaultClassLoader());
  }

  /**
   * Creates a loader that uses the given class loader.
   *
   * @param classLoader
   *            the class loader to read entry points and classes from
   */
  public EntryPointPluginLoader(ClassLoader classLoader) {
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  private static ClassLoader defaultClassLoader() {
    ClassLoader context = Thread.currentThread().getContextClassLoader();
    return context != null ? context : EntryPointPluginLoader.class.getClassLoader();
  }

  @Override
  public List<PluginHandle> find(String namespace, String name) {
    List<PluginHandle> handles = new ArrayList<>();
    String resource = ENTRY_POINT_DIR + namespace + ".properties";
    Enumeration<URL> urls;
    try {
      urls = classLoader.getResources(resource);
    } catch (IOException e) {
      logger.warn("Failed to list entry points {}: {}", resource, e.getMessage());
      return handles;
    }
    while (urls.hasMoreElements()) {
      URL url = urls.nextElement();
      Properties entryPoints = readEntryPoints(url);
      if (entryPoints == null) {
        continue;
      }
      String target = entryPoints.getProperty(name);
      if (target != null && !target.isBlank()) {
        handles.add(new PluginHandle(name, target.trim(), url.toString()));
      }
    }
    logger.debug("Found {} entry point(s) for {} in namespace {}", handles.size(), name, namespace);
    return handles;
  }

  private static Properties readEntryPoints(URL url) {
    Properties properties = new Properties();
    try (InputStream in = url.openStream();
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      properties.load(reader);
      return properties;
    } catch (IOException e) {
      logger.warn("Failed to read entry points from {} (skipping): {}", url, e.getMessage());
      return null;
    }
  }

  @Override
  public Object materialize(PluginHandle handle) throws PluginLoadException {
    Class<?> type = loadClass(handle);
    try {
      Constructor<?> constructor = type.getConstructor();
      return constructor.newInstance();
    } catch (ReflectiveOperationException e) {
      throw new PluginLoadException("Could not instantiate " + handle.getTarget(), e);
    } catch (LinkageError e) {
      throw new PluginLoadException("Could not initialize " + handle.getTarget(), e);
    }
  }

  @Override
  public PackageInfo packageInfo(PluginHandle handle) {
    Class<?> type = loadClass(handle);
    Package pkg = type.getPackage();
    String packageName = pkg != null && pkg.getImplementationTitle() != null ? pkg.getImplementationTitle()
        : type.getPackageName();
    String packageVersion = pkg != null ? pkg.getImplementationVersion() : null;
    return new PackageInfo(packageName, packageVersion, rootPath(type));
  }

  private Class<?> loadClass(PluginHandle handle) {
    try {
      return Class.forName(handle.getTarget(), true, classLoader);
    } catch (ClassNotFoundException | LinkageError e) {
      throw new PluginLoadException("Could not load class " + handle.getTarget(), e);
    }
  }

  /**
   * Returns where a class was loaded from, or the working directory if that
   * cannot be determined.
   */
  static Path rootPath(Class<?> type) {
    CodeSource codeSource = type.getProtectionDomain().getCodeSource();
    if (codeSource != null && codeSource.getLocation() != null) {
      try {
        return Paths.get(codeSource.getLocation().toURI()).toAbsolutePath();
      } catch (URISyntaxException | IllegalArgumentException e) {
        logger.debug("Cannot resolve code source of {}: {}", type.getName(), e.getMessage());
      }
    }
    return Paths.get("").toAbsolutePath();
  }
}
