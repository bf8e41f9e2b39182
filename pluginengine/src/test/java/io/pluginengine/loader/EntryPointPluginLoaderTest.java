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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.pluginengine.PluginEngine;
import io.pluginengine.core.FailureReason;
import io.pluginengine.core.PackageInfo;
import io.pluginengine.core.Plugin;
import io.pluginengine.core.PluginFactory;
import io.pluginengine.core.PluginHandle;
import io.pluginengine.core.PluginLoadException;

/**
 * Unit tests for EntryPointPluginLoader.
 */
class EntryPointPluginLoaderTest {

  private static final String NAMESPACE = "coffee.plugins";

  @TempDir
  Path tempDir;

  private URLClassLoader classLoader;

  @AfterEach
  void tearDown() throws IOException {
    if (classLoader != null) {
      classLoader.close();
    }
  }

  private EntryPointPluginLoader loader(String... entryPointFiles) throws IOException {
    URL[] urls = new URL[entryPointFiles.length];
    for (int i = 0; i < entryPointFiles.length; i++) {
      Path root = tempDir.resolve("jar" + i);
      Path dir = root.resolve(EntryPointPluginLoader.ENTRY_POINT_DIR);
      Files.createDirectories(dir);
      Files.write(dir.resolve(NAMESPACE + ".properties"), entryPointFiles[i].getBytes(StandardCharsets.UTF_8));
      urls[i] = root.toUri().toURL();
    }
    classLoader = new URLClassLoader(urls, getClass().getClassLoader());
    return new EntryPointPluginLoader(classLoader);
  }

  private static String entry(String name, Class<?> type) {
    return name + "=" + type.getName() + "\n";
  }

  @Test
  void testFindsPlugin() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", EspressoFactory.class));

    List<PluginHandle> handles = loader.find(NAMESPACE, "espresso");

    assertEquals(1, handles.size());
    assertEquals("espresso", handles.get(0).getName());
    assertEquals(EspressoFactory.class.getName(), handles.get(0).getTarget());
    assertTrue(handles.get(0).getOrigin().contains("jar0"));
  }

  @Test
  void testUnknownNameAndNamespace() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", EspressoFactory.class));

    assertTrue(loader.find(NAMESPACE, "tea").isEmpty());
    assertTrue(loader.find("tea.plugins", "espresso").isEmpty());
  }

  @Test
  void testSameNameInTwoLocations() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", EspressoFactory.class),
        entry("espresso", EspressoFactory.class) + entry("milk", EspressoFactory.class));

    List<PluginHandle> handles = loader.find(NAMESPACE, "espresso");

    assertEquals(2, handles.size());
    assertNotEquals(handles.get(0).getOrigin(), handles.get(1).getOrigin());
    assertEquals(1, loader.find(NAMESPACE, "milk").size());
  }

  @Test
  void testMaterialize() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", EspressoFactory.class));
    PluginHandle handle = loader.find(NAMESPACE, "espresso").get(0);

    assertTrue(loader.materialize(handle) instanceof EspressoFactory);
  }

  @Test
  void testMaterializeMissingClass() throws IOException {
    EntryPointPluginLoader loader = loader("espresso=com.example.coffee.MissingFactory\n");
    PluginHandle handle = loader.find(NAMESPACE, "espresso").get(0);

    PluginLoadException exception = assertThrows(PluginLoadException.class, () -> loader.materialize(handle));

    assertTrue(exception.getCause() instanceof ClassNotFoundException);
  }

  @Test
  void testMaterializeWithoutNoArgConstructor() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", NoDefaultConstructorFactory.class));
    PluginHandle handle = loader.find(NAMESPACE, "espresso").get(0);

    PluginLoadException exception = assertThrows(PluginLoadException.class, () -> loader.materialize(handle));

    assertTrue(exception.getCause() instanceof NoSuchMethodException);
  }

  @Test
  void testPackageInfo() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", EspressoFactory.class));
    PluginHandle handle = loader.find(NAMESPACE, "espresso").get(0);

    PackageInfo packageInfo = loader.packageInfo(handle);

    assertEquals("io.pluginengine.loader", packageInfo.getPackageName());
    assertNotNull(packageInfo.getRootPath());
    assertTrue(packageInfo.getRootPath().isAbsolute());
  }

  @Test
  void testLoadsPluginsIntoEngine() throws IOException {
    EntryPointPluginLoader loader = loader(entry("espresso", EspressoFactory.class)
        + entry("imposter", String.class));
    PluginEngine engine = PluginEngine.builder().namespace(NAMESPACE).plugins("espresso", "imposter")
        .skipFailed(true).loader(loader).build();

    assertFalse(engine.loadPlugins());

    assertTrue(engine.getPlugin("espresso") instanceof Espresso);
    assertEquals(FailureReason.CONTRACT_VIOLATION, engine.getFailureDetails().get("imposter").getReason());
  }

  /**
   * An espresso plugin.
   */
  public static class Espresso extends Plugin {
  }

  /**
   * Creates the espresso plugin.
   */
  public static class EspressoFactory implements PluginFactory {
    @Override
    public Plugin create() {
      return new Espresso();
    }
  }

  /**
   * Cannot be created reflectively.
   */
  public static class NoDefaultConstructorFactory implements PluginFactory {
    private final String roast;

    public NoDefaultConstructorFactory(String roast) {
      this.roast = roast;
    }

    @Override
    public Plugin create() {
      return new Espresso();
    }

    @Override
    public String getVersion() {
      return roast;
    }
  }
}
