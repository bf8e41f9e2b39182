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

package io.pluginengine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.pluginengine.core.ApplicationScope;
import io.pluginengine.core.DependencyResolutionException;
import io.pluginengine.core.FailureReason;
import io.pluginengine.core.PackageInfo;
import io.pluginengine.core.Plugin;
import io.pluginengine.core.PluginContext;
import io.pluginengine.core.PluginDefinition;
import io.pluginengine.core.PluginEngineException;
import io.pluginengine.core.PluginFailure;
import io.pluginengine.core.PluginHandle;
import io.pluginengine.core.PluginInfo;
import io.pluginengine.core.PluginInfoJson;
import io.pluginengine.core.PluginLoadException;
import io.pluginengine.core.PluginLoader;
import io.pluginengine.core.PluginsAlreadyLoadedException;
import io.pluginengine.loader.InMemoryPluginLoader;

/**
 * Unit tests for PluginEngine.
 */
@ExtendWith(MockitoExtension.class)
class PluginEngineTest {

  private static final String NAMESPACE = "coffee.plugins";
  private static final PackageInfo COFFEE = new PackageInfo("coffee", "1.2.3", Paths.get("/opt/coffee"));

  @Mock
  private ApplicationScope applicationScope;

  @Mock
  private ApplicationScope.Scope appScope;

  private InMemoryPluginLoader loader;
  private List<String> initOrder;

  @BeforeEach
  void setUp() {
    loader = new InMemoryPluginLoader();
    initOrder = new ArrayList<>();
  }

  private PluginEngine engine(String... plugins) {
    return PluginEngine.builder().namespace(NAMESPACE).plugins(plugins).skipFailed(true).loader(loader).build();
  }

  private void register(String name) {
    register(name, PluginDefinition.builder(() -> new Barista(initOrder)));
  }

  private void register(String name, PluginDefinition.Builder definition) {
    loader.register(NAMESPACE, name, definition.build(), COFFEE);
  }

  @Test
  void testLoadPlugins() {
    register("espresso");
    register("milk");
    PluginEngine engine = engine("espresso", "milk");
    AtomicInteger announcements = new AtomicInteger();
    engine.getPluginsLoadedSignal().connect(announcements::incrementAndGet);

    assertTrue(engine.loadPlugins());

    assertTrue(engine.isLoaded());
    assertEquals(List.of("espresso", "milk"), new ArrayList<>(engine.getActivePlugins().keySet()));
    assertTrue(engine.getFailedPlugins().isEmpty());
    assertEquals(1, announcements.get());
    assertSame(engine, engine.getPlugin("espresso").getEngine());
  }

  @Test
  void testNothingToLoad() {
    PluginEngine engine = engine();
    AtomicInteger announcements = new AtomicInteger();
    engine.getPluginsLoadedSignal().connect(announcements::incrementAndGet);

    assertTrue(engine.loadPlugins());

    assertTrue(engine.getActivePlugins().isEmpty());
    assertEquals(1, announcements.get());
  }

  @Test
  void testPluginVersion() {
    register("espresso", PluginDefinition.builder(() -> new Barista(initOrder)).version("2.0"));
    register("milk");
    PluginEngine engine = engine("espresso", "milk");

    engine.loadPlugins();

    Plugin espresso = engine.getPlugin("espresso");
    assertEquals("2.0", espresso.getVersion());
    assertEquals("1.2.3", espresso.getPackageVersion());
    assertEquals("coffee", espresso.getPackageName());
    assertEquals(Paths.get("/opt/coffee"), espresso.getRootPath());
    assertEquals("1.2.3", engine.getPlugin("milk").getVersion());
  }

  @Test
  void testNonExistingPlugin() {
    register("espresso");
    PluginEngine engine = engine("espresso", "tea");

    assertFalse(engine.loadPlugins());

    assertEquals(Set.of("tea"), engine.getFailedPlugins());
    assertEquals(FailureReason.NOT_FOUND, engine.getFailureDetails().get("tea").getReason());
    assertTrue(engine.hasPlugin("espresso"));
    assertFalse(engine.hasPlugin("tea"));
    assertNull(engine.getPlugin("tea"));
  }

  @Test
  void testFailedPluginWithoutSkipping() {
    register("espresso");
    PluginEngine engine = engine("espresso", "tea");
    AtomicInteger announcements = new AtomicInteger();
    engine.getPluginsLoadedSignal().connect(announcements::incrementAndGet);

    assertFalse(engine.loadPlugins(false));

    assertTrue(engine.getActivePlugins().isEmpty());
    assertTrue(initOrder.isEmpty());
    assertEquals(Set.of("tea"), engine.getFailedPlugins());
    assertEquals(0, announcements.get());
  }

  @Test
  void testSkipFailedDefaultComesFromOptions() {
    register("espresso");
    PluginEngine engine = PluginEngine.builder().namespace(NAMESPACE).plugins("espresso", "tea").skipFailed(false)
        .loader(loader).build();

    assertFalse(engine.loadPlugins());

    assertTrue(engine.getActivePlugins().isEmpty());
  }

  @Test
  void testAmbiguousPlugin() {
    register("espresso");
    loader.register(NAMESPACE, "espresso", PluginDefinition.of(() -> new Barista(initOrder)),
        new PackageInfo("espresso-fork", "0.1", null));
    register("milk");
    PluginEngine engine = engine("espresso", "milk");

    assertFalse(engine.loadPlugins());

    PluginFailure failure = engine.getFailureDetails().get("espresso");
    assertEquals(FailureReason.AMBIGUOUS, failure.getReason());
    assertTrue(failure.getMessage().contains("coffee"));
    assertTrue(failure.getMessage().contains("espresso-fork"));
    assertEquals(List.of("milk"), new ArrayList<>(engine.getActivePlugins().keySet()));
  }

  @Test
  void testPluginThatFailsToImport() {
    IllegalStateException error = new IllegalStateException("broken beans");
    loader.registerBroken(NAMESPACE, "espresso", error);
    PluginEngine engine = engine("espresso");

    assertFalse(engine.loadPlugins());

    PluginFailure failure = engine.getFailureDetails().get("espresso");
    assertEquals(FailureReason.MATERIALIZE_FAILED, failure.getReason());
    assertTrue(failure.getCause() instanceof PluginLoadException);
    assertSame(error, failure.getCause().getCause());
  }

  @Test
  void testImposterPlugin() {
    loader.register(NAMESPACE, "imposter", new Object(), COFFEE);
    PluginEngine engine = engine("imposter");

    assertFalse(engine.loadPlugins());

    assertEquals(FailureReason.CONTRACT_VIOLATION, engine.getFailureDetails().get("imposter").getReason());
    assertTrue(engine.getActivePlugins().isEmpty());
  }

  @Test
  void testDoubleLoad() {
    register("espresso");
    PluginEngine engine = engine("espresso");
    engine.loadPlugins();

    PluginsAlreadyLoadedException exception = assertThrows(PluginsAlreadyLoadedException.class,
        engine::loadPlugins);

    assertEquals("Plugins already loaded", exception.getMessage());
    assertEquals(1, initOrder.size());
  }

  @Test
  void testDoubleLoadAfterFailedLoad() {
    PluginEngine engine = engine("tea");
    assertFalse(engine.loadPlugins(false));

    assertThrows(PluginsAlreadyLoadedException.class, () -> engine.loadPlugins(true));
  }

  @Test
  void testTypedGetPlugin() {
    register("espresso");
    PluginEngine engine = engine("espresso");
    engine.loadPlugins();

    Barista barista = engine.getPlugin("espresso", Barista.class);

    assertEquals("espresso", barista.getName());
    assertNull(engine.getPlugin("tea", Barista.class));
  }

  @Test
  void testToString() {
    register("espresso");
    PluginEngine engine = engine("espresso");
    engine.loadPlugins();

    assertEquals("PluginEngine(namespace=coffee.plugins, plugins=[espresso])", engine.toString());
  }

  @Test
  void testDependencyOrder() {
    register("latte", PluginDefinition.builder(() -> new Barista(initOrder)).requires("espresso").uses("milk"));
    register("espresso", PluginDefinition.builder(() -> new Barista(initOrder)).uses("grinder"));
    register("milk");
    PluginEngine engine = engine("latte", "milk", "espresso");

    assertTrue(engine.loadPlugins());

    assertEquals(3, initOrder.size());
    assertTrue(initOrder.indexOf("espresso") < initOrder.indexOf("latte"));
    assertTrue(initOrder.indexOf("milk") < initOrder.indexOf("latte"));
    assertEquals(initOrder, new ArrayList<>(engine.getActivePlugins().keySet()));
  }

  @Test
  void testUsedDependencyCycle() {
    register("espresso", PluginDefinition.builder(() -> new Barista(initOrder)).uses("milk"));
    register("milk", PluginDefinition.builder(() -> new Barista(initOrder)).uses("espresso"));
    PluginEngine engine = engine("espresso", "milk");

    assertTrue(engine.loadPlugins());

    assertEquals(2, initOrder.size());
  }

  @Test
  void testMissingRequiredDependency() {
    register("latte", PluginDefinition.builder(() -> new Barista(initOrder)).requires("espresso"));
    register("milk");
    PluginEngine engine = engine("latte", "milk", "espresso");

    DependencyResolutionException exception = assertThrows(DependencyResolutionException.class,
        engine::loadPlugins);

    assertEquals(Set.of("espresso"), exception.getUnresolved().get("latte"));
    assertTrue(engine.getActivePlugins().isEmpty());
    assertTrue(initOrder.isEmpty());
    assertEquals(Set.of("espresso"), engine.getFailedPlugins());
  }

  @Test
  void testRequiredDependencyCycle() {
    register("espresso", PluginDefinition.builder(() -> new Barista(initOrder)).requires("milk"));
    register("milk", PluginDefinition.builder(() -> new Barista(initOrder)).requires("espresso"));
    PluginEngine engine = engine("espresso", "milk");

    assertThrows(DependencyResolutionException.class, engine::loadPlugins);
    assertTrue(initOrder.isEmpty());
  }

  @Test
  void testPluginInitFailure() {
    register("espresso", PluginDefinition.builder(() -> new Plugin() {
      @Override
      protected void init() {
        throw new IllegalStateException("out of beans");
      }
    }));
    PluginEngine engine = engine("espresso");

    PluginEngineException exception = assertThrows(PluginEngineException.class, engine::loadPlugins);

    assertEquals(PluginEngineException.PLUGIN_INIT_FAILED, exception.getErrorCode());
    assertEquals("espresso", exception.getDetails());
    assertTrue(exception.getCause() instanceof IllegalStateException);
    assertNull(PluginContext.current());
  }

  @Test
  void testEngineExceptionFromInitNamesThePlugin() {
    PluginEngineException cause = new PluginEngineException("bad roast profile");
    register("espresso", PluginDefinition.builder(() -> new Plugin() {
      @Override
      protected void init() {
        throw cause;
      }
    }));
    PluginEngine engine = engine("espresso");

    PluginEngineException exception = assertThrows(PluginEngineException.class, engine::loadPlugins);

    assertEquals(PluginEngineException.PLUGIN_INIT_FAILED, exception.getErrorCode());
    assertEquals("espresso", exception.getDetails());
    assertSame(cause, exception.getCause());
  }

  @Test
  void testFactoryReturningNullFailsInit() {
    register("milk");
    register("espresso", PluginDefinition.builder(() -> null).requires("milk"));
    PluginEngine engine = engine("milk", "espresso");

    PluginEngineException exception = assertThrows(PluginEngineException.class, engine::loadPlugins);

    assertEquals(PluginEngineException.PLUGIN_INIT_FAILED, exception.getErrorCode());
    assertEquals("espresso", exception.getDetails());
    assertEquals(List.of("milk"), new ArrayList<>(engine.getActivePlugins().keySet()));
  }

  @Test
  void testApplicationScopeHeldDuringInit() {
    when(applicationScope.open()).thenReturn(appScope);
    register("espresso");
    register("milk");
    PluginEngine engine = PluginEngine.builder().namespace(NAMESPACE).plugins("espresso", "milk")
        .loader(loader).applicationScope(applicationScope).build();

    engine.loadPlugins();

    verify(applicationScope, times(2)).open();
    verify(appScope, times(2)).close();
  }

  @Test
  void testPluginContextDuringInit() {
    register("espresso");
    PluginEngine engine = engine("espresso");

    engine.loadPlugins();

    Barista espresso = engine.getPlugin("espresso", Barista.class);
    assertSame(espresso, espresso.contextDuringInit);
    assertNull(PluginContext.current());
  }

  @Test
  void testReceiverConnectedTwiceRunsOnceInPluginContext() {
    register("espresso", PluginDefinition.builder(ListeningBarista::new));
    PluginEngine engine = engine("espresso");

    engine.loadPlugins();

    ListeningBarista espresso = engine.getPlugin("espresso", ListeningBarista.class);
    assertEquals(1, engine.getPluginsLoadedSignal().getReceivers().size());
    assertEquals(List.of(espresso), espresso.contextWhenLoaded);
  }

  @Test
  void testConfigure() {
    register("espresso");
    loader.register("tea.plugins", "sencha", PluginDefinition.of(() -> new Barista(initOrder)), COFFEE);
    PluginEngine engine = engine("espresso");

    engine.configure("tea.plugins", List.of("sencha", " sencha "));

    assertEquals("tea.plugins", engine.getNamespace());
    assertEquals(List.of("sencha"), engine.getPluginsToLoad());
    assertTrue(engine.loadPlugins());
    assertEquals(List.of("sencha"), initOrder);
    assertThrows(IllegalStateException.class, () -> engine.configure(NAMESPACE, List.of("espresso")));
  }

  @Test
  void testConfigureRejectsInvalidInput() {
    PluginEngine engine = engine();

    assertThrows(IllegalArgumentException.class, () -> engine.configure(" ", List.of("espresso")));
    assertThrows(IllegalArgumentException.class, () -> engine.configure(NAMESPACE, List.of("")));
  }

  @Test
  void testDescribePlugins() {
    register("espresso", PluginDefinition.builder(() -> new Barista(initOrder))
        .documentation("Espresso\n\n    Creamy espresso out of your app").requires("milk"));
    register("milk");
    PluginEngine engine = engine("espresso", "milk");
    engine.loadPlugins();

    List<PluginInfo> infos = engine.describePlugins();

    assertEquals(List.of("milk", "espresso"), List.of(infos.get(0).getName(), infos.get(1).getName()));
    PluginInfo espresso = infos.get(1);
    assertEquals("Espresso", espresso.getTitle());
    assertEquals("Creamy espresso out of your app", espresso.getDescription());
    String json = engine.describePluginsAsJson();
    assertTrue(json.contains("\"requiredPlugins\":[\"milk\"]"));
    assertEquals("espresso", PluginInfoJson.read(json).get(1).getName());
  }

  @Test
  void testActivePluginsAreReadOnly() {
    register("espresso");
    PluginEngine engine = engine("espresso");
    engine.loadPlugins();

    Map<String, Plugin> active = engine.getActivePlugins();

    assertThrows(UnsupportedOperationException.class, () -> active.remove("espresso"));
    assertThrows(UnsupportedOperationException.class, () -> engine.getFailedPlugins().add("tea"));
  }

  @Test
  void testWithMockedLoader() {
    PluginLoader mockLoader = mock(PluginLoader.class);
    PluginHandle handle = new PluginHandle("espresso", "com.example.Espresso", "test");
    when(mockLoader.find(NAMESPACE, "espresso")).thenReturn(List.of(handle));
    when(mockLoader.find(NAMESPACE, "tea")).thenReturn(List.of());
    when(mockLoader.materialize(handle)).thenReturn(PluginDefinition.of(() -> new Barista(initOrder)));
    when(mockLoader.packageInfo(handle)).thenReturn(COFFEE);
    PluginEngine engine = new PluginEngine(
        PluginEngineOptions.builder().namespace(NAMESPACE).plugins("espresso", "tea").skipFailed(true).build(),
        mockLoader);

    assertFalse(engine.loadPlugins());

    assertEquals(List.of("espresso"), initOrder);
    verify(mockLoader).materialize(handle);
    verify(mockLoader, never()).materialize(argThat(h -> h != handle));
    verify(mockLoader, times(2)).find(eq(NAMESPACE), any());
  }

  @Test
  void testLoaderErrorIsRecordedAndLoadingContinues() {
    PluginLoader mockLoader = mock(PluginLoader.class);
    PluginHandle bad = new PluginHandle("bad", "com.example.Bad", "test");
    PluginHandle good = new PluginHandle("good", "com.example.Good", "test");
    IllegalStateException error = new IllegalStateException("class path is broken");
    when(mockLoader.find(NAMESPACE, "bad")).thenReturn(List.of(bad));
    when(mockLoader.find(NAMESPACE, "good")).thenReturn(List.of(good));
    when(mockLoader.materialize(bad)).thenThrow(error);
    when(mockLoader.materialize(good)).thenReturn(PluginDefinition.of(() -> new Barista(initOrder)));
    when(mockLoader.packageInfo(good)).thenReturn(COFFEE);
    PluginEngine engine = new PluginEngine(
        PluginEngineOptions.builder().namespace(NAMESPACE).plugins("bad", "good").skipFailed(true).build(),
        mockLoader);

    assertFalse(engine.loadPlugins());

    PluginFailure failure = engine.getFailureDetails().get("bad");
    assertEquals(FailureReason.MATERIALIZE_FAILED, failure.getReason());
    assertSame(error, failure.getCause());
    assertEquals(Set.of("bad"), engine.getFailedPlugins());
    assertEquals(Set.of("good"), engine.getActivePlugins().keySet());
  }

  @Test
  void testPackageInfoErrorIsRecorded() {
    PluginLoader mockLoader = mock(PluginLoader.class);
    PluginHandle handle = new PluginHandle("espresso", "com.example.Espresso", "test");
    when(mockLoader.find(NAMESPACE, "espresso")).thenReturn(List.of(handle));
    when(mockLoader.materialize(handle)).thenReturn(PluginDefinition.of(() -> new Barista(initOrder)));
    when(mockLoader.packageInfo(handle)).thenThrow(new NoClassDefFoundError("com/example/Espresso"));
    PluginEngine engine = new PluginEngine(
        PluginEngineOptions.builder().namespace(NAMESPACE).plugins("espresso").skipFailed(true).build(),
        mockLoader);

    assertFalse(engine.loadPlugins());

    assertEquals(FailureReason.MATERIALIZE_FAILED, engine.getFailureDetails().get("espresso").getReason());
    assertTrue(initOrder.isEmpty());
  }

  /**
   * Records its initialization.
   */
  public static class Barista extends Plugin {
    private final List<String> initOrder;
    Plugin contextDuringInit;

    public Barista(List<String> initOrder) {
      this.initOrder = initOrder;
    }

    @Override
    protected void init() {
      initOrder.add(getName());
      contextDuringInit = PluginContext.current();
    }
  }

  /**
   * Listens for the plugins loaded signal.
   */
  public static class ListeningBarista extends Plugin {
    final List<Plugin> contextWhenLoaded = new ArrayList<>();
    private final Runnable onLoaded = () -> contextWhenLoaded.add(PluginContext.current());

    @Override
    protected void init() {
      PluginEngine engine = (PluginEngine) getEngine();
      connect(engine.getPluginsLoadedSignal(), onLoaded);
      connect(engine.getPluginsLoadedSignal(), onLoaded);
    }
  }
}
