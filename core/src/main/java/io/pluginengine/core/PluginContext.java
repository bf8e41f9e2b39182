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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Provides access to the plugin that the current code runs on behalf of.
 *
 * <p>
 * Every thread has its own stack of plugins. A plugin is pushed when a scope is
 * entered and popped when it is closed, so nested scopes unwind in reverse
 * order and callbacks can find out which plugin owns them:
 *
 * <pre>{@code
 * Runnable receiver = plugin.wrap(() -> {
 *   Plugin current = PluginContext.currentPlugin(); // plugin
 * });
 * }</pre>
 *
 * <p>
 * The stack only holds references. Plugins are owned by their engine.
 */
public final class PluginContext {

  private static final ThreadLocal<Deque<Plugin>> STACK = new ThreadLocal<>();

  private PluginContext() {
  }

  /**
   * Returns the plugin on top of the current thread's stack.
   *
   * @return the current plugin, or null if no plugin scope is active
   */
  public static Plugin current() {
    Deque<Plugin> stack = STACK.get();
    return stack != null ? stack.peek() : null;
  }

  /**
   * Returns the plugin on top of the current thread's stack.
   *
   * @return the current plugin
   * @throws IllegalStateException
   *             if no plugin scope is active
   */
  public static Plugin currentPlugin() {
    Plugin plugin = current();
    if (plugin == null) {
      throw new IllegalStateException("Not running within a plugin context");
    }
    return plugin;
  }

  /**
   * Returns the number of plugin scopes active on the current thread.
   *
   * @return the stack depth
   */
  public static int depth() {
    Deque<Plugin> stack = STACK.get();
    return stack != null ? stack.size() : 0;
  }

  /**
   * Pushes a plugin on the current thread's stack. The returned scope pops it
   * again and must be closed on the same thread, in reverse order of entry.
   *
   * @param plugin
   *            the plugin
   * @return the scope
   */
  public static Scope enter(Plugin plugin) {
    push(plugin);
    return new Scope(plugin);
  }

  /**
   * Runs a runnable with the plugin on the stack.
   *
   * @param plugin
   *            the plugin
   * @param runnable
   *            the runnable
   */
  public static void run(Plugin plugin, Runnable runnable) {
    try (Scope ignored = enter(plugin)) {
      runnable.run();
    }
  }

  /**
   * Calls a callable with the plugin on the stack.
   *
   * @param <T>
   *            the result type
   * @param plugin
   *            the plugin
   * @param callable
   *            the callable
   * @return the result of the callable
   * @throws Exception
   *             if the callable throws
   */
  public static <T> T call(Plugin plugin, Callable<T> callable) throws Exception {
    try (Scope ignored = enter(plugin)) {
      return callable.call();
    }
  }

  /**
   * Returns a runnable that runs the given one with the plugin on the stack of
   * whichever thread eventually invokes it. Every call creates a new wrapper;
   * use {@link PluginContextWrappers} to reuse them.
   *
   * @param plugin
   *            the plugin
   * @param runnable
   *            the runnable
   * @return the wrapper
   */
  public static Runnable wrap(Plugin plugin, Runnable runnable) {
    Objects.requireNonNull(plugin, "plugin");
    Objects.requireNonNull(runnable, "runnable");
    return () -> run(plugin, runnable);
  }

  /**
   * Returns a callable that calls the given one with the plugin on the stack of
   * whichever thread eventually invokes it.
   *
   * @param <T>
   *            the result type
   * @param plugin
   *            the plugin
   * @param callable
   *            the callable
   * @return the wrapper
   */
  public static <T> Callable<T> wrap(Plugin plugin, Callable<T> callable) {
    Objects.requireNonNull(plugin, "plugin");
    Objects.requireNonNull(callable, "callable");
    return () -> call(plugin, callable);
  }

  static void push(Plugin plugin) {
    Objects.requireNonNull(plugin, "plugin");
    Deque<Plugin> stack = STACK.get();
    if (stack == null) {
      stack = new ArrayDeque<>();
      STACK.set(stack);
    }
    stack.push(plugin);
  }

  static Plugin pop(Plugin expected) {
    Deque<Plugin> stack = STACK.get();
    Plugin popped = stack != null ? stack.poll() : null;
    if (stack != null && stack.isEmpty()) {
      STACK.remove();
    }
    if (popped != expected) {
      throw new PluginContextMismatchException(expected, popped);
    }
    return popped;
  }

  /**
   * An entered plugin scope. Closing it pops the plugin; closing it again does
   * nothing.
   */
  public static final class Scope implements AutoCloseable {

    private final Plugin plugin;
    private final Thread owner;
    private boolean closed;

    private Scope(Plugin plugin) {
      this.plugin = plugin;
      this.owner = Thread.currentThread();
    }

    public Plugin getPlugin() {
      return plugin;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (Thread.currentThread() != owner) {
        throw new IllegalStateException("Plugin scope for " + plugin + " closed on a different thread");
      }
      closed = true;
      pop(plugin);
    }
  }
}
