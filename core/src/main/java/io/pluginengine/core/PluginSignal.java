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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PluginSignal is a named broadcast without payload. Receivers are kept in
 * connection order and compared by identity, so connecting the same receiver
 * twice registers it once.
 */
public class PluginSignal {

  private static final Logger logger = LoggerFactory.getLogger(PluginSignal.class);

  private final String name;
  private final List<Runnable> receivers = new CopyOnWriteArrayList<>();

  /**
   * Creates a new PluginSignal.
   *
   * @param name
   *            the signal name, used in logs
   */
  public PluginSignal(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  /**
   * Connects a receiver.
   *
   * @param receiver
   *            the receiver
   * @return true if the receiver was not connected yet
   */
  public synchronized boolean connect(Runnable receiver) {
    Objects.requireNonNull(receiver, "receiver");
    if (indexOf(receiver) >= 0) {
      return false;
    }
    receivers.add(receiver);
    logger.debug("Connected receiver to signal {}", name);
    return true;
  }

  /**
   * Disconnects a receiver.
   *
   * @param receiver
   *            the receiver
   * @return true if the receiver was connected
   */
  public synchronized boolean disconnect(Runnable receiver) {
    int index = indexOf(receiver);
    if (index < 0) {
      return false;
    }
    receivers.remove(index);
    return true;
  }

  /**
   * Returns the connected receivers.
   *
   * @return a snapshot of the receivers in connection order
   */
  public List<Runnable> getReceivers() {
    return new ArrayList<>(receivers);
  }

  /**
   * Invokes every receiver. A failing receiver is logged and does not stop the
   * others.
   *
   * @return the number of receivers that completed normally
   */
  public int send() {
    int delivered = 0;
    for (Runnable receiver : receivers) {
      try {
        receiver.run();
        delivered++;
      } catch (RuntimeException e) {
        logger.error("Receiver of signal {} failed", name, e);
      }
    }
    logger.debug("Sent signal {} to {} receiver(s)", name, delivered);
    return delivered;
  }

  private int indexOf(Runnable receiver) {
    for (int i = 0; i < receivers.size(); i++) {
      if (receivers.get(i) == receiver) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return "PluginSignal(" + name + ")";
  }
}
