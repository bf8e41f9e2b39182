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

/**
 * Helpers for plugin documentation strings.
 */
public final class DocStrings {

  private static final int TAB_SIZE = 8;

  private DocStrings() {
    // Utility class
  }

  /**
   * Trims a documentation string the way PEP 257 describes for docstrings.
   * Tabs are expanded, the first line is stripped, the common indentation of
   * the remaining lines is removed, and leading and trailing blank lines are
   * dropped.
   *
   * @param documentation
   *            the documentation, may be null
   * @return the trimmed documentation, empty if there is none
   */
  public static String trim(String documentation) {
    if (documentation == null || documentation.isEmpty()) {
      return "";
    }
    String[] lines = expandTabs(documentation).split("\r\n|\r|\n", -1);

    // First line does not count towards the indentation
    int indent = Integer.MAX_VALUE;
    for (int i = 1; i < lines.length; i++) {
      String stripped = lines[i].stripLeading();
      if (!stripped.isEmpty()) {
        indent = Math.min(indent, lines[i].length() - stripped.length());
      }
    }

    List<String> trimmed = new ArrayList<>(lines.length);
    trimmed.add(lines[0].strip());
    if (indent < Integer.MAX_VALUE) {
      for (int i = 1; i < lines.length; i++) {
        String line = lines[i];
        trimmed.add(line.length() > indent ? line.substring(indent).stripTrailing() : "");
      }
    }

    while (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1).isEmpty()) {
      trimmed.remove(trimmed.size() - 1);
    }
    while (!trimmed.isEmpty() && trimmed.get(0).isEmpty()) {
      trimmed.remove(0);
    }
    return String.join("\n", trimmed);
  }

  /**
   * Returns the title of a documentation string: its first line.
   *
   * @param documentation
   *            the documentation, may be null
   * @return the title, empty if there is no documentation
   */
  public static String title(String documentation) {
    String trimmed = trim(documentation);
    int newline = trimmed.indexOf('\n');
    return (newline < 0 ? trimmed : trimmed.substring(0, newline)).strip();
  }

  /**
   * Returns the description of a documentation string: everything after the
   * first line.
   *
   * @param documentation
   *            the documentation, may be null
   * @param fallback
   *            returned when there is nothing after the first line
   * @return the description
   */
  public static String description(String documentation, String fallback) {
    String trimmed = trim(documentation);
    int newline = trimmed.indexOf('\n');
    if (newline < 0) {
      return fallback;
    }
    return trimmed.substring(newline + 1).strip();
  }

  private static String expandTabs(String text) {
    if (text.indexOf('\t') < 0) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length() + 16);
    int column = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\t') {
        int spaces = TAB_SIZE - (column % TAB_SIZE);
        for (int s = 0; s < spaces; s++) {
          sb.append(' ');
        }
        column += spaces;
      } else {
        sb.append(c);
        column = (c == '\n' || c == '\r') ? 0 : column + 1;
      }
    }
    return sb.toString();
  }
}
