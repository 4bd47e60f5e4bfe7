/*
 * Copyright (c) 2025, The SqlShift Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.dataops.sqlshift.common;

import java.util.Map;

/** Typed accessors over string property maps, with defaults for missing keys. */
public final class PropertyUtil {
  private PropertyUtil() {}

  public static String propertyAsString(
      Map<String, String> properties, String property, String defaultValue) {
    String value = properties.get(property);
    return value == null ? defaultValue : value.trim();
  }

  /**
   * Reads a boolean property. Only "true" and "false" (any case) are accepted.
   *
   * @param properties The property map.
   * @param property The property key.
   * @param defaultValue The value returned when the key is absent.
   * @return The parsed value.
   * @throws ValidationException if the value is not a boolean.
   */
  public static boolean propertyAsBoolean(
      Map<String, String> properties, String property, boolean defaultValue) {
    String value = properties.get(property);
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    ValidationException.check(
        "true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed),
        "Property %s must be true or false but was %s",
        property,
        value);
    return Boolean.parseBoolean(trimmed);
  }

  /**
   * Reads an integer property.
   *
   * @param properties The property map.
   * @param property The property key.
   * @param defaultValue The value returned when the key is absent.
   * @return The parsed value.
   * @throws ValidationException if the value is not an integer.
   */
  public static int propertyAsInt(
      Map<String, String> properties, String property, int defaultValue) {
    String value = properties.get(property);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new ValidationException("Property %s must be an integer but was %s", property, value);
    }
  }

  /**
   * Reads a long property.
   *
   * @param properties The property map.
   * @param property The property key.
   * @param defaultValue The value returned when the key is absent.
   * @return The parsed value.
   * @throws ValidationException if the value is not a long.
   */
  public static long propertyAsLong(
      Map<String, String> properties, String property, long defaultValue) {
    String value = properties.get(property);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new ValidationException("Property %s must be a long but was %s", property, value);
    }
  }
}
