/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.avrorows.util;

import com.google.common.base.Preconditions;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class PropertyUtil {

  private PropertyUtil() {}

  public static boolean propertyAsBoolean(
      Map<String, String> properties, String property, boolean defaultValue) {
    String value = properties.get(property);
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      Preconditions.checkArgument(
          "true".equals(normalized) || "false".equals(normalized),
          "Invalid value for %s: %s (must be true or false)",
          property,
          value);
      return Boolean.parseBoolean(normalized);
    }
    return defaultValue;
  }

  public static int propertyAsInt(
      Map<String, String> properties, String property, int defaultValue) {
    String value = properties.get(property);
    if (value != null) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("Invalid value for %s: %s (must be an integer)", property, value), e);
      }
    }
    return defaultValue;
  }

  /**
   * Returns a property value that must be one of a set of allowed values, compared ignoring case.
   *
   * @param properties input map
   * @param property property name
   * @param allowed allowed values, in lower case
   * @param defaultValue value to return when the property is not set
   * @return the lower case property value, or the default
   * @throws IllegalArgumentException if the value is not allowed
   */
  public static String propertyAsEnumString(
      Map<String, String> properties, String property, Set<String> allowed, String defaultValue) {
    String value = properties.get(property);
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      Preconditions.checkArgument(
          allowed.contains(normalized),
          "Invalid value for %s: %s (must be one of %s)",
          property,
          value,
          allowed);
      return normalized;
    }
    return defaultValue;
  }
}
