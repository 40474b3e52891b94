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
package org.apache.avrorows.data;

import com.google.common.base.Preconditions;
import java.io.Serializable;
import java.util.Objects;

/**
 * An amount of time made of three independent components: months, days and milliseconds.
 *
 * <p>The components cannot be collapsed into a single unit because the length of a month and of a
 * day (across daylight saving changes) varies. Each component is an unsigned 32-bit quantity.
 */
public class Interval implements Serializable {
  private static final long MAX_COMPONENT = 0xFFFFFFFFL;

  public static Interval of(long months, long days, long millis) {
    return new Interval(months, days, millis);
  }

  private final long months;
  private final long days;
  private final long millis;

  private Interval(long months, long days, long millis) {
    checkComponent("months", months);
    checkComponent("days", days);
    checkComponent("millis", millis);
    this.months = months;
    this.days = days;
    this.millis = millis;
  }

  private static void checkComponent(String name, long value) {
    Preconditions.checkArgument(
        value >= 0 && value <= MAX_COMPONENT,
        "Invalid interval %s: %s (must be an unsigned 32-bit value)",
        name,
        value);
  }

  public long months() {
    return months;
  }

  public long days() {
    return days;
  }

  public long millis() {
    return millis;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Interval)) {
      return false;
    }

    Interval that = (Interval) other;
    return months == that.months && days == that.days && millis == that.millis;
  }

  @Override
  public int hashCode() {
    return Objects.hash(months, days, millis);
  }

  @Override
  public String toString() {
    return String.format("Interval(months=%d, days=%d, millis=%d)", months, days, millis);
  }
}
