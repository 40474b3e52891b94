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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Converts the epoch-based encodings of Avro's date and time logical types to {@code java.time}.
 *
 * <p>Timestamps are offsets from 1970-01-01T00:00:00Z. Times are offsets from midnight.
 */
public class DateTimeUtil {
  private DateTimeUtil() {}

  public static final OffsetDateTime EPOCH =
      OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
  public static final LocalDate EPOCH_DAY = LocalDate.ofEpochDay(0);
  public static final long MILLIS_PER_DAY = 86_400_000L;
  public static final long MICROS_PER_DAY = 1_000L * MILLIS_PER_DAY;

  public static LocalDate dateFromDays(int daysFromEpoch) {
    return EPOCH_DAY.plusDays(daysFromEpoch);
  }

  public static LocalTime timeFromMillis(int millisFromMidnight) {
    return LocalTime.MIDNIGHT.plus(millisFromMidnight, ChronoUnit.MILLIS);
  }

  public static LocalTime timeFromMicros(long microsFromMidnight) {
    return LocalTime.MIDNIGHT.plus(microsFromMidnight, ChronoUnit.MICROS);
  }

  public static OffsetDateTime timestamptzFromMillis(long millisFromEpoch) {
    return EPOCH.plus(millisFromEpoch, ChronoUnit.MILLIS);
  }

  public static OffsetDateTime timestamptzFromMicros(long microsFromEpoch) {
    return EPOCH.plus(microsFromEpoch, ChronoUnit.MICROS);
  }

  /** Returns the wall-clock time in UTC for a timestamp without a zone. */
  public static LocalDateTime timestampFromMillis(long millisFromEpoch) {
    return timestamptzFromMillis(millisFromEpoch).toLocalDateTime();
  }

  /** Returns the wall-clock time in UTC for a timestamp without a zone. */
  public static LocalDateTime timestampFromMicros(long microsFromEpoch) {
    return timestamptzFromMicros(microsFromEpoch).toLocalDateTime();
  }
}
