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
package org.apache.avrorows.avro;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.apache.avrorows.data.Interval;
import org.apache.avrorows.exceptions.MalformedLogicalValueException;
import org.apache.avrorows.util.DateTimeUtil;

/**
 * Decoders for the encoded forms of Avro logical types.
 *
 * <p>Decoders are pure functions. Values outside the range of a logical type raise {@link
 * MalformedLogicalValueException}.
 */
public class LogicalValues {
  private static final int UUID_LENGTH = 36;

  private LogicalValues() {}

  /** Decodes a {@code date}: days since 1970-01-01. */
  public static LocalDate date(int daysFromEpoch) {
    try {
      return DateTimeUtil.dateFromDays(daysFromEpoch);
    } catch (DateTimeException | ArithmeticException e) {
      throw new MalformedLogicalValueException(
          e, "Invalid date: %s days from epoch", daysFromEpoch);
    }
  }

  /** Decodes a {@code time-millis}: milliseconds since midnight. */
  public static LocalTime timeMillis(int millisFromMidnight) {
    MalformedLogicalValueException.check(
        millisFromMidnight >= 0 && millisFromMidnight < DateTimeUtil.MILLIS_PER_DAY,
        "Invalid time-millis: %s (must be in [0, %s))",
        millisFromMidnight,
        DateTimeUtil.MILLIS_PER_DAY);
    return DateTimeUtil.timeFromMillis(millisFromMidnight);
  }

  /** Decodes a {@code time-micros}: microseconds since midnight. */
  public static LocalTime timeMicros(long microsFromMidnight) {
    MalformedLogicalValueException.check(
        microsFromMidnight >= 0 && microsFromMidnight < DateTimeUtil.MICROS_PER_DAY,
        "Invalid time-micros: %s (must be in [0, %s))",
        microsFromMidnight,
        DateTimeUtil.MICROS_PER_DAY);
    return DateTimeUtil.timeFromMicros(microsFromMidnight);
  }

  public static OffsetDateTime timestamptzMillis(long millisFromEpoch) {
    try {
      return DateTimeUtil.timestamptzFromMillis(millisFromEpoch);
    } catch (DateTimeException | ArithmeticException e) {
      throw new MalformedLogicalValueException(
          e, "Invalid timestamp-millis: %s", millisFromEpoch);
    }
  }

  public static OffsetDateTime timestamptzMicros(long microsFromEpoch) {
    try {
      return DateTimeUtil.timestamptzFromMicros(microsFromEpoch);
    } catch (DateTimeException | ArithmeticException e) {
      throw new MalformedLogicalValueException(
          e, "Invalid timestamp-micros: %s", microsFromEpoch);
    }
  }

  public static LocalDateTime timestampMillis(long millisFromEpoch) {
    try {
      return DateTimeUtil.timestampFromMillis(millisFromEpoch);
    } catch (DateTimeException | ArithmeticException e) {
      throw new MalformedLogicalValueException(
          e, "Invalid local-timestamp-millis: %s", millisFromEpoch);
    }
  }

  public static LocalDateTime timestampMicros(long microsFromEpoch) {
    try {
      return DateTimeUtil.timestampFromMicros(microsFromEpoch);
    } catch (DateTimeException | ArithmeticException e) {
      throw new MalformedLogicalValueException(
          e, "Invalid local-timestamp-micros: %s", microsFromEpoch);
    }
  }

  /**
   * Decodes a {@code decimal} from the big-endian two's-complement bytes of its unscaled value.
   *
   * @param unscaled unscaled value bytes; the array is not modified
   * @param precision maximum number of digits
   * @param scale number of digits after the decimal point
   * @return the decimal value, with the given scale
   */
  public static BigDecimal decimal(byte[] unscaled, int precision, int scale) {
    MalformedLogicalValueException.check(
        unscaled.length > 0, "Invalid decimal(%s, %s): empty unscaled value", precision, scale);
    return checkPrecision(new BigDecimal(new BigInteger(unscaled), scale), precision, scale);
  }

  /** Normalizes a decimal that was already converted to the scale of a decimal type. */
  public static BigDecimal decimal(BigDecimal value, int precision, int scale) {
    BigDecimal scaled;
    try {
      scaled = value.setScale(scale, RoundingMode.UNNECESSARY);
    } catch (ArithmeticException e) {
      throw new MalformedLogicalValueException(
          e, "Invalid decimal(%s, %s): cannot set scale of %s", precision, scale, value);
    }

    return checkPrecision(scaled, precision, scale);
  }

  private static BigDecimal checkPrecision(BigDecimal value, int precision, int scale) {
    // BigDecimal.precision() counts the digits of the unscaled value, 1 for zero
    MalformedLogicalValueException.check(
        value.precision() <= precision,
        "Invalid decimal(%s, %s): %s has %s digits",
        precision,
        scale,
        value,
        value.precision());
    return value;
  }

  /**
   * Decodes a {@code duration}: three little-endian unsigned ints for months, days and
   * milliseconds.
   *
   * @param bytes the remaining bytes of this buffer are decoded; its position is not changed
   * @return an interval
   */
  public static Interval duration(ByteBuffer bytes) {
    MalformedLogicalValueException.check(
        bytes.remaining() == AvroLogicalTypes.Duration.SIZE,
        "Invalid duration: %s bytes (must be %s)",
        bytes.remaining(),
        AvroLogicalTypes.Duration.SIZE);

    ByteBuffer buffer = bytes.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    long months = Integer.toUnsignedLong(buffer.getInt());
    long days = Integer.toUnsignedLong(buffer.getInt());
    long millis = Integer.toUnsignedLong(buffer.getInt());
    return Interval.of(months, days, millis);
  }

  /** Decodes a {@code uuid} from its canonical 36-character text form. */
  public static UUID uuid(CharSequence text) {
    String str = text.toString();
    MalformedLogicalValueException.check(
        str.length() == UUID_LENGTH, "Invalid uuid: %s (must be %s characters)", str, UUID_LENGTH);
    try {
      return UUID.fromString(str);
    } catch (IllegalArgumentException e) {
      throw new MalformedLogicalValueException(e, "Invalid uuid: %s", str);
    }
  }
}
