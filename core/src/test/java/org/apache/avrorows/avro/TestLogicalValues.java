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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import org.apache.avrorows.data.Interval;
import org.apache.avrorows.exceptions.MalformedLogicalValueException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestLogicalValues {
  @Test
  public void testDates() {
    assertThat(LogicalValues.date(0)).isEqualTo(LocalDate.of(1970, 1, 1));
    assertThat(LogicalValues.date(17000)).isEqualTo(LocalDate.of(2016, 7, 18));
    assertThat(LogicalValues.date(-1)).isEqualTo(LocalDate.of(1969, 12, 31));
  }

  @Test
  public void testTimes() {
    assertThat(LogicalValues.timeMillis(0)).isEqualTo(LocalTime.MIDNIGHT);
    assertThat(LogicalValues.timeMillis(86_399_999))
        .isEqualTo(LocalTime.of(23, 59, 59, 999_000_000));
    assertThat(LogicalValues.timeMicros(3_723_000_004L)).isEqualTo(LocalTime.of(1, 2, 3, 4_000));
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, 86_400_000, Integer.MAX_VALUE, Integer.MIN_VALUE})
  public void testInvalidTimeMillis(int millis) {
    assertThatThrownBy(() -> LogicalValues.timeMillis(millis))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid time-millis: %s (must be in [0, 86400000))", millis);
  }

  @ParameterizedTest
  @ValueSource(longs = {-1L, 86_400_000_000L, Long.MAX_VALUE})
  public void testInvalidTimeMicros(long micros) {
    assertThatThrownBy(() -> LogicalValues.timeMicros(micros))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid time-micros: %s (must be in [0, 86400000000))", micros);
  }

  @Test
  public void testTimestamps() {
    OffsetDateTime expected =
        OffsetDateTime.of(2017, 11, 16, 22, 31, 8, 123_000_000, ZoneOffset.UTC);
    long millis = expected.toInstant().toEpochMilli();

    assertThat(LogicalValues.timestamptzMillis(millis)).isEqualTo(expected);
    assertThat(LogicalValues.timestamptzMicros(millis * 1000 + 4))
        .isEqualTo(expected.plusNanos(4_000));
    assertThat(LogicalValues.timestampMillis(millis)).isEqualTo(expected.toLocalDateTime());
    assertThat(LogicalValues.timestampMicros(-1L))
        .isEqualTo(LocalDateTime.of(1969, 12, 31, 23, 59, 59, 999_999_000));
  }

  @Test
  public void testExtremeTimestamps() {
    assertThat(LogicalValues.timestamptzMillis(Long.MAX_VALUE).getYear())
        .isGreaterThan(292_000_000);
    assertThat(LogicalValues.timestampMicros(Long.MIN_VALUE).getYear()).isLessThan(-290_000);
  }

  @Test
  public void testDecimalFromBytes() {
    byte[] unscaled = new BigDecimal("-12.34").unscaledValue().toByteArray();
    assertThat(LogicalValues.decimal(unscaled, 4, 2)).isEqualTo(new BigDecimal("-12.34"));
    assertThat(LogicalValues.decimal(new byte[] {0}, 1, 0)).isEqualTo(BigDecimal.ZERO);

    // the unscaled value is read as two's complement
    assertThat(LogicalValues.decimal(new byte[] {(byte) 0xFF, (byte) 0xFF}, 3, 1))
        .isEqualTo(new BigDecimal("-0.1"));
  }

  @Test
  public void testInvalidDecimals() {
    assertThatThrownBy(() -> LogicalValues.decimal(new byte[0], 4, 2))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid decimal(4, 2): empty unscaled value");

    byte[] tooLarge = new BigDecimal("123.45").unscaledValue().toByteArray();
    assertThatThrownBy(() -> LogicalValues.decimal(tooLarge, 4, 2))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid decimal(4, 2): 123.45 has 5 digits");

    assertThatThrownBy(() -> LogicalValues.decimal(new BigDecimal("1.234"), 4, 2))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid decimal(4, 2): cannot set scale of 1.234")
        .hasCauseInstanceOf(ArithmeticException.class);
  }

  @Test
  public void testDecimalRescale() {
    BigDecimal rescaled = LogicalValues.decimal(new BigDecimal("1.5"), 4, 2);
    assertThat(rescaled.scale()).isEqualTo(2);
    assertThat(rescaled).isEqualTo(new BigDecimal("1.50"));
  }

  @Test
  public void testDuration() {
    ByteBuffer buffer = ByteBuffer.wrap(AvroTestHelpers.durationBytes(14, 3, 86_399_999));
    assertThat(LogicalValues.duration(buffer)).isEqualTo(Interval.of(14, 3, 86_399_999));
    assertThat(buffer.position()).as("Should not consume the buffer").isEqualTo(0);

    // components are unsigned
    ByteBuffer max = ByteBuffer.wrap(AvroTestHelpers.durationBytes(-1, -1, -1));
    assertThat(LogicalValues.duration(max))
        .isEqualTo(Interval.of(0xFFFFFFFFL, 0xFFFFFFFFL, 0xFFFFFFFFL));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 11, 13})
  public void testInvalidDurationLength(int length) {
    assertThatThrownBy(() -> LogicalValues.duration(ByteBuffer.allocate(length)))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid duration: %s bytes (must be 12)", length);
  }

  @Test
  public void testUuids() {
    UUID uuid = UUID.fromString("f79c3e09-677c-4bbd-a479-3f349cb785e7");
    assertThat(LogicalValues.uuid("f79c3e09-677c-4bbd-a479-3f349cb785e7")).isEqualTo(uuid);

    assertThatThrownBy(() -> LogicalValues.uuid("1-2-3-4-5"))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid uuid: 1-2-3-4-5 (must be 36 characters)");

    assertThatThrownBy(() -> LogicalValues.uuid("f79c3e09-677c-4bbd-a479-3f349cb785zz"))
        .isInstanceOf(MalformedLogicalValueException.class)
        .hasMessage("Invalid uuid: f79c3e09-677c-4bbd-a479-3f349cb785zz")
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }
}
