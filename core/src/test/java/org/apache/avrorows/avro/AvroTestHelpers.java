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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.apache.avro.JsonProperties;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.avrorows.data.Interval;
import org.apache.avrorows.data.Row;

class AvroTestHelpers {

  private AvroTestHelpers() {}

  static Schema.Field optionalField(String name, Schema schema) {
    return new Schema.Field(
        name,
        Schema.createUnion(Schema.create(Schema.Type.NULL), schema),
        null,
        JsonProperties.NULL_VALUE);
  }

  static Schema.Field requiredField(String name, Schema schema) {
    return new Schema.Field(name, schema, null, null);
  }

  static Schema record(String name, Schema.Field... fields) {
    return Schema.createRecord(name, null, null, false, Arrays.asList(fields));
  }

  /** Creates a record of a schema from field values by name; missing fields are left null. */
  static GenericData.Record mapToGenericRecord(Schema schema, Map<String, ?> values) {
    GenericData.Record record = new GenericData.Record(schema);
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      record.put(entry.getKey(), entry.getValue());
    }
    return record;
  }

  static GenericData.Fixed fixed(Schema schema, byte[] bytes) {
    return new GenericData.Fixed(schema, bytes);
  }

  /** Encodes a duration as three little-endian unsigned ints. */
  static byte[] durationBytes(int months, int days, int millis) {
    return ByteBuffer.allocate(12)
        .order(ByteOrder.LITTLE_ENDIAN)
        .putInt(months)
        .putInt(days)
        .putInt(millis)
        .array();
  }

  /**
   * Asserts that a converted value matches the Avro value it was converted from.
   *
   * <p>Expected values are decoded here without the converters under test.
   */
  static void assertEquals(Schema schema, Object expected, Object actual) {
    switch (schema.getType()) {
      case RECORD:
        assertThat(actual).as("Should be a row").isInstanceOf(Row.class);
        assertEquals(schema, (GenericRecord) expected, (Row) actual);
        break;
      case UNION:
        if (expected == null) {
          assertThat(actual).isNull();
        } else {
          int branch = GenericData.get().resolveUnion(schema, expected);
          assertEquals(schema.getTypes().get(branch), expected, actual);
        }
        break;
      case ARRAY:
        assertThat(actual).as("Should be a list").isInstanceOf(List.class);
        List<?> expectedList = (List<?>) expected;
        List<?> actualList = (List<?>) actual;
        assertThat(actualList).as("List size should match").hasSameSizeAs(expectedList);
        for (int i = 0; i < expectedList.size(); i += 1) {
          assertEquals(schema.getElementType(), expectedList.get(i), actualList.get(i));
        }
        break;
      case MAP:
        assertThat(actual).as("Should be a map").isInstanceOf(Map.class);
        Map<?, ?> expectedMap = (Map<?, ?>) expected;
        Map<?, ?> actualMap = (Map<?, ?>) actual;
        assertThat(actualMap).as("Map size should match").hasSameSizeAs(expectedMap);
        for (Map.Entry<?, ?> entry : expectedMap.entrySet()) {
          String key = entry.getKey().toString();
          assertThat(actualMap.containsKey(key)).as("Should contain key %s", key).isTrue();
          assertEquals(schema.getValueType(), entry.getValue(), actualMap.get(key));
        }
        break;
      default:
        assertThat(actual)
            .as("Converted %s value should match", schema.getType())
            .isEqualTo(expectedPrimitive(schema, expected));
    }
  }

  static void assertEquals(Schema schema, GenericRecord expected, Row actual) {
    List<Schema.Field> fields = schema.getFields();
    assertThat(actual.size()).as("Row size should match field count").isEqualTo(fields.size());
    for (int pos = 0; pos < fields.size(); pos += 1) {
      Schema.Field field = fields.get(pos);
      assertThat(actual.get(pos)).isSameAs(actual.getField(field.name()));
      assertEquals(field.schema(), expected.get(field.name()), actual.get(pos));
    }
  }

  private static Object expectedPrimitive(Schema schema, Object avroValue) {
    if (avroValue == null) {
      return null;
    }

    LogicalType logical = schema.getLogicalType();
    String logicalName = AvroSchemaUtil.logicalTypeName(schema);
    switch (schema.getType()) {
      case INT:
        int intValue = (Integer) avroValue;
        if (logical instanceof LogicalTypes.Date) {
          return LocalDate.ofEpochDay(intValue);
        } else if (logical instanceof LogicalTypes.TimeMillis) {
          return LocalTime.ofNanoOfDay(intValue * 1_000_000L);
        }
        return intValue;
      case LONG:
        long longValue = (Long) avroValue;
        if (logical instanceof LogicalTypes.TimeMicros) {
          return LocalTime.ofNanoOfDay(longValue * 1_000L);
        } else if (logical instanceof LogicalTypes.TimestampMillis) {
          return Instant.ofEpochMilli(longValue).atOffset(ZoneOffset.UTC);
        } else if (logical instanceof LogicalTypes.TimestampMicros) {
          return Instant.EPOCH.plus(longValue, ChronoUnit.MICROS).atOffset(ZoneOffset.UTC);
        } else if (logical instanceof LogicalTypes.LocalTimestampMillis) {
          return LocalDateTime.ofInstant(Instant.ofEpochMilli(longValue), ZoneOffset.UTC);
        } else if (logical instanceof LogicalTypes.LocalTimestampMicros) {
          return LocalDateTime.ofInstant(
              Instant.EPOCH.plus(longValue, ChronoUnit.MICROS), ZoneOffset.UTC);
        }
        return longValue;
      case STRING:
        if ("uuid".equals(logicalName)) {
          return UUID.fromString(avroValue.toString());
        }
        return avroValue.toString();
      case ENUM:
        return avroValue.toString();
      case BYTES:
      case FIXED:
        byte[] bytes = bytes(avroValue);
        if (logical instanceof LogicalTypes.Decimal) {
          return new BigDecimal(new BigInteger(bytes), ((LogicalTypes.Decimal) logical).getScale());
        } else if ("duration".equals(logicalName)) {
          ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
          return Interval.of(
              buffer.getInt() & 0xFFFFFFFFL,
              buffer.getInt() & 0xFFFFFFFFL,
              buffer.getInt() & 0xFFFFFFFFL);
        }
        return ByteBuffer.wrap(bytes);
      default:
        return avroValue;
    }
  }

  private static byte[] bytes(Object avroValue) {
    if (avroValue instanceof GenericFixed) {
      return ((GenericFixed) avroValue).bytes();
    } else if (avroValue instanceof byte[]) {
      return (byte[]) avroValue;
    }

    ByteBuffer buffer = ((ByteBuffer) avroValue).duplicate();
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return bytes;
  }
}
