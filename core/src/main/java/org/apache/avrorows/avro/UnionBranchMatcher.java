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

import com.google.common.collect.Sets;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericContainer;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.avrorows.data.Interval;

/** Decides which branches of a union accept a runtime value. */
class UnionBranchMatcher {
  enum Match {
    NONE,
    /** The value can be converted by the branch through promotion or structural compatibility. */
    PROMOTABLE,
    /** The value has the branch's own Java representation or full name. */
    EXACT
  }

  private UnionBranchMatcher() {}

  static Match match(Schema branch, Object value) {
    if (value == null) {
      return branch.getType() == Schema.Type.NULL ? Match.EXACT : Match.NONE;
    }

    LogicalType logical = branch.getLogicalType();
    switch (branch.getType()) {
      case NULL:
        return Match.NONE;
      case BOOLEAN:
        return exactIf(value instanceof Boolean);
      case INT:
        if (logical instanceof LogicalTypes.Date) {
          return exactIf(value instanceof Integer || value instanceof LocalDate);
        } else if (logical instanceof LogicalTypes.TimeMillis) {
          return exactIf(value instanceof Integer || value instanceof LocalTime);
        }
        return exactIf(value instanceof Integer);
      case LONG:
        return matchLong(logical, value);
      case FLOAT:
        if (value instanceof Float) {
          return Match.EXACT;
        }
        return promotableIf(value instanceof Integer || value instanceof Long);
      case DOUBLE:
        if (value instanceof Double) {
          return Match.EXACT;
        }
        return promotableIf(
            value instanceof Integer || value instanceof Long || value instanceof Float);
      case STRING:
        if (LogicalTypes.uuid().getName().equals(AvroSchemaUtil.logicalTypeName(branch))) {
          return exactIf(value instanceof CharSequence || value instanceof UUID);
        }
        return exactIf(value instanceof CharSequence);
      case BYTES:
        if (logical instanceof LogicalTypes.Decimal) {
          return exactIf(
              value instanceof ByteBuffer
                  || value instanceof byte[]
                  || value instanceof BigDecimal);
        }
        return exactIf(value instanceof ByteBuffer || value instanceof byte[]);
      case FIXED:
        return matchFixed(branch, value);
      case ENUM:
        return matchEnum(branch, value);
      case RECORD:
        return matchRecord(branch, value);
      case ARRAY:
        return exactIf(value instanceof Collection);
      case MAP:
        return exactIf(value instanceof Map);
      default:
        return Match.NONE;
    }
  }

  private static Match matchLong(LogicalType logical, Object value) {
    if (value instanceof Long) {
      return Match.EXACT;
    } else if (logical == null) {
      return promotableIf(value instanceof Integer);
    } else if (logical instanceof LogicalTypes.TimeMicros) {
      return exactIf(value instanceof LocalTime);
    } else if (logical instanceof LogicalTypes.TimestampMillis
        || logical instanceof LogicalTypes.TimestampMicros) {
      return exactIf(value instanceof Instant || value instanceof OffsetDateTime);
    } else if (logical instanceof LogicalTypes.LocalTimestampMillis
        || logical instanceof LogicalTypes.LocalTimestampMicros) {
      return exactIf(value instanceof LocalDateTime);
    }

    return promotableIf(value instanceof Integer);
  }

  private static Match matchFixed(Schema branch, Object value) {
    if (branch.getLogicalType() instanceof LogicalTypes.Decimal && value instanceof BigDecimal) {
      return Match.EXACT;
    } else if (AvroLogicalTypes.DURATION.equals(AvroSchemaUtil.logicalTypeName(branch))
        && value instanceof Interval) {
      return Match.EXACT;
    }

    int size = branch.getFixedSize();
    if (value instanceof GenericFixed) {
      if (sameName(branch, value)) {
        return Match.EXACT;
      }
      return promotableIf(((GenericFixed) value).bytes().length == size);
    } else if (value instanceof byte[]) {
      return promotableIf(((byte[]) value).length == size);
    } else if (value instanceof ByteBuffer) {
      return promotableIf(((ByteBuffer) value).remaining() == size);
    }

    return Match.NONE;
  }

  private static Match matchEnum(Schema branch, Object value) {
    if (value instanceof GenericEnumSymbol && sameName(branch, value)) {
      return Match.EXACT;
    } else if (value instanceof GenericEnumSymbol || value instanceof CharSequence) {
      return promotableIf(branch.hasEnumSymbol(value.toString()));
    }

    return Match.NONE;
  }

  private static Match matchRecord(Schema branch, Object value) {
    if (!(value instanceof GenericRecord)) {
      return Match.NONE;
    } else if (sameName(branch, value)) {
      return Match.EXACT;
    }

    Schema valueSchema = ((GenericRecord) value).getSchema();
    for (Schema.Field field : branch.getFields()) {
      boolean required = !AvroSchemaUtil.isNullable(field.schema());
      if (required && valueSchema.getField(field.name()) == null) {
        return Match.NONE;
      }
    }

    return Match.PROMOTABLE;
  }

  private static boolean sameName(Schema branch, Object value) {
    Schema valueSchema = ((GenericContainer) value).getSchema();
    return valueSchema != null && branch.getFullName().equals(valueSchema.getFullName());
  }

  /**
   * Returns whether a value could be accepted by more than one non-null branch of a union.
   *
   * <p>This is the case for two or more of long, float and double, for two or more records or
   * enums, for two or more fixed types of the same size, and for two or more decimals, which all
   * accept a {@link BigDecimal}.
   */
  static boolean mayBeAmbiguous(List<Schema> branches) {
    int numbers = 0;
    int records = 0;
    int enums = 0;
    int decimals = 0;
    Set<Integer> fixedSizes = Sets.newHashSet();
    for (Schema branch : branches) {
      if (branch.getLogicalType() instanceof LogicalTypes.Decimal) {
        decimals += 1;
      }

      switch (branch.getType()) {
        case LONG:
        case FLOAT:
        case DOUBLE:
          numbers += 1;
          break;
        case RECORD:
          records += 1;
          break;
        case ENUM:
          enums += 1;
          break;
        case FIXED:
          if (!fixedSizes.add(branch.getFixedSize())) {
            return true;
          }
          break;
        default:
      }
    }

    return numbers > 1 || records > 1 || enums > 1 || decimals > 1;
  }

  private static Match exactIf(boolean test) {
    return test ? Match.EXACT : Match.NONE;
  }

  private static Match promotableIf(boolean test) {
    return test ? Match.PROMOTABLE : Match.NONE;
  }
}
