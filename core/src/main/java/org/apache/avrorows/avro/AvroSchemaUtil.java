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

import static org.apache.avro.Schema.Type.NULL;
import static org.apache.avro.Schema.Type.UNION;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avrorows.AvroRowProperties;
import org.apache.avrorows.types.Type;

public class AvroSchemaUtil {

  private AvroSchemaUtil() {}

  public static final String FIELD_ID_PROP = "field-id";
  public static final String ADJUST_TO_UTC_PROP = "adjust-to-utc";
  public static final String LOGICAL_TYPE_PROP = "logicalType";

  public static Type convert(Schema schema) {
    return convert(schema, AvroRowProperties.TIMESTAMP_ADJUST_TO_UTC_DEFAULT_DEFAULT);
  }

  /**
   * Converts an Avro schema to the columnar type of the values converted from it.
   *
   * @param schema an Avro schema
   * @param adjustToUtcDefault whether timestamps without an {@code adjust-to-utc} property are
   *     absolute instants
   * @return the columnar type
   */
  public static Type convert(Schema schema, boolean adjustToUtcDefault) {
    return AvroWithPartnerVisitor.visit(schema, new SchemaToType(schema, adjustToUtcDefault));
  }

  /**
   * Returns the name of a schema's logical type.
   *
   * <p>Logical types that Avro does not know, like {@code duration} in a parsed schema, are not
   * returned by {@link Schema#getLogicalType()} and are read from the {@code logicalType} property
   * instead.
   */
  public static String logicalTypeName(Schema schema) {
    LogicalType logicalType = schema.getLogicalType();
    if (logicalType != null) {
      return logicalType.getName();
    }

    return schema.getProp(LOGICAL_TYPE_PROP);
  }

  public static boolean isTimestamptz(Schema schema, boolean adjustToUtcDefault) {
    LogicalType logicalType = schema.getLogicalType();
    if (logicalType instanceof LogicalTypes.TimestampMillis
        || logicalType instanceof LogicalTypes.TimestampMicros) {
      Object value = schema.getObjectProp(ADJUST_TO_UTC_PROP);

      if (value == null) {
        return adjustToUtcDefault;
      } else if (value instanceof Boolean) {
        return (Boolean) value;
      } else if (value instanceof String) {
        return Boolean.parseBoolean((String) value);
      }
    }

    return false;
  }

  /** Returns whether a schema is a union of null and exactly one other type. */
  public static boolean isOptionSchema(Schema schema) {
    return schema.getType() == UNION
        && schema.getTypes().size() == 2
        && nonNullBranches(schema).size() == 1;
  }

  /** Returns whether a schema accepts null: the null schema or a union with a null branch. */
  public static boolean isNullable(Schema schema) {
    if (schema.getType() == NULL) {
      return true;
    } else if (schema.getType() == UNION) {
      for (Schema branch : schema.getTypes()) {
        if (branch.getType() == NULL) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns the non-null branch of an option schema. */
  public static Schema fromOption(Schema schema) {
    Preconditions.checkArgument(isOptionSchema(schema), "Not an option schema: %s", schema);
    return nonNullBranches(schema).get(0);
  }

  /** Returns the branches of a union that are not null, in declaration order. */
  public static List<Schema> nonNullBranches(Schema union) {
    Preconditions.checkArgument(union.getType() == UNION, "Not a union schema: %s", union);
    ImmutableList.Builder<Schema> branches = ImmutableList.builder();
    for (Schema branch : union.getTypes()) {
      if (branch.getType() != NULL) {
        branches.add(branch);
      }
    }
    return branches.build();
  }

  /** Returns the id set by a field's {@code field-id} property, or null. */
  static Integer fieldId(Schema.Field field) {
    Object id = field.getObjectProp(FIELD_ID_PROP);
    if (id == null) {
      return null;
    } else if (id instanceof Number) {
      return ((Number) id).intValue();
    } else if (id instanceof String) {
      return Integer.valueOf((String) id);
    }

    throw new IllegalArgumentException(
        String.format("Invalid %s for field %s: %s", FIELD_ID_PROP, field.name(), id));
  }
}
