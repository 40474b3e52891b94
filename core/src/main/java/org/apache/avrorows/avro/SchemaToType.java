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

import com.google.common.collect.Lists;
import java.util.List;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avrorows.types.Type;
import org.apache.avrorows.types.Types;

/**
 * Maps an Avro schema to the columnar type of the values converted from it.
 *
 * <p>Fields of the root record are numbered from 0 in field order. Nested fields, list elements,
 * map keys and values and union options are numbered after the root fields, in the order they
 * are finished. A {@code field-id} property on a field takes precedence.
 */
class SchemaToType extends AvroWithPartnerVisitor<Void, Type> {
  private final Schema root;
  private final boolean adjustToUtcDefault;
  private int nextId;

  SchemaToType(Schema root, boolean adjustToUtcDefault) {
    this.root = root;
    this.adjustToUtcDefault = adjustToUtcDefault;
    this.nextId = root.getType() == Schema.Type.RECORD ? root.getFields().size() : 1;
  }

  private int allocateId() {
    int id = nextId;
    nextId += 1;
    return id;
  }

  @Override
  public Type record(Void partner, Schema record, List<Type> fieldTypes) {
    if (record == root) {
      // children are finished, so the root's own fields can take the first ids
      this.nextId = 0;
    }

    List<Schema.Field> fields = record.getFields();
    List<Types.NestedField> columns = Lists.newArrayListWithExpectedSize(fields.size());
    for (int pos = 0; pos < fields.size(); pos += 1) {
      Schema.Field field = fields.get(pos);
      Integer fieldId = AvroSchemaUtil.fieldId(field);
      int id = fieldId != null ? fieldId : allocateId();
      Type type = fieldTypes.get(pos);
      columns.add(
          AvroSchemaUtil.isNullable(field.schema())
              ? Types.NestedField.optional(id, field.name(), type, field.doc())
              : Types.NestedField.required(id, field.name(), type, field.doc()));
    }

    return Types.StructType.of(columns);
  }

  @Override
  public Type union(Void partner, Schema union, List<Type> branchTypes) {
    List<Type> options = Lists.newArrayList();
    List<Schema> branches = union.getTypes();
    for (int i = 0; i < branches.size(); i += 1) {
      if (branches.get(i).getType() != Schema.Type.NULL) {
        options.add(branchTypes.get(i));
      }
    }

    switch (options.size()) {
      case 0:
        return Types.NullType.get();
      case 1:
        return options.get(0);
      default:
        List<Types.NestedField> fields = Lists.newArrayListWithExpectedSize(options.size());
        for (Type option : options) {
          fields.add(Types.NestedField.optional(allocateId(), "option" + fields.size(), option));
        }
        return Types.UnionType.of(fields);
    }
  }

  @Override
  public Type array(Void partner, Schema array, Type elementType) {
    int elementId = allocateId();
    return AvroSchemaUtil.isNullable(array.getElementType())
        ? Types.ListType.ofOptional(elementId, elementType)
        : Types.ListType.ofRequired(elementId, elementType);
  }

  @Override
  public Type map(Void partner, Schema map, Type valueType) {
    int keyId = allocateId();
    int valueId = allocateId();
    return AvroSchemaUtil.isNullable(map.getValueType())
        ? Types.MapType.ofOptional(keyId, valueId, Types.StringType.get(), valueType)
        : Types.MapType.ofRequired(keyId, valueId, Types.StringType.get(), valueType);
  }

  @Override
  public Type primitive(Void partner, Schema primitive) {
    Type logicalType = logicalType(primitive);
    if (logicalType != null) {
      return logicalType;
    }

    switch (primitive.getType()) {
      case NULL:
        return Types.NullType.get();
      case BOOLEAN:
        return Types.BooleanType.get();
      case INT:
        return Types.IntegerType.get();
      case LONG:
        return Types.LongType.get();
      case FLOAT:
        return Types.FloatType.get();
      case DOUBLE:
        return Types.DoubleType.get();
      case STRING:
      case ENUM:
        return Types.StringType.get();
      case FIXED:
        return Types.FixedType.ofLength(primitive.getFixedSize());
      case BYTES:
        return Types.BinaryType.get();
      default:
        throw new UnsupportedOperationException("Unsupported primitive type: " + primitive);
    }
  }

  /** Returns the type of a logical type, or null when values are read as the base type. */
  private Type logicalType(Schema primitive) {
    LogicalType logical = primitive.getLogicalType();
    if (logical instanceof LogicalTypes.Decimal) {
      LogicalTypes.Decimal decimal = (LogicalTypes.Decimal) logical;
      return Types.DecimalType.of(decimal.getPrecision(), decimal.getScale());
    } else if (logical instanceof LogicalTypes.Date) {
      return Types.DateType.get();
    } else if (logical instanceof LogicalTypes.TimeMillis
        || logical instanceof LogicalTypes.TimeMicros) {
      return Types.TimeType.get();
    } else if (logical instanceof LogicalTypes.TimestampMillis
        || logical instanceof LogicalTypes.TimestampMicros) {
      return AvroSchemaUtil.isTimestamptz(primitive, adjustToUtcDefault)
          ? Types.TimestampType.withZone()
          : Types.TimestampType.withoutZone();
    } else if (logical instanceof LogicalTypes.LocalTimestampMillis
        || logical instanceof LogicalTypes.LocalTimestampMicros) {
      return Types.TimestampType.withoutZone();
    }

    String name = AvroSchemaUtil.logicalTypeName(primitive);
    if (primitive.getType() == Schema.Type.STRING && LogicalTypes.uuid().getName().equals(name)) {
      return Types.UUIDType.get();
    } else if (primitive.getType() == Schema.Type.FIXED && AvroLogicalTypes.DURATION.equals(name)) {
      return Types.IntervalType.get();
    }

    return null;
  }
}
