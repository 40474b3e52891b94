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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.util.List;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avrorows.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the converter tree for an Avro schema.
 *
 * <p>Each schema node is visited with the columnar type of its values, so that rows for nested
 * records share the struct types of the row type produced by {@link AvroSchemaUtil#convert}.
 */
class BuildConverter extends AvroWithPartnerVisitor<Type, ValueConverter<?>> {
  private static final Logger LOG = LoggerFactory.getLogger(BuildConverter.class);
  private static final Joiner DOT = Joiner.on('.');

  static ValueConverter<?> build(
      Schema schema, Type type, int maxDepth, boolean adjustToUtcDefault, boolean failOnAmbiguity) {
    return AvroWithPartnerVisitor.visit(
        type,
        schema,
        new BuildConverter(maxDepth, adjustToUtcDefault, failOnAmbiguity),
        TypeAccessors.get());
  }

  private final int maxDepth;
  private final boolean adjustToUtcDefault;
  private final boolean failOnAmbiguity;

  private BuildConverter(int maxDepth, boolean adjustToUtcDefault, boolean failOnAmbiguity) {
    this.maxDepth = maxDepth;
    this.adjustToUtcDefault = adjustToUtcDefault;
    this.failOnAmbiguity = failOnAmbiguity;
  }

  @Override
  protected void beforeNested(Type partner, Schema nested) {
    int depth = fieldNames().size() + 1;
    Preconditions.checkArgument(
        depth <= maxDepth,
        "Cannot convert schema: %s at %s exceeds the maximum nesting depth %s",
        nested.getType(),
        fieldNames().isEmpty() ? "<root>" : DOT.join(fieldNames()),
        maxDepth);
  }

  @Override
  public ValueConverter<?> record(Type partner, Schema record, List<ValueConverter<?>> fields) {
    return ValueConverters.record(record, partner.asStructType(), fields);
  }

  @Override
  public ValueConverter<?> union(Type partner, Schema union, List<ValueConverter<?>> options) {
    List<Schema> branches = union.getTypes();
    List<Schema> nonNull = AvroSchemaUtil.nonNullBranches(union);
    if (nonNull.isEmpty()) {
      return ValueConverters.nulls();
    } else if (AvroSchemaUtil.isOptionSchema(union)) {
      int index = branches.get(0).getType() == Schema.Type.NULL ? 1 : 0;
      return ValueConverters.option(options.get(index));
    } else if (branches.size() == 1) {
      return options.get(0);
    }

    if (!failOnAmbiguity && UnionBranchMatcher.mayBeAmbiguous(nonNull)) {
      LOG.warn(
          "Union at {} has branches that may accept the same value, using the first match: {}",
          fieldNames().isEmpty() ? "<root>" : DOT.join(fieldNames()),
          union);
    }

    return ValueConverters.union(union, options, failOnAmbiguity);
  }

  @Override
  public ValueConverter<?> array(Type partner, Schema array, ValueConverter<?> element) {
    return ValueConverters.array(element);
  }

  @Override
  public ValueConverter<?> map(Type partner, Schema map, ValueConverter<?> value) {
    return ValueConverters.map(value);
  }

  @Override
  public ValueConverter<?> primitive(Type partner, Schema primitive) {
    LogicalType logical = primitive.getLogicalType();
    String logicalName = AvroSchemaUtil.logicalTypeName(primitive);

    switch (primitive.getType()) {
      case NULL:
        return ValueConverters.nulls();

      case BOOLEAN:
        return ValueConverters.booleans();

      case INT:
        if (logical instanceof LogicalTypes.Date) {
          return ValueConverters.dates();
        } else if (logical instanceof LogicalTypes.TimeMillis) {
          return ValueConverters.timeMillis();
        }
        return ValueConverters.ints();

      case LONG:
        if (logical instanceof LogicalTypes.TimeMicros) {
          return ValueConverters.timeMicros();
        } else if (logical instanceof LogicalTypes.TimestampMillis) {
          return AvroSchemaUtil.isTimestamptz(primitive, adjustToUtcDefault)
              ? ValueConverters.timestamptzMillis()
              : ValueConverters.timestampMillis();
        } else if (logical instanceof LogicalTypes.TimestampMicros) {
          return AvroSchemaUtil.isTimestamptz(primitive, adjustToUtcDefault)
              ? ValueConverters.timestamptzMicros()
              : ValueConverters.timestampMicros();
        } else if (logical instanceof LogicalTypes.LocalTimestampMillis) {
          return ValueConverters.timestampMillis();
        } else if (logical instanceof LogicalTypes.LocalTimestampMicros) {
          return ValueConverters.timestampMicros();
        }
        return ValueConverters.longs();

      case FLOAT:
        return ValueConverters.floats();

      case DOUBLE:
        return ValueConverters.doubles();

      case STRING:
        if (LogicalTypes.uuid().getName().equals(logicalName)) {
          return ValueConverters.uuids();
        }
        return ValueConverters.strings();

      case ENUM:
        return ValueConverters.enums(primitive);

      case BYTES:
        if (logical instanceof LogicalTypes.Decimal) {
          LogicalTypes.Decimal decimal = (LogicalTypes.Decimal) logical;
          return ValueConverters.decimal(decimal.getPrecision(), decimal.getScale());
        }
        return ValueConverters.bytes();

      case FIXED:
        if (logical instanceof LogicalTypes.Decimal) {
          LogicalTypes.Decimal decimal = (LogicalTypes.Decimal) logical;
          return ValueConverters.decimal(decimal.getPrecision(), decimal.getScale());
        } else if (AvroLogicalTypes.DURATION.equals(logicalName)) {
          return ValueConverters.durations();
        }
        return ValueConverters.fixed(primitive);

      default:
        throw new IllegalArgumentException("Unsupported primitive type: " + primitive);
    }
  }
}
