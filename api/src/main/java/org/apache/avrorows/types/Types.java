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
package org.apache.avrorows.types;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import org.apache.avrorows.types.Type.NestedType;
import org.apache.avrorows.types.Type.PrimitiveType;

public class Types {

  private Types() {}

  private static final Joiner COMMA = Joiner.on(", ");

  /** Type of values that are always null. */
  public static class NullType extends PrimitiveType {
    private static final NullType INSTANCE = new NullType();

    public static NullType get() {
      return INSTANCE;
    }

    private NullType() {
      super(TypeID.NULL, "null");
    }
  }

  public static class BooleanType extends PrimitiveType {
    private static final BooleanType INSTANCE = new BooleanType();

    public static BooleanType get() {
      return INSTANCE;
    }

    private BooleanType() {
      super(TypeID.BOOLEAN, "boolean");
    }
  }

  public static class IntegerType extends PrimitiveType {
    private static final IntegerType INSTANCE = new IntegerType();

    public static IntegerType get() {
      return INSTANCE;
    }

    private IntegerType() {
      super(TypeID.INTEGER, "int");
    }
  }

  public static class LongType extends PrimitiveType {
    private static final LongType INSTANCE = new LongType();

    public static LongType get() {
      return INSTANCE;
    }

    private LongType() {
      super(TypeID.LONG, "long");
    }
  }

  public static class FloatType extends PrimitiveType {
    private static final FloatType INSTANCE = new FloatType();

    public static FloatType get() {
      return INSTANCE;
    }

    private FloatType() {
      super(TypeID.FLOAT, "float");
    }
  }

  public static class DoubleType extends PrimitiveType {
    private static final DoubleType INSTANCE = new DoubleType();

    public static DoubleType get() {
      return INSTANCE;
    }

    private DoubleType() {
      super(TypeID.DOUBLE, "double");
    }
  }

  public static class DateType extends PrimitiveType {
    private static final DateType INSTANCE = new DateType();

    public static DateType get() {
      return INSTANCE;
    }

    private DateType() {
      super(TypeID.DATE, "date");
    }
  }

  /** Time of day. Values read from millisecond and microsecond encodings share this type. */
  public static class TimeType extends PrimitiveType {
    private static final TimeType INSTANCE = new TimeType();

    public static TimeType get() {
      return INSTANCE;
    }

    private TimeType() {
      super(TypeID.TIME, "time");
    }
  }

  /**
   * Timestamp type. Timestamps adjusted to UTC are absolute instants and are converted to {@link
   * java.time.OffsetDateTime} values; timestamps without zone are converted to {@link
   * java.time.LocalDateTime} values.
   */
  public static class TimestampType extends PrimitiveType {
    private static final TimestampType INSTANCE_WITH_ZONE = new TimestampType(true);
    private static final TimestampType INSTANCE_WITHOUT_ZONE = new TimestampType(false);

    public static TimestampType withZone() {
      return INSTANCE_WITH_ZONE;
    }

    public static TimestampType withoutZone() {
      return INSTANCE_WITHOUT_ZONE;
    }

    private final boolean adjustToUTC;

    private TimestampType(boolean adjustToUTC) {
      super(TypeID.TIMESTAMP, adjustToUTC ? "timestamptz" : "timestamp");
      this.adjustToUTC = adjustToUTC;
    }

    public boolean shouldAdjustToUTC() {
      return adjustToUTC;
    }
  }

  public static class StringType extends PrimitiveType {
    private static final StringType INSTANCE = new StringType();

    public static StringType get() {
      return INSTANCE;
    }

    private StringType() {
      super(TypeID.STRING, "string");
    }
  }

  public static class UUIDType extends PrimitiveType {
    private static final UUIDType INSTANCE = new UUIDType();

    public static UUIDType get() {
      return INSTANCE;
    }

    private UUIDType() {
      super(TypeID.UUID, "uuid");
    }
  }

  public static class FixedType extends PrimitiveType {
    public static FixedType ofLength(int length) {
      return new FixedType(length);
    }

    private final int length;

    private FixedType(int length) {
      super(TypeID.FIXED, String.format("fixed[%d]", length));
      this.length = length;
    }

    public int length() {
      return length;
    }
  }

  public static class BinaryType extends PrimitiveType {
    private static final BinaryType INSTANCE = new BinaryType();

    public static BinaryType get() {
      return INSTANCE;
    }

    private BinaryType() {
      super(TypeID.BINARY, "binary");
    }
  }

  public static class DecimalType extends PrimitiveType {
    public static DecimalType of(int precision, int scale) {
      Preconditions.checkArgument(
          precision > 0, "Invalid decimal precision: %s (must be positive)", precision);
      Preconditions.checkArgument(
          scale >= 0 && scale <= precision,
          "Invalid decimal scale: %s (must be between 0 and precision %s)",
          scale,
          precision);
      return new DecimalType(precision, scale);
    }

    private final int precision;
    private final int scale;

    private DecimalType(int precision, int scale) {
      super(TypeID.DECIMAL, String.format("decimal(%d, %d)", precision, scale));
      this.precision = precision;
      this.scale = scale;
    }

    public int precision() {
      return precision;
    }

    public int scale() {
      return scale;
    }
  }

  /** An amount of time in months, days and milliseconds. */
  public static class IntervalType extends PrimitiveType {
    private static final IntervalType INSTANCE = new IntervalType();

    public static IntervalType get() {
      return INSTANCE;
    }

    private IntervalType() {
      super(TypeID.INTERVAL, "interval");
    }
  }

  /** A named, numbered child of a nested type. */
  public static class NestedField implements Serializable {
    public static NestedField optional(int id, String name, Type type) {
      return new NestedField(true, id, name, type, null);
    }

    public static NestedField optional(int id, String name, Type type, String doc) {
      return new NestedField(true, id, name, type, doc);
    }

    public static NestedField required(int id, String name, Type type) {
      return new NestedField(false, id, name, type, null);
    }

    public static NestedField required(int id, String name, Type type, String doc) {
      return new NestedField(false, id, name, type, doc);
    }

    private final boolean isOptional;
    private final int id;
    private final String name;
    private final Type type;
    private final String doc;

    private NestedField(boolean isOptional, int id, String name, Type type, String doc) {
      Preconditions.checkNotNull(name, "Name cannot be null");
      Preconditions.checkNotNull(type, "Type cannot be null");
      this.isOptional = isOptional;
      this.id = id;
      this.name = name;
      this.type = type;
      this.doc = doc;
    }

    /** Whether values of this field may be null. */
    public boolean isOptional() {
      return isOptional;
    }

    public int fieldId() {
      return id;
    }

    public String name() {
      return name;
    }

    public Type type() {
      return type;
    }

    public String doc() {
      return doc;
    }

    @Override
    public String toString() {
      return String.format("%d: %s: %s %s", id, name, isOptional ? "optional" : "required", type)
          + (doc != null ? " (" + doc + ")" : "");
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      } else if (!(o instanceof NestedField)) {
        return false;
      }

      NestedField that = (NestedField) o;
      return isOptional == that.isOptional
          && id == that.id
          && name.equals(that.name)
          && Objects.equals(doc, that.doc)
          && type.equals(that.type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, isOptional, name, type);
    }
  }

  /** Type of a row: one field for each field of an Avro record, in record order. */
  public static class StructType extends NestedType {
    public static StructType of(NestedField... fields) {
      return new StructType(fields);
    }

    public static StructType of(List<NestedField> fields) {
      Preconditions.checkNotNull(fields, "Field list cannot be null");
      return new StructType(fields.toArray(new NestedField[0]));
    }

    private StructType(NestedField[] fields) {
      super(fields);
    }

    @Override
    public TypeID typeId() {
      return TypeID.STRUCT;
    }

    @Override
    public StructType asStructType() {
      return this;
    }

    @Override
    public String toString() {
      return String.format("struct<%s>", COMMA.join(fields()));
    }
  }

  public static class ListType extends NestedType {
    public static ListType ofOptional(int elementId, Type elementType) {
      return new ListType(NestedField.optional(elementId, "element", elementType));
    }

    public static ListType ofRequired(int elementId, Type elementType) {
      return new ListType(NestedField.required(elementId, "element", elementType));
    }

    private ListType(NestedField element) {
      super(element);
    }

    public Type elementType() {
      return fieldAt(0).type();
    }

    public boolean isElementOptional() {
      return fieldAt(0).isOptional();
    }

    @Override
    public TypeID typeId() {
      return TypeID.LIST;
    }

    @Override
    public ListType asListType() {
      return this;
    }

    @Override
    public String toString() {
      return String.format("list<%s>", elementType());
    }
  }

  /** Map type. Keys of maps converted from Avro are always strings. */
  public static class MapType extends NestedType {
    public static MapType ofOptional(int keyId, int valueId, Type keyType, Type valueType) {
      return new MapType(
          NestedField.required(keyId, "key", keyType),
          NestedField.optional(valueId, "value", valueType));
    }

    public static MapType ofRequired(int keyId, int valueId, Type keyType, Type valueType) {
      return new MapType(
          NestedField.required(keyId, "key", keyType),
          NestedField.required(valueId, "value", valueType));
    }

    private MapType(NestedField key, NestedField value) {
      super(key, value);
    }

    public Type keyType() {
      return fieldAt(0).type();
    }

    public Type valueType() {
      return fieldAt(1).type();
    }

    public boolean isValueOptional() {
      return fieldAt(1).isOptional();
    }

    @Override
    public TypeID typeId() {
      return TypeID.MAP;
    }

    @Override
    public MapType asMapType() {
      return this;
    }

    @Override
    public String toString() {
      return String.format("map<%s, %s>", keyType(), valueType());
    }
  }

  /**
   * A value of one of several types.
   *
   * <p>Each option is a field named {@code option<i>}. A union value is the converted value of the
   * option selected for it, not a struct; the option types describe the possible values.
   */
  public static class UnionType extends NestedType {
    public static UnionType of(List<NestedField> options) {
      Preconditions.checkNotNull(options, "Option list cannot be null");
      Preconditions.checkArgument(
          options.size() > 1, "Cannot create a union with fewer than 2 options: %s", options);
      return new UnionType(options.toArray(new NestedField[0]));
    }

    private UnionType(NestedField[] options) {
      super(options);
    }

    public List<Type> optionTypes() {
      return Lists.transform(fields(), NestedField::type);
    }

    public Type optionType(int index) {
      return fieldAt(index).type();
    }

    @Override
    public TypeID typeId() {
      return TypeID.UNION;
    }

    @Override
    public boolean isUnionType() {
      return true;
    }

    @Override
    public UnionType asUnionType() {
      return this;
    }

    @Override
    public String toString() {
      return String.format("union<%s>", COMMA.join(optionTypes()));
    }
  }
}
