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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.avrorows.data.GenericRow;
import org.apache.avrorows.data.Interval;
import org.apache.avrorows.data.Row;
import org.apache.avrorows.exceptions.MissingFieldException;
import org.apache.avrorows.exceptions.RowConversionException;
import org.apache.avrorows.exceptions.SchemaMismatchException;
import org.apache.avrorows.types.Types;
import org.apache.avrorows.util.ByteBuffers;

public class ValueConverters {
  private ValueConverters() {}

  public static ValueConverter<Object> nulls() {
    return NullConverter.INSTANCE;
  }

  public static ValueConverter<Boolean> booleans() {
    return BooleanConverter.INSTANCE;
  }

  public static ValueConverter<Integer> ints() {
    return IntegerConverter.INSTANCE;
  }

  public static ValueConverter<Long> longs() {
    return LongConverter.INSTANCE;
  }

  public static ValueConverter<Float> floats() {
    return FloatConverter.INSTANCE;
  }

  public static ValueConverter<Double> doubles() {
    return DoubleConverter.INSTANCE;
  }

  public static ValueConverter<String> strings() {
    return StringConverter.INSTANCE;
  }

  public static ValueConverter<String> enums(Schema enumSchema) {
    return new EnumConverter(enumSchema);
  }

  public static ValueConverter<UUID> uuids() {
    return UUIDConverter.INSTANCE;
  }

  public static ValueConverter<ByteBuffer> bytes() {
    return BytesConverter.INSTANCE;
  }

  public static ValueConverter<ByteBuffer> fixed(Schema fixedSchema) {
    return new FixedConverter(fixedSchema);
  }

  public static ValueConverter<BigDecimal> decimal(int precision, int scale) {
    return new DecimalConverter(precision, scale);
  }

  public static ValueConverter<LocalDate> dates() {
    return DateConverter.INSTANCE;
  }

  public static ValueConverter<LocalTime> timeMillis() {
    return TimeMillisConverter.INSTANCE;
  }

  public static ValueConverter<LocalTime> timeMicros() {
    return TimeMicrosConverter.INSTANCE;
  }

  public static ValueConverter<OffsetDateTime> timestamptzMillis() {
    return TimestamptzConverter.MILLIS;
  }

  public static ValueConverter<OffsetDateTime> timestamptzMicros() {
    return TimestamptzConverter.MICROS;
  }

  public static ValueConverter<LocalDateTime> timestampMillis() {
    return TimestampConverter.MILLIS;
  }

  public static ValueConverter<LocalDateTime> timestampMicros() {
    return TimestampConverter.MICROS;
  }

  public static ValueConverter<Interval> durations() {
    return DurationConverter.INSTANCE;
  }

  public static ValueConverter<Object> option(ValueConverter<?> converter) {
    return new OptionConverter(converter);
  }

  public static ValueConverter<Object> union(
      Schema union, List<ValueConverter<?>> converters, boolean failOnAmbiguity) {
    return new UnionConverter(union, converters, failOnAmbiguity);
  }

  public static <T> ValueConverter<List<T>> array(ValueConverter<T> elementConverter) {
    return new ArrayConverter<>(elementConverter);
  }

  public static <V> ValueConverter<Map<String, V>> map(ValueConverter<V> valueConverter) {
    return new MapConverter<>(valueConverter);
  }

  public static ValueConverter<Row> record(
      Schema record, Types.StructType struct, List<ValueConverter<?>> converters) {
    return new RecordConverter(record, struct, converters);
  }

  private static String describe(Object value) {
    return value.getClass().getName();
  }

  /** Base class for converters of schemas that do not accept null. */
  private abstract static class NonNullConverter<T> implements ValueConverter<T> {
    private final String typeName;

    private NonNullConverter(String typeName) {
      this.typeName = typeName;
    }

    @Override
    public T convert(Object value) {
      if (value == null) {
        throw new SchemaMismatchException("Invalid null value for non-null type: %s", typeName);
      }

      return convertNonNull(value);
    }

    protected abstract T convertNonNull(Object value);

    protected SchemaMismatchException mismatch(Object value) {
      return new SchemaMismatchException(
          "Cannot convert %s to %s", describe(value), typeName);
    }
  }

  private static class NullConverter implements ValueConverter<Object> {
    private static final NullConverter INSTANCE = new NullConverter();

    private NullConverter() {}

    @Override
    public Object convert(Object value) {
      SchemaMismatchException.check(
          value == null, "Cannot convert %s to null", value != null ? describe(value) : null);
      return null;
    }
  }

  private static class BooleanConverter extends NonNullConverter<Boolean> {
    private static final BooleanConverter INSTANCE = new BooleanConverter();

    private BooleanConverter() {
      super("boolean");
    }

    @Override
    protected Boolean convertNonNull(Object value) {
      if (value instanceof Boolean) {
        return (Boolean) value;
      }

      throw mismatch(value);
    }
  }

  private static class IntegerConverter extends NonNullConverter<Integer> {
    private static final IntegerConverter INSTANCE = new IntegerConverter();

    private IntegerConverter() {
      super("int");
    }

    @Override
    protected Integer convertNonNull(Object value) {
      if (value instanceof Integer) {
        return (Integer) value;
      }

      throw mismatch(value);
    }
  }

  private static class LongConverter extends NonNullConverter<Long> {
    private static final LongConverter INSTANCE = new LongConverter();

    private LongConverter() {
      super("long");
    }

    @Override
    protected Long convertNonNull(Object value) {
      if (value instanceof Long) {
        return (Long) value;
      } else if (value instanceof Integer) {
        return ((Integer) value).longValue();
      }

      throw mismatch(value);
    }
  }

  private static class FloatConverter extends NonNullConverter<Float> {
    private static final FloatConverter INSTANCE = new FloatConverter();

    private FloatConverter() {
      super("float");
    }

    @Override
    protected Float convertNonNull(Object value) {
      if (value instanceof Float) {
        return (Float) value;
      } else if (value instanceof Integer || value instanceof Long) {
        return ((Number) value).floatValue();
      }

      throw mismatch(value);
    }
  }

  private static class DoubleConverter extends NonNullConverter<Double> {
    private static final DoubleConverter INSTANCE = new DoubleConverter();

    private DoubleConverter() {
      super("double");
    }

    @Override
    protected Double convertNonNull(Object value) {
      if (value instanceof Double) {
        return (Double) value;
      } else if (value instanceof Integer || value instanceof Long || value instanceof Float) {
        return ((Number) value).doubleValue();
      }

      throw mismatch(value);
    }
  }

  private static class StringConverter extends NonNullConverter<String> {
    private static final StringConverter INSTANCE = new StringConverter();

    private StringConverter() {
      super("string");
    }

    @Override
    protected String convertNonNull(Object value) {
      if (value instanceof CharSequence) {
        // Utf8 and other char sequences are copied into a new String
        return value.toString();
      }

      throw mismatch(value);
    }
  }

  private static class EnumConverter extends NonNullConverter<String> {
    private final String enumName;
    private final Set<String> symbols;

    private EnumConverter(Schema enumSchema) {
      super("enum " + enumSchema.getFullName());
      this.enumName = enumSchema.getFullName();
      this.symbols = ImmutableSet.copyOf(enumSchema.getEnumSymbols());
    }

    @Override
    protected String convertNonNull(Object value) {
      if (value instanceof GenericEnumSymbol || value instanceof CharSequence) {
        String symbol = value.toString();
        SchemaMismatchException.check(
            symbols.contains(symbol),
            "Invalid symbol for enum %s: %s",
            enumName,
            symbol);
        return symbol;
      }

      throw mismatch(value);
    }
  }

  private static class UUIDConverter extends NonNullConverter<UUID> {
    private static final UUIDConverter INSTANCE = new UUIDConverter();

    private UUIDConverter() {
      super("uuid");
    }

    @Override
    protected UUID convertNonNull(Object value) {
      if (value instanceof UUID) {
        return (UUID) value;
      } else if (value instanceof CharSequence) {
        return LogicalValues.uuid((CharSequence) value);
      }

      throw mismatch(value);
    }
  }

  private static class BytesConverter extends NonNullConverter<ByteBuffer> {
    private static final BytesConverter INSTANCE = new BytesConverter();

    private BytesConverter() {
      super("bytes");
    }

    @Override
    protected ByteBuffer convertNonNull(Object value) {
      if (value instanceof ByteBuffer) {
        return ByteBuffers.readOnlyCopy((ByteBuffer) value);
      } else if (value instanceof byte[]) {
        return ByteBuffers.readOnlyCopy(ByteBuffer.wrap((byte[]) value));
      }

      throw mismatch(value);
    }
  }

  /** Returns the bytes of a bytes or fixed value as a buffer, or null for other values. */
  private static ByteBuffer binary(Object value) {
    if (value instanceof ByteBuffer) {
      return (ByteBuffer) value;
    } else if (value instanceof byte[]) {
      return ByteBuffer.wrap((byte[]) value);
    } else if (value instanceof GenericFixed) {
      return ByteBuffer.wrap(((GenericFixed) value).bytes());
    }

    return null;
  }

  private static class FixedConverter extends NonNullConverter<ByteBuffer> {
    private final int length;

    private FixedConverter(Schema fixedSchema) {
      super("fixed " + fixedSchema.getFullName());
      this.length = fixedSchema.getFixedSize();
    }

    @Override
    protected ByteBuffer convertNonNull(Object value) {
      ByteBuffer buffer = binary(value);
      if (buffer == null) {
        throw mismatch(value);
      }

      SchemaMismatchException.check(
          buffer.remaining() == length,
          "Invalid fixed[%s] value: %s bytes",
          length,
          buffer.remaining());
      return ByteBuffers.readOnlyCopy(buffer);
    }
  }

  private static class DecimalConverter extends NonNullConverter<BigDecimal> {
    private final int precision;
    private final int scale;

    private DecimalConverter(int precision, int scale) {
      super(String.format("decimal(%s, %s)", precision, scale));
      this.precision = precision;
      this.scale = scale;
    }

    @Override
    protected BigDecimal convertNonNull(Object value) {
      if (value instanceof BigDecimal) {
        return LogicalValues.decimal((BigDecimal) value, precision, scale);
      }

      ByteBuffer buffer = binary(value);
      if (buffer == null) {
        throw mismatch(value);
      }

      return LogicalValues.decimal(ByteBuffers.copyToByteArray(buffer), precision, scale);
    }
  }

  private static class DateConverter extends NonNullConverter<LocalDate> {
    private static final DateConverter INSTANCE = new DateConverter();

    private DateConverter() {
      super("date");
    }

    @Override
    protected LocalDate convertNonNull(Object value) {
      if (value instanceof Integer) {
        return LogicalValues.date((Integer) value);
      } else if (value instanceof LocalDate) {
        return (LocalDate) value;
      }

      throw mismatch(value);
    }
  }

  private static class TimeMillisConverter extends NonNullConverter<LocalTime> {
    private static final TimeMillisConverter INSTANCE = new TimeMillisConverter();

    private TimeMillisConverter() {
      super("time-millis");
    }

    @Override
    protected LocalTime convertNonNull(Object value) {
      if (value instanceof Integer) {
        return LogicalValues.timeMillis((Integer) value);
      } else if (value instanceof LocalTime) {
        return (LocalTime) value;
      }

      throw mismatch(value);
    }
  }

  private static class TimeMicrosConverter extends NonNullConverter<LocalTime> {
    private static final TimeMicrosConverter INSTANCE = new TimeMicrosConverter();

    private TimeMicrosConverter() {
      super("time-micros");
    }

    @Override
    protected LocalTime convertNonNull(Object value) {
      if (value instanceof Long) {
        return LogicalValues.timeMicros((Long) value);
      } else if (value instanceof LocalTime) {
        return (LocalTime) value;
      }

      throw mismatch(value);
    }
  }

  private static class TimestamptzConverter extends NonNullConverter<OffsetDateTime> {
    private static final TimestamptzConverter MILLIS = new TimestamptzConverter(true);
    private static final TimestamptzConverter MICROS = new TimestamptzConverter(false);

    private final boolean millis;

    private TimestamptzConverter(boolean millis) {
      super(millis ? "timestamp-millis" : "timestamp-micros");
      this.millis = millis;
    }

    @Override
    protected OffsetDateTime convertNonNull(Object value) {
      if (value instanceof Long) {
        long encoded = (Long) value;
        return millis
            ? LogicalValues.timestamptzMillis(encoded)
            : LogicalValues.timestamptzMicros(encoded);
      } else if (value instanceof Instant) {
        return ((Instant) value).atOffset(ZoneOffset.UTC);
      } else if (value instanceof OffsetDateTime) {
        return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC);
      }

      throw mismatch(value);
    }
  }

  private static class TimestampConverter extends NonNullConverter<LocalDateTime> {
    private static final TimestampConverter MILLIS = new TimestampConverter(true);
    private static final TimestampConverter MICROS = new TimestampConverter(false);

    private final boolean millis;

    private TimestampConverter(boolean millis) {
      super(millis ? "local-timestamp-millis" : "local-timestamp-micros");
      this.millis = millis;
    }

    @Override
    protected LocalDateTime convertNonNull(Object value) {
      if (value instanceof Long) {
        long encoded = (Long) value;
        return millis
            ? LogicalValues.timestampMillis(encoded)
            : LogicalValues.timestampMicros(encoded);
      } else if (value instanceof LocalDateTime) {
        return (LocalDateTime) value;
      }

      throw mismatch(value);
    }
  }

  private static class DurationConverter extends NonNullConverter<Interval> {
    private static final DurationConverter INSTANCE = new DurationConverter();

    private DurationConverter() {
      super("duration");
    }

    @Override
    protected Interval convertNonNull(Object value) {
      if (value instanceof Interval) {
        return (Interval) value;
      }

      ByteBuffer buffer = binary(value);
      if (buffer == null) {
        throw mismatch(value);
      }

      return LogicalValues.duration(buffer);
    }
  }

  private static class OptionConverter implements ValueConverter<Object> {
    private final ValueConverter<?> converter;

    private OptionConverter(ValueConverter<?> converter) {
      this.converter = converter;
    }

    @Override
    public Object convert(Object value) {
      if (value == null) {
        return null;
      }

      return converter.convert(value);
    }
  }

  private static class UnionConverter implements ValueConverter<Object> {
    private final String union;
    private final Schema[] branches;
    private final ValueConverter<?>[] converters;
    private final boolean hasNull;
    private final boolean failOnAmbiguity;

    private UnionConverter(
        Schema union, List<ValueConverter<?>> converters, boolean failOnAmbiguity) {
      this.union = union.toString();
      this.branches = union.getTypes().toArray(new Schema[0]);
      this.converters = converters.toArray(new ValueConverter<?>[0]);
      this.hasNull = AvroSchemaUtil.isNullable(union);
      this.failOnAmbiguity = failOnAmbiguity;
    }

    @Override
    public Object convert(Object value) {
      if (value == null) {
        SchemaMismatchException.check(
            hasNull, "Invalid null value for union without null: %s", union);
        return null;
      }

      int exact = -1;
      int exactCount = 0;
      int promotable = -1;
      int promotableCount = 0;
      for (int i = 0; i < branches.length; i += 1) {
        switch (UnionBranchMatcher.match(branches[i], value)) {
          case EXACT:
            if (exact < 0) {
              exact = i;
            }
            exactCount += 1;
            break;
          case PROMOTABLE:
            if (promotable < 0) {
              promotable = i;
            }
            promotableCount += 1;
            break;
          default:
        }

        if (exact >= 0 && !failOnAmbiguity) {
          break;
        }
      }

      int selected;
      int matches;
      if (exact >= 0) {
        selected = exact;
        matches = exactCount;
      } else if (promotable >= 0) {
        selected = promotable;
        matches = promotableCount;
      } else {
        throw new SchemaMismatchException(
            "Cannot match %s to any branch of union: %s", describe(value), union);
      }

      SchemaMismatchException.check(
          !failOnAmbiguity || matches == 1,
          "Ambiguous union value: %s matches %s branches of union: %s",
          describe(value),
          matches,
          union);

      return converters[selected].convert(value);
    }
  }

  private static class ArrayConverter<T> implements ValueConverter<List<T>> {
    private final ValueConverter<T> elementConverter;

    private ArrayConverter(ValueConverter<T> elementConverter) {
      this.elementConverter = elementConverter;
    }

    @Override
    public List<T> convert(Object value) {
      if (value == null) {
        throw new SchemaMismatchException("Invalid null value for non-null type: array");
      } else if (!(value instanceof Collection)) {
        throw new SchemaMismatchException("Cannot convert %s to array", describe(value));
      }

      Collection<?> elements = (Collection<?>) value;
      List<T> result = Lists.newArrayListWithExpectedSize(elements.size());
      int index = 0;
      for (Object element : elements) {
        try {
          result.add(elementConverter.convert(element));
        } catch (RowConversionException e) {
          throw e.atIndex(index);
        }
        index += 1;
      }

      return Collections.unmodifiableList(result);
    }
  }

  private static class MapConverter<V> implements ValueConverter<Map<String, V>> {
    private final ValueConverter<V> valueConverter;

    private MapConverter(ValueConverter<V> valueConverter) {
      this.valueConverter = valueConverter;
    }

    @Override
    public Map<String, V> convert(Object value) {
      if (value == null) {
        throw new SchemaMismatchException("Invalid null value for non-null type: map");
      } else if (!(value instanceof Map)) {
        throw new SchemaMismatchException("Cannot convert %s to map", describe(value));
      }

      Map<?, ?> entries = (Map<?, ?>) value;
      Map<String, V> result = Maps.newLinkedHashMapWithExpectedSize(entries.size());
      for (Map.Entry<?, ?> entry : entries.entrySet()) {
        Object key = entry.getKey();
        SchemaMismatchException.check(
            key instanceof CharSequence,
            "Invalid map key: %s (must be a string)",
            key != null ? describe(key) : null);
        String name = key.toString();
        try {
          result.put(name, valueConverter.convert(entry.getValue()));
        } catch (RowConversionException e) {
          throw e.atKey(name);
        }
      }

      return Collections.unmodifiableMap(result);
    }
  }

  private static class RecordConverter implements ValueConverter<Row> {
    private final String recordName;
    private final Types.StructType struct;
    private final String[] names;
    private final boolean[] nullable;
    private final ValueConverter<?>[] converters;

    private RecordConverter(
        Schema record, Types.StructType struct, List<ValueConverter<?>> converters) {
      List<Schema.Field> fields = record.getFields();
      this.recordName = record.getFullName();
      this.struct = struct;
      this.names = new String[fields.size()];
      this.nullable = new boolean[fields.size()];
      this.converters = converters.toArray(new ValueConverter<?>[0]);
      for (int i = 0; i < names.length; i += 1) {
        Schema.Field field = fields.get(i);
        names[i] = field.name();
        nullable[i] = AvroSchemaUtil.isNullable(field.schema());
      }
    }

    @Override
    public Row convert(Object value) {
      if (value == null) {
        throw new SchemaMismatchException(
            "Invalid null value for non-null type: record %s", recordName);
      } else if (!(value instanceof GenericRecord)) {
        throw new SchemaMismatchException(
            "Cannot convert %s to record %s", describe(value), recordName);
      }

      GenericRecord genericRecord = (GenericRecord) value;
      Schema valueSchema = genericRecord.getSchema();
      Object[] values = new Object[names.length];
      for (int pos = 0; pos < names.length; pos += 1) {
        Schema.Field valueField = valueSchema.getField(names[pos]);
        Object fieldValue = valueField != null ? genericRecord.get(valueField.pos()) : null;
        if (fieldValue == null) {
          if (!nullable[pos]) {
            throw new MissingFieldException(
                    "Missing value for required field %s of record %s",
                    names[pos],
                    recordName)
                .inField(names[pos]);
          }

          continue;
        }

        try {
          values[pos] = converters[pos].convert(fieldValue);
        } catch (RowConversionException e) {
          throw e.inField(names[pos]);
        }
      }

      return GenericRow.of(struct, values);
    }
  }
}
