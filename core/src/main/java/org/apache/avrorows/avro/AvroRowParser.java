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

import static org.apache.avrorows.AvroRowProperties.CONVERTER_CACHE_ENABLED;
import static org.apache.avrorows.AvroRowProperties.CONVERTER_CACHE_ENABLED_DEFAULT;
import static org.apache.avrorows.AvroRowProperties.MAX_NESTING_DEPTH;
import static org.apache.avrorows.AvroRowProperties.MAX_NESTING_DEPTH_DEFAULT;
import static org.apache.avrorows.AvroRowProperties.TIMESTAMP_ADJUST_TO_UTC_DEFAULT;
import static org.apache.avrorows.AvroRowProperties.TIMESTAMP_ADJUST_TO_UTC_DEFAULT_DEFAULT;
import static org.apache.avrorows.AvroRowProperties.UNION_AMBIGUITY_POLICY;
import static org.apache.avrorows.AvroRowProperties.UNION_AMBIGUITY_POLICY_DEFAULT;
import static org.apache.avrorows.AvroRowProperties.UNION_AMBIGUITY_POLICY_FAIL;
import static org.apache.avrorows.AvroRowProperties.UNION_AMBIGUITY_POLICY_FIRST_MATCH;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.Map;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.avrorows.data.Row;
import org.apache.avrorows.types.Type;
import org.apache.avrorows.types.Types;
import org.apache.avrorows.util.PropertyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts Avro generic records to rows.
 *
 * <p>A converter tree is built once for each schema and reused for every record of that schema.
 * Parsers are immutable and thread-safe; the only shared state is the cache of converters, keyed
 * by schema identity.
 *
 * <pre>
 *   AvroRowParser parser = AvroRowParser.builder()
 *       .set(AvroRowProperties.UNION_AMBIGUITY_POLICY, "fail")
 *       .build();
 *   Row row = parser.parse(record);
 * </pre>
 */
public class AvroRowParser {
  private static final Logger LOG = LoggerFactory.getLogger(AvroRowParser.class);

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a parser that uses the default configuration. */
  public static AvroRowParser create() {
    return builder().build();
  }

  private final int maxDepth;
  private final boolean adjustToUtcDefault;
  private final boolean failOnAmbiguity;
  private final Cache<Schema, CompiledSchema> compiled;

  private AvroRowParser(Map<String, String> properties) {
    this.maxDepth =
        PropertyUtil.propertyAsInt(properties, MAX_NESTING_DEPTH, MAX_NESTING_DEPTH_DEFAULT);
    Preconditions.checkArgument(
        maxDepth > 0, "Invalid value for %s: %s (must be positive)", MAX_NESTING_DEPTH, maxDepth);
    this.adjustToUtcDefault =
        PropertyUtil.propertyAsBoolean(
            properties, TIMESTAMP_ADJUST_TO_UTC_DEFAULT, TIMESTAMP_ADJUST_TO_UTC_DEFAULT_DEFAULT);
    String policy =
        PropertyUtil.propertyAsEnumString(
            properties,
            UNION_AMBIGUITY_POLICY,
            ImmutableSet.of(UNION_AMBIGUITY_POLICY_FIRST_MATCH, UNION_AMBIGUITY_POLICY_FAIL),
            UNION_AMBIGUITY_POLICY_DEFAULT);
    this.failOnAmbiguity = UNION_AMBIGUITY_POLICY_FAIL.equals(policy);

    boolean cacheEnabled =
        PropertyUtil.propertyAsBoolean(
            properties, CONVERTER_CACHE_ENABLED, CONVERTER_CACHE_ENABLED_DEFAULT);
    this.compiled = cacheEnabled ? Caffeine.newBuilder().weakKeys().build() : null;
  }

  /**
   * Converts a record using the record's own schema.
   *
   * @param record a generic record
   * @return a row with one value for each field of the record's schema
   */
  public Row parse(GenericRecord record) {
    Preconditions.checkNotNull(record, "Cannot parse null record");
    return parse(record.getSchema(), record);
  }

  /**
   * Converts a record using a record schema.
   *
   * <p>Fields are read from the record by name. A field that the record does not have is read as
   * null.
   *
   * @param schema a record schema
   * @param record a generic record
   * @return a row with one value for each field of the schema, in schema order
   * @throws org.apache.avrorows.exceptions.RowConversionException if the record does not match
   *     the schema
   */
  public Row parse(Schema schema, GenericRecord record) {
    checkRecordSchema(schema);
    Preconditions.checkNotNull(record, "Cannot parse null record");
    return (Row) compile(schema).converter().convert(record);
  }

  /**
   * Converts a single value of any schema.
   *
   * @param schema an Avro schema
   * @param value a value in Avro's generic object model
   * @return the converted value
   */
  public Object convert(Schema schema, Object value) {
    Preconditions.checkNotNull(schema, "Schema cannot be null");
    return compile(schema).converter().convert(value);
  }

  /** Returns the struct type of rows parsed with a record schema. */
  public Types.StructType rowType(Schema schema) {
    checkRecordSchema(schema);
    return compile(schema).type().asStructType();
  }

  /** Returns the columnar type of values converted with a schema. */
  public Type type(Schema schema) {
    Preconditions.checkNotNull(schema, "Schema cannot be null");
    return compile(schema).type();
  }

  private static void checkRecordSchema(Schema schema) {
    Preconditions.checkNotNull(schema, "Schema cannot be null");
    Preconditions.checkArgument(
        schema.getType() == Schema.Type.RECORD,
        "Cannot parse with a non-record schema: %s",
        schema);
  }

  private CompiledSchema compile(Schema schema) {
    if (compiled != null) {
      return compiled.get(schema, this::build);
    }

    return build(schema);
  }

  private CompiledSchema build(Schema schema) {
    Type type = AvroSchemaUtil.convert(schema, adjustToUtcDefault);
    ValueConverter<?> converter =
        BuildConverter.build(schema, type, maxDepth, adjustToUtcDefault, failOnAmbiguity);
    LOG.debug("Built converter for schema {}: {}", schemaName(schema), type);
    return new CompiledSchema(type, converter);
  }

  private static String schemaName(Schema schema) {
    switch (schema.getType()) {
      case RECORD:
      case ENUM:
      case FIXED:
        return schema.getFullName();
      default:
        return schema.getType().getName();
    }
  }

  private static class CompiledSchema {
    private final Type type;
    private final ValueConverter<?> converter;

    private CompiledSchema(Type type, ValueConverter<?> converter) {
      this.type = type;
      this.converter = converter;
    }

    Type type() {
      return type;
    }

    ValueConverter<?> converter() {
      return converter;
    }
  }

  public static class Builder {
    private final Map<String, String> properties = Maps.newHashMap();

    private Builder() {}

    public Builder set(String property, String value) {
      properties.put(property, value);
      return this;
    }

    public Builder setAll(Map<String, String> newProperties) {
      properties.putAll(newProperties);
      return this;
    }

    public AvroRowParser build() {
      return new AvroRowParser(properties);
    }
  }
}
