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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Columnar type of a converted Avro value.
 *
 * <p>Primitive types are identified by their type string, like {@code decimal(9, 2)}. Nested
 * types are made of {@link Types.NestedField fields} and are equal when their fields are.
 */
public interface Type extends Serializable {
  enum TypeID {
    NULL,
    BOOLEAN,
    INTEGER,
    LONG,
    FLOAT,
    DOUBLE,
    DATE,
    TIME,
    TIMESTAMP,
    STRING,
    UUID,
    FIXED,
    BINARY,
    DECIMAL,
    INTERVAL,
    STRUCT,
    LIST,
    MAP,
    UNION
  }

  TypeID typeId();

  default boolean isNestedType() {
    return false;
  }

  default boolean isUnionType() {
    return false;
  }

  default Types.StructType asStructType() {
    throw new IllegalArgumentException("Not a struct type: " + this);
  }

  default Types.ListType asListType() {
    throw new IllegalArgumentException("Not a list type: " + this);
  }

  default Types.MapType asMapType() {
    throw new IllegalArgumentException("Not a map type: " + this);
  }

  default Types.UnionType asUnionType() {
    throw new IllegalArgumentException("Not a union type: " + this);
  }

  abstract class PrimitiveType implements Type {
    private final TypeID typeId;
    private final String typeString;

    protected PrimitiveType(TypeID typeId, String typeString) {
      this.typeId = typeId;
      this.typeString = typeString;
    }

    @Override
    public TypeID typeId() {
      return typeId;
    }

    @Override
    public String toString() {
      return typeString;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      } else if (!(o instanceof PrimitiveType)) {
        return false;
      }

      PrimitiveType that = (PrimitiveType) o;
      return typeId == that.typeId && typeString.equals(that.typeString);
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeId, typeString);
    }
  }

  /** A type with child fields, looked up by position, id or name. */
  abstract class NestedType implements Type {
    private final Types.NestedField[] fields;

    // lazy values
    private transient List<Types.NestedField> fieldList = null;
    private transient Map<String, Types.NestedField> fieldsByName = null;

    protected NestedType(Types.NestedField... fields) {
      this.fields = fields.clone();
    }

    @Override
    public boolean isNestedType() {
      return true;
    }

    public List<Types.NestedField> fields() {
      if (fieldList == null) {
        this.fieldList = ImmutableList.copyOf(fields);
      }
      return fieldList;
    }

    /** Returns the field with a name, or null. */
    public Types.NestedField field(String name) {
      if (fieldsByName == null) {
        Map<String, Types.NestedField> byName = Maps.newHashMapWithExpectedSize(fields.length);
        for (Types.NestedField field : fields) {
          byName.put(field.name(), field);
        }
        this.fieldsByName = byName;
      }
      return fieldsByName.get(name);
    }

    /** Returns the field with an id, or null. */
    public Types.NestedField field(int id) {
      for (Types.NestedField field : fields) {
        if (field.fieldId() == id) {
          return field;
        }
      }
      return null;
    }

    public Type fieldType(String name) {
      Types.NestedField field = field(name);
      return field != null ? field.type() : null;
    }

    protected Types.NestedField fieldAt(int pos) {
      return fields[pos];
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      } else if (!(o instanceof NestedType)) {
        return false;
      }

      NestedType that = (NestedType) o;
      return typeId() == that.typeId() && Arrays.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeId(), Arrays.hashCode(fields));
    }
  }
}
