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
package org.apache.avrorows.data;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.avrorows.types.Types;
import org.apache.avrorows.types.Types.StructType;

/**
 * Immutable {@link Row} backed by an array of converted values.
 *
 * <p>Rows are created fully populated by the parser and are never modified afterwards.
 */
public class GenericRow implements Row {
  private static final LoadingCache<StructType, Map<String, Integer>> NAME_MAP_CACHE =
      Caffeine.newBuilder()
          .weakKeys()
          .build(
              struct -> {
                Map<String, Integer> nameToPos = Maps.newHashMap();
                List<Types.NestedField> fields = struct.fields();
                for (int i = 0; i < fields.size(); i += 1) {
                  nameToPos.put(fields.get(i).name(), i);
                }
                return nameToPos;
              });

  /**
   * Creates a row from values in field order.
   *
   * <p>The array is owned by the row after this call and must not be modified by the caller.
   *
   * @param struct the row's struct type
   * @param values converted values, one for each field of the struct
   * @return a row
   */
  public static GenericRow of(StructType struct, Object[] values) {
    return new GenericRow(struct, values);
  }

  private final StructType struct;
  private final Object[] values;
  private final Map<String, Integer> nameToPos;

  private GenericRow(StructType struct, Object[] values) {
    Preconditions.checkNotNull(struct, "Struct type cannot be null");
    Preconditions.checkNotNull(values, "Values cannot be null");
    Preconditions.checkArgument(
        struct.fields().size() == values.length,
        "Cannot create row: %s values for %s fields",
        values.length,
        struct.fields().size());
    this.struct = struct;
    this.values = values;
    this.nameToPos = NAME_MAP_CACHE.get(struct);
  }

  @Override
  public StructType struct() {
    return struct;
  }

  @Override
  public Object getField(String name) {
    Integer pos = nameToPos.get(name);
    if (pos != null) {
      return values[pos];
    }

    return null;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getAs(String name) {
    Integer pos = nameToPos.get(name);
    Preconditions.checkArgument(pos != null, "Cannot find field named: %s", name);
    return (T) values[pos];
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public Object get(int pos) {
    return values[pos];
  }

  @Override
  public <T> T get(int pos, Class<T> javaClass) {
    Object value = get(pos);
    if (value == null || javaClass.isInstance(value)) {
      return javaClass.cast(value);
    } else {
      throw new IllegalStateException("Not an instance of " + javaClass.getName() + ": " + value);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Row(");
    for (int i = 0; i < values.length; i += 1) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(values[i]);
    }
    sb.append(")");
    return sb.toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof GenericRow)) {
      return false;
    }

    GenericRow that = (GenericRow) other;
    return struct.equals(that.struct) && Arrays.deepEquals(this.values, that.values);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(values);
  }
}
