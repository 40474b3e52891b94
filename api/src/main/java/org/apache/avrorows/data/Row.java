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

import org.apache.avrorows.StructLike;
import org.apache.avrorows.types.Types.StructType;

/**
 * A decoded row of columnar values.
 *
 * <p>Values are ordered like the fields of {@link #struct()} and can also be addressed by field
 * name. Nested records are rows, arrays are lists and maps are maps with string keys.
 */
public interface Row extends StructLike {
  StructType struct();

  /**
   * Returns the value of a field by name, or null if the row has no such field.
   *
   * @param name a field name
   * @return the field's value or null
   */
  Object getField(String name);

  Object get(int pos);

  /**
   * Returns the value of a field by name, cast to the caller's expected type.
   *
   * @param name a field name
   * @param <T> expected Java type of the value
   * @return the field's value
   * @throws IllegalArgumentException if the row has no field with the given name
   */
  <T> T getAs(String name);
}
