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

/**
 * Converts values of one Avro schema node to their columnar form.
 *
 * <p>Converters are immutable and may be shared between threads.
 *
 * @param <T> the Java class of converted values
 */
public interface ValueConverter<T> {
  /**
   * Converts a value read from Avro's generic object model.
   *
   * @param value a value of this converter's schema, or null
   * @return the converted value
   * @throws org.apache.avrorows.exceptions.RowConversionException if the value does not match
   *     the schema
   */
  T convert(Object value);
}
