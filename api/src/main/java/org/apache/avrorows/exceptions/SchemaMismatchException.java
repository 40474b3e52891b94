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
package org.apache.avrorows.exceptions;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Exception raised when the runtime shape of a value does not match its declared schema.
 *
 * <p>For example, this is thrown when a string is found where the schema declares an int, or when
 * no branch of a union accepts a value.
 */
public class SchemaMismatchException extends RowConversionException {
  @FormatMethod
  public SchemaMismatchException(String message, Object... args) {
    super(message, args);
  }

  @FormatMethod
  public SchemaMismatchException(Throwable cause, String message, Object... args) {
    super(cause, message, args);
  }

  @FormatMethod
  public static void check(boolean test, String message, Object... args) {
    if (!test) {
      throw new SchemaMismatchException(message, args);
    }
  }
}
