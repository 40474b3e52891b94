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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;

/**
 * Base class for errors raised while converting an Avro value to its columnar form.
 *
 * <p>Every conversion error carries the path of the offending value from the root record: field
 * names, array indexes rendered as {@code [i]} and map keys rendered as {@code [key]}. Converters
 * for nested types add their own segment as the exception travels up, so the path is complete
 * when the exception leaves the parser.
 *
 * <p>Conversion errors indicate a contract violation between the schema and the data and are
 * never retried.
 */
public abstract class RowConversionException extends RuntimeException {
  private final String reason;
  private final Deque<String> path = new LinkedList<>();

  @FormatMethod
  protected RowConversionException(String message, Object... args) {
    super(String.format(message, args));
    this.reason = super.getMessage();
  }

  @FormatMethod
  protected RowConversionException(Throwable cause, String message, Object... args) {
    super(String.format(message, args), cause);
    this.reason = super.getMessage();
  }

  /**
   * Adds a field name to the front of this exception's path.
   *
   * @param fieldName name of the field that contains the failed value
   * @return this exception, for rethrowing
   */
  public RowConversionException inField(String fieldName) {
    path.addFirst(fieldName);
    return this;
  }

  /**
   * Adds an array index to the front of this exception's path.
   *
   * @param index position of the failed element
   * @return this exception, for rethrowing
   */
  public RowConversionException atIndex(int index) {
    path.addFirst("[" + index + "]");
    return this;
  }

  /**
   * Adds a map key to the front of this exception's path.
   *
   * @param key key of the failed map value
   * @return this exception, for rethrowing
   */
  public RowConversionException atKey(String key) {
    path.addFirst("[" + key + "]");
    return this;
  }

  /** Returns the path segments from the root record to the failed value. */
  public List<String> fieldPath() {
    return ImmutableList.copyOf(path);
  }

  /** Returns the path to the failed value, like {@code regions[cities][1].name}. */
  public String path() {
    StringBuilder sb = new StringBuilder();
    for (String segment : path) {
      if (sb.length() > 0 && !segment.startsWith("[")) {
        sb.append('.');
      }
      sb.append(segment);
    }
    return sb.toString();
  }

  /** Returns the error message without the path. */
  public String reason() {
    return reason;
  }

  @Override
  public String getMessage() {
    if (path.isEmpty()) {
      return reason;
    }

    return reason + " (at " + path() + ")";
  }
}
