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

import com.google.common.base.Preconditions;
import org.apache.avro.LogicalType;
import org.apache.avro.Schema;

/** Logical types that Avro's {@link org.apache.avro.LogicalTypes} does not provide. */
public class AvroLogicalTypes {
  public static final String DURATION = "duration";

  private AvroLogicalTypes() {}

  /**
   * Returns the {@code duration} logical type: a 12-byte fixed holding months, days and
   * milliseconds as little-endian unsigned ints.
   */
  public static Duration duration() {
    return Duration.INSTANCE;
  }

  public static class Duration extends LogicalType {
    public static final int SIZE = 12;
    private static final Duration INSTANCE = new Duration();

    private Duration() {
      super(DURATION);
    }

    @Override
    public void validate(Schema schema) {
      super.validate(schema);
      Preconditions.checkArgument(
          schema.getType() == Schema.Type.FIXED,
          "Invalid type for duration, must be a fixed: %s",
          schema);
      Preconditions.checkArgument(
          schema.getFixedSize() == SIZE,
          "Invalid fixed size for duration: %s (must be %s)",
          schema.getFixedSize(),
          SIZE);
    }
  }
}
