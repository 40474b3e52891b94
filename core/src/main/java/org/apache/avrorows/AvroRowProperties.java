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
package org.apache.avrorows;

/** Configuration properties for converting Avro records to rows. */
public class AvroRowProperties {

  private AvroRowProperties() {}

  /**
   * How a value is matched to a union that has more than one non-null branch that accepts it.
   *
   * <p>{@code first-match} selects the first accepting branch in declaration order. {@code fail}
   * raises a schema mismatch when more than one branch accepts the value equally well.
   */
  public static final String UNION_AMBIGUITY_POLICY = "union.ambiguity-policy";

  public static final String UNION_AMBIGUITY_POLICY_FIRST_MATCH = "first-match";
  public static final String UNION_AMBIGUITY_POLICY_FAIL = "fail";
  public static final String UNION_AMBIGUITY_POLICY_DEFAULT = UNION_AMBIGUITY_POLICY_FIRST_MATCH;

  /** Maximum nesting of records, arrays and maps in a schema that can be converted. */
  public static final String MAX_NESTING_DEPTH = "schema.max-nesting-depth";

  public static final int MAX_NESTING_DEPTH_DEFAULT = 64;

  /**
   * Whether {@code timestamp-millis} and {@code timestamp-micros} values without an explicit
   * {@code adjust-to-utc} schema property are absolute instants.
   */
  public static final String TIMESTAMP_ADJUST_TO_UTC_DEFAULT = "timestamp.adjust-to-utc-default";

  public static final boolean TIMESTAMP_ADJUST_TO_UTC_DEFAULT_DEFAULT = true;

  /** Whether converters built for a schema are kept and reused for later records. */
  public static final String CONVERTER_CACHE_ENABLED = "converter-cache.enabled";

  public static final boolean CONVERTER_CACHE_ENABLED_DEFAULT = true;
}
