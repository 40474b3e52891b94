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

import com.google.common.collect.ImmutableMap;
import org.apache.avro.Schema;

/** Schemas shared by the conversion tests. */
class TestSchemas {

  private TestSchemas() {}

  private static Schema parse(String json) {
    return new Schema.Parser().parse(json);
  }

  static final Schema NATIVE_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"native\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"string\", \"type\": \"string\"},"
              + "{\"name\": \"float\", \"type\": \"float\"},"
              + "{\"name\": \"double\", \"type\": \"double\"},"
              + "{\"name\": \"int\", \"type\": \"int\"},"
              + "{\"name\": \"long\", \"type\": \"long\"},"
              + "{\"name\": \"boolean\", \"type\": \"boolean\"}]}");

  static final Schema NULLABLE_NATIVE_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"nullable_native\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"string\", \"type\": [\"null\", \"string\"], \"default\": null},"
              + "{\"name\": \"float\", \"type\": [\"null\", \"float\"], \"default\": null},"
              + "{\"name\": \"double\", \"type\": [\"null\", \"double\"], \"default\": null},"
              + "{\"name\": \"int\", \"type\": [\"null\", \"int\"], \"default\": null},"
              + "{\"name\": \"long\", \"type\": [\"null\", \"long\"], \"default\": null},"
              + "{\"name\": \"boolean\", \"type\": [\"null\", \"boolean\"], \"default\": null}]}");

  static final Schema COLLECTIONS_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"collections\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"array\", \"type\": {\"type\": \"array\", \"items\": \"string\"}},"
              + "{\"name\": \"map\", \"type\": {\"type\": \"map\","
              + " \"values\": {\"type\": \"array\", \"items\": \"long\"}}}]}");

  static final Schema BINARY_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"binary\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"bytes\", \"type\": \"bytes\"},"
              + "{\"name\": \"fixed\", \"type\": {\"type\": \"fixed\", \"name\": \"fixed16\","
              + " \"size\": 16}}]}");

  static final Schema LOGICAL_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"logical\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"decimal\", \"type\": {\"type\": \"bytes\","
              + " \"logicalType\": \"decimal\","
              + " \"precision\": 1, \"scale\": 0}},"
              + "{\"name\": \"fixed_decimal\", \"type\": {\"type\": \"fixed\","
              + " \"name\": \"dec_9_2\","
              + " \"size\": 4, \"logicalType\": \"decimal\", \"precision\": 9, \"scale\": 2}},"
              + "{\"name\": \"date\", \"type\": {\"type\": \"int\", \"logicalType\": \"date\"}},"
              + "{\"name\": \"time_millis\", \"type\": {\"type\": \"int\","
              + " \"logicalType\": \"time-millis\"}},"
              + "{\"name\": \"time_micros\", \"type\": {\"type\": \"long\","
              + " \"logicalType\": \"time-micros\"}},"
              + "{\"name\": \"timestamp_millis\", \"type\": {\"type\": \"long\","
              + " \"logicalType\": \"timestamp-millis\"}},"
              + "{\"name\": \"timestamp_micros\", \"type\": {\"type\": \"long\","
              + " \"logicalType\": \"timestamp-micros\"}},"
              + "{\"name\": \"local_timestamp_millis\", \"type\": {\"type\": \"long\","
              + " \"logicalType\": \"local-timestamp-millis\"}},"
              + "{\"name\": \"local_timestamp_micros\", \"type\": {\"type\": \"long\","
              + " \"logicalType\": \"local-timestamp-micros\"}},"
              + "{\"name\": \"duration\", \"type\": {\"type\": \"fixed\", \"name\": \"duration12\","
              + " \"size\": 12, \"logicalType\": \"duration\"}},"
              + "{\"name\": \"uuid\", \"type\": {\"type\": \"string\","
              + " \"logicalType\": \"uuid\"}}]}");

  static final Schema ENUM_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"card\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"suit\", \"type\": {\"type\": \"enum\", \"name\": \"Suit\","
              + " \"symbols\": [\"SPADES\", \"HEARTS\", \"DIAMONDS\", \"CLUBS\"]}}]}");

  /** A union whose float and double branches both accept ints and longs. */
  static final Schema NUMERIC_UNION_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"numeric_union\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"value\", \"type\": [\"null\", \"float\", \"double\", \"string\"],"
              + " \"default\": null}]}");

  static final Schema RECORD_UNION_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"record_union\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"shape\", \"type\": ["
              + "{\"type\": \"record\", \"name\": \"Point\", \"fields\": ["
              + "{\"name\": \"x\", \"type\": \"int\"}]},"
              + "{\"type\": \"record\", \"name\": \"Labeled\", \"fields\": ["
              + "{\"name\": \"x\", \"type\": \"int\"},"
              + "{\"name\": \"label\", \"type\": \"string\"}]}]}]}");

  /** A record that is not a branch of {@link #RECORD_UNION_SCHEMA} but has the fields of Point. */
  static final Schema OTHER_POINT_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"OtherPoint\", \"namespace\": \"other\","
              + " \"fields\": [{\"name\": \"x\", \"type\": \"int\"}]}");

  static final Schema STREET_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"Street\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"name\", \"type\": \"string\"},"
              + "{\"name\": \"zip\", \"type\": \"string\"}]}");

  static final Schema NEIGHBORHOOD_SCHEMA =
      new Schema.Parser()
          .addTypes(ImmutableMap.of(STREET_SCHEMA.getFullName(), STREET_SCHEMA))
          .parse(
              "{\"type\": \"record\", \"name\": \"Neighborhood\","
                  + " \"namespace\": \"all_types.test\","
                  + " \"fields\": ["
                  + "{\"name\": \"name\", \"type\": \"string\"},"
                  + "{\"name\": \"streets\", \"type\": {\"type\": \"array\","
                  + " \"items\": \"Street\"}}]}");

  static final Schema CITY_SCHEMA =
      new Schema.Parser()
          .addTypes(
              ImmutableMap.of(
                  NEIGHBORHOOD_SCHEMA.getFullName(), NEIGHBORHOOD_SCHEMA))
          .parse(
              "{\"type\": \"record\", \"name\": \"City\", \"namespace\": \"all_types.test\","
                  + " \"fields\": ["
                  + "{\"name\": \"name\", \"type\": \"string\"},"
                  + "{\"name\": \"neighborhoods\", \"type\": {\"type\": \"array\","
                  + " \"items\": \"Neighborhood\"}}]}");

  static final Schema STATE_SCHEMA =
      new Schema.Parser()
          .addTypes(ImmutableMap.of(CITY_SCHEMA.getFullName(), CITY_SCHEMA))
          .parse(
              "{\"type\": \"record\", \"name\": \"State\", \"namespace\": \"all_types.test\","
                  + " \"fields\": ["
                  + "{\"name\": \"name\", \"type\": \"string\"},"
                  + "{\"name\": \"regions\", \"type\": {\"type\": \"map\","
                  + " \"values\": {\"type\": \"array\", \"items\": \"City\"}}}]}");

  static final Schema RECURSIVE_SCHEMA =
      parse(
          "{\"type\": \"record\", \"name\": \"Node\", \"namespace\": \"all_types.test\","
              + " \"fields\": ["
              + "{\"name\": \"value\", \"type\": \"int\"},"
              + "{\"name\": \"next\", \"type\": [\"null\", \"Node\"], \"default\": null}]}");
}
