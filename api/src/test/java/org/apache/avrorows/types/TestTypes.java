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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

public class TestTypes {

  @Test
  public void testDecimalPreconditions() {
    assertThatThrownBy(() -> Types.DecimalType.of(0, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid decimal precision: 0 (must be positive)");

    assertThatThrownBy(() -> Types.DecimalType.of(2, 3))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid decimal scale: 3 (must be between 0 and precision 2)");
  }

  @Test
  public void testNestedTypeStrings() {
    assertThat(Types.ListType.ofRequired(1, Types.LongType.get())).hasToString("list<long>");
    assertThat(
            Types.MapType.ofOptional(2, 3, Types.StringType.get(), Types.DecimalType.of(9, 2)))
        .hasToString("map<string, decimal(9, 2)>");
    assertThat(Types.FixedType.ofLength(12)).hasToString("fixed[12]");
  }

  @Test
  public void testUnionType() {
    Types.UnionType union =
        Types.UnionType.of(
            ImmutableList.of(
                Types.NestedField.optional(1, "option0", Types.IntegerType.get()),
                Types.NestedField.optional(2, "option1", Types.StringType.get())));

    assertThat(union.isUnionType()).isTrue();
    assertThat(union.isNestedType()).isTrue();
    assertThat(union.typeId()).isEqualTo(Type.TypeID.UNION);
    assertThat(union.optionTypes())
        .containsExactly(Types.IntegerType.get(), Types.StringType.get());
    assertThat(union.optionType(1)).isEqualTo(Types.StringType.get());
    assertThat(union.fieldType("option0")).isEqualTo(Types.IntegerType.get());
    assertThat(union.field(2).name()).isEqualTo("option1");
    assertThat(union).hasToString("union<int, string>");
  }

  @Test
  public void testUnionTypeRequiresTwoOptions() {
    assertThatThrownBy(
            () ->
                Types.UnionType.of(
                    ImmutableList.of(
                        Types.NestedField.optional(1, "option0", Types.IntegerType.get()))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Cannot create a union with fewer than 2 options");
  }

  @Test
  public void testStructLookup() {
    Types.StructType struct =
        Types.StructType.of(
            Types.NestedField.required(0, "id", Types.LongType.get()),
            Types.NestedField.optional(1, "data", Types.NullType.get()));

    assertThat(struct.fieldType("id")).isEqualTo(Types.LongType.get());
    assertThat(struct.field("data").isOptional()).isTrue();
    assertThat(struct.field(1).type().typeId()).isEqualTo(Type.TypeID.NULL);
    assertThat(struct.field("missing")).isNull();
  }

  @Test
  public void testPrimitiveParameters() {
    assertThat(Types.FixedType.ofLength(16).length()).isEqualTo(16);
    assertThat(Types.DecimalType.of(9, 2).precision()).isEqualTo(9);
    assertThat(Types.DecimalType.of(9, 2).scale()).isEqualTo(2);
    assertThat(Types.TimestampType.withZone().shouldAdjustToUTC()).isTrue();
    assertThat(Types.TimestampType.withoutZone().shouldAdjustToUTC()).isFalse();
    assertThat(Types.DecimalType.of(9, 2)).isNotEqualTo(Types.DecimalType.of(9, 3));
    assertThat(Types.FixedType.ofLength(4)).isEqualTo(Types.FixedType.ofLength(4));
  }

  @Test
  public void testNestedEqualityIncludesKind() {
    ImmutableList<Types.NestedField> fields =
        ImmutableList.of(
            Types.NestedField.optional(1, "option0", Types.IntegerType.get()),
            Types.NestedField.optional(2, "option1", Types.StringType.get()));

    assertThat(Types.StructType.of(fields)).isEqualTo(Types.StructType.of(fields));
    assertThat((Type) Types.StructType.of(fields)).isNotEqualTo(Types.UnionType.of(fields));
    assertThat(Types.ListType.ofOptional(1, Types.LongType.get()))
        .isNotEqualTo(Types.ListType.ofRequired(1, Types.LongType.get()));
  }

  @Test
  public void testNestedFieldRequiresName() {
    assertThatThrownBy(() -> Types.NestedField.required(1, null, Types.LongType.get()))
        .isInstanceOf(NullPointerException.class);
  }
}
