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
import com.google.common.collect.Lists;
import java.util.Deque;
import java.util.List;
import org.apache.avro.Schema;
import org.apache.avrorows.types.Type;
import org.apache.avrorows.types.Types;

/**
 * Visits an Avro schema together with a partner structure of the same shape.
 *
 * <p>Partners are matched to record fields by position and to union branches by their position
 * among the non-null branches.
 *
 * @param <P> partner type
 * @param <R> result type
 */
public class AvroWithPartnerVisitor<P, R> {
  public interface PartnerAccessors<P> {
    P fieldPartner(P partnerStruct, int pos, String name);

    P unionBranchPartner(P partnerUnion, Schema union, int branch);

    P mapValuePartner(P partnerMap);

    P listElementPartner(P partnerList);
  }

  /** Accessors for the columnar type produced by {@link AvroSchemaUtil#convert(Schema)}. */
  static class TypeAccessors implements PartnerAccessors<Type> {
    private static final TypeAccessors INSTANCE = new TypeAccessors();

    public static TypeAccessors get() {
      return INSTANCE;
    }

    @Override
    public Type fieldPartner(Type partner, int pos, String name) {
      Types.NestedField field = partner.asStructType().fields().get(pos);
      Preconditions.checkState(
          field.name().equals(name), "Field %s does not match type field %s", name, field);
      return field.type();
    }

    @Override
    public Type unionBranchPartner(Type partner, Schema union, int branch) {
      List<Schema> branches = union.getTypes();
      if (branches.get(branch).getType() == Schema.Type.NULL) {
        return Types.NullType.get();
      } else if (!partner.isUnionType()) {
        // options and single-branch unions have the type of their only non-null branch
        return partner;
      }

      int option = 0;
      for (int i = 0; i < branch; i += 1) {
        if (branches.get(i).getType() != Schema.Type.NULL) {
          option += 1;
        }
      }

      return partner.asUnionType().optionType(option);
    }

    @Override
    public Type mapValuePartner(Type partner) {
      return partner.asMapType().valueType();
    }

    @Override
    public Type listElementPartner(Type partner) {
      return partner.asListType().elementType();
    }
  }

  /** Accessors for visits without a partner structure. */
  private static class NoPartners implements PartnerAccessors<Void> {
    private static final NoPartners INSTANCE = new NoPartners();

    @Override
    public Void fieldPartner(Void partnerStruct, int pos, String name) {
      return null;
    }

    @Override
    public Void unionBranchPartner(Void partnerUnion, Schema union, int branch) {
      return null;
    }

    @Override
    public Void mapValuePartner(Void partnerMap) {
      return null;
    }

    @Override
    public Void listElementPartner(Void partnerList) {
      return null;
    }
  }

  /** Used to fail on recursive types. */
  private final Deque<String> recordLevels = Lists.newLinkedList();

  private final Deque<String> fieldNames = Lists.newLinkedList();

  /** Returns the names from the root to the node being visited; arrays and maps add a name. */
  protected Deque<String> fieldNames() {
    return fieldNames;
  }

  public R record(P partner, Schema record, List<R> fieldResults) {
    return null;
  }

  public R union(P partner, Schema union, List<R> optionResults) {
    return null;
  }

  public R array(P partner, Schema array, R elementResult) {
    return null;
  }

  public R map(P partner, Schema map, R valueResult) {
    return null;
  }

  public R primitive(P partner, Schema primitive) {
    return null;
  }

  /** Called before the children of a record, array or map are visited. */
  protected void beforeNested(P partner, Schema nested) {}

  /** Visits a schema on its own, with a null partner at every node. */
  public static <R> R visit(Schema schema, AvroWithPartnerVisitor<Void, R> visitor) {
    return visit(null, schema, visitor, NoPartners.INSTANCE);
  }

  public static <P, R> R visit(
      P partner,
      Schema schema,
      AvroWithPartnerVisitor<P, R> visitor,
      PartnerAccessors<P> accessors) {
    switch (schema.getType()) {
      case RECORD:
        return visitRecord(partner, schema, visitor, accessors);

      case UNION:
        return visitUnion(partner, schema, visitor, accessors);

      case ARRAY:
        visitor.beforeNested(partner, schema);
        return visitor.array(
            partner,
            schema,
            visitWithName(
                "element",
                partner != null ? accessors.listElementPartner(partner) : null,
                schema.getElementType(),
                visitor,
                accessors));

      case MAP:
        visitor.beforeNested(partner, schema);
        return visitor.map(
            partner,
            schema,
            visitWithName(
                "value",
                partner != null ? accessors.mapValuePartner(partner) : null,
                schema.getValueType(),
                visitor,
                accessors));

      default:
        return visitor.primitive(partner, schema);
    }
  }

  private static <P, R> R visitWithName(
      String name,
      P partner,
      Schema schema,
      AvroWithPartnerVisitor<P, R> visitor,
      PartnerAccessors<P> accessors) {
    try {
      visitor.fieldNames.addLast(name);
      return visit(partner, schema, visitor, accessors);
    } finally {
      visitor.fieldNames.removeLast();
    }
  }

  private static <P, R> R visitRecord(
      P partnerStruct,
      Schema record,
      AvroWithPartnerVisitor<P, R> visitor,
      PartnerAccessors<P> accessors) {
    // check to make sure this hasn't been visited before
    String recordName = record.getFullName();
    Preconditions.checkState(
        !visitor.recordLevels.contains(recordName),
        "Cannot process recursive Avro record %s",
        recordName);
    visitor.beforeNested(partnerStruct, record);
    visitor.recordLevels.push(recordName);

    List<Schema.Field> fields = record.getFields();
    List<R> results = Lists.newArrayListWithExpectedSize(fields.size());
    for (int pos = 0; pos < fields.size(); pos += 1) {
      Schema.Field field = fields.get(pos);
      P fieldPartner =
          partnerStruct != null ? accessors.fieldPartner(partnerStruct, pos, field.name()) : null;
      results.add(visitWithName(field.name(), fieldPartner, field.schema(), visitor, accessors));
    }

    visitor.recordLevels.pop();

    return visitor.record(partnerStruct, record, results);
  }

  private static <P, R> R visitUnion(
      P partner,
      Schema union,
      AvroWithPartnerVisitor<P, R> visitor,
      PartnerAccessors<P> accessors) {
    List<Schema> types = union.getTypes();
    List<R> options = Lists.newArrayListWithExpectedSize(types.size());
    for (int branch = 0; branch < types.size(); branch += 1) {
      P branchPartner =
          partner != null ? accessors.unionBranchPartner(partner, union, branch) : null;
      options.add(visit(branchPartner, types.get(branch), visitor, accessors));
    }

    return visitor.union(partner, union, options);
  }
}
