/*
 * Licensed to SK Telecom Co., LTD. (SK Telecom) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  SK Telecom licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
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

package io.loki.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Names the fields a record exposes and whether each of them is scalar or jagged.
 */
public class Schema implements TypeResolver
{
  public static Builder builder()
  {
    return new Builder();
  }

  private final List<FieldSpec> fields;
  private final Map<String, FieldSpec> index;

  @JsonCreator
  public Schema(@JsonProperty("fields") List<FieldSpec> fields)
  {
    this.fields = fields == null ? ImmutableList.<FieldSpec>of() : ImmutableList.copyOf(fields);
    this.index = Maps.newLinkedHashMap();
    for (FieldSpec field : this.fields) {
      Preconditions.checkArgument(
          index.put(field.getName(), field) == null, "duplicated field [%s] in schema", field.getName()
      );
    }
  }

  @JsonProperty
  public List<FieldSpec> getFields()
  {
    return fields;
  }

  public FieldSpec getField(String name)
  {
    return index.get(name);
  }

  public boolean contains(String name)
  {
    return index.containsKey(name);
  }

  @Override
  public FieldType resolve(String field)
  {
    final FieldSpec spec = index.get(field);
    return spec == null ? null : spec.getType();
  }

  public String collectionOf(String field)
  {
    final FieldSpec spec = index.get(field);
    return spec == null ? null : spec.getCollection();
  }

  @Override
  public boolean equals(Object o)
  {
    return o instanceof Schema && fields.equals(((Schema) o).fields);
  }

  @Override
  public int hashCode()
  {
    return fields.hashCode();
  }

  @Override
  public String toString()
  {
    return "Schema" + fields;
  }

  public static class Builder
  {
    private final List<FieldSpec> fields = Lists.newArrayList();

    public Builder scalar(String name)
    {
      fields.add(new FieldSpec(name, FieldType.SCALAR, null));
      return this;
    }

    public Builder jagged(String name)
    {
      return jagged(name, null);
    }

    public Builder jagged(String name, String collection)
    {
      fields.add(new FieldSpec(name, FieldType.JAGGED, collection));
      return this;
    }

    public Schema build()
    {
      return new Schema(fields);
    }
  }
}
