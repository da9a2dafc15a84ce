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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Declares one record field. Jagged fields may name the collection they belong to; fields of one
 * collection always have the same number of values per record.
 */
public class FieldSpec
{
  private final String name;
  private final FieldType type;
  private final String collection;

  @JsonCreator
  public FieldSpec(
      @JsonProperty("name") String name,
      @JsonProperty("type") FieldType type,
      @JsonProperty("collection") String collection
  )
  {
    this.name = Preconditions.checkNotNull(name, "field name should not be null");
    this.type = type == null ? FieldType.SCALAR : type;
    Preconditions.checkArgument(
        collection == null || this.type == FieldType.JAGGED,
        "scalar field [%s] cannot belong to collection [%s]", name, collection
    );
    this.collection = collection;
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @JsonProperty
  public FieldType getType()
  {
    return type;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getCollection()
  {
    return collection;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FieldSpec that = (FieldSpec) o;
    return name.equals(that.name) && type == that.type && Objects.equals(collection, that.collection);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, type, collection);
  }

  @Override
  public String toString()
  {
    return "FieldSpec{" +
           "name='" + name + '\'' +
           ", type=" + type +
           (collection == null ? "" : ", collection='" + collection + '\'') +
           '}';
  }
}
