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

package io.loki.query.histogram;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one output histogram: one to three axes, an optional selection and an optional
 * weight (1.0 when absent). Validation happens in {@link HistogramRegistry#register(HistogramDefinition)}.
 */
public class HistogramDefinition
{
  public static final int MAX_DIMENSIONALITY = 3;

  public static Builder builder()
  {
    return new Builder();
  }

  private final String name;
  private final Integer dimensionality;
  private final List<Axis> axes;
  private final String selection;
  private final String weight;

  @JsonCreator
  public HistogramDefinition(
      @JsonProperty("name") String name,
      @JsonProperty("dimensionality") Integer dimensionality,
      @JsonProperty("axes") List<Axis> axes,
      @JsonProperty("selection") String selection,
      @JsonProperty("weight") String weight
  )
  {
    this.name = name;
    this.dimensionality = dimensionality;
    this.axes = axes == null ? null : ImmutableList.copyOf(axes);
    this.selection = selection;
    this.weight = weight;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getName()
  {
    return name;
  }

  /**
   * declared dimensionality, the number of axes if not declared
   */
  @JsonProperty
  public int getDimensionality()
  {
    return dimensionality != null ? dimensionality : axes == null ? 0 : axes.size();
  }

  @JsonProperty
  public List<Axis> getAxes()
  {
    return axes;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getSelection()
  {
    return selection;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getWeight()
  {
    return weight;
  }

  /**
   * Name of the histogram in the output, the content hash when no name is given.
   */
  @JsonIgnore
  public String getIdentity()
  {
    return name != null ? name : contentHash();
  }

  public String contentHash()
  {
    final Hasher hasher = Hashing.md5().newHasher();
    for (int i = 0; i < MAX_DIMENSIONALITY; i++) {
      if (axes != null && i < axes.size()) {
        final Axis axis = axes.get(i);
        hasher.putString(String.valueOf(axis.getExpression()), Charsets.UTF_8);
        hasher.putString(Arrays.toString(axis.getEdges()), Charsets.UTF_8);
      } else {
        hasher.putString("None", Charsets.UTF_8);
      }
      hasher.putString("|", Charsets.UTF_8);
    }
    for (String expression : Arrays.asList(selection, weight)) {
      hasher.putString(expression == null ? "None" : expression, Charsets.UTF_8);
      hasher.putString("|", Charsets.UTF_8);
    }
    return hasher.hash().toString();
  }

  public HistogramDefinition withName(String name)
  {
    return new HistogramDefinition(name, dimensionality, axes, selection, weight);
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
    HistogramDefinition that = (HistogramDefinition) o;
    return Objects.equals(name, that.name)
           && getDimensionality() == that.getDimensionality()
           && Objects.equals(axes, that.axes)
           && Objects.equals(selection, that.selection)
           && Objects.equals(weight, that.weight);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, getDimensionality(), axes, selection, weight);
  }

  @Override
  public String toString()
  {
    return "HistogramDefinition{" +
           "name='" + getIdentity() + '\'' +
           ", axes=" + axes +
           (selection == null ? "" : ", selection='" + selection + '\'') +
           (weight == null ? "" : ", weight='" + weight + '\'') +
           '}';
  }

  public static class Builder
  {
    private String name;
    private Integer dimensionality;
    private final List<Axis> axes = Lists.newArrayList();
    private String selection;
    private String weight;

    public Builder name(String name)
    {
      this.name = name;
      return this;
    }

    public Builder dimensionality(int dimensionality)
    {
      this.dimensionality = dimensionality;
      return this;
    }

    public Builder axis(String expression, double... edges)
    {
      axes.add(new Axis(expression, edges));
      return this;
    }

    public Builder selection(String selection)
    {
      this.selection = selection;
      return this;
    }

    public Builder weight(String weight)
    {
      this.weight = weight;
      return this;
    }

    public HistogramDefinition build()
    {
      return new HistogramDefinition(name, dimensionality, axes, selection, weight);
    }
  }
}
