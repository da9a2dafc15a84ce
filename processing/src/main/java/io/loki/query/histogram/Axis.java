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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * One axis of a histogram: the expression filled along it and its bin edges.
 * <p>
 * For {@code n} regular bins (n + 1 edges) bin 0 is the underflow, bins 1..n cover {@code [edge[i-1], edge[i])}
 * and bin n + 1 is the overflow.
 */
public class Axis
{
  private final String expression;
  private final double[] edges;

  @JsonCreator
  public Axis(
      @JsonProperty("expression") String expression,
      @JsonProperty("edges") double[] edges
  )
  {
    this.expression = expression;
    this.edges = edges == null ? null : edges.clone();
  }

  @JsonProperty
  public String getExpression()
  {
    return expression;
  }

  @JsonProperty
  public double[] getEdges()
  {
    return edges == null ? null : edges.clone();
  }

  @JsonIgnore
  public int getNumBins()
  {
    return edges.length - 1;
  }

  /**
   * number of bins including underflow and overflow
   */
  @JsonIgnore
  public int getNumCells()
  {
    return edges.length + 1;
  }

  /**
   * Returns the bin holding the value. NaN is counted as overflow.
   */
  public int locate(double value)
  {
    return locate(edges, value);
  }

  static int locate(double[] edges, double value)
  {
    if (Double.isNaN(value)) {
      return edges.length;
    }
    // binarySearch orders -0.0 below 0.0
    final int index = Arrays.binarySearch(edges, value == 0.0 ? 0.0 : value);
    // exact hit on an edge lands in the bin it opens
    return index >= 0 ? index + 1 : -index - 1;
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
    Axis axis = (Axis) o;
    return Objects.equals(expression, axis.expression) && Arrays.equals(edges, axis.edges);
  }

  @Override
  public int hashCode()
  {
    return 31 * Objects.hashCode(expression) + Arrays.hashCode(edges);
  }

  @Override
  public String toString()
  {
    return expression + Arrays.toString(edges);
  }
}
