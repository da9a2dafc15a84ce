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

import com.google.common.collect.ImmutableList;
import io.loki.query.expression.ExpressionHandle;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A validated definition bound to the expression handles of one pool.
 */
public class RegisteredHistogram
{
  private final int index;
  private final String name;
  private final HistogramDefinition definition;
  private final List<ExpressionHandle> axes;
  private final ExpressionHandle selection;
  private final ExpressionHandle weight;

  RegisteredHistogram(
      int index,
      String name,
      HistogramDefinition definition,
      List<ExpressionHandle> axes,
      @Nullable ExpressionHandle selection,
      @Nullable ExpressionHandle weight
  )
  {
    this.index = index;
    this.name = name;
    this.definition = definition;
    this.axes = ImmutableList.copyOf(axes);
    this.selection = selection;
    this.weight = weight;
  }

  public int getIndex()
  {
    return index;
  }

  public String getName()
  {
    return name;
  }

  public HistogramDefinition getDefinition()
  {
    return definition;
  }

  public List<ExpressionHandle> getAxes()
  {
    return axes;
  }

  @Nullable
  public ExpressionHandle getSelection()
  {
    return selection;
  }

  @Nullable
  public ExpressionHandle getWeight()
  {
    return weight;
  }

  /**
   * axes, selection and weight, in that order
   */
  public List<ExpressionHandle> getHandles()
  {
    final ImmutableList.Builder<ExpressionHandle> builder = ImmutableList.builder();
    builder.addAll(axes);
    if (selection != null) {
      builder.add(selection);
    }
    if (weight != null) {
      builder.add(weight);
    }
    return builder.build();
  }

  public Histogram newHistogram()
  {
    final List<Axis> axisList = definition.getAxes();
    final double[][] edges = new double[axisList.size()][];
    for (int i = 0; i < edges.length; i++) {
      edges[i] = axisList.get(i).getEdges();
    }
    return new Histogram(name, edges);
  }

  @Override
  public String toString()
  {
    return name + getHandles();
  }
}
