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
import com.google.common.base.Preconditions;
import io.loki.common.MergeShapeMismatchException;

import java.util.Arrays;

/**
 * Binned state of one histogram. Cells are flattened with the first axis varying fastest and every axis
 * carrying its underflow (index 0) and overflow (index n + 1) bins. Each cell keeps the sum of weights,
 * the sum of squared weights and the number of entries.
 * <p>
 * Mutable while owned by one worker. Merging is cell-wise addition.
 */
public class Histogram
{
  private final String name;
  private final double[][] edges;
  private final int[] strides;
  private final double[] sumW;
  private final double[] sumW2;
  private final long[] entries;

  public Histogram(String name, double[][] edges)
  {
    this(name, edges, null, null, null);
  }

  @JsonCreator
  public Histogram(
      @JsonProperty("name") String name,
      @JsonProperty("edges") double[][] edges,
      @JsonProperty("sumW") double[] sumW,
      @JsonProperty("sumW2") double[] sumW2,
      @JsonProperty("entries") long[] entries
  )
  {
    Preconditions.checkArgument(edges != null && edges.length > 0, "histogram [%s] without axis", name);
    this.name = name;
    this.edges = edges;
    this.strides = new int[edges.length];
    int cells = 1;
    for (int i = 0; i < edges.length; i++) {
      strides[i] = cells;
      cells *= edges[i].length + 1;
    }
    this.sumW = sumW == null ? new double[cells] : checkLength(sumW, cells);
    this.sumW2 = sumW2 == null ? new double[cells] : checkLength(sumW2, cells);
    this.entries = entries == null ? new long[cells] : checkLength(entries, cells);
  }

  private double[] checkLength(double[] array, int cells)
  {
    checkLength(array.length, cells);
    return array;
  }

  private long[] checkLength(long[] array, int cells)
  {
    checkLength(array.length, cells);
    return array;
  }

  private void checkLength(int length, int cells)
  {
    Preconditions.checkArgument(length == cells, "histogram [%s] needs %s cells but %s given", name, cells, length);
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @JsonProperty
  public double[][] getEdges()
  {
    return edges;
  }

  @JsonProperty
  public double[] getSumW()
  {
    return sumW;
  }

  @JsonProperty
  public double[] getSumW2()
  {
    return sumW2;
  }

  @JsonProperty
  public long[] getEntries()
  {
    return entries;
  }

  @JsonIgnore
  public int getDimensionality()
  {
    return edges.length;
  }

  /**
   * number of regular bins on the axis
   */
  public int getNumBins(int axis)
  {
    return edges[axis].length - 1;
  }

  @JsonIgnore
  public int getNumCells()
  {
    return sumW.length;
  }

  /**
   * Flattened index of a cell given one bin index per axis, counting underflow as 0.
   */
  public int cell(int... bins)
  {
    Preconditions.checkArgument(bins.length == edges.length, "expected %s bin indices", edges.length);
    int cell = 0;
    for (int i = 0; i < bins.length; i++) {
      Preconditions.checkElementIndex(bins[i], edges[i].length + 1, "bin");
      cell += bins[i] * strides[i];
    }
    return cell;
  }

  /**
   * Flattened index of the cell holding the values, one per axis.
   */
  public int locate(double... values)
  {
    int cell = 0;
    for (int i = 0; i < edges.length; i++) {
      cell += Axis.locate(edges[i], values[i]) * strides[i];
    }
    return cell;
  }

  public void fill(int cell, double weight)
  {
    sumW[cell] += weight;
    sumW2[cell] += weight * weight;
    entries[cell]++;
  }

  public double getSumW(int... bins)
  {
    return sumW[cell(bins)];
  }

  public double getSumW2(int... bins)
  {
    return sumW2[cell(bins)];
  }

  public long getEntries(int... bins)
  {
    return entries[cell(bins)];
  }

  public double getError(int... bins)
  {
    return Math.sqrt(getSumW2(bins));
  }

  /**
   * entries of every cell, underflow and overflow included
   */
  @JsonIgnore
  public long getTotalEntries()
  {
    long total = 0;
    for (long entry : entries) {
      total += entry;
    }
    return total;
  }

  /**
   * sum of weights over regular bins only
   */
  @JsonIgnore
  public double getIntegral()
  {
    double integral = 0;
    for (int cell = 0; cell < sumW.length; cell++) {
      if (isRegular(cell)) {
        integral += sumW[cell];
      }
    }
    return integral;
  }

  private boolean isRegular(int cell)
  {
    for (int i = edges.length - 1; i >= 0; i--) {
      final int bin = cell / strides[i];
      if (bin == 0 || bin == edges[i].length) {
        return false;
      }
      cell %= strides[i];
    }
    return true;
  }

  /**
   * Multiplies weights by the factor. Entry counts are left unchanged.
   */
  public Histogram scale(double factor)
  {
    for (int i = 0; i < sumW.length; i++) {
      sumW[i] *= factor;
      sumW2[i] *= factor * factor;
    }
    return this;
  }

  /**
   * Adds the cells of the other histogram into this one.
   *
   * @throws MergeShapeMismatchException if names or binning differ
   */
  public Histogram add(Histogram other)
  {
    checkSameShape(other);
    for (int i = 0; i < sumW.length; i++) {
      sumW[i] += other.sumW[i];
      sumW2[i] += other.sumW2[i];
      entries[i] += other.entries[i];
    }
    return this;
  }

  public Histogram copy()
  {
    final double[][] copied = new double[edges.length][];
    for (int i = 0; i < edges.length; i++) {
      copied[i] = edges[i].clone();
    }
    return new Histogram(name, copied, sumW.clone(), sumW2.clone(), entries.clone());
  }

  public boolean isSameShape(Histogram other)
  {
    return name.equals(other.name) && Arrays.deepEquals(edges, other.edges);
  }

  private void checkSameShape(Histogram other)
  {
    if (!isSameShape(other)) {
      throw new MergeShapeMismatchException(
          "cannot merge histogram [%s] with %s into [%s] with %s",
          other.name, describe(other.edges), name, describe(edges)
      );
    }
  }

  private static String describe(double[][] edges)
  {
    final StringBuilder builder = new StringBuilder();
    for (double[] axis : edges) {
      builder.append(Arrays.toString(axis));
    }
    return builder.toString();
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
    Histogram that = (Histogram) o;
    return isSameShape(that)
           && Arrays.equals(sumW, that.sumW)
           && Arrays.equals(sumW2, that.sumW2)
           && Arrays.equals(entries, that.entries);
  }

  @Override
  public int hashCode()
  {
    return 31 * name.hashCode() + Arrays.hashCode(entries);
  }

  @Override
  public String toString()
  {
    return "Histogram{" +
           "name='" + name + '\'' +
           ", edges=" + describe(edges) +
           ", entries=" + getTotalEntries() +
           ", integral=" + getIntegral() +
           '}';
  }
}
