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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import io.loki.common.MergeShapeMismatchException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Final or partial result of a run: every histogram by name, with the summary of processed records.
 */
public class HistogramSet
{
  private final Map<String, Histogram> histograms;
  private final ProcessingSummary summary;

  @JsonCreator
  public HistogramSet(
      @JsonProperty("histograms") Map<String, Histogram> histograms,
      @JsonProperty("summary") ProcessingSummary summary
  )
  {
    this.histograms = histograms == null ? Maps.<String, Histogram>newLinkedHashMap() : histograms;
    this.summary = summary == null ? ProcessingSummary.EMPTY : summary;
  }

  @JsonProperty
  public Map<String, Histogram> getHistograms()
  {
    return Collections.unmodifiableMap(histograms);
  }

  @JsonProperty
  public ProcessingSummary getSummary()
  {
    return summary;
  }

  public Histogram get(String name)
  {
    return histograms.get(name);
  }

  public int size()
  {
    return histograms.size();
  }

  /**
   * Multiplies the weights of every histogram. Entry counts are unchanged.
   */
  public HistogramSet scale(double factor)
  {
    for (Histogram histogram : histograms.values()) {
      histogram.scale(factor);
    }
    return this;
  }

  /**
   * Combines two sets into a new one, leaving both untouched. Associative and commutative.
   *
   * @throws MergeShapeMismatchException if the sets hold different histograms or binnings
   */
  public static HistogramSet merge(HistogramSet lhs, HistogramSet rhs)
  {
    if (!lhs.histograms.keySet().equals(rhs.histograms.keySet())) {
      throw new MergeShapeMismatchException(
          "cannot merge histogram sets, %s only in one side",
          Sets.symmetricDifference(lhs.histograms.keySet(), rhs.histograms.keySet())
      );
    }
    final Map<String, Histogram> merged = Maps.newLinkedHashMap();
    for (Map.Entry<String, Histogram> entry : lhs.histograms.entrySet()) {
      merged.put(entry.getKey(), entry.getValue().copy().add(rhs.histograms.get(entry.getKey())));
    }
    return new HistogramSet(merged, lhs.summary.merge(rhs.summary));
  }

  /**
   * Pairwise reduction of partial results.
   */
  public static HistogramSet mergeAll(List<HistogramSet> sets)
  {
    if (sets.isEmpty()) {
      throw new IllegalArgumentException("nothing to merge");
    }
    List<HistogramSet> current = sets;
    while (current.size() > 1) {
      final List<HistogramSet> next = Lists.newArrayListWithCapacity((current.size() + 1) / 2);
      for (int i = 0; i < current.size(); i += 2) {
        next.add(i + 1 < current.size() ? merge(current.get(i), current.get(i + 1)) : current.get(i));
      }
      current = next;
    }
    return current.get(0);
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
    HistogramSet that = (HistogramSet) o;
    return histograms.equals(that.histograms) && summary.equals(that.summary);
  }

  @Override
  public int hashCode()
  {
    return 31 * histograms.hashCode() + summary.hashCode();
  }

  @Override
  public String toString()
  {
    return "HistogramSet{" + histograms.keySet() + ", " + summary + '}';
  }
}
