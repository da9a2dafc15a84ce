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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * What happened to the records of a run, so that records dropped on errors are always accounted for.
 */
public class ProcessingSummary
{
  public static final ProcessingSummary EMPTY = new ProcessingSummary(0, 0, 0, null, false);

  private final long recordsProcessed;
  private final long cardinalitySkipped;
  private final long evaluationSkipped;
  private final Map<String, Long> skippedPerHistogram;
  private final boolean cancelled;

  @JsonCreator
  public ProcessingSummary(
      @JsonProperty("recordsProcessed") long recordsProcessed,
      @JsonProperty("cardinalitySkipped") long cardinalitySkipped,
      @JsonProperty("evaluationSkipped") long evaluationSkipped,
      @JsonProperty("skippedPerHistogram") Map<String, Long> skippedPerHistogram,
      @JsonProperty("cancelled") boolean cancelled
  )
  {
    this.recordsProcessed = recordsProcessed;
    this.cardinalitySkipped = cardinalitySkipped;
    this.evaluationSkipped = evaluationSkipped;
    this.skippedPerHistogram = skippedPerHistogram == null
                               ? ImmutableMap.<String, Long>of()
                               : ImmutableMap.copyOf(new TreeMap<>(skippedPerHistogram));
    this.cancelled = cancelled;
  }

  @JsonProperty
  public long getRecordsProcessed()
  {
    return recordsProcessed;
  }

  /**
   * records which lost the contribution to at least one histogram on a cardinality mismatch
   */
  @JsonProperty
  public long getCardinalitySkipped()
  {
    return cardinalitySkipped;
  }

  /**
   * records which lost the contribution to at least one histogram on an evaluation error
   */
  @JsonProperty
  public long getEvaluationSkipped()
  {
    return evaluationSkipped;
  }

  @JsonProperty
  public Map<String, Long> getSkippedPerHistogram()
  {
    return skippedPerHistogram;
  }

  public long getSkipped(String histogram)
  {
    final Long skipped = skippedPerHistogram.get(histogram);
    return skipped == null ? 0 : skipped;
  }

  @JsonProperty
  public boolean isCancelled()
  {
    return cancelled;
  }

  public ProcessingSummary merge(ProcessingSummary other)
  {
    final Map<String, Long> skipped = Maps.newHashMap(skippedPerHistogram);
    for (Map.Entry<String, Long> entry : other.skippedPerHistogram.entrySet()) {
      final Long prev = skipped.get(entry.getKey());
      skipped.put(entry.getKey(), prev == null ? entry.getValue() : prev + entry.getValue());
    }
    return new ProcessingSummary(
        recordsProcessed + other.recordsProcessed,
        cardinalitySkipped + other.cardinalitySkipped,
        evaluationSkipped + other.evaluationSkipped,
        skipped,
        cancelled || other.cancelled
    );
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
    ProcessingSummary that = (ProcessingSummary) o;
    return recordsProcessed == that.recordsProcessed &&
           cardinalitySkipped == that.cardinalitySkipped &&
           evaluationSkipped == that.evaluationSkipped &&
           cancelled == that.cancelled &&
           skippedPerHistogram.equals(that.skippedPerHistogram);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(recordsProcessed, cardinalitySkipped, evaluationSkipped, skippedPerHistogram, cancelled);
  }

  @Override
  public String toString()
  {
    final StringBuilder builder = new StringBuilder()
        .append("processed ").append(recordsProcessed).append(" records, skipped ")
        .append(cardinalitySkipped).append(" due to cardinality errors");
    if (evaluationSkipped > 0) {
      builder.append(" and ").append(evaluationSkipped).append(" due to evaluation errors");
    }
    if (cancelled) {
      builder.append(" (cancelled)");
    }
    return builder.toString();
  }
}
