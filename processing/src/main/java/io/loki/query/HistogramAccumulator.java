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

package io.loki.query;

import com.google.common.collect.Maps;
import com.metamx.common.logger.Logger;
import io.loki.common.CardinalityMismatchException;
import io.loki.common.LokiException;
import io.loki.data.Record;
import io.loki.math.expr.Evals;
import io.loki.query.expression.ExpressionHandle;
import io.loki.query.histogram.Histogram;
import io.loki.query.histogram.HistogramDefinition;
import io.loki.query.histogram.HistogramRegistry;
import io.loki.query.histogram.HistogramSet;
import io.loki.query.histogram.ProcessingSummary;
import io.loki.query.histogram.RegisteredHistogram;
import io.loki.query.sync.RecordEvaluation;
import io.loki.query.sync.SyncPlan;
import io.loki.query.sync.SyncPlanner;

import java.util.List;
import java.util.Map;

/**
 * Fills the histograms of one partition record by record. A failure while evaluating the expressions of a
 * histogram drops the contribution of that record to that histogram only and is counted.
 * <p>
 * Owned by a single worker.
 */
public class HistogramAccumulator
{
  private static final Logger log = new Logger(HistogramAccumulator.class);

  private final List<RegisteredHistogram> histograms;
  private final RecordEvaluation evaluation;
  private final Histogram[] states;
  private final long[] skipped;
  private final double[] point;

  private long processed;
  private long cardinalitySkipped;
  private long evaluationSkipped;

  public HistogramAccumulator(HistogramRegistry registry)
  {
    this(registry, SyncPlanner.plan(registry));
  }

  public HistogramAccumulator(HistogramRegistry registry, SyncPlan plan)
  {
    this.histograms = registry.getHistograms();
    this.evaluation = new RecordEvaluation(registry.getPool(), plan);
    this.states = new Histogram[histograms.size()];
    this.skipped = new long[histograms.size()];
    for (RegisteredHistogram histogram : histograms) {
      states[histogram.getIndex()] = histogram.newHistogram();
    }
    this.point = new double[HistogramDefinition.MAX_DIMENSIONALITY];
  }

  public void add(Record record)
  {
    evaluation.evaluate(record);
    boolean cardinalityFailure = false;
    boolean evaluationFailure = false;
    for (RegisteredHistogram histogram : histograms) {
      final LokiException failure = evaluation.failureOf(histogram);
      if (failure == null) {
        fill(histogram);
        continue;
      }
      skipped[histogram.getIndex()]++;
      if (failure instanceof CardinalityMismatchException) {
        cardinalityFailure = true;
      } else {
        evaluationFailure = true;
      }
      log.debug("record %d skipped for histogram [%s]: %s", processed, histogram.getName(), failure.getMessage());
    }
    if (cardinalityFailure) {
      cardinalitySkipped++;
    }
    if (evaluationFailure) {
      evaluationSkipped++;
    }
    processed++;
  }

  private void fill(RegisteredHistogram histogram)
  {
    final Histogram state = states[histogram.getIndex()];
    final List<ExpressionHandle> axes = histogram.getAxes();
    final ExpressionHandle selection = histogram.getSelection();
    final ExpressionHandle weight = histogram.getWeight();
    final int size = evaluation.size(histogram);
    for (int slot = 0; slot < size; slot++) {
      if (selection != null && !Evals.asBoolean(evaluation.get(selection, slot))) {
        continue;
      }
      for (int i = 0; i < axes.size(); i++) {
        point[i] = evaluation.get(axes.get(i), slot);
      }
      state.fill(state.locate(point), weight == null ? 1.0 : evaluation.get(weight, slot));
    }
  }

  public long getProcessed()
  {
    return processed;
  }

  public long getCardinalitySkipped()
  {
    return cardinalitySkipped;
  }

  public long getEvaluationSkipped()
  {
    return evaluationSkipped;
  }

  public ProcessingSummary getSummary(boolean cancelled)
  {
    final Map<String, Long> skippedPerHistogram = Maps.newHashMap();
    for (RegisteredHistogram histogram : histograms) {
      if (skipped[histogram.getIndex()] > 0) {
        skippedPerHistogram.put(histogram.getName(), skipped[histogram.getIndex()]);
      }
    }
    return new ProcessingSummary(processed, cardinalitySkipped, evaluationSkipped, skippedPerHistogram, cancelled);
  }

  /**
   * Hands the filled state over. The accumulator must not be used afterwards.
   */
  public HistogramSet toHistogramSet(boolean cancelled)
  {
    final Map<String, Histogram> result = Maps.newLinkedHashMap();
    for (RegisteredHistogram histogram : histograms) {
      result.put(histogram.getName(), states[histogram.getIndex()]);
    }
    return new HistogramSet(result, getSummary(cancelled));
  }
}
