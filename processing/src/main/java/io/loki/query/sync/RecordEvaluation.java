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

package io.loki.query.sync;

import io.loki.common.CardinalityMismatchException;
import io.loki.common.LokiException;
import io.loki.data.Record;
import io.loki.query.expression.ExpressionHandle;
import io.loki.query.expression.ExpressionPool;
import io.loki.query.histogram.RegisteredHistogram;

import java.util.Arrays;

/**
 * Values of every planned expression for the current record, each evaluated once and shared by all
 * histograms reading it. Reused from record to record by one worker.
 * <p>
 * Slot counts are checked per histogram: the first jagged expression of a histogram (axes, then selection,
 * then weight) fixes N, and every other jagged expression of the same histogram must yield exactly N values.
 * A mismatch fails that histogram only, never the expressions themselves, so a histogram whose own inputs
 * agree still fills whatever else the group holds. Scalar expressions keep their single value and are
 * broadcast to any slot.
 */
public class RecordEvaluation
{
  private final ExpressionPool pool;
  private final SyncPlan plan;

  private final double[][] values;
  private final LokiException[] failures;

  public RecordEvaluation(ExpressionPool pool, SyncPlan plan)
  {
    this.pool = pool;
    this.plan = plan;
    this.values = new double[plan.getNumHandles()][];
    this.failures = new LokiException[plan.getNumHandles()];
  }

  public RecordEvaluation evaluate(Record record)
  {
    Arrays.fill(values, null);
    Arrays.fill(failures, null);
    for (ExpressionHandle scalar : plan.getScalars()) {
      evaluate(scalar, record);
    }
    for (SyncGroup group : plan.getGroups()) {
      for (ExpressionHandle member : group.getMembers()) {
        evaluate(member, record);
      }
    }
    return this;
  }

  private void evaluate(ExpressionHandle handle, Record record)
  {
    try {
      values[handle.getId()] = pool.evaluate(handle, record);
    }
    catch (LokiException e) {
      failures[handle.getId()] = e;
    }
  }

  /**
   * Number of fills for the histogram in this record, 1 for histograms reading scalars only.
   * Valid only when {@link #failureOf} returned null for it.
   */
  public int size(RegisteredHistogram histogram)
  {
    if (plan.groupOf(histogram) == null) {
      return 1;
    }
    for (ExpressionHandle handle : histogram.getHandles()) {
      if (!handle.isScalar()) {
        return values[handle.getId()].length;
      }
    }
    return 1;
  }

  /**
   * @return the first evaluation failure among the expressions of the histogram, otherwise a
   * {@link CardinalityMismatchException} if its jagged expressions disagree, null if it can be filled
   */
  public LokiException failureOf(RegisteredHistogram histogram)
  {
    for (ExpressionHandle handle : histogram.getHandles()) {
      if (failures[handle.getId()] != null) {
        return failures[handle.getId()];
      }
    }
    int size = -1;
    for (ExpressionHandle handle : histogram.getHandles()) {
      if (handle.isScalar()) {
        continue;
      }
      final int length = values[handle.getId()].length;
      if (size < 0) {
        size = length;
      } else if (length != size) {
        return new CardinalityMismatchException(handle.getText(), size, length);
      }
    }
    return null;
  }

  /**
   * value of the expression at the slot, scalars broadcast
   */
  public double get(ExpressionHandle handle, int slot)
  {
    final double[] evaluated = values[handle.getId()];
    return handle.isScalar() ? evaluated[0] : evaluated[slot];
  }
}
