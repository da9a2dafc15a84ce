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
import io.loki.common.EvaluationException;
import io.loki.data.MapBasedRecord;
import io.loki.data.Schema;
import io.loki.query.expression.ExpressionPool;
import io.loki.query.histogram.HistogramDefinition;
import io.loki.query.histogram.HistogramRegistry;
import io.loki.query.histogram.RegisteredHistogram;
import org.junit.Assert;
import org.junit.Test;

public class SyncPlannerTest
{
  private final Schema schema = Schema.builder()
                                      .scalar("mu")
                                      .scalar("w")
                                      .jagged("a")
                                      .jagged("b")
                                      .jagged("c")
                                      .jagged("d")
                                      .build();

  private static HistogramDefinition histogram(String name, String x, String y, String weight)
  {
    final HistogramDefinition.Builder builder = HistogramDefinition.builder().name(name).axis(x, 0, 1, 2);
    if (y != null) {
      builder.axis(y, 0, 1, 2);
    }
    return builder.weight(weight).build();
  }

  @Test
  public void testGroups()
  {
    final HistogramRegistry registry = new HistogramRegistry(schema);
    final RegisteredHistogram ab = registry.register(histogram("ab", "a", "b", "w"));
    final RegisteredHistogram bc = registry.register(histogram("bc", "b * 2", "c", null));
    final RegisteredHistogram d = registry.register(histogram("d", "d", "mu", null));
    final RegisteredHistogram scalar = registry.register(histogram("scalar", "mu", null, "w"));

    final SyncPlan plan = SyncPlanner.plan(registry);
    final ExpressionPool pool = registry.getPool();

    Assert.assertEquals(2, plan.getGroups().size());
    final SyncGroup first = plan.getGroups().get(0);
    Assert.assertEquals(4, first.getMembers().size());
    Assert.assertTrue(first.contains(pool.intern("a")));
    Assert.assertTrue(first.contains(pool.intern("b")));
    Assert.assertTrue(first.contains(pool.intern("c")));
    // shares field 'b' with histogram "ab"
    Assert.assertTrue(first.contains(pool.intern("b * 2")));
    Assert.assertSame(first, plan.groupOf(ab));
    Assert.assertSame(first, plan.groupOf(bc));

    final SyncGroup second = plan.getGroups().get(1);
    Assert.assertEquals(1, second.getMembers().size());
    Assert.assertSame(second, plan.groupOf(d));
    Assert.assertNull(plan.groupOf(scalar));

    Assert.assertEquals(2, plan.getScalars().size());
    Assert.assertTrue(plan.getScalars().contains(pool.intern("w")));
    Assert.assertTrue(plan.getScalars().contains(pool.intern("mu")));
  }

  @Test
  public void testEvaluationBroadcastsScalars()
  {
    final HistogramRegistry registry = new HistogramRegistry(schema);
    final RegisteredHistogram ab = registry.register(histogram("ab", "a", "b", "w"));
    final RecordEvaluation evaluation = new RecordEvaluation(registry.getPool(), SyncPlanner.plan(registry));

    evaluation.evaluate(MapBasedRecord.of("w", 0.5, "a", new double[]{1, 2, 3}, "b", new double[]{4, 5, 6}));
    Assert.assertNull(evaluation.failureOf(ab));
    Assert.assertEquals(3, evaluation.size(ab));
    for (int slot = 0; slot < 3; slot++) {
      Assert.assertEquals(0.5, evaluation.get(ab.getWeight(), slot), 0.0);
      Assert.assertEquals(slot + 1, evaluation.get(ab.getAxes().get(0), slot), 0.0);
      Assert.assertEquals(slot + 4, evaluation.get(ab.getAxes().get(1), slot), 0.0);
    }
  }

  @Test
  public void testMismatchIsReportedPerRecord()
  {
    final HistogramRegistry registry = new HistogramRegistry(schema);
    final RegisteredHistogram ab = registry.register(histogram("ab", "a", "b", null));
    final RegisteredHistogram a = registry.register(histogram("a", "a", null, null));
    final RecordEvaluation evaluation = new RecordEvaluation(registry.getPool(), SyncPlanner.plan(registry));

    evaluation.evaluate(MapBasedRecord.of("a", new double[]{1, 2, 3}, "b", new double[]{4, 5}));
    Assert.assertTrue(evaluation.failureOf(ab) instanceof CardinalityMismatchException);
    Assert.assertNull(evaluation.failureOf(a));
    Assert.assertEquals(3, evaluation.size(a));

    // the next record is evaluated from scratch
    evaluation.evaluate(MapBasedRecord.of("a", new double[]{1, 2}, "b", new double[]{4, 5}));
    Assert.assertNull(evaluation.failureOf(ab));
    Assert.assertEquals(2, evaluation.size(ab));
  }

  @Test
  public void testFailedRepresentativeIsReplaced()
  {
    final HistogramRegistry registry = new HistogramRegistry(schema);
    final RegisteredHistogram ab = registry.register(histogram("ab", "a", "b", null));
    final RegisteredHistogram b = registry.register(histogram("b", "b", null, null));
    final RecordEvaluation evaluation = new RecordEvaluation(registry.getPool(), SyncPlanner.plan(registry));

    // 'a' is missing from the record
    evaluation.evaluate(MapBasedRecord.of("b", new double[]{4, 5}));
    Assert.assertTrue(evaluation.failureOf(ab) instanceof EvaluationException);
    Assert.assertNull(evaluation.failureOf(b));
    Assert.assertEquals(2, evaluation.size(b));
  }
}
