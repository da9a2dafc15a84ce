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

import io.loki.data.MapBasedRecord;
import io.loki.data.Schema;
import io.loki.query.histogram.Histogram;
import io.loki.query.histogram.HistogramDefinition;
import io.loki.query.histogram.HistogramRegistry;
import io.loki.query.histogram.HistogramSet;
import org.junit.Assert;
import org.junit.Test;

public class HistogramAccumulatorTest
{
  private final Schema schema = Schema.builder()
                                      .scalar("mu")
                                      .scalar("w")
                                      .jagged("x")
                                      .jagged("a")
                                      .jagged("b")
                                      .build();

  private HistogramAccumulator accumulator(HistogramDefinition... definitions)
  {
    final HistogramRegistry registry = new HistogramRegistry(schema);
    for (HistogramDefinition definition : definitions) {
      registry.register(definition);
    }
    return new HistogramAccumulator(registry);
  }

  @Test
  public void testJaggedEndToEnd()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("x").axis("x", 0, 4, 8, 12).build()
    );
    accumulator.add(MapBasedRecord.of("x", new double[]{1.0, 5.0}));
    accumulator.add(MapBasedRecord.of("x", new double[]{10.0}));
    accumulator.add(MapBasedRecord.of("x", new double[0]));

    final HistogramSet result = accumulator.toHistogramSet(false);
    final Histogram histogram = result.get("x");
    Assert.assertEquals(0, histogram.getEntries(0));
    Assert.assertEquals(1, histogram.getEntries(1));
    Assert.assertEquals(1, histogram.getEntries(2));
    Assert.assertEquals(1, histogram.getEntries(3));
    Assert.assertEquals(0, histogram.getEntries(4));
    Assert.assertEquals(3, histogram.getTotalEntries());
    Assert.assertEquals(1.0, histogram.getSumW(1), 0.0);
    Assert.assertEquals(1.0, histogram.getSumW2(3), 0.0);

    Assert.assertEquals(3, result.getSummary().getRecordsProcessed());
    Assert.assertEquals(0, result.getSummary().getCardinalitySkipped());
    Assert.assertEquals("processed 3 records, skipped 0 due to cardinality errors", result.getSummary().toString());
  }

  @Test
  public void testScalarWeightIsBroadcast()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("x").axis("x", 0, 4, 8, 12).weight("w").build()
    );
    accumulator.add(MapBasedRecord.of("w", 0.5, "x", new double[]{1, 5, 9, 11}));

    final Histogram histogram = accumulator.toHistogramSet(false).get("x");
    Assert.assertEquals(4, histogram.getTotalEntries());
    Assert.assertEquals(0.5, histogram.getSumW(1), 0.0);
    Assert.assertEquals(0.5, histogram.getSumW(2), 0.0);
    Assert.assertEquals(1.0, histogram.getSumW(3), 0.0);
    Assert.assertEquals(0.5, histogram.getSumW2(3), 0.0);
    Assert.assertEquals(2, histogram.getEntries(3));
  }

  @Test
  public void testScalarOnlyFillsOncePerRecord()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("mu").axis("mu", 0, 20, 40).weight("w * 2").build(),
        HistogramDefinition.builder().name("mu_vs_w").axis("mu", 0, 20, 40).axis("w", 0, 1, 2).build()
    );
    for (int i = 0; i < 10; i++) {
      accumulator.add(MapBasedRecord.of("mu", i * 4, "w", 1, "x", new double[]{1, 2, 3}));
    }
    final HistogramSet result = accumulator.toHistogramSet(false);
    Assert.assertEquals(10, result.get("mu").getTotalEntries());
    Assert.assertEquals(5, result.get("mu").getEntries(1));
    Assert.assertEquals(10.0, result.get("mu").getSumW(2), 0.0);
    Assert.assertEquals(10, result.get("mu_vs_w").getTotalEntries());
    Assert.assertEquals(5, result.get("mu_vs_w").getEntries(2, 2));
  }

  @Test
  public void testSelection()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("x").axis("x", 0, 4, 8, 12).selection("x > 2 && mu < 30").build()
    );
    accumulator.add(MapBasedRecord.of("mu", 10, "x", new double[]{1, 3, 5}));
    accumulator.add(MapBasedRecord.of("mu", 40, "x", new double[]{7}));

    final Histogram histogram = accumulator.toHistogramSet(false).get("x");
    Assert.assertEquals(2, histogram.getTotalEntries());
    Assert.assertEquals(1, histogram.getEntries(1));
    Assert.assertEquals(1, histogram.getEntries(2));
  }

  @Test
  public void testCardinalityMismatchSkipsAffectedHistogramOnly()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("ab").axis("a", 0, 10).axis("b", 0, 10).build(),
        HistogramDefinition.builder().name("a").axis("a", 0, 10).build()
    );
    accumulator.add(MapBasedRecord.of("a", new double[]{1, 2, 3}, "b", new double[]{1, 2}));
    accumulator.add(MapBasedRecord.of("a", new double[]{4, 5}, "b", new double[]{6, 7}));

    final HistogramSet result = accumulator.toHistogramSet(false);
    Assert.assertEquals(2, result.get("ab").getTotalEntries());
    Assert.assertEquals(5, result.get("a").getTotalEntries());
    Assert.assertEquals(2, result.getSummary().getRecordsProcessed());
    Assert.assertEquals(1, result.getSummary().getCardinalitySkipped());
    Assert.assertEquals(1, result.getSummary().getSkipped("ab"));
    Assert.assertEquals(0, result.getSummary().getSkipped("a"));
    Assert.assertEquals("processed 2 records, skipped 1 due to cardinality errors", result.getSummary().toString());
  }

  @Test
  public void testCardinalityMismatchIndependentOfRegistrationOrder()
  {
    final HistogramDefinition ba = HistogramDefinition.builder().name("ba").axis("b", 0, 10).axis("a", 0, 10).build();
    final HistogramDefinition a = HistogramDefinition.builder().name("a").axis("a", 0, 10).build();
    final HistogramDefinition b = HistogramDefinition.builder().name("b").axis("b", 0, 10).build();

    for (HistogramDefinition[] order : new HistogramDefinition[][]{{ba, a, b}, {a, b, ba}, {b, ba, a}}) {
      final HistogramAccumulator accumulator = accumulator(order);
      accumulator.add(MapBasedRecord.of("a", new double[]{1, 2, 3}, "b", new double[]{1, 2}));

      final HistogramSet result = accumulator.toHistogramSet(false);
      Assert.assertEquals(0, result.get("ba").getTotalEntries());
      Assert.assertEquals(3, result.get("a").getTotalEntries());
      Assert.assertEquals(2, result.get("b").getTotalEntries());
      Assert.assertEquals(1, result.getSummary().getCardinalitySkipped());
      Assert.assertEquals(1, result.getSummary().getSkipped("ba"));
      Assert.assertEquals(0, result.getSummary().getSkipped("a"));
      Assert.assertEquals(0, result.getSummary().getSkipped("b"));
    }
  }

  @Test
  public void testNegatedZeroFillsFirstBin()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("neg").axis("-x", 0, 4, 8).build()
    );
    accumulator.add(MapBasedRecord.of("x", new double[]{0.0}));

    final Histogram neg = accumulator.toHistogramSet(false).get("neg");
    Assert.assertEquals(0, neg.getEntries(0));
    Assert.assertEquals(1, neg.getEntries(1));
  }

  @Test
  public void testEvaluationFailure()
  {
    final HistogramAccumulator accumulator = accumulator(
        HistogramDefinition.builder().name("mu").axis("mu", 0, 100).build(),
        HistogramDefinition.builder().name("x").axis("x", 0, 100).build(),
        HistogramDefinition.builder().name("first").axis("x[0]", 0, 100).build()
    );
    accumulator.add(MapBasedRecord.of("x", new double[0]));

    final HistogramSet result = accumulator.toHistogramSet(false);
    Assert.assertEquals(0, result.get("mu").getTotalEntries());
    Assert.assertEquals(0, result.get("x").getTotalEntries());
    Assert.assertEquals(0, result.get("first").getTotalEntries());
    Assert.assertEquals(1, result.getSummary().getEvaluationSkipped());
    Assert.assertEquals(0, result.getSummary().getCardinalitySkipped());
    Assert.assertEquals(1, result.getSummary().getSkipped("mu"));
    Assert.assertEquals(0, result.getSummary().getSkipped("x"));
    Assert.assertEquals(1, result.getSummary().getSkipped("first"));
  }

  @Test
  public void testFillOrderDoesNotMatter()
  {
    final HistogramDefinition definition = HistogramDefinition.builder()
                                                              .name("x")
                                                              .axis("x", 0, 4, 8, 12)
                                                              .weight("w")
                                                              .build();
    final MapBasedRecord r1 = MapBasedRecord.of("w", 2, "x", new double[]{1, 5});
    final MapBasedRecord r2 = MapBasedRecord.of("w", 3, "x", new double[]{5, 13});

    final HistogramAccumulator forward = accumulator(definition);
    forward.add(r1);
    forward.add(r2);
    final HistogramAccumulator backward = accumulator(definition);
    backward.add(r2);
    backward.add(r1);
    Assert.assertEquals(forward.toHistogramSet(false), backward.toHistogramSet(false));
  }
}
