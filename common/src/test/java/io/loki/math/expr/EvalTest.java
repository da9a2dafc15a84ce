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

package io.loki.math.expr;

import io.loki.common.CardinalityMismatchException;
import io.loki.common.EvaluationException;
import io.loki.data.MapBasedRecord;
import io.loki.data.RecordBinding;
import io.loki.data.Schema;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

/**
 */
public class EvalTest
{
  private final Schema schema = Schema.builder()
                                      .scalar("x")
                                      .scalar("y")
                                      .jagged("pt")
                                      .jagged("eta")
                                      .build();

  private final MapBasedRecord record = MapBasedRecord.of(
      "x", 2.0f,
      "y", 3L,
      "pt", new double[]{10, 20, 30},
      "eta", new float[]{-1.5f, 0.5f, 2.5f}
  );

  private double eval(String expression)
  {
    return Parser.parse(expression, schema).eval(new RecordBinding(record));
  }

  private double evalAt(String expression, int slot)
  {
    return Parser.parse(expression, schema).eval(new RecordBinding(record, slot));
  }

  @Test
  public void testArithmetic()
  {
    Assert.assertEquals(5.0, eval("x + y"), 0.0);
    Assert.assertEquals(-1.0, eval("x - y"), 0.0);
    Assert.assertEquals(6.0, eval("x * y"), 0.0);
    Assert.assertEquals(2.0 / 3.0, eval("x / y"), 0.0);
    Assert.assertEquals(1.0, eval("y % x"), 0.0);
    Assert.assertEquals(8.0, eval("x ^ y"), 0.0);
    Assert.assertEquals(-2.0, eval("-x"), 0.0);
    Assert.assertEquals(512.0, eval("x ^ y ^ 2"), 0.0);
    Assert.assertEquals(0.5, eval("1 / x"), 0.0);
    Assert.assertEquals(1.5e3, eval("1.5e3"), 0.0);
  }

  @Test
  public void testBooleans()
  {
    Assert.assertEquals(1.0, eval("x < y"), 0.0);
    Assert.assertEquals(0.0, eval("x > y"), 0.0);
    Assert.assertEquals(1.0, eval("x <= 2"), 0.0);
    Assert.assertEquals(1.0, eval("y >= 3"), 0.0);
    Assert.assertEquals(1.0, eval("x == 2"), 0.0);
    Assert.assertEquals(0.0, eval("x != 2"), 0.0);
    Assert.assertEquals(1.0, eval("x && y"), 0.0);
    Assert.assertEquals(0.0, eval("!x"), 0.0);
    Assert.assertEquals(1.0, eval("x > 5 || y == 3"), 0.0);
    Assert.assertEquals(0.0, eval("x > 5 && y == 3"), 0.0);
    Assert.assertFalse(Evals.asBoolean(Double.NaN));
    Assert.assertTrue(Evals.asBoolean(-0.1));
  }

  @Test
  public void testMathFunctions()
  {
    Assert.assertEquals(2.0, eval("abs(-x)"), 0.0);
    Assert.assertEquals(Math.sqrt(2), eval("sqrt(x)"), 0.0);
    Assert.assertEquals(Math.log(2), eval("log(x)"), 0.0);
    Assert.assertEquals(2.0, eval("log10(100)"), 1e-12);
    Assert.assertEquals(3.0, eval("ceil(2.1)"), 0.0);
    Assert.assertEquals(2.0, eval("floor(2.9)"), 0.0);
    Assert.assertEquals(2.0, eval("round(2.4)"), 0.0);
    Assert.assertEquals(-1.0, eval("signum(-y)"), 0.0);
    Assert.assertEquals(5.0, eval("hypot(3, 4)"), 0.0);
    Assert.assertEquals(9.0, eval("pow(y, 2)"), 0.0);
    Assert.assertEquals(3.0, eval("max(x, y)"), 0.0);
    Assert.assertEquals(2.0, eval("min(x, y)"), 0.0);
    Assert.assertEquals(Math.atan2(2, 3), eval("atan2(x, y)"), 0.0);
    Assert.assertEquals(3.0, eval("if(x > 1, y, x)"), 0.0);
    Assert.assertEquals(2.0, eval("if(x > 5, y, x)"), 0.0);
  }

  @Test
  public void testSlots()
  {
    Assert.assertEquals(10.0, evalAt("pt", 0), 0.0);
    Assert.assertEquals(30.0, evalAt("pt", 2), 0.0);
    Assert.assertEquals(22.0, evalAt("pt + x", 1), 0.0);
    Assert.assertEquals(20.5, evalAt("pt + eta", 1), 0.0);
    Assert.assertEquals(30.0, eval("pt[2]"), 0.0);
    try {
      eval("pt");
      Assert.fail("jagged field needs a slot");
    }
    catch (EvaluationException e) {
      Assert.assertTrue(e.getMessage().contains("without a slot"));
    }
    try {
      eval("pt[3]");
      Assert.fail("index out of range");
    }
    catch (EvaluationException e) {
      Assert.assertTrue(e.getMessage().contains("out of range"));
    }
  }

  @Test
  public void testReductions()
  {
    Assert.assertEquals(3.0, eval("length(pt)"), 0.0);
    Assert.assertEquals(60.0, eval("sum(pt)"), 0.0);
    Assert.assertEquals(10.0, eval("minof(pt)"), 0.0);
    Assert.assertEquals(30.0, eval("maxof(pt)"), 0.0);
    Assert.assertEquals(2.0, eval("sum(pt > 15)"), 0.0);
    Assert.assertEquals(1.0, eval("sum(abs(eta) < 1)"), 0.0);
    Assert.assertEquals(10.0, evalAt("maxof(pt) - pt", 1), 0.0);

    final MapBasedRecord empty = MapBasedRecord.of("pt", new double[0]);
    final RecordBinding binding = new RecordBinding(empty);
    Assert.assertEquals(0.0, Parser.parse("length(pt)", schema).eval(binding), 0.0);
    Assert.assertEquals(0.0, Parser.parse("sum(pt)", schema).eval(binding), 0.0);
    Assert.assertTrue(Double.isNaN(Parser.parse("minof(pt)", schema).eval(binding)));
    Assert.assertTrue(Double.isNaN(Parser.parse("maxof(pt)", schema).eval(binding)));
  }

  @Test(expected = CardinalityMismatchException.class)
  public void testReductionOverMismatchedFields()
  {
    final MapBasedRecord mismatched = MapBasedRecord.of("pt", new double[]{1, 2}, "eta", new double[]{1});
    Parser.parse("sum(pt * eta)", schema).eval(new RecordBinding(mismatched));
  }

  @Test
  public void testCardinality()
  {
    final RecordBinding binding = new RecordBinding(record);
    Assert.assertEquals(1, Evals.cardinality(Collections.<String>emptyList(), binding, "x"));
    Assert.assertEquals(3, Evals.cardinality(Arrays.asList("pt", "eta"), binding, "pt + eta"));
    try {
      Evals.cardinality(
          Arrays.asList("pt", "eta"),
          new RecordBinding(MapBasedRecord.of("pt", new int[]{1, 2, 3}, "eta", new long[]{1, 2})),
          "pt + eta"
      );
      Assert.fail();
    }
    catch (CardinalityMismatchException e) {
      Assert.assertEquals(3, e.getExpected());
      Assert.assertEquals(2, e.getActual());
    }
  }
}
