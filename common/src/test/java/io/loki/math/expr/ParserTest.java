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

import com.google.common.collect.ImmutableList;
import io.loki.common.CompileException;
import io.loki.data.Schema;
import org.junit.Assert;
import org.junit.Test;

/**
 */
public class ParserTest
{
  private final Schema schema = Schema.builder()
                                      .scalar("mu")
                                      .scalar("weight")
                                      .jagged("TauJets.pt", "TauJets")
                                      .jagged("TauJets.eta", "TauJets")
                                      .jagged("Tracks.d0", "Tracks")
                                      .build();

  private void validateFlatten(String expression, String withoutFlatten, String withFlatten)
  {
    Assert.assertEquals(expression, withoutFlatten, Parser.parse(expression, schema, false).toString());
    Assert.assertEquals(expression, withFlatten, Parser.parse(expression, schema, true).toString());
  }

  private void validateParser(String expression, String expected, Iterable<String> identifiers)
  {
    final Expr parsed = Parser.parse(expression, schema);
    Assert.assertEquals(expression, expected, parsed.toString());
    Assert.assertEquals(expression, ImmutableList.copyOf(identifiers), Parser.findRequiredBindings(parsed));
  }

  @Test
  public void testSimple()
  {
    validateParser("1", "1", ImmutableList.<String>of());
    validateParser("mu", "mu", ImmutableList.of("mu"));
    validateParser("\"mu\"", "mu", ImmutableList.of("mu"));
    validateParser("TauJets.pt", "TauJets.pt", ImmutableList.of("TauJets.pt"));
    validateParser("TauJets.pt[0]", "TauJets.pt[0]", ImmutableList.of("TauJets.pt"));
  }

  @Test
  public void testSimpleBinaryOps()
  {
    validateParser("mu-1", "(mu - 1)", ImmutableList.of("mu"));
    validateParser("mu+1", "(mu + 1)", ImmutableList.of("mu"));
    validateParser("mu*weight", "(mu * weight)", ImmutableList.of("mu", "weight"));
    validateParser("mu/weight", "(mu / weight)", ImmutableList.of("mu", "weight"));
    validateParser("mu%2", "(mu % 2)", ImmutableList.of("mu"));
    validateParser("mu>=1 && weight<2", "((mu >= 1) && (weight < 2))", ImmutableList.of("mu", "weight"));
  }

  @Test
  public void testPrecedence()
  {
    validateParser("mu+weight*2", "(mu + (weight * 2))", ImmutableList.of("mu", "weight"));
    validateParser("(mu+weight)*2", "((mu + weight) * 2)", ImmutableList.of("mu", "weight"));
    validateParser("mu^2^3", "(mu ^ 8)", ImmutableList.of("mu"));
    validateFlatten("mu^2^3", "(mu ^ (2 ^ 3))", "(mu ^ 8)");
    validateParser("mu<1 || mu>2 && weight==0", "((mu < 1) || ((mu > 2) && (weight == 0)))", ImmutableList.of("mu", "weight"));
  }

  @Test
  public void testFlatten()
  {
    validateFlatten("1 + 2 * 3", "(1 + (2 * 3))", "7");
    validateFlatten("mu * (2 + 3)", "(mu * (2 + 3))", "(mu * 5)");
    validateFlatten("sqrt(16) + mu", "(sqrt(16) + mu)", "(4 + mu)");
    validateFlatten("1 / 4", "(1 / 4)", "0.25");
    validateFlatten("-mu", "-mu", "-mu");
  }

  @Test
  public void testFunctions()
  {
    validateParser("abs(mu)", "abs(mu)", ImmutableList.of("mu"));
    validateParser("if(mu > 1, weight, 0)", "if((mu > 1), weight, 0)", ImmutableList.of("mu", "weight"));
    validateParser("MAX(mu, weight)", "MAX(mu, weight)", ImmutableList.of("mu", "weight"));
    Assert.assertTrue(Parser.getFunctionNames().containsAll(ImmutableList.of("sum", "length", "minof", "maxof", "hypot")));
  }

  @Test
  public void testSlotBindings()
  {
    Assert.assertEquals(
        ImmutableList.of("TauJets.pt", "TauJets.eta"),
        Parser.findSlotBindings(Parser.parse("TauJets.pt * abs(TauJets.eta) + mu", schema))
    );
    Assert.assertEquals(
        ImmutableList.of(),
        Parser.findSlotBindings(Parser.parse("sum(TauJets.pt) / length(TauJets.pt)", schema))
    );
    Assert.assertEquals(
        ImmutableList.of("TauJets.eta"),
        Parser.findSlotBindings(Parser.parse("TauJets.eta - TauJets.pt[0]", schema))
    );
    Assert.assertTrue(Parser.isScalar(Parser.parse("mu * maxof(Tracks.d0)", schema)));
    Assert.assertFalse(Parser.isScalar(Parser.parse("Tracks.d0", schema)));
  }

  @Test
  public void testCompileErrors()
  {
    assertCompileError("mu +", "syntax error");
    assertCompileError("nonexisting * 2", "not declared in schema");
    assertCompileError("unknown(mu)", "is not defined");
    assertCompileError("mu[1]", "cannot be indexed");
    assertCompileError("sqrt(mu, weight)", "needs 1 argument");
    assertCompileError("if(mu, weight)", "needs 3 arguments");
  }

  private void assertCompileError(String expression, String message)
  {
    try {
      Parser.parse(expression, schema);
      Assert.fail(expression + " should not be compiled");
    }
    catch (CompileException e) {
      Assert.assertEquals(expression, e.getExpression());
      Assert.assertTrue(e.getMessage(), e.getMessage().contains(message));
    }
  }
}
