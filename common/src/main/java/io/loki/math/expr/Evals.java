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

import java.util.List;

/**
 */
public class Evals
{
  public static double of(boolean bool)
  {
    return bool ? 1D : 0D;
  }

  // NaN is false
  public static boolean asBoolean(double value)
  {
    return value != 0D && !Double.isNaN(value);
  }

  public static boolean evalBoolean(Expr expr, Expr.NumericBinding bindings)
  {
    return asBoolean(expr.eval(bindings));
  }

  public static boolean isConstant(Expr expr)
  {
    return expr instanceof Constant;
  }

  public static boolean isAllConstants(List<Expr> exprs)
  {
    for (Expr expr : exprs) {
      if (!isConstant(expr)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the common number of values the jagged fields hold in the bound record, 1 when there are none.
   *
   * @throws CardinalityMismatchException if the fields disagree
   */
  public static int cardinality(List<String> jaggedFields, Expr.NumericBinding bindings, Object source)
  {
    if (jaggedFields.isEmpty()) {
      return 1;
    }
    final int expected = bindings.size(jaggedFields.get(0));
    for (int i = 1; i < jaggedFields.size(); i++) {
      final int actual = bindings.size(jaggedFields.get(i));
      if (actual != expected) {
        throw new CardinalityMismatchException(source + " (" + jaggedFields.get(i) + ")", expected, actual);
      }
    }
    return expected;
  }

  static Expr toConstant(double value)
  {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
      return new LongConst((long) value);
    }
    return new DoubleConst(value);
  }
}
