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

package io.loki.query.expression;

import com.google.common.collect.ImmutableList;
import io.loki.data.Record;
import io.loki.data.RecordBinding;
import io.loki.math.expr.Evals;
import io.loki.math.expr.Expr;
import io.loki.math.expr.Parser;

import java.util.List;

/**
 * Expression compiled against a schema, together with the jagged fields deciding its number of values.
 */
public class CompiledExpression
{
  private final String text;
  private final Expr expr;
  private final List<String> slotFields;

  CompiledExpression(String text, Expr expr)
  {
    this.text = text;
    this.expr = expr;
    this.slotFields = ImmutableList.copyOf(Parser.findSlotBindings(expr));
  }

  public String getText()
  {
    return text;
  }

  /**
   * jagged fields deciding the number of values per record
   */
  public List<String> getSlotFields()
  {
    return slotFields;
  }

  public boolean isScalar()
  {
    return slotFields.isEmpty();
  }

  /**
   * Returns one value per slot of the record, exactly one for scalar expressions.
   */
  public double[] evaluate(Record record)
  {
    final RecordBinding binding = new RecordBinding(record);
    if (slotFields.isEmpty()) {
      return new double[]{expr.eval(binding)};
    }
    final int size = Evals.cardinality(slotFields, binding, text);
    final double[] values = new double[size];
    for (int i = 0; i < size; i++) {
      values[i] = expr.eval(binding.setSlot(i));
    }
    return values;
  }

  @Override
  public String toString()
  {
    return text;
  }
}
