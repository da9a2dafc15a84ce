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

import io.loki.common.EvaluationException;
import io.loki.data.FieldType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Compiled numeric expression. Booleans are represented as 1.0 and 0.0.
 */
public interface Expr
{
  double eval(NumericBinding bindings);

  default List<Expr> getChildren()
  {
    return Collections.emptyList();
  }

  interface NumericBinding
  {
    int NO_SLOT = -1;

    /**
     * value of a scalar field
     */
    double get(String name);

    /**
     * value at position {@code index} of a jagged field
     */
    double get(String name, int index);

    int size(String name);

    /**
     * current position in jagged fields, {@link #NO_SLOT} if not positioned
     */
    int slot();

    NumericBinding atSlot(int slot);
  }

  NumericBinding NULL_BINDING = new NumericBinding()
  {
    @Override
    public double get(String name)
    {
      throw new EvaluationException("Not a constant (contains '%s')", name);
    }

    @Override
    public double get(String name, int index)
    {
      throw new EvaluationException("Not a constant (contains '%s')", name);
    }

    @Override
    public int size(String name)
    {
      throw new EvaluationException("Not a constant (contains '%s')", name);
    }

    @Override
    public int slot()
    {
      return NO_SLOT;
    }

    @Override
    public NumericBinding atSlot(int slot)
    {
      return this;
    }
  };
}

interface Constant extends Expr
{
  double get();

  @Override
  default double eval(NumericBinding bindings)
  {
    return get();
  }
}

final class LongConst implements Constant
{
  private final long value;

  public LongConst(long value)
  {
    this.value = value;
  }

  @Override
  public double get()
  {
    return value;
  }

  @Override
  public String toString()
  {
    return String.valueOf(value);
  }

  @Override
  public boolean equals(Object other)
  {
    return other instanceof LongConst && value == ((LongConst) other).value;
  }

  @Override
  public int hashCode()
  {
    return Long.hashCode(value);
  }
}

final class DoubleConst implements Constant
{
  private final double value;

  public DoubleConst(double value)
  {
    this.value = value;
  }

  @Override
  public double get()
  {
    return value;
  }

  @Override
  public String toString()
  {
    return String.valueOf(value);
  }

  @Override
  public boolean equals(Object other)
  {
    return other instanceof DoubleConst && Double.compare(value, ((DoubleConst) other).value) == 0;
  }

  @Override
  public int hashCode()
  {
    return Double.hashCode(value);
  }
}

final class IdentifierExpr implements Expr
{
  private final String identifier;
  private final FieldType type;

  IdentifierExpr(String identifier, FieldType type)
  {
    this.identifier = identifier;
    this.type = type;
  }

  public String identifier()
  {
    return identifier;
  }

  public boolean isJagged()
  {
    return type == FieldType.JAGGED;
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    if (type != FieldType.JAGGED) {
      return bindings.get(identifier);
    }
    final int slot = bindings.slot();
    if (slot == NumericBinding.NO_SLOT) {
      throw new EvaluationException("jagged field '%s' is accessed without a slot", identifier);
    }
    return bindings.get(identifier, slot);
  }

  @Override
  public String toString()
  {
    return identifier;
  }

  @Override
  public boolean equals(Object other)
  {
    return other instanceof IdentifierExpr && identifier.equals(((IdentifierExpr) other).identifier);
  }

  @Override
  public int hashCode()
  {
    return identifier.hashCode();
  }
}

// element of a jagged field at fixed position, scalar from the outside
final class IndexedIdentifierExpr implements Expr
{
  private final String identifier;
  private final int index;

  IndexedIdentifierExpr(String identifier, int index)
  {
    this.identifier = identifier;
    this.index = index;
  }

  public String identifier()
  {
    return identifier;
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    return bindings.get(identifier, index);
  }

  @Override
  public String toString()
  {
    return identifier + "[" + index + "]";
  }
}

final class FunctionExpr implements Expr
{
  final String name;
  final List<Expr> args;
  final Function function;

  FunctionExpr(String name, List<Expr> args, Function function)
  {
    this.name = name;
    this.args = args;
    this.function = function;
  }

  public String op()
  {
    return name;
  }

  public boolean isReduction()
  {
    return function instanceof Function.Reduction;
  }

  @Override
  public List<Expr> getChildren()
  {
    return args;
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    return function.evaluate(args, bindings);
  }

  @Override
  public String toString()
  {
    final StringBuilder builder = new StringBuilder(name).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(args.get(i));
    }
    return builder.append(')').toString();
  }
}

interface UnaryOp extends Expr
{
  Expr expr();

  @Override
  default List<Expr> getChildren()
  {
    return Collections.singletonList(expr());
  }
}

final class UnaryMinusExpr implements UnaryOp
{
  private final Expr expr;

  UnaryMinusExpr(Expr expr)
  {
    this.expr = expr;
  }

  @Override
  public Expr expr()
  {
    return expr;
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    return -expr.eval(bindings);
  }

  @Override
  public String toString()
  {
    return "-" + expr;
  }
}

final class UnaryNotExpr implements UnaryOp
{
  private final Expr expr;

  UnaryNotExpr(Expr expr)
  {
    this.expr = expr;
  }

  @Override
  public Expr expr()
  {
    return expr;
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    return Evals.of(!Evals.asBoolean(expr.eval(bindings)));
  }

  @Override
  public String toString()
  {
    return "!" + expr;
  }
}

interface BinaryOp extends Expr
{
  String op();

  Expr left();

  Expr right();

  @Override
  default List<Expr> getChildren()
  {
    return Arrays.asList(left(), right());
  }
}

abstract class AbstractBinaryOp implements BinaryOp
{
  protected final String op;
  protected final Expr left;
  protected final Expr right;

  AbstractBinaryOp(String op, Expr left, Expr right)
  {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @Override
  public String op()
  {
    return op;
  }

  @Override
  public Expr left()
  {
    return left;
  }

  @Override
  public Expr right()
  {
    return right;
  }

  @Override
  public String toString()
  {
    return "(" + left + " " + op + " " + right + ")";
  }
}

abstract class BinaryOpExprBase extends AbstractBinaryOp
{
  BinaryOpExprBase(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  public final double eval(NumericBinding bindings)
  {
    return evalDouble(left.eval(bindings), right.eval(bindings));
  }

  protected abstract double evalDouble(double left, double right);
}

final class BinMinusExpr extends BinaryOpExprBase
{
  BinMinusExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return left - right;
  }
}

final class BinPowExpr extends BinaryOpExprBase
{
  BinPowExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Math.pow(left, right);
  }
}

final class BinMulExpr extends BinaryOpExprBase
{
  BinMulExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return left * right;
  }
}

final class BinDivExpr extends BinaryOpExprBase
{
  BinDivExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return left / right;
  }
}

final class BinModuloExpr extends BinaryOpExprBase
{
  BinModuloExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return left % right;
  }
}

final class BinPlusExpr extends BinaryOpExprBase
{
  BinPlusExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return left + right;
  }
}

final class BinLtExpr extends BinaryOpExprBase
{
  BinLtExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Evals.of(left < right);
  }
}

final class BinLeqExpr extends BinaryOpExprBase
{
  BinLeqExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Evals.of(left <= right);
  }
}

final class BinGtExpr extends BinaryOpExprBase
{
  BinGtExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Evals.of(left > right);
  }
}

final class BinGeqExpr extends BinaryOpExprBase
{
  BinGeqExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Evals.of(left >= right);
  }
}

final class BinEqExpr extends BinaryOpExprBase
{
  BinEqExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Evals.of(left == right);
  }
}

final class BinNeqExpr extends BinaryOpExprBase
{
  BinNeqExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  protected double evalDouble(double left, double right)
  {
    return Evals.of(left != right);
  }
}

final class BinAndExpr extends AbstractBinaryOp
{
  BinAndExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    return Evals.of(Evals.asBoolean(left.eval(bindings)) && Evals.asBoolean(right.eval(bindings)));
  }
}

final class BinOrExpr extends AbstractBinaryOp
{
  BinOrExpr(String op, Expr left, Expr right)
  {
    super(op, left, right);
  }

  @Override
  public double eval(NumericBinding bindings)
  {
    return Evals.of(Evals.asBoolean(left.eval(bindings)) || Evals.asBoolean(right.eval(bindings)));
  }
}
