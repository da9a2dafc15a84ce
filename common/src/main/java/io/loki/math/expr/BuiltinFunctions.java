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

import io.loki.data.TypeResolver;
import io.loki.math.expr.Expr.NumericBinding;
import io.loki.math.expr.Function.NamedFactory;

import java.util.List;

/**
 */
public interface BuiltinFunctions extends Function.Library
{
  abstract class SingleParamMath extends NamedFactory
  {
    @Override
    public Function create(List<Expr> args, TypeResolver resolver)
    {
      exactOne(args);
      return new Function()
      {
        @Override
        public double evaluate(List<Expr> args, NumericBinding bindings)
        {
          return _eval(args.get(0).eval(bindings));
        }
      };
    }

    protected abstract double _eval(double x);
  }

  abstract class DoubleParamMath extends NamedFactory
  {
    @Override
    public Function create(List<Expr> args, TypeResolver resolver)
    {
      exactTwo(args);
      return new Function()
      {
        @Override
        public double evaluate(List<Expr> args, NumericBinding bindings)
        {
          return _eval(args.get(0).eval(bindings), args.get(1).eval(bindings));
        }
      };
    }

    protected abstract double _eval(double x, double y);
  }

  @Function.Named("abs")
  final class Abs extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.abs(x);
    }
  }

  @Function.Named("sqrt")
  final class Sqrt extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.sqrt(x);
    }
  }

  @Function.Named("exp")
  final class Exp extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.exp(x);
    }
  }

  @Function.Named("log")
  final class Log extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.log(x);
    }
  }

  @Function.Named("log10")
  final class Log10 extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.log10(x);
    }
  }

  @Function.Named("sin")
  final class Sin extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.sin(x);
    }
  }

  @Function.Named("cos")
  final class Cos extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.cos(x);
    }
  }

  @Function.Named("tan")
  final class Tan extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.tan(x);
    }
  }

  @Function.Named("asin")
  final class Asin extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.asin(x);
    }
  }

  @Function.Named("acos")
  final class Acos extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.acos(x);
    }
  }

  @Function.Named("atan")
  final class Atan extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.atan(x);
    }
  }

  @Function.Named("sinh")
  final class Sinh extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.sinh(x);
    }
  }

  @Function.Named("cosh")
  final class Cosh extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.cosh(x);
    }
  }

  @Function.Named("tanh")
  final class Tanh extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.tanh(x);
    }
  }

  @Function.Named("floor")
  final class Floor extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.floor(x);
    }
  }

  @Function.Named("ceil")
  final class Ceil extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.ceil(x);
    }
  }

  @Function.Named("round")
  final class Round extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.rint(x);
    }
  }

  @Function.Named("signum")
  final class Signum extends SingleParamMath
  {
    @Override
    protected double _eval(double x)
    {
      return Math.signum(x);
    }
  }

  @Function.Named("pow")
  final class Pow extends DoubleParamMath
  {
    @Override
    protected double _eval(double x, double y)
    {
      return Math.pow(x, y);
    }
  }

  @Function.Named("atan2")
  final class Atan2 extends DoubleParamMath
  {
    @Override
    protected double _eval(double y, double x)
    {
      return Math.atan2(y, x);
    }
  }

  @Function.Named("hypot")
  final class Hypot extends DoubleParamMath
  {
    @Override
    protected double _eval(double x, double y)
    {
      return Math.hypot(x, y);
    }
  }

  @Function.Named("max")
  final class Max extends DoubleParamMath
  {
    @Override
    protected double _eval(double x, double y)
    {
      return Math.max(x, y);
    }
  }

  @Function.Named("min")
  final class Min extends DoubleParamMath
  {
    @Override
    protected double _eval(double x, double y)
    {
      return Math.min(x, y);
    }
  }

  @Function.Named("if")
  final class IfFunc extends NamedFactory
  {
    @Override
    public Function create(List<Expr> args, TypeResolver resolver)
    {
      exactThree(args);
      return new Function()
      {
        @Override
        public double evaluate(List<Expr> args, NumericBinding bindings)
        {
          return Evals.evalBoolean(args.get(0), bindings) ? args.get(1).eval(bindings) : args.get(2).eval(bindings);
        }
      };
    }
  }

  // reductions over all values of a jagged argument in the current record
  abstract class JaggedReduction extends NamedFactory
  {
    @Override
    public Function create(List<Expr> args, TypeResolver resolver)
    {
      exactOne(args);
      final List<String> jaggedFields = Parser.findSlotBindings(args.get(0));
      return new Function.Reduction()
      {
        @Override
        public double evaluate(List<Expr> args, NumericBinding bindings)
        {
          final Expr arg = args.get(0);
          if (jaggedFields.isEmpty()) {
            return reduce(1, new double[]{arg.eval(bindings)});
          }
          final int size = Evals.cardinality(jaggedFields, bindings, arg);
          final double[] values = new double[size];
          for (int i = 0; i < size; i++) {
            values[i] = arg.eval(bindings.atSlot(i));
          }
          return reduce(size, values);
        }
      };
    }

    protected abstract double reduce(int size, double[] values);
  }

  @Function.Named("length")
  final class Length extends JaggedReduction
  {
    @Override
    protected double reduce(int size, double[] values)
    {
      return size;
    }
  }

  @Function.Named("sum")
  final class Sum extends JaggedReduction
  {
    @Override
    protected double reduce(int size, double[] values)
    {
      double sum = 0;
      for (double value : values) {
        sum += value;
      }
      return sum;
    }
  }

  @Function.Named("minof")
  final class MinOf extends JaggedReduction
  {
    @Override
    protected double reduce(int size, double[] values)
    {
      double min = Double.NaN;
      for (double value : values) {
        min = Double.isNaN(min) ? value : Math.min(min, value);
      }
      return min;
    }
  }

  @Function.Named("maxof")
  final class MaxOf extends JaggedReduction
  {
    @Override
    protected double reduce(int size, double[] values)
    {
      double max = Double.NaN;
      for (double value : values) {
        max = Double.isNaN(max) ? value : Math.max(max, value);
      }
      return max;
    }
  }
}
