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

import com.google.common.base.Preconditions;
import com.metamx.common.IAE;
import io.loki.data.TypeResolver;
import io.loki.math.expr.Expr.NumericBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.List;

/**
 */
public interface Function
{
  double evaluate(List<Expr> args, NumericBinding bindings);

  interface Library
  {
  }

  interface Factory
  {
    String name();

    Function create(List<Expr> args, TypeResolver resolver);
  }

  /**
   * Collapses all values of its jagged argument into one value per record. Jagged fields referenced
   * inside the argument do not make the enclosing expression jagged.
   */
  interface Reduction extends Function
  {
  }

  @Target({ElementType.TYPE})
  @Retention(RetentionPolicy.RUNTIME)
  @interface Named
  {
    String value();
  }

  abstract class NamedEntity
  {
    private static final String EXACT_ONE_PARAM = "function '%s' needs 1 argument";
    private static final String EXACT_TWO_PARAM = "function '%s' needs 2 arguments";
    private static final String EXACT_THREE_PARAM = "function '%s' needs 3 arguments";

    protected final String name;

    protected NamedEntity()
    {
      this.name = Preconditions.checkNotNull(getClass().getAnnotation(Named.class).value());
    }

    protected NamedEntity(String name)
    {
      this.name = name;
    }

    public final String name()
    {
      return name;
    }

    public void exactOne(List<Expr> args)
    {
      if (args.size() != 1) {
        throw new IAE(EXACT_ONE_PARAM, name);
      }
    }

    public void exactTwo(List<Expr> args)
    {
      if (args.size() != 2) {
        throw new IAE(EXACT_TWO_PARAM, name);
      }
    }

    public void exactThree(List<Expr> args)
    {
      if (args.size() != 3) {
        throw new IAE(EXACT_THREE_PARAM, name);
      }
    }
  }

  abstract class NamedFactory extends NamedEntity implements Factory
  {
  }
}
