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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.metamx.common.logger.Logger;
import io.loki.common.CompileException;
import io.loki.data.Record;
import io.loki.data.TypeResolver;
import io.loki.math.expr.Parser;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;
import java.util.Map;

/**
 * Owns the compiled form of every distinct expression text. Identical texts share one handle and are
 * compiled once; texts that failed to compile keep failing with the same error.
 * <p>
 * Not thread safe: every worker owns its own pool.
 */
public class ExpressionPool
{
  private static final Logger log = new Logger(ExpressionPool.class);

  private final TypeResolver resolver;
  private final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
  private final List<ExpressionHandle> handles = Lists.newArrayList();
  private final List<CompiledExpression> compiled = Lists.newArrayList();
  private final Map<String, CompileException> failures = Maps.newHashMap();

  private int compileCount;

  public ExpressionPool(TypeResolver resolver)
  {
    this.resolver = Preconditions.checkNotNull(resolver, "resolver");
    this.ids.defaultReturnValue(-1);
  }

  /**
   * Returns the handle of the expression, compiling it on first use.
   *
   * @throws CompileException if the text cannot be parsed or refers to fields unknown to the schema
   */
  public ExpressionHandle intern(String text)
  {
    Preconditions.checkNotNull(text, "expression should not be null");
    final int id = ids.getInt(text);
    if (id >= 0) {
      return handles.get(id);
    }
    final CompileException failure = failures.get(text);
    if (failure != null) {
      throw failure;
    }
    final CompiledExpression expression;
    try {
      compileCount++;
      expression = new CompiledExpression(text, Parser.parse(text, resolver));
    }
    catch (CompileException e) {
      failures.put(text, e);
      throw e;
    }
    final ExpressionHandle handle = new ExpressionHandle(handles.size(), text, expression.isScalar());
    ids.put(text, handle.getId());
    handles.add(handle);
    compiled.add(expression);
    log.debug("compiled %s, slot fields %s", handle, expression.getSlotFields());
    return handle;
  }

  public CompiledExpression getCompiled(ExpressionHandle handle)
  {
    return compiled.get(checkOwned(handle).getId());
  }

  public double[] evaluate(ExpressionHandle handle, Record record)
  {
    return getCompiled(handle).evaluate(record);
  }

  public List<ExpressionHandle> getHandles()
  {
    return ImmutableList.copyOf(handles);
  }

  public int size()
  {
    return handles.size();
  }

  /**
   * number of compilations performed, failed ones included
   */
  public int getCompileCount()
  {
    return compileCount;
  }

  private ExpressionHandle checkOwned(ExpressionHandle handle)
  {
    Preconditions.checkArgument(
        handle.getId() < handles.size() && handles.get(handle.getId()) == handle,
        "%s is not interned in this pool", handle
    );
    return handle;
  }
}
