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

package io.loki.query.histogram;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.metamx.common.logger.Logger;
import io.loki.common.InvalidDefinitionException;
import io.loki.data.Schema;
import io.loki.query.expression.ExpressionHandle;
import io.loki.query.expression.ExpressionPool;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates histogram definitions and binds them to the expressions of a pool. Everything is checked here,
 * before any record is read, so a run either starts with a valid configuration or does not start.
 */
public class HistogramRegistry
{
  private static final Logger log = new Logger(HistogramRegistry.class);

  private final Schema schema;
  private final ExpressionPool pool;
  private final Map<String, RegisteredHistogram> histograms = Maps.newLinkedHashMap();

  private int duplicates;

  public HistogramRegistry(Schema schema)
  {
    this(schema, new ExpressionPool(schema));
  }

  public HistogramRegistry(Schema schema, ExpressionPool pool)
  {
    this.schema = Preconditions.checkNotNull(schema, "schema");
    this.pool = Preconditions.checkNotNull(pool, "pool");
  }

  public Schema getSchema()
  {
    return schema;
  }

  public ExpressionPool getPool()
  {
    return pool;
  }

  public HistogramRegistry registerAll(Iterable<HistogramDefinition> definitions)
  {
    for (HistogramDefinition definition : definitions) {
      register(definition);
    }
    return this;
  }

  /**
   * Registers the definition, returning the existing registration for an identical definition.
   *
   * @throws InvalidDefinitionException if the definition is malformed or its name is taken by a different one
   * @throws io.loki.common.CompileException if one of its expressions cannot be compiled
   */
  public RegisteredHistogram register(HistogramDefinition definition)
  {
    Preconditions.checkNotNull(definition, "definition");
    final String name = definition.getIdentity();
    final RegisteredHistogram registered = histograms.get(name);
    if (registered != null) {
      if (!registered.getDefinition().equals(definition)) {
        throw new InvalidDefinitionException(name, "another histogram is already registered with the same name");
      }
      duplicates++;
      log.debug("histogram [%s] is registered more than once", name);
      return registered;
    }
    final List<Axis> axes = definition.getAxes();
    if (axes == null || axes.isEmpty() || axes.size() > HistogramDefinition.MAX_DIMENSIONALITY) {
      throw new InvalidDefinitionException(
          name, "needs 1 to %d axes but %d given",
          HistogramDefinition.MAX_DIMENSIONALITY, axes == null ? 0 : axes.size()
      );
    }
    if (definition.getDimensionality() != axes.size()) {
      throw new InvalidDefinitionException(
          name, "dimensionality %d does not match %d axis expressions", definition.getDimensionality(), axes.size()
      );
    }
    final List<ExpressionHandle> axisHandles = Lists.newArrayList();
    for (int i = 0; i < axes.size(); i++) {
      final Axis axis = axes.get(i);
      validateEdges(name, i, axis.getEdges());
      axisHandles.add(intern(name, "axis " + i, axis.getExpression()));
    }
    final ExpressionHandle selection = internOptional(name, "selection", definition.getSelection());
    final ExpressionHandle weight = internOptional(name, "weight", definition.getWeight());

    final RegisteredHistogram histogram = new RegisteredHistogram(
        histograms.size(), name, definition, axisHandles, selection, weight
    );
    validateCollections(histogram);
    histograms.put(name, histogram);
    return histogram;
  }

  public List<RegisteredHistogram> getHistograms()
  {
    return ImmutableList.copyOf(histograms.values());
  }

  public RegisteredHistogram getHistogram(String name)
  {
    return histograms.get(name);
  }

  public int size()
  {
    return histograms.size();
  }

  /**
   * number of registrations collapsed onto an identical, earlier one
   */
  public int getDuplicates()
  {
    return duplicates;
  }

  private ExpressionHandle internOptional(String name, String role, String expression)
  {
    return expression == null ? null : intern(name, role, expression);
  }

  private ExpressionHandle intern(String name, String role, String expression)
  {
    if (Strings.isNullOrEmpty(expression) || expression.trim().isEmpty()) {
      throw new InvalidDefinitionException(name, "%s expression is empty", role);
    }
    return pool.intern(expression);
  }

  private static void validateEdges(String name, int axis, double[] edges)
  {
    if (edges == null || edges.length < 2) {
      throw new InvalidDefinitionException(name, "axis %d needs at least two bin edges", axis);
    }
    for (int i = 0; i < edges.length; i++) {
      if (Double.isNaN(edges[i]) || Double.isInfinite(edges[i])) {
        throw new InvalidDefinitionException(name, "axis %d has non-finite edge %s", axis, edges[i]);
      }
      if (i > 0 && edges[i] <= edges[i - 1]) {
        throw new InvalidDefinitionException(
            name, "bin edges of axis %d are not strictly increasing at %d (%s <= %s)", axis, i, edges[i], edges[i - 1]
        );
      }
    }
  }

  // jagged fields of different declared collections can never be paired slot by slot
  private void validateCollections(RegisteredHistogram histogram)
  {
    final Set<String> collections = Sets.newTreeSet();
    for (ExpressionHandle handle : histogram.getHandles()) {
      for (String field : pool.getCompiled(handle).getSlotFields()) {
        final String collection = schema.collectionOf(field);
        if (collection != null) {
          collections.add(collection);
        }
      }
    }
    if (collections.size() > 1) {
      throw new InvalidDefinitionException(
          histogram.getName(), "mixes jagged fields of unrelated collections %s", collections
      );
    }
  }
}
