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

package io.loki.query.sync;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.metamx.common.logger.Logger;
import io.loki.query.expression.ExpressionHandle;
import io.loki.query.histogram.HistogramRegistry;
import io.loki.query.histogram.RegisteredHistogram;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups the jagged expressions of registered histograms so that expressions filled together are
 * evaluated at one common slot count per record. Two jagged expressions end up in one group when some
 * histogram reads both or when they read a common jagged field. Scalar expressions belong to no group
 * and are broadcast.
 */
public class SyncPlanner
{
  private static final Logger log = new Logger(SyncPlanner.class);

  public static SyncPlan plan(HistogramRegistry registry)
  {
    final List<RegisteredHistogram> histograms = registry.getHistograms();
    final List<ExpressionHandle> handles = registry.getPool().getHandles();
    final UnionFind unionFind = new UnionFind(handles.size());
    final boolean[] used = new boolean[handles.size()];

    for (RegisteredHistogram histogram : histograms) {
      ExpressionHandle first = null;
      for (ExpressionHandle handle : histogram.getHandles()) {
        used[handle.getId()] = true;
        if (handle.isScalar()) {
          continue;
        }
        if (first == null) {
          first = handle;
        } else {
          unionFind.union(first.getId(), handle.getId());
        }
      }
    }

    // expressions reading the same jagged field always agree
    final Map<String, ExpressionHandle> readers = Maps.newHashMap();
    for (ExpressionHandle handle : handles) {
      if (!used[handle.getId()] || handle.isScalar()) {
        continue;
      }
      for (String field : registry.getPool().getCompiled(handle).getSlotFields()) {
        final ExpressionHandle reader = readers.get(field);
        if (reader == null) {
          readers.put(field, handle);
        } else {
          unionFind.union(reader.getId(), handle.getId());
        }
      }
    }

    final Map<Integer, List<ExpressionHandle>> members = new TreeMap<>();
    final List<ExpressionHandle> scalars = Lists.newArrayList();
    for (ExpressionHandle handle : handles) {
      if (!used[handle.getId()]) {
        continue;
      }
      if (handle.isScalar()) {
        scalars.add(handle);
        continue;
      }
      final int root = unionFind.find(handle.getId());
      List<ExpressionHandle> group = members.get(root);
      if (group == null) {
        members.put(root, group = Lists.newArrayList());
      }
      group.add(handle);
    }

    // groups numbered by their lowest member
    final Map<Integer, SyncGroup> groupOfRoot = Maps.newHashMap();
    final List<SyncGroup> groups = Lists.newArrayList();
    for (List<ExpressionHandle> group : sortByFirst(members)) {
      final SyncGroup syncGroup = new SyncGroup(groups.size(), group);
      groups.add(syncGroup);
      groupOfRoot.put(unionFind.find(group.get(0).getId()), syncGroup);
    }

    final SyncGroup[] groupOfHistogram = new SyncGroup[histograms.size()];
    for (RegisteredHistogram histogram : histograms) {
      for (ExpressionHandle handle : histogram.getHandles()) {
        if (!handle.isScalar()) {
          groupOfHistogram[histogram.getIndex()] = groupOfRoot.get(unionFind.find(handle.getId()));
          break;
        }
      }
    }
    final SyncPlan plan = new SyncPlan(groups, scalars, groupOfHistogram, handles.size());
    log.debug("%d histograms planned into %s", histograms.size(), plan);
    return plan;
  }

  private static List<List<ExpressionHandle>> sortByFirst(Map<Integer, List<ExpressionHandle>> members)
  {
    final TreeMap<Integer, List<ExpressionHandle>> sorted = new TreeMap<>();
    for (List<ExpressionHandle> group : members.values()) {
      sorted.put(group.get(0).getId(), group);
    }
    return Lists.newArrayList(sorted.values());
  }
}
