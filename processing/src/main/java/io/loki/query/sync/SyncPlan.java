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

import com.google.common.collect.ImmutableList;
import io.loki.query.expression.ExpressionHandle;
import io.loki.query.histogram.RegisteredHistogram;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Result of {@link SyncPlanner#plan}: the sync groups, the scalar expressions broadcast into them and the
 * group every histogram fills from.
 */
public class SyncPlan
{
  private final List<SyncGroup> groups;
  private final List<ExpressionHandle> scalars;
  private final SyncGroup[] groupOfHistogram;
  private final int numHandles;

  SyncPlan(List<SyncGroup> groups, List<ExpressionHandle> scalars, SyncGroup[] groupOfHistogram, int numHandles)
  {
    this.groups = ImmutableList.copyOf(groups);
    this.scalars = ImmutableList.copyOf(scalars);
    this.groupOfHistogram = groupOfHistogram;
    this.numHandles = numHandles;
  }

  public List<SyncGroup> getGroups()
  {
    return groups;
  }

  public List<ExpressionHandle> getScalars()
  {
    return scalars;
  }

  /**
   * @return the group of the histogram, null if it reads scalar expressions only
   */
  @Nullable
  public SyncGroup groupOf(RegisteredHistogram histogram)
  {
    return groupOfHistogram[histogram.getIndex()];
  }

  int getNumHandles()
  {
    return numHandles;
  }

  @Override
  public String toString()
  {
    return "SyncPlan{groups=" + groups + ", scalars=" + scalars + '}';
  }
}
