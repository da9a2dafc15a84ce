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

import java.util.List;

/**
 * Jagged expressions that must yield the same number of values in every record. Members are ordered by
 * handle id; the first one that evaluates decides the count for the record.
 */
public class SyncGroup
{
  private final int id;
  private final List<ExpressionHandle> members;

  SyncGroup(int id, List<ExpressionHandle> members)
  {
    this.id = id;
    this.members = ImmutableList.copyOf(members);
  }

  public int getId()
  {
    return id;
  }

  public List<ExpressionHandle> getMembers()
  {
    return members;
  }

  public boolean contains(ExpressionHandle handle)
  {
    return members.contains(handle);
  }

  @Override
  public String toString()
  {
    return "SyncGroup#" + id + members;
  }
}
