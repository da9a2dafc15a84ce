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

package io.loki.query;

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;

/**
 * Disjoint part of the input, processed by one worker with its own state.
 */
public class Partition
{
  private final String name;
  private final RecordSource source;
  private final Long numRecords;
  private final Double scale;

  public Partition(String name, RecordSource source)
  {
    this(name, source, null, null);
  }

  /**
   * @param numRecords number of records in the source if known, required to process a fraction of them
   * @param scale      factor applied to the filled weights, none if null
   */
  public Partition(String name, RecordSource source, @Nullable Long numRecords, @Nullable Double scale)
  {
    this.name = Preconditions.checkNotNull(name, "name");
    this.source = Preconditions.checkNotNull(source, "source");
    this.numRecords = numRecords;
    this.scale = scale;
  }

  public String getName()
  {
    return name;
  }

  public RecordSource getSource()
  {
    return source;
  }

  @Nullable
  public Long getNumRecords()
  {
    return numRecords;
  }

  @Nullable
  public Double getScale()
  {
    return scale;
  }

  @Override
  public String toString()
  {
    return "Partition{" +
           "name='" + name + '\'' +
           (numRecords == null ? "" : ", numRecords=" + numRecords) +
           (scale == null ? "" : ", scale=" + scale) +
           '}';
  }
}
