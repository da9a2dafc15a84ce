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
import com.google.common.collect.ImmutableList;
import io.loki.data.Record;

import java.util.List;

public class RecordSources
{
  public static RecordSource of(List<? extends Record> records)
  {
    return of(records, 1024);
  }

  /**
   * In-memory source handing out the records in batches of at most {@code batchSize}.
   */
  public static RecordSource of(final List<? extends Record> records, final int batchSize)
  {
    Preconditions.checkArgument(batchSize > 0, "batch size should be positive");
    final List<Record> copy = ImmutableList.copyOf(records);
    return new RecordSource()
    {
      private int position;

      @Override
      public List<Record> nextBatch()
      {
        if (position >= copy.size()) {
          return null;
        }
        final int end = Math.min(copy.size(), position + batchSize);
        final List<Record> batch = copy.subList(position, end);
        position = end;
        return batch;
      }

      @Override
      public void close()
      {
        position = copy.size();
      }
    };
  }
}
