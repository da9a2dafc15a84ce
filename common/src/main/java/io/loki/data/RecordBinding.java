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

package io.loki.data;

import io.loki.math.expr.Expr;

/**
 * Exposes a record to expressions, optionally positioned at one slot of its jagged fields.
 */
public class RecordBinding implements Expr.NumericBinding
{
  private final Record record;
  private int slot;

  public RecordBinding(Record record)
  {
    this(record, NO_SLOT);
  }

  public RecordBinding(Record record, int slot)
  {
    this.record = record;
    this.slot = slot;
  }

  public Record getRecord()
  {
    return record;
  }

  public RecordBinding setSlot(int slot)
  {
    this.slot = slot;
    return this;
  }

  @Override
  public double get(String name)
  {
    return record.getDouble(name);
  }

  @Override
  public double get(String name, int index)
  {
    return record.getDouble(name, index);
  }

  @Override
  public int size(String name)
  {
    return record.size(name);
  }

  @Override
  public int slot()
  {
    return slot;
  }

  @Override
  public Expr.NumericBinding atSlot(int slot)
  {
    return new RecordBinding(record, slot);
  }
}
