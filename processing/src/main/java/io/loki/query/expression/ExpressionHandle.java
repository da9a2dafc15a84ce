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

/**
 * Identity of one distinct expression text inside an {@link ExpressionPool}. Ids are dense and assigned
 * in interning order, so they can index per record evaluation arrays.
 */
public final class ExpressionHandle implements Comparable<ExpressionHandle>
{
  private final int id;
  private final String text;
  private final boolean scalar;

  ExpressionHandle(int id, String text, boolean scalar)
  {
    this.id = id;
    this.text = text;
    this.scalar = scalar;
  }

  public int getId()
  {
    return id;
  }

  public String getText()
  {
    return text;
  }

  /**
   * @return true if the expression yields exactly one value per record
   */
  public boolean isScalar()
  {
    return scalar;
  }

  @Override
  public int compareTo(ExpressionHandle o)
  {
    return Integer.compare(id, o.id);
  }

  @Override
  public String toString()
  {
    return "#" + id + "[" + text + "]";
  }
}
