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

import java.util.Collection;

/**
 * One event of input. Scalar fields hold exactly one value, jagged fields a variable number of values
 * (one per element of a collection) which may differ from record to record.
 */
public interface Record
{
  Collection<String> getFields();

  /**
   * @return true if the field holds a sequence of values in this record
   */
  boolean isJagged(String field);

  /**
   * Returns the value of a scalar field.
   */
  double getDouble(String field);

  /**
   * Returns the number of values the field holds in this record, 1 for scalar fields.
   */
  int size(String field);

  /**
   * Returns the value at position {@code index} of a jagged field.
   */
  double getDouble(String field, int index);
}
