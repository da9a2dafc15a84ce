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

package io.loki.common;

/**
 * Jagged values which should be paired slot by slot have different lengths in one record.
 * Recoverable: only the contribution of that record is dropped.
 */
public class CardinalityMismatchException extends LokiException
{
  private final int expected;
  private final int actual;

  public CardinalityMismatchException(String expression, int expected, int actual)
  {
    super("'%s' yields %d values where %d were expected", expression, actual, expected);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected()
  {
    return expected;
  }

  public int getActual()
  {
    return actual;
  }
}
