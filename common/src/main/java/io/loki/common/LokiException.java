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
 * Base of every error raised while compiling expressions, registering histograms, filling or merging them.
 */
public class LokiException extends RuntimeException
{
  public LokiException(String formatText, Object... arguments)
  {
    super(format(formatText, arguments));
  }

  public LokiException(Throwable cause, String formatText, Object... arguments)
  {
    super(format(formatText, arguments), cause);
  }

  static String format(String formatText, Object... arguments)
  {
    return arguments == null || arguments.length == 0 ? formatText : String.format(formatText, arguments);
  }
}
