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

import io.loki.common.LokiException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Failure of a worker, propagated out of {@link ProcessingRun#get()}.
 */
public class ProcessingException extends LokiException
{
  private final String partition;

  public ProcessingException(Throwable cause, String partition)
  {
    super(cause, "failed processing partition [%s]: %s", partition, cause.getMessage());
    this.partition = partition;
  }

  public ProcessingException(Throwable cause)
  {
    super(cause, String.valueOf(cause.getMessage()));
    this.partition = null;
  }

  public String getPartition()
  {
    return partition;
  }

  public static RuntimeException wrapIfNeeded(Throwable e)
  {
    if (e instanceof ExecutionException && e.getCause() != null) {
      e = e.getCause();
    }
    if (e instanceof LokiException) {
      return (LokiException) e;
    }
    if (e instanceof CancellationException) {
      return (CancellationException) e;
    }
    return new ProcessingException(e);
  }
}
