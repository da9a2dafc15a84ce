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

package io.loki.concurrent;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.metamx.common.logger.Logger;

import javax.annotation.Nullable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

/**
 */
public class Execs
{
  private static final Logger log = new Logger(Execs.class);

  public static ExecutorService multiThreaded(int threads, String nameFormat)
  {
    return Executors.newFixedThreadPool(threads, makeThreadFactory(nameFormat));
  }

  public static ListeningExecutorService listening(int threads, String nameFormat)
  {
    return MoreExecutors.listeningDecorator(multiThreaded(threads, nameFormat));
  }

  public static ThreadFactory makeThreadFactory(String nameFormat)
  {
    return new ThreadFactoryBuilder().setDaemon(true).setNameFormat(nameFormat).build();
  }

  /**
   * Resolves the requested parallelism against the available processors. Null means at most two threads,
   * a negative value leaves that many processors free, a positive one is capped by the processors.
   */
  public static int resolveParallelism(@Nullable Integer requested, int processors)
  {
    if (requested == null || requested == 0) {
      return Math.max(1, Math.min(2, processors));
    } else if (requested < 0) {
      return Math.max(1, processors + requested);
    }
    return Math.max(1, Math.min(requested, processors));
  }

  public static void cancelQuietly(@Nullable Future<?> future)
  {
    if (future != null && !future.isDone()) {
      try {
        future.cancel(true);
      }
      catch (Exception e) {
        log.warn(e, "failed to cancel %s", future);
      }
    }
  }
}
