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

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ListenableFuture;
import com.metamx.common.logger.Logger;
import io.loki.concurrent.Execs;
import io.loki.query.histogram.HistogramSet;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a submitted run. Cancelling stops every worker before its next record; what was filled up to
 * that point is still merged and returned by {@link #get()}.
 */
public class ProcessingRun
{
  private static final Logger log = new Logger(ProcessingRun.class);

  private final ListenableFuture<List<HistogramSet>> futures;
  private final AtomicBoolean cancelled;
  private final Stopwatch stopwatch;

  ProcessingRun(ListenableFuture<List<HistogramSet>> futures, AtomicBoolean cancelled, Stopwatch stopwatch)
  {
    this.futures = futures;
    this.cancelled = cancelled;
    this.stopwatch = stopwatch;
  }

  public void cancel()
  {
    if (cancelled.compareAndSet(false, true)) {
      log.info("Cancelling run, workers stop before their next record");
    }
  }

  public boolean isCancelRequested()
  {
    return cancelled.get();
  }

  public boolean isDone()
  {
    return futures.isDone();
  }

  /**
   * Waits for every worker and merges their results.
   *
   * @throws ProcessingException if a worker failed
   */
  public HistogramSet get()
  {
    final List<HistogramSet> partials;
    try {
      partials = futures.get();
    }
    catch (InterruptedException e) {
      cancel();
      Execs.cancelQuietly(futures);
      Thread.currentThread().interrupt();
      throw ProcessingException.wrapIfNeeded(e);
    }
    catch (ExecutionException e) {
      cancel();
      throw ProcessingException.wrapIfNeeded(e.getCause());
    }
    final HistogramSet merged = HistogramSet.mergeAll(partials);
    log.info("Processing time: %,d msec, %s", stopwatch.elapsed(TimeUnit.MILLISECONDS), merged.getSummary());
    if (merged.getSummary().getCardinalitySkipped() > 0 || merged.getSummary().getEvaluationSkipped() > 0) {
      log.warn("Records skipped per histogram: %s", merged.getSummary().getSkippedPerHistogram());
    }
    return merged;
  }
}
