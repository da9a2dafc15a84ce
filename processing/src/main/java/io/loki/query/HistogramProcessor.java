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
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.metamx.common.logger.Logger;
import io.loki.concurrent.Execs;
import io.loki.data.Record;
import io.loki.data.Schema;
import io.loki.query.histogram.HistogramDefinition;
import io.loki.query.histogram.HistogramRegistry;
import io.loki.query.histogram.HistogramSet;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fills histograms from partitions of the input in parallel and merges the partial results.
 * <p>
 * Definitions are validated when the processor is created. Every worker then builds its own expression pool,
 * sync plan and histogram state, so nothing mutable is shared while records are read.
 */
public class HistogramProcessor
{
  private static final Logger log = new Logger(HistogramProcessor.class);

  private final Schema schema;
  private final List<HistogramDefinition> definitions;
  private final ProcessorConfig config;
  private final HistogramRegistry validated;

  public HistogramProcessor(Schema schema, List<HistogramDefinition> definitions)
  {
    this(schema, definitions, new ProcessorConfig());
  }

  /**
   * @throws io.loki.common.InvalidDefinitionException on a malformed definition
   * @throws io.loki.common.CompileException            on an expression which cannot be compiled
   */
  public HistogramProcessor(Schema schema, List<HistogramDefinition> definitions, ProcessorConfig config)
  {
    this.schema = Preconditions.checkNotNull(schema, "schema");
    this.definitions = ImmutableList.copyOf(definitions);
    this.config = config == null ? new ProcessorConfig() : config;
    this.validated = new HistogramRegistry(schema).registerAll(this.definitions);
    if (validated.getDuplicates() > 0) {
      log.info("%d duplicate histogram definitions are filled once", validated.getDuplicates());
    }
  }

  public int getNumHistograms()
  {
    return validated.size();
  }

  public HistogramSet process(List<Partition> partitions)
  {
    return submit(partitions).get();
  }

  public ProcessingRun submit(List<Partition> partitions)
  {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final AtomicBoolean cancelled = new AtomicBoolean();
    final Double fraction = config.getEffectiveEventFraction();
    if (partitions.isEmpty()) {
      log.info("Nothing to process");
      final HistogramSet empty = new HistogramAccumulator(validated).toHistogramSet(false);
      return new ProcessingRun(
          Futures.<List<HistogramSet>>immediateFuture(Collections.singletonList(empty)), cancelled, stopwatch
      );
    }
    final int threads = Math.min(
        config.getNumThreads(Runtime.getRuntime().availableProcessors()),
        partitions.size()
    );
    logSummary(partitions, fraction, threads);

    final ListeningExecutorService exec = Execs.listening(threads, "loki-worker-%d");
    try {
      final List<ListenableFuture<HistogramSet>> futures = Lists.newArrayList();
      for (final Partition partition : partitions) {
        futures.add(
            exec.submit(
                new Callable<HistogramSet>()
                {
                  @Override
                  public HistogramSet call() throws Exception
                  {
                    try {
                      return processPartition(partition, fraction, cancelled);
                    }
                    catch (Exception e) {
                      log.error(e, "Exception while processing partition [%s]", partition.getName());
                      throw new ProcessingException(e, partition.getName());
                    }
                  }
                }
            )
        );
      }
      return new ProcessingRun(Futures.allAsList(futures), cancelled, stopwatch);
    }
    finally {
      // submitted workers still run to the end
      exec.shutdown();
    }
  }

  HistogramSet processPartition(Partition partition, Double fraction, AtomicBoolean cancelled) throws IOException
  {
    final HistogramRegistry registry = new HistogramRegistry(schema).registerAll(definitions);
    final HistogramAccumulator accumulator = new HistogramAccumulator(registry);
    final long limit = limitOf(partition, fraction);

    boolean stopped = false;
    try (RecordSource source = partition.getSource()) {
      loop:
      for (List<Record> batch = source.nextBatch(); batch != null; batch = source.nextBatch()) {
        for (Record record : batch) {
          if (cancelled.get()) {
            stopped = true;
            break loop;
          }
          if (accumulator.getProcessed() >= limit) {
            break loop;
          }
          accumulator.add(record);
        }
      }
    }
    final HistogramSet result = accumulator.toHistogramSet(stopped);
    final Double scale = scaleOf(partition, fraction);
    if (scale != null) {
      result.scale(scale);
    }
    log.debug(
        "Partition [%s] done: %s%s", partition.getName(), result.getSummary(), scale == null ? "" : ", scaled by " + scale
    );
    return result;
  }

  private static long limitOf(Partition partition, Double fraction)
  {
    if (fraction == null || partition.getNumRecords() == null) {
      return Long.MAX_VALUE;
    }
    return (long) (fraction * partition.getNumRecords());
  }

  private Double scaleOf(Partition partition, Double fraction)
  {
    if (config.isNoWeight() || partition.getScale() == null) {
      return null;
    }
    if (fraction == null || partition.getNumRecords() == null) {
      return partition.getScale();
    }
    return partition.getScale() / fraction;
  }

  private void logSummary(List<Partition> partitions, Double fraction, int threads)
  {
    long known = 0;
    int unknown = 0;
    for (Partition partition : partitions) {
      if (partition.getNumRecords() == null) {
        unknown++;
      } else {
        known += partition.getNumRecords();
      }
    }
    log.info(
        "Job summary: %d partitions, %,d known records%s, %d histograms to fill (%d duplicates), %d threads",
        partitions.size(), known, unknown > 0 ? " (" + unknown + " partitions of unknown size)" : "",
        validated.size(), validated.getDuplicates(), threads
    );
    log.info("Using %.1f%% of available events", fraction == null ? 100d : fraction * 100);
    if (fraction != null && unknown > 0) {
      log.warn("Event fraction is not applied to %d partitions of unknown size", unknown);
    }
  }
}
