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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.metamx.common.logger.Logger;
import io.loki.concurrent.Execs;

/**
 */
public class ProcessorConfig
{
  private static final Logger log = new Logger(ProcessorConfig.class);

  public static final double MIN_EVENT_FRACTION = 0.001;

  @JsonProperty
  private Integer numThreads;

  @JsonProperty
  private Double eventFraction;

  @JsonProperty
  private boolean noWeight;

  public Integer getNumThreads()
  {
    return numThreads;
  }

  public void setNumThreads(Integer numThreads)
  {
    this.numThreads = numThreads;
  }

  public int getNumThreads(int processors)
  {
    return Execs.resolveParallelism(numThreads, processors);
  }

  public Double getEventFraction()
  {
    return eventFraction;
  }

  public void setEventFraction(Double eventFraction)
  {
    this.eventFraction = eventFraction;
  }

  /**
   * Fraction of records to process, rounded to three decimals and at least {@link #MIN_EVENT_FRACTION}.
   * Null when every record is processed.
   */
  @JsonIgnore
  public Double getEffectiveEventFraction()
  {
    return discretize(eventFraction);
  }

  public boolean isNoWeight()
  {
    return noWeight;
  }

  public void setNoWeight(boolean noWeight)
  {
    this.noWeight = noWeight;
  }

  static Double discretize(Double eventFraction)
  {
    if (eventFraction == null) {
      return null;
    }
    Preconditions.checkArgument(
        eventFraction > 0 && eventFraction <= 1, "event fraction should be in (0, 1] but %s", eventFraction
    );
    final double discretized = Math.max(Math.round(eventFraction * 1000) / 1000d, MIN_EVENT_FRACTION);
    if (discretized != eventFraction) {
      log.warn("Discretizing event fraction: %s -> %s", eventFraction, discretized);
    }
    return discretized;
  }

  @Override
  public String toString()
  {
    return "ProcessorConfig{" +
           "numThreads=" + numThreads +
           ", eventFraction=" + eventFraction +
           ", noWeight=" + noWeight +
           '}';
  }
}
