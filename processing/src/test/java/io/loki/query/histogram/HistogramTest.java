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

package io.loki.query.histogram;

import io.loki.common.MergeShapeMismatchException;
import org.junit.Assert;
import org.junit.Test;

public class HistogramTest
{
  private static Histogram histogram2D()
  {
    return new Histogram("h2", new double[][]{{0, 1, 2}, {0, 10}});
  }

  @Test
  public void testCells()
  {
    final Histogram histogram = histogram2D();
    Assert.assertEquals(2, histogram.getDimensionality());
    Assert.assertEquals(2, histogram.getNumBins(0));
    Assert.assertEquals(1, histogram.getNumBins(1));
    Assert.assertEquals(4 * 3, histogram.getNumCells());
    Assert.assertEquals(histogram.cell(2, 1), histogram.locate(1.5, 5));
    Assert.assertEquals(histogram.cell(0, 2), histogram.locate(-1, 10));
    Assert.assertEquals(histogram.cell(3, 0), histogram.locate(2, -3));
  }

  @Test
  public void testFill()
  {
    final Histogram histogram = histogram2D();
    histogram.fill(histogram.locate(0.5, 1), 2.0);
    histogram.fill(histogram.locate(0.5, 2), 3.0);
    histogram.fill(histogram.locate(5, 5), 1.0);

    Assert.assertEquals(5.0, histogram.getSumW(1, 1), 0.0);
    Assert.assertEquals(13.0, histogram.getSumW2(1, 1), 0.0);
    Assert.assertEquals(Math.sqrt(13.0), histogram.getError(1, 1), 0.0);
    Assert.assertEquals(2, histogram.getEntries(1, 1));
    Assert.assertEquals(1, histogram.getEntries(3, 1));
    Assert.assertEquals(3, histogram.getTotalEntries());
    Assert.assertEquals(5.0, histogram.getIntegral(), 0.0);
  }

  @Test
  public void testScale()
  {
    final Histogram histogram = histogram2D();
    histogram.fill(histogram.locate(0.5, 1), 2.0);
    histogram.scale(3.0);
    Assert.assertEquals(6.0, histogram.getSumW(1, 1), 0.0);
    Assert.assertEquals(36.0, histogram.getSumW2(1, 1), 0.0);
    Assert.assertEquals(1, histogram.getEntries(1, 1));
  }

  @Test
  public void testAdd()
  {
    final Histogram lhs = histogram2D();
    final Histogram rhs = histogram2D();
    lhs.fill(lhs.locate(0.5, 1), 1.0);
    rhs.fill(rhs.locate(0.5, 1), 2.0);
    rhs.fill(rhs.locate(1.5, 1), 1.0);

    final Histogram copy = lhs.copy();
    lhs.add(rhs);
    Assert.assertEquals(3.0, lhs.getSumW(1, 1), 0.0);
    Assert.assertEquals(5.0, lhs.getSumW2(1, 1), 0.0);
    Assert.assertEquals(2, lhs.getEntries(1, 1));
    Assert.assertEquals(1, lhs.getEntries(2, 1));
    Assert.assertEquals(1, copy.getTotalEntries());
  }

  @Test(expected = MergeShapeMismatchException.class)
  public void testAddDifferentEdges()
  {
    histogram2D().add(new Histogram("h2", new double[][]{{0, 1, 3}, {0, 10}}));
  }

  @Test(expected = MergeShapeMismatchException.class)
  public void testAddDifferentName()
  {
    histogram2D().add(new Histogram("other", new double[][]{{0, 1, 2}, {0, 10}}));
  }

  @Test
  public void testStateLengthChecked()
  {
    final double[][] edges = {{0, 1, 2}};
    final Histogram restored = new Histogram("h", edges, new double[4], new double[4], new long[4]);
    Assert.assertEquals(4, restored.getNumCells());
    try {
      new Histogram("h", edges, new double[4], new double[4], new long[3]);
      Assert.fail();
    }
    catch (IllegalArgumentException e) {
      Assert.assertEquals("histogram [h] needs 4 cells but 3 given", e.getMessage());
    }
    try {
      new Histogram("h", edges, new double[5], null, null);
      Assert.fail();
    }
    catch (IllegalArgumentException e) {
      Assert.assertEquals("histogram [h] needs 4 cells but 5 given", e.getMessage());
    }
  }
}
