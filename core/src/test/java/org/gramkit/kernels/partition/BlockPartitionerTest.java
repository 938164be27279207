/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gramkit.kernels.partition;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.gramkit.common.GramkitTestCase;
import org.junit.Test;

import java.util.List;

public final class BlockPartitionerTest extends GramkitTestCase {

  @Test
  public void testRemainderBlock() {
    List<BlockGroup<Double>> groups = BlockPartitioner.partition(ImmutableList.of(1.0, 2.0, 3.0), 2);
    assertEquals(2, groups.size());
    assertEquals(0, groups.get(0).index());
    assertEquals(ImmutableList.of(1.0, 2.0), groups.get(0).elements());
    assertEquals(1, groups.get(1).index());
    assertEquals(ImmutableList.of(3.0), groups.get(1).elements());
  }

  @Test
  public void testConcatenationPreservesOrder() {
    List<Integer> data = Lists.newArrayList();
    for (int i = 0; i < 23; i++) {
      data.add(i * 7 % 23);
    }
    for (int blockSize = 1; blockSize <= 25; blockSize++) {
      List<BlockGroup<Integer>> groups = BlockPartitioner.partition(data, blockSize);
      assertEquals(BlockPartitioner.numBlocks(data.size(), blockSize), groups.size());
      assertEquals((data.size() + blockSize - 1) / blockSize, groups.size());

      List<Integer> concatenated = Lists.newArrayList();
      for (int g = 0; g < groups.size(); g++) {
        BlockGroup<Integer> group = groups.get(g);
        assertEquals(g, group.index());
        if (g < groups.size() - 1) {
          assertEquals(blockSize, group.size());
        } else {
          assertTrue(group.size() > 0 && group.size() <= blockSize);
        }
        concatenated.addAll(group.elements());
      }
      assertEquals(data, concatenated);
    }
  }

  @Test
  public void testNumBlocks() {
    assertEquals(0, BlockPartitioner.numBlocks(0, 3));
    assertEquals(1, BlockPartitioner.numBlocks(3, 3));
    assertEquals(2, BlockPartitioner.numBlocks(4, 3));
    assertEquals(5000000000L, BlockPartitioner.numBlocks(10000000000L, 2));
  }

  @Test
  public void testEmptyDataset() {
    List<Double> empty = ImmutableList.of();
    assertTrue(BlockPartitioner.partition(empty, 4).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroBlockSize() {
    BlockPartitioner.partition(ImmutableList.of(1.0), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeBlockSize() {
    BlockPartitioner.numBlocks(10, -1);
  }
}
