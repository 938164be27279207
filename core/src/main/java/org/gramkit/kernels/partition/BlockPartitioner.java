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

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * Splits a dataset into consecutive {@link BlockGroup}s of a target size. Every group holds
 * {@code blockSize} points except possibly the last, which holds the remainder.
 */
public final class BlockPartitioner {

  private BlockPartitioner() {
  }

  public static <T> List<BlockGroup<T>> partition(List<T> data, int blockSize) {
    Preconditions.checkArgument(blockSize > 0, "Block size must be positive: %s", blockSize);
    List<List<T>> chunks = Lists.partition(data, blockSize);
    List<BlockGroup<T>> groups = Lists.newArrayListWithCapacity(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      groups.add(new BlockGroup<T>(i, chunks.get(i)));
    }
    return groups;
  }

  /**
   * @return {@code ceil(length / blockSize)}
   */
  public static long numBlocks(long length, int blockSize) {
    Preconditions.checkArgument(blockSize > 0, "Block size must be positive: %s", blockSize);
    Preconditions.checkArgument(length >= 0, "Negative length: %s", length);
    return (length + blockSize - 1) / blockSize;
  }
}
