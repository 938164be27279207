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

import com.google.common.base.Function;
import com.google.common.collect.Iterables;
import org.gramkit.common.IndexedPair;
import org.gramkit.common.PairCombiner;
import org.gramkit.kernels.KernelFunction;
import org.gramkit.kernels.KernelMatrixConfig;
import org.gramkit.math.MatrixBlock;
import org.gramkit.math.PartitionedMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the cross kernel matrix between two datasets as a {@link PartitionedMatrix}. Each dataset
 * is partitioned on its own and every pair of row and column blocks is computed.
 */
public final class PartitionedCrossKernelBuilder {
  private static final Logger log = LoggerFactory.getLogger(PartitionedCrossKernelBuilder.class);

  private PartitionedCrossKernelBuilder() {
  }

  public static <T> PartitionedMatrix build(List<T> data1, List<T> data2, KernelFunction<? super T> kernel,
                                            KernelMatrixConfig config) {
    return build(data1, data2, config.getRowBlockSize(), config.getColBlockSize(), kernel,
        config.blockExecutor());
  }

  public static <T> PartitionedMatrix build(List<T> data1, List<T> data2, int numElementsPerRowBlock,
                                            int numElementsPerColBlock, KernelFunction<? super T> kernel) {
    return build(data1, data2, numElementsPerRowBlock, numElementsPerColBlock, kernel, BlockExecutor.lazy());
  }

  public static <T> PartitionedMatrix build(List<T> data1, List<T> data2, int numElementsPerRowBlock,
                                            int numElementsPerColBlock, final KernelFunction<? super T> kernel,
                                            BlockExecutor executor) {
    long rows = data1.size();
    long cols = data2.size();

    log.info("Constructing cross partitioned kernel matrix.");
    log.info("Dimension: {} x {}", rows, cols);

    long numRowBlocks = BlockPartitioner.numBlocks(rows, numElementsPerRowBlock);
    long numColBlocks = BlockPartitioner.numBlocks(cols, numElementsPerColBlock);
    log.info("Blocks: {} x {}", numRowBlocks, numColBlocks);

    log.info("~~~~~~~~~~~~~~~~~~~~~~~");
    log.info("Constructing Partitions");
    Iterable<KernelBlockTask<T>> tasks = Iterables.transform(
        PairCombiner.combine(BlockPartitioner.partition(data1, numElementsPerRowBlock),
            BlockPartitioner.partition(data2, numElementsPerColBlock)),
        new Function<IndexedPair<BlockGroup<T>, BlockGroup<T>>, KernelBlockTask<T>>() {
          @Override
          public KernelBlockTask<T> apply(IndexedPair<BlockGroup<T>, BlockGroup<T>> pair) {
            return KernelBlockTask.cross(pair.first().value(), pair.second().value(), kernel);
          }
        });
    Iterable<MatrixBlock> blocks = executor.execute(tasks);
    return new PartitionedMatrix(blocks, rows, cols, numRowBlocks, numColBlocks);
  }
}
