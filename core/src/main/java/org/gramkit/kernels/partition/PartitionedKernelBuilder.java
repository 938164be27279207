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
import org.gramkit.math.PartitionedPSDMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the kernel matrix of a dataset as a {@link PartitionedPSDMatrix}.
 *
 * The dataset is cut into blocks of {@code numElementsPerRowBlock} points and only the block pairs
 * on or below the diagonal of the block grid are computed. Diagonal blocks are built with
 * {@link org.gramkit.kernels.DenseKernelBuilder}, the others with
 * {@link org.gramkit.kernels.CrossKernelBuilder}.
 */
public final class PartitionedKernelBuilder {
  private static final Logger log = LoggerFactory.getLogger(PartitionedKernelBuilder.class);

  private PartitionedKernelBuilder() {
  }

  public static <T> PartitionedPSDMatrix build(List<T> data, KernelFunction<? super T> kernel,
                                               KernelMatrixConfig config) {
    return build(data, data.size(), config.getRowBlockSize(), config.getColBlockSize(), kernel,
        config.blockExecutor());
  }

  public static <T> PartitionedPSDMatrix build(List<T> data, long length, int numElementsPerRowBlock,
                                               int numElementsPerColBlock, KernelFunction<? super T> kernel) {
    return build(data, length, numElementsPerRowBlock, numElementsPerColBlock, kernel, BlockExecutor.lazy());
  }

  /**
   * @param data the points
   * @param length number of points in {@code data}
   * @param numElementsPerRowBlock points per block; the blocks are the same along both axes
   * @param numElementsPerColBlock only used to report the number of column blocks
   * @param kernel a symmetric kernel function
   * @param executor runs the block computations
   * @throws IndexOutOfBoundsException if {@code length} is not the size of {@code data}
   * @throws IllegalArgumentException if a block size is not positive
   */
  public static <T> PartitionedPSDMatrix build(List<T> data, long length, int numElementsPerRowBlock,
                                               int numElementsPerColBlock, final KernelFunction<? super T> kernel,
                                               BlockExecutor executor) {
    if (length != data.size()) {
      throw new IndexOutOfBoundsException("Declared length " + length + " but the dataset holds "
          + data.size() + " points");
    }
    long rows = length;
    long cols = length;

    log.info("Constructing partitioned kernel matrix.");
    log.info("Dimension: {} x {}", rows, cols);

    long numRowBlocks = BlockPartitioner.numBlocks(rows, numElementsPerRowBlock);
    long numColBlocks = BlockPartitioner.numBlocks(cols, numElementsPerColBlock);
    log.info("Blocks: {} x {}", numRowBlocks, numColBlocks);
    if (numElementsPerRowBlock != numElementsPerColBlock) {
      log.warn("Row and column block sizes differ ({} vs {}); the row block size is used for both axes",
          numElementsPerRowBlock, numElementsPerColBlock);
    }

    List<BlockGroup<T>> partitionedData = BlockPartitioner.partition(data, numElementsPerRowBlock);

    log.info("~~~~~~~~~~~~~~~~~~~~~~~");
    log.info("Constructing Partitions");
    Iterable<KernelBlockTask<T>> tasks = Iterables.transform(
        PairCombiner.combineLowerTriangular(partitionedData),
        new Function<IndexedPair<BlockGroup<T>, BlockGroup<T>>, KernelBlockTask<T>>() {
          @Override
          public KernelBlockTask<T> apply(IndexedPair<BlockGroup<T>, BlockGroup<T>> pair) {
            return KernelBlockTask.symmetric(pair.first().value(), pair.second().value(), kernel);
          }
        });
    Iterable<MatrixBlock> blocks = executor.execute(tasks);
    return new PartitionedPSDMatrix(blocks, rows, cols, numRowBlocks, numColBlocks);
  }
}
