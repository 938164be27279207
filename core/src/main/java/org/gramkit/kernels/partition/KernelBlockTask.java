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

import org.apache.mahout.math.Matrix;
import org.gramkit.kernels.CrossKernelBuilder;
import org.gramkit.kernels.DenseKernelBuilder;
import org.gramkit.kernels.KernelFunction;
import org.gramkit.math.BlockIndex;
import org.gramkit.math.MatrixBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Computes one block of a partitioned kernel matrix from a row block group and a column block
 * group. Reads nothing but its two groups and the kernel function, so tasks may run in any order
 * and on any thread.
 */
public final class KernelBlockTask<T> implements Callable<MatrixBlock> {
  private static final Logger log = LoggerFactory.getLogger(KernelBlockTask.class);

  private final BlockGroup<T> rowGroup;
  private final BlockGroup<T> colGroup;
  private final KernelFunction<? super T> kernel;
  private final boolean symmetric;

  private KernelBlockTask(BlockGroup<T> rowGroup, BlockGroup<T> colGroup,
                          KernelFunction<? super T> kernel, boolean symmetric) {
    this.rowGroup = rowGroup;
    this.colGroup = colGroup;
    this.kernel = kernel;
    this.symmetric = symmetric;
  }

  /**
   * A block of a symmetric kernel matrix: diagonal blocks are built with
   * {@link DenseKernelBuilder}, which exploits their own symmetry.
   */
  public static <T> KernelBlockTask<T> symmetric(BlockGroup<T> rowGroup, BlockGroup<T> colGroup,
                                                 KernelFunction<? super T> kernel) {
    return new KernelBlockTask<T>(rowGroup, colGroup, kernel, true);
  }

  public static <T> KernelBlockTask<T> cross(BlockGroup<T> rowGroup, BlockGroup<T> colGroup,
                                             KernelFunction<? super T> kernel) {
    return new KernelBlockTask<T>(rowGroup, colGroup, kernel, false);
  }

  public BlockIndex index() {
    return new BlockIndex(rowGroup.index(), colGroup.index());
  }

  @Override
  public MatrixBlock call() {
    BlockIndex partitionIndex = index();
    log.debug(":- Partition: {}", partitionIndex);
    Matrix matrix;
    if (symmetric && partitionIndex.isDiagonal()) {
      matrix = DenseKernelBuilder.build(rowGroup.elements(), rowGroup.size(), kernel).getKernelMatrix();
    } else {
      matrix = CrossKernelBuilder.build(rowGroup.elements(), colGroup.elements(), kernel);
    }
    return new MatrixBlock(partitionIndex, matrix);
  }
}
