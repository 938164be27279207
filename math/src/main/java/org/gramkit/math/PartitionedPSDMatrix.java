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

package org.gramkit.math;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterables;
import org.apache.mahout.math.Matrix;

/**
 * A symmetric {@link PartitionedMatrix} which stores only the lower triangle of its block grid,
 * i.e. entries whose block row index is at least the block column index. A block above the
 * diagonal is the transpose of its mirror below the diagonal.
 *
 * The block grid is square with {@link #numRowBlocks()} blocks on each side, the same block row
 * sizes being used for the columns.
 */
public class PartitionedPSDMatrix extends PartitionedMatrix {

  public PartitionedPSDMatrix(Iterable<MatrixBlock> blocks, long rows, long cols,
                              long numRowBlocks, long numColBlocks) {
    super(blocks, rows, cols, numRowBlocks, numColBlocks);
    Preconditions.checkArgument(rows == cols, "Symmetric matrix must be square: %s x %s", rows, cols);
  }

  @Override
  public boolean isSymmetric() {
    return true;
  }

  /**
   * @return the stored lower triangular blocks followed by the transposes of the off-diagonal ones.
   */
  @Override
  protected Iterable<MatrixBlock> expand(Iterable<MatrixBlock> stored) {
    Iterable<MatrixBlock> mirrored = Iterables.transform(
        Iterables.filter(stored, new Predicate<MatrixBlock>() {
          @Override
          public boolean apply(MatrixBlock block) {
            return !block.index().isDiagonal();
          }
        }),
        new Function<MatrixBlock, MatrixBlock>() {
          @Override
          public MatrixBlock apply(MatrixBlock block) {
            return block.transpose();
          }
        });
    return Iterables.concat(stored, mirrored);
  }

  @Override
  public Matrix getBlock(long row, long col) {
    if (row < col) {
      return super.getBlock(col, row).transpose();
    }
    return super.getBlock(row, col);
  }

  @Override
  protected PartitionedMatrix withBlocks(Iterable<MatrixBlock> newBlocks) {
    return new PartitionedPSDMatrix(newBlocks, rows(), cols(), numRowBlocks(), numColBlocks());
  }

  @Override
  protected void checkBlock(MatrixBlock block) {
    super.checkBlock(block);
    if (block.index().row() < block.index().col()) {
      throw new IllegalArgumentException("Block " + block.index()
          + " lies above the diagonal of a symmetric partitioned matrix");
    }
  }

  @Override
  protected void checkGridPosition(long row, long col) {
    Preconditions.checkArgument(row < numRowBlocks() && col < numRowBlocks(),
        "Block %s, %s lies outside the %s x %s block grid", row, col, numRowBlocks(), numRowBlocks());
  }
}
