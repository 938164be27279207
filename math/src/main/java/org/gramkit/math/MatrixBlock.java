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

import com.google.common.base.Preconditions;
import org.apache.mahout.math.Matrix;

/**
 * A dense block of a {@link PartitionedMatrix} together with its grid position.
 */
public final class MatrixBlock {
  private final BlockIndex index;
  private final Matrix matrix;

  public MatrixBlock(BlockIndex index, Matrix matrix) {
    this.index = Preconditions.checkNotNull(index);
    this.matrix = Preconditions.checkNotNull(matrix);
  }

  public MatrixBlock(long row, long col, Matrix matrix) {
    this(new BlockIndex(row, col), matrix);
  }

  public BlockIndex index() {
    return index;
  }

  /**
   * @return the block contents, shared with the partitioned matrix holding this block; must not be modified
   */
  public Matrix matrix() {
    return matrix;
  }

  /**
   * @return the mirrored block: transposed contents at the transposed grid position.
   */
  public MatrixBlock transpose() {
    return new MatrixBlock(index.transpose(), matrix.transpose());
  }

  @Override
  public String toString() {
    return "MatrixBlock" + index + '[' + matrix.numRows() + " x " + matrix.numCols() + ']';
  }
}
