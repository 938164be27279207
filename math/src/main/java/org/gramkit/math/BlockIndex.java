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

/**
 * Position of a block in the block grid of a {@link PartitionedMatrix}.
 */
public final class BlockIndex implements Comparable<BlockIndex> {
  private final long row;
  private final long col;

  public BlockIndex(long row, long col) {
    Preconditions.checkArgument(row >= 0 && col >= 0, "Negative block index: (%s, %s)", row, col);
    this.row = row;
    this.col = col;
  }

  public long row() {
    return row;
  }

  public long col() {
    return col;
  }

  public boolean isDiagonal() {
    return row == col;
  }

  /**
   * @return the index of the block mirrored across the diagonal of the grid.
   */
  public BlockIndex transpose() {
    return new BlockIndex(col, row);
  }

  @Override
  public int compareTo(BlockIndex other) {
    if (row != other.row) {
      return row < other.row ? -1 : 1;
    }
    if (col != other.col) {
      return col < other.col ? -1 : 1;
    }
    return 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BlockIndex)) {
      return false;
    }
    BlockIndex other = (BlockIndex) o;
    return row == other.row && col == other.col;
  }

  @Override
  public int hashCode() {
    return 31 * (int) (row ^ (row >>> 32)) + (int) (col ^ (col >>> 32));
  }

  @Override
  public String toString() {
    return "(" + row + ", " + col + ')';
  }
}
