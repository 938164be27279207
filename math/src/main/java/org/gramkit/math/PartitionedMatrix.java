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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import org.apache.mahout.math.CardinalityException;
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * A matrix of {@code rows x cols} represented as a grid of {@code numRowBlocks x numColBlocks}
 * dense blocks. The blocks are supplied as a sequence of {@link MatrixBlock} entries, which may
 * be lazy: a lazily computed sequence is re-evaluated on every traversal until
 * {@link #materialize()} is called.
 *
 * Entries are checked against the block grid as they are traversed.
 */
public class PartitionedMatrix {
  private static final Logger log = LoggerFactory.getLogger(PartitionedMatrix.class);

  private final Iterable<MatrixBlock> blocks;
  private final long rows;
  private final long cols;
  private final long numRowBlocks;
  private final long numColBlocks;

  public PartitionedMatrix(Iterable<MatrixBlock> blocks, long rows, long cols,
                           long numRowBlocks, long numColBlocks) {
    Preconditions.checkNotNull(blocks);
    Preconditions.checkArgument(rows >= 0 && cols >= 0,
        "Matrix dimensions must be non-negative: %s x %s", rows, cols);
    Preconditions.checkArgument(numRowBlocks >= 0 && numColBlocks >= 0,
        "Block grid dimensions must be non-negative: %s x %s", numRowBlocks, numColBlocks);
    this.rows = rows;
    this.cols = cols;
    this.numRowBlocks = numRowBlocks;
    this.numColBlocks = numColBlocks;
    this.blocks = Iterables.transform(blocks, new Function<MatrixBlock, MatrixBlock>() {
      @Override
      public MatrixBlock apply(MatrixBlock block) {
        checkBlock(block);
        return block;
      }
    });
  }

  public long rows() {
    return rows;
  }

  public long cols() {
    return cols;
  }

  public long numRowBlocks() {
    return numRowBlocks;
  }

  public long numColBlocks() {
    return numColBlocks;
  }

  public boolean isSymmetric() {
    return false;
  }

  /**
   * @return the stored block entries, in the order they were supplied.
   */
  public Iterable<MatrixBlock> blocks() {
    return blocks;
  }

  /**
   * @return every block of the grid, including those that are only implied by the stored ones.
   */
  public Iterable<MatrixBlock> allBlocks() {
    return expand(blocks());
  }

  /**
   * Completes a sequence of stored blocks with the blocks they imply.
   */
  protected Iterable<MatrixBlock> expand(Iterable<MatrixBlock> stored) {
    return stored;
  }

  /**
   * Every block of the grid, computing each stored block exactly once.
   */
  private List<MatrixBlock> snapshot() {
    return ImmutableList.copyOf(expand(ImmutableList.copyOf(blocks())));
  }

  /**
   * Looks up the block at the given grid position. On a lazily computed matrix this computes the
   * stored blocks preceding the one found; call {@link #materialize()} first for repeated lookups.
   *
   * @throws IllegalArgumentException if the position lies outside the block grid
   * @throws IllegalStateException if no entry exists for the position
   */
  public Matrix getBlock(long row, long col) {
    checkGridPosition(row, col);
    BlockIndex wanted = new BlockIndex(row, col);
    for (MatrixBlock block : blocks()) {
      if (block.index().equals(wanted)) {
        return block.matrix();
      }
    }
    throw new IllegalStateException("No block stored at " + wanted);
  }

  /**
   * Computes every block once and returns a matrix backed by the computed blocks.
   */
  public PartitionedMatrix materialize() {
    long start = System.nanoTime();
    ImmutableList<MatrixBlock> computed = ImmutableList.copyOf(blocks());
    log.debug("Materialized {} blocks in {}ms", computed.size(), (System.nanoTime() - start) / 1.0e6);
    return withBlocks(computed);
  }

  protected PartitionedMatrix withBlocks(Iterable<MatrixBlock> newBlocks) {
    return new PartitionedMatrix(newBlocks, rows, cols, numRowBlocks, numColBlocks);
  }

  /**
   * Assembles the full matrix. Only possible when both dimensions fit in an int.
   */
  public Matrix toDense() {
    Preconditions.checkState(rows <= Integer.MAX_VALUE && cols <= Integer.MAX_VALUE,
        "Matrix too large to assemble densely: %s x %s", rows, cols);
    List<MatrixBlock> all = snapshot();
    Layout layout = layout(all);
    Matrix dense = new DenseMatrix((int) rows, (int) cols);
    for (MatrixBlock block : all) {
      int rowOffset = layout.rowOffset(block.index().row());
      int colOffset = layout.colOffset(block.index().col());
      Matrix m = block.matrix();
      for (int i = 0; i < m.numRows(); i++) {
        for (int j = 0; j < m.numCols(); j++) {
          dense.setQuick(rowOffset + i, colOffset + j, m.getQuick(i, j));
        }
      }
    }
    return dense;
  }

  /**
   * Blockwise matrix-vector product.
   *
   * Only possible when both dimensions fit in an int.
   *
   * @throws CardinalityException if {@code v.size() != cols()}
   */
  public Vector times(Vector v) {
    Preconditions.checkState(rows <= Integer.MAX_VALUE && cols <= Integer.MAX_VALUE,
        "Matrix too large for a dense product: %s x %s", rows, cols);
    if (v.size() != cols) {
      throw new CardinalityException((int) cols, v.size());
    }
    List<MatrixBlock> all = snapshot();
    Layout layout = layout(all);
    Vector result = new DenseVector((int) rows);
    for (MatrixBlock block : all) {
      int rowOffset = layout.rowOffset(block.index().row());
      int colOffset = layout.colOffset(block.index().col());
      Matrix m = block.matrix();
      Vector partial = m.times(v.viewPart(colOffset, m.numCols()));
      for (int i = 0; i < partial.size(); i++) {
        result.setQuick(rowOffset + i, result.getQuick(rowOffset + i) + partial.getQuick(i));
      }
    }
    return result;
  }

  protected void checkBlock(MatrixBlock block) {
    checkGridPosition(block.index().row(), block.index().col());
  }

  protected void checkGridPosition(long row, long col) {
    Preconditions.checkArgument(row < numRowBlocks && col < numColBlocks,
        "Block %s, %s lies outside the %s x %s block grid", row, col, numRowBlocks, numColBlocks);
  }

  /**
   * Row and column offsets of each block row/column, derived from the block shapes.
   */
  private Layout layout(List<MatrixBlock> all) {
    SortedMap<Long, Integer> heights = Maps.newTreeMap();
    SortedMap<Long, Integer> widths = Maps.newTreeMap();
    for (MatrixBlock block : all) {
      record(heights, block.index().row(), block.matrix().numRows(), "rows");
      record(widths, block.index().col(), block.matrix().numCols(), "columns");
    }
    return new Layout(offsets(heights, rows, "row"), offsets(widths, cols, "column"));
  }

  private static void record(Map<Long, Integer> sizes, long index, int size, String what) {
    Integer known = sizes.get(index);
    if (known != null && known != size) {
      throw new IllegalStateException("Blocks in block line " + index + " disagree on number of "
          + what + ": " + known + " vs " + size);
    }
    sizes.put(index, size);
  }

  private static int[] offsets(SortedMap<Long, Integer> sizes, long total, String axis) {
    int[] offsets = new int[sizes.size()];
    long offset = 0;
    long expected = 0;
    for (Map.Entry<Long, Integer> entry : sizes.entrySet()) {
      if (entry.getKey() != expected) {
        throw new IllegalStateException("Missing " + axis + " block " + expected);
      }
      offsets[(int) expected++] = (int) offset;
      offset += entry.getValue();
    }
    if (offset != total) {
      throw new IllegalStateException("Blocks cover " + offset + ' ' + axis + "s but the matrix has " + total);
    }
    return offsets;
  }

  private static final class Layout {
    private final int[] rowOffsets;
    private final int[] colOffsets;

    private Layout(int[] rowOffsets, int[] colOffsets) {
      this.rowOffsets = rowOffsets;
      this.colOffsets = colOffsets;
    }

    int rowOffset(long blockRow) {
      return rowOffsets[(int) blockRow];
    }

    int colOffset(long blockCol) {
      return colOffsets[(int) blockCol];
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '[' + rows + " x " + cols + ", blocks "
        + numRowBlocks + " x " + numColBlocks + ']';
  }
}
