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

package org.gramkit.kernels;

import com.google.common.collect.Maps;
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;
import org.gramkit.common.IndexPair;
import org.gramkit.common.IndexedPair;
import org.gramkit.common.PairCombiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Builds the symmetric kernel matrix of a dataset.
 *
 * The kernel is evaluated once per pair {@code (i, j)} with {@code i >= j}; both {@code K[i][j]}
 * and {@code K[j][i]} are filled from that single stored value, so the result is exactly symmetric
 * whatever rounding the kernel function does, and the kernel is called {@code n(n+1)/2} times.
 */
public final class DenseKernelBuilder {
  private static final Logger log = LoggerFactory.getLogger(DenseKernelBuilder.class);

  private DenseKernelBuilder() {
  }

  public static <T> KernelMatrix build(List<T> data, KernelFunction<? super T> kernel) {
    return build(data, data.size(), kernel);
  }

  /**
   * @param data the points
   * @param length number of points in {@code data}
   * @param kernel the kernel function
   * @throws IndexOutOfBoundsException if {@code length} is not the size of {@code data}
   */
  public static <T> KernelMatrix build(List<T> data, int length, KernelFunction<? super T> kernel) {
    if (length != data.size()) {
      throw new IndexOutOfBoundsException("Declared length " + length + " but the dataset holds "
          + data.size() + " points");
    }

    Map<IndexPair, Double> kernelIndex = Maps.newHashMap();
    for (IndexedPair<T, T> pair : PairCombiner.combineLowerTriangular(data)) {
      kernelIndex.put(pair.indices(), kernel.evaluate(pair.first().value(), pair.second().value()));
    }

    Matrix matrix = new DenseMatrix(length, length);
    for (int i = 0; i < length; i++) {
      for (int j = 0; j < length; j++) {
        matrix.setQuick(i, j, lookup(kernelIndex, IndexPair.lowerTriangular(i, j)));
      }
    }

    log.info("   Dimensions: {} x {}", matrix.numRows(), matrix.numCols());
    return new KernelMatrix(matrix, length);
  }

  private static double lookup(Map<IndexPair, Double> kernelIndex, IndexPair pair) {
    Double value = kernelIndex.get(pair);
    if (value == null) {
      throw new IndexOutOfBoundsException("No kernel value computed for " + pair);
    }
    return value;
  }
}
