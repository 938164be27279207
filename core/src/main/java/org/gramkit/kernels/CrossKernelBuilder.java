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

import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;
import org.gramkit.common.IndexedPair;
import org.gramkit.common.PairCombiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the rectangular kernel matrix {@code M[i][j] = k(first[i], second[j])} between two
 * datasets. Every pair is evaluated.
 */
public final class CrossKernelBuilder {
  private static final Logger log = LoggerFactory.getLogger(CrossKernelBuilder.class);

  private CrossKernelBuilder() {
  }

  public static <T> Matrix build(List<T> first, List<T> second, KernelFunction<? super T> kernel) {
    Matrix matrix = new DenseMatrix(first.size(), second.size());
    for (IndexedPair<T, T> pair : PairCombiner.combine(first, second)) {
      matrix.setQuick(pair.first().index(), pair.second().index(),
          kernel.evaluate(pair.first().value(), pair.second().value()));
    }
    log.info("   Dimensions: {} x {}", first.size(), second.size());
    return matrix;
  }
}
