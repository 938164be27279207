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

import com.google.common.base.Preconditions;
import org.apache.mahout.math.CardinalityException;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;
import org.apache.mahout.math.solver.EigenDecomposition;
import org.gramkit.kernels.nystrom.KernelEigenDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dense symmetric kernel matrix over a dataset of {@link #dimension()} points.
 */
public class KernelMatrix {
  private static final Logger log = LoggerFactory.getLogger(KernelMatrix.class);

  private final Matrix kernel;
  private final int dimension;

  public KernelMatrix(Matrix kernel, int dimension) {
    Preconditions.checkNotNull(kernel);
    if (kernel.numRows() != dimension) {
      throw new CardinalityException(dimension, kernel.numRows());
    }
    if (kernel.numCols() != dimension) {
      throw new CardinalityException(dimension, kernel.numCols());
    }
    this.kernel = kernel;
    this.dimension = dimension;
  }

  /**
   * @return a copy of the kernel matrix; changing it leaves this kernel matrix untouched
   */
  public Matrix getKernelMatrix() {
    return kernel.clone();
  }

  public int dimension() {
    return dimension;
  }

  public double get(int i, int j) {
    return kernel.get(i, j);
  }

  public KernelEigenDecomposition eigenDecomposition() {
    return eigenDecomposition(dimension);
  }

  /**
   * Eigen decomposition of the kernel matrix, restricted to the {@code dimensions} largest
   * eigenvalues and their eigenvectors.
   */
  public KernelEigenDecomposition eigenDecomposition(int dimensions) {
    Preconditions.checkArgument(dimensions >= 0 && dimensions <= dimension,
        "Cannot take %s eigenpairs of a %s x %s kernel matrix", dimensions, dimension, dimension);
    log.info("Eigenvalue decomposition of the {} x {} kernel matrix", dimension, dimension);
    EigenDecomposition decomposition = new EigenDecomposition(kernel);
    Vector eigenvalues = decomposition.getRealEigenvalues();
    if (dimension > 0) {
      log.info("Eigenvalue stats: {} =< lambda =< {}", eigenvalues.minValue(), eigenvalues.maxValue());
    }
    return new KernelEigenDecomposition(eigenvalues, decomposition.getV()).leading(dimensions);
  }

  @Override
  public String toString() {
    return "KernelMatrix[" + dimension + " x " + dimension + ']';
  }
}
