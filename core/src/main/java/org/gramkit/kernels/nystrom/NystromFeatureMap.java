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

package org.gramkit.kernels.nystrom;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.mahout.math.CardinalityException;
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;
import org.gramkit.kernels.KernelFunction;

import java.util.List;

/**
 * Approximate nonlinear feature map of a kernel, obtained with the Nystrom method from the eigen
 * decomposition of the kernel matrix over a set of prototypes {@code p_1 .. p_m}.
 *
 * For each of the {@code d} eigenpairs {@code (lambda_i, v_i)}:
 * <pre>
 *   phi_i(x) = (1 / sqrt(lambda_i)) * sum(k = 1..m, K(p_k, x) * v_i[k])
 * </pre>
 * so that {@code phi(x) . phi(y)} approximates {@code K(x, y)}.
 */
public class NystromFeatureMap<T> {
  private final List<T> prototypes;
  private final KernelFunction<? super T> kernel;
  private final Matrix projection;
  private final Vector scale;

  /**
   * @param decomposition eigen decomposition of the kernel matrix of {@code prototypes}
   * @param prototypes the prototype points, in the row order of the eigenvector matrix
   * @param kernel the kernel function the decomposed matrix was built with
   * @throws CardinalityException if the eigenvector matrix does not have one row per prototype
   * @throws IllegalArgumentException if an eigenvalue is not strictly positive
   */
  public NystromFeatureMap(KernelEigenDecomposition decomposition, List<T> prototypes,
                           KernelFunction<? super T> kernel) {
    Preconditions.checkNotNull(decomposition);
    Preconditions.checkNotNull(kernel);
    if (decomposition.numPrototypes() != prototypes.size()) {
      throw new CardinalityException(prototypes.size(), decomposition.numPrototypes());
    }
    Vector eigenvalues = decomposition.getEigenvalues();
    scale = new DenseVector(eigenvalues.size());
    for (int i = 0; i < eigenvalues.size(); i++) {
      double lambda = eigenvalues.getQuick(i);
      Preconditions.checkArgument(lambda > 0,
          "Eigenvalue %s at position %s is not positive; drop it before building the feature map", lambda, i);
      scale.setQuick(i, 1 / Math.sqrt(lambda));
    }
    this.prototypes = ImmutableList.copyOf(prototypes);
    this.kernel = kernel;
    this.projection = decomposition.getEigenvectors().transpose();
  }

  /** Dimension of the feature space. */
  public int dimension() {
    return scale.size();
  }

  public List<T> getPrototypes() {
    return prototypes;
  }

  public Vector map(T x) {
    Vector kernelRow = new DenseVector(prototypes.size());
    for (int k = 0; k < prototypes.size(); k++) {
      kernelRow.setQuick(k, kernel.evaluate(prototypes.get(k), x));
    }
    return projection.times(kernelRow).times(scale);
  }

  public List<Vector> mapAll(List<T> data) {
    List<Vector> features = Lists.newArrayListWithCapacity(data.size());
    for (T x : data) {
      features.add(map(x));
    }
    return features;
  }
}
