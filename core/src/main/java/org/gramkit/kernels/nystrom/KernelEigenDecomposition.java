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
import com.google.common.collect.Lists;
import org.apache.mahout.math.CardinalityException;
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Eigenvalues and eigenvectors of a kernel matrix over {@code m} prototypes. Column {@code i} of
 * the {@code m x d} eigenvector matrix belongs to eigenvalue {@code i}.
 */
public final class KernelEigenDecomposition {
  private final Vector eigenvalues;
  private final Matrix eigenvectors;

  /**
   * @throws CardinalityException if the eigenvector matrix does not have one column per eigenvalue
   */
  public KernelEigenDecomposition(Vector eigenvalues, Matrix eigenvectors) {
    Preconditions.checkNotNull(eigenvalues);
    Preconditions.checkNotNull(eigenvectors);
    if (eigenvectors.numCols() != eigenvalues.size()) {
      throw new CardinalityException(eigenvalues.size(), eigenvectors.numCols());
    }
    this.eigenvalues = eigenvalues;
    this.eigenvectors = eigenvectors;
  }

  public Vector getEigenvalues() {
    return eigenvalues;
  }

  public Matrix getEigenvectors() {
    return eigenvectors;
  }

  /** Number of eigenpairs. */
  public int size() {
    return eigenvalues.size();
  }

  /** Number of prototypes, i.e. rows of the eigenvector matrix. */
  public int numPrototypes() {
    return eigenvectors.numRows();
  }

  /**
   * @return the {@code k} eigenpairs with the largest eigenvalues, largest first
   */
  public KernelEigenDecomposition leading(int k) {
    Preconditions.checkArgument(k >= 0 && k <= size(), "Cannot keep %s of %s eigenpairs", k, size());
    List<Integer> order = Lists.newArrayListWithCapacity(size());
    for (int i = 0; i < size(); i++) {
      order.add(i);
    }
    Collections.sort(order, new Comparator<Integer>() {
      @Override
      public int compare(Integer a, Integer b) {
        return Double.compare(eigenvalues.getQuick(b), eigenvalues.getQuick(a));
      }
    });
    return select(order.subList(0, k));
  }

  /**
   * @return the eigenpairs whose eigenvalue is strictly positive, in their current order
   */
  public KernelEigenDecomposition positive() {
    List<Integer> kept = Lists.newArrayList();
    for (int i = 0; i < size(); i++) {
      if (eigenvalues.getQuick(i) > 0) {
        kept.add(i);
      }
    }
    return select(kept);
  }

  private KernelEigenDecomposition select(List<Integer> columns) {
    Vector values = new DenseVector(columns.size());
    Matrix vectors = new DenseMatrix(numPrototypes(), columns.size());
    for (int c = 0; c < columns.size(); c++) {
      int source = columns.get(c);
      values.setQuick(c, eigenvalues.getQuick(source));
      for (int row = 0; row < numPrototypes(); row++) {
        vectors.setQuick(row, c, eigenvectors.getQuick(row, source));
      }
    }
    return new KernelEigenDecomposition(values, vectors);
  }
}
