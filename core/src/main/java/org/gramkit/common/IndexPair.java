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

package org.gramkit.common;

/**
 * A pair of zero-based positions {@code (i, j)}.
 */
public final class IndexPair {
  private final int i;
  private final int j;

  public IndexPair(int i, int j) {
    this.i = i;
    this.j = j;
  }

  /**
   * @return the pair {@code (i, j)} if {@code i >= j}, otherwise {@code (j, i)}
   */
  public static IndexPair lowerTriangular(int i, int j) {
    return i >= j ? new IndexPair(i, j) : new IndexPair(j, i);
  }

  public int i() {
    return i;
  }

  public int j() {
    return j;
  }

  public boolean isLowerTriangular() {
    return i >= j;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IndexPair)) {
      return false;
    }
    IndexPair other = (IndexPair) o;
    return i == other.i && j == other.j;
  }

  @Override
  public int hashCode() {
    return 31 * i + j;
  }

  @Override
  public String toString() {
    return "(" + i + ", " + j + ')';
  }
}
