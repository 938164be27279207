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

package org.gramkit.kernels.partition;

import java.util.List;

/**
 * A contiguous run of points from a dataset, tagged with its zero-based block index.
 */
public final class BlockGroup<T> {
  private final int index;
  private final List<T> elements;

  public BlockGroup(int index, List<T> elements) {
    this.index = index;
    this.elements = elements;
  }

  public int index() {
    return index;
  }

  public List<T> elements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  @Override
  public String toString() {
    return "BlockGroup[" + index + ", " + elements.size() + " points]";
  }
}
