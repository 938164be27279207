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

import java.util.List;
import java.util.Random;

/**
 * Draws a prototype subset for the Nystrom method uniformly at random, without replacement.
 * The sample keeps the relative order of the dataset, and a seeded {@link Random} gives the same
 * sample for the same dataset.
 */
public class PrototypeSampler {

  private final Random random;

  public PrototypeSampler(Random random) {
    this.random = Preconditions.checkNotNull(random);
  }

  public <T> List<T> sample(List<T> data, int numPrototypes) {
    int size = data.size();
    Preconditions.checkArgument(numPrototypes >= 0 && numPrototypes <= size,
        "Cannot draw %s prototypes from %s points", numPrototypes, size);
    List<T> prototypes = Lists.newArrayListWithCapacity(numPrototypes);
    int needed = numPrototypes;
    for (int i = 0; i < size && needed > 0; i++) {
      // select with probability needed / remaining
      if (random.nextInt(size - i) < needed) {
        prototypes.add(data.get(i));
        needed--;
      }
    }
    return prototypes;
  }
}
