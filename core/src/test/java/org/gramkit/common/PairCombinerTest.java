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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import org.junit.Test;

import java.util.List;

public final class PairCombinerTest extends GramkitTestCase {

  private static List<IndexPair> indices(Iterable<? extends IndexedPair<?, ?>> pairs) {
    List<IndexPair> indices = Lists.newArrayList();
    for (IndexedPair<?, ?> pair : pairs) {
      indices.add(pair.indices());
    }
    return indices;
  }

  @Test
  public void testZipWithIndex() {
    List<Indexed<String>> indexed = PairCombiner.zipWithIndex(ImmutableList.of("a", "b", "c"));
    assertEquals(ImmutableList.of(new Indexed<String>(0, "a"), new Indexed<String>(1, "b"),
        new Indexed<String>(2, "c")), indexed);
  }

  @Test
  public void testCombine() {
    Iterable<IndexedPair<String, Integer>> pairs =
        PairCombiner.combine(ImmutableList.of("a", "b"), ImmutableList.of(10, 20, 30));
    assertEquals(ImmutableList.of(new IndexPair(0, 0), new IndexPair(0, 1), new IndexPair(0, 2),
        new IndexPair(1, 0), new IndexPair(1, 1), new IndexPair(1, 2)), indices(pairs));

    IndexedPair<String, Integer> last = Iterables.getLast(pairs);
    assertEquals("b", last.first().value());
    assertEquals(Integer.valueOf(30), last.second().value());
  }

  @Test
  public void testCombineLowerTriangular() {
    Iterable<IndexedPair<Double, Double>> pairs =
        PairCombiner.combineLowerTriangular(ImmutableList.of(1.0, 2.0, 3.0));
    assertEquals(ImmutableList.of(new IndexPair(0, 0), new IndexPair(1, 0), new IndexPair(1, 1),
        new IndexPair(2, 0), new IndexPair(2, 1), new IndexPair(2, 2)), indices(pairs));
    for (IndexedPair<Double, Double> pair : pairs) {
      assertTrue(pair.indices().isLowerTriangular());
    }
  }

  @Test
  public void testLowerTriangularCount() {
    for (int n = 0; n < 12; n++) {
      List<Integer> elements = Lists.newArrayList();
      for (int i = 0; i < n; i++) {
        elements.add(i);
      }
      assertEquals(n * (n + 1) / 2, Iterables.size(PairCombiner.combineLowerTriangular(elements)));
      assertEquals(n * n, Iterables.size(PairCombiner.combine(elements, elements)));
    }
  }

  @Test
  public void testReproducible() {
    List<Double> data = ImmutableList.of(0.5, -1.0, 2.0, 7.0);
    Iterable<IndexedPair<Double, Double>> pairs = PairCombiner.combineLowerTriangular(data);
    assertEquals(indices(pairs), indices(pairs));
    assertEquals(indices(pairs), indices(PairCombiner.combineLowerTriangular(data)));
  }

  @Test
  public void testEmpty() {
    List<String> empty = ImmutableList.of();
    assertTrue(Iterables.isEmpty(PairCombiner.combine(empty, ImmutableList.of("x"))));
    assertTrue(Iterables.isEmpty(PairCombiner.combineLowerTriangular(empty)));
  }

  @Test
  public void testIndexPairLowerTriangular() {
    assertEquals(new IndexPair(3, 1), IndexPair.lowerTriangular(1, 3));
    assertEquals(new IndexPair(3, 1), IndexPair.lowerTriangular(3, 1));
    assertEquals(new IndexPair(2, 2), IndexPair.lowerTriangular(2, 2));
  }
}
