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

import com.google.common.base.Function;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import java.util.List;

/**
 * Lazy cartesian products of indexed sequences.
 *
 * Pairs are produced ordered by the first index, then by the second index, so that the
 * sequence (and anything built from it) is reproducible for fixed inputs. Nothing is paired
 * until the returned {@link Iterable} is traversed.
 */
public final class PairCombiner {

  private PairCombiner() {
  }

  /**
   * @return the elements of {@code elements} paired with their positions
   */
  public static <T> List<Indexed<T>> zipWithIndex(List<T> elements) {
    ImmutableList.Builder<Indexed<T>> indexed = ImmutableList.builder();
    int i = 0;
    for (T element : elements) {
      indexed.add(new Indexed<T>(i++, element));
    }
    return indexed.build();
  }

  /**
   * All pairs {@code ((i, first[i]), (j, second[j]))}.
   */
  public static <A, B> Iterable<IndexedPair<A, B>> combine(List<A> first, List<B> second) {
    final List<Indexed<B>> right = zipWithIndex(second);
    return Iterables.concat(Iterables.transform(zipWithIndex(first),
        new Function<Indexed<A>, Iterable<IndexedPair<A, B>>>() {
          @Override
          public Iterable<IndexedPair<A, B>> apply(final Indexed<A> left) {
            return Iterables.transform(right, new Function<Indexed<B>, IndexedPair<A, B>>() {
              @Override
              public IndexedPair<A, B> apply(Indexed<B> element) {
                return new IndexedPair<A, B>(left, element);
              }
            });
          }
        }));
  }

  /**
   * The pairs of {@code elements} with itself whose first index is at least the second index.
   * For a symmetric function of the pair these are the only pairs needing evaluation.
   */
  public static <T> Iterable<IndexedPair<T, T>> combineLowerTriangular(List<T> elements) {
    return Iterables.filter(combine(elements, elements), LOWER_TRIANGULAR);
  }

  private static final Predicate<IndexedPair<?, ?>> LOWER_TRIANGULAR = new Predicate<IndexedPair<?, ?>>() {
    @Override
    public boolean apply(IndexedPair<?, ?> pair) {
      return pair.first().index() >= pair.second().index();
    }
  };
}
