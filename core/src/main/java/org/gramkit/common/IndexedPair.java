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
 * One element of a cartesian product produced by {@link PairCombiner}.
 */
public final class IndexedPair<A, B> {
  private final Indexed<A> first;
  private final Indexed<B> second;

  public IndexedPair(Indexed<A> first, Indexed<B> second) {
    this.first = first;
    this.second = second;
  }

  public Indexed<A> first() {
    return first;
  }

  public Indexed<B> second() {
    return second;
  }

  public IndexPair indices() {
    return new IndexPair(first.index(), second.index());
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ')';
  }
}
