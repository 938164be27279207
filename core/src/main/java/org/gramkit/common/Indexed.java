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

import com.google.common.base.Objects;

/**
 * An element together with its zero-based position in the sequence it was taken from.
 */
public final class Indexed<T> {
  private final int index;
  private final T value;

  public Indexed(int index, T value) {
    this.index = index;
    this.value = value;
  }

  public int index() {
    return index;
  }

  public T value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Indexed)) {
      return false;
    }
    Indexed<?> other = (Indexed<?>) o;
    return index == other.index && Objects.equal(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(index, value);
  }

  @Override
  public String toString() {
    return index + ":" + value;
  }
}
