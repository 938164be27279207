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

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;
import org.gramkit.math.MatrixBlock;

import java.util.concurrent.Callable;

/**
 * Decides when and where the block tasks of a partitioned kernel matrix run. Whatever the
 * strategy, the resulting blocks come out in task order.
 */
public abstract class BlockExecutor {

  private static final BlockExecutor LAZY = new BlockExecutor() {
    @Override
    public Iterable<MatrixBlock> execute(Iterable<? extends Callable<MatrixBlock>> tasks) {
      return Iterables.transform(tasks, new Function<Callable<MatrixBlock>, MatrixBlock>() {
        @Override
        public MatrixBlock apply(Callable<MatrixBlock> task) {
          return compute(task);
        }
      });
    }

    @Override
    public String toString() {
      return "BlockExecutor[lazy]";
    }
  };

  public abstract Iterable<MatrixBlock> execute(Iterable<? extends Callable<MatrixBlock>> tasks);

  /**
   * Computes each block on the calling thread, only when the block sequence is traversed.
   */
  public static BlockExecutor lazy() {
    return LAZY;
  }

  /**
   * Computes all blocks up front on a pool of {@code numThreads} threads.
   */
  public static BlockExecutor threaded(int numThreads) {
    Preconditions.checkArgument(numThreads > 0, "Number of threads must be positive: %s", numThreads);
    return new ThreadPoolBlockExecutor(numThreads);
  }

  static MatrixBlock compute(Callable<MatrixBlock> task) {
    try {
      return task.call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new BlockComputationException("Block computation failed", e);
    }
  }
}
