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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.gramkit.math.MatrixBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Computes every block on a fixed size thread pool before returning. A block is only published
 * once its task has completed. If the caller is interrupted while waiting, blocks not yet computed
 * are cancelled and nothing is returned.
 */
public class ThreadPoolBlockExecutor extends BlockExecutor {
  private static final Logger log = LoggerFactory.getLogger(ThreadPoolBlockExecutor.class);

  private final int numThreads;

  ThreadPoolBlockExecutor(int numThreads) {
    this.numThreads = numThreads;
  }

  public int getNumThreads() {
    return numThreads;
  }

  @Override
  public Iterable<MatrixBlock> execute(Iterable<? extends Callable<MatrixBlock>> tasks) {
    List<Callable<MatrixBlock>> work = Lists.<Callable<MatrixBlock>>newArrayList(tasks);
    log.info("Starting block threadpool with {} threads for {} blocks", numThreads, work.size());
    ThreadPoolExecutor threadPool = new ThreadPoolExecutor(numThreads, numThreads, 0, TimeUnit.SECONDS,
        new LinkedBlockingQueue<Runnable>());
    long startTime = System.nanoTime();
    try {
      List<Future<MatrixBlock>> futures = threadPool.invokeAll(work);
      List<MatrixBlock> blocks = Lists.newArrayListWithCapacity(futures.size());
      for (Future<MatrixBlock> future : futures) {
        blocks.add(future.get());
      }
      return ImmutableList.copyOf(blocks);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BlockComputationException("Interrupted while computing blocks, remaining blocks cancelled", e);
    } catch (ExecutionException e) {
      throw new BlockComputationException("Block computation failed", e.getCause());
    } finally {
      threadPool.shutdownNow();
      log.info("threadpool took: {}ms", (System.nanoTime() - startTime) / 1.0e6);
    }
  }

  @Override
  public String toString() {
    return "BlockExecutor[" + numThreads + " threads]";
  }
}
