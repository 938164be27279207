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

import com.google.common.collect.Lists;
import org.apache.mahout.math.DenseMatrix;
import org.gramkit.common.GramkitTestCase;
import org.gramkit.math.MatrixBlock;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

public final class ThreadPoolBlockExecutorTest extends GramkitTestCase {

  private static Callable<MatrixBlock> constantBlock(final int row, final double value) {
    return new Callable<MatrixBlock>() {
      @Override
      public MatrixBlock call() {
        DenseMatrix m = new DenseMatrix(1, 1);
        m.set(0, 0, value);
        return new MatrixBlock(row, 0, m);
      }
    };
  }

  @Test
  public void testKeepsTaskOrder() {
    List<Callable<MatrixBlock>> tasks = Lists.newArrayList();
    for (int i = 0; i < 50; i++) {
      tasks.add(constantBlock(i, i * 0.5));
    }
    List<MatrixBlock> blocks = Lists.newArrayList(BlockExecutor.threaded(5).execute(tasks));
    assertEquals(50, blocks.size());
    for (int i = 0; i < 50; i++) {
      assertEquals(i, blocks.get(i).index().row());
      assertEquals(i * 0.5, blocks.get(i).matrix().get(0, 0), 0.0);
    }
  }

  @Test
  public void testFailurePropagates() {
    final IllegalStateException failure = new IllegalStateException("bad block");
    List<Callable<MatrixBlock>> tasks = Lists.newArrayList();
    tasks.add(constantBlock(0, 1.0));
    tasks.add(new Callable<MatrixBlock>() {
      @Override
      public MatrixBlock call() {
        throw failure;
      }
    });
    try {
      BlockExecutor.threaded(2).execute(tasks);
      fail("expected a BlockComputationException");
    } catch (BlockComputationException e) {
      assertSame(failure, e.getCause());
    }
  }

  @Test
  public void testInterruptCancelsRemainingBlocks() {
    final CountDownLatch never = new CountDownLatch(1);
    List<Callable<MatrixBlock>> tasks = Lists.newArrayList();
    for (int i = 0; i < 4; i++) {
      tasks.add(new Callable<MatrixBlock>() {
        @Override
        public MatrixBlock call() throws Exception {
          never.await();
          return null;
        }
      });
    }
    Thread.currentThread().interrupt();
    try {
      BlockExecutor.threaded(2).execute(tasks);
      fail("expected a BlockComputationException");
    } catch (BlockComputationException e) {
      assertTrue(e.getCause() instanceof InterruptedException);
      assertTrue("interrupt status is restored", Thread.interrupted());
    }
  }

  @Test
  public void testLazyExecutorDefersWork() {
    final int[] calls = new int[1];
    List<Callable<MatrixBlock>> tasks = Lists.newArrayList();
    tasks.add(new Callable<MatrixBlock>() {
      @Override
      public MatrixBlock call() {
        calls[0]++;
        return new MatrixBlock(0, 0, new DenseMatrix(1, 1));
      }
    });
    Iterable<MatrixBlock> blocks = BlockExecutor.lazy().execute(tasks);
    assertEquals(0, calls[0]);
    Lists.newArrayList(blocks);
    Lists.newArrayList(blocks);
    assertEquals(2, calls[0]);
  }

  @Test
  public void testLazyExecutorWrapsCheckedExceptions() {
    final Exception failure = new Exception("checked");
    List<Callable<MatrixBlock>> tasks = Lists.newArrayList();
    tasks.add(new Callable<MatrixBlock>() {
      @Override
      public MatrixBlock call() throws Exception {
        throw failure;
      }
    });
    try {
      Lists.newArrayList(BlockExecutor.lazy().execute(tasks));
      fail("expected a BlockComputationException");
    } catch (BlockComputationException e) {
      assertSame(failure, e.getCause());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoThreads() {
    BlockExecutor.threaded(0);
  }
}
