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

package org.gramkit.kernels;

import org.gramkit.common.GramkitTestCase;
import org.gramkit.kernels.partition.BlockExecutor;
import org.gramkit.kernels.partition.ThreadPoolBlockExecutor;
import org.junit.Test;

import java.util.Properties;

public final class KernelMatrixConfigTest extends GramkitTestCase {

  @Test
  public void testDefaults() {
    KernelMatrixConfig config = KernelMatrixConfig.fromProperties(new Properties());
    assertEquals(KernelMatrixConfig.DEFAULT_BLOCK_SIZE, config.getRowBlockSize());
    assertEquals(KernelMatrixConfig.DEFAULT_BLOCK_SIZE, config.getColBlockSize());
    assertEquals(1, config.getNumThreads());
    assertSame(BlockExecutor.lazy(), config.blockExecutor());
  }

  @Test
  public void testFromResource() throws Exception {
    KernelMatrixConfig config = KernelMatrixConfig.fromResource("gramkit-test.properties");
    assertEquals(64, config.getRowBlockSize());
    assertEquals(32, config.getColBlockSize());
    assertEquals(3, config.getNumThreads());
    BlockExecutor executor = config.blockExecutor();
    assertTrue(executor instanceof ThreadPoolBlockExecutor);
    assertEquals(3, ((ThreadPoolBlockExecutor) executor).getNumThreads());
  }

  @Test
  public void testPropertiesRoundTrip() {
    KernelMatrixConfig config = new KernelMatrixConfig().setBlockSize(17).setNumThreads(2);
    KernelMatrixConfig copy = KernelMatrixConfig.fromProperties(config.toProperties());
    assertEquals(17, copy.getRowBlockSize());
    assertEquals(17, copy.getColBlockSize());
    assertEquals(2, copy.getNumThreads());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedValue() {
    Properties properties = new Properties();
    properties.setProperty(KernelMatrixConfig.ROW_BLOCK_SIZE, "lots");
    KernelMatrixConfig.fromProperties(properties);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoThreads() {
    new KernelMatrixConfig().setNumThreads(0).blockExecutor();
  }
}
