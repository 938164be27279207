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

import com.google.common.base.Preconditions;
import com.google.common.io.Resources;
import org.gramkit.kernels.partition.BlockExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for building partitioned kernel matrices.
 *
 * <ul>
 *   <li>{@value #ROW_BLOCK_SIZE}: points per row block, default {@value #DEFAULT_BLOCK_SIZE}</li>
 *   <li>{@value #COL_BLOCK_SIZE}: points per column block, default {@value #DEFAULT_BLOCK_SIZE}</li>
 *   <li>{@value #NUM_THREADS}: threads computing blocks, default 1 (blocks computed lazily)</li>
 * </ul>
 */
public class KernelMatrixConfig {
  public static final String ROW_BLOCK_SIZE = "gramkit.block.rows";
  public static final String COL_BLOCK_SIZE = "gramkit.block.cols";
  public static final String NUM_THREADS = "gramkit.threads";

  public static final int DEFAULT_BLOCK_SIZE = 1000;

  private int rowBlockSize = DEFAULT_BLOCK_SIZE;
  private int colBlockSize = DEFAULT_BLOCK_SIZE;
  private int numThreads = 1;

  public int getRowBlockSize() {
    return rowBlockSize;
  }

  public KernelMatrixConfig setRowBlockSize(int rowBlockSize) {
    this.rowBlockSize = rowBlockSize;
    return this;
  }

  public int getColBlockSize() {
    return colBlockSize;
  }

  public KernelMatrixConfig setColBlockSize(int colBlockSize) {
    this.colBlockSize = colBlockSize;
    return this;
  }

  public KernelMatrixConfig setBlockSize(int blockSize) {
    return setRowBlockSize(blockSize).setColBlockSize(blockSize);
  }

  public int getNumThreads() {
    return numThreads;
  }

  public KernelMatrixConfig setNumThreads(int numThreads) {
    this.numThreads = numThreads;
    return this;
  }

  /**
   * @return a lazy executor for a single thread, a thread pool otherwise
   */
  public BlockExecutor blockExecutor() {
    Preconditions.checkArgument(numThreads > 0, "Number of threads must be positive: %s", numThreads);
    return numThreads == 1 ? BlockExecutor.lazy() : BlockExecutor.threaded(numThreads);
  }

  public static KernelMatrixConfig fromProperties(Properties properties) {
    return new KernelMatrixConfig()
        .setRowBlockSize(intProperty(properties, ROW_BLOCK_SIZE, DEFAULT_BLOCK_SIZE))
        .setColBlockSize(intProperty(properties, COL_BLOCK_SIZE, DEFAULT_BLOCK_SIZE))
        .setNumThreads(intProperty(properties, NUM_THREADS, 1));
  }

  /**
   * Reads the settings from a properties file on the classpath.
   */
  public static KernelMatrixConfig fromResource(String resource) throws IOException {
    Properties properties = new Properties();
    InputStream in = Resources.asByteSource(Resources.getResource(resource)).openStream();
    try {
      properties.load(in);
    } finally {
      in.close();
    }
    return fromProperties(properties);
  }

  public Properties toProperties() {
    Properties properties = new Properties();
    properties.setProperty(ROW_BLOCK_SIZE, String.valueOf(rowBlockSize));
    properties.setProperty(COL_BLOCK_SIZE, String.valueOf(colBlockSize));
    properties.setProperty(NUM_THREADS, String.valueOf(numThreads));
    return properties;
  }

  private static int intProperty(Properties properties, String key, int defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
    }
  }

  @Override
  public String toString() {
    return "KernelMatrixConfig[rowBlockSize=" + rowBlockSize + ", colBlockSize=" + colBlockSize
        + ", numThreads=" + numThreads + ']';
  }
}
