/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.comet.hash;

import java.util.Arrays;
import java.util.List;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;

/**
 * Assigns rows to partitions like Spark's {@code HashPartitioning}: the key columns are
 * hashed with Murmur3 from seed 42, and each hash is mapped with {@link Partitioning#pmod(int, int)}.
 */
public class HashPartitioner {

  /**
   * The seed Spark uses for hash partitioning and for the {@code hash} function.
   */
  public static final int DEFAULT_SEED = 42;

  private final int numPartitions;

  private final int seed;

  private final ColumnHasher hasher;

  public HashPartitioner(int numPartitions) {
    this(numPartitions, DEFAULT_SEED, null);
  }

  public HashPartitioner(int numPartitions, DictionaryProvider provider) {
    this(numPartitions, DEFAULT_SEED, provider);
  }

  /**
   * Constructs a partitioner.
   * @param numPartitions the number of partitions, must be positive.
   * @param seed the initial hash of every row.
   * @param provider the provider of the dictionaries of dictionary-encoded keys, may be null.
   */
  public HashPartitioner(int numPartitions, int seed, DictionaryProvider provider) {
    Preconditions.checkArgument(numPartitions > 0, "expecting a positive number of partitions, got %s",
        numPartitions);
    this.numPartitions = numPartitions;
    this.seed = seed;
    this.hasher = new ColumnHasher(provider);
  }

  public int getNumPartitions() {
    return numPartitions;
  }

  public int getSeed() {
    return seed;
  }

  /**
   * Computes the partition of every row.
   * @param keys the key columns, in hashing order, all with the same number of values.
   * @return one partition index per row.
   */
  public int[] partitionIds(List<? extends FieldVector> keys) {
    Preconditions.checkArgument(!keys.isEmpty(), "expecting at least one key column");
    int[] hashes = newHashes(keys.get(0).getValueCount());
    hasher.createHashes(keys, hashes);
    return Partitioning.pmod(hashes, numPartitions, hashes);
  }

  /**
   * Computes the partition of every row of a batch into a vector.
   * @param root the batch.
   * @param keyColumns names of the key columns, in hashing order.
   * @param output the vector to hold one partition index per row.
   */
  public void partition(VectorSchemaRoot root, List<String> keyColumns, IntVector output) {
    int[] hashes = newHashes(root.getRowCount());
    hasher.createHashes(root, keyColumns, hashes);
    Partitioning.pmod(hashes, numPartitions, hashes);

    output.allocateNew(hashes.length);
    for (int i = 0; i < hashes.length; i++) {
      output.set(i, hashes[i]);
    }
    output.setValueCount(hashes.length);
  }

  private int[] newHashes(int rowCount) {
    int[] hashes = new int[rowCount];
    Arrays.fill(hashes, seed);
    return hashes;
  }
}
