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

import org.apache.arrow.util.Preconditions;

/**
 * Maps hash codes to partition indices the way Spark's {@code Pmod} does.
 */
public class Partitioning {

  /**
   * Gets the partition of a hash code.
   * The hash is read as a signed int, and a negative remainder is shifted into range,
   * so that the result lies in {@code [0, numPartitions)}.
   * @param hash the hash code.
   * @param numPartitions the number of partitions, must be positive.
   * @return the partition index.
   */
  public static int pmod(int hash, int numPartitions) {
    Preconditions.checkArgument(numPartitions > 0, "expecting a positive number of partitions, got %s",
        numPartitions);
    int r = hash % numPartitions;
    return r < 0 ? (r + numPartitions) % numPartitions : r;
  }

  /**
   * Gets the partitions of a batch of hash codes.
   * @param hashes the hash codes.
   * @param numPartitions the number of partitions, must be positive.
   * @param partitionIds the output, of the same length as the hash codes.
   * @return the output array.
   */
  public static int[] pmod(int[] hashes, int numPartitions, int[] partitionIds) {
    Preconditions.checkArgument(numPartitions > 0, "expecting a positive number of partitions, got %s",
        numPartitions);
    Preconditions.checkArgument(hashes.length == partitionIds.length,
        "expecting %s partition ids, got %s", hashes.length, partitionIds.length);
    for (int i = 0; i < hashes.length; i++) {
      int r = hashes[i] % numPartitions;
      partitionIds[i] = r < 0 ? (r + numPartitions) % numPartitions : r;
    }
    return partitionIds;
  }

  private Partitioning() {
  }
}
