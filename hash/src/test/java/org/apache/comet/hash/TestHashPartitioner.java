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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test cases for {@link HashPartitioner}. */
public class TestHashPartitioner {

  private BufferAllocator allocator;

  @BeforeEach
  public void prepare() {
    allocator = new RootAllocator(1024 * 1024);
  }

  @AfterEach
  public void shutdown() {
    allocator.close();
  }

  private BigIntVector newKeys() {
    BigIntVector vector = new BigIntVector("key", allocator);
    long[] values = {1L, 0L, -1L, Long.MAX_VALUE, Long.MIN_VALUE};
    vector.allocateNew(values.length);
    for (int i = 0; i < values.length; i++) {
      vector.set(i, values[i]);
    }
    vector.setValueCount(values.length);
    return vector;
  }

  @Test
  public void testSparkPartitions() {
    try (BigIntVector keys = newKeys()) {
      HashPartitioner partitioner = new HashPartitioner(200);
      assertEquals(HashPartitioner.DEFAULT_SEED, partitioner.getSeed());
      assertEquals(200, partitioner.getNumPartitions());
      assertArrayEquals(new int[] {69, 5, 193, 171, 115}, partitioner.partitionIds(Collections.singletonList(keys)));
    }
  }

  @Test
  public void testNullKeysUseSeed() {
    try (BigIntVector keys = newKeys()) {
      keys.setNull(2);
      int[] partitions = new HashPartitioner(200).partitionIds(Collections.singletonList(keys));
      assertEquals(Partitioning.pmod(HashPartitioner.DEFAULT_SEED, 200), partitions[2]);
      assertEquals(69, partitions[0]);
    }
  }

  @Test
  public void testPartitionBatch() {
    try (BigIntVector keys = newKeys();
         VarCharVector payload = new VarCharVector("payload", allocator);
         IntVector output = new IntVector("partition", allocator)) {
      payload.allocateNew();
      for (int i = 0; i < keys.getValueCount(); i++) {
        payload.setSafe(i, ("row" + i).getBytes(StandardCharsets.UTF_8));
      }
      payload.setValueCount(keys.getValueCount());

      VectorSchemaRoot root = VectorSchemaRoot.of(keys, payload);
      HashPartitioner partitioner = new HashPartitioner(200);
      partitioner.partition(root, Collections.singletonList("key"), output);

      assertEquals(5, output.getValueCount());
      int[] expected = {69, 5, 193, 171, 115};
      for (int i = 0; i < expected.length; i++) {
        assertFalse(output.isNull(i));
        assertEquals(expected[i], output.get(i));
      }

      int[] composite = new HashPartitioner(200).partitionIds(Arrays.asList(keys, payload));
      partitioner.partition(root, Arrays.asList("key", "payload"), output);
      for (int i = 0; i < composite.length; i++) {
        assertEquals(composite[i], output.get(i));
      }
    }
  }

  @Test
  public void testCustomSeed() {
    try (BigIntVector keys = newKeys()) {
      int[] partitions = new HashPartitioner(16, 7, null).partitionIds(Collections.singletonList(keys));
      for (int i = 0; i < partitions.length; i++) {
        assertEquals(Partitioning.pmod(Murmur3Hasher.hashLong(keys.get(i), 7), 16), partitions[i]);
      }
    }
  }

  @Test
  public void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new HashPartitioner(0));
    assertThrows(IllegalArgumentException.class,
        () -> new HashPartitioner(10).partitionIds(Collections.emptyList()));
  }
}
