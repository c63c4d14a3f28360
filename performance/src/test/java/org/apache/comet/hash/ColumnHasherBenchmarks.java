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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryEncoder;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.junit.jupiter.api.Test;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Benchmarks for {@link ColumnHasher}.
 */
@State(Scope.Benchmark)
public class ColumnHasherBenchmarks {

  private static final int VECTOR_LENGTH = 4096;

  private static final int DICTIONARY_LENGTH = 64;

  private static final int KEY_LENGTH = 24;

  private BufferAllocator allocator;

  private BigIntVector longVector;

  private VarCharVector stringVector;

  private VarCharVector dictionaryVector;

  private ValueVector encodedVector;

  private ColumnHasher hasher;

  private int[] hashes;

  /**
   * Setup benchmarks.
   */
  @Setup
  public void prepare() {
    Random random = new Random(0);
    allocator = new RootAllocator(64 * 1024 * 1024);

    longVector = new BigIntVector("long", allocator);
    longVector.allocateNew(VECTOR_LENGTH);
    for (int i = 0; i < VECTOR_LENGTH; i++) {
      longVector.set(i, random.nextLong());
    }
    longVector.setValueCount(VECTOR_LENGTH);

    dictionaryVector = new VarCharVector("dictionary", allocator);
    dictionaryVector.allocateNew();
    for (int i = 0; i < DICTIONARY_LENGTH; i++) {
      dictionaryVector.setSafe(i, generateKey(random, i));
    }
    dictionaryVector.setValueCount(DICTIONARY_LENGTH);

    stringVector = new VarCharVector("string", allocator);
    stringVector.allocateNew();
    for (int i = 0; i < VECTOR_LENGTH; i++) {
      stringVector.setSafe(i, dictionaryVector.get(random.nextInt(DICTIONARY_LENGTH)));
    }
    stringVector.setValueCount(VECTOR_LENGTH);

    Dictionary dictionary = new Dictionary(dictionaryVector, new DictionaryEncoding(1L, false, null));
    DictionaryProvider.MapDictionaryProvider provider = new DictionaryProvider.MapDictionaryProvider();
    provider.put(dictionary);
    encodedVector = DictionaryEncoder.encode(stringVector, dictionary);

    hasher = new ColumnHasher(provider);
    hashes = new int[VECTOR_LENGTH];
  }

  /**
   * Tear down benchmarks.
   */
  @TearDown
  public void tearDown() {
    encodedVector.close();
    stringVector.close();
    dictionaryVector.close();
    longVector.close();
    allocator.close();
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  public int hashLongs() {
    Arrays.fill(hashes, HashPartitioner.DEFAULT_SEED);
    return hasher.createHashes(Collections.singletonList(longVector), hashes)[0];
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  public int hashStrings() {
    Arrays.fill(hashes, HashPartitioner.DEFAULT_SEED);
    return hasher.createHashes(Collections.singletonList(stringVector), hashes)[0];
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  public int hashDictionaryEncodedStrings() {
    Arrays.fill(hashes, HashPartitioner.DEFAULT_SEED);
    return hasher.createHashes(Collections.singletonList(encodedVector), hashes)[0];
  }

  private static byte[] generateKey(Random random, int index) {
    StringBuilder sb = new StringBuilder();
    sb.append(index).append('-');
    while (sb.length() < KEY_LENGTH) {
      sb.append((char) ('a' + random.nextInt(26)));
    }
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void evaluate() throws RunnerException {
    Options opt = new OptionsBuilder()
        .include(ColumnHasherBenchmarks.class.getSimpleName())
        .forks(1)
        .build();

    new Runner(opt).run();
  }
}
