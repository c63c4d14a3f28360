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

import java.nio.ByteOrder;

import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.util.MemoryUtil;
import org.apache.arrow.memory.util.hash.ArrowBufHasher;
import org.apache.arrow.util.Preconditions;

/**
 * The 32-bit Murmur3 hash, bit compatible with Spark's {@code Murmur3_x86_32}.
 * <p>
 *   Input is consumed as 4-byte little-endian words regardless of the platform byte order.
 *   Unlike the reference Murmur3 algorithm, the 1 to 3 trailing bytes that do not fill a word
 *   are mixed one at a time, each sign-extended to an int, as Spark does for strings and binaries.
 * </p>
 * <p>
 *   An instance carries a fixed seed and can be used wherever Arrow expects an
 *   {@link ArrowBufHasher}. The static methods take the seed explicitly and are
 *   what the column hashers use to chain per-row seeds.
 * </p>
 */
public class Murmur3Hasher implements ArrowBufHasher {

  private static final boolean LITTLE_ENDIAN = ByteOrder.nativeOrder() == ByteOrder.LITTLE_ENDIAN;

  private static final int C1 = 0xcc9e2d51;
  private static final int C2 = 0x1b873593;

  private final int seed;

  /**
   * Creates a hasher with seed 0.
   */
  public Murmur3Hasher() {
    this(0);
  }

  /**
   * Creates a hasher.
   * @param seed the seed for the hasher.
   */
  public Murmur3Hasher(int seed) {
    this.seed = seed;
  }

  public int getSeed() {
    return seed;
  }

  @Override
  public int hashCode(long address, long length) {
    return hashRegion(new ByteSource() {
      @Override
      public int getInt(long index) {
        return MemoryUtil.UNSAFE.getInt(address + index);
      }

      @Override
      public byte getByte(long index) {
        return MemoryUtil.UNSAFE.getByte(address + index);
      }
    }, length, seed);
  }

  @Override
  public int hashCode(ArrowBuf buf, long offset, long length) {
    return hashBytes(buf, offset, length, seed);
  }

  /**
   * Hashes a 32-bit value, the same as hashing its 4 little-endian bytes.
   * @param value the value to hash.
   * @param seed the seed.
   * @return the hash code.
   */
  public static int hashInt(int value, int seed) {
    int h1 = mixH1(seed, mixK1(value));
    return fmix(h1, 4);
  }

  /**
   * Hashes a 64-bit value, the same as hashing its 8 little-endian bytes.
   * @param value the value to hash.
   * @param seed the seed.
   * @return the hash code.
   */
  public static int hashLong(long value, int seed) {
    int h1 = mixH1(seed, mixK1((int) value));
    h1 = mixH1(h1, mixK1((int) (value >>> 32)));
    return fmix(h1, 8);
  }

  /**
   * Hashes a 128-bit two's complement value given as its low and high 64-bit halves,
   * the same as hashing its 16 little-endian bytes.
   * @param low the low 64 bits.
   * @param high the high 64 bits.
   * @param seed the seed.
   * @return the hash code.
   */
  public static int hashInt128(long low, long high, int seed) {
    int h1 = mixH1(seed, mixK1((int) low));
    h1 = mixH1(h1, mixK1((int) (low >>> 32)));
    h1 = mixH1(h1, mixK1((int) high));
    h1 = mixH1(h1, mixK1((int) (high >>> 32)));
    return fmix(h1, 16);
  }

  /**
   * Hashes all bytes of an array.
   * @param bytes the bytes to hash.
   * @param seed the seed.
   * @return the hash code.
   */
  public static int hashBytes(byte[] bytes, int seed) {
    return hashBytes(bytes, 0, bytes.length, seed);
  }

  /**
   * Hashes a region of a byte array.
   * @param bytes the array holding the region.
   * @param offset start of the region.
   * @param length length of the region.
   * @param seed the seed.
   * @return the hash code.
   */
  public static int hashBytes(byte[] bytes, int offset, int length, int seed) {
    Preconditions.checkPositionIndexes(offset, offset + length, bytes.length);
    int h1 = seed;
    int aligned = length - length % 4;
    int index = 0;
    for (; index < aligned; index += 4) {
      int pos = offset + index;
      int word = (bytes[pos] & 0xff)
          | (bytes[pos + 1] & 0xff) << 8
          | (bytes[pos + 2] & 0xff) << 16
          | (bytes[pos + 3] & 0xff) << 24;
      h1 = mixH1(h1, mixK1(word));
    }
    for (; index < length; index++) {
      h1 = mixH1(h1, mixK1(bytes[offset + index]));
    }
    return fmix(h1, length);
  }

  /**
   * Hashes a region of an Arrow buffer. The region is bounds checked by the buffer.
   * @param buf the buffer holding the region.
   * @param offset start of the region within the buffer.
   * @param length length of the region.
   * @param seed the seed.
   * @return the hash code.
   */
  public static int hashBytes(ArrowBuf buf, long offset, long length, int seed) {
    return hashRegion(new ByteSource() {
      @Override
      public int getInt(long index) {
        return buf.getInt(offset + index);
      }

      @Override
      public byte getByte(long index) {
        return buf.getByte(offset + index);
      }
    }, length, seed);
  }

  private static int hashRegion(ByteSource source, long length, int seed) {
    Preconditions.checkArgument(length >= 0 && length <= Integer.MAX_VALUE,
        "expecting length in [0, %s], got %s", Integer.MAX_VALUE, length);
    int h1 = seed;
    long aligned = length - length % 4;
    long index = 0;
    for (; index < aligned; index += 4) {
      h1 = mixH1(h1, mixK1(toLittleEndian(source.getInt(index))));
    }
    for (; index < length; index++) {
      // sign extension of the trailing bytes is intended
      h1 = mixH1(h1, mixK1(source.getByte(index)));
    }
    return fmix(h1, (int) length);
  }

  static int mixK1(int k1) {
    k1 *= C1;
    k1 = Integer.rotateLeft(k1, 15);
    k1 *= C2;
    return k1;
  }

  static int mixH1(int h1, int k1) {
    h1 ^= k1;
    h1 = Integer.rotateLeft(h1, 13);
    h1 = h1 * 5 + 0xe6546b64;
    return h1;
  }

  // Finalization mix - force all bits of a hash block to avalanche
  static int fmix(int h1, int length) {
    h1 ^= length;
    h1 ^= h1 >>> 16;
    h1 *= 0x85ebca6b;
    h1 ^= h1 >>> 13;
    h1 *= 0xc2b2ae35;
    h1 ^= h1 >>> 16;
    return h1;
  }

  private static int toLittleEndian(int nativeWord) {
    return LITTLE_ENDIAN ? nativeWord : Integer.reverseBytes(nativeWord);
  }

  /**
   * Native-order reads relative to the start of a region.
   */
  private interface ByteSource {
    int getInt(long index);

    byte getByte(long index);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Murmur3Hasher that = (Murmur3Hasher) o;
    return seed == that.seed;
  }

  @Override
  public int hashCode() {
    return seed;
  }

  @Override
  public String toString() {
    return "Murmur3Hasher(seed=" + seed + ")";
  }
}
