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
import org.apache.arrow.vector.BaseLargeVariableWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FixedSizeBinaryVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Hashes the values of one non-dictionary column into the running per-row hashes.
 * <p>
 *   There is one arm per Arrow type, so a type added to Arrow has to be handled here
 *   before this class compiles again. Each value is hashed from the current hash of its row
 *   and the result replaces it. Null values leave the hash of their row untouched.
 * </p>
 */
class ColumnHashVisitor implements ArrowType.ArrowTypeVisitor<Void> {

  private static final boolean LITTLE_ENDIAN = ByteOrder.nativeOrder() == ByteOrder.LITTLE_ENDIAN;

  private static final int NEGATIVE_ZERO_FLOAT_BITS = Float.floatToRawIntBits(-0.0f);

  private static final long NEGATIVE_ZERO_DOUBLE_BITS = Double.doubleToRawLongBits(-0.0d);

  private final ValueVector vector;

  private final int[] hashes;

  /**
   * If the vector has no nulls, the validity check is skipped for every row.
   */
  private final boolean hasNulls;

  ColumnHashVisitor(ValueVector vector, int[] hashes) {
    this.vector = vector;
    this.hashes = hashes;
    this.hasNulls = vector.getNullCount() > 0;
  }

  private boolean skip(int index) {
    return hasNulls && vector.isNull(index);
  }

  @Override
  public Void visit(ArrowType.Null type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.Struct type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.List type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.LargeList type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.FixedSizeList type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.Union type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.Map type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.Int type) {
    if (!type.getIsSigned()) {
      throw unsupported(type);
    }
    switch (type.getBitWidth()) {
      case 8:
        hashTinyInt((TinyIntVector) vector);
        return null;
      case 16:
        hashSmallInt((SmallIntVector) vector);
        return null;
      case 32:
        hashInt((IntVector) vector);
        return null;
      case 64:
        hashBigInt((BigIntVector) vector);
        return null;
      default:
        throw unsupported(type);
    }
  }

  @Override
  public Void visit(ArrowType.FloatingPoint type) {
    switch (type.getPrecision()) {
      case SINGLE:
        hashFloat4((Float4Vector) vector);
        return null;
      case DOUBLE:
        hashFloat8((Float8Vector) vector);
        return null;
      default:
        throw unsupported(type);
    }
  }

  @Override
  public Void visit(ArrowType.Utf8 type) {
    hashVariableWidth((BaseVariableWidthVector) vector);
    return null;
  }

  @Override
  public Void visit(ArrowType.LargeUtf8 type) {
    hashLargeVariableWidth((BaseLargeVariableWidthVector) vector);
    return null;
  }

  @Override
  public Void visit(ArrowType.Binary type) {
    hashVariableWidth((BaseVariableWidthVector) vector);
    return null;
  }

  @Override
  public Void visit(ArrowType.LargeBinary type) {
    hashLargeVariableWidth((BaseLargeVariableWidthVector) vector);
    return null;
  }

  @Override
  public Void visit(ArrowType.FixedSizeBinary type) {
    FixedSizeBinaryVector binaryVector = (FixedSizeBinaryVector) vector;
    ArrowBuf data = binaryVector.getDataBuffer();
    int byteWidth = binaryVector.getByteWidth();
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashBytes(data, (long) i * byteWidth, byteWidth, hashes[i]);
    }
    return null;
  }

  @Override
  public Void visit(ArrowType.Bool type) {
    BitVector bitVector = (BitVector) vector;
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashInt(bitVector.get(i), hashes[i]);
    }
    return null;
  }

  @Override
  public Void visit(ArrowType.Decimal type) {
    if (type.getBitWidth() != 128) {
      throw unsupported(type);
    }
    hashDecimal((DecimalVector) vector);
    return null;
  }

  @Override
  public Void visit(ArrowType.Date type) {
    switch (type.getUnit()) {
      case DAY:
        DateDayVector dayVector = (DateDayVector) vector;
        for (int i = 0; i < hashes.length; i++) {
          if (skip(i)) {
            continue;
          }
          hashes[i] = Murmur3Hasher.hashInt(dayVector.get(i), hashes[i]);
        }
        return null;
      case MILLISECOND:
        DateMilliVector milliVector = (DateMilliVector) vector;
        for (int i = 0; i < hashes.length; i++) {
          if (skip(i)) {
            continue;
          }
          hashes[i] = Murmur3Hasher.hashLong(milliVector.get(i), hashes[i]);
        }
        return null;
      default:
        throw unsupported(type);
    }
  }

  @Override
  public Void visit(ArrowType.Time type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.Timestamp type) {
    // every unit is hashed as its raw 64-bit value, without normalizing the unit or the time zone
    TimeStampVector timeStampVector = (TimeStampVector) vector;
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashLong(timeStampVector.get(i), hashes[i]);
    }
    return null;
  }

  @Override
  public Void visit(ArrowType.Interval type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.Duration type) {
    throw unsupported(type);
  }

  @Override
  public Void visit(ArrowType.ExtensionType type) {
    throw unsupported(type);
  }

  private void hashTinyInt(TinyIntVector tinyIntVector) {
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashInt(tinyIntVector.get(i), hashes[i]);
    }
  }

  private void hashSmallInt(SmallIntVector smallIntVector) {
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashInt(smallIntVector.get(i), hashes[i]);
    }
  }

  private void hashInt(IntVector intVector) {
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashInt(intVector.get(i), hashes[i]);
    }
  }

  private void hashBigInt(BigIntVector bigIntVector) {
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      hashes[i] = Murmur3Hasher.hashLong(bigIntVector.get(i), hashes[i]);
    }
  }

  private void hashFloat4(Float4Vector float4Vector) {
    // raw IEEE-754 bits, NaN payloads included
    ArrowBuf data = float4Vector.getDataBuffer();
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      int bits = data.getInt((long) i * Float4Vector.TYPE_WIDTH);
      // -0.0 is hashed as +0.0
      if (bits == NEGATIVE_ZERO_FLOAT_BITS) {
        bits = 0;
      }
      hashes[i] = Murmur3Hasher.hashInt(bits, hashes[i]);
    }
  }

  private void hashFloat8(Float8Vector float8Vector) {
    ArrowBuf data = float8Vector.getDataBuffer();
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      long bits = data.getLong((long) i * Float8Vector.TYPE_WIDTH);
      // -0.0 is hashed as +0.0
      if (bits == NEGATIVE_ZERO_DOUBLE_BITS) {
        bits = 0L;
      }
      hashes[i] = Murmur3Hasher.hashLong(bits, hashes[i]);
    }
  }

  private void hashVariableWidth(BaseVariableWidthVector variableWidthVector) {
    ArrowBuf offsets = variableWidthVector.getOffsetBuffer();
    ArrowBuf data = variableWidthVector.getDataBuffer();
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      int start = offsets.getInt((long) i * BaseVariableWidthVector.OFFSET_WIDTH);
      int end = offsets.getInt((long) (i + 1) * BaseVariableWidthVector.OFFSET_WIDTH);
      hashes[i] = Murmur3Hasher.hashBytes(data, start, end - start, hashes[i]);
    }
  }

  private void hashLargeVariableWidth(BaseLargeVariableWidthVector variableWidthVector) {
    ArrowBuf offsets = variableWidthVector.getOffsetBuffer();
    ArrowBuf data = variableWidthVector.getDataBuffer();
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      long start = offsets.getLong((long) i * BaseLargeVariableWidthVector.OFFSET_WIDTH);
      long end = offsets.getLong((long) (i + 1) * BaseLargeVariableWidthVector.OFFSET_WIDTH);
      hashes[i] = Murmur3Hasher.hashBytes(data, start, end - start, hashes[i]);
    }
  }

  private void hashDecimal(DecimalVector decimalVector) {
    // values are stored as native-endian 128-bit two's complement integers
    ArrowBuf data = decimalVector.getDataBuffer();
    for (int i = 0; i < hashes.length; i++) {
      if (skip(i)) {
        continue;
      }
      long startIndex = (long) i * DecimalVector.TYPE_WIDTH;
      long low;
      long high;
      if (LITTLE_ENDIAN) {
        low = data.getLong(startIndex);
        high = data.getLong(startIndex + Long.BYTES);
      } else {
        high = data.getLong(startIndex);
        low = data.getLong(startIndex + Long.BYTES);
      }
      hashes[i] = Murmur3Hasher.hashInt128(low, high, hashes[i]);
    }
  }

  private static UnsupportedHashTypeException unsupported(ArrowType type) {
    return new UnsupportedHashTypeException("Unsupported data type in hasher", type);
  }
}
