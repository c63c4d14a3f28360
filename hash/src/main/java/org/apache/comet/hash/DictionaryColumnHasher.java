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

import java.util.Collections;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hashes dictionary-encoded columns.
 * <p>
 *   Each dictionary entry is hashed once, from seed 0, and the hash of an entry is then
 *   copied to every row whose key refers to it.
 * </p>
 * <p>
 *   Unlike every other column, a dictionary-encoded column does not chain from the hash
 *   its rows had before: the hash of a non-null row is replaced by the hash of its entry.
 *   Rows with a null key keep their hash.
 * </p>
 */
class DictionaryColumnHasher {

  private static final Logger logger = LoggerFactory.getLogger(DictionaryColumnHasher.class);

  /**
   * Hashes the dictionary entries.
   */
  private final ColumnHasher valueHasher;

  /**
   * Source of the dictionaries, may be null if no column is dictionary-encoded.
   */
  private final DictionaryProvider provider;

  DictionaryColumnHasher(ColumnHasher valueHasher, DictionaryProvider provider) {
    this.valueHasher = valueHasher;
    this.provider = provider;
  }

  /**
   * Replaces the hashes of the non-null rows by the hashes of the entries their keys refer to.
   * @param keys the index vector of the encoded column.
   * @param encoding the dictionary encoding of the column.
   * @param hashes the running hashes, one per row.
   */
  void hash(ValueVector keys, DictionaryEncoding encoding, int[] hashes) {
    if (!(keys instanceof BaseIntVector)) {
      throw new UnsupportedHashTypeException("Unsupported dictionary type in hasher", keys.getField().getType());
    }
    checkIndexType(encoding.getIndexType());

    Dictionary dictionary = provider == null ? null : provider.lookup(encoding.getId());
    Preconditions.checkArgument(dictionary != null, "No dictionary was found for id %s", encoding.getId());

    FieldVector values = dictionary.getVector();
    int[] valueHashes = new int[values.getValueCount()];
    if (logger.isDebugEnabled()) {
      logger.debug("Hashing dictionary [{}] of {} entries for {} rows", encoding.getId(), valueHashes.length,
          hashes.length);
    }
    valueHasher.createHashes(Collections.singletonList(values), valueHashes);

    BaseIntVector indices = (BaseIntVector) keys;
    boolean hasNulls = keys.getNullCount() > 0;
    for (int i = 0; i < hashes.length; i++) {
      if (hasNulls && keys.isNull(i)) {
        continue;
      }
      long key = indices.getValueAsLong(i);
      if (key < 0 || key >= valueHashes.length) {
        throw new DictionaryKeyConversionException(key, encoding, valueHashes.length);
      }
      hashes[i] = valueHashes[(int) key];
    }
  }

  private static void checkIndexType(ArrowType.Int indexType) {
    switch (indexType.getBitWidth()) {
      case 8:
      case 16:
      case 32:
      case 64:
        return;
      default:
        throw new UnsupportedHashTypeException("Unsupported dictionary type in hasher", indexType);
    }
  }
}
