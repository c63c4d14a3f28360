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

import java.util.ArrayList;
import java.util.List;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes per-row hash codes over a batch of columns that are identical to the ones
 * Spark's {@code Murmur3Hash} expression computes for the same rows.
 * <p>
 *   The caller owns an {@code int[]} with one running hash per row, usually filled with
 *   the seed 42 that Spark uses for hash partitioning. Columns are hashed in the given order,
 *   each one from the hashes left by the previous, so the order must be the one Spark uses
 *   for the same key. The array is updated in place and returned. It must not be shared with
 *   another thread while a call is in progress.
 * </p>
 * <p>
 *   The hasher keeps no state between calls, so one instance can be used from several threads
 *   as long as each thread hashes into its own array.
 * </p>
 */
public class ColumnHasher {

  private static final Logger logger = LoggerFactory.getLogger(ColumnHasher.class);

  private final DictionaryColumnHasher dictionaryHasher;

  /**
   * Constructs a hasher for columns that are not dictionary-encoded.
   */
  public ColumnHasher() {
    this(null);
  }

  /**
   * Constructs a hasher.
   * @param provider the provider of the dictionaries of dictionary-encoded columns.
   */
  public ColumnHasher(DictionaryProvider provider) {
    this.dictionaryHasher = new DictionaryColumnHasher(this, provider);
  }

  /**
   * Hashes the columns into the running hashes, one column after the other.
   * A null value leaves the hash of its row unchanged.
   * @param columns the key columns, each with as many values as there are hashes.
   * @param hashes the running hashes, updated in place.
   * @return the same hashes array.
   * @throws UnsupportedHashTypeException if a column type cannot be hashed.
   * @throws DictionaryKeyConversionException if a dictionary key does not address an entry.
   */
  public int[] createHashes(List<? extends ValueVector> columns, int[] hashes) {
    Preconditions.checkNotNull(hashes, "hashes");
    if (logger.isDebugEnabled()) {
      logger.debug("Hashing {} columns over {} rows", columns.size(), hashes.length);
    }
    for (ValueVector column : columns) {
      hashColumn(column, hashes);
    }
    return hashes;
  }

  /**
   * Hashes the named columns of a batch into the running hashes.
   * @param root the batch.
   * @param keyColumns names of the key columns, in hashing order.
   * @param hashes the running hashes, updated in place.
   * @return the same hashes array.
   */
  public int[] createHashes(VectorSchemaRoot root, List<String> keyColumns, int[] hashes) {
    List<FieldVector> columns = new ArrayList<>(keyColumns.size());
    for (String name : keyColumns) {
      FieldVector vector = root.getVector(name);
      Preconditions.checkArgument(vector != null, "No column named %s in schema %s", name, root.getSchema());
      columns.add(vector);
    }
    return createHashes(columns, hashes);
  }

  private void hashColumn(ValueVector column, int[] hashes) {
    Preconditions.checkArgument(column.getValueCount() == hashes.length,
        "Column %s has %s values, but there are %s hashes",
        column.getName(), column.getValueCount(), hashes.length);

    DictionaryEncoding encoding = column.getField().getDictionary();
    if (encoding != null) {
      dictionaryHasher.hash(column, encoding, hashes);
    } else {
      column.getField().getType().accept(new ColumnHashVisitor(column, hashes));
    }
  }
}
