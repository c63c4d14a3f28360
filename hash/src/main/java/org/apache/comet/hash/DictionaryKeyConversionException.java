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

import org.apache.arrow.vector.types.pojo.DictionaryEncoding;

/**
 * Thrown when a key of a dictionary-encoded column does not address an entry of its dictionary.
 */
public class DictionaryKeyConversionException extends IllegalArgumentException {

  private final long key;

  private final DictionaryEncoding dictionaryType;

  /**
   * Constructs an exception.
   * @param key the raw key value, as read from the index vector.
   * @param dictionaryType the encoding of the column, which names the index type.
   * @param dictionarySize the number of entries in the dictionary.
   */
  public DictionaryKeyConversionException(long key, DictionaryEncoding dictionaryType, int dictionarySize) {
    super("Can not convert key value " + formatKey(key, dictionaryType) + " to an index into dictionary " +
        dictionaryType + " of size " + dictionarySize);
    this.key = key;
    this.dictionaryType = dictionaryType;
  }

  public long getKey() {
    return key;
  }

  public DictionaryEncoding getDictionaryType() {
    return dictionaryType;
  }

  private static String formatKey(long key, DictionaryEncoding dictionaryType) {
    if (dictionaryType.getIndexType().getIsSigned()) {
      return Long.toString(key);
    }
    return Long.toUnsignedString(key);
  }
}
