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

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Thrown when a column, or the index of a dictionary-encoded column, has a type that
 * cannot be hashed compatibly with Spark.
 * <p>
 *   This is a mismatch between the caller and the hashed schema. Retrying the same batch
 *   fails the same way, and skipping the column would route rows to the wrong partitions,
 *   so the enclosing shuffle or join should be aborted.
 * </p>
 */
public class UnsupportedHashTypeException extends UnsupportedOperationException {

  private final ArrowType type;

  public UnsupportedHashTypeException(String message, ArrowType type) {
    super(message + ": " + type);
    this.type = type;
  }

  /**
   * Gets the type that could not be hashed.
   */
  public ArrowType getType() {
    return type;
  }
}
