/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.prism.exec.store.parquet.stat;

import org.apache.parquet.bytes.BytesUtils;
import org.apache.parquet.column.Dictionary;
import org.apache.parquet.io.ParquetDecodingException;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Decodes plain encoded statistics values into the Java representation of their physical type:
 * {@code Boolean}, {@code Integer}, {@code Long}, {@code Float}, {@code Double} or {@code byte[]}.
 */
public final class PrimitiveValues {

  private static final int INT96_LENGTH = 12;

  private PrimitiveValues() {
  }

  public static Object decode(PrimitiveType type, byte[] bytes) throws CorruptStatisticsException {
    PrimitiveTypeName typeName = type.getPrimitiveTypeName();
    switch (typeName) {
      case BOOLEAN:
        checkLength(type, bytes, 1);
        return BytesUtils.bytesToBool(bytes);
      case INT32:
        checkLength(type, bytes, Integer.BYTES);
        return BytesUtils.bytesToInt(bytes);
      case INT64:
        checkLength(type, bytes, Long.BYTES);
        return BytesUtils.bytesToLong(bytes);
      case FLOAT:
        checkLength(type, bytes, Float.BYTES);
        return Float.intBitsToFloat(BytesUtils.bytesToInt(bytes));
      case DOUBLE:
        checkLength(type, bytes, Double.BYTES);
        return Double.longBitsToDouble(BytesUtils.bytesToLong(bytes));
      case INT96:
        checkLength(type, bytes, INT96_LENGTH);
        return bytes.clone();
      case FIXED_LEN_BYTE_ARRAY:
        checkLength(type, bytes, type.getTypeLength());
        return bytes.clone();
      case BINARY:
        return bytes.clone();
      default:
        throw new CorruptStatisticsException("Unsupported physical type " + typeName);
    }
  }

  /**
   * Decodes a dictionary id stored as a plain encoded INT32 value.
   */
  public static int decodeDictionaryId(byte[] bytes) throws CorruptStatisticsException {
    if (bytes.length != Integer.BYTES) {
      throw new CorruptStatisticsException("Dictionary id takes " + bytes.length + " bytes instead of 4");
    }
    return BytesUtils.bytesToInt(bytes);
  }

  public static Object decode(PrimitiveType type, Dictionary dictionary, int id) throws CorruptStatisticsException {
    if (id < 0 || id > dictionary.getMaxId()) {
      throw new CorruptStatisticsException("Dictionary id " + id + " is out of range [0, " + dictionary.getMaxId() + "]");
    }
    try {
      switch (type.getPrimitiveTypeName()) {
        case BOOLEAN:
          return dictionary.decodeToBoolean(id);
        case INT32:
          return dictionary.decodeToInt(id);
        case INT64:
          return dictionary.decodeToLong(id);
        case FLOAT:
          return dictionary.decodeToFloat(id);
        case DOUBLE:
          return dictionary.decodeToDouble(id);
        default:
          return dictionary.decodeToBinary(id).getBytes();
      }
    } catch (UnsupportedOperationException | ParquetDecodingException e) {
      throw new CorruptStatisticsException("Dictionary does not hold " + type.getPrimitiveTypeName() + " values", e);
    }
  }

  private static void checkLength(PrimitiveType type, byte[] bytes, int expected) throws CorruptStatisticsException {
    if (bytes.length != expected) {
      throw new CorruptStatisticsException(String.format("%s value of %s takes %d bytes instead of %d",
          type.getPrimitiveTypeName(), type.getName(), bytes.length, expected));
    }
  }
}
