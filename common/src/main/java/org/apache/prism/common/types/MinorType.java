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
package org.apache.prism.common.types;

/**
 * Logical value types a column or literal may carry.
 */
public enum MinorType {
  BIT,
  TINYINT,
  SMALLINT,
  INT,
  BIGINT,
  UINT1,
  UINT2,
  UINT4,
  UINT8,
  FLOAT4,
  FLOAT8,
  VARDECIMAL,
  VARCHAR,
  VARBINARY,
  DATE,
  TIME,
  TIMESTAMP,
  TIMESTAMPTZ,
  /** Type of an untyped null literal. */
  NULL,
  /** Type of a column reference not yet resolved against a schema. */
  LATE;

  public boolean isIntegral() {
    switch (this) {
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
      case UINT1:
      case UINT2:
      case UINT4:
      case UINT8:
        return true;
      default:
        return false;
    }
  }

  public boolean isFloatingPoint() {
    return this == FLOAT4 || this == FLOAT8;
  }

  public boolean isNumeric() {
    return isIntegral() || isFloatingPoint() || this == VARDECIMAL;
  }

  public boolean isTemporal() {
    return this == DATE || this == TIME || this == TIMESTAMP || this == TIMESTAMPTZ;
  }

  public boolean isBytes() {
    return this == VARCHAR || this == VARBINARY;
  }

  /**
   * Smallest value representable by an integral type.
   */
  public long minIntegralValue() {
    switch (this) {
      case TINYINT:
        return Byte.MIN_VALUE;
      case SMALLINT:
        return Short.MIN_VALUE;
      case INT:
        return Integer.MIN_VALUE;
      case BIGINT:
        return Long.MIN_VALUE;
      case UINT1:
      case UINT2:
      case UINT4:
      case UINT8:
        return 0;
      default:
        throw new UnsupportedOperationException("Not an integral type: " + this);
    }
  }

  /**
   * Largest value representable by an integral type. Values of {@code UINT8} above
   * {@link Long#MAX_VALUE} are not representable in the normalized domain.
   */
  public long maxIntegralValue() {
    switch (this) {
      case TINYINT:
        return Byte.MAX_VALUE;
      case SMALLINT:
        return Short.MAX_VALUE;
      case INT:
        return Integer.MAX_VALUE;
      case BIGINT:
      case UINT8:
        return Long.MAX_VALUE;
      case UINT1:
        return 0xFFL;
      case UINT2:
        return 0xFFFFL;
      case UINT4:
        return 0xFFFF_FFFFL;
      default:
        throw new UnsupportedOperationException("Not an integral type: " + this);
    }
  }
}
