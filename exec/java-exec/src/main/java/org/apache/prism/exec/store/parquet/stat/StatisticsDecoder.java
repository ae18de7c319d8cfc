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

import org.apache.parquet.schema.PrimitiveType;
import org.apache.prism.common.types.MajorType;

/**
 * Converts a physical statistics value into the normalized domain of a column type.
 */
@FunctionalInterface
public interface StatisticsDecoder {

  /**
   * @param physical value as returned by {@link PrimitiveValues}
   * @param fileType type of the column in the file, with its logical type annotation
   * @param columnType type of the column the filter refers to
   * @param bound whether the value is a lower bound, an upper bound or an exact value
   * @return normalized value, or {@code null} when it cannot be represented in the column type
   * @throws CorruptStatisticsException when the value cannot be decoded at all
   */
  Object decode(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound)
      throws CorruptStatisticsException;
}
