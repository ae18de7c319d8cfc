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
package org.apache.prism.exec.store.parquet.metadata;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.metastore.metadata.MetadataType;

/**
 * Raw statistics of the units of one scan level, such as the row groups of a file
 * or the pages of a row group.
 */
public interface StatisticsSource {

  MetadataType getMetadataType();

  int getUnitCount();

  long getRowCount(int unit);

  /**
   * @return statistics of the column in the unit, or {@code null} when the unit
   *         does not have the column at all
   */
  RawStatistics getStatistics(int unit, SchemaPath column);

  default long[] getRowCounts() {
    long[] rowCounts = new long[getUnitCount()];
    for (int i = 0; i < rowCounts.length; i++) {
      rowCounts[i] = getRowCount(i);
    }
    return rowCounts;
  }
}
