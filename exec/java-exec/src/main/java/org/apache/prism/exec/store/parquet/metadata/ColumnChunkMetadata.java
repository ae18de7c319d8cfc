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

import java.util.Objects;

import org.apache.parquet.column.Dictionary;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.prism.common.expression.SchemaPath;

/**
 * Footer metadata of one column chunk of a row group.
 */
public class ColumnChunkMetadata {

  private final SchemaPath path;
  private final RawStatistics statistics;
  private final Dictionary dictionary;
  private final boolean fullyDictionaryEncoded;

  private ColumnChunkMetadata(ColumnChunkMetadataBuilder builder) {
    this.path = builder.path;
    this.statistics = builder.statistics;
    this.dictionary = builder.dictionary;
    this.fullyDictionaryEncoded = builder.fullyDictionaryEncoded;
  }

  public SchemaPath getPath() {
    return path;
  }

  public PrimitiveType getPrimitiveType() {
    return statistics.getPrimitiveType();
  }

  public RawStatistics getStatistics() {
    return statistics;
  }

  /**
   * @return the dictionary page of the chunk, or {@code null} when it was not read
   */
  public Dictionary getDictionary() {
    return dictionary;
  }

  /**
   * Whether every data page of the chunk is dictionary encoded, so the dictionary holds
   * every value of the chunk.
   */
  public boolean isFullyDictionaryEncoded() {
    return fullyDictionaryEncoded && dictionary != null;
  }

  public static ColumnChunkMetadataBuilder builder() {
    return new ColumnChunkMetadataBuilder();
  }

  public static class ColumnChunkMetadataBuilder {
    private SchemaPath path;
    private RawStatistics statistics;
    private Dictionary dictionary;
    private boolean fullyDictionaryEncoded;

    public ColumnChunkMetadataBuilder path(SchemaPath path) {
      this.path = path;
      return this;
    }

    public ColumnChunkMetadataBuilder statistics(RawStatistics statistics) {
      this.statistics = statistics;
      return this;
    }

    public ColumnChunkMetadataBuilder dictionary(Dictionary dictionary, boolean fullyDictionaryEncoded) {
      this.dictionary = dictionary;
      this.fullyDictionaryEncoded = fullyDictionaryEncoded;
      return this;
    }

    public ColumnChunkMetadata build() {
      Objects.requireNonNull(path, "path was not set");
      Objects.requireNonNull(statistics, "statistics was not set");
      return new ColumnChunkMetadata(this);
    }
  }
}
