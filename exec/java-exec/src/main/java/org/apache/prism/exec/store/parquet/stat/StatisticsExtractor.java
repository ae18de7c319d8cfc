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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.apache.parquet.column.Dictionary;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.exec.expr.stat.StatisticsBatch;
import org.apache.prism.exec.store.parquet.PruningMetrics;
import org.apache.prism.exec.store.parquet.metadata.ColumnChunkMetadata;
import org.apache.prism.exec.store.parquet.metadata.RawStatistics;
import org.apache.prism.exec.store.parquet.metadata.StatisticsSource;
import org.apache.prism.metastore.util.ValueComparators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Normalizes raw statistics of all units of a {@link StatisticsSource} into a
 * {@link StatisticsBatch}.
 * <p>
 * Anything that is missing or cannot be represented in the column type becomes unknown.
 * A field whose encoding is invalid is treated the same way and counted as corrupt, so bad
 * metadata costs pruning opportunities but never fails a scan. A unit that does not have
 * the column at all holds only nulls in it.
 */
public class StatisticsExtractor {
  private static final Logger logger = LoggerFactory.getLogger(StatisticsExtractor.class);

  private final StatisticsDecoders decoders;
  private final PruningMetrics metrics;

  public StatisticsExtractor(StatisticsDecoders decoders, PruningMetrics metrics) {
    this.decoders = Preconditions.checkNotNull(decoders);
    this.metrics = Preconditions.checkNotNull(metrics);
  }

  public StatisticsBatch extract(SchemaPath column, MajorType columnType, StatisticsSource source) {
    int unitCount = source.getUnitCount();
    StatisticsBatch.Builder builder = StatisticsBatch.builder(columnType, unitCount);
    StatisticsDecoder decoder = decoders.forType(columnType.getMinorType());
    Comparator<Object> comparator = ValueComparators.forType(columnType.getMinorType());
    for (int unit = 0; unit < unitCount; unit++) {
      long rowCount = source.getRowCount(unit);
      RawStatistics raw = source.getStatistics(unit, column);
      if (raw == null) {
        builder.set(unit, null, null, rowCount, rowCount);
        continue;
      }
      Long nullCount = raw.getNullCount();
      if (nullCount != null && (nullCount < 0 || nullCount > rowCount)) {
        corrupt(column, source, unit, "null count " + nullCount + " of " + rowCount + " rows");
        nullCount = null;
      }
      Object min = null;
      Object max = null;
      if (decoder != null && comparator != null && !columnType.isRepeated()) {
        min = decodeBound(column, columnType, source, unit, raw, decoder, comparator, Bound.MIN);
        max = decodeBound(column, columnType, source, unit, raw, decoder, comparator, Bound.MAX);
        if (min != null && max != null && comparator.compare(min, max) > 0) {
          corrupt(column, source, unit, "min is greater than max");
          min = null;
          max = null;
        }
      }
      builder.set(unit, min, max, nullCount, rowCount);
    }
    StatisticsBatch batch = builder.build();
    logger.trace("Extracted {} statistics of {}: {}", source.getMetadataType(), column, batch);
    return batch;
  }

  /**
   * Returns every distinct value of a fully dictionary encoded column chunk, normalized to
   * the column type.
   *
   * @return values of the chunk, or empty when they are not all known exactly
   */
  public Optional<List<Object>> extractValues(ColumnChunkMetadata chunk, MajorType columnType) {
    StatisticsDecoder decoder = decoders.forType(columnType.getMinorType());
    if (!chunk.isFullyDictionaryEncoded() || decoder == null || columnType.isRepeated()) {
      return Optional.empty();
    }
    Dictionary dictionary = chunk.getDictionary();
    PrimitiveType fileType = chunk.getPrimitiveType();
    List<Object> values = new ArrayList<>(dictionary.getMaxId() + 1);
    try {
      for (int id = 0; id <= dictionary.getMaxId(); id++) {
        Object value = decoder.decode(PrimitiveValues.decode(fileType, dictionary, id), fileType, columnType, Bound.EXACT);
        if (value == null) {
          return Optional.empty();
        }
        values.add(value);
      }
    } catch (CorruptStatisticsException e) {
      metrics.getCorruptStatistics().inc();
      logger.debug("Unable to decode dictionary of {}: {}", chunk.getPath(), e.getMessage());
      return Optional.empty();
    }
    return Optional.of(values);
  }

  private Object decodeBound(SchemaPath column, MajorType columnType, StatisticsSource source, int unit,
                             RawStatistics raw, StatisticsDecoder decoder, Comparator<Object> comparator, Bound bound) {
    PrimitiveType fileType = raw.getPrimitiveType();
    try {
      if (raw.isDictionaryBounds() && !raw.isSortedDictionary()) {
        return dictionaryBound(raw.getDictionary(), fileType, columnType, decoder, comparator, bound);
      }
      byte[] bytes = bound == Bound.MIN ? raw.getMin() : raw.getMax();
      if (bytes == null) {
        return null;
      }
      Object physical = raw.isDictionaryBounds()
          ? PrimitiveValues.decode(fileType, raw.getDictionary(), PrimitiveValues.decodeDictionaryId(bytes))
          : PrimitiveValues.decode(fileType, bytes);
      return decoder.decode(physical, fileType, columnType, bound);
    } catch (CorruptStatisticsException e) {
      corrupt(column, source, unit, bound + " value: " + e.getMessage());
      return null;
    }
  }

  /**
   * Bound over all entries of an unsorted dictionary. NaN entries of floating point columns
   * do not take part in bounds.
   */
  private static Object dictionaryBound(Dictionary dictionary, PrimitiveType fileType, MajorType columnType,
                                        StatisticsDecoder decoder, Comparator<Object> comparator, Bound bound)
      throws CorruptStatisticsException {
    boolean floatingPoint = columnType.getMinorType().isFloatingPoint();
    Object result = null;
    for (int id = 0; id <= dictionary.getMaxId(); id++) {
      Object value = decoder.decode(PrimitiveValues.decode(fileType, dictionary, id), fileType, columnType, bound);
      if (value == null) {
        if (floatingPoint) {
          continue;
        }
        return null;
      }
      int comparison = result == null ? 0 : comparator.compare(value, result);
      if (result == null || (bound == Bound.MIN ? comparison < 0 : comparison > 0)) {
        result = value;
      }
    }
    return result;
  }

  private void corrupt(SchemaPath column, StatisticsSource source, int unit, String details) {
    metrics.getCorruptStatistics().inc();
    logger.debug("Ignoring corrupt statistics of {} in {} {}: {}", column, source.getMetadataType(), unit, details);
  }
}
