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
package org.apache.prism.exec.store.parquet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.prism.common.config.PrismConfig;
import org.apache.prism.common.exceptions.UserException;
import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.exec.expr.Decision;
import org.apache.prism.exec.expr.PruningEvaluator;
import org.apache.prism.exec.expr.PruningPredicate;
import org.apache.prism.exec.expr.PruningPredicateCompiler;
import org.apache.prism.exec.expr.StatisticsProvider;
import org.apache.prism.exec.expr.coerce.CoercionRules;
import org.apache.prism.exec.expr.guarantee.LiteralGuarantee;
import org.apache.prism.exec.expr.guarantee.LiteralGuaranteeAnalyzer;
import org.apache.prism.exec.expr.stat.StatisticsBatch;
import org.apache.prism.exec.record.metadata.ColumnMetadata;
import org.apache.prism.exec.record.metadata.TupleMetadata;
import org.apache.prism.exec.store.parquet.metadata.ColumnChunkMetadata;
import org.apache.prism.exec.store.parquet.metadata.FileMetadata;
import org.apache.prism.exec.store.parquet.metadata.PageStatisticsSource;
import org.apache.prism.exec.store.parquet.metadata.RowGroupMetadata;
import org.apache.prism.exec.store.parquet.metadata.RowGroupStatisticsSource;
import org.apache.prism.exec.store.parquet.metadata.StatisticsSource;
import org.apache.prism.exec.store.parquet.stat.StatisticsDecoders;
import org.apache.prism.exec.store.parquet.stat.StatisticsExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Prunes the files of a table, the row groups of a file and the pages of its row groups.
 * <p>
 * Row groups are first checked against the literal guarantees of the filter using partition
 * values and dictionaries, then against their footer statistics. Row groups that survive are
 * refined with their page index. A row group whose pages are all skipped is skipped as well.
 * <p>
 * A pruner created from a {@link PrismConfig} owns its extraction threads and must be closed.
 */
public class ParquetPruner implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ParquetPruner.class);

  private static final long TERMINATION_TIMEOUT_SECONDS = 10;

  private final PruningOptions options;
  private final CoercionRules coercionRules;
  private final StatisticsExtractor extractor;
  private final PruningMetrics metrics;
  private final ListeningExecutorService executor;
  // shut down on close, null when the executor belongs to the caller
  private final ExecutorService ownedExecutor;

  /**
   * @param executor runs statistics extraction of several columns in parallel,
   *                 {@code null} to extract in the calling thread. It is not shut down
   *                 by {@link #close()}.
   */
  public ParquetPruner(PruningOptions options, CoercionRules coercionRules, StatisticsDecoders decoders,
                       PruningMetrics metrics, ExecutorService executor) {
    this(options, coercionRules, decoders, metrics, executor, false);
  }

  /**
   * Pruner with default rules and process wide metrics. Statistics of several columns are
   * extracted on daemon threads when the configured parallelism allows it.
   */
  public ParquetPruner(PrismConfig config) {
    this(PruningOptions.fromConfig(config));
  }

  private ParquetPruner(PruningOptions options) {
    this(options, CoercionRules.defaults(), StatisticsDecoders.defaults(), PruningMetrics.getInstance(),
        newExecutor(options.getParallelism()), true);
  }

  private ParquetPruner(PruningOptions options, CoercionRules coercionRules, StatisticsDecoders decoders,
                        PruningMetrics metrics, ExecutorService executor, boolean ownsExecutor) {
    this.options = Preconditions.checkNotNull(options);
    this.coercionRules = Preconditions.checkNotNull(coercionRules);
    this.metrics = Preconditions.checkNotNull(metrics);
    this.extractor = new StatisticsExtractor(decoders, metrics);
    this.executor = executor == null || options.getParallelism() <= 1
        ? MoreExecutors.newDirectExecutorService()
        : MoreExecutors.listeningDecorator(executor);
    this.ownedExecutor = ownsExecutor ? executor : null;
  }

  private static ExecutorService newExecutor(int parallelism) {
    if (parallelism <= 1) {
      return null;
    }
    return Executors.newFixedThreadPool(parallelism, new ThreadFactoryBuilder()
        .setNameFormat("prism-pruning-%d")
        .setDaemon(true)
        .build());
  }

  public PruningOptions getOptions() {
    return options;
  }

  /**
   * Stops the extraction threads the pruner created. Executors supplied by the caller
   * keep running.
   */
  @Override
  public void close() {
    if (ownedExecutor != null && !MoreExecutors.shutdownAndAwaitTermination(ownedExecutor, TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
      logger.warn("Pruning threads did not terminate within {} seconds", TERMINATION_TIMEOUT_SECONDS);
    }
  }

  /**
   * Whether the threads created by the pruner have terminated. Always true for a pruner
   * without threads of its own.
   */
  boolean isTerminated() {
    return ownedExecutor == null || ownedExecutor.isTerminated();
  }

  /**
   * Compiles the filter and derives its literal guarantees.
   *
   * @param filter type-checked filter
   * @param schema columns of the table
   */
  public PruningFilter prepare(LogicalExpression filter, TupleMetadata schema) {
    PruningPredicate predicate = new PruningPredicateCompiler(coercionRules).compile(filter, schema);
    List<LiteralGuarantee> guarantees = options.isLiteralGuaranteeEnabled()
        ? new LiteralGuaranteeAnalyzer(coercionRules).analyze(filter, schema)
        : Collections.emptyList();
    return new PruningFilter(filter, schema, predicate, guarantees);
  }

  /**
   * Decides which files of a table can contain matching rows. Statistics of a file cover all
   * of its row groups, and partition columns hold a single value per file.
   */
  public AccessPlan pruneFiles(List<FileMetadata> files, PruningFilter filter) {
    if (!options.isEnabled()) {
      return AccessPlan.selectAll(files.size());
    }
    try (Timer.Context ignored = metrics.time()) {
      metrics.getFilesTotal().inc(files.size());
      long[] rowCounts = new long[files.size()];
      for (int i = 0; i < rowCounts.length; i++) {
        rowCounts[i] = files.get(i).getRowCount();
      }
      Decision[] decisions = new Decision[files.size()];
      Arrays.fill(decisions, Decision.KEEP);
      for (int i = 0; i < decisions.length; i++) {
        if (excludedByPartition(files.get(i), filter)) {
          decisions[i] = Decision.SKIP;
        }
      }
      PruningPredicate predicate = filter.getPredicate();
      if (!predicate.isAlwaysKeep()) {
        Map<SchemaPath, StatisticsBatch> statistics = new HashMap<>();
        for (SchemaPath column : predicate.getColumns()) {
          statistics.put(column, fileStatistics(files, column, columnType(filter, column), rowCounts));
        }
        merge(decisions, PruningEvaluator.decide(predicate, StatisticsProvider.of(statistics, rowCounts)));
      }
      AccessPlan plan = AccessPlan.of(decisions);
      int pruned = files.size() - plan.getKeptUnitCount();
      metrics.getFilesPruned().inc(pruned);
      logger.info("Pruned {} of {} files using filter {}", pruned, files.size(), predicate.getFilter());
      return plan;
    }
  }

  /**
   * Decides which row groups of a file, and which pages of kept row groups, can contain
   * matching rows.
   */
  public AccessPlan pruneRowGroups(FileMetadata file, PruningFilter filter) {
    List<RowGroupMetadata> rowGroups = file.getRowGroups();
    if (!options.isEnabled()) {
      return AccessPlan.selectAll(rowGroups.size());
    }
    try (Timer.Context ignored = metrics.time()) {
      metrics.getRowGroupsTotal().inc(rowGroups.size());
      Decision[] decisions = new Decision[rowGroups.size()];
      Arrays.fill(decisions, Decision.KEEP);

      int prunedByGuarantee = 0;
      if (!filter.getGuarantees().isEmpty()) {
        boolean fileExcluded = excludedByPartition(file, filter);
        for (int i = 0; i < decisions.length; i++) {
          if (fileExcluded || excludedByDictionary(rowGroups.get(i), file, filter)) {
            decisions[i] = Decision.SKIP;
            prunedByGuarantee++;
          }
        }
        metrics.getRowGroupsPrunedByGuarantee().inc(prunedByGuarantee);
      }

      PruningPredicate predicate = filter.getPredicate();
      if (!predicate.isAlwaysKeep() && prunedByGuarantee < decisions.length) {
        RowGroupStatisticsSource source = new RowGroupStatisticsSource(rowGroups);
        merge(decisions, PruningEvaluator.decide(predicate, provider(source, file, filter, true)));
      }
      AccessPlan plan = AccessPlan.of(decisions);

      if (options.isPageIndexEnabled() && !predicate.isAlwaysKeep()) {
        for (int unit : plan.keptUnits()) {
          refinePages(plan, unit, rowGroups.get(unit), file, filter);
        }
      }
      int pruned = rowGroups.size() - plan.getKeptUnitCount();
      metrics.getRowGroupsPruned().inc(pruned);
      logger.info("Pruned {} of {} row groups of {}, {} of them by literal guarantees",
          pruned, rowGroups.size(), file.getLocation(), prunedByGuarantee);
      return plan;
    }
  }

  private void refinePages(AccessPlan plan, int unit, RowGroupMetadata rowGroup, FileMetadata file,
                           PruningFilter filter) {
    if (rowGroup.getPageIndex() == null) {
      return;
    }
    PageStatisticsSource source = new PageStatisticsSource(rowGroup);
    Decision[] pages = PruningEvaluator.decide(filter.getPredicate(), provider(source, file, filter, false));
    plan.refine(unit, pages);
    int skipped = 0;
    for (Decision page : pages) {
      if (!page.isKeep()) {
        skipped++;
      }
    }
    metrics.getPagesTotal().inc(pages.length);
    metrics.getPagesPruned().inc(skipped);
    if (skipped == pages.length && pages.length > 0) {
      plan.skip(unit);
    }
    logger.debug("Pruned {} of {} pages of row group {} of {}", skipped, pages.length,
        rowGroup.getRowGroupIndex(), file.getLocation());
  }

  private boolean excludedByPartition(FileMetadata file, PruningFilter filter) {
    for (LiteralGuarantee guarantee : filter.getGuarantees()) {
      Literal partitionValue = file.getPartitionValues().get(guarantee.getColumn());
      if (partitionValue == null) {
        continue;
      }
      Optional<List<Object>> values = partitionValues(partitionValue, guarantee.getColumnType());
      if (values.isPresent() && guarantee.excludes(values.get())) {
        logger.debug("File {} excluded by {}", file.getLocation(), guarantee);
        return true;
      }
    }
    return false;
  }

  private boolean excludedByDictionary(RowGroupMetadata rowGroup, FileMetadata file, PruningFilter filter) {
    for (LiteralGuarantee guarantee : filter.getGuarantees()) {
      if (file.getPartitionValues().containsKey(guarantee.getColumn())) {
        continue;
      }
      ColumnChunkMetadata chunk = rowGroup.getColumn(guarantee.getColumn());
      // a column missing from the file holds only nulls
      Optional<List<Object>> values = chunk == null
          ? Optional.of(Collections.emptyList())
          : extractor.extractValues(chunk, guarantee.getColumnType());
      if (values.isPresent() && guarantee.excludes(values.get())) {
        logger.debug("Row group {} of {} excluded by {}", rowGroup.getRowGroupIndex(), file.getLocation(), guarantee);
        return true;
      }
    }
    return false;
  }

  /**
   * Values of a partition column, empty for a null partition.
   */
  private Optional<List<Object>> partitionValues(Literal value, MajorType columnType) {
    if (value.isNull()) {
      return Optional.of(Collections.emptyList());
    }
    return coercionRules.coerce(value, columnType).map(Collections::singletonList);
  }

  /**
   * Provider over the units of the source. Partition columns are constant over all units.
   *
   * @param parallel extracts columns on the executor
   */
  private StatisticsProvider provider(StatisticsSource source, FileMetadata file, PruningFilter filter,
                                      boolean parallel) {
    long[] rowCounts = source.getRowCounts();
    Map<SchemaPath, StatisticsBatch> statistics = new HashMap<>();
    List<SchemaPath> extracted = new ArrayList<>();
    for (SchemaPath column : filter.getPredicate().getColumns()) {
      MajorType columnType = columnType(filter, column);
      Literal partitionValue = file.getPartitionValues().get(column);
      if (partitionValue != null) {
        statistics.put(column, partitionStatistics(partitionValue, columnType, rowCounts));
      } else {
        extracted.add(column);
      }
    }
    if (parallel && extracted.size() > 1) {
      List<ListenableFuture<StatisticsBatch>> futures = new ArrayList<>();
      for (SchemaPath column : extracted) {
        futures.add(executor.submit(() -> extractor.extract(column, columnType(filter, column), source)));
      }
      List<StatisticsBatch> batches = getAll(futures, file);
      for (int i = 0; i < extracted.size(); i++) {
        statistics.put(extracted.get(i), batches.get(i));
      }
    } else {
      for (SchemaPath column : extracted) {
        statistics.put(column, extractor.extract(column, columnType(filter, column), source));
      }
    }
    return StatisticsProvider.of(statistics, rowCounts);
  }

  private List<StatisticsBatch> getAll(List<ListenableFuture<StatisticsBatch>> futures, FileMetadata file) {
    try {
      return Futures.allAsList(futures).get();
    } catch (ExecutionException e) {
      throw UserException.systemError(e.getCause())
          .message("Failed to read statistics of %s", file.getLocation())
          .build(logger);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw UserException.systemError(e)
          .message("Interrupted while reading statistics of %s", file.getLocation())
          .build(logger);
    }
  }

  /**
   * Statistics of a column over files, each file summarizing its row groups.
   */
  private StatisticsBatch fileStatistics(List<FileMetadata> files, SchemaPath column, MajorType columnType,
                                         long[] rowCounts) {
    StatisticsBatch.Builder builder = StatisticsBatch.builder(columnType, files.size());
    for (int i = 0; i < files.size(); i++) {
      FileMetadata file = files.get(i);
      Literal partitionValue = file.getPartitionValues().get(column);
      StatisticsBatch summary = partitionValue != null
          ? partitionStatistics(partitionValue, columnType, new long[] {rowCounts[i]})
          : extractor.extract(column, columnType, new RowGroupStatisticsSource(file.getRowGroups())).summarize();
      builder.set(i, summary.getMin(0), summary.getMax(0), summary.getNullCount(0), rowCounts[i]);
    }
    return builder.build();
  }

  private StatisticsBatch partitionStatistics(Literal value, MajorType columnType, long[] rowCounts) {
    StatisticsBatch.Builder builder = StatisticsBatch.builder(columnType, rowCounts.length);
    Optional<Object> coerced = value.isNull() ? Optional.empty() : coercionRules.coerce(value, columnType);
    for (int i = 0; i < rowCounts.length; i++) {
      if (value.isNull()) {
        builder.set(i, null, null, rowCounts[i], rowCounts[i]);
      } else if (coerced.isPresent()) {
        builder.set(i, coerced.get(), coerced.get(), 0L, rowCounts[i]);
      } else {
        builder.set(i, null, null, null, rowCounts[i]);
      }
    }
    return builder.build();
  }

  private static MajorType columnType(PruningFilter filter, SchemaPath column) {
    ColumnMetadata metadata = filter.getSchema().metadata(column);
    Preconditions.checkState(metadata != null, "Column %s is not in the schema", column);
    return metadata.majorType();
  }

  private static void merge(Decision[] decisions, Decision[] other) {
    for (int i = 0; i < decisions.length; i++) {
      if (!other[i].isKeep()) {
        decisions[i] = Decision.SKIP;
      }
    }
  }
}
