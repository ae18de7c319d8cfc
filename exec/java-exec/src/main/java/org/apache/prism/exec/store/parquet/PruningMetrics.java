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

import org.apache.prism.exec.metrics.PrismMetrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Counters describing how much work statistics-based pruning saved.
 */
public class PruningMetrics {

  public static final String PREFIX = "prism.pruning";

  private final Counter filesTotal;
  private final Counter filesPruned;
  private final Counter rowGroupsTotal;
  private final Counter rowGroupsPruned;
  private final Counter rowGroupsPrunedByGuarantee;
  private final Counter pagesTotal;
  private final Counter pagesPruned;
  private final Counter corruptStatistics;
  private final Timer pruningTime;

  public PruningMetrics(MetricRegistry registry) {
    this.filesTotal = registry.counter(MetricRegistry.name(PREFIX, "files", "total"));
    this.filesPruned = registry.counter(MetricRegistry.name(PREFIX, "files", "pruned"));
    this.rowGroupsTotal = registry.counter(MetricRegistry.name(PREFIX, "row_groups", "total"));
    this.rowGroupsPruned = registry.counter(MetricRegistry.name(PREFIX, "row_groups", "pruned"));
    this.rowGroupsPrunedByGuarantee = registry.counter(MetricRegistry.name(PREFIX, "row_groups", "pruned_by_guarantee"));
    this.pagesTotal = registry.counter(MetricRegistry.name(PREFIX, "pages", "total"));
    this.pagesPruned = registry.counter(MetricRegistry.name(PREFIX, "pages", "pruned"));
    this.corruptStatistics = registry.counter(MetricRegistry.name(PREFIX, "statistics", "corrupt"));
    this.pruningTime = registry.timer(MetricRegistry.name(PREFIX, "time"));
  }

  /**
   * Metrics registered in the process wide registry.
   */
  public static PruningMetrics getInstance() {
    return new PruningMetrics(PrismMetrics.getInstance());
  }

  public Counter getFilesTotal() {
    return filesTotal;
  }

  public Counter getFilesPruned() {
    return filesPruned;
  }

  public Counter getRowGroupsTotal() {
    return rowGroupsTotal;
  }

  public Counter getRowGroupsPruned() {
    return rowGroupsPruned;
  }

  public Counter getRowGroupsPrunedByGuarantee() {
    return rowGroupsPrunedByGuarantee;
  }

  public Counter getPagesTotal() {
    return pagesTotal;
  }

  public Counter getPagesPruned() {
    return pagesPruned;
  }

  /**
   * Statistics fields discarded because their encoding was invalid.
   */
  public Counter getCorruptStatistics() {
    return corruptStatistics;
  }

  public Timer.Context time() {
    return pruningTime.time();
  }
}
