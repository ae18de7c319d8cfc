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

import org.apache.prism.common.config.PrismConfig;
import org.apache.prism.exec.ExecConstants;

import com.google.common.base.MoreObjects;

/**
 * Pruning settings read from {@link PrismConfig}.
 */
public class PruningOptions {

  private final boolean enabled;
  private final boolean pageIndexEnabled;
  private final boolean literalGuaranteeEnabled;
  private final int parallelism;

  public PruningOptions(boolean enabled, boolean pageIndexEnabled, boolean literalGuaranteeEnabled, int parallelism) {
    this.enabled = enabled;
    this.pageIndexEnabled = pageIndexEnabled;
    this.literalGuaranteeEnabled = literalGuaranteeEnabled;
    this.parallelism = parallelism;
  }

  public static PruningOptions fromConfig(PrismConfig config) {
    return new PruningOptions(
        config.getBoolean(ExecConstants.PRUNING_ENABLED, true),
        config.getBoolean(ExecConstants.PRUNING_PAGE_INDEX_ENABLED, true),
        config.getBoolean(ExecConstants.PRUNING_LITERAL_GUARANTEE_ENABLED, true),
        config.getInt(ExecConstants.PRUNING_PARALLELISM, 1));
  }

  public static PruningOptions defaults() {
    return new PruningOptions(true, true, true, 1);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isPageIndexEnabled() {
    return pageIndexEnabled;
  }

  public boolean isLiteralGuaranteeEnabled() {
    return literalGuaranteeEnabled;
  }

  public int getParallelism() {
    return parallelism;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enabled", enabled)
        .add("pageIndexEnabled", pageIndexEnabled)
        .add("literalGuaranteeEnabled", literalGuaranteeEnabled)
        .add("parallelism", parallelism)
        .toString();
  }
}
