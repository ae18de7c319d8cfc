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
package org.apache.prism.exec;

public final class ExecConstants {
  private ExecConstants() {
    // Don't allow instantiation
  }

  public static final String PRUNING_ENABLED = "prism.exec.pruning.enabled";
  public static final String PRUNING_PAGE_INDEX_ENABLED = "prism.exec.pruning.page_index.enabled";
  public static final String PRUNING_LITERAL_GUARANTEE_ENABLED = "prism.exec.pruning.literal_guarantee.enabled";
  /**
   * Number of columns whose statistics may be extracted concurrently. Values below 2 disable fan out.
   */
  public static final String PRUNING_PARALLELISM = "prism.exec.pruning.parallelism";
}
