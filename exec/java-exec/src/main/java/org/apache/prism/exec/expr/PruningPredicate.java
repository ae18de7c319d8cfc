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
package org.apache.prism.exec.expr;

import java.util.Set;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.exec.expr.stat.ConstantPredicate;
import org.apache.prism.exec.expr.stat.FilterPredicate;

import com.google.common.collect.ImmutableSet;

/**
 * Compiled form of a filter, produced once per query by {@link PruningPredicateCompiler}
 * and reusable across scans and threads.
 */
public class PruningPredicate {

  private final String filter;
  private final FilterPredicate root;
  private final ImmutableSet<SchemaPath> columns;

  PruningPredicate(String filter, FilterPredicate root, Set<SchemaPath> columns) {
    this.filter = filter;
    this.root = root;
    this.columns = ImmutableSet.copyOf(columns);
  }

  public FilterPredicate getRoot() {
    return root;
  }

  /**
   * Columns whose statistics are needed to evaluate the predicate.
   */
  public Set<SchemaPath> getColumns() {
    return columns;
  }

  /**
   * Returns true when no unit can ever be pruned by this predicate,
   * so statistics need not be read at all.
   */
  public boolean isAlwaysKeep() {
    return root == ConstantPredicate.ALWAYS || root == ConstantPredicate.UNKNOWN;
  }

  /**
   * Returns true when the filter can never be true, so every unit can be pruned.
   */
  public boolean isNeverMatch() {
    return root == ConstantPredicate.NEVER;
  }

  public String getFilter() {
    return filter;
  }

  @Override
  public String toString() {
    return "PruningPredicate[filter=" + filter + ", pruning=" + root + "]";
  }
}
