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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.visitors.AbstractExprVisitor;
import org.apache.prism.exec.expr.PruningPredicate;
import org.apache.prism.exec.expr.guarantee.LiteralGuarantee;
import org.apache.prism.exec.record.metadata.TupleMetadata;

import com.google.common.collect.ImmutableList;

/**
 * Everything derived from a filter once per query: the compiled pruning predicate and the
 * literal guarantees. Immutable, so a filter may be shared by concurrent scans.
 */
public class PruningFilter {

  private final LogicalExpression filter;
  private final TupleMetadata schema;
  private final PruningPredicate predicate;
  private final List<LiteralGuarantee> guarantees;

  public PruningFilter(LogicalExpression filter, TupleMetadata schema, PruningPredicate predicate,
                       List<LiteralGuarantee> guarantees) {
    this.filter = filter;
    this.schema = schema;
    this.predicate = predicate;
    this.guarantees = ImmutableList.copyOf(guarantees);
  }

  public LogicalExpression getFilter() {
    return filter;
  }

  public TupleMetadata getSchema() {
    return schema;
  }

  public PruningPredicate getPredicate() {
    return predicate;
  }

  public List<LiteralGuarantee> getGuarantees() {
    return guarantees;
  }

  /**
   * Whether neither statistics nor guarantees can prune anything for this filter.
   */
  public boolean isAlwaysKeep() {
    return predicate.isAlwaysKeep() && guarantees.isEmpty();
  }

  /**
   * All columns the filter refers to, including those pruning cannot use.
   */
  public Set<SchemaPath> getReferencedColumns() {
    return filter.accept(new FieldReferenceFinder(), null);
  }

  @Override
  public String toString() {
    return "PruningFilter[predicate=" + predicate + ", guarantees=" + guarantees + "]";
  }

  /**
   * Search through a LogicalExpression, finding all internal schema path references and returning them in a set.
   */
  public static class FieldReferenceFinder extends AbstractExprVisitor<Set<SchemaPath>, Void, RuntimeException> {
    @Override
    public Set<SchemaPath> visitSchemaPath(SchemaPath path, Void value) {
      Set<SchemaPath> set = new HashSet<>();
      set.add(path);
      return set;
    }

    @Override
    public Set<SchemaPath> visitUnknown(LogicalExpression e, Void value) {
      Set<SchemaPath> paths = new HashSet<>();
      for (LogicalExpression ex : e) {
        paths.addAll(ex.accept(this, null));
      }
      return paths;
    }
  }
}
