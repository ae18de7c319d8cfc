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
package org.apache.prism.exec.expr.stat;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.prism.exec.expr.StatisticsProvider;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Boolean predicates for statistics-based pruning. Children are evaluated through the
 * provider so that a child shared by several parents is matched once.
 */
public abstract class BooleanPredicate implements FilterPredicate {

  private final ImmutableList<FilterPredicate> children;

  private BooleanPredicate(List<FilterPredicate> children) {
    Preconditions.checkArgument(!children.isEmpty());
    this.children = ImmutableList.copyOf(children);
  }

  public List<FilterPredicate> getChildren() {
    return children;
  }

  protected abstract RowsMatch combine(RowsMatch left, RowsMatch right);

  protected abstract RowsMatch dominant();

  protected abstract String name();

  @Override
  public RowsMatch[] matches(StatisticsProvider provider) {
    RowsMatch[] result = provider.evaluate(children.get(0)).clone();
    for (int c = 1; c < children.size(); c++) {
      if (allEqual(result, dominant())) {
        break;
      }
      RowsMatch[] childResult = provider.evaluate(children.get(c));
      for (int i = 0; i < result.length; i++) {
        result[i] = combine(result[i], childResult[i]);
      }
    }
    return result;
  }

  private static boolean allEqual(RowsMatch[] values, RowsMatch expected) {
    for (RowsMatch value : values) {
      if (value != expected) {
        return false;
      }
    }
    return true;
  }

  /**
   * "and" : as long as one branch matches no rows, the unit matches no rows.
   */
  private static BooleanPredicate createAndPredicate(List<FilterPredicate> children) {
    return new BooleanPredicate(children) {
      @Override
      protected RowsMatch combine(RowsMatch left, RowsMatch right) {
        return left.and(right);
      }

      @Override
      protected RowsMatch dominant() {
        return RowsMatch.NONE;
      }

      @Override
      protected String name() {
        return "AND";
      }
    };
  }

  /**
   * "or" : the unit matches no rows only when every branch matches no rows.
   */
  private static BooleanPredicate createOrPredicate(List<FilterPredicate> children) {
    return new BooleanPredicate(children) {
      @Override
      protected RowsMatch combine(RowsMatch left, RowsMatch right) {
        return left.or(right);
      }

      @Override
      protected RowsMatch dominant() {
        return RowsMatch.SOME;
      }

      @Override
      protected String name() {
        return "OR";
      }
    };
  }

  public static FilterPredicate createBooleanPredicate(boolean and, List<FilterPredicate> children) {
    if (children.size() == 1) {
      return children.get(0);
    }
    return and ? createAndPredicate(children) : createOrPredicate(children);
  }

  @Override
  public String toString() {
    return children.stream()
        .map(Object::toString)
        .collect(Collectors.joining(" " + name() + " ", "(", ")"));
  }
}
