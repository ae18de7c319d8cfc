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
package org.apache.prism.exec.expr.guarantee;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.prism.common.expression.BooleanOperator;
import org.apache.prism.common.expression.BooleanTestExpression;
import org.apache.prism.common.expression.ComparisonExpression;
import org.apache.prism.common.expression.ComparisonOperator;
import org.apache.prism.common.expression.InListExpression;
import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.NotExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.exec.expr.coerce.CoercionRules;
import org.apache.prism.exec.expr.guarantee.LiteralGuarantee.Kind;
import org.apache.prism.exec.record.metadata.ColumnMetadata;
import org.apache.prism.exec.record.metadata.TupleMetadata;
import org.apache.prism.metastore.util.ValueComparators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Derives {@link LiteralGuarantee}s from equality and membership tests of a filter.
 * <p>
 * Conjunctions combine guarantees of each column. A disjunction yields a guarantee only when
 * every branch constrains the same single column in the same way. A test that cannot be
 * turned into an exact value set gives no guarantee, and a disjunction containing such a
 * test gives none either.
 */
public class LiteralGuaranteeAnalyzer {
  private static final Logger logger = LoggerFactory.getLogger(LiteralGuaranteeAnalyzer.class);

  private final CoercionRules coercionRules;

  public LiteralGuaranteeAnalyzer() {
    this(CoercionRules.defaults());
  }

  public LiteralGuaranteeAnalyzer(CoercionRules coercionRules) {
    this.coercionRules = Preconditions.checkNotNull(coercionRules);
  }

  /**
   * @return guarantees implied by the filter, at most one per column
   */
  public List<LiteralGuarantee> analyze(LogicalExpression filter, TupleMetadata schema) {
    Map<SchemaPath, LiteralGuarantee> guarantees = analyze(filter, false, schema);
    logger.debug("Filter {} guarantees {}", filter, guarantees.values());
    return ImmutableList.copyOf(guarantees.values());
  }

  private Map<SchemaPath, LiteralGuarantee> analyze(LogicalExpression expr, boolean negated, TupleMetadata schema) {
    if (expr instanceof NotExpression) {
      return analyze(((NotExpression) expr).getInput(), !negated, schema);
    }
    if (expr instanceof BooleanOperator) {
      BooleanOperator op = (BooleanOperator) expr;
      List<Map<SchemaPath, LiteralGuarantee>> children = new ArrayList<>();
      for (LogicalExpression arg : op.getArgs()) {
        children.add(analyze(arg, negated, schema));
      }
      // NOT (a AND b) is NOT a OR NOT b and vice versa
      return op.isAnd() != negated ? conjunction(children) : disjunction(children);
    }
    if (expr instanceof ComparisonExpression) {
      return comparison((ComparisonExpression) expr, negated, schema);
    }
    if (expr instanceof InListExpression) {
      return inList((InListExpression) expr, negated, schema);
    }
    if (expr instanceof BooleanTestExpression) {
      BooleanTestExpression test = (BooleanTestExpression) expr;
      BooleanTestExpression.Kind kind = negated ? test.getKind().negate() : test.getKind();
      switch (kind) {
        case IS_TRUE:
          return analyze(test.getInput(), false, schema);
        case IS_FALSE:
          return analyze(test.getInput(), true, schema);
        default:
          return Collections.emptyMap();
      }
    }
    return Collections.emptyMap();
  }

  private Map<SchemaPath, LiteralGuarantee> conjunction(List<Map<SchemaPath, LiteralGuarantee>> children) {
    Map<SchemaPath, LiteralGuarantee> result = new LinkedHashMap<>();
    for (Map<SchemaPath, LiteralGuarantee> child : children) {
      for (LiteralGuarantee guarantee : child.values()) {
        result.merge(guarantee.getColumn(), guarantee, LiteralGuaranteeAnalyzer::both);
      }
    }
    return result;
  }

  /**
   * Guarantee holding for rows satisfying both guarantees of the same column.
   */
  private static LiteralGuarantee both(LiteralGuarantee left, LiteralGuarantee right) {
    if (left.getKind() == right.getKind()) {
      // values both must be, or values neither may be
      return left.merge(right, left.getKind() == Kind.MUST_BE_ONE_OF);
    }
    return left.getKind() == Kind.MUST_BE_ONE_OF ? left.exclude(right) : right.exclude(left);
  }

  private Map<SchemaPath, LiteralGuarantee> disjunction(List<Map<SchemaPath, LiteralGuarantee>> children) {
    LiteralGuarantee result = null;
    for (Map<SchemaPath, LiteralGuarantee> child : children) {
      if (child.size() != 1) {
        return Collections.emptyMap();
      }
      LiteralGuarantee guarantee = child.values().iterator().next();
      if (result == null) {
        result = guarantee;
      } else if (!result.getColumn().equals(guarantee.getColumn()) || result.getKind() != guarantee.getKind()) {
        return Collections.emptyMap();
      } else {
        result = result.merge(guarantee, result.getKind() == Kind.MUST_NOT_BE_ONE_OF);
      }
    }
    return result == null ? Collections.emptyMap() : Collections.singletonMap(result.getColumn(), result);
  }

  private Map<SchemaPath, LiteralGuarantee> comparison(ComparisonExpression comparison, boolean negated,
                                                       TupleMetadata schema) {
    ComparisonOperator operator = negated ? comparison.getOperator().negate() : comparison.getOperator();
    if (operator != ComparisonOperator.EQUAL && operator != ComparisonOperator.NOT_EQUAL) {
      return Collections.emptyMap();
    }
    LogicalExpression columnSide = comparison.getLeft();
    LogicalExpression literalSide = comparison.getRight();
    if (columnSide instanceof Literal) {
      columnSide = comparison.getRight();
      literalSide = comparison.getLeft();
    }
    if (!(literalSide instanceof Literal)) {
      return Collections.emptyMap();
    }
    Kind kind = operator == ComparisonOperator.EQUAL ? Kind.MUST_BE_ONE_OF : Kind.MUST_NOT_BE_ONE_OF;
    return guarantee(columnSide, kind, Collections.singletonList((Literal) literalSide), schema);
  }

  private Map<SchemaPath, LiteralGuarantee> inList(InListExpression in, boolean negated, TupleMetadata schema) {
    boolean notIn = in.isNegated() != negated;
    List<Literal> literals = new ArrayList<>();
    for (LogicalExpression value : in.getValues()) {
      if (!(value instanceof Literal)) {
        return Collections.emptyMap();
      }
      Literal literal = (Literal) value;
      if (literal.isNull()) {
        if (notIn) {
          return Collections.emptyMap();
        }
        // equality with NULL never holds
        continue;
      }
      literals.add(literal);
    }
    return guarantee(in.getInput(), notIn ? Kind.MUST_NOT_BE_ONE_OF : Kind.MUST_BE_ONE_OF, literals, schema);
  }

  private Map<SchemaPath, LiteralGuarantee> guarantee(LogicalExpression columnSide, Kind kind,
                                                      List<Literal> literals, TupleMetadata schema) {
    if (!(columnSide instanceof SchemaPath)) {
      return Collections.emptyMap();
    }
    SchemaPath path = (SchemaPath) columnSide;
    ColumnMetadata column = schema.metadata(path);
    if (column == null || column.isArray() || ValueComparators.forType(column.majorType().getMinorType()) == null) {
      return Collections.emptyMap();
    }
    List<Object> values = new ArrayList<>();
    for (Literal literal : literals) {
      if (literal.isNull()) {
        return Collections.emptyMap();
      }
      Optional<Object> value = coercionRules.coerce(literal, column.majorType());
      if (!value.isPresent()) {
        logger.debug("No guarantee for {}: literal {} is not exactly representable as {}",
            path, literal, column.majorType().getMinorType());
        return Collections.emptyMap();
      }
      values.add(value.get());
    }
    return Collections.singletonMap(path, new LiteralGuarantee(path, column.majorType(), kind, values));
  }
}
