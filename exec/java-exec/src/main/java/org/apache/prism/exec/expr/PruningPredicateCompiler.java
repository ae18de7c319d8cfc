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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.apache.prism.common.expression.BooleanOperator;
import org.apache.prism.common.expression.BooleanTestExpression;
import org.apache.prism.common.expression.CastExpression;
import org.apache.prism.common.expression.ComparisonExpression;
import org.apache.prism.common.expression.ComparisonOperator;
import org.apache.prism.common.expression.InListExpression;
import org.apache.prism.common.expression.IsNullExpression;
import org.apache.prism.common.expression.LikeExpression;
import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.NotExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.UnsupportedExpression;
import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.expression.visitors.ExprVisitor;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.Types;
import org.apache.prism.exec.expr.coerce.CastFunctions;
import org.apache.prism.exec.expr.coerce.CoercionRules;
import org.apache.prism.exec.expr.stat.BooleanPredicate;
import org.apache.prism.exec.expr.stat.CastOperand;
import org.apache.prism.exec.expr.stat.ColumnOperand;
import org.apache.prism.exec.expr.stat.ComparisonPredicate;
import org.apache.prism.exec.expr.stat.ConstantOperand;
import org.apache.prism.exec.expr.stat.ConstantPredicate;
import org.apache.prism.exec.expr.stat.FilterPredicate;
import org.apache.prism.exec.expr.stat.IsPredicate;
import org.apache.prism.exec.expr.stat.StatOperand;
import org.apache.prism.exec.record.metadata.ColumnMetadata;
import org.apache.prism.exec.record.metadata.TupleMetadata;
import org.apache.prism.metastore.util.ValueComparators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Rewrites a filter into a predicate over unit statistics.
 * <p>
 * Every part of the filter that cannot be proven false from min, max, null count and row
 * count is replaced with {@link ConstantPredicate#UNKNOWN}. Supported legs of an {@code AND}
 * are kept when other legs are not supported, while an {@code OR} with an unsupported leg
 * becomes unknown as a whole. Subtrees shared by several parents are compiled once.
 */
public class PruningPredicateCompiler {
  private static final Logger logger = LoggerFactory.getLogger(PruningPredicateCompiler.class);

  private final CoercionRules coercionRules;

  public PruningPredicateCompiler() {
    this(CoercionRules.defaults());
  }

  public PruningPredicateCompiler(CoercionRules coercionRules) {
    this.coercionRules = Preconditions.checkNotNull(coercionRules);
  }

  /**
   * @param filter type-checked filter expression
   * @param schema columns for which statistics may be available
   * @return compiled predicate, reusable across scans
   */
  public PruningPredicate compile(LogicalExpression filter, TupleMetadata schema) {
    Compilation compilation = new Compilation(schema);
    FilterPredicate root = compilation.compile(filter);
    PruningPredicate predicate = new PruningPredicate(filter.toString(), root, compilation.columns);
    logger.debug("Compiled filter {} into {}", filter, root);
    return predicate;
  }

  /**
   * State of a single compilation: the schema, the referenced columns and the
   * predicates already built for shared subtrees.
   */
  private class Compilation {
    private final TupleMetadata schema;
    private final Set<SchemaPath> columns = new LinkedHashSet<>();
    private final Map<LogicalExpression, FilterPredicate> compiled = new IdentityHashMap<>();
    private final Map<LogicalExpression, FilterPredicate> compiledNegated = new IdentityHashMap<>();
    private final PositiveBuilder positive = new PositiveBuilder();
    private final NegatedBuilder negated = new NegatedBuilder();

    Compilation(TupleMetadata schema) {
      this.schema = schema;
    }

    FilterPredicate compile(LogicalExpression expr) {
      FilterPredicate predicate = compiled.get(expr);
      if (predicate == null) {
        predicate = expr.accept(positive, null);
        compiled.put(expr, predicate);
      }
      return predicate;
    }

    FilterPredicate compileNegated(LogicalExpression expr) {
      FilterPredicate predicate = compiledNegated.get(expr);
      if (predicate == null) {
        predicate = expr.accept(negated, null);
        compiledNegated.put(expr, predicate);
      }
      return predicate;
    }

    FilterPredicate unsupported(LogicalExpression expr) {
      logger.debug("Expression {} was not qualified for statistics-based pruning", expr);
      return ConstantPredicate.UNKNOWN;
    }

    /**
     * Resolves a column reference, possibly under casts, into an operand whose
     * value range can be computed from statistics.
     */
    StatOperandHolder toOperand(LogicalExpression expr) {
      if (expr instanceof SchemaPath) {
        SchemaPath path = (SchemaPath) expr;
        ColumnMetadata column = schema.metadata(path);
        // statistics of arrays describe elements rather than rows
        if (column == null || column.isArray() || ValueComparators.forType(column.majorType().getMinorType()) == null) {
          return null;
        }
        return new StatOperandHolder(new ColumnOperand(path, column.majorType()), path);
      }
      if (expr instanceof CastExpression) {
        CastExpression cast = (CastExpression) expr;
        StatOperandHolder input = toOperand(cast.getInput());
        if (input == null) {
          return null;
        }
        Optional<UnaryOperator<Object>> function = CastFunctions.boundsFunction(input.operand.getType(), cast.getMajorType());
        if (!function.isPresent()) {
          return null;
        }
        MajorType type = cast.getMajorType().withMode(input.operand.getType().getMode());
        return new StatOperandHolder(new CastOperand(input.operand, type, function.get()), input.path);
      }
      return null;
    }

    FilterPredicate comparison(ComparisonOperator operator, LogicalExpression left, LogicalExpression right,
                               LogicalExpression original) {
      if (left instanceof Literal && !(right instanceof Literal)) {
        return comparison(operator.flip(), right, left, original);
      }
      if (right instanceof Literal) {
        Literal literal = (Literal) right;
        if (literal.isNull()) {
          // comparison with NULL is never true
          return ConstantPredicate.NEVER;
        }
        StatOperandHolder column = toOperand(left);
        if (column == null) {
          return unsupported(original);
        }
        MajorType columnType = column.operand.getType();
        Optional<Object> value = coercionRules.coerce(literal, columnType);
        if (!value.isPresent()) {
          logger.debug("Literal {} cannot be compared exactly with {} of type {}", literal, left, columnType.getMinorType());
          return unsupported(original);
        }
        columns.add(column.path);
        return ComparisonPredicate.createComparisonPredicate(operator, column.operand,
            new ConstantOperand(value.get(), columnType));
      }
      StatOperandHolder leftColumn = toOperand(left);
      StatOperandHolder rightColumn = toOperand(right);
      if (leftColumn == null || rightColumn == null
          || !Types.isSameComparisonDomain(leftColumn.operand.getType(), rightColumn.operand.getType())) {
        return unsupported(original);
      }
      columns.add(leftColumn.path);
      columns.add(rightColumn.path);
      return ComparisonPredicate.createComparisonPredicate(operator, leftColumn.operand, rightColumn.operand);
    }

    boolean isFloatingPointComparison(ComparisonExpression comparison) {
      for (LogicalExpression operand : ImmutableList.of(comparison.getLeft(), comparison.getRight())) {
        StatOperandHolder holder = toOperand(operand);
        if (holder != null && holder.operand.getType().getMinorType().isFloatingPoint()) {
          return true;
        }
      }
      return false;
    }

    FilterPredicate isPredicate(IsPredicate.Kind kind, LogicalExpression input, LogicalExpression original) {
      StatOperandHolder column = toOperand(input);
      if (column == null) {
        return unsupported(original);
      }
      boolean booleanTest = kind != IsPredicate.Kind.IS_NULL && kind != IsPredicate.Kind.IS_NOT_NULL;
      if (booleanTest && column.operand.getType().getMinorType() != MinorType.BIT) {
        return unsupported(original);
      }
      columns.add(column.path);
      return IsPredicate.createIsPredicate(kind, column.operand);
    }

    FilterPredicate isNull(IsNullExpression isNull, boolean notNull) {
      LogicalExpression input = isNull.getInput();
      if (input instanceof Literal) {
        return ((Literal) input).isNull() != notNull ? ConstantPredicate.ALWAYS : ConstantPredicate.NEVER;
      }
      return isPredicate(notNull ? IsPredicate.Kind.IS_NOT_NULL : IsPredicate.Kind.IS_NULL, input, isNull);
    }

    FilterPredicate inList(InListExpression in, boolean notIn) {
      List<Literal> values = new ArrayList<>();
      for (LogicalExpression value : in.getValues()) {
        if (!(value instanceof Literal)) {
          return unsupported(in);
        }
        values.add((Literal) value);
      }
      List<FilterPredicate> legs = new ArrayList<>();
      for (Literal value : values) {
        if (value.isNull()) {
          if (notIn) {
            // x NOT IN (..., NULL) is never true
            return ConstantPredicate.NEVER;
          }
          continue;
        }
        legs.add(comparison(notIn ? ComparisonOperator.NOT_EQUAL : ComparisonOperator.EQUAL, in.getInput(), value, in));
      }
      return notIn ? and(legs) : or(legs);
    }

    FilterPredicate booleanTest(BooleanTestExpression test, BooleanTestExpression.Kind kind) {
      LogicalExpression input = test.getInput();
      if (input instanceof Literal) {
        Object value = ((Literal) input).getValue();
        boolean result;
        switch (kind) {
          case IS_TRUE:
            result = Boolean.TRUE.equals(value);
            break;
          case IS_FALSE:
            result = Boolean.FALSE.equals(value);
            break;
          case IS_NOT_TRUE:
            result = !Boolean.TRUE.equals(value);
            break;
          default:
            result = !Boolean.FALSE.equals(value);
        }
        return result ? ConstantPredicate.ALWAYS : ConstantPredicate.NEVER;
      }
      if (input instanceof SchemaPath || input instanceof CastExpression) {
        return isPredicate(toIsKind(kind), input, test);
      }
      // a nested condition: IS TRUE holds where the condition holds, IS FALSE where its negation holds
      switch (kind) {
        case IS_TRUE:
          return compile(input);
        case IS_FALSE:
          return compileNegated(input);
        default:
          return unsupported(test);
      }
    }

    FilterPredicate like(LikeExpression like) {
      if (like.isNegated()) {
        return unsupported(like);
      }
      StatOperandHolder column = toOperand(like.getInput());
      if (column == null || column.operand.getType().getMinorType() != MinorType.VARCHAR) {
        return unsupported(like);
      }
      LikePattern pattern = LikePattern.parse(like.getPattern(), like.getEscape());
      if (pattern == null) {
        return unsupported(like);
      }
      columns.add(column.path);
      MajorType type = column.operand.getType();
      byte[] prefix = pattern.getPrefix().getBytes(StandardCharsets.UTF_8);
      if (!pattern.hasWildcards()) {
        return ComparisonPredicate.createComparisonPredicate(ComparisonOperator.EQUAL, column.operand,
            new ConstantOperand(prefix, type));
      }
      if (prefix.length == 0) {
        // any pattern matches non-null values only
        return IsPredicate.createIsPredicate(IsPredicate.Kind.IS_NOT_NULL, column.operand);
      }
      List<FilterPredicate> range = new ArrayList<>();
      range.add(ComparisonPredicate.createComparisonPredicate(ComparisonOperator.GREATER_THAN_OR_EQUAL,
          column.operand, new ConstantOperand(prefix, type)));
      byte[] upper = LikePattern.prefixUpperBound(prefix);
      if (upper != null) {
        range.add(ComparisonPredicate.createComparisonPredicate(ComparisonOperator.LESS_THAN,
            column.operand, new ConstantOperand(upper, type)));
      }
      return BooleanPredicate.createBooleanPredicate(true, range);
    }

    FilterPredicate booleanColumn(LogicalExpression expr, IsPredicate.Kind kind) {
      StatOperandHolder column = toOperand(expr);
      if (column == null || column.operand.getType().getMinorType() != MinorType.BIT) {
        return unsupported(expr);
      }
      columns.add(column.path);
      return IsPredicate.createIsPredicate(kind, column.operand);
    }

    FilterPredicate and(List<FilterPredicate> children) {
      List<FilterPredicate> supported = new ArrayList<>();
      boolean unknown = false;
      for (FilterPredicate child : children) {
        if (child == ConstantPredicate.NEVER) {
          return ConstantPredicate.NEVER;
        } else if (child == ConstantPredicate.UNKNOWN) {
          unknown = true;
        } else if (child != ConstantPredicate.ALWAYS) {
          supported.add(child);
        }
      }
      if (supported.isEmpty()) {
        return unknown ? ConstantPredicate.UNKNOWN : ConstantPredicate.ALWAYS;
      }
      return BooleanPredicate.createBooleanPredicate(true, supported);
    }

    FilterPredicate or(List<FilterPredicate> children) {
      List<FilterPredicate> supported = new ArrayList<>();
      for (FilterPredicate child : children) {
        if (child == ConstantPredicate.UNKNOWN || child == ConstantPredicate.ALWAYS) {
          return child;
        } else if (child != ConstantPredicate.NEVER) {
          supported.add(child);
        }
      }
      if (supported.isEmpty()) {
        return ConstantPredicate.NEVER;
      }
      return BooleanPredicate.createBooleanPredicate(false, supported);
    }

    private IsPredicate.Kind toIsKind(BooleanTestExpression.Kind kind) {
      switch (kind) {
        case IS_TRUE:
          return IsPredicate.Kind.IS_TRUE;
        case IS_FALSE:
          return IsPredicate.Kind.IS_FALSE;
        case IS_NOT_TRUE:
          return IsPredicate.Kind.IS_NOT_TRUE;
        default:
          return IsPredicate.Kind.IS_NOT_FALSE;
      }
    }

    /**
     * Builds the predicate of an expression.
     */
    private class PositiveBuilder implements ExprVisitor<FilterPredicate, Void, RuntimeException> {

      @Override
      public FilterPredicate visitSchemaPath(SchemaPath path, Void value) {
        // a bare boolean column is a shorthand for "column IS TRUE"
        return booleanColumn(path, IsPredicate.Kind.IS_TRUE);
      }

      @Override
      public FilterPredicate visitLiteral(Literal literal, Void value) {
        if (literal.isNull()) {
          return ConstantPredicate.NEVER;
        }
        if (literal.getMajorType().getMinorType() != MinorType.BIT) {
          return unsupported(literal);
        }
        return (Boolean) literal.getValue() ? ConstantPredicate.ALWAYS : ConstantPredicate.NEVER;
      }

      @Override
      public FilterPredicate visitComparison(ComparisonExpression comparison, Void value) {
        return comparison(comparison.getOperator(), comparison.getLeft(), comparison.getRight(), comparison);
      }

      @Override
      public FilterPredicate visitBooleanOperator(BooleanOperator op, Void value) {
        List<FilterPredicate> children = new ArrayList<>();
        for (LogicalExpression arg : op.getArgs()) {
          children.add(compile(arg));
        }
        return op.isAnd() ? and(children) : or(children);
      }

      @Override
      public FilterPredicate visitNot(NotExpression not, Void value) {
        return compileNegated(not.getInput());
      }

      @Override
      public FilterPredicate visitIsNull(IsNullExpression isNull, Void value) {
        return isNull(isNull, isNull.isNegated());
      }

      @Override
      public FilterPredicate visitBooleanTest(BooleanTestExpression test, Void value) {
        return booleanTest(test, test.getKind());
      }

      @Override
      public FilterPredicate visitInList(InListExpression in, Void value) {
        return inList(in, in.isNegated());
      }

      @Override
      public FilterPredicate visitCast(CastExpression cast, Void value) {
        return booleanColumn(cast, IsPredicate.Kind.IS_TRUE);
      }

      @Override
      public FilterPredicate visitLike(LikeExpression like, Void value) {
        return like(like);
      }

      @Override
      public FilterPredicate visitUnsupported(UnsupportedExpression unsupported, Void value) {
        return unsupported(unsupported);
      }
    }

    /**
     * Builds the predicate of the negation of an expression. Only leaves whose negation is
     * again a leaf are supported.
     */
    private class NegatedBuilder implements ExprVisitor<FilterPredicate, Void, RuntimeException> {

      @Override
      public FilterPredicate visitSchemaPath(SchemaPath path, Void value) {
        return booleanColumn(path, IsPredicate.Kind.IS_FALSE);
      }

      @Override
      public FilterPredicate visitLiteral(Literal literal, Void value) {
        if (literal.isNull()) {
          return ConstantPredicate.NEVER;
        }
        if (literal.getMajorType().getMinorType() != MinorType.BIT) {
          return unsupported(literal);
        }
        return (Boolean) literal.getValue() ? ConstantPredicate.NEVER : ConstantPredicate.ALWAYS;
      }

      @Override
      public FilterPredicate visitComparison(ComparisonExpression comparison, Void value) {
        // NaN values fail a comparison and its negation alike
        if (isFloatingPointComparison(comparison)) {
          return unsupported(comparison);
        }
        return comparison(comparison.getOperator().negate(), comparison.getLeft(), comparison.getRight(), comparison);
      }

      @Override
      public FilterPredicate visitBooleanOperator(BooleanOperator op, Void value) {
        return unsupported(op);
      }

      @Override
      public FilterPredicate visitNot(NotExpression not, Void value) {
        return compile(not.getInput());
      }

      @Override
      public FilterPredicate visitIsNull(IsNullExpression isNull, Void value) {
        return isNull(isNull, !isNull.isNegated());
      }

      @Override
      public FilterPredicate visitBooleanTest(BooleanTestExpression test, Void value) {
        return booleanTest(test, test.getKind().negate());
      }

      @Override
      public FilterPredicate visitInList(InListExpression in, Void value) {
        return inList(in, !in.isNegated());
      }

      @Override
      public FilterPredicate visitCast(CastExpression cast, Void value) {
        return booleanColumn(cast, IsPredicate.Kind.IS_FALSE);
      }

      @Override
      public FilterPredicate visitLike(LikeExpression like, Void value) {
        return unsupported(like);
      }

      @Override
      public FilterPredicate visitUnsupported(UnsupportedExpression unsupported, Void value) {
        return unsupported(unsupported);
      }
    }
  }

  private static class StatOperandHolder {
    private final StatOperand operand;
    private final SchemaPath path;

    StatOperandHolder(StatOperand operand, SchemaPath path) {
      this.operand = operand;
      this.path = path;
    }
  }
}
