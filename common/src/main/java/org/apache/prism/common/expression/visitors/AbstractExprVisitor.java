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
package org.apache.prism.common.expression.visitors;

import org.apache.prism.common.expression.BooleanOperator;
import org.apache.prism.common.expression.BooleanTestExpression;
import org.apache.prism.common.expression.CastExpression;
import org.apache.prism.common.expression.ComparisonExpression;
import org.apache.prism.common.expression.InListExpression;
import org.apache.prism.common.expression.IsNullExpression;
import org.apache.prism.common.expression.LikeExpression;
import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.NotExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.UnsupportedExpression;
import org.apache.prism.common.expression.ValueExpressions.Literal;

public abstract class AbstractExprVisitor<T, VAL, EXCEP extends Exception> implements ExprVisitor<T, VAL, EXCEP> {

  @Override
  public T visitSchemaPath(SchemaPath path, VAL value) throws EXCEP {
    return visitUnknown(path, value);
  }

  @Override
  public T visitLiteral(Literal literal, VAL value) throws EXCEP {
    return visitUnknown(literal, value);
  }

  @Override
  public T visitComparison(ComparisonExpression comparison, VAL value) throws EXCEP {
    return visitUnknown(comparison, value);
  }

  @Override
  public T visitBooleanOperator(BooleanOperator op, VAL value) throws EXCEP {
    return visitUnknown(op, value);
  }

  @Override
  public T visitNot(NotExpression not, VAL value) throws EXCEP {
    return visitUnknown(not, value);
  }

  @Override
  public T visitIsNull(IsNullExpression isNull, VAL value) throws EXCEP {
    return visitUnknown(isNull, value);
  }

  @Override
  public T visitBooleanTest(BooleanTestExpression test, VAL value) throws EXCEP {
    return visitUnknown(test, value);
  }

  @Override
  public T visitInList(InListExpression in, VAL value) throws EXCEP {
    return visitUnknown(in, value);
  }

  @Override
  public T visitCast(CastExpression cast, VAL value) throws EXCEP {
    return visitUnknown(cast, value);
  }

  @Override
  public T visitLike(LikeExpression like, VAL value) throws EXCEP {
    return visitUnknown(like, value);
  }

  @Override
  public T visitUnsupported(UnsupportedExpression unsupported, VAL value) throws EXCEP {
    return visitUnknown(unsupported, value);
  }

  public T visitUnknown(LogicalExpression e, VAL value) throws EXCEP {
    throw new UnsupportedOperationException(String.format("Expression of type %s not handled by visitor type %s.",
        e.getClass().getCanonicalName(), this.getClass().getCanonicalName()));
  }
}
