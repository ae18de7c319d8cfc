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
package org.apache.prism.exec.expr.coerce;

import java.util.Optional;

import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.types.MajorType;

/**
 * Converts a literal into the normalized value domain of a column.
 * <p>
 * A conversion that is lossy, ambiguous or overflows yields an empty result, which makes
 * the comparison using the literal unknown. Implementations never throw for such literals.
 */
@FunctionalInterface
public interface LiteralCoercer {

  /**
   * @param literal non-null literal
   * @param columnType type of the column the literal is compared with
   * @return the normalized value, or empty when the literal has no exact counterpart in the column domain
   */
  Optional<Object> coerce(Literal literal, MajorType columnType);
}
