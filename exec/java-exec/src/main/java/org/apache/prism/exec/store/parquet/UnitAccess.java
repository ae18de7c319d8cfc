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

import java.util.Arrays;

import org.apache.prism.exec.expr.Decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Access decision of one unit of an {@link AccessPlan} and, once refined,
 * the decisions of its pages.
 */
@JsonPropertyOrder({"unit", "decision", "pages"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnitAccess {

  private final int unit;
  private Decision decision;
  private Decision[] pages;

  /**
   * Decisions are checked against each other by {@link AccessPlan}. Missing decisions of
   * the unit or of its pages mean the unit or page is read.
   */
  @JsonCreator
  UnitAccess(@JsonProperty("unit") int unit,
             @JsonProperty("decision") Decision decision,
             @JsonProperty("pages") Decision[] pages) {
    this.unit = unit;
    this.decision = decision == null ? Decision.KEEP : decision;
    this.pages = pages == null ? null : keepUnmarked(pages);
  }

  @JsonProperty("unit")
  public int getUnit() {
    return unit;
  }

  @JsonProperty("decision")
  public Decision getDecision() {
    return decision;
  }

  /**
   * @return page decisions, or {@code null} when the unit was not refined
   */
  @JsonProperty("pages")
  public Decision[] getPages() {
    return pages == null ? null : pages.clone();
  }

  @JsonIgnore
  public boolean isKept() {
    return decision.isKeep();
  }

  @JsonIgnore
  public boolean isRefined() {
    return pages != null;
  }

  /**
   * Decision for a page of the unit. Pages of a unit that was not refined share its decision.
   */
  public Decision getPageDecision(int page) {
    if (!isKept()) {
      return Decision.SKIP;
    }
    return pages == null ? Decision.KEEP : pages[page];
  }

  @JsonIgnore
  public int getKeptPageCount() {
    int count = 0;
    if (pages != null && isKept()) {
      for (Decision page : pages) {
        if (page.isKeep()) {
          count++;
        }
      }
    }
    return count;
  }

  void skip() {
    decision = Decision.SKIP;
    pages = null;
  }

  /**
   * Narrows page decisions: a page stays kept only when every refinement keeps it.
   */
  void refine(Decision[] pageDecisions) {
    if (pages == null) {
      pages = keepUnmarked(pageDecisions);
      return;
    }
    for (int i = 0; i < pages.length; i++) {
      if (pageDecisions[i] == Decision.SKIP) {
        pages[i] = Decision.SKIP;
      }
    }
  }

  private static Decision[] keepUnmarked(Decision[] decisions) {
    Decision[] copy = new Decision[decisions.length];
    for (int i = 0; i < decisions.length; i++) {
      copy[i] = decisions[i] == null ? Decision.KEEP : decisions[i];
    }
    return copy;
  }

  @Override
  public String toString() {
    return "UnitAccess[unit=" + unit + ", decision=" + decision
        + (pages == null ? "" : ", pages=" + Arrays.toString(pages)) + "]";
  }
}
