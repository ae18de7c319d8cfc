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

import java.util.ArrayList;
import java.util.List;

import org.apache.prism.common.exceptions.UserException;
import org.apache.prism.exec.expr.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableList;

/**
 * Units of a scan the executor reads, and within kept units the pages it reads.
 * <p>
 * A plan starts with one decision per unit and may only be narrowed afterwards: units can be
 * skipped and kept units can be refined with page decisions. Pages of a skipped unit cannot be
 * selected. A unit or page without a decision is read.
 * <p>
 * {@link #selectAll(int)} creates the plan of a scan for which no pruning was requested. Such
 * a plan reads everything and cannot be narrowed.
 */
@JsonPropertyOrder({"selectAll", "units"})
public class AccessPlan {
  private static final Logger logger = LoggerFactory.getLogger(AccessPlan.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  private final boolean selectAll;
  private final List<UnitAccess> units;

  /**
   * @throws UserException when units are missing or out of order, a skipped unit selects
   *         pages, or a plan without pruning does not read everything
   */
  @JsonCreator
  AccessPlan(@JsonProperty("selectAll") boolean selectAll,
             @JsonProperty("units") List<UnitAccess> units) {
    this.selectAll = selectAll;
    this.units = validate(selectAll, units);
  }

  private static List<UnitAccess> validate(boolean selectAll, List<UnitAccess> units) {
    if (units == null) {
      throw UserException.validationError()
          .message("Access plan has no units")
          .build(logger);
    }
    ImmutableList.Builder<UnitAccess> validated = ImmutableList.builder();
    for (int i = 0; i < units.size(); i++) {
      UnitAccess access = units.get(i);
      if (access == null || access.getUnit() != i) {
        throw UserException.validationError()
            .message("Unit at position %d of the access plan is %s", i, access == null ? "missing" : access.getUnit())
            .addContext("Position", i)
            .build(logger);
      }
      if (selectAll && (!access.isKept() || access.isRefined())) {
        throw UserException.validationError()
            .message("Unit %d of a plan without pruning must be read completely", i)
            .addContext("Unit", i)
            .build(logger);
      }
      if (!access.isKept() && access.isRefined()) {
        for (Decision page : access.getPages()) {
          if (page.isKeep()) {
            throw UserException.validationError()
                .message("Pages of unit %d cannot be selected since the unit is skipped", i)
                .addContext("Unit", i)
                .build(logger);
          }
        }
        access.skip();
      }
      validated.add(access);
    }
    return validated.build();
  }

  /**
   * Plan reading every unit when pruning was not requested.
   */
  public static AccessPlan selectAll(int unitCount) {
    List<UnitAccess> units = new ArrayList<>(unitCount);
    for (int i = 0; i < unitCount; i++) {
      units.add(new UnitAccess(i, Decision.KEEP, null));
    }
    return new AccessPlan(true, units);
  }

  /**
   * Plan with the decisions of a pruning pass over all units.
   */
  public static AccessPlan of(Decision[] decisions) {
    List<UnitAccess> units = new ArrayList<>(decisions.length);
    for (int i = 0; i < decisions.length; i++) {
      units.add(new UnitAccess(i, decisions[i], null));
    }
    return new AccessPlan(false, units);
  }

  /**
   * Whether the plan is the baseline of a scan without pruning, as opposed to a pruned
   * plan that happens to keep everything.
   */
  @JsonProperty("selectAll")
  public boolean isSelectAll() {
    return selectAll;
  }

  @JsonProperty("units")
  public List<UnitAccess> getUnits() {
    return units;
  }

  @JsonIgnore
  public int getUnitCount() {
    return units.size();
  }

  public UnitAccess getUnitAccess(int unit) {
    checkUnit(unit);
    return units.get(unit);
  }

  public boolean isKept(int unit) {
    return getUnitAccess(unit).isKept();
  }

  /**
   * Unit decisions in unit order.
   */
  @JsonIgnore
  public Decision[] getSelection() {
    Decision[] selection = new Decision[units.size()];
    for (int i = 0; i < selection.length; i++) {
      selection[i] = units.get(i).getDecision();
    }
    return selection;
  }

  /**
   * Indexes of the kept units, in ascending order.
   */
  @JsonIgnore
  public List<Integer> keptUnits() {
    List<Integer> kept = new ArrayList<>();
    for (UnitAccess unit : units) {
      if (unit.isKept()) {
        kept.add(unit.getUnit());
      }
    }
    return kept;
  }

  @JsonIgnore
  public int getKeptUnitCount() {
    return keptUnits().size();
  }

  public void skip(int unit) {
    checkMutable("skip unit " + unit);
    getUnitAccess(unit).skip();
  }

  /**
   * Restricts a kept unit to the pages whose decision is not {@link Decision#SKIP}. A page
   * skipped by an earlier refinement stays skipped, a {@code null} page decision keeps the page.
   *
   * @throws UserException when the unit is skipped, or the number of pages differs from the
   *         number of pages the unit was refined with before
   */
  public void refine(int unit, Decision[] pages) {
    checkMutable("refine unit " + unit);
    UnitAccess access = getUnitAccess(unit);
    if (pages == null) {
      throw UserException.validationError()
          .message("No page decisions were given for unit %d", unit)
          .addContext("Unit", unit)
          .build(logger);
    }
    if (!access.isKept()) {
      throw UserException.validationError()
          .message("Pages of unit %d cannot be selected since the unit is skipped", unit)
          .addContext("Unit", unit)
          .build(logger);
    }
    if (access.isRefined() && access.getPages().length != pages.length) {
      throw UserException.validationError()
          .message("Unit %d has %d pages but %d page decisions were given", unit, access.getPages().length, pages.length)
          .addContext("Unit", unit)
          .build(logger);
    }
    access.refine(pages);
  }

  /**
   * Rows of the unit the executor reads.
   *
   * @param pageRowCounts row count of every page of the unit
   */
  public RowSelection toRowSelection(int unit, long[] pageRowCounts) {
    UnitAccess access = getUnitAccess(unit);
    long rowCount = 0;
    for (long pageRowCount : pageRowCounts) {
      rowCount += pageRowCount;
    }
    if (!access.isKept()) {
      return RowSelection.none(rowCount);
    }
    if (!access.isRefined()) {
      return RowSelection.all(rowCount);
    }
    Decision[] pages = access.getPages();
    if (pages.length != pageRowCounts.length) {
      throw UserException.validationError()
          .message("Unit %d has %d page decisions but %d page row counts were given", unit, pages.length, pageRowCounts.length)
          .addContext("Unit", unit)
          .build(logger);
    }
    return RowSelection.of(pages, pageRowCounts);
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw UserException.systemError(e)
          .message("Unable to serialize access plan")
          .build(logger);
    }
  }

  public static AccessPlan fromJson(String json) {
    try {
      return MAPPER.readValue(json, AccessPlan.class);
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof UserException) {
        throw (UserException) e.getCause();
      }
      throw UserException.validationError(e)
          .message("Invalid access plan: %s", e.getOriginalMessage())
          .build(logger);
    }
  }

  private void checkUnit(int unit) {
    if (unit < 0 || unit >= units.size()) {
      throw UserException.validationError()
          .message("Unit %d does not exist, the plan has %d units", unit, units.size())
          .build(logger);
    }
  }

  private void checkMutable(String operation) {
    if (selectAll) {
      throw UserException.validationError()
          .message("Cannot %s of a plan without pruning", operation)
          .build(logger);
    }
  }

  @Override
  public String toString() {
    return "AccessPlan[selectAll=" + selectAll + ", units=" + units + "]";
  }
}
