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

import static org.apache.prism.exec.expr.Decision.KEEP;
import static org.apache.prism.exec.expr.Decision.SKIP;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.prism.common.exceptions.UserException;
import org.apache.prism.exec.expr.Decision;
import org.apache.prism.exec.store.parquet.RowSelection.RowRun;
import org.apache.prism.test.PrismTest;
import org.junit.Test;

public class TestAccessPlan extends PrismTest {

  @Test
  public void testSelectAll() {
    AccessPlan plan = AccessPlan.selectAll(3);
    assertTrue(plan.isSelectAll());
    assertEquals(3, plan.getKeptUnitCount());
    assertArrayEquals(new Decision[] {KEEP, KEEP, KEEP}, plan.getSelection());
    assertEquals(RowSelection.all(30), plan.toRowSelection(1, new long[] {10, 20}));
  }

  @Test
  public void testSelectAllCannotBeNarrowed() {
    AccessPlan plan = AccessPlan.selectAll(2);
    try {
      plan.skip(0);
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
      assertTrue(e.getOriginalMessage(), e.getOriginalMessage().startsWith("Cannot skip unit 0"));
    }
    try {
      plan.refine(0, new Decision[] {SKIP});
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
    assertTrue(plan.isKept(0));
  }

  @Test
  public void testPrunedPlanThatKeepsEverything() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP, KEEP});
    assertFalse(plan.isSelectAll());
    plan.skip(1);
    assertEquals(Arrays.asList(0), plan.keptUnits());
  }

  @Test
  public void testSkippedUnitCannotBeRefined() {
    AccessPlan plan = AccessPlan.of(new Decision[] {SKIP, KEEP});
    try {
      plan.refine(0, new Decision[] {KEEP});
      fail();
    } catch (UserException e) {
      assertEquals("Pages of unit 0 cannot be selected since the unit is skipped", e.getOriginalMessage());
    }
    assertEquals(SKIP, plan.getUnitAccess(0).getPageDecision(0));
  }

  @Test
  public void testRefinementsNarrow() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP});
    plan.refine(0, new Decision[] {KEEP, SKIP, KEEP, KEEP});
    plan.refine(0, new Decision[] {KEEP, KEEP, SKIP, KEEP});

    UnitAccess access = plan.getUnitAccess(0);
    assertTrue(access.isRefined());
    assertArrayEquals(new Decision[] {KEEP, SKIP, SKIP, KEEP}, access.getPages());
    assertEquals(2, access.getKeptPageCount());
  }

  @Test
  public void testRefinementWithOtherPageCountFails() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP});
    plan.refine(0, new Decision[] {KEEP, SKIP});
    try {
      plan.refine(0, new Decision[] {KEEP});
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
  }

  @Test
  public void testSkippingDropsPages() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP});
    plan.refine(0, new Decision[] {KEEP, SKIP});
    plan.skip(0);
    assertFalse(plan.isKept(0));
    assertNull(plan.getUnitAccess(0).getPages());
    assertEquals(0, plan.getUnitAccess(0).getKeptPageCount());
  }

  @Test
  public void testUnknownUnit() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP});
    try {
      plan.isKept(1);
      fail();
    } catch (UserException e) {
      assertTrue(e.getOriginalMessage(), e.getOriginalMessage().startsWith("Unit 1 does not exist"));
    }
  }

  @Test
  public void testRowSelection() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP, SKIP, KEEP});
    plan.refine(2, new Decision[] {SKIP, KEEP, KEEP, SKIP});
    long[] pageRowCounts = {10, 20, 30, 40};

    assertEquals(RowSelection.all(100), plan.toRowSelection(0, pageRowCounts));
    assertEquals(RowSelection.none(100), plan.toRowSelection(1, pageRowCounts));
    RowSelection selection = plan.toRowSelection(2, pageRowCounts);
    assertEquals(Arrays.asList(RowRun.skip(10), RowRun.select(50), RowRun.skip(40)), selection.getRuns());
    assertEquals(50, selection.getSelectedRowCount());

    try {
      plan.toRowSelection(2, new long[] {10, 90});
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
  }

  @Test
  public void testJson() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP, SKIP});
    plan.refine(0, new Decision[] {SKIP, KEEP});

    AccessPlan copy = AccessPlan.fromJson(plan.toJson());
    assertFalse(copy.isSelectAll());
    assertArrayEquals(plan.getSelection(), copy.getSelection());
    assertArrayEquals(new Decision[] {SKIP, KEEP}, copy.getUnitAccess(0).getPages());
    assertFalse(copy.getUnitAccess(1).isRefined());

    assertTrue(AccessPlan.fromJson(AccessPlan.selectAll(1).toJson()).isSelectAll());
  }

  @Test
  public void testSkippedUnitWithSelectedPagesIsRejected() {
    List<UnitAccess> units = Collections.singletonList(new UnitAccess(0, SKIP, new Decision[] {KEEP}));
    try {
      new AccessPlan(false, units);
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
      assertEquals("Pages of unit 0 cannot be selected since the unit is skipped", e.getOriginalMessage());
    }
    try {
      AccessPlan.fromJson("{\"selectAll\": false, \"units\": [{\"unit\": 0, \"decision\": \"SKIP\", \"pages\": [\"KEEP\"]}]}");
      fail();
    } catch (UserException e) {
      assertEquals("Pages of unit 0 cannot be selected since the unit is skipped", e.getOriginalMessage());
    }
  }

  @Test
  public void testSkippedUnitWithSkippedPages() {
    AccessPlan plan = AccessPlan.fromJson(
        "{\"selectAll\": false, \"units\": [{\"unit\": 0, \"decision\": \"SKIP\", \"pages\": [\"SKIP\", \"SKIP\"]}]}");
    assertFalse(plan.isKept(0));
    assertNull(plan.getUnitAccess(0).getPages());
  }

  @Test
  public void testSelectAllMustReadEverything() {
    try {
      new AccessPlan(true, Arrays.asList(new UnitAccess(0, KEEP, null), new UnitAccess(1, SKIP, null)));
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
    try {
      AccessPlan.fromJson("{\"selectAll\": true, \"units\": [{\"unit\": 0, \"decision\": \"KEEP\", \"pages\": [\"SKIP\"]}]}");
      fail();
    } catch (UserException e) {
      assertEquals("Unit 0 of a plan without pruning must be read completely", e.getOriginalMessage());
    }
  }

  @Test
  public void testUnitsMustBeInOrder() {
    try {
      new AccessPlan(false, Arrays.asList(new UnitAccess(1, KEEP, null), new UnitAccess(0, KEEP, null)));
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
    try {
      AccessPlan.fromJson("{\"selectAll\": false}");
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
  }

  @Test
  public void testUnmarkedPagesAreKept() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP});
    plan.refine(0, new Decision[] {null, SKIP, KEEP});
    assertArrayEquals(new Decision[] {KEEP, SKIP, KEEP}, plan.getUnitAccess(0).getPages());
    assertEquals(2, plan.getUnitAccess(0).getKeptPageCount());

    plan.refine(0, new Decision[] {SKIP, null, null});
    assertArrayEquals(new Decision[] {SKIP, SKIP, KEEP}, plan.getUnitAccess(0).getPages());

    AccessPlan parsed = AccessPlan.fromJson(
        "{\"selectAll\": false, \"units\": [{\"unit\": 0, \"decision\": null, \"pages\": [null, \"SKIP\"]}]}");
    assertTrue(parsed.isKept(0));
    assertArrayEquals(new Decision[] {KEEP, SKIP}, parsed.getUnitAccess(0).getPages());
    assertEquals(1, parsed.getUnitAccess(0).getKeptPageCount());
  }

  @Test
  public void testRefinementWithoutPages() {
    AccessPlan plan = AccessPlan.of(new Decision[] {KEEP});
    try {
      plan.refine(0, null);
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
  }

  @Test
  public void testInvalidJson() {
    try {
      AccessPlan.fromJson("{\"units\": [{\"unit\": 0, \"decision\": \"MAYBE\"}]}");
      fail();
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.VALIDATION, e.getErrorType());
    }
  }
}
