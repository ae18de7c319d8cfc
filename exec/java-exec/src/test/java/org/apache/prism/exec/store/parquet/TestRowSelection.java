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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.apache.prism.exec.expr.Decision;
import org.apache.prism.exec.store.parquet.RowSelection.RowRun;
import org.apache.prism.test.PrismTest;
import org.junit.Test;

public class TestRowSelection extends PrismTest {

  @Test
  public void testAdjacentPagesAreMerged() {
    RowSelection selection = RowSelection.of(new Decision[] {KEEP, KEEP, SKIP, SKIP, KEEP}, new long[] {1, 2, 3, 4, 5});
    assertEquals(Arrays.asList(RowRun.select(3), RowRun.skip(7), RowRun.select(5)), selection.getRuns());
    assertEquals(8, selection.getSelectedRowCount());
    assertEquals(7, selection.getSkippedRowCount());
    assertEquals(15, selection.getRowCount());
  }

  @Test
  public void testEmptyPagesDoNotSplitRuns() {
    RowSelection selection = RowSelection.of(new Decision[] {KEEP, SKIP, KEEP}, new long[] {4, 0, 6});
    assertEquals(Collections.singletonList(RowRun.select(10)), selection.getRuns());
  }

  @Test
  public void testNothingSelected() {
    assertTrue(RowSelection.none(10).selectsNothing());
    assertTrue(RowSelection.all(0).selectsNothing());
    assertTrue(RowSelection.all(0).getRuns().isEmpty());
    assertFalse(RowSelection.all(1).selectsNothing());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedPageCounts() {
    RowSelection.of(new Decision[] {KEEP}, new long[] {1, 2});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyRun() {
    RowRun.select(0);
  }
}
