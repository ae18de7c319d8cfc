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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.prism.test.PrismTest;
import org.junit.Test;

public class TestLikePattern extends PrismTest {

  @Test
  public void testPrefixEndsAtFirstWildcard() {
    LikePattern pattern = LikePattern.parse("abc%d_", null);
    assertEquals("abc", pattern.getPrefix());
    assertTrue(pattern.hasWildcards());

    pattern = LikePattern.parse("a_c", null);
    assertEquals("a", pattern.getPrefix());
  }

  @Test
  public void testPatternWithoutWildcards() {
    LikePattern pattern = LikePattern.parse("abc", null);
    assertEquals("abc", pattern.getPrefix());
    assertFalse(pattern.hasWildcards());
  }

  @Test
  public void testEscapedWildcards() {
    LikePattern pattern = LikePattern.parse("10\\%\\_off%", '\\');
    assertEquals("10%_off", pattern.getPrefix());
    assertTrue(pattern.hasWildcards());

    pattern = LikePattern.parse("a!!b", '!');
    assertEquals("a!b", pattern.getPrefix());
    assertFalse(pattern.hasWildcards());
  }

  @Test
  public void testDanglingEscape() {
    assertNull(LikePattern.parse("abc!", '!'));
  }

  @Test
  public void testPrefixUpperBound() {
    assertArrayEquals(new byte[] {'a', 'c'}, LikePattern.prefixUpperBound(new byte[] {'a', 'b'}));
    assertArrayEquals(new byte[] {'b'}, LikePattern.prefixUpperBound(new byte[] {'a', (byte) 0xFF}));
    assertNull(LikePattern.prefixUpperBound(new byte[] {(byte) 0xFF, (byte) 0xFF}));
    assertNull(LikePattern.prefixUpperBound(new byte[0]));
  }
}
