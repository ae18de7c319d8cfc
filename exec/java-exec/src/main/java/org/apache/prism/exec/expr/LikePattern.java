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

import java.util.Arrays;

/**
 * Literal prefix of a LIKE pattern. {@code %} and {@code _} are wildcards, and a character
 * following the escape character is taken literally.
 */
public final class LikePattern {

  private final String prefix;
  private final boolean wildcards;

  private LikePattern(String prefix, boolean wildcards) {
    this.prefix = prefix;
    this.wildcards = wildcards;
  }

  /**
   * @return parsed pattern or {@code null} when the pattern ends with a dangling escape
   */
  public static LikePattern parse(String pattern, Character escape) {
    StringBuilder prefix = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (escape != null && c == escape) {
        if (i + 1 == pattern.length()) {
          return null;
        }
        prefix.append(pattern.charAt(++i));
      } else if (c == '%' || c == '_') {
        return new LikePattern(prefix.toString(), true);
      } else {
        prefix.append(c);
      }
    }
    return new LikePattern(prefix.toString(), false);
  }

  public String getPrefix() {
    return prefix;
  }

  public boolean hasWildcards() {
    return wildcards;
  }

  /**
   * Smallest byte string greater than every string starting with {@code prefix}, or
   * {@code null} when there is none (the prefix consists of {@code 0xFF} bytes only).
   */
  public static byte[] prefixUpperBound(byte[] prefix) {
    for (int i = prefix.length - 1; i >= 0; i--) {
      if (prefix[i] != (byte) 0xFF) {
        byte[] upper = Arrays.copyOf(prefix, i + 1);
        upper[i]++;
        return upper;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "LikePattern[prefix=" + prefix + ", wildcards=" + wildcards + "]";
  }
}
