/*
 * Copyright 2024 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.lrgen.codegen;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.ImmutableIntArray;
import com.google.common.primitives.Ints;

/**
 * Generates the C conditions the skeleton uses to test table cells against sentinels.
 */
public final class TablePredicates {
  /** Condition that is always false. */
  static final String FALSE = "0";

  private TablePredicates() {}

  /**
   * Generates a condition checking whether {@code value} equals {@code symbol}.
   *
   * <p>If {@code literal} (the numeric value of {@code symbol}) lies outside the range of the
   * table, no cell can hold it and the condition is the constant {@code 0}, so that the C
   * compiler drops the dead branch.
   *
   * @param table table the value was read from
   * @param value C expression holding a cell of the table
   * @param literal numeric value of {@code symbol}
   * @param symbol C name of the compared constant
   * @throws IllegalArgumentException if the table is empty
   */
  public static String tableValueEquals(
      ImmutableIntArray table, String value, int literal, String symbol) {
    checkArgument(!table.isEmpty(), "Can't compare against an empty table");

    int[] array = table.toArray();
    int min = Ints.min(array);
    int max = Ints.max(array);

    if (literal < min || max < literal) {
      return FALSE;
    }

    return "((" + value + ") == " + symbol + ")";
  }
}
