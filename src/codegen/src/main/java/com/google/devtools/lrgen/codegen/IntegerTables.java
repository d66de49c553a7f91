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

import com.google.common.base.Strings;
import com.google.common.primitives.ImmutableIntArray;
import com.google.common.primitives.Ints;

/**
 * Serializes integer tables as C array initializers.
 */
public final class IntegerTables {
  /** Number of values on each line of an initializer. */
  static final int VALUES_PER_LINE = 10;

  /** Width of each right aligned value. */
  static final int FIELD_WIDTH = 6;

  private IntegerTables() {}

  /**
   * Selects the narrowest type able to hold every value of the table.
   *
   * @throws IllegalArgumentException if the table is empty
   */
  public static IntegerType selectIntegerType(ImmutableIntArray values) {
    checkArgument(!values.isEmpty(), "Can't select an integer type for an empty table");

    int[] array = values.toArray();
    int min = Ints.min(array);
    int max = Ints.max(array);

    return selectIntegerType(min, max);
  }

  /**
   * Selects the narrowest type able to hold every value in {@code [min, max]}.
   */
  public static IntegerType selectIntegerType(int min, int max) {
    for (IntegerType type : IntegerType.values()) {
      if (type.accepts(min, max)) {
        return type;
      }
    }

    return IntegerType.INT;
  }

  /**
   * Formats the table as the body of a C array initializer.
   *
   * <p>Every line starts with two spaces and holds up to ten values right aligned to six
   * characters. All values but the last one are followed by a comma. The output does not end with
   * a new line. The selected integer type is not enforced here.
   */
  public static String formatIntegerArray(ImmutableIntArray values) {
    StringBuilder out = new StringBuilder();
    int last = values.length() - 1;
    for (int i = 0; i < values.length(); ++i) {
      if (i % VALUES_PER_LINE == 0) {
        if (i > 0) {
          out.append('\n');
        }
        out.append("  ");
      }

      out.append(Strings.padStart(Integer.toString(values.get(i)), FIELD_WIDTH, ' '));
      if (i != last) {
        out.append(',');
      }
    }

    return out.toString();
  }
}
