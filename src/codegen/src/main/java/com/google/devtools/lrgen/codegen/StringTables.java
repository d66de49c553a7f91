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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.List;

/**
 * Serializes string tables as C array initializers.
 */
public final class StringTables {
  /** Maximal length of a generated line. */
  static final int MAX_LINE_LENGTH = 75;

  /** Room kept at the end of each line when deciding whether the next string still fits. */
  static final String RESERVED = " \"\",";

  /** Terminates every string table. */
  static final String TERMINATOR = " YY_NULLPTR";

  private static final Escaper C_STRING_ESCAPER =
      Escapers.builder().addEscape('\\', "\\\\").addEscape('"', "\\\"").build();

  private StringTables() {}

  /**
   * Formats the strings as quoted C literals separated by commas and followed by
   * {@code YY_NULLPTR}.
   *
   * <p>Lines are filled greedily: a string goes on the current line unless the line would then
   * exceed {@value #MAX_LINE_LENGTH} characters, in which case a new line is started.
   */
  public static String formatStringArray(List<String> strings) {
    StringBuilder out = new StringBuilder();
    StringBuilder line = new StringBuilder(" ");
    for (String string : strings) {
      String escaped = C_STRING_ESCAPER.escape(string);
      if (line.length() + escaped.length() + RESERVED.length() > MAX_LINE_LENGTH) {
        out.append(line).append('\n');
        line.setLength(0);
        line.append("  \"").append(escaped).append("\",");
      } else {
        line.append(" \"").append(escaped).append("\",");
      }
    }

    return out.append(line).append(TERMINATOR).toString();
  }
}
