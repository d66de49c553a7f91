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
import com.google.common.collect.Iterables;
import com.google.devtools.lrgen.model.KindEntry;
import java.util.List;

/**
 * Renders the enumerators of {@code enum yytokentype} and {@code enum yysymbol_kind_t}.
 */
public final class EnumRenderer {
  static final String TOKEN_INDENT = "    ";
  static final int TOKEN_WIDTH = 30;
  static final String SYMBOL_INDENT = "  ";
  static final int SYMBOL_WIDTH = 40;

  private EnumRenderer() {}

  /**
   * Renders the token kinds. The enumerator numbered {@code maxUserToken} closes the enum and
   * gets no comma.
   */
  public static String tokenEnums(List<KindEntry> tokenKinds, int maxUserToken) {
    return render(tokenKinds, maxUserToken, TOKEN_INDENT, TOKEN_WIDTH);
  }

  /**
   * Renders the symbol kinds. The last enumerator closes the enum and gets no comma.
   *
   * @throws IllegalArgumentException if there are no symbol kinds
   */
  public static String symbolEnum(List<KindEntry> symbolKinds) {
    checkArgument(!symbolKinds.isEmpty(), "The symbol kind table is empty");
    int last = Iterables.getLast(symbolKinds).getId();
    return render(symbolKinds, last, SYMBOL_INDENT, SYMBOL_WIDTH);
  }

  /**
   * Renders one {@code NAME = ID} line per entry. Entries with a display name get it as a
   * trailing comment, after the assignment is padded to {@code width} characters.
   */
  static String render(List<KindEntry> entries, int maxId, String indent, int width) {
    StringBuilder out = new StringBuilder();
    for (KindEntry entry : entries) {
      String assignment =
          entry.getName() + " = " + entry.getId() + ((entry.getId() == maxId) ? "" : ",");

      out.append(indent);
      if (entry.getDisplayName() != null) {
        out.append(Strings.padEnd(assignment, width, ' '))
            .append(" /* ")
            .append(entry.getDisplayName())
            .append("  */");
      } else {
        out.append(assignment);
      }
      out.append('\n');
    }

    return out.toString();
  }
}
