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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.Ordering;
import com.google.devtools.lrgen.model.Code;
import com.google.devtools.lrgen.model.Rule;
import com.google.devtools.lrgen.model.Symbol;
import java.util.Comparator;
import java.util.List;

/**
 * Splices user code from the grammar file into the generated parser.
 *
 * <p>Each block is surrounded by {@code #line} directives: the first one points at the grammar
 * file, the second one switches back to the generated file. The latter relies on {@link
 * Placeholder} markers since the final line numbers are only known once the whole file has been
 * assembled.
 */
public final class UserCodeEmitter {
  /** Directive returning to the generated file. */
  static final String OUTPUT_LINE_DIRECTIVE =
      "#line " + Placeholder.OUTPUT_LINE.getToken() + " " + Placeholder.OUTPUT_FILE.getToken()
          + "\n";

  private static final Comparator<Rule> BY_ID =
      new Comparator<Rule>() {
        @Override
        public int compare(Rule r1, Rule r2) {
          return Integer.compare(r1.getId(), r2.getId());
        }
      };

  /**
   * Path of the grammar file as it should appear in {@code #line} directives.
   */
  private final String grammarFilePath;

  public UserCodeEmitter(String grammarFilePath) {
    this.grammarFilePath = checkNotNull(grammarFilePath);
  }

  /**
   * Generates the cases of the reduction {@code switch}, one per rule with an action, in rule
   * order. The result always ends with a directive returning to the generated file, even if no
   * rule has an action.
   */
  public String userActions(List<Rule> rules) {
    StringBuilder out = new StringBuilder();
    for (Rule rule : Ordering.from(BY_ID).sortedCopy(rules)) {
      Code code = rule.getCode();
      if (code == null) {
        continue;
      }

      out.append("  case ").append(rule.getId() + 1).append(": /* ")
          .append(rule.getComment()).append("  */\n");
      appendBlock(out, code, rule.getTranslatedCode());
      out.append("    break;\n\n");
    }

    out.append('\n').append(OUTPUT_LINE_DIRECTIVE);
    return out.toString();
  }

  /**
   * Generates the cases of {@code yy_symbol_value_print}, one per symbol with a printer, in
   * declaration order.
   */
  public String symbolActionsForPrinter(List<Symbol> symbols) {
    StringBuilder out = new StringBuilder();
    for (Symbol symbol : symbols) {
      Code printer = symbol.getPrinter();
      if (printer == null) {
        continue;
      }

      out.append("    case ").append(symbol.getEnumName()).append(": /* ")
          .append(symbol.getComment()).append("  */\n");
      appendBlock(out, printer, symbol.getTranslatedPrinter());
      out.append("        break;\n\n");
    }

    return out.toString();
  }

  /**
   * Copies a block that needs no reference translation, such as the prologue or the union body.
   */
  public String verbatim(Code code) {
    StringBuilder out = new StringBuilder();
    appendBlock(out, code, code.getText());
    return out.toString();
  }

  private void appendBlock(StringBuilder out, Code code, String text) {
    out.append("#line ").append(code.getLine()).append(" \"").append(grammarFilePath)
        .append("\"\n");
    // Only the first line is shifted; the following ones already carry their indentation.
    out.append(Strings.repeat(" ", code.getColumn() - 1)).append(text).append('\n');
    out.append(OUTPUT_LINE_DIRECTIVE);
  }
}
