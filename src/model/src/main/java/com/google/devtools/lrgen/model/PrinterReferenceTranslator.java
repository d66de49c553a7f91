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

package com.google.devtools.lrgen.model;

/**
 * Translates references inside a {@code %printer} block. Only the printed symbol itself
 * ({@code $$} and {@code @$}) can be referenced.
 */
final class PrinterReferenceTranslator extends ReferenceTranslator {
  private final Symbol symbol;

  PrinterReferenceTranslator(Symbol symbol) {
    this.symbol = symbol;
  }

  @Override
  String valueOfResult(String tag) {
    if (tag == null) {
      tag = symbol.getTag();
    }

    return (tag == null) ? "(*yyvaluep)" : "((*yyvaluep)." + tag + ")";
  }

  @Override
  String valueOfComponent(int index, String tag) {
    throw new IllegalArgumentException(
        String.format("$%d is not allowed in the printer of %s", index, symbol.getName()));
  }

  @Override
  String locationOfResult() {
    return "(*yylocationp)";
  }

  @Override
  String locationOfComponent(int index) {
    throw new IllegalArgumentException(
        String.format("@%d is not allowed in the printer of %s", index, symbol.getName()));
  }
}
