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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SymbolTest {

  @Test
  public void commentDefaultsToName() {
    Symbol symbol = Symbol.builder(3, "NUM", "YYSYMBOL_NUM").build();
    assertThat(symbol.getComment()).isEqualTo("NUM");
    assertThat(symbol.getTag()).isNull();
    assertThat(symbol.getPrinter()).isNull();
  }

  @Test
  public void typedPrinter() {
    Symbol symbol =
        Symbol.builder(3, "NUM", "YYSYMBOL_NUM")
            .setTag("ival")
            .setPrinter(new Code("{ fprintf (yyo, \"%d\", $$); }", 8, 10))
            .build();

    assertThat(symbol.getTranslatedPrinter())
        .isEqualTo("{ fprintf (yyo, \"%d\", ((*yyvaluep).ival)); }");
  }

  @Test
  public void untypedPrinterWithLocation() {
    Symbol symbol =
        Symbol.builder(3, "ID", "YYSYMBOL_ID")
            .setPrinter(new Code("{ show ($$, @$); }", 8, 10))
            .build();

    assertThat(symbol.getTranslatedPrinter()).isEqualTo("{ show ((*yyvaluep), (*yylocationp)); }");
  }

  @Test
  public void numberedReferenceRejected() {
    Symbol symbol =
        Symbol.builder(3, "ID", "YYSYMBOL_ID").setPrinter(new Code("{ $1; }", 8, 10)).build();

    assertThrows(IllegalArgumentException.class, symbol::getTranslatedPrinter);
  }

  @Test
  public void noPrinter() {
    Symbol symbol = Symbol.builder(3, "ID", "YYSYMBOL_ID").build();
    assertThrows(IllegalStateException.class, symbol::getTranslatedPrinter);
  }
}
