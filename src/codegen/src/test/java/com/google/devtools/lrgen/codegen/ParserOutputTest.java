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

import static com.google.common.truth.Truth.assertThat;

import com.google.devtools.lrgen.model.Auxiliary;
import com.google.devtools.lrgen.model.Grammar;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserOutputTest {
  private static ParserOutput output(Grammar grammar, String headerFilePath) {
    return new ParserOutput(
        SampleGrammar.context(),
        grammar,
        SampleGrammar.GRAMMAR_FILE,
        "bison/yacc.c",
        headerFilePath);
  }

  private static ParserOutput output(String parseParam) {
    return output(SampleGrammar.grammarBuilder().setParseParam(parseParam).build(), null);
  }

  @Test
  public void parseParam() {
    ParserOutput output = output("{int *count}");

    assertThat(output.getParseParam()).isEqualTo("int *count");
    assertThat(output.getParseParamName()).isEqualTo("count");
    assertThat(output.getUserFormals()).isEqualTo(", int *count");
    assertThat(output.getUserArgs()).isEqualTo(", count");
  }

  @Test
  public void parseParamWithoutBraces() {
    ParserOutput output = output("  struct state *st ");

    assertThat(output.getParseParam()).isEqualTo("struct state *st");
    assertThat(output.getParseParamName()).isEqualTo("st");
  }

  @Test
  public void noParseParam() {
    ParserOutput output = output(SampleGrammar.grammar(), null);

    assertThat(output.getParseParam()).isNull();
    assertThat(output.getParseParamName()).isNull();
    assertThat(output.getUserFormals()).isEmpty();
    assertThat(output.getUserArgs()).isEmpty();
  }

  @Test
  public void cppGuard() {
    assertThat(output(SampleGrammar.grammar(), "out/calc.tab.h").getCppGuard())
        .isEqualTo("YY_YY_OUT_CALC_TAB_H_INCLUDED");
    assertThat(output(SampleGrammar.grammar(), "../gen//y-1.h").getCppGuard())
        .isEqualTo("YY_YY__GEN_Y_1_H_INCLUDED");
  }

  @Test
  public void noHeader() {
    ParserOutput output = output(SampleGrammar.grammar(), null);

    assertThat(output.getCppGuard()).isEmpty();
    assertThat(output.getSpecMappedHeaderFile()).isNull();
  }

  @Test
  public void templateBasename() {
    assertThat(output(SampleGrammar.grammar(), null).getTemplateBasename()).isEqualTo("yacc.c");
  }

  @Test
  public void prologueAndEpilogue() {
    ParserOutput output = output(SampleGrammar.grammar(), null);

    assertThat(output.prologue())
        .isEqualTo("#line 2 \"calc.y\"\n#include <stdio.h>\n\n#line [@oline@] [@ofile@]\n");
    assertThat(output.epilogue()).startsWith("#line 13 \"calc.y\"\nint main");
  }

  @Test
  public void missingAuxiliaryCode() {
    Grammar grammar =
        SampleGrammar.grammarBuilder().setAux(Auxiliary.empty()).setUnionCode(null).build();
    ParserOutput output = output(grammar, null);

    assertThat(output.prologue()).isEmpty();
    assertThat(output.epilogue()).isEmpty();
    assertThat(output.unionMembers()).isEmpty();
  }

  @Test
  public void unionMembers() {
    assertThat(output(SampleGrammar.grammar(), null).unionMembers())
        .isEqualTo("#line 4 \"calc.y\"\n         int ival;\n#line [@oline@] [@ofile@]\n");
  }

  @Test
  public void tables() {
    ParserOutput output = output(SampleGrammar.grammar(), null);

    assertThat(output.intTypeFor(SampleGrammar.context().getTranslate()))
        .isEqualTo("yytype_int8");
    assertThat(output.intTypeForRange(0, 5)).isEqualTo("yytype_int8");
    assertThat(output.yyrline()).isEqualTo("       0,     9,     9,    10");
    assertThat(output.yytname()).startsWith("  \"\\\"end of file\\\"\", \"error\",");
    assertThat(output.tableValueEquals(SampleGrammar.context().getPact(), "Yyn", -3, "NINF"))
        .isEqualTo("((Yyn) == NINF)");
  }

  @Test
  public void enums() {
    ParserOutput output = output(SampleGrammar.grammar(), null);

    assertThat(output.tokenEnums()).contains("    NUM = 258                      /* NUM  */\n");
    assertThat(output.symbolEnum())
        .endsWith("  YYSYMBOL_exp = 6                         /* exp  */\n");
  }

  @Test
  public void actions() {
    ParserOutput output = output(SampleGrammar.grammar(), null);

    assertThat(output.userActions()).contains("  case 3: /* exp: NUM  */\n");
    assertThat(output.symbolActionsForPrinter()).startsWith("    case YYSYMBOL_NUM: /* NUM  */\n");
  }
}
