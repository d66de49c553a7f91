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

import com.google.common.primitives.ImmutableIntArray;
import com.google.devtools.lrgen.model.AnalysisContext;
import com.google.devtools.lrgen.model.Code;
import com.google.devtools.lrgen.model.Grammar;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exposes the formatting services to the skeletons as the {@code output} variable.
 *
 * <p>Methods are named after the skeleton fragments they produce. None of them changes the
 * context or the grammar.
 */
public final class ParserOutput {
  private static final Pattern TRAILING_IDENTIFIER =
      Pattern.compile("([A-Za-z_][A-Za-z_0-9]*)\\s*$");

  private static final Pattern NON_IDENTIFIER_RUN = Pattern.compile("[^a-zA-Z_0-9]+");

  private final AnalysisContext context;
  private final Grammar grammar;
  private final String templateName;
  private final String headerFilePath;
  private final UserCodeEmitter userCode;

  /**
   * @param context result of the grammar analysis
   * @param grammar the analyzed grammar
   * @param grammarFilePath path of the grammar file used in {@code #line} directives
   * @param templateName name of the body skeleton
   * @param headerFilePath path of the generated header or null if no header is generated
   */
  public ParserOutput(
      AnalysisContext context,
      Grammar grammar,
      String grammarFilePath,
      String templateName,
      String headerFilePath) {
    this.context = checkNotNull(context);
    this.grammar = checkNotNull(grammar);
    this.templateName = checkNotNull(templateName);
    this.headerFilePath = headerFilePath;
    this.userCode = new UserCodeEmitter(grammarFilePath);
  }

  /** Enumerators of {@code enum yytokentype}. */
  public String tokenEnums() {
    return EnumRenderer.tokenEnums(context.getTokenKinds(), context.getMaxUserToken());
  }

  /** Enumerators of {@code enum yysymbol_kind_t}. */
  public String symbolEnum() {
    return EnumRenderer.symbolEnum(context.getSymbolKinds());
  }

  /** Initializer of {@code yytranslate}. */
  public String yytranslate() {
    return IntegerTables.formatIntegerArray(context.getTranslate());
  }

  /** Initializer of {@code yyrline}. */
  public String yyrline() {
    return IntegerTables.formatIntegerArray(context.getRline());
  }

  /** Initializer of {@code yytname}. */
  public String yytname() {
    return StringTables.formatStringArray(context.getTname());
  }

  /** Initializer of any other integer table. */
  public String intArray(ImmutableIntArray table) {
    return IntegerTables.formatIntegerArray(table);
  }

  /** C type of the elements of {@code table}. */
  public String intTypeFor(ImmutableIntArray table) {
    return IntegerTables.selectIntegerType(table).getCName();
  }

  /** C type able to hold all the values in {@code [min, max]}. */
  public String intTypeForRange(int min, int max) {
    return IntegerTables.selectIntegerType(min, max).getCName();
  }

  /** See {@link TablePredicates#tableValueEquals}. */
  public String tableValueEquals(
      ImmutableIntArray table, String value, int literal, String symbol) {
    return TablePredicates.tableValueEquals(table, value, literal, symbol);
  }

  /** Cases of the reduction {@code switch}. */
  public String userActions() {
    return userCode.userActions(context.getRules());
  }

  /** Cases of the semantic value printer {@code switch}. */
  public String symbolActionsForPrinter() {
    return userCode.symbolActionsForPrinter(grammar.getSymbols());
  }

  /** User prologue with its {@code #line} directives, or an empty string. */
  public String prologue() {
    return verbatimOrEmpty(grammar.getAux().getPrologue());
  }

  /** User epilogue with its {@code #line} directives, or an empty string. */
  public String epilogue() {
    return verbatimOrEmpty(grammar.getAux().getEpilogue());
  }

  /** Members of {@code union YYSTYPE} with their {@code #line} directives, or an empty string. */
  public String unionMembers() {
    return verbatimOrEmpty(grammar.getUnionCode());
  }

  private String verbatimOrEmpty(Code code) {
    return (code == null) ? "" : userCode.verbatim(code);
  }

  /**
   * Gets the {@code %parse-param} declaration without its braces or null if there is none.
   */
  public String getParseParam() {
    String parseParam = grammar.getParseParam();
    if (parseParam == null) {
      return null;
    }

    parseParam = parseParam.trim();
    if (parseParam.startsWith("{") && parseParam.endsWith("}")) {
      parseParam = parseParam.substring(1, parseParam.length() - 1).trim();
    }

    return parseParam;
  }

  /**
   * Gets the name of the parameter declared by {@code %parse-param} or null if there is none.
   */
  public String getParseParamName() {
    String parseParam = getParseParam();
    if (parseParam == null) {
      return null;
    }

    Matcher matcher = TRAILING_IDENTIFIER.matcher(parseParam);
    return matcher.find() ? matcher.group(1) : null;
  }

  /** Extra formal parameters appended to the internal functions, e.g. {@code ", int *count"}. */
  public String getUserFormals() {
    String parseParam = getParseParam();
    return (parseParam == null) ? "" : ", " + parseParam;
  }

  /** Extra arguments matching {@link #getUserFormals()}, e.g. {@code ", count"}. */
  public String getUserArgs() {
    String name = getParseParamName();
    return (name == null) ? "" : ", " + name;
  }

  /** Gets the file name of the body skeleton. */
  public String getTemplateBasename() {
    int slash = templateName.lastIndexOf('/');
    return (slash < 0) ? templateName : templateName.substring(slash + 1);
  }

  /** Gets the path of the generated header or null if no header is generated. */
  public String getSpecMappedHeaderFile() {
    return headerFilePath;
  }

  /**
   * Gets the include guard of the generated header, e.g. {@code YY_YY_PARSE_H_INCLUDED}, or an
   * empty string if no header is generated.
   */
  public String getCppGuard() {
    if (headerFilePath == null) {
      return "";
    }

    return "YY_YY_"
        + NON_IDENTIFIER_RUN.matcher(headerFilePath).replaceAll("_").toUpperCase(Locale.ROOT)
        + "_INCLUDED";
  }

  public String getGeneratorVersion() {
    return CodeGenVersion.VERSION;
  }
}
