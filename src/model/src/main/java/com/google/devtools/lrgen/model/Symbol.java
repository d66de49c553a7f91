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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Grammar symbol (terminal or nonterminal) as seen by the code generator.
 */
public final class Symbol {
  /**
   * Symbol number in the symbol-kind table.
   */
  private final int number;

  /**
   * Name of the symbol as written in the grammar (e.g. {@code NUM}, {@code '+'}, {@code expr}).
   */
  private final String name;

  /**
   * Name of the generated {@code yysymbol_kind_t} enumerator (e.g. {@code YYSYMBOL_NUM}).
   */
  private final String enumName;

  /**
   * Human readable description emitted next to generated cases.
   */
  private final String comment;

  /**
   * Member of the semantic value union used by this symbol or null if untyped.
   */
  private final String tag;

  /**
   * Code to run when displaying the semantic value of this symbol or null.
   */
  private final Code printer;

  private final boolean terminal;

  private Symbol(Builder builder) {
    this.number = builder.number;
    this.name = builder.name;
    this.enumName = builder.enumName;
    this.comment = (builder.comment != null) ? builder.comment : builder.name;
    this.tag = builder.tag;
    this.printer = builder.printer;
    this.terminal = builder.terminal;
  }

  public static Builder builder(int number, String name, String enumName) {
    return new Builder(number, name, enumName);
  }

  public int getNumber() {
    return number;
  }

  public String getName() {
    return name;
  }

  public String getEnumName() {
    return enumName;
  }

  public String getComment() {
    return comment;
  }

  public String getTag() {
    return tag;
  }

  public Code getPrinter() {
    return printer;
  }

  public boolean isTerminal() {
    return terminal;
  }

  /**
   * Gets the printer code with semantic value and location references replaced by the
   * expressions available inside {@code yy_symbol_value_print}.
   *
   * @throws IllegalStateException if the symbol has no printer
   */
  public String getTranslatedPrinter() {
    checkState(printer != null, "Symbol %s has no printer", name);
    return new PrinterReferenceTranslator(this).translate(printer.getText());
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * Builder of {@link Symbol} instances.
   */
  public static final class Builder {
    private final int number;
    private final String name;
    private final String enumName;
    private String comment;
    private String tag;
    private Code printer;
    private boolean terminal;

    private Builder(int number, String name, String enumName) {
      this.number = number;
      this.name = checkNotNull(name);
      this.enumName = checkNotNull(enumName);
    }

    public Builder setComment(String comment) {
      this.comment = comment;
      return this;
    }

    public Builder setTag(String tag) {
      this.tag = tag;
      return this;
    }

    public Builder setPrinter(Code printer) {
      this.printer = printer;
      return this;
    }

    public Builder setTerminal(boolean terminal) {
      this.terminal = terminal;
      return this;
    }

    public Symbol build() {
      return new Symbol(this);
    }
  }
}
