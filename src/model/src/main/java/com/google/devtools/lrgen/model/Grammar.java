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

import com.google.common.collect.ImmutableList;

/**
 * Grammar as produced by the front end: symbols, rules and the verbatim code that goes into the
 * generated parser as is.
 *
 * <p>Instances are immutable and are never modified by the code generator.
 */
public final class Grammar {
  private final Symbol eofSymbol;
  private final Symbol errorSymbol;
  private final Symbol undefSymbol;
  private final Symbol acceptSymbol;
  private final ImmutableList<Symbol> symbols;
  private final ImmutableList<Rule> rules;
  private final String parseParam;
  private final Code unionCode;
  private final Auxiliary aux;

  private Grammar(Builder builder) {
    this.eofSymbol = checkNotNull(builder.eofSymbol, "end of input symbol not set");
    this.errorSymbol = checkNotNull(builder.errorSymbol, "error symbol not set");
    this.undefSymbol = checkNotNull(builder.undefSymbol, "undefined symbol not set");
    this.acceptSymbol = checkNotNull(builder.acceptSymbol, "accept symbol not set");
    this.symbols = builder.symbols.build();
    this.rules = builder.rules.build();
    this.parseParam = builder.parseParam;
    this.unionCode = builder.unionCode;
    this.aux = builder.aux;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Symbol getEofSymbol() {
    return eofSymbol;
  }

  public Symbol getErrorSymbol() {
    return errorSymbol;
  }

  public Symbol getUndefSymbol() {
    return undefSymbol;
  }

  public Symbol getAcceptSymbol() {
    return acceptSymbol;
  }

  /** Gets all the symbols in declaration order. */
  public ImmutableList<Symbol> getSymbols() {
    return symbols;
  }

  public ImmutableList<Rule> getRules() {
    return rules;
  }

  /**
   * Gets the {@code %parse-param} declaration including the surrounding braces (e.g.
   * <code>{struct context *ctx}</code>) or null if not declared.
   */
  public String getParseParam() {
    return parseParam;
  }

  /** Gets the body of the {@code %union} declaration or null if not declared. */
  public Code getUnionCode() {
    return unionCode;
  }

  public Auxiliary getAux() {
    return aux;
  }

  /**
   * Builder of {@link Grammar} instances.
   */
  public static final class Builder {
    private Symbol eofSymbol;
    private Symbol errorSymbol;
    private Symbol undefSymbol;
    private Symbol acceptSymbol;
    private final ImmutableList.Builder<Symbol> symbols = ImmutableList.builder();
    private final ImmutableList.Builder<Rule> rules = ImmutableList.builder();
    private String parseParam;
    private Code unionCode;
    private Auxiliary aux = Auxiliary.empty();

    private Builder() {}

    public Builder setEofSymbol(Symbol eofSymbol) {
      this.eofSymbol = eofSymbol;
      return this;
    }

    public Builder setErrorSymbol(Symbol errorSymbol) {
      this.errorSymbol = errorSymbol;
      return this;
    }

    public Builder setUndefSymbol(Symbol undefSymbol) {
      this.undefSymbol = undefSymbol;
      return this;
    }

    public Builder setAcceptSymbol(Symbol acceptSymbol) {
      this.acceptSymbol = acceptSymbol;
      return this;
    }

    public Builder addSymbol(Symbol symbol) {
      symbols.add(symbol);
      return this;
    }

    public Builder addRule(Rule rule) {
      rules.add(rule);
      return this;
    }

    public Builder setParseParam(String parseParam) {
      this.parseParam = parseParam;
      return this;
    }

    public Builder setUnionCode(Code unionCode) {
      this.unionCode = unionCode;
      return this;
    }

    public Builder setAux(Auxiliary aux) {
      this.aux = checkNotNull(aux);
      return this;
    }

    public Grammar build() {
      return new Grammar(this);
    }
  }
}
