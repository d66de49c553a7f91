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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;

/**
 * Result of the grammar analysis: automaton dimensions, kind tables and the packed LALR(1)
 * tables, in the shape the C skeleton expects them.
 *
 * <p>Table names follow the arrays of the generated parser ({@code yypact}, {@code yycheck},
 * ...). The code generator only serializes them, it never checks that they are consistent.
 */
public final class AnalysisContext {
  private final int finalState;
  private final int lastIndex;
  private final int tokenCount;
  private final int nonterminalCount;
  private final int ruleCount;
  private final int stateCount;
  private final int maxUserToken;
  private final int pactNinf;
  private final int tableNinf;
  private final ImmutableList<KindEntry> tokenKinds;
  private final ImmutableList<KindEntry> symbolKinds;
  private final ImmutableList<Rule> rules;
  private final ImmutableIntArray translate;
  private final ImmutableIntArray rline;
  private final ImmutableList<String> tname;
  private final ImmutableIntArray pact;
  private final ImmutableIntArray defact;
  private final ImmutableIntArray pgoto;
  private final ImmutableIntArray defgoto;
  private final ImmutableIntArray table;
  private final ImmutableIntArray check;
  private final ImmutableIntArray stos;
  private final ImmutableIntArray r1;
  private final ImmutableIntArray r2;

  private AnalysisContext(Builder builder) {
    this.finalState = builder.finalState;
    this.lastIndex = builder.lastIndex;
    this.tokenCount = builder.tokenCount;
    this.nonterminalCount = builder.nonterminalCount;
    this.ruleCount = builder.ruleCount;
    this.stateCount = builder.stateCount;
    this.maxUserToken = builder.maxUserToken;
    this.pactNinf = builder.pactNinf;
    this.tableNinf = builder.tableNinf;
    this.tokenKinds = checkAscending(builder.tokenKinds, "token");
    this.symbolKinds = checkAscending(builder.symbolKinds, "symbol");
    this.rules = builder.rules;
    this.translate = builder.translate;
    this.rline = builder.rline;
    this.tname = builder.tname;
    this.pact = builder.pact;
    this.defact = builder.defact;
    this.pgoto = builder.pgoto;
    this.defgoto = builder.defgoto;
    this.table = builder.table;
    this.check = builder.check;
    this.stos = builder.stos;
    this.r1 = builder.r1;
    this.r2 = builder.r2;
  }

  private static ImmutableList<KindEntry> checkAscending(
      ImmutableList<KindEntry> entries, String kind) {
    for (int i = 1; i < entries.size(); ++i) {
      checkArgument(
          entries.get(i - 1).getId() < entries.get(i).getId(),
          "The %s kind table is not sorted by id: %s before %s",
          kind,
          entries.get(i - 1),
          entries.get(i));
    }

    return entries;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** YYFINAL: the accepting state. */
  public int getFinalState() {
    return finalState;
  }

  /** YYLAST: the last index in {@link #getTable()} and {@link #getCheck()}. */
  public int getLastIndex() {
    return lastIndex;
  }

  /** YYNTOKENS: number of terminals. */
  public int getTokenCount() {
    return tokenCount;
  }

  /** YYNNTS: number of nonterminals. */
  public int getNonterminalCount() {
    return nonterminalCount;
  }

  /** YYNRULES: number of rules. */
  public int getRuleCount() {
    return ruleCount;
  }

  /** YYNSTATES: number of states. */
  public int getStateCount() {
    return stateCount;
  }

  /** YYMAXUTOK: the largest user token number. */
  public int getMaxUserToken() {
    return maxUserToken;
  }

  /** YYPACT_NINF: value of {@link #getPact()} meaning "use the default reduction". */
  public int getPactNinf() {
    return pactNinf;
  }

  /** YYTABLE_NINF: value of {@link #getTable()} meaning "syntax error". */
  public int getTableNinf() {
    return tableNinf;
  }

  /** Gets the rows of {@code enum yytokentype} ordered by token number. */
  public ImmutableList<KindEntry> getTokenKinds() {
    return tokenKinds;
  }

  /** Gets the rows of {@code enum yysymbol_kind_t} ordered by symbol number. */
  public ImmutableList<KindEntry> getSymbolKinds() {
    return symbolKinds;
  }

  /** Gets the rules known to the automaton. */
  public ImmutableList<Rule> getRules() {
    return rules;
  }

  /** Maps token numbers returned by {@code yylex} to symbol numbers. */
  public ImmutableIntArray getTranslate() {
    return translate;
  }

  /** Grammar file line of each rule. */
  public ImmutableIntArray getRline() {
    return rline;
  }

  /** Display names of all the symbols. */
  public ImmutableList<String> getTname() {
    return tname;
  }

  public ImmutableIntArray getPact() {
    return pact;
  }

  public ImmutableIntArray getDefact() {
    return defact;
  }

  public ImmutableIntArray getPgoto() {
    return pgoto;
  }

  public ImmutableIntArray getDefgoto() {
    return defgoto;
  }

  public ImmutableIntArray getTable() {
    return table;
  }

  public ImmutableIntArray getCheck() {
    return check;
  }

  public ImmutableIntArray getStos() {
    return stos;
  }

  public ImmutableIntArray getR1() {
    return r1;
  }

  public ImmutableIntArray getR2() {
    return r2;
  }

  /**
   * Builder of {@link AnalysisContext} instances. Tables not set are empty.
   */
  public static final class Builder {
    private int finalState;
    private int lastIndex;
    private int tokenCount;
    private int nonterminalCount;
    private int ruleCount;
    private int stateCount;
    private int maxUserToken;
    private int pactNinf;
    private int tableNinf;
    private ImmutableList<KindEntry> tokenKinds = ImmutableList.of();
    private ImmutableList<KindEntry> symbolKinds = ImmutableList.of();
    private ImmutableList<Rule> rules = ImmutableList.of();
    private ImmutableIntArray translate = ImmutableIntArray.of();
    private ImmutableIntArray rline = ImmutableIntArray.of();
    private ImmutableList<String> tname = ImmutableList.of();
    private ImmutableIntArray pact = ImmutableIntArray.of();
    private ImmutableIntArray defact = ImmutableIntArray.of();
    private ImmutableIntArray pgoto = ImmutableIntArray.of();
    private ImmutableIntArray defgoto = ImmutableIntArray.of();
    private ImmutableIntArray table = ImmutableIntArray.of();
    private ImmutableIntArray check = ImmutableIntArray.of();
    private ImmutableIntArray stos = ImmutableIntArray.of();
    private ImmutableIntArray r1 = ImmutableIntArray.of();
    private ImmutableIntArray r2 = ImmutableIntArray.of();

    private Builder() {}

    public Builder setFinalState(int finalState) {
      this.finalState = finalState;
      return this;
    }

    public Builder setLastIndex(int lastIndex) {
      this.lastIndex = lastIndex;
      return this;
    }

    public Builder setTokenCount(int tokenCount) {
      this.tokenCount = tokenCount;
      return this;
    }

    public Builder setNonterminalCount(int nonterminalCount) {
      this.nonterminalCount = nonterminalCount;
      return this;
    }

    public Builder setRuleCount(int ruleCount) {
      this.ruleCount = ruleCount;
      return this;
    }

    public Builder setStateCount(int stateCount) {
      this.stateCount = stateCount;
      return this;
    }

    public Builder setMaxUserToken(int maxUserToken) {
      this.maxUserToken = maxUserToken;
      return this;
    }

    public Builder setPactNinf(int pactNinf) {
      this.pactNinf = pactNinf;
      return this;
    }

    public Builder setTableNinf(int tableNinf) {
      this.tableNinf = tableNinf;
      return this;
    }

    public Builder setTokenKinds(List<KindEntry> tokenKinds) {
      this.tokenKinds = ImmutableList.copyOf(tokenKinds);
      return this;
    }

    public Builder setSymbolKinds(List<KindEntry> symbolKinds) {
      this.symbolKinds = ImmutableList.copyOf(symbolKinds);
      return this;
    }

    public Builder setRules(List<Rule> rules) {
      this.rules = ImmutableList.copyOf(rules);
      return this;
    }

    public Builder setTranslate(ImmutableIntArray translate) {
      this.translate = checkNotNull(translate);
      return this;
    }

    public Builder setRline(ImmutableIntArray rline) {
      this.rline = checkNotNull(rline);
      return this;
    }

    public Builder setTname(List<String> tname) {
      this.tname = ImmutableList.copyOf(tname);
      return this;
    }

    public Builder setPact(ImmutableIntArray pact) {
      this.pact = checkNotNull(pact);
      return this;
    }

    public Builder setDefact(ImmutableIntArray defact) {
      this.defact = checkNotNull(defact);
      return this;
    }

    public Builder setPgoto(ImmutableIntArray pgoto) {
      this.pgoto = checkNotNull(pgoto);
      return this;
    }

    public Builder setDefgoto(ImmutableIntArray defgoto) {
      this.defgoto = checkNotNull(defgoto);
      return this;
    }

    public Builder setTable(ImmutableIntArray table) {
      this.table = checkNotNull(table);
      return this;
    }

    public Builder setCheck(ImmutableIntArray check) {
      this.check = checkNotNull(check);
      return this;
    }

    public Builder setStos(ImmutableIntArray stos) {
      this.stos = checkNotNull(stos);
      return this;
    }

    public Builder setR1(ImmutableIntArray r1) {
      this.r1 = checkNotNull(r1);
      return this;
    }

    public Builder setR2(ImmutableIntArray r2) {
      this.r2 = checkNotNull(r2);
      return this;
    }

    public AnalysisContext build() {
      return new AnalysisContext(this);
    }
  }
}
