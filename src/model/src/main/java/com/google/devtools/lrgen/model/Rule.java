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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Grammar production {@code lhs: rhs...} with an optional reduction action.
 */
public final class Rule {
  private final int id;
  private final Symbol lhs;
  private final ImmutableList<Symbol> rhs;
  private final Code code;

  public Rule(int id, Symbol lhs, List<Symbol> rhs, Code code) {
    this.id = id;
    this.lhs = checkNotNull(lhs);
    this.rhs = ImmutableList.copyOf(rhs);
    this.code = code;
  }

  /**
   * Gets the 0-based rule number. The generated {@code switch} uses {@code id + 1}.
   */
  public int getId() {
    return id;
  }

  public Symbol getLhs() {
    return lhs;
  }

  public ImmutableList<Symbol> getRhs() {
    return rhs;
  }

  /**
   * Gets the action code or null if the rule has no action.
   */
  public Code getCode() {
    return code;
  }

  /**
   * Formats the rule the way it is shown in generated comments, e.g. {@code expr: expr '+' NUM}.
   */
  public String getComment() {
    if (rhs.isEmpty()) {
      return lhs.getName() + ": %empty";
    }

    return lhs.getName() + ": " + Joiner.on(' ').join(rhs);
  }

  /**
   * Gets the action code with {@code $$}, {@code $n}, {@code @$} and {@code @n} replaced by
   * parser stack accesses.
   *
   * @throws IllegalStateException if the rule has no action
   */
  public String getTranslatedCode() {
    checkState(code != null, "Rule %s has no action", id);
    return new ActionReferenceTranslator(this).translate(code.getText());
  }

  @Override
  public String toString() {
    return getComment();
  }
}
