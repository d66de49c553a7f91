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

/**
 * Translates references inside a rule action into accesses to {@code yyval}, {@code yyloc} and
 * the value and location stacks.
 */
final class ActionReferenceTranslator extends ReferenceTranslator {
  private final Rule rule;

  ActionReferenceTranslator(Rule rule) {
    this.rule = rule;
  }

  @Override
  String valueOfResult(String tag) {
    return withMember("(yyval", (tag != null) ? tag : rule.getLhs().getTag());
  }

  @Override
  String valueOfComponent(int index, String tag) {
    int length = rule.getRhs().size();
    checkArgument(
        index <= length,
        "$%s of rule %s exceeds the %s symbols of its right hand side",
        index,
        rule.getComment(),
        length);

    if (tag == null && index >= 1) {
      tag = rule.getRhs().get(index - 1).getTag();
    }

    return withMember("(yyvsp[" + (index - length) + "]", tag);
  }

  @Override
  String locationOfResult() {
    return "(yyloc)";
  }

  @Override
  String locationOfComponent(int index) {
    int length = rule.getRhs().size();
    checkArgument(
        index <= length,
        "@%s of rule %s exceeds the %s symbols of its right hand side",
        index,
        rule.getComment(),
        length);

    return "(yylsp[" + (index - length) + "])";
  }

  private static String withMember(String open, String tag) {
    return (tag == null) ? open + ")" : open + "." + tag + ")";
  }
}
