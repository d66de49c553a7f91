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
 * Rewrites semantic value ({@code $$}, {@code $n}, {@code $<tag>n}) and location ({@code @$},
 * {@code @n}) references in user code into C expressions.
 *
 * <p>String literals, character literals and comments are copied as is. Anything that does not
 * parse as a reference (e.g. {@code $name}) is copied as is too.
 */
abstract class ReferenceTranslator {

  /** Translates {@code $$} or {@code $<tag>$}; {@code tag} is null unless given explicitly. */
  abstract String valueOfResult(String tag);

  /** Translates {@code $n} or {@code $<tag>n}; {@code tag} is null unless given explicitly. */
  abstract String valueOfComponent(int index, String tag);

  /** Translates {@code @$}. */
  abstract String locationOfResult();

  /** Translates {@code @n}. */
  abstract String locationOfComponent(int index);

  final String translate(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      switch (c) {
        case '"':
        case '\'':
          i = copyQuoted(text, i, out);
          break;
        case '/':
          i = copyComment(text, i, out);
          break;
        case '$':
          i = translateValue(text, i, out);
          break;
        case '@':
          i = translateLocation(text, i, out);
          break;
        default:
          out.append(c);
          ++i;
          break;
      }
    }

    return out.toString();
  }

  private static int copyQuoted(String text, int start, StringBuilder out) {
    char quote = text.charAt(start);
    int i = start + 1;
    while (i < text.length() && text.charAt(i) != quote) {
      i += (text.charAt(i) == '\\') ? 2 : 1;
    }

    int end = Math.min(i + 1, text.length());
    out.append(text, start, end);
    return end;
  }

  private static int copyComment(String text, int start, StringBuilder out) {
    int end;
    if (text.startsWith("/*", start)) {
      end = text.indexOf("*/", start + 2);
      end = (end < 0) ? text.length() : end + 2;
    } else if (text.startsWith("//", start)) {
      end = text.indexOf('\n', start);
      end = (end < 0) ? text.length() : end;
    } else {
      end = start + 1;
    }

    out.append(text, start, end);
    return end;
  }

  private int translateValue(String text, int start, StringBuilder out) {
    int i = start + 1;
    String tag = null;
    if (i < text.length() && text.charAt(i) == '<') {
      int close = text.indexOf('>', i);
      if (close < 0) {
        out.append('$');
        return start + 1;
      }

      tag = text.substring(i + 1, close);
      i = close + 1;
    }

    if (i < text.length() && text.charAt(i) == '$') {
      out.append(valueOfResult(tag));
      return i + 1;
    }

    int end = scanIndex(text, i);
    if (end == i) {
      out.append(text, start, i);
      return i;
    }

    out.append(valueOfComponent(Integer.parseInt(text.substring(i, end)), tag));
    return end;
  }

  private int translateLocation(String text, int start, StringBuilder out) {
    int i = start + 1;
    if (i < text.length() && text.charAt(i) == '$') {
      out.append(locationOfResult());
      return i + 1;
    }

    int end = scanIndex(text, i);
    if (end == i) {
      out.append('@');
      return i;
    }

    out.append(locationOfComponent(Integer.parseInt(text.substring(i, end))));
    return end;
  }

  /**
   * Returns the end of an optionally negative decimal number starting at {@code start}, or
   * {@code start} if there is none.
   */
  private static int scanIndex(String text, int start) {
    int i = start;
    if (i < text.length() && text.charAt(i) == '-') {
      ++i;
    }

    int digits = i;
    while (i < text.length() && Character.isDigit(text.charAt(i))) {
      ++i;
    }

    return (i == digits) ? start : i;
  }
}
