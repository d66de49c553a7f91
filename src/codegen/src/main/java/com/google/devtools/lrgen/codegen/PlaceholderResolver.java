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

import com.google.common.collect.ImmutableList;

/**
 * Replaces {@link Placeholder} markers in a fully executed skeleton.
 *
 * <p>The text is processed one physical line at a time (1-based). {@link
 * Placeholder#OUTPUT_LINE} becomes the number of the next line, which is what a {@code #line}
 * directive expects, and {@link Placeholder#OUTPUT_FILE} becomes the quoted output path. A marker
 * takes the number of the line holding it wherever it appears on that line.
 */
public final class PlaceholderResolver {
  private final String quotedOutputPath;

  public PlaceholderResolver(String outputFilePath) {
    this.quotedOutputPath = "\"" + checkNotNull(outputFilePath) + "\"";
  }

  /**
   * Resolves all the markers of {@code text}. Line terminators are preserved.
   */
  public String resolve(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int lineNumber = 0;
    int start = 0;
    while (start < text.length()) {
      int end = text.indexOf('\n', start);
      end = (end < 0) ? text.length() : end + 1;
      ++lineNumber;

      for (Segment segment : parseLine(text.substring(start, end))) {
        out.append(resolve(segment, lineNumber));
      }

      start = end;
    }

    return out.toString();
  }

  private String resolve(Segment segment, int lineNumber) {
    if (segment.getPlaceholder() == null) {
      return segment.getLiteral();
    }

    switch (segment.getPlaceholder()) {
      case OUTPUT_LINE:
        return Integer.toString(lineNumber + 1);
      case OUTPUT_FILE:
        return quotedOutputPath;
      default:
        throw new AssertionError("Unexpected placeholder " + segment.getPlaceholder());
    }
  }

  /**
   * Splits a line into literal text and markers.
   */
  static ImmutableList<Segment> parseLine(String line) {
    ImmutableList.Builder<Segment> segments = ImmutableList.builder();
    int literalStart = 0;
    int i = line.indexOf('[');
    while (i >= 0) {
      Placeholder placeholder = placeholderAt(line, i);
      if (placeholder == null) {
        i = line.indexOf('[', i + 1);
        continue;
      }

      if (literalStart < i) {
        segments.add(Segment.literal(line.substring(literalStart, i)));
      }
      segments.add(Segment.placeholder(placeholder));

      literalStart = i + placeholder.getToken().length();
      i = line.indexOf('[', literalStart);
    }

    if (literalStart < line.length()) {
      segments.add(Segment.literal(line.substring(literalStart)));
    }

    return segments.build();
  }

  private static Placeholder placeholderAt(String line, int offset) {
    for (Placeholder placeholder : Placeholder.values()) {
      if (line.startsWith(placeholder.getToken(), offset)) {
        return placeholder;
      }
    }

    return null;
  }

  /**
   * Piece of a line: either literal text or a marker.
   */
  static final class Segment {
    private final String literal;
    private final Placeholder placeholder;

    private Segment(String literal, Placeholder placeholder) {
      this.literal = literal;
      this.placeholder = placeholder;
    }

    static Segment literal(String text) {
      return new Segment(text, null);
    }

    static Segment placeholder(Placeholder placeholder) {
      return new Segment(null, placeholder);
    }

    /** Gets the literal text or null if this segment is a marker. */
    String getLiteral() {
      return literal;
    }

    /** Gets the marker or null if this segment is literal text. */
    Placeholder getPlaceholder() {
      return placeholder;
    }

    @Override
    public String toString() {
      return (placeholder != null) ? placeholder.getToken() : literal;
    }
  }
}
