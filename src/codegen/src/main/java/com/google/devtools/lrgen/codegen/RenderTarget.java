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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Where the generated parser goes.
 *
 * <p>The body is always written to a caller supplied sink. A header is generated only if a header
 * path is set: it is written to the header sink if there is one, or to a new file at the header
 * path otherwise.
 */
public final class RenderTarget {
  private final Appendable out;
  private final String outputFilePath;
  private final Appendable headerOut;
  private final String headerFilePath;

  private RenderTarget(
      Appendable out, String outputFilePath, Appendable headerOut, String headerFilePath) {
    this.out = out;
    this.outputFilePath = outputFilePath;
    this.headerOut = headerOut;
    this.headerFilePath = headerFilePath;
  }

  /** Creates a target without a header. */
  public static RenderTarget of(Appendable out, String outputFilePath) {
    return new RenderTarget(checkNotNull(out), checkNotNull(outputFilePath), null, null);
  }

  /**
   * Creates a target with a header.
   *
   * @param headerOut header sink or null to create a file at {@code headerFilePath}
   * @param headerFilePath path of the header used in {@code #line} directives and include guards
   * @throws IllegalArgumentException if a header sink comes without a header path
   */
  public static RenderTarget withHeader(
      Appendable out, String outputFilePath, Appendable headerOut, String headerFilePath) {
    checkArgument(
        headerOut == null || headerFilePath != null, "Header sink given without a header path");
    return new RenderTarget(
        checkNotNull(out), checkNotNull(outputFilePath), headerOut, headerFilePath);
  }

  public Appendable getOut() {
    return out;
  }

  public String getOutputFilePath() {
    return outputFilePath;
  }

  /** Gets the header sink or null. */
  public Appendable getHeaderOut() {
    return headerOut;
  }

  /** Gets the header path or null if no header is generated. */
  public String getHeaderFilePath() {
    return headerFilePath;
  }
}
