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

/**
 * Verbatim block of user code copied from the grammar file.
 *
 * <p>The line and column point at the first character of the block in the grammar file. The
 * column is used to reproduce the original indentation of multi-line blocks.
 */
public final class Code {
  private final String text;
  private final int line;
  private final int column;

  public Code(String text, int line, int column) {
    checkArgument(line >= 1, "Code line must be 1-based, got %s", line);
    checkArgument(column >= 1, "Code column must be 1-based, got %s", column);
    this.text = checkNotNull(text);
    this.line = line;
    this.column = column;
  }

  /** Gets the raw text of the block, without any reference translation. */
  public String getText() {
    return text;
  }

  /** Gets the 1-based line of the block in the grammar file. */
  public int getLine() {
    return line;
  }

  /** Gets the 1-based column of the block in the grammar file. */
  public int getColumn() {
    return column;
  }

  @Override
  public String toString() {
    return String.format("Code{line=%d, column=%d, text=%s}", line, column, text);
  }
}
