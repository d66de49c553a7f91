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
 * Verbatim code surrounding the grammar rules: the {@code %{ ... %}} prologue and the code
 * after the second {@code %%}.
 */
public final class Auxiliary {
  private static final Auxiliary EMPTY = new Auxiliary(null, null);

  private final Code prologue;
  private final Code epilogue;

  public Auxiliary(Code prologue, Code epilogue) {
    this.prologue = prologue;
    this.epilogue = epilogue;
  }

  public static Auxiliary empty() {
    return EMPTY;
  }

  /** Gets the prologue or null. */
  public Code getPrologue() {
    return prologue;
  }

  /** Gets the epilogue or null. */
  public Code getEpilogue() {
    return epilogue;
  }
}
