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

/**
 * Markers left in the executed skeleton for values only known once the whole file is assembled.
 */
public enum Placeholder {
  /** Number of the line following the one holding the marker. */
  OUTPUT_LINE("[@oline@]"),

  /** Quoted path of the generated file. */
  OUTPUT_FILE("[@ofile@]");

  private final String token;

  Placeholder(String token) {
    this.token = token;
  }

  /** Gets the text of the marker as it appears in the executed skeleton. */
  public String getToken() {
    return token;
  }

  @Override
  public String toString() {
    return token;
  }
}
