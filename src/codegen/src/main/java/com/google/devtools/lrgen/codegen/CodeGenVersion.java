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

/** Defines the version of the code generator stamped into generated files. */
public final class CodeGenVersion {
  /**
   * Major version of the code generator.
   *
   * <p>Generated parsers of the same major version expect the same skeleton layout.
   */
  public static final int MAJOR_VERSION = 1;

  /** Minor version of the code generator. */
  public static final int MINOR_VERSION = 0;

  /** Version string in the format of MAJOR.MINOR. */
  public static final String VERSION = String.format("%d.%d", MAJOR_VERSION, MINOR_VERSION);

  private CodeGenVersion() {}
}
