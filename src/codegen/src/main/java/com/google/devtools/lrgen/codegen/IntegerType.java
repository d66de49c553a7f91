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
 * Integer types the skeleton declares for its tables, from the narrowest to the widest.
 *
 * <p>Signed ranges are symmetric: the most negative value of the C type is left out.
 */
public enum IntegerType {
  INT8("yytype_int8", -127, 127),
  UINT8("yytype_uint8", 0, 255),
  INT16("yytype_int16", -32767, 32767),
  UINT16("yytype_uint16", 0, 65535),
  INT("int", Integer.MIN_VALUE, Integer.MAX_VALUE);

  private final String cName;
  private final int min;
  private final int max;

  IntegerType(String cName, int min, int max) {
    this.cName = cName;
    this.min = min;
    this.max = max;
  }

  /** Gets the name of the type in the generated code. */
  public String getCName() {
    return cName;
  }

  /** Checks whether both ends of {@code [low, high]} are representable. */
  boolean accepts(int low, int high) {
    return (min <= low) && (low <= max) && (min <= high) && (high <= max);
  }

  @Override
  public String toString() {
    return cName;
  }
}
