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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.primitives.ImmutableIntArray;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IntegerTablesTest {
  private static IntegerType typeOf(int... values) {
    return IntegerTables.selectIntegerType(ImmutableIntArray.copyOf(values));
  }

  @Test
  public void int8() {
    assertThat(typeOf(0, 127)).isEqualTo(IntegerType.INT8);
    assertThat(typeOf(-127, 5)).isEqualTo(IntegerType.INT8);
    assertThat(IntegerType.INT8.getCName()).isEqualTo("yytype_int8");
  }

  @Test
  public void uint8() {
    assertThat(typeOf(0, 128)).isEqualTo(IntegerType.UINT8);
    assertThat(typeOf(255)).isEqualTo(IntegerType.UINT8);
  }

  @Test
  public void int16() {
    assertThat(typeOf(-1, 256)).isEqualTo(IntegerType.INT16);
    assertThat(typeOf(-128)).isEqualTo(IntegerType.INT16);
    assertThat(typeOf(32767)).isEqualTo(IntegerType.INT16);
  }

  @Test
  public void uint16() {
    assertThat(typeOf(32768)).isEqualTo(IntegerType.UINT16);
    assertThat(typeOf(0, 65535)).isEqualTo(IntegerType.UINT16);
  }

  @Test
  public void plainInt() {
    assertThat(typeOf(65536)).isEqualTo(IntegerType.INT);
    assertThat(typeOf(-32768, 0)).isEqualTo(IntegerType.INT);
    assertThat(IntegerType.INT.getCName()).isEqualTo("int");
  }

  @Test
  public void range() {
    assertThat(IntegerTables.selectIntegerType(0, 5)).isEqualTo(IntegerType.INT8);
    assertThat(IntegerTables.selectIntegerType(-1, 200)).isEqualTo(IntegerType.INT16);
  }

  @Test
  public void boundsComeFromAnyPosition() {
    assertThat(typeOf(5, -200, 3)).isEqualTo(IntegerType.INT16);
    assertThat(typeOf(5, 300, 3)).isEqualTo(IntegerType.INT16);
  }

  @Test
  public void emptyTable() {
    assertThrows(
        IllegalArgumentException.class,
        () -> IntegerTables.selectIntegerType(ImmutableIntArray.of()));
  }

  @Test
  public void formatShortTable() {
    assertThat(IntegerTables.formatIntegerArray(ImmutableIntArray.of(1, -2, 300)))
        .isEqualTo("       1,    -2,   300");
  }

  @Test
  public void formatWrapsEveryTenValues() {
    ImmutableIntArray.Builder values = ImmutableIntArray.builder();
    for (int i = 0; i < 23; ++i) {
      values.add(i);
    }

    String formatted = IntegerTables.formatIntegerArray(values.build());

    String[] lines = formatted.split("\n", -1);
    assertThat(lines).hasLength(3);
    assertThat(lines[0])
        .isEqualTo("       0,     1,     2,     3,     4,     5,     6,     7,     8,     9,");
    assertThat(lines[1]).startsWith("      10,");
    assertThat(lines[1]).endsWith("    19,");
    assertThat(lines[2]).isEqualTo("      20,    21,    22");
  }

  @Test
  public void formatEmptyTable() {
    assertThat(IntegerTables.formatIntegerArray(ImmutableIntArray.of())).isEmpty();
  }
}
