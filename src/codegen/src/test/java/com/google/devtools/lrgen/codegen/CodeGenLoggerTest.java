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

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CodeGenLoggerTest {
  @Rule public final LogRecorder log = new LogRecorder();

  @Test
  public void info() {
    CodeGenLogger.info("Hello");
    LogRecord record = log.pullOnly();
    assertThat(record.getLevel()).isEqualTo(Level.INFO);
    assertThat(record.getMessage()).isEqualTo("Hello");
  }

  @Test
  public void warn() {
    CodeGenLogger.warn("Hello");
    assertThat(log.pullOnly().getLevel()).isEqualTo(Level.WARNING);
  }

  @Test
  public void severe() {
    CodeGenLogger.severe("Hello");
    assertThat(log.pullOnly().getLevel()).isEqualTo(Level.SEVERE);
  }

  @Test
  public void infofmt() {
    CodeGenLogger.infofmt("%d + %s", 15, "orange");
    assertThat(log.pullOnly().getMessage()).isEqualTo("15 + orange");
  }

  @Test
  public void warnfmt() {
    CodeGenLogger.warnfmt("%d + %s", 15, "orange");
    LogRecord record = log.pullOnly();
    assertThat(record.getLevel()).isEqualTo(Level.WARNING);
    assertThat(record.getMessage()).isEqualTo("15 + orange");
  }

  @Test
  public void severefmt() {
    CodeGenLogger.severefmt("%d + %s", 15, "orange");
    LogRecord record = log.pullOnly();
    assertThat(record.getLevel()).isEqualTo(Level.SEVERE);
    assertThat(record.getMessage()).isEqualTo("15 + orange");
  }

  @Test
  public void warnfmtWithException() {
    IOException exception = new IOException();
    CodeGenLogger.warnfmt(exception, "four = %d", 4);
    LogRecord record = log.pullOnly();
    assertThat(record.getMessage()).isEqualTo("four = 4");
    assertThat(record.getThrown()).isSameInstanceAs(exception);
  }

  @Test
  public void severefmtWithException() {
    IOException exception = new IOException();
    CodeGenLogger.severefmt(exception, "five = %d", 5);
    LogRecord record = log.pullOnly();
    assertThat(record.getLevel()).isEqualTo(Level.SEVERE);
    assertThat(record.getThrown()).isSameInstanceAs(exception);
  }

  @Test
  public void nullFormatString() {
    CodeGenLogger.warnfmt(null, 15, "apple");
    assertThat(log.pullOnly().getMessage()).isEqualTo("Failed to format message: \"null\"");
  }

  @Test
  public void badFormatString() {
    CodeGenLogger.warnfmt("a = %d", "no");
    assertThat(log.pullOnly().getMessage())
        .isEqualTo("Failed to format message: \"a = %d\", args: [no]");
  }

  @Test
  public void nullException() {
    Throwable t = null;
    CodeGenLogger.severefmt(t, "a = %d", 4);
    LogRecord record = log.pullOnly();
    assertThat(record.getMessage()).isEqualTo("a = 4");
    assertThat(record.getThrown()).isNull();
  }
}
