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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import org.junit.rules.ExternalResource;

/**
 * Records everything written to {@link CodeGenLogger} while a test runs.
 */
final class LogRecorder extends ExternalResource {
  private final List<LogRecord> records = new ArrayList<>();

  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          synchronized (records) {
            records.add(record);
          }
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  @Override
  protected void before() {
    CodeGenLogger.getLogger().addHandler(handler);
  }

  @Override
  protected void after() {
    CodeGenLogger.getLogger().removeHandler(handler);
  }

  /** Gets the records published so far and forgets them. */
  List<LogRecord> pull() {
    synchronized (records) {
      List<LogRecord> pulled = new ArrayList<>(records);
      records.clear();
      return pulled;
    }
  }

  /** Gets the only record published so far. */
  LogRecord pullOnly() {
    List<LogRecord> pulled = pull();
    if (pulled.size() != 1) {
      throw new AssertionError("Expected one log record, got " + pulled.size());
    }
    return pulled.get(0);
  }
}
