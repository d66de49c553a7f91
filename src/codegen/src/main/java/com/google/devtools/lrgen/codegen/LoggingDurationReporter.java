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

import static com.google.devtools.lrgen.codegen.CodeGenLogger.infofmt;

import java.time.Duration;

/**
 * Default {@link DurationReporter} writing one log line per operation.
 */
public final class LoggingDurationReporter implements DurationReporter {
  @Override
  public void reportDuration(String operation, Duration elapsed) {
    infofmt("%s %.5f s", operation, elapsed.toNanos() / 1e9);
  }
}
