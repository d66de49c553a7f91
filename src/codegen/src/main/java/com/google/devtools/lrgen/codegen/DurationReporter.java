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

import java.time.Duration;

/**
 * Receives the time spent in code generation steps.
 */
public interface DurationReporter {
  /**
   * Called once per completed operation.
   *
   * @param operation name of the operation (e.g. "render")
   * @param elapsed wall time spent in the operation
   */
  void reportDuration(String operation, Duration elapsed);
}
