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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Row of the token-kind or symbol-kind table: {@code NAME = ID} with an optional display name.
 */
public final class KindEntry {
  private final String name;
  private final int id;
  private final String displayName;

  public KindEntry(String name, int id, String displayName) {
    this.name = checkNotNull(name);
    this.id = id;
    this.displayName = displayName;
  }

  /** Creates an entry rendered without a trailing comment. */
  public static KindEntry of(String name, int id) {
    return new KindEntry(name, id, null);
  }

  public String getName() {
    return name;
  }

  public int getId() {
    return id;
  }

  /** Gets the display name or null if the entry has none. */
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return name + " = " + id;
  }
}
