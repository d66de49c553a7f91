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

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static class to log diagnostic messages of the code generator.
 *
 * <p>All messages go to the {@value #LOGGER_NAME} {@link Logger}, so the hosting tool decides
 * where they end up through the usual {@code java.util.logging} configuration.
 */
public final class CodeGenLogger {
  static final String LOGGER_NAME = "com.google.devtools.lrgen";

  private static final Logger logger = Logger.getLogger(LOGGER_NAME);

  private CodeGenLogger() {}

  /** Gets the underlying logger. */
  public static Logger getLogger() {
    return logger;
  }

  public static void info(String message) {
    logger.log(Level.INFO, message);
  }

  public static void warn(String message) {
    logger.log(Level.WARNING, message);
  }

  public static void severe(String message) {
    logger.log(Level.SEVERE, message);
  }

  public static void infofmt(Throwable thrown, String message, Object... args) {
    if (logger.isLoggable(Level.INFO)) {
      logger.log(Level.INFO, formatSafely(message, args), thrown);
    }
  }

  public static void warnfmt(Throwable thrown, String message, Object... args) {
    if (logger.isLoggable(Level.WARNING)) {
      logger.log(Level.WARNING, formatSafely(message, args), thrown);
    }
  }

  public static void severefmt(Throwable thrown, String message, Object... args) {
    if (logger.isLoggable(Level.SEVERE)) {
      logger.log(Level.SEVERE, formatSafely(message, args), thrown);
    }
  }

  public static void infofmt(String message, Object... args) {
    if (logger.isLoggable(Level.INFO)) {
      info(formatSafely(message, args));
    }
  }

  public static void warnfmt(String message, Object... args) {
    if (logger.isLoggable(Level.WARNING)) {
      warn(formatSafely(message, args));
    }
  }

  public static void severefmt(String message, Object... args) {
    if (logger.isLoggable(Level.SEVERE)) {
      severe(formatSafely(message, args));
    }
  }

  /**
   * Safely formats a string with {@link String#format(String, Object[])}, and guarantees not to
   * throw an exception, but instead returns a slightly different message.
   *
   * @param fmt the format string
   * @param args array of parameters for the format string
   */
  static String formatSafely(String fmt, Object... args) {
    try {
      try {
        return String.format(fmt, args);
      } catch (IllegalFormatException e) {
        return String.format(
            "Failed to format message: \"%s\", args: %s",
            fmt, (args != null) ? Arrays.toString(args) : "null");
      }
    } catch (Exception e) {
      // such as a failure during toString() on one of the arguments
      return String.format("Failed to format message: \"%s\"", fmt);
    }
  }
}
