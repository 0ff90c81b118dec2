// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.util.Optional;
import java.util.logging.*;

/// Console logging for processes that embed the chain. The level comes from the `LOG_LEVEL` environment variable
/// and defaults to `INFO`. Call [#initialize()] once at startup.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      // Remove existing handlers
      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("INFO");
      Level level = Level.parse(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          return String.format("[%s] %s%n",
              record.getLevel().getName(),
              formatMessage(record));
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  public static void initialize() {
    // Method to trigger static initialization which will configure the logger
  }
}
