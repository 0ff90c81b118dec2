// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.util.logging.Logger;

/// The single JUL logger shared by the chain core. Configure it through the root logger or [LoggerConfig].
public final class ChainLogger {
  public static final Logger LOGGER = Logger.getLogger(ChainLogger.class.getPackageName());

  private ChainLogger() {
  }
}
