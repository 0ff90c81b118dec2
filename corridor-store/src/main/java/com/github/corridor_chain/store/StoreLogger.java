// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import java.util.logging.Logger;

/// The JUL logger of the store module.
public final class StoreLogger {
  public static final Logger LOGGER = Logger.getLogger(StoreLogger.class.getPackageName());

  private StoreLogger() {
  }
}
