// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import org.h2.mvstore.MVStore;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/// Where and how the journal is stored.
///
/// @param fileName   the MVStore file, or null for a store that lives only in memory
/// @param autoCommit when false only [MVStoreChainJournal#sync()] commits, which is what the engine expects
public record StoreConfig(@Nullable String fileName, boolean autoCommit) {
  public static final String FILE_PROPERTY = "corridor.store.file";
  public static final String AUTOCOMMIT_PROPERTY = "corridor.store.autocommit";
  public static final String FILE_ENV = "CORRIDOR_STORE_FILE";

  public static StoreConfig inMemory() {
    return new StoreConfig(null, false);
  }

  /// Reads the system properties, falling back to the `CORRIDOR_STORE_FILE` environment variable for the file name.
  /// Autocommit defaults to off.
  public static StoreConfig fromEnvironment() {
    final var fileName = Optional.ofNullable(System.getProperty(FILE_PROPERTY))
        .or(() -> Optional.ofNullable(System.getenv(FILE_ENV)))
        .filter(s -> !s.isBlank())
        .orElse(null);
    final var autoCommit = Boolean.parseBoolean(System.getProperty(AUTOCOMMIT_PROPERTY, "false"));
    return new StoreConfig(fileName, autoCommit);
  }

  public MVStore open() {
    final var builder = new MVStore.Builder();
    if (fileName != null) {
      builder.fileName(fileName);
    }
    if (!autoCommit) {
      builder.autoCommitDisabled();
    }
    return builder.open();
  }
}
