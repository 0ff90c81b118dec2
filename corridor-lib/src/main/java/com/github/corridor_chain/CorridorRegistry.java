// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.github.corridor_chain.ChainLogger.LOGGER;

/// One [ChainEngine] per corridor, all sharing a journal. Corridors are independent so writers to different
/// corridors never contend.
public class CorridorRegistry {
  private final ChainJournal journal;
  private final Clock clock;
  private final ConcurrentMap<CorridorId, ChainEngine> engines = new ConcurrentHashMap<>();

  public CorridorRegistry(ChainJournal journal) {
    this(journal, Clock.systemUTC());
  }

  public CorridorRegistry(ChainJournal journal, Clock clock) {
    this.journal = journal;
    this.clock = clock;
  }

  /// Starts a new corridor.
  ///
  /// @throws IllegalStateException if the corridor is already registered
  public ChainEngine establish(CorridorId corridorId, ContentDigest genesisRoot) {
    final var created = new boolean[1];
    final var engine = engines.computeIfAbsent(corridorId, id -> {
      created[0] = true;
      return ChainEngine.establish(id, genesisRoot, journal, clock);
    });
    if (!created[0]) {
      throw new IllegalStateException("corridor " + corridorId + " is already established");
    }
    return engine;
  }

  /// Returns the engine of the corridor, establishing it with `genesisRoot` if there is none.
  public ChainEngine open(CorridorId corridorId, ContentDigest genesisRoot) {
    return engines.computeIfAbsent(corridorId, id -> ChainEngine.establish(id, genesisRoot, journal, clock));
  }

  /// Adds an engine rebuilt from the journal.
  ///
  /// @throws IllegalStateException if the corridor is already registered
  public void register(ChainEngine engine) {
    final var existing = engines.putIfAbsent(engine.corridorId(), engine);
    if (existing != null) {
      throw new IllegalStateException("corridor " + engine.corridorId() + " is already registered");
    }
    LOGGER.info(() -> "registered " + engine);
  }

  public Optional<ChainEngine> engine(CorridorId corridorId) {
    return Optional.ofNullable(engines.get(corridorId));
  }

  public Set<CorridorId> corridors() {
    return Set.copyOf(engines.keySet());
  }
}
