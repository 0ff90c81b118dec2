// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import com.github.corridor_chain.ChainEngine;
import com.github.corridor_chain.ChainJournal;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.CorridorRegistry;
import com.github.corridor_chain.receipt.Checkpoint;
import com.github.corridor_chain.receipt.ReceiptChain;

import java.time.Clock;
import java.util.Comparator;
import java.util.Optional;

import static com.github.corridor_chain.store.StoreLogger.LOGGER;

/// Rebuilds chains from a [ChainJournal] by replaying every stored receipt through [ReceiptChain#append]. Nothing in
/// the journal is trusted: each receipt is validated again and each checkpoint must match the replayed state at its
/// height.
///
/// Replay stops at the first receipt that is missing, cannot be decoded or does not extend the chain, and the chain
/// is returned at the last good height. This is logged as a WARNING because it means the store is damaged.
/// Checkpoints that do not match are skipped with a WARNING.
public class ChainLoader {
  private final ChainJournal journal;
  private final Clock clock;

  public ChainLoader(ChainJournal journal) {
    this(journal, Clock.systemUTC());
  }

  public ChainLoader(ChainJournal journal, Clock clock) {
    this.journal = journal;
    this.clock = clock;
  }

  /// @return the replayed chain or empty when the journal has no genesis record for the corridor
  public Optional<ReceiptChain> load(CorridorId corridorId) {
    final var genesis = journal.readGenesis(corridorId);
    if (genesis.isEmpty()) {
      return Optional.empty();
    }
    final var chain = new ReceiptChain(corridorId, genesis.get(), clock);
    final var checkpoints = journal.readCheckpoints(corridorId).stream()
        .sorted(Comparator.comparingLong(Checkpoint::height))
        .iterator();
    var nextCheckpoint = checkpoints.hasNext() ? checkpoints.next() : null;

    final long stored = journal.receiptCount(corridorId);
    for (long sequence = 0; sequence < stored; sequence++) {
      final long seq = sequence;
      try {
        final var receipt = journal.readReceipt(corridorId, sequence)
            .orElseThrow(() -> new CorruptRecordException("receipt #" + seq + " is missing"));
        chain.append(receipt);
      } catch (RuntimeException e) {
        LOGGER.warning(() -> "stopping replay of " + corridorId + " at receipt #" + seq + " of " + stored
            + ": " + e.getMessage());
        break;
      }
      while (nextCheckpoint != null && nextCheckpoint.height() <= chain.height()) {
        restore(chain, nextCheckpoint);
        nextCheckpoint = checkpoints.hasNext() ? checkpoints.next() : null;
      }
    }
    while (nextCheckpoint != null) {
      final var skipped = nextCheckpoint;
      LOGGER.warning(() -> "skipping " + skipped + " beyond replayed height " + chain.height());
      nextCheckpoint = checkpoints.hasNext() ? checkpoints.next() : null;
    }
    LOGGER.info(() -> "loaded " + chain + " with " + chain.checkpoints().size() + " checkpoints");
    return Optional.of(chain);
  }

  /// Loads the corridor and wraps it in an engine that writes to the same journal.
  public Optional<ChainEngine> loadEngine(CorridorId corridorId) {
    return load(corridorId).map(chain -> new ChainEngine(chain, journal));
  }

  /// Loads every corridor in the journal into the registry.
  ///
  /// @return the number of corridors loaded
  public int loadAll(CorridorRegistry registry) {
    int loaded = 0;
    for (var corridorId : journal.corridors()) {
      final var engine = loadEngine(corridorId);
      if (engine.isPresent()) {
        registry.register(engine.get());
        loaded++;
      }
    }
    return loaded;
  }

  private static void restore(ReceiptChain chain, Checkpoint checkpoint) {
    try {
      chain.recordCheckpoint(checkpoint);
    } catch (RuntimeException e) {
      LOGGER.warning(() -> "skipping stored " + checkpoint + ": " + e.getMessage());
    }
  }
}
