// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import com.github.corridor_chain.ChainJournal;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.LoggerConfig;

import java.util.List;

/// Replays every corridor in a store file and prints one line per corridor. Damage found during replay is logged
/// as a warning and shows up as a replayed height below the stored receipt count.
///
/// Usage: `StoreInspector [store-file]`. Without an argument the file comes from [StoreConfig#fromEnvironment()].
public class StoreInspector {

  public record CorridorSummary(CorridorId corridorId, long storedReceipts, long height, String mmrRoot,
                                String finalStateRoot, int checkpoints) {
    public boolean damaged() {
      return height != storedReceipts;
    }

    @Override
    public String toString() {
      return corridorId + " height=" + height + "/" + storedReceipts + " root=" + mmrRoot
          + " final=" + finalStateRoot + " checkpoints=" + checkpoints + (damaged() ? " DAMAGED" : "");
    }
  }

  public static List<CorridorSummary> inspect(ChainJournal journal) {
    final var loader = new ChainLoader(journal);
    return journal.corridors().stream()
        .sorted()
        .flatMap(id -> loader.load(id).stream())
        .map(chain -> new CorridorSummary(chain.corridorId(), journal.receiptCount(chain.corridorId()),
            chain.height(), chain.mmrRoot(), chain.finalStateRootHex(), chain.checkpoints().size()))
        .toList();
  }

  public static void main(String[] args) {
    LoggerConfig.initialize();
    final var config = args.length > 0 ? new StoreConfig(args[0], false) : StoreConfig.fromEnvironment();
    if (config.fileName() == null) {
      System.err.println("usage: StoreInspector <store-file> (or set " + StoreConfig.FILE_ENV + ")");
      System.exit(1);
    }
    final boolean damaged;
    try (var store = config.open()) {
      final var summaries = inspect(new MVStoreChainJournal(store));
      summaries.forEach(System.out::println);
      damaged = summaries.stream().anyMatch(CorridorSummary::damaged);
    }
    if (damaged) {
      System.exit(2);
    }
  }
}
