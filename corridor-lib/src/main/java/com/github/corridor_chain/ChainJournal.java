// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import com.github.corridor_chain.receipt.Checkpoint;
import com.github.corridor_chain.receipt.Receipt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Durable storage for corridor chains. The [ChainEngine] writes every receipt and checkpoint here before it changes
/// the in-memory chain and then calls [#sync()]. A chain is rebuilt after a restart by reading the genesis root and
/// replaying the receipts in sequence order.
///
/// Writes must be crash durable once [#sync()] returns. If a write or sync throws, the state of the journal is
/// unknown: the engine marks itself crashed and the chain has to be reloaded from the journal.
///
/// Receipts are never deleted or rewritten. The journal holds plain data only and does not validate it; validation
/// happens again on reload.
public interface ChainJournal {

  /// Records the root a corridor chain starts from. Called once per corridor.
  void writeGenesis(CorridorId corridorId, ContentDigest genesisRoot);

  Optional<ContentDigest> readGenesis(CorridorId corridorId);

  /// Stores an accepted receipt under its corridor and sequence.
  void writeReceipt(Receipt receipt);

  /// @return the receipt at `sequence` or empty if none was written
  Optional<Receipt> readReceipt(CorridorId corridorId, long sequence);

  /// Number of receipts stored for the corridor. Sequences `0 .. count-1` are expected to be present.
  long receiptCount(CorridorId corridorId);

  void writeCheckpoint(Checkpoint checkpoint);

  /// @return every checkpoint of the corridor in height order
  List<Checkpoint> readCheckpoints(CorridorId corridorId);

  /// Every corridor that has a genesis record.
  Set<CorridorId> corridors();

  /// Make everything written so far crash durable.
  void sync();
}
