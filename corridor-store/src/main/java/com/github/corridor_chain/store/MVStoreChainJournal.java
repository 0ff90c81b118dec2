// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import com.github.corridor_chain.ChainJournal;
import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.receipt.Checkpoint;
import com.github.corridor_chain.receipt.Receipt;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.github.corridor_chain.store.StoreLogger.LOGGER;

/// A [ChainJournal] in an H2 MVStore. Each corridor gets a receipt map keyed by sequence and a checkpoint map keyed
/// by height; values are canonical JSON text from [ReceiptCodec]. Genesis roots share one map keyed by corridor id.
/// [#sync()] commits the store.
public class MVStoreChainJournal implements ChainJournal {
  static final String PREFIX = "com.github.corridor_chain.store#";

  private final MVStore store;
  private final MVMap<String, String> genesis;

  public MVStoreChainJournal(MVStore store) {
    this.store = store;
    this.genesis = store.openMap(PREFIX + "genesis");
  }

  @Override
  public void writeGenesis(CorridorId corridorId, ContentDigest genesisRoot) {
    final var previous = genesis.putIfAbsent(corridorId.toString(), genesisRoot.toString());
    if (previous != null && !previous.equals(genesisRoot.toString())) {
      throw new IllegalStateException("corridor " + corridorId + " already has genesis " + previous);
    }
  }

  @Override
  public Optional<ContentDigest> readGenesis(CorridorId corridorId) {
    return Optional.ofNullable(genesis.get(corridorId.toString())).map(ContentDigest::parse);
  }

  @Override
  public void writeReceipt(Receipt receipt) {
    receipts(receipt.corridorId()).put(receipt.sequence(), ReceiptCodec.encode(receipt));
    LOGGER.finer(() -> "journaled " + receipt);
  }

  @Override
  public Optional<Receipt> readReceipt(CorridorId corridorId, long sequence) {
    return Optional.ofNullable(receipts(corridorId).get(sequence)).map(ReceiptCodec::decodeReceipt);
  }

  /// One past the highest stored sequence, so a gap shows up as a missing receipt on replay.
  @Override
  public long receiptCount(CorridorId corridorId) {
    final var map = receipts(corridorId);
    return map.isEmpty() ? 0 : map.lastKey() + 1;
  }

  /// Keyed by append order, so repeated checkpoints at one height are all kept.
  @Override
  public void writeCheckpoint(Checkpoint checkpoint) {
    final var map = checkpoints(checkpoint.corridorId());
    map.put(map.isEmpty() ? 0 : map.lastKey() + 1, ReceiptCodec.encode(checkpoint));
    LOGGER.finer(() -> "journaled " + checkpoint);
  }

  /// Records that cannot be decoded are skipped with a warning.
  @Override
  public List<Checkpoint> readCheckpoints(CorridorId corridorId) {
    final var result = new ArrayList<Checkpoint>();
    for (var entry : checkpoints(corridorId).entrySet()) {
      try {
        result.add(ReceiptCodec.decodeCheckpoint(entry.getValue()));
      } catch (CorruptRecordException e) {
        LOGGER.warning(() -> "skipping corrupt checkpoint #" + entry.getKey() + " of " + corridorId
            + ": " + e.getMessage());
      }
    }
    return result;
  }

  @Override
  public Set<CorridorId> corridors() {
    return genesis.keySet().stream().map(CorridorId::parse).collect(Collectors.toSet());
  }

  @Override
  public void sync() {
    store.commit();
  }

  MVMap<Long, String> receipts(CorridorId corridorId) {
    return store.openMap(PREFIX + "receipts:" + corridorId);
  }

  MVMap<Long, String> checkpoints(CorridorId corridorId) {
    return store.openMap(PREFIX + "checkpoints:" + corridorId);
  }
}
