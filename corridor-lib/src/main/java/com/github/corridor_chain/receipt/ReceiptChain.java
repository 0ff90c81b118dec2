// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.receipt;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.mmr.MerkleMountainRange;
import com.github.corridor_chain.mmr.MmrInclusionProof;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.github.corridor_chain.ChainLogger.LOGGER;
import static com.github.corridor_chain.receipt.ChainIntegrityException.Reason.*;

/// The append-only receipt history of one corridor, committed to by a [MerkleMountainRange].
///
/// Invariants:
///
/// - `height() == receipts().size() == mmr size`
/// - the MMR leaf at position `i` is the `next_root` (the content digest) of receipt `i`
/// - the final-state root is the genesis root until the first append and then the `next_root` of the last receipt
/// - append is all or nothing: every check runs before anything is modified
///
/// Not thread safe. A chain must have a single writer; [com.github.corridor_chain.ChainEngine] provides that along
/// with concurrent readers.
public class ReceiptChain {
  private final CorridorId corridorId;
  private final ContentDigest genesisRoot;
  private final Clock clock;
  private final List<Receipt> receipts = new ArrayList<>();
  private final MerkleMountainRange mmr = new MerkleMountainRange();
  private final List<Checkpoint> checkpoints = new ArrayList<>();
  private ContentDigest finalStateRoot;

  public ReceiptChain(CorridorId corridorId, ContentDigest genesisRoot) {
    this(corridorId, genesisRoot, Clock.systemUTC());
  }

  /// @param clock used only to stamp checkpoints with their creation time
  public ReceiptChain(CorridorId corridorId, ContentDigest genesisRoot, Clock clock) {
    this.corridorId = corridorId;
    this.genesisRoot = genesisRoot;
    this.finalStateRoot = genesisRoot;
    this.clock = clock;
  }

  public CorridorId corridorId() {
    return corridorId;
  }

  public ContentDigest genesisRoot() {
    return genesisRoot;
  }

  public ContentDigest finalStateRoot() {
    return finalStateRoot;
  }

  public String finalStateRootHex() {
    return finalStateRoot.toHex();
  }

  public long height() {
    return receipts.size();
  }

  /// The MMR root, or the empty string for an empty chain.
  public String mmrRoot() {
    return mmr.root();
  }

  public List<Receipt> receipts() {
    return Collections.unmodifiableList(receipts);
  }

  public List<Checkpoint> checkpoints() {
    return Collections.unmodifiableList(checkpoints);
  }

  /// A draft that is correctly sequenced and linked to the current state. Seal it and pass it to [#append].
  public ReceiptDraft nextDraft(String receiptType, Instant timestamp, List<String> lawpackDigestSet,
                                List<String> rulesetDigestSet, @Nullable JsonNode transition) {
    return new ReceiptDraft(receiptType, corridorId, height(), timestamp, finalStateRootHex(),
        lawpackDigestSet, rulesetDigestSet, transition);
  }

  /// Runs every append check without modifying the chain, in this order: sequence, predecessor root, seal, corridor.
  ///
  /// @return the recomputed content digest of the receipt
  /// @throws ChainIntegrityException on the first failed check
  public ContentDigest validate(Receipt receipt) {
    final long expectedSequence = height();
    if (receipt.sequence() != expectedSequence) {
      throw new ChainIntegrityException(SEQUENCE_MISMATCH, "sequence mismatch: expected " + expectedSequence
          + " but got " + receipt.sequence() + " for corridor " + corridorId);
    }
    final var expectedPrev = finalStateRootHex();
    if (!expectedPrev.equals(receipt.prevRoot())) {
      throw new ChainIntegrityException(PREV_ROOT_MISMATCH, "prev_root mismatch for receipt #" + receipt.sequence()
          + ": expected " + expectedPrev + " but got " + receipt.prevRoot());
    }
    final var recomputed = receipt.contentDigest();
    if (!recomputed.toHex().equals(receipt.nextRoot())) {
      throw new ChainIntegrityException(NEXT_ROOT_MISMATCH, "next_root mismatch for receipt #" + receipt.sequence()
          + ": expected " + recomputed.toHex() + " but got " + receipt.nextRoot());
    }
    if (!corridorId.equals(receipt.corridorId())) {
      throw new ChainIntegrityException(CORRIDOR_MISMATCH, "receipt #" + receipt.sequence() + " belongs to corridor "
          + receipt.corridorId() + " not " + corridorId);
    }
    return recomputed;
  }

  /// Validates the receipt and, only if every check passes, appends its content digest as the next MMR leaf and
  /// advances the final-state root.
  public void append(Receipt receipt) {
    final var recomputed = validate(receipt);
    mmr.append(receipt.nextRoot());
    finalStateRoot = recomputed;
    receipts.add(receipt);
    LOGGER.fine(() -> corridorId + " appended receipt #" + receipt.sequence() + " next_root=" + receipt.nextRoot());
  }

  /// Captures `(height, mmr root)` without recording it. See [#recordCheckpoint].
  public Checkpoint snapshotCheckpoint() {
    if (receipts.isEmpty()) {
      throw new ChainIntegrityException(EMPTY_CHAIN, "cannot checkpoint empty chain " + corridorId);
    }
    return Checkpoint.of(corridorId, height(), mmrRoot(), mmr.peaks(), genesisRoot, finalStateRoot, clock.instant());
  }

  /// Adds a checkpoint to the history after checking it describes the current state exactly.
  public void recordCheckpoint(Checkpoint checkpoint) {
    if (!corridorId.equals(checkpoint.corridorId())) {
      throw new ChainIntegrityException(CORRIDOR_MISMATCH, "checkpoint belongs to corridor "
          + checkpoint.corridorId() + " not " + corridorId);
    }
    if (checkpoint.height() != height()
        || !checkpoint.mmrRoot().equals(mmrRoot())
        || !checkpoint.genesisRoot().equals(genesisRoot)
        || !checkpoint.finalStateRoot().equals(finalStateRoot)
        || !checkpoint.peaks().equals(mmr.peaks())
        || !checkpoint.verifyDigest()) {
      throw new ChainIntegrityException(CHECKPOINT_MISMATCH, checkpoint + " does not match " + corridorId
          + " at height " + height() + " root " + mmrRoot());
    }
    checkpoints.add(checkpoint);
    LOGGER.info(() -> "recorded " + checkpoint);
  }

  /// Snapshots the current state and appends it to the checkpoint history, which is never pruned.
  public Checkpoint createCheckpoint() {
    final var checkpoint = snapshotCheckpoint();
    recordCheckpoint(checkpoint);
    return checkpoint;
  }

  /// @param sequence the receipt whose inclusion is to be proven
  public MmrInclusionProof buildInclusionProof(long sequence) {
    if (receipts.isEmpty()) {
      throw new ChainIntegrityException(EMPTY_CHAIN, "cannot prove inclusion in empty chain " + corridorId);
    }
    return mmr.buildInclusionProof(sequence);
  }

  /// @return true when the proof is valid and commits to this chain's current root
  public boolean verifyInclusionProof(MmrInclusionProof proof) {
    return mmr.verifyInclusionProof(proof);
  }

  /// Checks a proof without a chain, e.g. one received alongside a checkpoint. The caller must compare
  /// `proof.root()` with a root it trusts.
  public static boolean verifyReceiptProof(MmrInclusionProof proof) {
    return proof.verify();
  }

  @Override
  public String toString() {
    return "ReceiptChain(" + corridorId + ",height=" + height() + ",root=" + mmrRoot() + ")";
  }
}
