// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.corridor_chain.mmr.MmrInclusionProof;
import com.github.corridor_chain.receipt.Checkpoint;
import com.github.corridor_chain.receipt.Receipt;
import com.github.corridor_chain.receipt.ReceiptChain;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;

import static com.github.corridor_chain.ChainLogger.LOGGER;

/// Owns the [ReceiptChain] of one corridor and makes it safe to share between threads:
///
/// - appends and checkpoints take the write lock so there is a single writer per corridor
/// - reads take the read lock and may run concurrently with each other
/// - every accepted receipt and checkpoint is written to the [ChainJournal] and synced before the chain changes
///
/// A receipt that fails validation is refused before anything is journaled. If the journal throws, the engine logs
/// the failure as SEVERE, marks itself crashed and rethrows. A crashed engine refuses all further writes; the
/// corridor must be reloaded from the journal.
public class ChainEngine {
  private static final String CRASHED = "ChainEngine crashed due to a journal failure: ";

  private final ReceiptChain chain;
  private final ChainJournal journal;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
  private volatile boolean crashed = false;

  /// @param chain   a chain whose state the journal already holds
  /// @param journal where accepted receipts and checkpoints are written
  public ChainEngine(ReceiptChain chain, ChainJournal journal) {
    this.chain = chain;
    this.journal = journal;
  }

  /// Starts a new corridor chain and records its genesis root in the journal.
  public static ChainEngine establish(CorridorId corridorId, ContentDigest genesisRoot, ChainJournal journal,
                                     Clock clock) {
    final var engine = new ChainEngine(new ReceiptChain(corridorId, genesisRoot, clock), journal);
    engine.journaled(() -> journal.writeGenesis(corridorId, genesisRoot));
    LOGGER.info(() -> "established corridor " + corridorId + " with genesis " + genesisRoot);
    return engine;
  }

  public CorridorId corridorId() {
    return chain.corridorId();
  }

  /// Validates, journals and appends a sealed receipt.
  ///
  /// @throws com.github.corridor_chain.receipt.ChainIntegrityException when the receipt does not extend the chain
  public void append(Receipt receipt) {
    lock.writeLock().lock();
    try {
      appendUnderLock(receipt);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /// Seals and appends the next receipt of the chain. Sequence and `prev_root` come from the current state so this
  /// cannot race with another writer.
  public Receipt appendNext(String receiptType, Instant timestamp, List<String> lawpackDigestSet,
                            List<String> rulesetDigestSet, @Nullable JsonNode transition) {
    lock.writeLock().lock();
    try {
      final var receipt = chain.nextDraft(receiptType, timestamp, lawpackDigestSet, rulesetDigestSet, transition)
          .seal();
      appendUnderLock(receipt);
      return receipt;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /// Takes, journals and records a checkpoint of the current state.
  public Checkpoint checkpoint() {
    lock.writeLock().lock();
    try {
      requireNotCrashed();
      final var checkpoint = chain.snapshotCheckpoint();
      journaled(() -> journal.writeCheckpoint(checkpoint));
      chain.recordCheckpoint(checkpoint);
      return checkpoint;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public long height() {
    return read(chain::height);
  }

  public String mmrRoot() {
    return read(chain::mmrRoot);
  }

  public ContentDigest finalStateRoot() {
    return read(chain::finalStateRoot);
  }

  public ContentDigest genesisRoot() {
    return chain.genesisRoot();
  }

  /// A snapshot copy of the receipts.
  public List<Receipt> receipts() {
    return read(() -> List.copyOf(chain.receipts()));
  }

  public List<Checkpoint> checkpoints() {
    return read(() -> List.copyOf(chain.checkpoints()));
  }

  public MmrInclusionProof buildInclusionProof(long sequence) {
    return read(() -> chain.buildInclusionProof(sequence));
  }

  public boolean verifyInclusionProof(MmrInclusionProof proof) {
    return read(() -> chain.verifyInclusionProof(proof));
  }

  public boolean isCrashed() {
    return crashed;
  }

  private void appendUnderLock(Receipt receipt) {
    requireNotCrashed();
    chain.validate(receipt);
    journaled(() -> journal.writeReceipt(receipt));
    chain.append(receipt);
  }

  private void journaled(Runnable write) {
    try {
      write.run();
      journal.sync();
    } catch (RuntimeException e) {
      crashed = true;
      LOGGER.log(Level.SEVERE, CRASHED + e, e);
      throw e;
    }
  }

  private <T> T read(Supplier<T> reader) {
    lock.readLock().lock();
    try {
      return reader.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  private void requireNotCrashed() {
    if (crashed) {
      throw new IllegalStateException("corridor " + chain.corridorId() + " has crashed and must be reloaded");
    }
  }

  @Override
  public String toString() {
    return "ChainEngine(" + read(chain::toString) + (crashed ? ",crashed" : "") + ")";
  }
}
