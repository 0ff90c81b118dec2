// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.corridor_chain.ChainLogger.LOGGER;
import static com.github.corridor_chain.anchor.AnchorException.Reason.*;

/// A simulated ledger. Each submission is mined into the next block number. Every status poll adds one
/// confirmation; a transaction is `CONFIRMED` once it has any and `FINALIZED` once it has the configured number.
/// Outages and failed transactions can be switched on to exercise callers.
public final class InMemoryAnchorTarget implements AnchorTarget {

  private static final class Transaction {
    int confirmations;
    boolean failed;
  }

  private final String chainId;
  private final int confirmationsToFinality;
  private final AtomicLong nextBlock = new AtomicLong(1);
  private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();
  private volatile boolean available = true;

  public InMemoryAnchorTarget(String chainId, int confirmationsToFinality) {
    if (confirmationsToFinality < 1) {
      throw new IllegalArgumentException("confirmationsToFinality must be at least 1 but was " + confirmationsToFinality);
    }
    this.chainId = chainId;
    this.confirmationsToFinality = confirmationsToFinality;
  }

  public InMemoryAnchorTarget(String chainId) {
    this(chainId, 1);
  }

  @Override
  public String chainId() {
    return chainId;
  }

  /// While unavailable every call fails with `CHAIN_UNAVAILABLE`.
  public void setAvailable(boolean available) {
    this.available = available;
  }

  /// Marks a submitted transaction as reverted so polling reports `FAILED`.
  public void fail(String transactionId) {
    final var tx = transaction(transactionId);
    synchronized (tx) {
      tx.failed = true;
    }
  }

  @Override
  public AnchorReceipt anchor(AnchorCommitment commitment) {
    requireAvailable();
    if (commitment.chainId() != null && !commitment.chainId().equals(chainId)) {
      throw new AnchorException(REJECTED, "commitment for chain " + commitment.chainId() + " sent to " + chainId);
    }
    final long block = nextBlock.getAndIncrement();
    final var transactionId = "mem-tx-" + commitment.checkpointDigest().toHex().substring(0, 16) + "-" + block;
    transactions.put(transactionId, new Transaction());
    LOGGER.fine(() -> chainId + " anchored " + commitment.checkpointDigest() + " at height "
        + commitment.checkpointHeight() + " in block " + block);
    return new AnchorReceipt(commitment, chainId, transactionId, block, AnchorStatus.PENDING);
  }

  @Override
  public AnchorStatus checkStatus(String transactionId) {
    requireAvailable();
    final var tx = transaction(transactionId);
    synchronized (tx) {
      if (tx.failed) {
        return AnchorStatus.FAILED;
      }
      if (tx.confirmations < confirmationsToFinality) {
        tx.confirmations++;
      }
      return tx.confirmations >= confirmationsToFinality ? AnchorStatus.FINALIZED : AnchorStatus.CONFIRMED;
    }
  }

  private Transaction transaction(String transactionId) {
    final var tx = transactions.get(transactionId);
    if (tx == null) {
      throw new AnchorException(UNKNOWN_TRANSACTION, "no transaction " + transactionId + " on " + chainId);
    }
    return tx;
  }

  private void requireAvailable() {
    if (!available) {
      throw new AnchorException(CHAIN_UNAVAILABLE, chainId + " is unavailable");
    }
  }
}
