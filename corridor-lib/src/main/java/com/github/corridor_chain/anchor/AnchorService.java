// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

import com.github.corridor_chain.receipt.Checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import static com.github.corridor_chain.ChainLogger.LOGGER;
import static com.github.corridor_chain.anchor.AnchorException.Reason.TRANSACTION_FAILED;

/// Submits checkpoints to an [AnchorTarget] off the caller's thread so a slow or unavailable ledger never holds up
/// chain appends. Status is checked by polling. A failed submission is logged and leaves nothing behind, so the
/// same checkpoint can be submitted again. A submission is remembered only until a poll reports a terminal status.
public class AnchorService {
  private final AnchorTarget target;
  private final Executor executor;
  private final Map<String, AnchorReceipt> submitted = new ConcurrentHashMap<>();

  public AnchorService(AnchorTarget target, Executor executor) {
    this.target = target;
    this.executor = executor;
  }

  /// Completes exceptionally with an [AnchorException] when the target refuses the commitment. Any other failure of
  /// the target is reported as `TRANSACTION_FAILED`.
  public CompletableFuture<AnchorReceipt> submit(Checkpoint checkpoint) {
    final var commitment = AnchorCommitment.of(checkpoint, target.chainId());
    return CompletableFuture.supplyAsync(() -> {
      try {
        return target.anchor(commitment);
      } catch (AnchorException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new AnchorException(TRANSACTION_FAILED, "anchoring " + checkpoint + " failed", e);
      }
    }, executor).whenComplete((receipt, error) -> {
      if (error != null) {
        LOGGER.warning(() -> "anchoring " + checkpoint + " to " + target.chainId() + " failed: " + error.getMessage());
      } else {
        submitted.put(receipt.transactionId(), receipt);
        LOGGER.info(() -> "anchored " + checkpoint + " as " + receipt.transactionId());
      }
    });
  }

  public AnchorStatus checkStatus(String transactionId) {
    final var status = target.checkStatus(transactionId);
    if (status.isTerminal() && submitted.remove(transactionId) != null) {
      LOGGER.fine(() -> transactionId + " is " + status);
    }
    return status;
  }

  /// @return the receipt of a submission whose status has not yet been seen to be terminal
  public Optional<AnchorReceipt> submitted(String transactionId) {
    return Optional.ofNullable(submitted.get(transactionId));
  }
}
