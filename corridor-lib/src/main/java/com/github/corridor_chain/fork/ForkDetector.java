// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static com.github.corridor_chain.ChainLogger.LOGGER;

/// Collects competing branch pairs as they are observed and resolves them in batches. Safe to use from many
/// threads. Pairs are independent of each other so draining order carries no meaning.
public class ForkDetector {

  /// Two competing observations of the same chain position.
  public record ForkPair(ForkBranch first, ForkBranch second) {
    public ForkPair {
      Objects.requireNonNull(first, "first");
      Objects.requireNonNull(second, "second");
    }
  }

  private final ForkResolver resolver;
  private final Queue<ForkPair> pending = new ConcurrentLinkedQueue<>();

  public ForkDetector(ForkResolver resolver) {
    this.resolver = resolver;
  }

  /// Queues the pair when it is a fork.
  ///
  /// @return false when both branches are the same branch and nothing was queued
  public boolean registerFork(ForkBranch first, ForkBranch second) {
    if (!resolver.isFork(first, second)) {
      LOGGER.finer(() -> "ignoring identical branches " + first.receiptDigest());
      return false;
    }
    pending.add(new ForkPair(first, second));
    return true;
  }

  public int pendingCount() {
    return pending.size();
  }

  /// Drains the queue. A pair the resolver refuses is reported as [ForkOutcome.Rejected] and does not stop the
  /// others from resolving.
  public List<ForkOutcome> resolveAll() {
    final var outcomes = new ArrayList<ForkOutcome>();
    ForkPair pair;
    while ((pair = pending.poll()) != null) {
      try {
        final var resolution = resolver.resolve(pair.first(), pair.second());
        LOGGER.info(() -> "fork resolved by " + resolution.reason() + " in favour of " + resolution.winningDigest());
        outcomes.add(new ForkOutcome.Resolved(pair, resolution));
      } catch (ForkException e) {
        final var rejected = pair;
        LOGGER.warning(() -> "fork " + rejected + " not resolvable: " + e.getMessage());
        outcomes.add(new ForkOutcome.Rejected(pair, e));
      }
    }
    return outcomes;
  }
}
