// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

import java.time.Clock;
import java.time.Duration;

import static com.github.corridor_chain.ChainLogger.LOGGER;
import static com.github.corridor_chain.fork.ForkException.Reason.FUTURE_TIMESTAMP;
import static com.github.corridor_chain.fork.ForkException.Reason.NOT_A_FORK;

/// Picks the canonical branch of a fork. Every node that evaluates the same pair picks the same winner for the same
/// reason, so honest participants converge without a coordinator. The rules apply in strict order:
///
/// 1. If the timestamps differ by more than [#MAX_CLOCK_SKEW] the earlier branch wins.
/// 2. Otherwise the branch with more attestations wins.
/// 3. Otherwise the branch with the smaller receipt digest, compared as unsigned bytes, wins.
///
/// A gap of exactly [#MAX_CLOCK_SKEW] counts as within tolerance. The result does not depend on argument order.
/// The only state is the clock used to refuse branches dated more than [#MAX_FUTURE_DRIFT] into the future, which
/// would otherwise always win rule 1 against an honest branch.
public class ForkResolver {
  public static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);
  public static final Duration MAX_FUTURE_DRIFT = Duration.ofSeconds(60);

  private final Clock clock;

  public ForkResolver() {
    this(Clock.systemUTC());
  }

  public ForkResolver(Clock clock) {
    this.clock = clock;
  }

  /// @return true when the branches have different receipt digests
  public boolean isFork(ForkBranch a, ForkBranch b) {
    return !a.receiptDigest().equals(b.receiptDigest());
  }

  /// @throws ForkException with `NOT_A_FORK` for the same branch twice or `FUTURE_TIMESTAMP` when a branch is dated
  ///                      too far ahead of this resolver's clock
  public ForkResolution resolve(ForkBranch a, ForkBranch b) {
    if (!isFork(a, b)) {
      throw new ForkException(NOT_A_FORK, "not a fork: both branches have digest " + a.receiptDigest());
    }
    final var latestAcceptable = clock.instant().plus(MAX_FUTURE_DRIFT);
    for (var branch : new ForkBranch[]{a, b}) {
      if (branch.timestamp().isAfter(latestAcceptable)) {
        throw new ForkException(FUTURE_TIMESTAMP, branch + " is dated after " + latestAcceptable);
      }
    }

    final ForkResolution resolution;
    final var gap = Duration.between(a.timestamp(), b.timestamp()).abs();
    if (gap.compareTo(MAX_CLOCK_SKEW) > 0) {
      resolution = a.timestamp().isBefore(b.timestamp())
          ? new ForkResolution(a, b, ResolutionReason.EARLIER_TIMESTAMP)
          : new ForkResolution(b, a, ResolutionReason.EARLIER_TIMESTAMP);
    } else if (a.attestationCount() != b.attestationCount()) {
      resolution = a.attestationCount() > b.attestationCount()
          ? new ForkResolution(a, b, ResolutionReason.MORE_ATTESTATIONS)
          : new ForkResolution(b, a, ResolutionReason.MORE_ATTESTATIONS);
    } else {
      resolution = a.receiptDigest().compareTo(b.receiptDigest()) < 0
          ? new ForkResolution(a, b, ResolutionReason.LEXICOGRAPHIC_TIEBREAK)
          : new ForkResolution(b, a, ResolutionReason.LEXICOGRAPHIC_TIEBREAK);
    }
    LOGGER.fine(() -> "fork resolved " + resolution.reason() + " winner=" + resolution.winningDigest()
        + " loser=" + resolution.losingDigest());
    return resolution;
  }
}
