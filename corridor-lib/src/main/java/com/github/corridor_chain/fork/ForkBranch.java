// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.Timestamps;
import com.github.corridor_chain.mmr.MmrHashing;
import com.github.corridor_chain.receipt.Receipt;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/// One observation of what happened at a contested chain position.
///
/// Two branches are the same branch when their receipt digests are equal, whatever their other fields say.
///
/// @param receiptDigest    digest of the whole receipt, see [Receipt#receiptDigest()]
/// @param timestamp        the receipt timestamp, whole seconds
/// @param attestationCount number of distinct watchers vouching for the branch
/// @param nextRoot         the `next_root` the branch claims
public record ForkBranch(ContentDigest receiptDigest, Instant timestamp, int attestationCount, String nextRoot) {
  public ForkBranch {
    Objects.requireNonNull(receiptDigest, "receiptDigest");
    timestamp = Timestamps.truncate(Objects.requireNonNull(timestamp, "timestamp"));
    if (attestationCount < 0) {
      throw new IllegalArgumentException("attestationCount must be non-negative but was " + attestationCount);
    }
    nextRoot = MmrHashing.normalize(nextRoot);
  }

  public static ForkBranch of(Receipt receipt, int attestationCount) {
    return new ForkBranch(receipt.receiptDigest(), receipt.timestamp(), attestationCount, receipt.nextRoot());
  }

  /// Counts each watcher at most once and ignores attestations for any other `next_root`.
  public static ForkBranch fromAttestations(Receipt receipt, Collection<WatcherAttestation> attestations) {
    final var watchers = attestations.stream()
        .filter(a -> a.nextRoot().equals(receipt.nextRoot()))
        .map(WatcherAttestation::watcherId)
        .collect(Collectors.toSet());
    return of(receipt, watchers.size());
  }

  @Override
  public String toString() {
    return "ForkBranch(" + receiptDigest + "," + Timestamps.format(timestamp) + ",attestations=" + attestationCount + ")";
  }
}
