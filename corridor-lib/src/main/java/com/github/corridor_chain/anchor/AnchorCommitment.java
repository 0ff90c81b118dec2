// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.receipt.Checkpoint;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// What gets written to an external ledger: a checkpoint digest and the height it covers.
///
/// @param checkpointDigest digest of the checkpoint
/// @param chainId          the external chain to use, or null for the target's own
/// @param checkpointHeight number of receipts the checkpoint covers
public record AnchorCommitment(ContentDigest checkpointDigest, @Nullable String chainId, long checkpointHeight) {
  public AnchorCommitment {
    Objects.requireNonNull(checkpointDigest, "checkpointDigest");
    if (checkpointHeight < 0) {
      throw new IllegalArgumentException("checkpointHeight must be non-negative but was " + checkpointHeight);
    }
  }

  public static AnchorCommitment of(Checkpoint checkpoint) {
    return new AnchorCommitment(checkpoint.digest(), null, checkpoint.height());
  }

  public static AnchorCommitment of(Checkpoint checkpoint, String chainId) {
    return new AnchorCommitment(checkpoint.digest(), chainId, checkpoint.height());
  }
}
