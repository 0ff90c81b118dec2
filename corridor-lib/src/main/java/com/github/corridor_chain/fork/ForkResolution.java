// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

import com.github.corridor_chain.ContentDigest;

import java.util.Objects;

/// The outcome of comparing two branches. Discarding the losing branch is up to the caller.
public record ForkResolution(ForkBranch winningBranch, ForkBranch losingBranch, ResolutionReason reason) {
  public ForkResolution {
    Objects.requireNonNull(winningBranch, "winningBranch");
    Objects.requireNonNull(losingBranch, "losingBranch");
    Objects.requireNonNull(reason, "reason");
  }

  public ContentDigest winningDigest() {
    return winningBranch.receiptDigest();
  }

  public ContentDigest losingDigest() {
    return losingBranch.receiptDigest();
  }
}
