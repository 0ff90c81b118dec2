// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

import java.util.Objects;

/// Proof of submission returned by an [AnchorTarget]. The status is as of submission; poll
/// [AnchorTarget#checkStatus(String)] for progress.
public record AnchorReceipt(AnchorCommitment commitment, String chainId, String transactionId, long blockNumber,
                            AnchorStatus status) {
  public AnchorReceipt {
    Objects.requireNonNull(commitment, "commitment");
    Objects.requireNonNull(chainId, "chainId");
    Objects.requireNonNull(transactionId, "transactionId");
    Objects.requireNonNull(status, "status");
  }
}
