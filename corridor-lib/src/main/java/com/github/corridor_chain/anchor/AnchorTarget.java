// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

/// An external ledger that can record checkpoint digests. The interface is sealed so that every target lives in
/// this package and shares its error semantics; other code uses targets through this type only.
public sealed interface AnchorTarget permits InMemoryAnchorTarget {

  /// The chain this target writes to.
  String chainId();

  /// Submits a commitment. Does not wait for finality.
  ///
  /// @throws AnchorException when the target refuses or cannot be reached
  AnchorReceipt anchor(AnchorCommitment commitment);

  /// @throws AnchorException with `UNKNOWN_TRANSACTION` for an id this target never issued
  AnchorStatus checkStatus(String transactionId);
}
