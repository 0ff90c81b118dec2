// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

/// Which rule decided a fork.
public enum ResolutionReason {
  /// The timestamps differ by more than the clock skew tolerance.
  EARLIER_TIMESTAMP,
  /// Timestamps are within tolerance and one branch has more watcher attestations.
  MORE_ATTESTATIONS,
  /// Neither rule above decided so the smaller receipt digest wins.
  LEXICOGRAPHIC_TIEBREAK
}
