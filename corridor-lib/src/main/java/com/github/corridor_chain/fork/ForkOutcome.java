// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

/// What became of one registered fork pair when the [ForkDetector] drained its queue.
public sealed interface ForkOutcome permits ForkOutcome.Resolved, ForkOutcome.Rejected {

  ForkDetector.ForkPair pair();

  record Resolved(ForkDetector.ForkPair pair, ForkResolution resolution) implements ForkOutcome {
  }

  record Rejected(ForkDetector.ForkPair pair, ForkException error) implements ForkOutcome {
  }
}
