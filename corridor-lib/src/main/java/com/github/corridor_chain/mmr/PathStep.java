// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

/// One sibling on the way from a leaf up to its peak. `side` says where the sibling sits relative to the running hash.
public record PathStep(Side side, String hash) {
  public enum Side {LEFT, RIGHT}

  public PathStep {
    java.util.Objects.requireNonNull(side, "side");
    hash = MmrHashing.normalize(hash);
  }

  String apply(String current) {
    return side == Side.LEFT ? MmrHashing.nodeHash(hash, current) : MmrHashing.nodeHash(current, hash);
  }
}
