// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

/// The root of one perfect binary mountain. A peak of height `h` covers `2^h` leaves.
public record Peak(int height, String hash) {
  public Peak {
    if (height < 0) {
      throw new IllegalArgumentException("height must be non-negative");
    }
    hash = MmrHashing.normalize(hash);
  }
}
