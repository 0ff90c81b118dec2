// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

import com.github.corridor_chain.Timestamps;
import com.github.corridor_chain.mmr.MmrHashing;

import java.time.Instant;
import java.util.Objects;

/// A watcher vouching that it observed the receipt with the given `next_root`.
///
/// @param watcherId  stable identity of the watcher
/// @param nextRoot   the `next_root` the watcher saw at the contested position
/// @param attestedAt when the watcher made the observation
public record WatcherAttestation(String watcherId, String nextRoot, Instant attestedAt) {
  public WatcherAttestation {
    Objects.requireNonNull(watcherId, "watcherId");
    if (watcherId.isBlank()) {
      throw new IllegalArgumentException("watcherId must not be blank");
    }
    nextRoot = MmrHashing.normalize(nextRoot);
    attestedAt = Timestamps.truncate(Objects.requireNonNull(attestedAt, "attestedAt"));
  }
}
