// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.receipt;

import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.Digester;
import com.github.corridor_chain.DigestAlgorithm;
import com.github.corridor_chain.Timestamps;
import com.github.corridor_chain.mmr.Peak;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// An immutable snapshot of a chain's height and MMR root. The checkpoint digest is computed through the
/// canonicalizer like every other record. Height is part of the digested content so checkpoints at different
/// heights always differ. `createdAt` is informational and is not digested, which lets independent nodes that
/// checkpoint the same chain state agree on the digest.
///
/// @param corridorId     the corridor of the chain
/// @param height         number of receipts covered
/// @param mmrRoot        the MMR root at `height`
/// @param peaks          the MMR peaks at `height` so later roots can be computed from the checkpoint alone
/// @param genesisRoot    the chain's genesis root
/// @param finalStateRoot the `next_root` of the last receipt covered
/// @param digest         digest of [#canonicalContent]
/// @param createdAt      when the snapshot was taken
public record Checkpoint(
    CorridorId corridorId,
    long height,
    String mmrRoot,
    List<Peak> peaks,
    ContentDigest genesisRoot,
    ContentDigest finalStateRoot,
    ContentDigest digest,
    Instant createdAt
) {
  public static final String CHECKPOINT_TYPE = "CorridorStateCheckpoint";
  public static final String MMR_TYPE = "CorridorReceiptMMR";

  public Checkpoint {
    Objects.requireNonNull(corridorId, "corridorId");
    Objects.requireNonNull(mmrRoot, "mmrRoot");
    Objects.requireNonNull(genesisRoot, "genesisRoot");
    Objects.requireNonNull(finalStateRoot, "finalStateRoot");
    Objects.requireNonNull(digest, "digest");
    if (height < 0) {
      throw new IllegalArgumentException("height must be non-negative but was " + height);
    }
    peaks = List.copyOf(peaks);
    createdAt = Timestamps.truncate(Objects.requireNonNull(createdAt, "createdAt"));
  }

  /// Builds a checkpoint and computes its digest.
  public static Checkpoint of(CorridorId corridorId, long height, String mmrRoot, List<Peak> peaks,
                              ContentDigest genesisRoot, ContentDigest finalStateRoot, Instant createdAt) {
    final var digest = Digester.digestOf(canonicalContent(corridorId, height, mmrRoot, genesisRoot, finalStateRoot));
    return new Checkpoint(corridorId, height, mmrRoot, peaks, genesisRoot, finalStateRoot, digest, createdAt);
  }

  public Map<String, Object> canonicalContent() {
    return canonicalContent(corridorId, height, mmrRoot, genesisRoot, finalStateRoot);
  }

  /// @return true when `digest` matches the content
  public boolean verifyDigest() {
    return Digester.digestOf(canonicalContent()).equals(digest);
  }

  static Map<String, Object> canonicalContent(CorridorId corridorId, long height, String mmrRoot,
                                              ContentDigest genesisRoot, ContentDigest finalStateRoot) {
    final var mmr = new LinkedHashMap<String, Object>();
    mmr.put("type", MMR_TYPE);
    mmr.put("algorithm", DigestAlgorithm.SHA256.tag());
    mmr.put("size", height);
    mmr.put("root", mmrRoot);

    final var content = new LinkedHashMap<String, Object>();
    content.put("type", CHECKPOINT_TYPE);
    content.put("corridor_id", corridorId.toString());
    content.put("genesis_root", genesisRoot.toHex());
    content.put("final_state_root", finalStateRoot.toHex());
    content.put("receipt_count", height);
    content.put("mmr", mmr);
    return content;
  }

  @Override
  public String toString() {
    return "Checkpoint(" + corridorId + "@" + height + ",root=" + Receipt.abbreviate(mmrRoot) + ",digest=" + digest + ")";
  }
}
