// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.receipt;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.Digester;
import com.github.corridor_chain.Timestamps;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.github.corridor_chain.receipt.Receipt.*;

/// A receipt that has not been sealed yet. It has every field except `next_root` and cannot be appended to a chain;
/// [#seal()] is the only way to get a [Receipt].
///
/// The digest sets are content identifiers supplied by policy collaborators. They are kept in the order given and
/// are never re-sorted, so their order is part of the receipt content.
///
/// @param receiptType       free-form tag for the kind of event
/// @param corridorId        the corridor whose chain this receipt extends
/// @param sequence          zero based position in the chain
/// @param timestamp         UTC, truncated to whole seconds on construction
/// @param prevRoot          hex of the chain's final-state root at the time of append
/// @param lawpackDigestSet  ordered law digests
/// @param rulesetDigestSet  ordered rule digests
/// @param transition        optional opaque payload describing the state transition
public record ReceiptDraft(
    String receiptType,
    CorridorId corridorId,
    long sequence,
    Instant timestamp,
    String prevRoot,
    List<String> lawpackDigestSet,
    List<String> rulesetDigestSet,
    @Nullable JsonNode transition
) {
  public ReceiptDraft {
    Objects.requireNonNull(receiptType, "receiptType");
    Objects.requireNonNull(corridorId, "corridorId");
    Objects.requireNonNull(prevRoot, "prevRoot");
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be non-negative but was " + sequence);
    }
    timestamp = Timestamps.truncate(Objects.requireNonNull(timestamp, "timestamp"));
    lawpackDigestSet = List.copyOf(lawpackDigestSet);
    rulesetDigestSet = List.copyOf(rulesetDigestSet);
    transition = transition == null ? null : transition.deepCopy();
  }

  /// The fields that `next_root` commits to. `prev_root` is among them so the seal binds the receipt to its
  /// predecessor.
  public Map<String, Object> canonicalContent() {
    final var content = new LinkedHashMap<String, Object>();
    content.put(TYPE, receiptType);
    content.put(CORRIDOR_ID, corridorId.toString());
    content.put(SEQUENCE, sequence);
    content.put(TIMESTAMP, Timestamps.format(timestamp));
    content.put(PREV_ROOT, prevRoot);
    content.put(LAWPACK_DIGEST_SET, lawpackDigestSet);
    content.put(RULESET_DIGEST_SET, rulesetDigestSet);
    if (transition != null) {
      content.put(TRANSITION, transition);
    }
    return content;
  }

  /// Digest of [#canonicalContent()]. Its hex form is the sealed `next_root` and the MMR leaf of this receipt.
  public ContentDigest contentDigest() {
    return Digester.digestOf(canonicalContent());
  }

  public Receipt seal() {
    return new Receipt(receiptType, corridorId, sequence, timestamp, prevRoot, contentDigest().toHex(),
        lawpackDigestSet, rulesetDigestSet, transition);
  }
}
