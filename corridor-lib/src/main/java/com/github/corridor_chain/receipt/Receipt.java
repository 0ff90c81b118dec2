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
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A sealed receipt: a [ReceiptDraft] plus the `next_root` computed from its content. New receipts come from
/// [ReceiptDraft#seal()]. The canonical constructor exists so that receipts can be read back from a store; a
/// [ReceiptChain] recomputes the seal on append so a forged `next_root` is refused.
///
/// Receipts are immutable and are never changed after append.
public record Receipt(
    String receiptType,
    CorridorId corridorId,
    long sequence,
    Instant timestamp,
    String prevRoot,
    String nextRoot,
    List<String> lawpackDigestSet,
    List<String> rulesetDigestSet,
    @Nullable JsonNode transition
) {
  public static final String TYPE = "type";
  public static final String CORRIDOR_ID = "corridor_id";
  public static final String SEQUENCE = "sequence";
  public static final String TIMESTAMP = "timestamp";
  public static final String PREV_ROOT = "prev_root";
  public static final String NEXT_ROOT = "next_root";
  public static final String LAWPACK_DIGEST_SET = "lawpack_digest_set";
  public static final String RULESET_DIGEST_SET = "ruleset_digest_set";
  public static final String TRANSITION = "transition";

  public Receipt {
    Objects.requireNonNull(nextRoot, "nextRoot");
    final var draft = new ReceiptDraft(receiptType, corridorId, sequence, timestamp, prevRoot,
        lawpackDigestSet, rulesetDigestSet, transition);
    timestamp = draft.timestamp();
    lawpackDigestSet = draft.lawpackDigestSet();
    rulesetDigestSet = draft.rulesetDigestSet();
    transition = draft.transition();
  }

  /// The receipt without its seal.
  public ReceiptDraft draft() {
    return new ReceiptDraft(receiptType, corridorId, sequence, timestamp, prevRoot,
        lawpackDigestSet, rulesetDigestSet, transition);
  }

  /// Recomputes the seal from the content.
  public ContentDigest contentDigest() {
    return draft().contentDigest();
  }

  public boolean isSealed() {
    return contentDigest().toHex().equals(nextRoot);
  }

  /// Every field including `next_root`. This is the at-rest form of a receipt.
  public Map<String, Object> canonicalContent() {
    final var content = draft().canonicalContent();
    content.put(NEXT_ROOT, nextRoot);
    return content;
  }

  /// Digest over the whole receipt including its seal. Two observations of the same chain position that disagree
  /// on this value are a fork.
  public ContentDigest receiptDigest() {
    return Digester.digestOf(canonicalContent());
  }

  @Override
  public String toString() {
    return "Receipt(" + corridorId + "#" + sequence + "," + receiptType + "," + Timestamps.format(timestamp)
        + ",prev=" + abbreviate(prevRoot) + ",next=" + abbreviate(nextRoot) + ")";
  }

  static String abbreviate(String hex) {
    return hex.length() > 12 ? hex.substring(0, 12) : hex;
  }
}
