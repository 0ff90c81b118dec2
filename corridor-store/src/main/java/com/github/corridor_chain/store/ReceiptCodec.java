// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.corridor_chain.Canonicalizer;
import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.Timestamps;
import com.github.corridor_chain.mmr.Peak;
import com.github.corridor_chain.receipt.Checkpoint;
import com.github.corridor_chain.receipt.Receipt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.corridor_chain.receipt.Receipt.*;

/// Converts receipts and checkpoints to and from the canonical JSON text that is stored. Storing the canonical
/// form means a stored receipt re-digests to exactly the value that was sealed.
public final class ReceiptCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String PEAKS = "peaks";
  static final String DIGEST = "digest";
  static final String CREATED_AT = "created_at";
  static final String HEIGHT = "height";
  static final String HASH = "hash";

  private ReceiptCodec() {
  }

  public static String encode(Receipt receipt) {
    return Canonicalizer.canonicalize(receipt.canonicalContent()).asUtf8();
  }

  /// @throws CorruptRecordException when the text is not a receipt
  public static Receipt decodeReceipt(String json) {
    final var node = parse(json);
    try {
      final var transition = node.get(TRANSITION);
      return new Receipt(
          text(node, TYPE),
          CorridorId.parse(text(node, CORRIDOR_ID)),
          integral(node, SEQUENCE),
          Timestamps.parse(text(node, TIMESTAMP)),
          text(node, PREV_ROOT),
          text(node, NEXT_ROOT),
          strings(node, LAWPACK_DIGEST_SET),
          strings(node, RULESET_DIGEST_SET),
          transition == null || transition.isNull() ? null : transition);
    } catch (CorruptRecordException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CorruptRecordException("invalid receipt record: " + e.getMessage(), e);
    }
  }

  /// The digested content plus the peaks, stored digest and creation time.
  public static String encode(Checkpoint checkpoint) {
    final Map<String, Object> content = new LinkedHashMap<>(checkpoint.canonicalContent());
    final var peaks = new ArrayList<Map<String, Object>>();
    for (var peak : checkpoint.peaks()) {
      final var p = new LinkedHashMap<String, Object>();
      p.put(HEIGHT, peak.height());
      p.put(HASH, peak.hash());
      peaks.add(p);
    }
    content.put(PEAKS, peaks);
    content.put(DIGEST, checkpoint.digest().toString());
    content.put(CREATED_AT, checkpoint.createdAt());
    return Canonicalizer.canonicalize(content).asUtf8();
  }

  /// The digest is taken from the record as stored. Use [Checkpoint#verifyDigest()] to check it.
  public static Checkpoint decodeCheckpoint(String json) {
    final var node = parse(json);
    try {
      final var mmr = required(node, "mmr");
      final var peaks = new ArrayList<Peak>();
      for (var p : required(node, PEAKS)) {
        peaks.add(new Peak(Math.toIntExact(integral(p, HEIGHT)), text(p, HASH)));
      }
      return new Checkpoint(
          CorridorId.parse(text(node, "corridor_id")),
          integral(node, "receipt_count"),
          text(mmr, "root"),
          peaks,
          ContentDigest.fromHex(text(node, "genesis_root")),
          ContentDigest.fromHex(text(node, "final_state_root")),
          ContentDigest.parse(text(node, DIGEST)),
          Timestamps.parse(text(node, CREATED_AT)));
    } catch (CorruptRecordException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CorruptRecordException("invalid checkpoint record: " + e.getMessage(), e);
    }
  }

  private static JsonNode parse(String json) {
    try {
      final var node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new CorruptRecordException("record is not a JSON object: " + json);
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new CorruptRecordException("record is not JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static JsonNode required(JsonNode node, String field) {
    final var value = node.get(field);
    if (value == null || value.isNull()) {
      throw new CorruptRecordException("missing field " + field);
    }
    return value;
  }

  private static long integral(JsonNode node, String field) {
    final var value = required(node, field);
    if (!value.isIntegralNumber() || !value.canConvertToLong()) {
      throw new CorruptRecordException("field " + field + " is not an integer: " + value);
    }
    return value.longValue();
  }

  private static String text(JsonNode node, String field) {
    final var value = required(node, field);
    if (!value.isTextual()) {
      throw new CorruptRecordException("field " + field + " is not text");
    }
    return value.textValue();
  }

  private static List<String> strings(JsonNode node, String field) {
    final var array = required(node, field);
    if (!array.isArray()) {
      throw new CorruptRecordException("field " + field + " is not an array");
    }
    final var result = new ArrayList<String>(array.size());
    for (var element : array) {
      if (!element.isTextual()) {
        throw new CorruptRecordException("field " + field + " has a non-text element");
      }
      result.add(element.textValue());
    }
    return result;
  }
}
