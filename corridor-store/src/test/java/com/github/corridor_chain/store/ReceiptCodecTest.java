// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.store;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.corridor_chain.ContentDigest;
import com.github.corridor_chain.CorridorId;
import com.github.corridor_chain.receipt.ReceiptChain;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReceiptCodecTest {
  static final Instant T0 = Instant.parse("2025-03-01T00:00:00Z");

  @Test
  public void storedReceiptIsItsCanonicalForm() {
    final var chain = new ReceiptChain(CorridorId.random(), ContentDigest.zero());
    final var transition = JsonNodeFactory.instance.objectNode().put("settled_at", "2025-03-01T01:00:00+01:00");
    final var receipt = chain.nextDraft("settlement", T0, List.of("sha256:b", "sha256:a"), List.of(), transition)
        .seal();
    final var json = ReceiptCodec.encode(receipt);
    assertThat(json).contains("\"next_root\":\"" + receipt.nextRoot() + "\"")
        .contains("\"settled_at\":\"2025-03-01T00:00:00Z\"")
        .contains("\"lawpack_digest_set\":[\"sha256:b\",\"sha256:a\"]")
        .doesNotContain(" ");
    final var decoded = ReceiptCodec.decodeReceipt(json);
    assertThat(decoded.isSealed()).isTrue();
    assertThat(decoded.nextRoot()).isEqualTo(receipt.nextRoot());
    assertThat(decoded.receiptDigest()).isEqualTo(receipt.receiptDigest());
  }

  @Test
  public void checkpointKeepsItsDigestAndPeaks() {
    final var chain = new ReceiptChain(CorridorId.random(), ContentDigest.zero());
    for (int i = 0; i < 3; i++) {
      chain.append(chain.nextDraft("settlement", T0.plusSeconds(i), List.of(), List.of(), null).seal());
    }
    final var checkpoint = chain.createCheckpoint();
    final var decoded = ReceiptCodec.decodeCheckpoint(ReceiptCodec.encode(checkpoint));
    assertThat(decoded).isEqualTo(checkpoint);
    assertThat(decoded.verifyDigest()).isTrue();
  }

  @Test
  public void rejectsRecordsThatAreNotReceipts() {
    assertThatThrownBy(() -> ReceiptCodec.decodeReceipt("[]")).isInstanceOf(CorruptRecordException.class);
    assertThatThrownBy(() -> ReceiptCodec.decodeReceipt("{\"type\":\"x\"}"))
        .isInstanceOf(CorruptRecordException.class)
        .hasMessageContaining("corridor_id");
    assertThatThrownBy(() -> ReceiptCodec.decodeReceipt("{oops")).isInstanceOf(CorruptRecordException.class);
    assertThatThrownBy(() -> ReceiptCodec.decodeCheckpoint("{\"corridor_id\":\"not-a-uuid\"}"))
        .isInstanceOf(CorruptRecordException.class);
  }

  @Test
  public void rejectsNonNumericCounters() {
    final var chain = new ReceiptChain(CorridorId.random(), ContentDigest.zero());
    final var receipt = chain.nextDraft("settlement", T0, List.of(), List.of(), null).seal();
    final var json = ReceiptCodec.encode(receipt);
    assertThat(json).contains("\"sequence\":0");
    assertThatThrownBy(() -> ReceiptCodec.decodeReceipt(json.replace("\"sequence\":0", "\"sequence\":\"zero\"")))
        .isInstanceOf(CorruptRecordException.class)
        .hasMessageContaining("sequence");

    chain.append(receipt);
    final var checkpoint = ReceiptCodec.encode(chain.createCheckpoint());
    assertThat(checkpoint).contains("\"receipt_count\":1");
    assertThatThrownBy(() -> ReceiptCodec.decodeCheckpoint(checkpoint.replace("\"receipt_count\":1", "\"receipt_count\":true")))
        .isInstanceOf(CorruptRecordException.class)
        .hasMessageContaining("receipt_count");
  }
}
