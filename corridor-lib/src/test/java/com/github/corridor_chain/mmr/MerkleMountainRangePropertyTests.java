// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

import net.jqwik.api.*;

import java.util.HexFormat;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

public class MerkleMountainRangePropertyTests {

  @Property(tries = 200)
  void incrementalAndBatchAgree(@ForAll("leafLists") List<String> leaves) {
    final var incremental = new MerkleMountainRange();
    for (var leaf : leaves) {
      incremental.append(leaf);
    }
    final var replayed = MerkleMountainRange.fromLeaves(incremental.leaves());
    assertThat(replayed.size()).isEqualTo(incremental.size());
    assertThat(replayed.root()).isEqualTo(incremental.root());
    assertThat(MerkleMountainRange.rootOf(leaves)).isEqualTo(incremental.root());
  }

  @Property(tries = 100)
  void splitAppendOfPeaksAgrees(@ForAll("leafLists") List<String> leaves, @ForAll Random random) {
    final int split = leaves.isEmpty() ? 0 : random.nextInt(leaves.size() + 1);
    final var prefix = MerkleMountainRange.fromLeaves(leaves.subList(0, split));
    final var peaks = MerkleMountainRange.appendPeaks(prefix.peaks(), leaves.subList(split, leaves.size()));
    assertThat(MmrHashing.bagPeaks(peaks)).isEqualTo(MerkleMountainRange.rootOf(leaves));
  }

  @Property(tries = 100)
  void everyProofVerifies(@ForAll("leafLists") List<String> leaves) {
    Assume.that(!leaves.isEmpty());
    final var mmr = MerkleMountainRange.fromLeaves(leaves);
    for (long i = 0; i < leaves.size(); i++) {
      assertThat(mmr.verifyInclusionProof(mmr.buildInclusionProof(i))).isTrue();
    }
  }

  @Provide
  Arbitrary<List<String>> leafLists() {
    return Arbitraries.bytes().array(byte[].class).ofSize(32)
        .map(bytes -> HexFormat.of().formatHex(bytes))
        .list().ofMaxSize(40);
  }
}
