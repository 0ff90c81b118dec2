// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MerkleMountainRangeTest {

  /// `sha256("0")`, `sha256("1")` and so on.
  static List<String> leaves(int count) {
    return IntStream.range(0, count).mapToObj(i -> sha256(String.valueOf(i))).toList();
  }

  static String sha256(String text) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError(e);
    }
  }

  @Test
  public void emptyRangeHasEmptyRoot() {
    final var mmr = new MerkleMountainRange();
    assertThat(mmr.size()).isZero();
    assertThat(mmr.root()).isEmpty();
    assertThat(mmr.peaks()).isEmpty();
    assertThat(MerkleMountainRange.rootOf(List.of())).isEmpty();
  }

  @Test
  public void knownRoots() {
    final var all = leaves(11);
    assertThat(MerkleMountainRange.fromLeaves(all.subList(0, 1)).root())
        .isEqualTo("13a77175e35eb1d9da91ee14df0d7772cea71289800206e2b45c882ecb06efbf");
    assertThat(MerkleMountainRange.fromLeaves(all.subList(0, 2)).root())
        .isEqualTo("bbb441530bdded54e6e2bfcdc829819ff39b30768eb9f023071dffc16b410f10");
    assertThat(MerkleMountainRange.fromLeaves(all.subList(0, 3)).root())
        .isEqualTo("8be871f13785b4c81a1700459c76ac2b3ae2caebb7876c376e223c6adff98c47");
    assertThat(MerkleMountainRange.fromLeaves(all.subList(0, 7)).root())
        .isEqualTo("5653c4ab2514ccd6ea4f0159702d2aba901f2562aa75abcff5a19e344bee038f");
    assertThat(MerkleMountainRange.fromLeaves(all).root())
        .isEqualTo("fb88a056dbced484adbd3755541cfd343055c943c535fdee0a8f314e5acc42bb");
  }

  @Test
  public void singleLeafRootIsTheLeafHash() {
    final var leaf = leaves(1).get(0);
    final var mmr = new MerkleMountainRange();
    assertThat(mmr.append(leaf)).isEqualTo(MmrHashing.leafHash(leaf));
    assertThat(mmr.root()).isEqualTo(MmrHashing.leafHash(leaf));
  }

  @Test
  public void peaksFollowTheBitsOfTheSize() {
    final var mmr = MerkleMountainRange.fromLeaves(leaves(11));
    assertThat(mmr.peaks()).extracting(Peak::height).containsExactly(3, 1, 0);
    assertThat(MerkleMountainRange.peakHeights(11)).containsExactly(3, 1, 0);
    assertThat(MerkleMountainRange.peakHeights(16)).containsExactly(4);
  }

  @Test
  public void malformedLeafLeavesStateUnchanged() {
    final var mmr = MerkleMountainRange.fromLeaves(leaves(3));
    final var root = mmr.root();
    for (var bad : List.of("abc", "z".repeat(64), "0".repeat(63), "0".repeat(65), " " + "0".repeat(63))) {
      assertThatThrownBy(() -> mmr.append(bad))
          .isInstanceOf(MmrException.class)
          .extracting(e -> ((MmrException) e).reason()).isEqualTo(MmrException.Reason.MALFORMED_LEAF);
    }
    assertThat(mmr.size()).isEqualTo(3);
    assertThat(mmr.root()).isEqualTo(root);
  }

  @Test
  public void upperCaseLeavesAreStoredLowerCase() {
    final var leaf = leaves(1).get(0);
    final var upper = MerkleMountainRange.fromLeaves(List.of(leaf.toUpperCase()));
    assertThat(upper.leaves()).containsExactly(leaf);
    assertThat(upper.root()).isEqualTo(MerkleMountainRange.fromLeaves(List.of(leaf)).root());
  }

  @Test
  public void everyLeafHasAValidProof() {
    for (int size = 1; size <= 33; size++) {
      final var mmr = MerkleMountainRange.fromLeaves(leaves(size));
      for (long index = 0; index < size; index++) {
        final var proof = mmr.buildInclusionProof(index);
        assertThat(proof.verify()).as("size %d index %d", size, index).isTrue();
        assertThat(mmr.verifyInclusionProof(proof)).isTrue();
        assertThat(proof.path()).hasSize(proof.peakHeight());
      }
    }
  }

  @Test
  public void tamperedProofsFail() {
    final var mmr = MerkleMountainRange.fromLeaves(leaves(13));
    final var proof = mmr.buildInclusionProof(5);
    final var otherLeaf = sha256("other");

    final var wrongLeaf = new MmrInclusionProof(proof.size(), proof.root(), proof.leafIndex(), otherLeaf,
        MmrHashing.leafHash(otherLeaf), proof.peakIndex(), proof.peakHeight(), proof.path(), proof.peaks());
    assertThat(wrongLeaf.verify()).isFalse();

    final var wrongIndex = new MmrInclusionProof(proof.size(), proof.root(), 4, proof.leaf(),
        proof.leafHash(), proof.peakIndex(), proof.peakHeight(), proof.path(), proof.peaks());
    assertThat(wrongIndex.verify()).isFalse();

    final var path = new ArrayList<>(proof.path());
    path.set(1, new PathStep(path.get(1).side(), otherLeaf));
    final var wrongSibling = new MmrInclusionProof(proof.size(), proof.root(), proof.leafIndex(), proof.leaf(),
        proof.leafHash(), proof.peakIndex(), proof.peakHeight(), path, proof.peaks());
    assertThat(wrongSibling.verify()).isFalse();

    final var wrongRoot = new MmrInclusionProof(proof.size(), otherLeaf, proof.leafIndex(), proof.leaf(),
        proof.leafHash(), proof.peakIndex(), proof.peakHeight(), proof.path(), proof.peaks());
    assertThat(wrongRoot.verify()).isFalse();
  }

  @Test
  public void staleProofDoesNotMatchGrownRange() {
    final var mmr = MerkleMountainRange.fromLeaves(leaves(4));
    final var proof = mmr.buildInclusionProof(2);
    mmr.append(sha256("late"));
    assertThat(proof.verify()).isTrue();
    assertThat(mmr.verifyInclusionProof(proof)).isFalse();
  }

  @Test
  public void proofRequestsOutsideTheRangeFail() {
    assertThatThrownBy(() -> new MerkleMountainRange().buildInclusionProof(0))
        .isInstanceOf(MmrException.class)
        .extracting(e -> ((MmrException) e).reason()).isEqualTo(MmrException.Reason.EMPTY);
    final var mmr = MerkleMountainRange.fromLeaves(leaves(3));
    assertThatThrownBy(() -> mmr.buildInclusionProof(3))
        .isInstanceOf(MmrException.class)
        .extracting(e -> ((MmrException) e).reason()).isEqualTo(MmrException.Reason.INDEX_OUT_OF_RANGE);
    assertThatThrownBy(() -> mmr.buildInclusionProof(-1))
        .isInstanceOf(MmrException.class)
        .extracting(e -> ((MmrException) e).reason()).isEqualTo(MmrException.Reason.INDEX_OUT_OF_RANGE);
  }

  @Test
  public void peaksCanBeExtendedWithoutLeaves() {
    final var all = leaves(11);
    final var checkpointed = MerkleMountainRange.fromLeaves(all.subList(0, 6));
    final var extended = MerkleMountainRange.appendPeaks(checkpointed.peaks(), all.subList(6, 11));
    assertThat(extended).isEqualTo(MerkleMountainRange.fromLeaves(all).peaks());
    assertThat(MmrHashing.bagPeaks(extended)).isEqualTo(MerkleMountainRange.rootOf(all));
  }

  @Test
  public void leavesAndNodesAreDomainSeparated() {
    final var a = leaves(2).get(0);
    final var b = leaves(2).get(1);
    assertThat(MmrHashing.leafHash(a)).isNotEqualTo(sha256Hex(a));
    assertThat(MmrHashing.nodeHash(a, b)).isNotEqualTo(MmrHashing.nodeHash(b, a));
  }

  static String sha256Hex(String hex) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(HexFormat.of().parseHex(hex)));
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError(e);
    }
  }
}
