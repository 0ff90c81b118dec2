// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.github.corridor_chain.ChainLogger.LOGGER;
import static com.github.corridor_chain.mmr.MmrException.Reason.EMPTY;
import static com.github.corridor_chain.mmr.MmrException.Reason.INDEX_OUT_OF_RANGE;

/// An append-only Merkle Mountain Range over 32 byte leaf values carried as hex.
///
/// Leaves are gathered into a forest of perfect binary trees ("mountains") whose heights are the set bits of the
/// leaf count. Appending a leaf merges equal height peaks into their parent, so an append costs `O(log n)` hashes at
/// worst and `O(1)` amortised. The root bags the peaks right to left, see [MmrHashing#bagPeaks].
///
/// Every interior node that has ever been formed is retained per level. Node `j` on level `h` commits to leaves
/// `[j * 2^h, (j + 1) * 2^h)`. An inclusion proof is therefore read straight out of the levels in `O(log n)`
/// without rebuilding anything.
///
/// The root is a pure function of the leaf sequence. An empty range has size zero and the empty string as its root.
///
/// Not thread safe. The owning receipt chain serialises writers.
public class MerkleMountainRange {

  private final List<String> leaves = new ArrayList<>();

  /// `levels.get(h)` holds the hashes of all complete subtrees of height `h` from left to right.
  private final List<List<String>> levels = new ArrayList<>();

  public MerkleMountainRange() {
  }

  /// Replays `leaves` into a new range.
  public static MerkleMountainRange fromLeaves(List<String> leaves) {
    final var mmr = new MerkleMountainRange();
    leaves.forEach(mmr::append);
    return mmr;
  }

  /// Appends one leaf. A malformed leaf is rejected before anything is modified.
  ///
  /// @param leafHex 64 hex characters, upper case is accepted and stored lower case
  /// @return the leaf hash that was added to the bottom level
  public String append(String leafHex) {
    final var leaf = MmrHashing.normalize(leafHex);
    final var leafHash = MmrHashing.leafHash(leaf);
    leaves.add(leaf);
    level(0).add(leafHash);
    int height = 0;
    // an even count on a level means its last two nodes are siblings that now have a parent
    while (level(height).size() % 2 == 0) {
      final var nodes = level(height);
      final var parent = MmrHashing.nodeHash(nodes.get(nodes.size() - 2), nodes.get(nodes.size() - 1));
      level(height + 1).add(parent);
      height++;
    }
    final int merged = height;
    LOGGER.finest(() -> "mmr append leaf " + (leaves.size() - 1) + " merged " + merged + " levels");
    return leafHash;
  }

  public long size() {
    return leaves.size();
  }

  public boolean isEmpty() {
    return leaves.isEmpty();
  }

  /// The appended leaf values in order.
  public List<String> leaves() {
    return Collections.unmodifiableList(leaves);
  }

  public List<Peak> peaks() {
    final var peaks = new ArrayList<Peak>();
    long offset = 0;
    for (int height : peakHeights(size())) {
      peaks.add(new Peak(height, levels.get(height).get((int) (offset >> height))));
      offset += 1L << height;
    }
    return peaks;
  }

  /// The bagged peaks, or the empty string when there are no leaves.
  public String root() {
    return MmrHashing.bagPeaks(peaks());
  }

  public MmrInclusionProof buildInclusionProof(long leafIndex) {
    if (leaves.isEmpty()) {
      throw new MmrException(EMPTY, "cannot build a proof for an empty mountain range");
    }
    if (leafIndex < 0 || leafIndex >= size()) {
      throw new MmrException(INDEX_OUT_OF_RANGE, "leaf index " + leafIndex + " outside [0, " + size() + ")");
    }
    final var location = locate(size(), leafIndex);
    final var path = new ArrayList<PathStep>(location.height());
    long position = leafIndex;
    for (int height = 0; height < location.height(); height++) {
      final long sibling = position ^ 1;
      final var side = sibling < position ? PathStep.Side.LEFT : PathStep.Side.RIGHT;
      path.add(new PathStep(side, levels.get(height).get((int) sibling)));
      position >>= 1;
    }
    final var leaf = leaves.get((int) leafIndex);
    return new MmrInclusionProof(
        size(),
        root(),
        leafIndex,
        leaf,
        levels.get(0).get((int) leafIndex),
        location.peakIndex(),
        location.height(),
        path,
        peaks());
  }

  /// @return true when `proof` is valid and commits to this range's current root
  public boolean verifyInclusionProof(MmrInclusionProof proof) {
    return proof != null && proof.verify() && proof.root().equalsIgnoreCase(root());
  }

  /// Computes the root of `leaves` with a single stack of peaks and no retained levels.
  public static String rootOf(List<String> leaves) {
    return MmrHashing.bagPeaks(appendPeaks(List.of(), leaves));
  }

  /// Extends a peak list with more leaves. This lets a holder of only the peaks (for example a checkpoint) compute
  /// the root after further appends.
  public static List<Peak> appendPeaks(List<Peak> existingPeaks, List<String> newLeaves) {
    final var stack = new ArrayList<>(existingPeaks);
    for (String leafHex : newLeaves) {
      int height = 0;
      String current = MmrHashing.leafHash(leafHex);
      while (!stack.isEmpty() && stack.get(stack.size() - 1).height() == height) {
        final var left = stack.remove(stack.size() - 1);
        current = MmrHashing.nodeHash(left.hash(), current);
        height++;
      }
      stack.add(new Peak(height, current));
    }
    return stack;
  }

  /// Heights of the peaks of a range of `size` leaves from left to right. These are the set bits of `size`, highest
  /// first.
  static List<Integer> peakHeights(long size) {
    final var heights = new ArrayList<Integer>();
    for (int height = 63 - Long.numberOfLeadingZeros(size); height >= 0; height--) {
      if ((size & (1L << height)) != 0) {
        heights.add(height);
      }
    }
    return heights;
  }

  record Location(int peakIndex, long start, int height) {
  }

  /// Finds the peak covering `leafIndex`.
  static Location locate(long size, long leafIndex) {
    long start = 0;
    int peakIndex = 0;
    for (int height : peakHeights(size)) {
      final long count = 1L << height;
      if (leafIndex < start + count) {
        return new Location(peakIndex, start, height);
      }
      start += count;
      peakIndex++;
    }
    throw new MmrException(INDEX_OUT_OF_RANGE, "leaf index " + leafIndex + " outside [0, " + size + ")");
  }

  private List<String> level(int height) {
    while (levels.size() <= height) {
      levels.add(new ArrayList<>());
    }
    return levels.get(height);
  }

  @Override
  public String toString() {
    return "MMR(size=" + size() + ",root=" + root() + ")";
  }
}
