// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

import java.util.List;

import static com.github.corridor_chain.ChainLogger.LOGGER;

/// Evidence that `leaf` sits at `leafIndex` in a mountain range of `size` leaves whose bagged root is `root`.
///
/// Verification recomputes the leaf hash, walks `path` up to the peak at `peakIndex`, substitutes that peak into
/// `peaks` and bags them. The proof is self-contained: it can be checked without access to the range that produced it.
/// Comparing `root` against a trusted root is the caller's job, see [MerkleMountainRange#verifyInclusionProof].
///
/// @param size       number of leaves when the proof was built
/// @param root       the bagged root at that size
/// @param leafIndex  zero based position of the leaf
/// @param leaf       the appended leaf value
/// @param leafHash   `sha256(0x00 || leaf)`
/// @param peakIndex  which peak, counted from the left, covers the leaf
/// @param peakHeight height of that peak which is also the length of `path`
/// @param path       siblings from the leaf up to the peak
/// @param peaks      all peaks at `size`
public record MmrInclusionProof(
    long size,
    String root,
    long leafIndex,
    String leaf,
    String leafHash,
    int peakIndex,
    int peakHeight,
    List<PathStep> path,
    List<Peak> peaks
) {
  public MmrInclusionProof {
    path = List.copyOf(path);
    peaks = List.copyOf(peaks);
  }

  /// @return true when the proof is internally consistent and folds to `root`. Malformed proofs are false, never an
  /// exception.
  public boolean verify() {
    if (size <= 0 || leafIndex < 0 || leafIndex >= size) {
      return false;
    }
    if (!MmrHashing.isHex32(root) || !MmrHashing.isHex32(leaf) || !MmrHashing.isHex32(leafHash)) {
      return false;
    }
    if (!MmrHashing.leafHash(leaf).equals(leafHash.toLowerCase(java.util.Locale.ROOT))) {
      return false;
    }
    final var plan = MerkleMountainRange.peakHeights(size);
    if (plan.size() != peaks.size()) {
      return false;
    }
    for (int i = 0; i < plan.size(); i++) {
      if (peaks.get(i).height() != plan.get(i)) {
        return false;
      }
    }
    final var location = MerkleMountainRange.locate(size, leafIndex);
    if (location.peakIndex() != peakIndex || location.height() != peakHeight || path.size() != peakHeight) {
      return false;
    }
    String current = MmrHashing.leafHash(leaf);
    long position = leafIndex;
    for (PathStep step : path) {
      final var expectedSide = (position & 1) == 0 ? PathStep.Side.RIGHT : PathStep.Side.LEFT;
      if (step.side() != expectedSide) {
        return false;
      }
      current = step.apply(current);
      position >>= 1;
    }
    final var rebuilt = new java.util.ArrayList<>(peaks);
    rebuilt.set(peakIndex, new Peak(peakHeight, current));
    final var computed = MmrHashing.bagPeaks(rebuilt);
    final boolean valid = computed.equals(root.toLowerCase(java.util.Locale.ROOT));
    if (!valid) {
      LOGGER.finer(() -> "inclusion proof for leaf " + leafIndex + " folds to " + computed + " not " + root);
    }
    return valid;
  }
}
