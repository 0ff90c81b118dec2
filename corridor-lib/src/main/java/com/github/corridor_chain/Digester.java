// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

/// Computes content identifiers. The only input accepted is [CanonicalBytes] so nothing can be hashed that did not
/// pass through the [Canonicalizer].
public final class Digester {

  /// The algorithm new identifiers are tagged with.
  public static final DigestAlgorithm ACTIVE = DigestAlgorithm.SHA256;

  private Digester() {
  }

  public static ContentDigest digest(CanonicalBytes canonical) {
    return digest(ACTIVE, canonical);
  }

  public static ContentDigest digest(DigestAlgorithm algorithm, CanonicalBytes canonical) {
    final var md = algorithm.newMessageDigest();
    return new ContentDigest(algorithm, md.digest(canonical.unsafeBytes()));
  }

  /// Shorthand for `digest(Canonicalizer.canonicalize(value))`.
  public static ContentDigest digestOf(Object value) {
    return digest(Canonicalizer.canonicalize(value));
  }
}
