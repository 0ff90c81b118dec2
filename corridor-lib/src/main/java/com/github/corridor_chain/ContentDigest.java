// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// A content identifier: an algorithm tag and a fixed-width hash value. Fresh identifiers come only from
/// [Digester#digest(CanonicalBytes)]. Identifiers that were produced elsewhere (a genesis root, a digest read back
/// from a store) are recovered with [#fromHex(String)] or [#parse(String)], which validate the width and alphabet.
///
/// Equality, hashing and ordering are by value. The natural order compares the hash bytes as unsigned bytes.
public final class ContentDigest implements Comparable<ContentDigest> {
  private static final HexFormat HEX = HexFormat.of();

  private final DigestAlgorithm algorithm;
  private final byte[] hash;

  ContentDigest(DigestAlgorithm algorithm, byte[] hash) {
    Objects.requireNonNull(algorithm, "algorithm");
    if (hash.length != algorithm.length()) {
      throw new IllegalArgumentException("expected " + algorithm.length() + " bytes for " + algorithm
          + " but got " + hash.length);
    }
    this.algorithm = algorithm;
    this.hash = hash;
  }

  /// The all-zero SHA-256 value, conventionally the genesis root of a new chain.
  public static ContentDigest zero() {
    return new ContentDigest(DigestAlgorithm.SHA256, new byte[DigestAlgorithm.SHA256.length()]);
  }

  /// Recovers a SHA-256 identifier from its 64 character hex form. Upper case input is accepted.
  public static ContentDigest fromHex(String hex) {
    return fromHex(DigestAlgorithm.SHA256, hex);
  }

  public static ContentDigest fromHex(DigestAlgorithm algorithm, String hex) {
    Objects.requireNonNull(hex, "hex");
    if (hex.length() != algorithm.length() * 2) {
      throw new IllegalArgumentException("expected " + algorithm.length() * 2 + " hex chars for " + algorithm
          + " but got " + hex.length());
    }
    try {
      return new ContentDigest(algorithm, HEX.parseHex(hex));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("not hexadecimal: " + hex, e);
    }
  }

  /// Parses the `algorithm:hex` display form produced by [#toString()].
  public static ContentDigest parse(String display) {
    final int colon = display.indexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException("expected algorithm:hex but got " + display);
    }
    return fromHex(DigestAlgorithm.fromTag(display.substring(0, colon)), display.substring(colon + 1));
  }

  public DigestAlgorithm algorithm() {
    return algorithm;
  }

  public byte[] hash() {
    return hash.clone();
  }

  /// Lower case hex without a prefix. This is the form used as a storage key and as an MMR leaf.
  public String toHex() {
    return HEX.formatHex(hash);
  }

  @Override
  public int compareTo(ContentDigest that) {
    final int byHash = Arrays.compareUnsigned(this.hash, that.hash);
    return byHash != 0 ? byHash : this.algorithm.compareTo(that.algorithm);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ContentDigest that
        && algorithm == that.algorithm
        && Arrays.equals(hash, that.hash);
  }

  @Override
  public int hashCode() {
    return 31 * algorithm.hashCode() + Arrays.hashCode(hash);
  }

  /// `algorithm:hex`, e.g. `sha256:9f86d0...`.
  @Override
  public String toString() {
    return algorithm.tag() + ":" + toHex();
  }
}
