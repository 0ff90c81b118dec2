// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/// The hash functions a [ContentDigest] may be tagged with.
public enum DigestAlgorithm {
  SHA256("sha256", "SHA-256", 32);

  private final String tag;
  private final String jcaName;
  private final int length;

  DigestAlgorithm(String tag, String jcaName, int length) {
    this.tag = tag;
    this.jcaName = jcaName;
    this.length = length;
  }

  /// The tag used in the `algorithm:hex` display form.
  public String tag() {
    return tag;
  }

  /// Width of the hash value in bytes.
  public int length() {
    return length;
  }

  MessageDigest newMessageDigest() {
    try {
      return MessageDigest.getInstance(jcaName);
    } catch (NoSuchAlgorithmException e) {
      // every JVM is required to provide SHA-256
      throw new IllegalStateException(jcaName + " not available", e);
    }
  }

  public static DigestAlgorithm fromTag(String tag) {
    return Arrays.stream(values())
        .filter(a -> a.tag.equals(tag))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown digest algorithm: " + tag));
  }

  @Override
  public String toString() {
    return tag;
  }
}
