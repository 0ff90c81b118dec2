// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// The deterministic byte encoding of a structured value. There is no public constructor: the only way to obtain
/// an instance is [Canonicalizer#canonicalize(Object)], and [Digester#digest(CanonicalBytes)] only accepts this type.
/// That makes it impossible for two components to hash differently serialized versions of the same record.
///
/// Instances are immutable. [#bytes()] returns a copy.
public final class CanonicalBytes {
  private final byte[] bytes;

  CanonicalBytes(byte[] bytes) {
    this.bytes = bytes;
  }

  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  public boolean isEmpty() {
    return bytes.length == 0;
  }

  /// The canonical form is always valid UTF-8 JSON text.
  public String asUtf8() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  // used by the digester without a defensive copy
  byte[] unsafeBytes() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CanonicalBytes that && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return asUtf8();
  }
}
