// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

/// Structural errors of a [MerkleMountainRange]. They are always raised before any internal state is touched.
public class MmrException extends RuntimeException {

  public enum Reason {
    /// Not 64 hexadecimal characters.
    MALFORMED_LEAF,
    INDEX_OUT_OF_RANGE,
    EMPTY
  }

  private final Reason reason;

  public MmrException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
