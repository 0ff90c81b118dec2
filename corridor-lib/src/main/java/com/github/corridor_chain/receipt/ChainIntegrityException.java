// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.receipt;

/// A receipt or checkpoint was refused by a [ReceiptChain]. The chain is left exactly as it was so the caller can
/// retry with a corrected receipt without any risk of duplication.
public class ChainIntegrityException extends RuntimeException {

  public enum Reason {
    /// The receipt sequence is not the current height.
    SEQUENCE_MISMATCH,
    /// The receipt does not link to the current final-state root.
    PREV_ROOT_MISMATCH,
    /// The sealed `next_root` does not match the receipt content.
    NEXT_ROOT_MISMATCH,
    /// The receipt or checkpoint names another corridor.
    CORRIDOR_MISMATCH,
    /// A checkpoint does not match the chain state it claims to capture.
    CHECKPOINT_MISMATCH,
    /// The operation needs at least one receipt.
    EMPTY_CHAIN
  }

  private final Reason reason;

  public ChainIntegrityException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
