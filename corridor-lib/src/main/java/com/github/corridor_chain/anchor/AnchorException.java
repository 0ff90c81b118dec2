// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

/// An anchor target could not accept or report on a commitment. The checkpoint is unaffected and may be anchored
/// again later.
public class AnchorException extends RuntimeException {

  public enum Reason {
    /// The target refused the commitment.
    REJECTED,
    /// The external ledger could not be reached.
    CHAIN_UNAVAILABLE,
    /// Submission failed for a reason the target did not classify.
    TRANSACTION_FAILED,
    /// The target has no record of the transaction id.
    UNKNOWN_TRANSACTION
  }

  private final Reason reason;

  public AnchorException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AnchorException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
