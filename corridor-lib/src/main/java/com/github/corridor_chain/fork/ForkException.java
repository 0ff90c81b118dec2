// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.fork;

/// A pair of branches that cannot be resolved.
public class ForkException extends RuntimeException {

  public enum Reason {
    /// Both branches have the same receipt digest so they are the same branch.
    NOT_A_FORK,
    /// A branch claims a time too far ahead of the local clock to be trusted.
    FUTURE_TIMESTAMP
  }

  private final Reason reason;

  public ForkException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
