// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

/// Thrown when a value cannot be turned into [CanonicalBytes]. No partial output is ever produced and the value
/// is never silently coerced.
public class CanonicalizationException extends RuntimeException {

  public enum Reason {
    /// A floating point number or a decimal with a fractional part.
    FLOAT_REJECTED,
    /// [Timestamps#parse(String)] was given text that is not a date-time.
    INVALID_TIMESTAMP,
    /// The value could not be mapped to a JSON tree, e.g. a cyclic object graph, or contains unpaired surrogates.
    SERIALIZATION_FAILED,
    /// Nesting deeper than [Canonicalizer#MAX_DEPTH].
    DEPTH_EXCEEDED
  }

  private final Reason reason;

  public CanonicalizationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CanonicalizationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
