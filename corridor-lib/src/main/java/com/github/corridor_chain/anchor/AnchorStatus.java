// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.anchor;

public enum AnchorStatus {
  PENDING,
  CONFIRMED,
  FINALIZED,
  FAILED;

  public boolean isTerminal() {
    return this == FINALIZED || this == FAILED;
  }
}
