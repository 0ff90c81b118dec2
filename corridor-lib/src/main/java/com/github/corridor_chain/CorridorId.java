// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/// Identifies one settlement corridor. Created once when the corridor is established and never changed.
/// Renders as the bare UUID string both in logs and in canonical content.
public record CorridorId(UUID id) implements Comparable<CorridorId> {
  public CorridorId {
    Objects.requireNonNull(id, "id");
  }

  public static CorridorId random() {
    return new CorridorId(UUID.randomUUID());
  }

  public static CorridorId parse(String text) {
    return new CorridorId(UUID.fromString(text));
  }

  @Override
  public int compareTo(CorridorId other) {
    return id.compareTo(other.id);
  }

  @JsonValue
  @Override
  public String toString() {
    return id.toString();
  }
}
