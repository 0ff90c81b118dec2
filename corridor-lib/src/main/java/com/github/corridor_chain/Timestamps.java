// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Pattern;

/// The one date-time rendering used in canonical content: UTC, whole seconds, literal `Z`, e.g.
/// `2025-01-15T12:00:00Z`.
public final class Timestamps {

  static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'")
      .withZone(ZoneOffset.UTC);

  /// Strings of this shape are treated as date-times. A missing offset means UTC.
  static final Pattern DATE_TIME = Pattern.compile(
      "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d{1,9})?(Z|[+-]\\d{2}:\\d{2})?");

  private Timestamps() {
  }

  public static Instant truncate(Instant instant) {
    return instant.truncatedTo(ChronoUnit.SECONDS);
  }

  public static String format(Instant instant) {
    return CANONICAL.format(truncate(instant));
  }

  public static String format(OffsetDateTime dateTime) {
    return format(dateTime.toInstant());
  }

  public static String format(ZonedDateTime dateTime) {
    return format(dateTime.toInstant());
  }

  /// Naive date-times are taken to be UTC.
  public static String format(LocalDateTime dateTime) {
    return format(dateTime.toInstant(ZoneOffset.UTC));
  }

  /// Parses any string accepted by [#normalize(String)] into an instant truncated to seconds.
  public static Instant parse(String text) {
    return normalizeToInstant(text).orElseThrow(() -> new CanonicalizationException(
        CanonicalizationException.Reason.INVALID_TIMESTAMP, "not a date-time: " + text));
  }

  /// @return the canonical rendering when `text` is a date-time, otherwise `text` unchanged. Text that only looks
  /// like a date-time, such as `2025-02-30T12:00:00Z`, is not one and passes unchanged.
  public static String normalize(String text) {
    return normalizeToInstant(text).map(Timestamps::format).orElse(text);
  }

  private static Optional<Instant> normalizeToInstant(String text) {
    final var matcher = DATE_TIME.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    try {
      if (matcher.group(2) == null) {
        return Optional.of(truncate(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC)));
      }
      return Optional.of(truncate(OffsetDateTime.parse(text).toInstant()));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
