package com.example.dataspaceaccess.core.http;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Parses the {@code Retry-After} response header (delta seconds or an HTTP date). */
final class RetryAfter {

  private RetryAfter() {}

  static Optional<Duration> parse(final HttpHeaders headers, final Clock clock) {
    return headers.firstValue("Retry-After").map(String::trim).flatMap(v -> parse(v, clock));
  }

  static Optional<Duration> parse(final String value, final Clock clock) {
    if (value == null || value.isBlank()) return Optional.empty();

    if (value.chars().allMatch(Character::isDigit)) {
      try {
        return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
      } catch (final NumberFormatException e) {
        return Optional.empty();
      }
    }

    try {
      final var at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
      final var wait = Duration.between(clock.instant(), at);
      return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
    } catch (final DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
