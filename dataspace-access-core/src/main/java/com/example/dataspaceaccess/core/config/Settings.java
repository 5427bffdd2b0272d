package com.example.dataspaceaccess.core.config;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/** Resolves a setting from a system property, then an environment variable. */
final class Settings {

  private Settings() {}

  static Optional<String> lookup(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isBlank());
  }

  static String string(final String property, final String env, final String defaultValue) {
    return lookup(property, env).orElse(defaultValue);
  }

  static int integer(final String property, final String env, final int defaultValue) {
    return parsed(property, env, Integer::parseInt).orElse(defaultValue);
  }

  static Duration millis(final String property, final String env, final Duration defaultValue) {
    return parsed(property, env, Long::parseLong).map(Duration::ofMillis).orElse(defaultValue);
  }

  private static <T> Optional<T> parsed(
      final String property, final String env, final Function<String, T> parser) {
    return lookup(property, env)
        .map(
            val -> {
              try {
                return parser.apply(val);
              } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Setting " + property + " is not a number: " + val, e);
              }
            });
  }
}
