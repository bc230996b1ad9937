package com.aireciudadano.acquisition.prometheus;

import com.aireciudadano.acquisition.error.InvalidRequestException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for the duration tokens and time values exchanged with the backend.
 */
public final class StepTokens {
  private static final Pattern STEP_PATTERN = Pattern.compile("^(\\d+)([smhdwy])$");
  private static final Map<String, String> UNIT_NAMES = Map.of(
      "seconds", "s",
      "minutes", "m",
      "hours", "h",
      "days", "d",
      "weeks", "w",
      "years", "y");
  private static final long[] UNIT_SECONDS = {365L * 86400L, 7L * 86400L, 86400L, 3600L, 60L, 1L};
  private static final String[] UNIT_SUFFIXES = {"y", "w", "d", "h", "m", "s"};

  private StepTokens() {}

  /**
   * Parses a step token such as {@code 30s}, {@code 1m}, {@code 6h}, {@code 1d} or {@code 2w}.
   *
   * @param raw raw token
   * @return positive duration
   */
  public static Duration parseStep(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidRequestException("step must not be empty");
    }

    Matcher matcher = STEP_PATTERN.matcher(raw.trim().toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new InvalidRequestException("step must use format like 30s,1m,6h,1d,2w");
    }

    Duration parsed;
    try {
      long amount = Long.parseLong(matcher.group(1));
      parsed = switch (matcher.group(2)) {
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        case "h" -> Duration.ofHours(amount);
        case "d" -> Duration.ofDays(amount);
        case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
        case "y" -> Duration.ofDays(Math.multiplyExact(amount, 365L));
        default -> throw new InvalidRequestException("unsupported step unit");
      };
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new InvalidRequestException("step is too large: " + raw);
    }

    if (parsed.isZero()) {
      throw new InvalidRequestException("step must be > 0");
    }
    return parsed;
  }

  /**
   * Builds a token from a number and a unit name as submitted by forms ({@code minutes},
   * {@code hours}, {@code days}, {@code weeks}, {@code years}).
   *
   * @param number positive amount
   * @param unitName long unit name
   * @return step token, for example {@code 2h}
   */
  public static String stepToken(long number, String unitName) {
    if (number <= 0) {
      throw new InvalidRequestException("step number must be > 0");
    }
    String suffix = unitName == null ? null : UNIT_NAMES.get(unitName.trim().toLowerCase(Locale.ROOT));
    if (suffix == null) {
      throw new InvalidRequestException("step unit must be one of: " + String.join(",", UNIT_NAMES.keySet()));
    }
    return number + suffix;
  }

  /**
   * Formats a duration as the largest exact unit token ({@code PT1H} becomes {@code 1h}, {@code
   * PT90S} stays {@code 90s}).
   *
   * @param step positive duration, whole seconds
   * @return step token
   */
  public static String formatStep(Duration step) {
    if (step == null || step.isNegative() || step.isZero()) {
      throw new InvalidRequestException("step must be > 0");
    }
    if (step.getNano() != 0) {
      throw new InvalidRequestException("step must be a whole number of seconds");
    }
    long seconds = step.getSeconds();
    for (int i = 0; i < UNIT_SECONDS.length; i++) {
      if (seconds % UNIT_SECONDS[i] == 0) {
        return (seconds / UNIT_SECONDS[i]) + UNIT_SUFFIXES[i];
      }
    }
    return seconds + "s";
  }

  /**
   * Parses a point in time from epoch seconds, epoch millis or ISO-8601 with offset.
   *
   * @param raw raw value
   * @return UTC instant
   */
  public static Instant parseInstant(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidRequestException("time must not be empty");
    }

    String value = raw.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      try {
        long epoch = Long.parseLong(value);
        return epoch > 10_000_000_000L ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
      } catch (NumberFormatException ex) {
        throw new InvalidRequestException("time is out of range: " + raw);
      }
    }

    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      throw new InvalidRequestException("time must be epoch seconds/ms or ISO8601 with offset: " + raw);
    }
  }

  /**
   * Splits a comma-separated station pattern list, dropping blanks.
   *
   * @param raw raw list, may be null
   * @return trimmed patterns
   */
  public static List<String> parsePatterns(String raw) {
    List<String> patterns = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return patterns;
    }
    for (String chunk : raw.split(",")) {
      String trimmed = chunk.trim();
      if (!trimmed.isEmpty()) {
        patterns.add(trimmed);
      }
    }
    return patterns;
  }
}
