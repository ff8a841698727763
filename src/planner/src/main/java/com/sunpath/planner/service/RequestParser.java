package com.sunpath.planner.service;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.TwilightType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Utility class for parsing and validating planner query parameters.
 */
public final class RequestParser {
  private RequestParser() {}

  /**
   * Parses a location formatted as {@code lat,lon}.
   *
   * @param raw raw query value
   * @param name parameter name used in error messages
   * @return validated point
   */
  public static GeoPoint parsePoint(String raw, String name) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidInputException(name + " is required");
    }
    String[] chunks = raw.split(",", -1);
    if (chunks.length != 2) {
      throw new InvalidInputException(name + " must be lat,lon");
    }
    try {
      return GeoPoint.of(Double.parseDouble(chunks[0].trim()), Double.parseDouble(chunks[1].trim()));
    } catch (NumberFormatException ex) {
      throw new InvalidInputException(name + " values must be numeric");
    }
  }

  /**
   * Parses a required finite number.
   *
   * @param raw raw query value
   * @param name parameter name used in error messages
   * @return parsed value
   */
  public static double parseNumber(String raw, String name) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidInputException(name + " is required");
    }
    try {
      double value = Double.parseDouble(raw.trim());
      if (!Double.isFinite(value)) {
        throw new InvalidInputException(name + " must be a finite number");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new InvalidInputException(name + " must be numeric");
    }
  }

  /**
   * Parses an optional finite number.
   *
   * @param raw raw query value
   * @param defaultValue fallback when absent
   * @param name parameter name used in error messages
   * @return parsed value or the default
   */
  public static double parseNumber(String raw, double defaultValue, String name) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return parseNumber(raw, name);
  }

  /**
   * Parses an optional instant from epoch seconds, epoch milliseconds or ISO-8601.
   *
   * @param raw raw query value
   * @param defaultValue fallback when absent
   * @param name parameter name used in error messages
   * @return parsed instant or the default
   */
  public static Instant parseInstant(String raw, Instant defaultValue, String name) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }

    String value = raw.trim();
    try {
      if (value.chars().allMatch(Character::isDigit)) {
        long epoch = Long.parseLong(value);
        return epoch > 10_000_000_000L ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
      }
      return OffsetDateTime.parse(value).toInstant();
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new InvalidInputException(name + " must be epoch seconds/ms or ISO8601");
    }
  }

  /**
   * Parses an optional {@code yyyy-MM-dd} calendar day.
   *
   * @param raw raw query value
   * @param defaultValue fallback when absent
   * @return parsed date or the default
   */
  public static LocalDate parseDate(String raw, LocalDate defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return LocalDate.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      throw new InvalidInputException("date must be yyyy-MM-dd");
    }
  }

  /**
   * Parses the requested number of route segments.
   *
   * @param raw raw query value
   * @param defaultValue fallback when absent
   * @return requested segment count, not yet capped
   */
  public static int parsePointCount(String raw, int defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new InvalidInputException("points must be > 0");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new InvalidInputException("points must be an integer");
    }
  }

  /**
   * Parses an optional twilight kind.
   *
   * @param raw raw query value ({@code civil|nautical|astronomical})
   * @return twilight type, civil when absent
   */
  public static TwilightType parseTwilightType(String raw) {
    if (raw == null || raw.isBlank()) {
      return TwilightType.CIVIL;
    }
    try {
      return TwilightType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidInputException("type must be one of: civil,nautical,astronomical");
    }
  }
}
