package com.sunpath.planner.solar;

import static com.sunpath.planner.geo.Angles.cosDeg;
import static com.sunpath.planner.geo.Angles.sinDeg;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.model.DaylightInfo;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.TwilightType;
import com.sunpath.planner.model.TwilightWindow;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Sunrise, sunset, solar transit and twilight finder built on {@link SolarCalculator}.
 *
 * <p>Crossings are located by bisection on solar altitude inside the half-day windows either
 * side of solar noon. Each window is assumed to contain a single monotone crossing; near polar
 * boundaries, where the Sun grazes the threshold, the result is a best-effort instant rather than
 * an error.
 */
public final class DaylightCalculator {
  /** Sunrise/sunset altitude accounting for refraction and the solar semi-diameter. */
  public static final double SUNRISE_SUNSET_ALTITUDE = -0.833;
  public static final int MAX_ITERATIONS = 20;
  public static final Duration PRECISION = Duration.ofSeconds(10);

  private static final Duration HALF_DAY = Duration.ofHours(12);

  private DaylightCalculator() {}

  /**
   * Computes sunrise, sunset, transit and civil twilight for one UTC calendar day.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees, [-180,180]
   * @param date UTC calendar day
   * @return daylight summary, with null rise/set instants under polar day or night
   */
  public static DaylightInfo daylightInfo(double lat, double lon, LocalDate date) {
    GeoPoint.of(lat, lon);
    requireDate(date);

    Instant solarNoon = solarNoon(lon, date);
    Instant solarMidnight = solarNoon.plus(HALF_DAY);

    double noonAltitude = SolarCalculator.position(lat, lon, solarNoon).altitude();
    double midnightAltitude = SolarCalculator.position(lat, lon, solarMidnight).altitude();

    boolean alwaysDay = midnightAltitude > SUNRISE_SUNSET_ALTITUDE;
    boolean alwaysNight = noonAltitude < SUNRISE_SUNSET_ALTITUDE;

    Instant sunrise = null;
    Instant sunset = null;
    Instant civilStart = null;
    Instant civilEnd = null;
    if (!alwaysDay && !alwaysNight) {
      sunrise = findCrossing(lat, lon, solarNoon.minus(HALF_DAY), solarNoon, SUNRISE_SUNSET_ALTITUDE, true);
      sunset = findCrossing(lat, lon, solarNoon, solarMidnight, SUNRISE_SUNSET_ALTITUDE, false);
      TwilightWindow civil = window(
          lat, lon, solarNoon, noonAltitude, midnightAltitude, TwilightType.CIVIL);
      civilStart = civil.start();
      civilEnd = civil.end();
    }

    double dayLength;
    if (alwaysDay) {
      dayLength = 24.0;
    } else if (alwaysNight) {
      dayLength = 0.0;
    } else {
      dayLength = Duration.between(sunrise, sunset).toMillis() / 3_600_000.0;
    }

    return new DaylightInfo(
        sunrise,
        sunset,
        solarNoon,
        solarMidnight,
        civilStart,
        civilEnd,
        dayLength,
        24.0 - dayLength,
        alwaysDay,
        alwaysNight);
  }

  /**
   * Computes dawn and dusk bounds for a twilight kind.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees, [-180,180]
   * @param date UTC calendar day
   * @param type twilight kind
   * @return twilight window; bounds are null when the Sun does not cross the threshold that day
   */
  public static TwilightWindow twilight(double lat, double lon, LocalDate date, TwilightType type) {
    GeoPoint.of(lat, lon);
    requireDate(date);
    if (type == null) {
      throw new InvalidInputException("twilight type is required");
    }

    Instant solarNoon = solarNoon(lon, date);
    double noonAltitude = SolarCalculator.position(lat, lon, solarNoon).altitude();
    double midnightAltitude =
        SolarCalculator.position(lat, lon, solarNoon.plus(HALF_DAY)).altitude();
    return window(lat, lon, solarNoon, noonAltitude, midnightAltitude, type);
  }

  /**
   * Approximates solar noon from longitude and the equation of time.
   *
   * @param lon longitude in degrees
   * @param date UTC calendar day
   * @return solar noon truncated to the minute
   */
  public static Instant solarNoon(double lon, LocalDate date) {
    requireDate(date);
    Instant startOfDay = date.atStartOfDay(ZoneOffset.UTC).toInstant();
    double t = SolarCalculator.julianCentury(SolarCalculator.julianDay(startOfDay));

    double hours = 12.0 - lon / 15.0 + equationOfTime(t) / 60.0;
    long minutes = (long) Math.floor(hours * 60.0);
    return startOfDay.plus(Duration.ofMinutes(minutes));
  }

  /**
   * Solar midnight following {@link #solarNoon(double, LocalDate)}.
   *
   * @param lon longitude in degrees
   * @param date UTC calendar day
   * @return instant twelve hours after solar noon
   */
  public static Instant solarMidnight(double lon, LocalDate date) {
    return solarNoon(lon, date).plus(HALF_DAY);
  }

  /**
   * Equation of time from the Sun's mean anomaly.
   *
   * @param t Julian century
   * @return apparent minus mean solar time, in minutes
   */
  public static double equationOfTime(double t) {
    double m = SolarCalculator.meanAnomaly(t);
    return 229.18 * (0.000075
        + 0.001868 * cosDeg(m)
        - 0.032077 * sinDeg(m)
        - 0.014615 * cosDeg(2 * m)
        - 0.040849 * sinDeg(2 * m));
  }

  /**
   * Bisects a window for the instant the solar altitude crosses a threshold.
   *
   * <p>Stops after {@link #MAX_ITERATIONS} halvings or once the window is narrower than
   * {@link #PRECISION}; returns the upper bound of the final window.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees
   * @param low window start
   * @param high window end
   * @param targetAltitude threshold in degrees
   * @param rising {@code true} when altitude increases through the window
   * @return best estimate of the crossing instant
   */
  public static Instant findCrossing(
      double lat, double lon, Instant low, Instant high, double targetAltitude, boolean rising) {
    long lowMs = low.toEpochMilli();
    long highMs = high.toEpochMilli();
    long precisionMs = PRECISION.toMillis();

    for (int i = 0; i < MAX_ITERATIONS && highMs - lowMs >= precisionMs; i++) {
      long midMs = lowMs + (highMs - lowMs) / 2;
      double altitude = SolarCalculator.position(lat, lon, Instant.ofEpochMilli(midMs)).altitude();
      boolean beforeCrossing = rising ? altitude < targetAltitude : altitude > targetAltitude;
      if (beforeCrossing) {
        lowMs = midMs;
      } else {
        highMs = midMs;
      }
    }
    return Instant.ofEpochMilli(highMs);
  }

  private static TwilightWindow window(
      double lat,
      double lon,
      Instant solarNoon,
      double noonAltitude,
      double midnightAltitude,
      TwilightType type) {
    double threshold = type.altitude();
    if (noonAltitude < threshold || midnightAltitude > threshold) {
      return new TwilightWindow(type, null, null);
    }
    Instant start = findCrossing(lat, lon, solarNoon.minus(HALF_DAY), solarNoon, threshold, true);
    Instant end = findCrossing(lat, lon, solarNoon, solarNoon.plus(HALF_DAY), threshold, false);
    return new TwilightWindow(type, start, end);
  }

  private static void requireDate(LocalDate date) {
    if (date == null) {
      throw new InvalidInputException("date is required");
    }
  }
}
