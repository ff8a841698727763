package com.sunpath.planner.solar;

import static com.sunpath.planner.geo.Angles.clampUnit;
import static com.sunpath.planner.geo.Angles.cosDeg;
import static com.sunpath.planner.geo.Angles.normalize360;
import static com.sunpath.planner.geo.Angles.sinDeg;
import static com.sunpath.planner.geo.Angles.tanDeg;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.model.EquatorialCoordinates;
import com.sunpath.planner.model.SolarPosition;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Low-precision solar ephemeris (Meeus, Astronomical Algorithms, ch. 7 and 25).
 *
 * <p>All methods are pure functions of their arguments. Accuracy is around 0.01 degree in
 * declination, which is plenty for cabin-side and sunrise estimates. The Earth-Sun distance is
 * not modeled and is reported as 1 AU.
 */
public final class SolarCalculator {
  /** Julian Day of the J2000.0 epoch (2000-01-01T12:00Z). */
  public static final double J2000 = 2451545.0;
  public static final double DAYS_PER_CENTURY = 36525.0;
  public static final double MEAN_DISTANCE_AU = 1.0;

  private SolarCalculator() {}

  /**
   * Converts an instant to a Julian Day using the Gregorian calendar algorithm.
   *
   * @param instant UTC instant
   * @return Julian Day, with the time of day folded in relative to the noon epoch
   */
  public static double julianDay(Instant instant) {
    ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
    int year = utc.getYear();
    int month = utc.getMonthValue();
    int day = utc.getDayOfMonth();

    int a = (14 - month) / 12;
    long y = year + 4800L - a;
    long m = month + 12L * a - 3;

    long jdn = day
        + (153 * m + 2) / 5
        + 365 * y
        + Math.floorDiv(y, 4)
        - Math.floorDiv(y, 100)
        + Math.floorDiv(y, 400)
        - 32045;

    double seconds = utc.getSecond() + utc.getNano() / 1_000_000_000.0;
    double fraction = (utc.getHour() - 12) / 24.0 + utc.getMinute() / 1440.0 + seconds / 86400.0;
    return jdn + fraction;
  }

  /**
   * Julian centuries elapsed since J2000.0.
   *
   * @param julianDay Julian Day
   * @return time in Julian centuries
   */
  public static double julianCentury(double julianDay) {
    return (julianDay - J2000) / DAYS_PER_CENTURY;
  }

  /**
   * Mean anomaly of the Sun.
   *
   * @param t Julian century
   * @return mean anomaly in degrees
   */
  public static double meanAnomaly(double t) {
    return (357.52911 + t * (35999.05029 - t * 0.0001537)) % 360.0;
  }

  /**
   * Computes right ascension and declination of the Sun.
   *
   * @param julianDay Julian Day
   * @return equatorial coordinates, right ascension in hours
   */
  public static EquatorialCoordinates equatorialCoordinates(double julianDay) {
    double t = julianCentury(julianDay);

    double meanLongitude = (280.46646 + t * (36000.76983 + t * 0.0003032)) % 360.0;
    double meanAnomaly = meanAnomaly(t);
    double equationOfCenter = (1.914602 - t * (0.004817 + t * 0.000014)) * sinDeg(meanAnomaly)
        + (0.019993 - t * 0.000101) * sinDeg(2 * meanAnomaly)
        + 0.000289 * sinDeg(3 * meanAnomaly);
    double trueLongitude = meanLongitude + equationOfCenter;

    double omega = 125.04 - 1934.136 * t;
    double apparentLongitude = trueLongitude - 0.00569 - 0.00478 * sinDeg(omega);

    double meanObliquity = 23.439291 - t * (0.0130042 + t * (0.00000016 - t * 0.000000504));
    double obliquity = meanObliquity + 0.00256 * cosDeg(omega);

    double rightAscensionDeg = Math.toDegrees(Math.atan2(
        cosDeg(obliquity) * sinDeg(apparentLongitude),
        cosDeg(apparentLongitude)));
    double declination = Math.toDegrees(Math.asin(
        clampUnit(sinDeg(obliquity) * sinDeg(apparentLongitude))));

    return new EquatorialCoordinates(normalize360(rightAscensionDeg) / 15.0, declination);
  }

  /**
   * Greenwich Mean Sidereal Time.
   *
   * @param julianDay Julian Day
   * @return GMST in degrees, [0,360)
   */
  public static double greenwichSiderealTime(double julianDay) {
    double t = julianCentury(julianDay);
    return normalize360(280.46061837
        + 360.98564736629 * (julianDay - J2000)
        + t * t * (0.000387933 - t / 38710000.0));
  }

  /**
   * Computes the apparent horizontal position of the Sun.
   *
   * <p>Longitude may lie outside [-180,180] (unwrapped route coordinates); it is reduced modulo
   * 360. At the geographic poles azimuth is not meaningful and an arbitrary in-range value is
   * returned, altitude stays exact.
   *
   * @param lat observer latitude in degrees, [-90,90]
   * @param lon observer longitude in degrees
   * @param instant UTC instant
   * @return solar position with refraction applied to altitude
   */
  public static SolarPosition position(double lat, double lon, Instant instant) {
    requireLatitude(lat);
    if (!Double.isFinite(lon)) {
      throw new InvalidInputException("longitude must be a finite number");
    }
    if (instant == null) {
      throw new InvalidInputException("instant is required");
    }

    double jd = julianDay(instant);
    EquatorialCoordinates equatorial = equatorialCoordinates(jd);

    double localSiderealTime = normalize360(greenwichSiderealTime(jd) + lon);
    double hourAngle = localSiderealTime - equatorial.rightAscension() * 15.0;

    double latRad = Math.toRadians(lat);
    double decRad = Math.toRadians(equatorial.declination());
    double haRad = Math.toRadians(hourAngle);

    double sinAlt = clampUnit(Math.sin(latRad) * Math.sin(decRad)
        + Math.cos(latRad) * Math.cos(decRad) * Math.cos(haRad));
    double altitude = Math.toDegrees(Math.asin(sinAlt));

    double denominator = Math.cos(latRad) * Math.cos(Math.asin(sinAlt));
    double cosAz = Math.abs(denominator) < 1e-12
        ? 1.0
        : clampUnit((Math.sin(decRad) - Math.sin(latRad) * sinAlt) / denominator);
    double azimuth = Math.toDegrees(Math.acos(cosAz));
    if (Math.sin(haRad) > 0) {
      azimuth = 360.0 - azimuth;
    }

    double refracted = Math.max(-90.0, Math.min(90.0, altitude + refractionCorrection(altitude)));

    return new SolarPosition(
        normalize360(azimuth),
        refracted,
        90.0 - refracted,
        MEAN_DISTANCE_AU,
        equatorial.rightAscension(),
        equatorial.declination());
  }

  /**
   * Atmospheric refraction to add to a geometric altitude.
   *
   * @param altitude geometric altitude in degrees
   * @return correction in degrees
   */
  public static double refractionCorrection(double altitude) {
    if (altitude > 85.0) {
      return 0.0;
    }
    if (altitude > 5.0) {
      double tanAlt = tanDeg(altitude);
      return (58.1 / tanAlt
          - 0.07 / Math.pow(tanAlt, 3)
          + 0.000086 / Math.pow(tanAlt, 5)) / 3600.0;
    }
    if (altitude > -0.575) {
      return (1735.0
          + altitude * (-518.2 + altitude * (103.4 + altitude * (-12.79 + altitude * 0.711))))
          / 3600.0;
    }
    return -20.774 / tanDeg(altitude) / 3600.0;
  }

  static void requireLatitude(double lat) {
    if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
      throw new InvalidInputException("latitude must be within [-90,90]");
    }
  }
}
