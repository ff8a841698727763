package com.sunpath.planner.model;

import com.sunpath.planner.api.InvalidInputException;

/**
 * Flight profile used to build a timeline.
 *
 * @param pointCount number of route segments; the timeline has {@code pointCount + 1} points
 * @param cruiseSpeedKmh constant ground speed, [1,5000] km/h
 * @param cruiseAltitudeFt constant cruise altitude
 */
public record TimelineOptions(int pointCount, double cruiseSpeedKmh, double cruiseAltitudeFt) {
  public static final int DEFAULT_POINT_COUNT = 150;
  public static final double DEFAULT_CRUISE_SPEED_KMH = 850.0;
  public static final double DEFAULT_CRUISE_ALTITUDE_FT = 37000.0;
  /** Slowest accepted ground speed; keeps the longest route within a representable duration. */
  public static final double MIN_CRUISE_SPEED_KMH = 1.0;
  public static final double MAX_CRUISE_SPEED_KMH = 5000.0;

  public TimelineOptions {
    if (pointCount < 1) {
      throw new InvalidInputException("points must be >= 1");
    }
    if (!Double.isFinite(cruiseSpeedKmh)
        || cruiseSpeedKmh < MIN_CRUISE_SPEED_KMH
        || cruiseSpeedKmh > MAX_CRUISE_SPEED_KMH) {
      throw new InvalidInputException("speed must be within [1,5000] km/h");
    }
    if (!Double.isFinite(cruiseAltitudeFt) || cruiseAltitudeFt < 0) {
      throw new InvalidInputException("altitude must be >= 0");
    }
  }

  /**
   * Returns the airliner defaults: 150 segments at 850 km/h and FL370.
   *
   * @return default options
   */
  public static TimelineOptions defaults() {
    return new TimelineOptions(
        DEFAULT_POINT_COUNT, DEFAULT_CRUISE_SPEED_KMH, DEFAULT_CRUISE_ALTITUDE_FT);
  }
}
