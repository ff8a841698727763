package com.sunpath.planner.exposure;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.geo.Angles;
import com.sunpath.planner.model.CabinSide;
import com.sunpath.planner.model.SunExposureSample;

/**
 * Classifies which cabin side the Sun lights for a given heading and solar position.
 *
 * <p>Branches are evaluated in order: night, twilight, overhead, ahead, behind, then right or
 * left with intensity and angle bands.
 */
public final class SunExposureClassifier {
  public static final double NIGHT_ALTITUDE = -6.0;
  public static final double SUNRISE_TWILIGHT_ALTITUDE = -3.0;
  public static final double OVERHEAD_ALTITUDE = 70.0;
  public static final double AHEAD_LOW_ALTITUDE = 15.0;
  public static final double GOLDEN_HOUR_ALTITUDE = 20.0;
  public static final double AHEAD_CONE = 30.0;
  public static final double BEHIND_CONE = 150.0;
  public static final double INTENSE_THRESHOLD = 0.7;
  public static final double INTENSE_BROADSIDE_CONE = 30.0;
  public static final double GOOD_LIGHT_THRESHOLD = 0.5;

  private SunExposureClassifier() {}

  /**
   * Classifies cabin sun exposure at one instant.
   *
   * @param heading aircraft heading in degrees
   * @param sunAzimuth solar azimuth in degrees
   * @param sunAltitude solar altitude in degrees
   * @return exposure sample with side, relative bearing, intensity and advice
   */
  public static SunExposureSample classify(double heading, double sunAzimuth, double sunAltitude) {
    if (!Double.isFinite(heading) || !Double.isFinite(sunAzimuth)) {
      throw new InvalidInputException("heading and azimuth must be finite numbers");
    }
    if (!Double.isFinite(sunAltitude) || sunAltitude < -90.0 || sunAltitude > 90.0) {
      throw new InvalidInputException("sun altitude must be within [-90,90]");
    }

    double relativeBearing = relativeBearing(heading, sunAzimuth);
    double intensity = intensity(relativeBearing, sunAltitude);
    double absBearing = Math.abs(relativeBearing);

    CabinSide side;
    String recommendation;
    if (sunAltitude < NIGHT_ALTITUDE) {
      side = CabinSide.NONE;
      recommendation = ExposureAdvice.NIGHT.render();
    } else if (sunAltitude < 0) {
      side = CabinSide.NONE;
      ExposureAdvice advice = sunAltitude > SUNRISE_TWILIGHT_ALTITUDE
          ? ExposureAdvice.TWILIGHT_SUNRISE
          : ExposureAdvice.TWILIGHT_SUNSET;
      recommendation = advice.render(relativeBearing > 0 ? CabinSide.RIGHT : CabinSide.LEFT);
    } else if (sunAltitude > OVERHEAD_ALTITUDE) {
      side = CabinSide.OVERHEAD;
      recommendation = ExposureAdvice.OVERHEAD.render();
    } else if (absBearing <= AHEAD_CONE) {
      side = CabinSide.NONE;
      recommendation = sunAltitude < AHEAD_LOW_ALTITUDE
          ? ExposureAdvice.AHEAD_LOW.render()
          : ExposureAdvice.AHEAD.render();
    } else if (absBearing >= BEHIND_CONE) {
      side = CabinSide.NONE;
      recommendation = ExposureAdvice.BEHIND.render();
    } else {
      side = relativeBearing > 0 ? CabinSide.RIGHT : CabinSide.LEFT;
      recommendation = sideAdvice(absBearing, sunAltitude, intensity).render(side);
    }

    return new SunExposureSample(side, relativeBearing, absBearing, intensity, recommendation);
  }

  /**
   * Sun bearing relative to the aircraft nose.
   *
   * @param heading aircraft heading in degrees
   * @param sunAzimuth solar azimuth in degrees
   * @return bearing in (-180,180], 0 = ahead, 90 = right wing, -90 = left wing
   */
  public static double relativeBearing(double heading, double sunAzimuth) {
    return Angles.normalize180(sunAzimuth - heading);
  }

  /**
   * Broadside intensity: strongest with the Sun high and exactly off a wing.
   *
   * @param relativeBearing relative bearing in degrees
   * @param sunAltitude solar altitude in degrees
   * @return intensity in [0,1], zero with the Sun at or below the horizon
   */
  public static double intensity(double relativeBearing, double sunAltitude) {
    if (sunAltitude <= 0) {
      return 0.0;
    }
    double directness = Math.abs(Math.abs(relativeBearing) - 90.0) / 90.0;
    return (1.0 - directness) * Angles.sinDeg(sunAltitude);
  }

  private static ExposureAdvice sideAdvice(double absBearing, double sunAltitude, double intensity) {
    double offBroadside = Math.abs(absBearing - 90.0);
    if (intensity > INTENSE_THRESHOLD && offBroadside < INTENSE_BROADSIDE_CONE) {
      return ExposureAdvice.INTENSE;
    }
    if (sunAltitude < GOLDEN_HOUR_ALTITUDE) {
      return ExposureAdvice.GOLDEN_HOUR;
    }
    if (intensity > GOOD_LIGHT_THRESHOLD) {
      return ExposureAdvice.GOOD_LIGHT;
    }
    return ExposureAdvice.GENTLE;
  }
}
