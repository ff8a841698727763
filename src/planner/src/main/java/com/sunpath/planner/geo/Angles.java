package com.sunpath.planner.geo;

/**
 * Degree-based trigonometry and angle normalization helpers.
 */
public final class Angles {
  private Angles() {}

  public static double sinDeg(double degrees) {
    return Math.sin(Math.toRadians(degrees));
  }

  public static double cosDeg(double degrees) {
    return Math.cos(Math.toRadians(degrees));
  }

  public static double tanDeg(double degrees) {
    return Math.tan(Math.toRadians(degrees));
  }

  /**
   * Reduces an angle into [0,360).
   *
   * @param degrees any finite angle
   * @return equivalent angle in [0,360)
   */
  public static double normalize360(double degrees) {
    double reduced = degrees % 360.0;
    if (reduced < 0) {
      reduced += 360.0;
    }
    // -1e-15 % 360 + 360 rounds to exactly 360
    return reduced >= 360.0 ? 0.0 : reduced;
  }

  /**
   * Reduces an angle into (-180,180].
   *
   * @param degrees any finite angle
   * @return equivalent signed angle
   */
  public static double normalize180(double degrees) {
    double reduced = normalize360(degrees);
    return reduced > 180.0 ? reduced - 360.0 : reduced;
  }

  /**
   * Clamps a value into [-1,1] before an inverse trig call.
   *
   * @param value ratio possibly off by floating round-off
   * @return clamped ratio
   */
  public static double clampUnit(double value) {
    return Math.max(-1.0, Math.min(1.0, value));
  }
}
