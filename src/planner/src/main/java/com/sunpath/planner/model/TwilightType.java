package com.sunpath.planner.model;

/** Twilight definitions keyed by the solar altitude that bounds them. */
public enum TwilightType {
  CIVIL(-6.0),
  NAUTICAL(-12.0),
  ASTRONOMICAL(-18.0);

  private final double altitude;

  TwilightType(double altitude) {
    this.altitude = altitude;
  }

  /**
   * Returns the solar altitude marking the start of dawn and the end of dusk.
   *
   * @return threshold altitude in degrees
   */
  public double altitude() {
    return altitude;
  }
}
