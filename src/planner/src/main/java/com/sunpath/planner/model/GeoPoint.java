package com.sunpath.planner.model;

import com.sunpath.planner.api.InvalidInputException;

/**
 * Surface location in decimal degrees.
 *
 * <p>Latitude is always within [-90,90]. Longitude is only required to be finite so that
 * unwrapped route longitudes (outside [-180,180] after an antimeridian crossing) can be carried;
 * use {@link #of(double, double)} for canonical user-supplied coordinates.
 *
 * @param lat latitude in degrees
 * @param lon longitude in degrees
 */
public record GeoPoint(double lat, double lon) {
  public GeoPoint {
    if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
      throw new InvalidInputException("latitude must be within [-90,90]");
    }
    if (!Double.isFinite(lon)) {
      throw new InvalidInputException("longitude must be a finite number");
    }
  }

  /**
   * Creates a canonical point, rejecting longitudes outside [-180,180].
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees
   * @return validated point
   */
  public static GeoPoint of(double lat, double lon) {
    if (Double.isFinite(lon) && (lon < -180.0 || lon > 180.0)) {
      throw new InvalidInputException("longitude must be within [-180,180]");
    }
    return new GeoPoint(lat, lon);
  }
}
